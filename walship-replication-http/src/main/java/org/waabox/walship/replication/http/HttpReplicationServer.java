package org.waabox.walship.replication.http;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.walship.StatusRegistry;
import org.waabox.walship.replication.ReplicationServer;
import org.waabox.walship.replication.StreamRequest;
import org.waabox.walship.replication.StreamRequestCodec;

/**
 * Exposes a {@link ReplicationServer} over HTTP.
 *
 * <p>Uses Java's built-in {@code com.sun.net.httpserver.HttpServer} with
 * the following endpoints under the configured base path:
 * <ul>
 *   <li>{@code POST {path}/stream}: JSON {@link StreamRequest} body, the
 *       response body is the replication stream;</li>
 *   <li>{@code GET {path}/snapshot?database=name}: a snapshot record;</li>
 *   <li>{@code GET {path}/status}: the {@link StatusRegistry} as JSON.</li>
 * </ul>
 *
 * <p>Every exchange runs on a thread of its own, since stream exchanges
 * last as long as the replica stays connected.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class HttpReplicationServer {

  private static final Logger log =
      LoggerFactory.getLogger(HttpReplicationServer.class);

  /** HTTP 200 OK status code. */
  private static final int HTTP_OK = 200;

  /** HTTP 400 Bad Request status code. */
  private static final int HTTP_BAD_REQUEST = 400;

  /** HTTP 405 Method Not Allowed status code. */
  private static final int HTTP_METHOD_NOT_ALLOWED = 405;

  /** HTTP 500 Internal Server Error status code. */
  private static final int HTTP_INTERNAL_ERROR = 500;

  /** The configuration. */
  private final HttpReplicationConfig config;

  /** The replication server to expose. */
  private final ReplicationServer replication;

  /** The status to publish. */
  private final StatusRegistry status;

  /** The HTTP server, null until started. */
  private HttpServer server;

  /** Runs the exchanges, null until started. */
  private ExecutorService executor;

  /**
   * Creates a new HTTP server.
   *
   * @param theConfig      the configuration, never null
   * @param theReplication the replication server, never null
   * @param theStatus      the status to publish, never null
   */
  public HttpReplicationServer(final HttpReplicationConfig theConfig,
      final ReplicationServer theReplication, final StatusRegistry theStatus) {
    config = Objects.requireNonNull(theConfig, "config must not be null");
    replication = Objects.requireNonNull(theReplication,
        "replication must not be null");
    status = Objects.requireNonNull(theStatus, "status must not be null");
  }

  /**
   * Starts listening.
   *
   * @throws IllegalStateException if the port cannot be bound
   */
  public synchronized void start() {
    try {
      server = HttpServer.create(new InetSocketAddress(config.port()), 0);
    } catch (final IOException e) {
      throw new IllegalStateException("Failed to start HTTP server on port "
          + config.port(), e);
    }
    executor = Executors.newCachedThreadPool(r -> {
      final Thread thread = new Thread(r, "walship-http");
      thread.setDaemon(true);
      return thread;
    });
    server.setExecutor(executor);
    server.createContext(config.path() + "/stream", this::handleStream);
    server.createContext(config.path() + "/snapshot", this::handleSnapshot);
    server.createContext(config.path() + "/status", this::handleStatus);
    server.start();
    log.info("Replication HTTP server listening on port {} at {}", port(),
        config.path());
  }

  /** Stops listening and drops open exchanges. */
  public synchronized void stop() {
    if (server != null) {
      server.stop(0);
      executor.shutdownNow();
      server = null;
      log.info("Replication HTTP server stopped");
    }
  }

  /**
   * Returns the bound port, useful when configured with port 0.
   *
   * @return the port
   * @throws IllegalStateException if the server is not started
   */
  public synchronized int port() {
    if (server == null) {
      throw new IllegalStateException("Server not started");
    }
    return server.getAddress().getPort();
  }

  private void handleStream(final HttpExchange exchange) throws IOException {
    try {
      if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
        sendText(exchange, HTTP_METHOD_NOT_ALLOWED, "Method Not Allowed");
        return;
      }
      final StreamRequest request;
      try (InputStream is = exchange.getRequestBody()) {
        request = StreamRequestCodec.deserialize(
            new String(is.readAllBytes(), StandardCharsets.UTF_8));
      } catch (final IllegalArgumentException e) {
        log.warn("Rejecting malformed stream request: {}", e.getMessage());
        sendText(exchange, HTTP_BAD_REQUEST, "Bad Request");
        return;
      }
      exchange.getResponseHeaders().set("Content-Type",
          "application/octet-stream");
      exchange.sendResponseHeaders(HTTP_OK, 0);
      try (OutputStream os = exchange.getResponseBody()) {
        replication.serve(request, os);
      } catch (final IOException e) {
        log.debug("Stream to {} ended: {}", request.node(), e.getMessage());
      }
    } finally {
      exchange.close();
    }
  }

  private void handleSnapshot(final HttpExchange exchange)
      throws IOException {
    try {
      if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
        sendText(exchange, HTTP_METHOD_NOT_ALLOWED, "Method Not Allowed");
        return;
      }
      final String database = queryParameter(exchange, "database");
      if (database == null || database.isEmpty()) {
        sendText(exchange, HTTP_BAD_REQUEST, "Missing database parameter");
        return;
      }
      exchange.getResponseHeaders().set("Content-Type",
          "application/octet-stream");
      exchange.sendResponseHeaders(HTTP_OK, 0);
      try (OutputStream os = exchange.getResponseBody()) {
        replication.snapshot(database, os);
      }
    } catch (final RuntimeException e) {
      log.error("Failed to serve snapshot", e);
      throw e;
    } finally {
      exchange.close();
    }
  }

  private void handleStatus(final HttpExchange exchange) throws IOException {
    try {
      if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
        sendText(exchange, HTTP_METHOD_NOT_ALLOWED, "Method Not Allowed");
        return;
      }
      final String json;
      try {
        json = status.toJson();
      } catch (final RuntimeException e) {
        log.error("Failed to render status", e);
        sendText(exchange, HTTP_INTERNAL_ERROR, "Internal Server Error");
        return;
      }
      exchange.getResponseHeaders().set("Content-Type", "application/json");
      send(exchange, HTTP_OK, json.getBytes(StandardCharsets.UTF_8));
    } finally {
      exchange.close();
    }
  }

  private static String queryParameter(final HttpExchange exchange,
      final String name) {
    final String query = exchange.getRequestURI().getRawQuery();
    if (query == null) {
      return null;
    }
    for (final String pair : query.split("&")) {
      final int eq = pair.indexOf('=');
      final String key = eq < 0 ? pair : pair.substring(0, eq);
      if (name.equals(URLDecoder.decode(key, StandardCharsets.UTF_8))) {
        return eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1),
            StandardCharsets.UTF_8);
      }
    }
    return null;
  }

  private static void sendText(final HttpExchange exchange,
      final int statusCode, final String body) throws IOException {
    send(exchange, statusCode, body.getBytes(StandardCharsets.UTF_8));
  }

  private static void send(final HttpExchange exchange, final int statusCode,
      final byte[] bytes) throws IOException {
    exchange.sendResponseHeaders(statusCode, bytes.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(bytes);
    }
  }
}
