package org.waabox.walship.replication.http;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.walship.Node;
import org.waabox.walship.replication.ReplicationClient;
import org.waabox.walship.replication.StreamRequest;
import org.waabox.walship.replication.StreamRequestCodec;

/**
 * A {@link ReplicationClient} reaching the primary's
 * {@link HttpReplicationServer} through {@code java.net.http.HttpClient}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class HttpReplicationClient implements ReplicationClient {

  private static final Logger log =
      LoggerFactory.getLogger(HttpReplicationClient.class);

  /** HTTP 200 OK status code. */
  private static final int HTTP_OK = 200;

  /** The configuration. */
  private final HttpReplicationConfig config;

  /** The HTTP client. */
  private final HttpClient client;

  /**
   * Creates a new client.
   *
   * @param theConfig the configuration, never null
   */
  public HttpReplicationClient(final HttpReplicationConfig theConfig) {
    config = Objects.requireNonNull(theConfig, "config must not be null");
    client = HttpClient.newBuilder()
        .connectTimeout(config.connectTimeout())
        .build();
  }

  @Override
  public InputStream stream(final Node primary, final StreamRequest request)
      throws IOException {
    Objects.requireNonNull(primary, "primary must not be null");
    Objects.requireNonNull(request, "request must not be null");
    final HttpRequest httpRequest = HttpRequest.newBuilder()
        .uri(endpoint(primary, "/stream"))
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(
            StreamRequestCodec.serialize(request)))
        .build();
    return send(httpRequest);
  }

  @Override
  public InputStream snapshot(final Node primary, final String database)
      throws IOException {
    Objects.requireNonNull(primary, "primary must not be null");
    Objects.requireNonNull(database, "database must not be null");
    final HttpRequest httpRequest = HttpRequest.newBuilder()
        .uri(endpoint(primary, "/snapshot?database="
            + URLEncoder.encode(database, StandardCharsets.UTF_8)))
        .GET()
        .build();
    return send(httpRequest);
  }

  private URI endpoint(final Node primary, final String suffix) {
    String base = primary.advertiseUrl();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return URI.create(base + config.path() + suffix);
  }

  private InputStream send(final HttpRequest request) throws IOException {
    final HttpResponse<InputStream> response;
    try {
      response = client.send(request,
          HttpResponse.BodyHandlers.ofInputStream());
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("Interrupted calling "
          + request.uri());
    }
    if (response.statusCode() != HTTP_OK) {
      response.body().close();
      throw new IOException(request.uri() + " responded with status "
          + response.statusCode());
    }
    log.debug("Connected to {}", request.uri());
    return response.body();
  }
}
