package org.waabox.walship.replication.http;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration of the HTTP replication transport.
 *
 * <p>Holds the port to listen on, the base path of the replication
 * endpoints and the timeout used when connecting to a primary.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class HttpReplicationConfig {

  /** The default base path of the endpoints. */
  private static final String DEFAULT_PATH = "/walship";

  /** The default connect timeout. */
  private static final Duration DEFAULT_CONNECT_TIMEOUT =
      Duration.ofSeconds(5);

  /** The port to listen on, 0 for an ephemeral port. */
  private final int port;

  /** The base path of the endpoints. */
  private final String path;

  /** The connect timeout of the client. */
  private final Duration connectTimeout;

  private HttpReplicationConfig(final int thePort, final String thePath,
      final Duration theConnectTimeout) {
    port = thePort;
    path = thePath;
    connectTimeout = theConnectTimeout;
  }

  /**
   * Creates a configuration with the default path ({@value #DEFAULT_PATH})
   * and connect timeout.
   *
   * @param port the port to listen on, 0 for an ephemeral port
   * @return the configuration, never null
   */
  public static HttpReplicationConfig create(final int port) {
    return create(port, DEFAULT_PATH, DEFAULT_CONNECT_TIMEOUT);
  }

  /**
   * Creates a configuration.
   *
   * @param port           the port to listen on, 0 for an ephemeral port
   * @param path           the base path, must start with a slash
   * @param connectTimeout the client connect timeout, never null
   *
   * @return the configuration, never null
   */
  public static HttpReplicationConfig create(final int port,
      final String path, final Duration connectTimeout) {
    Objects.requireNonNull(path, "path must not be null");
    Objects.requireNonNull(connectTimeout, "connectTimeout must not be null");
    if (port < 0 || port > 65535) {
      throw new IllegalArgumentException("Invalid port: " + port);
    }
    if (!path.startsWith("/")) {
      throw new IllegalArgumentException("path must start with '/', got: "
          + path);
    }
    final String normalized = path.length() > 1 && path.endsWith("/")
        ? path.substring(0, path.length() - 1) : path;
    return new HttpReplicationConfig(port, normalized, connectTimeout);
  }

  /**
   * Returns the port to listen on.
   *
   * @return the port
   */
  public int port() {
    return port;
  }

  /**
   * Returns the base path of the endpoints, without trailing slash.
   *
   * @return the path, never null
   */
  public String path() {
    return path;
  }

  /**
   * Returns the connect timeout of the client.
   *
   * @return the timeout, never null
   */
  public Duration connectTimeout() {
    return connectTimeout;
  }
}
