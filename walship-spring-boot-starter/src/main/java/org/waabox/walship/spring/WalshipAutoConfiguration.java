package org.waabox.walship.spring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.waabox.walship.Invalidator;
import org.waabox.walship.Node;
import org.waabox.walship.RetryPolicy;
import org.waabox.walship.StatusRegistry;
import org.waabox.walship.Store;
import org.waabox.walship.leader.k8s.K8sLeaseConfig;
import org.waabox.walship.leader.k8s.K8sLeaser;
import org.waabox.walship.lease.Leaser;
import org.waabox.walship.lease.StaticLeaser;
import org.waabox.walship.metrics.WalshipMetrics;
import org.waabox.walship.replication.ReplicationClient;
import org.waabox.walship.replication.SnapshotHandler;
import org.waabox.walship.replication.http.HttpReplicationClient;
import org.waabox.walship.replication.http.HttpReplicationConfig;
import org.waabox.walship.replication.http.HttpReplicationServer;
import org.waabox.walship.retention.RetentionPolicy;
import org.waabox.walship.storage.FrameStore;
import org.waabox.walship.store.fs.FileSystemFrameStore;

/**
 * Spring Boot auto-configuration for a walship node.
 *
 * <p>This configuration validates {@link WalshipProperties} and creates
 * the singleton {@link Store}, wiring the leaser selected by the
 * configured lease mode, the file system frame store under the data
 * directory and the HTTP replication transport. Optional
 * {@link Invalidator}, {@link SnapshotHandler}, {@link WalshipMetrics} and
 * {@link RetryPolicy} beans found in the application context are handed
 * to the store.
 *
 * <p>The store and the replication endpoints are started and stopped
 * through a {@link SmartLifecycle}: the endpoints come up before the store
 * opens and go down after it closed.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@AutoConfiguration
@EnableConfigurationProperties(WalshipProperties.class)
public class WalshipAutoConfiguration {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      WalshipAutoConfiguration.class);

  /** The name the store status is published under. */
  static final String STATUS_NAME = "store";

  /**
   * Creates the local node from the validated properties.
   *
   * @param properties the configuration properties, never null
   *
   * @return the local node, never null
   *
   * @throws org.waabox.walship.ConfigurationException if the properties
   *     are invalid
   */
  @Bean
  @ConditionalOnMissingBean
  public Node walshipNode(final WalshipProperties properties) {
    properties.validate();
    final String hostname = properties.resolveHostname();
    final Node node = new Node(hostname,
        properties.resolveAdvertiseUrl(hostname), properties.isCandidate());
    log.info("walship node '{}' advertising {} (data-dir={}, mount-dir={})",
        node.hostname(), node.advertiseUrl(), properties.getDataDir(),
        properties.getMountDir());
    return node;
  }

  /**
   * Creates the leaser of the configured lease mode.
   *
   * @param properties the configuration properties, never null
   * @param node       the local node, never null
   *
   * @return a {@link StaticLeaser} or a {@link K8sLeaser}, never null
   */
  @Bean
  @ConditionalOnMissingBean
  public Leaser walshipLeaser(final WalshipProperties properties,
      final Node node) {
    final WalshipProperties.K8s k8s = properties.getK8s();
    if (k8s.isConfigured()) {
      log.info("walship using Kubernetes lease '{}'", k8s.getLeaseName());
      return new K8sLeaser(K8sLeaseConfig.create(k8s.getLeaseName(),
          k8s.getNamespace(), node.hostname(), node.advertiseUrl(),
          k8s.getTtl(), k8s.getLockDelay()));
    }
    final WalshipProperties.Static config = properties.getStatic();
    if (config.isLocalPrimary()) {
      log.info("walship using static lease, this node is the primary");
      return new StaticLeaser(true, node.hostname(), node.advertiseUrl());
    }
    log.info("walship using static lease, primary is '{}'",
        config.getHostname());
    return new StaticLeaser(false, config.getHostname(),
        config.getAdvertiseUrl());
  }

  /**
   * Creates the durable frame log under the data directory.
   *
   * @param properties the configuration properties, never null
   *
   * @return the frame store, never null
   */
  @Bean
  @ConditionalOnMissingBean
  public FrameStore walshipFrameStore(final WalshipProperties properties) {
    return new FileSystemFrameStore(properties.getDataDir());
  }

  /**
   * Creates the replication endpoint configuration.
   *
   * @param properties the configuration properties, never null
   *
   * @return the configuration, never null
   */
  @Bean
  @ConditionalOnMissingBean
  public HttpReplicationConfig walshipHttpConfig(
      final WalshipProperties properties) {
    return HttpReplicationConfig.create(properties.getHttp().getPort());
  }

  /**
   * Creates the client replicas use to reach the primary.
   *
   * @param config the replication endpoint configuration, never null
   *
   * @return the client, never null
   */
  @Bean
  @ConditionalOnMissingBean
  public ReplicationClient walshipReplicationClient(
      final HttpReplicationConfig config) {
    return new HttpReplicationClient(config);
  }

  /**
   * Creates the registry the status endpoint renders.
   *
   * @return an empty registry, never null
   */
  @Bean
  @ConditionalOnMissingBean
  public StatusRegistry walshipStatusRegistry() {
    return new StatusRegistry();
  }

  /**
   * Creates the singleton {@link Store} bean.
   *
   * @param properties            the configuration properties, never null
   * @param node                  the local node, never null
   * @param leaser                the leaser, never null
   * @param client                the replication client, never null
   * @param frameStore            the frame store, never null
   * @param invalidatorProvider   provider for an optional Invalidator bean
   * @param snapshotProvider      provider for an optional SnapshotHandler
   *                              bean
   * @param metricsProvider       provider for an optional WalshipMetrics
   *                              bean
   * @param retryPolicyProvider   provider for an optional RetryPolicy bean
   *
   * @return the configured store, not opened yet, never null
   */
  @Bean
  public Store walshipStore(
      final WalshipProperties properties,
      final Node node,
      final Leaser leaser,
      final ReplicationClient client,
      final FrameStore frameStore,
      final ObjectProvider<Invalidator> invalidatorProvider,
      final ObjectProvider<SnapshotHandler> snapshotProvider,
      final ObjectProvider<WalshipMetrics> metricsProvider,
      final ObjectProvider<RetryPolicy> retryPolicyProvider) {

    final WalshipProperties.Retention retention = properties.getRetention();
    final Store.Builder builder = Store.builder()
        .node(node)
        .leaser(leaser)
        .client(client)
        .frameStore(frameStore)
        .retentionPolicy(RetentionPolicy.create(retention.getDuration(),
            retention.getMaxFrames(), retention.getMonitorInterval()));

    if (properties.getK8s().isConfigured()
        && properties.getK8s().getRenewInterval() != null) {
      builder.renewInterval(properties.getK8s().getRenewInterval());
    }

    invalidatorProvider.ifAvailable(invalidator -> {
      builder.invalidator(invalidator);
      log.info("walship using Invalidator: {}",
          invalidator.getClass().getSimpleName());
    });

    snapshotProvider.ifAvailable(handler -> {
      builder.snapshotHandler(handler);
      log.info("walship using SnapshotHandler: {}",
          handler.getClass().getSimpleName());
    });

    metricsProvider.ifAvailable(metrics -> {
      builder.metrics(metrics);
      log.info("walship using WalshipMetrics: {}",
          metrics.getClass().getSimpleName());
    });

    retryPolicyProvider.ifAvailable(policy -> {
      builder.retryPolicy(policy);
      log.info("walship using custom RetryPolicy");
    });

    return builder.build();
  }

  /**
   * Creates the HTTP endpoints serving the store's replication streams,
   * snapshots and status.
   *
   * @param config the replication endpoint configuration, never null
   * @param store  the store, never null
   * @param status the status registry, never null
   *
   * @return the server, not started yet, never null
   */
  @Bean
  public HttpReplicationServer walshipHttpServer(
      final HttpReplicationConfig config, final Store store,
      final StatusRegistry status) {
    return new HttpReplicationServer(config, store.replicationServer(),
        status);
  }

  /**
   * Creates a {@link SmartLifecycle} bean that manages the store and the
   * replication endpoints.
   *
   * <p>The lifecycle starts late (phase {@code Integer.MAX_VALUE - 1})
   * to ensure all other beans are initialized first, and stops early
   * for the same reason.
   *
   * @param store  the store to manage, never null
   * @param server the replication endpoints, never null
   * @param status the status registry, never null
   *
   * @return the lifecycle bean, never null
   */
  @Bean
  public SmartLifecycle walshipLifecycle(final Store store,
      final HttpReplicationServer server, final StatusRegistry status) {
    return new SmartLifecycle() {

      /** Whether the lifecycle is currently running. */
      private volatile boolean running = false;

      @Override
      public void start() {
        log.info("Starting walship lifecycle...");
        if (!status.isRegistered(STATUS_NAME)) {
          status.register(STATUS_NAME, store::status);
        }
        server.start();
        store.open();
        running = true;
        log.info("walship lifecycle started successfully.");
      }

      @Override
      public void stop() {
        log.info("Stopping walship lifecycle...");
        try {
          store.close();
        } finally {
          server.stop();
          running = false;
        }
        log.info("walship lifecycle stopped.");
      }

      @Override
      public boolean isRunning() {
        return running;
      }

      @Override
      public int getPhase() {
        return Integer.MAX_VALUE - 1;
      }
    };
  }
}
