package org.waabox.walship.spring;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Duration;

import org.junit.jupiter.api.Test;
import org.waabox.walship.ConfigurationException;
import org.waabox.walship.Node;
import org.waabox.walship.leader.k8s.K8sLeaser;

/**
 * Tests for {@link WalshipProperties}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class WalshipPropertiesTest {

  private WalshipProperties k8s() {
    final WalshipProperties properties = new WalshipProperties();
    properties.setDataDir(Path.of("/var/lib/walship"));
    properties.setMountDir(Path.of("/mnt/walship"));
    properties.getK8s().setLeaseName("walship-primary");
    properties.getK8s().setHostname("pod-a");
    return properties;
  }

  @Test
  void whenValidating_givenKubernetesDefaults_shouldAccept() {
    assertDoesNotThrow(k8s()::validate);
  }

  @Test
  void whenValidating_givenRenewIntervalNotBelowTtl_shouldReject() {
    final WalshipProperties properties = k8s();
    properties.getK8s().setRenewInterval(Duration.ofSeconds(10));

    final ConfigurationException error = assertThrows(
        ConfigurationException.class, properties::validate);
    assertTrue(error.getMessage().contains("renew-interval"));
  }

  @Test
  void whenValidating_givenMissingMountDir_shouldReject() {
    final WalshipProperties properties = k8s();
    properties.setMountDir(null);

    assertThrows(ConfigurationException.class, properties::validate);
  }

  @Test
  void whenValidating_givenEquivalentDirectories_shouldReject() {
    final WalshipProperties properties = k8s();
    properties.setMountDir(Path.of("/var/lib/../lib/walship"));

    assertThrows(ConfigurationException.class, properties::validate);
  }

  @Test
  void whenValidating_givenNonPositiveRetention_shouldReject() {
    final WalshipProperties properties = k8s();
    properties.getRetention().setDuration(Duration.ZERO);

    assertThrows(ConfigurationException.class, properties::validate);
  }

  @Test
  void whenValidating_givenNegativeMaxFrames_shouldReject() {
    final WalshipProperties properties = k8s();
    properties.getRetention().setMaxFrames(-1);

    assertThrows(ConfigurationException.class, properties::validate);
  }

  @Test
  void whenValidating_givenStaticPrimaryThatIsNotCandidate_shouldReject() {
    final WalshipProperties properties = new WalshipProperties();
    properties.setDataDir(Path.of("/var/lib/walship"));
    properties.setMountDir(Path.of("/mnt/walship"));
    properties.getStatic().setPrimary(true);
    properties.setCandidate(false);

    final ConfigurationException error = assertThrows(
        ConfigurationException.class, properties::validate);
    assertTrue(error.getMessage().contains("walship.candidate"));
  }

  @Test
  void whenValidating_givenStaticReplicaWithoutPrimaryUrl_shouldReject() {
    final WalshipProperties properties = new WalshipProperties();
    properties.setDataDir(Path.of("/var/lib/walship"));
    properties.setMountDir(Path.of("/mnt/walship"));
    properties.getStatic().setPrimary(false);
    properties.getStatic().setHostname("node-a");

    assertThrows(ConfigurationException.class, properties::validate);
  }

  @Test
  void whenResolvingAdvertiseUrl_givenNoneConfigured_shouldDeriveFromPort() {
    final WalshipProperties properties = k8s();
    properties.getHttp().setPort(3000);

    assertEquals("pod-a", properties.resolveHostname());
    assertEquals("http://pod-a:3000",
        properties.resolveAdvertiseUrl("pod-a"));
  }

  @Test
  void whenResolvingHostname_givenNoneConfigured_shouldUseOsHostname() {
    final WalshipProperties properties = k8s();
    properties.getK8s().setHostname(null);

    final String hostname = properties.resolveHostname();

    assertFalse(hostname.isBlank());
  }

  @Test
  void whenCreatingLeaser_givenKubernetesMode_shouldUseK8sLeaser() {
    final WalshipProperties properties = k8s();
    final Node node = new WalshipAutoConfiguration().walshipNode(properties);

    assertEquals("pod-a", node.hostname());
    assertEquals("http://pod-a:20202", node.advertiseUrl());
    assertInstanceOf(K8sLeaser.class,
        new WalshipAutoConfiguration().walshipLeaser(properties, node));
  }
}
