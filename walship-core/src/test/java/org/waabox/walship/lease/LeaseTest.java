package org.waabox.walship.lease;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.Test;
import org.waabox.walship.Node;

/**
 * Tests for {@link Lease}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class LeaseTest {

  private static final Node OWNER = new Node("a", "http://a:20202", true);

  private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

  @Test
  void whenCheckingExpiry_givenTtlLease_shouldExpireAfterTtl() {
    final Lease lease = Lease.of(OWNER, START, Duration.ofSeconds(10),
        Duration.ofSeconds(5));

    assertFalse(lease.isExpired(START.plusSeconds(9)));
    assertTrue(lease.isExpired(START.plusSeconds(10)));
    assertEquals(START.plusSeconds(10), lease.expiresAt().orElseThrow());
  }

  @Test
  void whenRenewing_givenTtlLease_shouldMoveExpiry() {
    final Lease lease = Lease.of(OWNER, START, Duration.ofSeconds(10),
        Duration.ofSeconds(5));

    final Lease renewed = lease.renewedAt(START.plusSeconds(8));

    assertFalse(renewed.isExpired(START.plusSeconds(17)));
    assertEquals(START, renewed.termStart());
    assertEquals("http://a:20202", renewed.advertiseUrl());
  }

  @Test
  void whenCheckingExpiry_givenPermanentLease_shouldNeverExpire() {
    final Lease lease = Lease.permanent(OWNER, START);

    assertFalse(lease.isExpired(START.plus(Duration.ofDays(3650))));
    assertTrue(lease.expiresAt().isEmpty());
    assertTrue(lease.ttl().isEmpty());
  }

  @Test
  void whenCreating_givenZeroTtl_shouldThrow() {
    assertThrows(IllegalArgumentException.class,
        () -> Lease.of(OWNER, START, Duration.ZERO, Duration.ZERO));
  }
}
