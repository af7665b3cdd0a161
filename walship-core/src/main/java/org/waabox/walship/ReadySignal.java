package org.waabox.walship;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A single-fire notification telling startup orchestration that the node
 * is safe to begin accepting local application traffic.
 *
 * <p>The signal fires once, when the node first becomes primary or first
 * catches up with a primary. Later role changes do not reset it. Any
 * number of threads may wait on it.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ReadySignal {

  /** Released when the signal fires. */
  private final CountDownLatch latch = new CountDownLatch(1);

  /** Whether the signal already fired. */
  private final AtomicBoolean fired = new AtomicBoolean(false);

  /**
   * Fires the signal.
   *
   * @return true if this call fired the signal, false if it had already
   *         fired
   */
  public boolean fire() {
    if (!fired.compareAndSet(false, true)) {
      return false;
    }
    latch.countDown();
    return true;
  }

  /**
   * Returns whether the signal fired.
   *
   * @return true once the node is ready
   */
  public boolean isReady() {
    return fired.get();
  }

  /**
   * Waits until the signal fires.
   *
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public void await() throws InterruptedException {
    latch.await();
  }

  /**
   * Waits until the signal fires or the timeout elapses.
   *
   * @param timeout the maximum time to wait, never null
   * @return true if the signal fired, false on timeout
   *
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public boolean await(final Duration timeout) throws InterruptedException {
    return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }
}
