package ca.gc.cra.conduit.application.queue;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Wake-up signal shared by the lanes of one queue manager so idle consumers park instead of spinning.
 * <p>Waiters always pass a timeout; a missed signal only costs one idle interval.</p>
 *
 * @since 0.1.0
 */
public final class WorkSignal {
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();
  private long version;

  /** Wakes every waiter. */
  public void signal() {
    lock.lock();
    try {
      version++;
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Waits until {@link #signal()} is called or the timeout elapses.
   *
   * @param timeoutMillis maximum wait
   * @return {@code true} if signalled
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public boolean await(long timeoutMillis) throws InterruptedException {
    lock.lock();
    try {
      long observed = version;
      long remaining = TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
      while (version == observed) {
        if (remaining <= 0L) {
          return false;
        }
        remaining = changed.awaitNanos(remaining);
      }
      return true;
    } finally {
      lock.unlock();
    }
  }
}
