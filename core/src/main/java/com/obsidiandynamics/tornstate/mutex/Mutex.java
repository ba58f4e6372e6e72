package com.obsidiandynamics.tornstate.mutex;

public interface Mutex {
  /**
   * Attempts to acquire the mutex, waiting for up to {@code timeoutMs}. A timeout of
   * {@link Long#MAX_VALUE} waits indefinitely, while a zero timeout makes a single attempt.
   *
   * @param timeoutMs The maximum wait time, in milliseconds.
   * @return True if the mutex was acquired.
   * @throws InterruptedException If the calling thread was interrupted while waiting.
   */
  boolean tryAcquire(long timeoutMs) throws InterruptedException;

  void release();
}
