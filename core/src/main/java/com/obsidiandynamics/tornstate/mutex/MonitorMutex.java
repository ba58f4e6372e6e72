package com.obsidiandynamics.tornstate.mutex;

public final class MonitorMutex implements Mutex {
  private final Object monitor = new Object();

  private Thread owner;

  @Override
  public boolean tryAcquire(long timeoutMs) throws InterruptedException {
    final var current = Thread.currentThread();
    var deadline = 0L;
    synchronized (monitor) {
      if (owner == current) {
        throw new IllegalMonitorStateException("Already locked by the current thread");
      }

      while (true) {
        if (owner == null) {
          owner = current;
          return true;
        } else if (timeoutMs > 0) {
          final var currentTime = System.currentTimeMillis();
          if (deadline == 0) {
            deadline = addNoWrap(currentTime, timeoutMs);
          }
          final var remaining = deadline - currentTime;
          if (remaining > 0) {
            monitor.wait(remaining);
          } else {
            return false;
          }
        } else {
          return false;
        }
      }
    }
  }

  @Override
  public void release() {
    synchronized (monitor) {
      if (owner != Thread.currentThread()) {
        throw new IllegalMonitorStateException("Not locked by the current thread");
      }
      owner = null;
      monitor.notify();
    }
  }

  @Override
  public String toString() {
    synchronized (monitor) {
      return MonitorMutex.class.getSimpleName() + "[owner=" + owner + ']';
    }
  }

  private static long addNoWrap(long l1, long l2) {
    final var sum = l1 + l2;
    return sum < 0 ? Long.MAX_VALUE : sum;
  }
}
