package com.obsidiandynamics.tornstate.mutex;

import java.util.concurrent.*;
import java.util.concurrent.locks.*;

public final class ReentrantMutex implements Mutex {
  private final Lock lock;

  public ReentrantMutex(boolean fair) {
    lock = new ReentrantLock(fair);
  }

  @Override
  public boolean tryAcquire(long timeoutMs) throws InterruptedException {
    return lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS);
  }

  @Override
  public void release() {
    lock.unlock();
  }

  @Override
  public String toString() {
    return ReentrantMutex.class.getSimpleName() + "[lock=" + lock + ']';
  }
}
