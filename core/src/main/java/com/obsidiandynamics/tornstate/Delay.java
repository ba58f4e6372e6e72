package com.obsidiandynamics.tornstate;

/**
 * Suspends a transfer between its debit and its credit.
 */
@FunctionalInterface
public interface Delay {
  void pause(long millis) throws InterruptedException;

  static Delay sleep() {
    return Thread::sleep;
  }
}
