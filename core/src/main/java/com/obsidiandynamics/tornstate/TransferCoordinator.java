package com.obsidiandynamics.tornstate;

import com.obsidiandynamics.tornstate.TransferCancelledException.*;
import com.obsidiandynamics.tornstate.log.*;
import com.obsidiandynamics.tornstate.mutex.*;
import com.obsidiandynamics.tornstate.util.*;

import java.util.function.*;

/**
 * Mediates all access to a single {@link AccountPair}. Every operation, reads included, runs
 * under the pair's mutex, so no caller observes the pair in the middle of a transfer. The
 * mutex is always released, even when a transfer is interrupted partway; the pair, however,
 * is not rolled back.
 */
public final class TransferCoordinator {
  public static class Options {
    public Supplier<Mutex> mutexFactory = () -> new ReentrantMutex(false);
    public long mutexTimeoutMs = Long.MAX_VALUE;
    public Log log = Log.nop();
    public Delay delay = Delay.sleep();

    void validate() {
      Assert.isNotNull(mutexFactory, Assert.withMessage("Mutex factory cannot be null"));
      Assert.that(mutexTimeoutMs >= 0, () -> String.format("Mutex timeout cannot be negative (%d)", mutexTimeoutMs));
      Assert.isNotNull(log, Assert.withMessage("Log cannot be null"));
      Assert.isNotNull(delay, Assert.withMessage("Delay cannot be null"));
    }
  }

  private final AccountPair pair;

  private final Mutex mutex;

  private final long mutexTimeoutMs;

  private final Log log;

  public TransferCoordinator(long invariantTotal, long balanceA, long balanceB, Options options) {
    options.validate();
    pair = new AccountPair(invariantTotal, balanceA, balanceB, options.delay);
    mutex = options.mutexFactory.get();
    Assert.isNotNull(mutex, Assert.withMessage("Mutex factory returned null"));
    mutexTimeoutMs = options.mutexTimeoutMs;
    log = options.log;
  }

  public static TransferCoordinator of(long invariantTotal, long balanceA, long balanceB, Options options) {
    return new TransferCoordinator(invariantTotal, balanceA, balanceB, options);
  }

  public static TransferCoordinator balanced(long balanceA, long balanceB, Options options) {
    return new TransferCoordinator(balanceA + balanceB, balanceA, balanceB, options);
  }

  public long getInvariantTotal() {
    return pair.getInvariantTotal();
  }

  public long getBalance(int accountId) throws InterruptedException {
    acquire();
    try {
      return pair.getBalance(accountId);
    } finally {
      mutex.release();
    }
  }

  public long totalBalance() throws InterruptedException {
    acquire();
    try {
      return pair.totalBalance();
    } finally {
      mutex.release();
    }
  }

  public Balances transfer(int fromAccountId, long amount, long delayMillis) throws InterruptedException {
    return transfer(fromAccountId, amount, delayMillis, CancellationToken.none());
  }

  public Balances transfer(int fromAccountId, long amount, long delayMillis, CancellationToken token) throws InterruptedException {
    final var thread = Thread.currentThread();
    log.append(String.format("thread %s called transfer from %d amount %d", thread, fromAccountId, amount));
    token.throwIfCancelled(Checkpoint.BEFORE_ACQUIRE);

    final Balances balances;
    acquire();
    try {
      log.append(String.format("thread %s acquired lock from %d amount %d", thread, fromAccountId, amount));
      token.throwIfCancelled(Checkpoint.BEFORE_MUTATION);
      balances = pair.transfer(fromAccountId, amount, delayMillis);
    } finally {
      mutex.release();
    }

    log.append(String.format("thread %s released lock from %d amount %d", thread, fromAccountId, amount));
    return balances;
  }

  private void acquire() throws InterruptedException {
    if (! mutex.tryAcquire(mutexTimeoutMs)) {
      throw new MutexAcquisitionFailure(String.format("Timed out after %d ms while acquiring mutex", mutexTimeoutMs), null);
    }
  }

  @Override
  public String toString() {
    return TransferCoordinator.class.getSimpleName() + "[mutex=" + mutex + ", mutexTimeoutMs=" + mutexTimeoutMs + ']';
  }
}
