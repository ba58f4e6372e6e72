package com.obsidiandynamics.tornstate;

import com.obsidiandynamics.tornstate.TransferCancelledException.*;

import java.util.concurrent.atomic.*;

/**
 * A request for cooperative cancellation. A transfer honours it only at checkpoints that
 * precede the debit; a request that arrives once the balances are being mutated is ignored
 * by that transfer, which then runs to completion.
 */
public final class CancellationToken {
  private static final CancellationToken NONE = new CancellationToken(false);

  private final boolean cancellable;

  private final AtomicBoolean cancelled = new AtomicBoolean();

  public CancellationToken() {
    this(true);
  }

  private CancellationToken(boolean cancellable) {
    this.cancellable = cancellable;
  }

  public static CancellationToken none() {
    return NONE;
  }

  public void cancel() {
    if (! cancellable) {
      throw new UnsupportedOperationException("Cannot cancel the shared no-op token");
    }
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  void throwIfCancelled(Checkpoint checkpoint) {
    if (isCancelled()) {
      throw new TransferCancelledException(checkpoint);
    }
  }

  @Override
  public String toString() {
    return CancellationToken.class.getSimpleName() + "[cancelled=" + cancelled.get() + ']';
  }
}
