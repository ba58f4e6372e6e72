package com.obsidiandynamics.tornstate;

import java.util.concurrent.*;

public final class TransferCancelledException extends CancellationException {
  public enum Checkpoint {
    BEFORE_ACQUIRE,
    BEFORE_MUTATION
  }

  private final Checkpoint checkpoint;

  TransferCancelledException(Checkpoint checkpoint) {
    super("Transfer cancelled at " + checkpoint);
    this.checkpoint = checkpoint;
  }

  public Checkpoint getCheckpoint() {
    return checkpoint;
  }
}
