package com.obsidiandynamics.tornstate.log;

import com.obsidiandynamics.tornstate.util.*;

import java.io.*;
import java.time.*;

public final class TimestampedLog implements Log {
  private final Object lock = new Object();

  private final Writer out;

  private final Clock clock;

  public TimestampedLog(Writer out, Clock clock) {
    Assert.isNotNull(out, Assert.withMessage("Output writer cannot be null"));
    Assert.isNotNull(clock, Assert.withMessage("Clock cannot be null"));
    this.out = out;
    this.clock = clock;
  }

  @Override
  public void append(String line) {
    // timestamp at invocation, before contending for the writer
    final var now = LocalDateTime.now(clock);
    synchronized (lock) {
      try {
        out.write(now + " " + line + "\n");
        out.flush();
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    }
  }

  @Override
  public String toString() {
    return TimestampedLog.class.getSimpleName() + "[clock=" + clock + ']';
  }
}
