package com.obsidiandynamics.tornstate.log;

import java.io.*;
import java.nio.charset.*;
import java.time.*;

@FunctionalInterface
public interface Log {
  void append(String line);

  static Log nop() {
    return __ -> {};
  }

  static Log of(PrintStream out) {
    return new TimestampedLog(new OutputStreamWriter(out, StandardCharsets.UTF_8), Clock.systemDefaultZone());
  }
}
