package com.obsidiandynamics.tornstate;

public final class MutexAcquisitionFailure extends RuntimeException {
  MutexAcquisitionFailure(String m, Throwable cause) {
    super(m, cause);
  }
}
