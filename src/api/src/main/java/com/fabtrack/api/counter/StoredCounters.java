package com.fabtrack.api.counter;

public record StoredCounters(int total, int completed) {

  public static final StoredCounters ZERO = new StoredCounters(0, 0);
}
