package com.fabtrack.api.counter;

public enum CounterKind {
  TOTAL,
  COMPLETED
}
