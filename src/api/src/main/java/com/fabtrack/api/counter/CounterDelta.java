package com.fabtrack.api.counter;

import com.fabtrack.api.task.TaskCategory;

public record CounterDelta(String projectNo, TaskCategory category, CounterKind kind, int delta) {
}
