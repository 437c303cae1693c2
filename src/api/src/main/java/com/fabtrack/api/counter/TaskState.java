package com.fabtrack.api.counter;

/** The part of a task row that decides which counters it contributes to. */
public record TaskState(String projectNo, String status) {
}
