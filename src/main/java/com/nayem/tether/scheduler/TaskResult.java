package com.nayem.tether.scheduler;

public enum TaskResult {
    SUCCESS,
    RETRY,
    FAILURE
}
