package com.nayem.tether.scheduler;

public enum TaskState {
    IDLE,
    QUEUED,
    RUNNING,
    FAILED
}
