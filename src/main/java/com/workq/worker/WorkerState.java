package com.workq.worker;

public enum WorkerState {
    IDLE,
    CLAIMING,
    EXECUTING,
    STOPPING,
    STOPPED
}
