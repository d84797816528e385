package com.github.linkyeeter.model;

public enum WorkerState {
    IDLE,
    BUSY,
    STOPPED
}
