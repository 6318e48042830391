package com.example.bilitracker.domain;

public enum SchedulerState {

    /** Never started. */
    STOPPED,

    /** Jobs registered, waiting for the next tick. */
    ARMED,

    /** A full pass is executing. */
    RUNNING
}
