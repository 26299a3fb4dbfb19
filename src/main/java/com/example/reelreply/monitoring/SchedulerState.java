package com.example.reelreply.monitoring;

public enum SchedulerState {
    STOPPED, RUNNING
}
