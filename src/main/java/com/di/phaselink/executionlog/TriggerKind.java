package com.di.phaselink.executionlog;

public enum TriggerKind {
    COMPLETION_EVENT,
    FALLBACK_TIMER,
    MANUAL
}
