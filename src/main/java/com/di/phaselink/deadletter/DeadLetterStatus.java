package com.di.phaselink.deadletter;

public enum DeadLetterStatus {
    PENDING,
    REPLAYED,
    DISCARDED
}
