package com.example.apirecovery.recovery;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RecoveryEvent {
    CIRCUIT_OPENED("circuit-opened"),
    CIRCUIT_CLOSED("circuit-closed"),
    RETRY_EXHAUSTED("retry-exhausted"),
    QUEUE_OVERFLOW("queue-overflow"),
    FALLBACK_TRIGGERED("fallback-triggered"),
    RECOVERY_SUCCESSFUL("recovery-successful");

    private final String eventName;

    RecoveryEvent(String eventName) {
        this.eventName = eventName;
    }

    @JsonValue
    public String getEventName() {
        return eventName;
    }
}
