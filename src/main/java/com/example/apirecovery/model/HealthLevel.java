package com.example.apirecovery.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum HealthLevel {
    HEALTHY, WARNING, CRITICAL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    // 取两者中更严重的一个
    public HealthLevel worst(HealthLevel other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
