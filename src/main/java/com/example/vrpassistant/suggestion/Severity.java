package com.example.vrpassistant.suggestion;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Severity {
    LOW, MEDIUM, HIGH;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
