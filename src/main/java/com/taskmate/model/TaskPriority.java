package com.taskmate.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum TaskPriority {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String wireValue;

    TaskPriority(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public static Optional<TaskPriority> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (TaskPriority priority : values()) {
            if (priority.wireValue.equals(normalized)) {
                return Optional.of(priority);
            }
        }
        return Optional.empty();
    }
}
