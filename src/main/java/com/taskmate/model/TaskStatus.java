package com.taskmate.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum TaskStatus {
    TODO("todo"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    ARCHIVED("archived");

    private final String wireValue;

    TaskStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /**
     * Case-insensitive lookup that also accepts the spellings used by older front ends
     * ({@code inprogress}, {@code In Progress}, {@code in-progress}).
     */
    public static Optional<TaskStatus> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        if ("inprogress".equals(normalized)) {
            return Optional.of(IN_PROGRESS);
        }
        for (TaskStatus status : values()) {
            if (status.wireValue.equals(normalized)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
