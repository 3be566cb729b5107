package com.taskmate.tools;

import com.taskmate.exception.ToolArgumentException;
import com.taskmate.model.TaskPriority;
import com.taskmate.model.TaskStatus;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Typed, validating view over the raw argument map a model sent for one tool call.
 * Blank strings count as absent, since models frequently send {@code ""} for unused parameters.
 */
public final class ToolArguments {

    public static final String TASK_ID = "task_id";
    public static final String TITLE = "title";
    public static final String DESCRIPTION = "description";
    public static final String STATUS = "status";
    public static final String PRIORITY = "priority";
    public static final String DUE_DATE = "due_date";

    static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59);

    private final Map<String, Object> raw;

    public ToolArguments(Map<String, Object> raw) {
        this.raw = raw != null ? raw : Collections.emptyMap();
    }

    public String requireText(String key) {
        return optionalText(key)
                .orElseThrow(() -> new ToolArgumentException("'" + key + "' is required and must not be empty"));
    }

    public Optional<String> optionalText(String key) {
        Object value = raw.get(key);
        if (value == null) {
            return Optional.empty();
        }
        String text = value.toString().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    public long requireTaskId() {
        Object value = raw.get(TASK_ID);
        if (value == null || value.toString().isBlank()) {
            throw new ToolArgumentException("'" + TASK_ID + "' is required");
        }
        try {
            BigDecimal number = new BigDecimal(value.toString().trim());
            return number.longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new ToolArgumentException("'" + TASK_ID + "' must be a whole number, got '" + value + "'");
        }
    }

    public Optional<TaskStatus> optionalStatus() {
        return optionalText(STATUS).map(text -> TaskStatus.parse(text)
                .orElseThrow(() -> new ToolArgumentException(
                        "'" + STATUS + "' must be one of " + allowed(TaskStatus.values(), TaskStatus::wireValue) + ", got '" + text + "'")));
    }

    public Optional<TaskPriority> optionalPriority() {
        return optionalText(PRIORITY).map(text -> TaskPriority.parse(text)
                .orElseThrow(() -> new ToolArgumentException(
                        "'" + PRIORITY + "' must be one of " + allowed(TaskPriority.values(), TaskPriority::wireValue) + ", got '" + text + "'")));
    }

    /** Like {@link #optionalPriority()} but falls back to medium instead of failing. */
    public TaskPriority priorityOrMedium() {
        return optionalText(PRIORITY)
                .flatMap(TaskPriority::parse)
                .orElse(TaskPriority.MEDIUM);
    }

    /**
     * Accepts {@code 2026-10-20} (taken as 23:59:59 that day), {@code 2026-10-20T09:30[:ss]} and
     * offset forms such as {@code 2026-10-20T09:30:00Z}, whose local date-time part is kept.
     */
    public Optional<LocalDateTime> optionalDueDate() {
        return optionalText(DUE_DATE).map(ToolArguments::parseDueDate);
    }

    static LocalDateTime parseDueDate(String text) {
        try {
            if (text.indexOf('T') < 0) {
                return LocalDate.parse(text).atTime(END_OF_DAY);
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(text, OffsetDateTime::from, LocalDateTime::from);
            return parsed instanceof OffsetDateTime offset ? offset.toLocalDateTime() : (LocalDateTime) parsed;
        } catch (DateTimeParseException e) {
            throw new ToolArgumentException("'" + DUE_DATE + "' must be an ISO-8601 date or date-time, got '" + text + "'");
        }
    }

    private static <E> String allowed(E[] values, Function<E, String> wireValue) {
        return Arrays.stream(values)
                .map(wireValue)
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
