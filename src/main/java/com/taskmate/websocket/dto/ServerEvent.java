package com.taskmate.websocket.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.taskmate.model.Task;

import java.util.List;

/**
 * Outbound frame. Exactly one of {@code tasks} and {@code message} is set, depending on the type.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServerEvent(String type, List<Task> tasks, String message) {

    public static final String INITIAL_TASKS = "initial_tasks";
    public static final String AGENT_RESPONSE = "agent_response";
    public static final String TASK_UPDATE = "task_update";
    public static final String ERROR = "error";

    public static ServerEvent initialTasks(List<Task> tasks) {
        return new ServerEvent(INITIAL_TASKS, List.copyOf(tasks), null);
    }

    public static ServerEvent agentResponse(String message) {
        return new ServerEvent(AGENT_RESPONSE, null, message);
    }

    public static ServerEvent taskUpdate(List<Task> tasks) {
        return new ServerEvent(TASK_UPDATE, List.copyOf(tasks), null);
    }

    public static ServerEvent error(String message) {
        return new ServerEvent(ERROR, null, message);
    }
}
