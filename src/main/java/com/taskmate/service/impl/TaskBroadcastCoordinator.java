package com.taskmate.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskmate.exception.ModelInvocationException;
import com.taskmate.model.Task;
import com.taskmate.model.TaskQuery;
import com.taskmate.repository.TaskRepository;
import com.taskmate.service.impl.dto.TurnOutcome;
import com.taskmate.session.ChatSession;
import com.taskmate.session.SessionRegistry;
import com.taskmate.websocket.dto.ServerEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Turns the outcome of a turn into outbound frames. The reply always goes to the originating
 * session first; a fresh task snapshot is broadcast only when the store changed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TaskBroadcastCoordinator {

    private final SessionRegistry sessionRegistry;
    private final TaskRepository taskRepository;
    private final ObjectMapper mapper;

    public void sendInitialSnapshot(ChatSession session) {
        snapshot().ifPresent(tasks -> {
            sessionRegistry.sendTo(session, toJson(ServerEvent.initialTasks(tasks)));
            log.debug("Sent initial snapshot of {} task(s) to session id={}", tasks.size(), session.id());
        });
    }

    public void afterTurn(ChatSession origin, TurnOutcome outcome) {
        sessionRegistry.sendTo(origin, toJson(ServerEvent.agentResponse(outcome.finalText())));
        if (outcome.mutated()) {
            broadcastSnapshot();
        }
    }

    public void afterFailure(ChatSession origin, ModelInvocationException failure) {
        sessionRegistry.sendTo(origin, toJson(ServerEvent.error(failure.getMessage())));
        if (failure.isMutatedBeforeFailure()) {
            log.info("Turn failed after changing tasks; resynchronising clients");
            broadcastSnapshot();
        }
    }

    public void reportError(ChatSession origin, String message) {
        sessionRegistry.sendTo(origin, toJson(ServerEvent.error(message)));
    }

    private void broadcastSnapshot() {
        snapshot().ifPresent(tasks -> {
            int delivered = sessionRegistry.broadcast(toJson(ServerEvent.taskUpdate(tasks)));
            log.info("Broadcast task_update with {} task(s) to {} session(s)", tasks.size(), delivered);
        });
    }

    private Optional<List<Task>> snapshot() {
        try {
            return Optional.of(taskRepository.findAll(TaskQuery.all()));
        } catch (RuntimeException e) {
            log.error("Could not read task snapshot", e);
            return Optional.empty();
        }
    }

    private String toJson(ServerEvent event) {
        try {
            return mapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise " + event.type() + " event", e);
        }
    }
}
