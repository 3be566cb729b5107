package com.taskmate.service.impl;

import com.taskmate.ai.SpringAiChatGateway;
import com.taskmate.config.AiProperties;
import com.taskmate.exception.ModelInvocationException;
import com.taskmate.service.ConversationMemoryService;
import com.taskmate.service.ConversationOrchestrator;
import com.taskmate.service.impl.dto.ConversationTurn;
import com.taskmate.service.impl.dto.ModelDecision;
import com.taskmate.service.impl.dto.TurnOutcome;
import com.taskmate.session.ChatSession;
import com.taskmate.tools.AiToolExecutor;
import com.taskmate.tools.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
public class ConversationOrchestratorImpl implements ConversationOrchestrator {

    static final String EMPTY_REPLY_TEXT = "Done. Let me know if there is anything else you need.";
    static final String TRUNCATION_TEXT = "I had to stop before finishing this request because it took too many steps. "
            + "Some changes may already have been applied, so please check the task list and try a more specific request.";

    private final SpringAiChatGateway gateway;
    private final AiToolExecutor toolExecutor;
    private final ConversationMemoryService memoryService;
    private final Clock clock;
    private final int maxToolLoops;
    private final boolean memoryEnabled;

    public ConversationOrchestratorImpl(SpringAiChatGateway gateway,
                                        AiToolExecutor toolExecutor,
                                        ConversationMemoryService memoryService,
                                        AiProperties properties,
                                        Clock clock) {
        this.gateway = gateway;
        this.toolExecutor = toolExecutor;
        this.memoryService = memoryService;
        this.clock = clock;
        this.maxToolLoops = Math.max(1, properties.getTools().getMaxLoops());
        this.memoryEnabled = properties.getMemory().isEnabled();
    }

    @Override
    public Mono<TurnOutcome> run(ChatSession session, String userMessage) {
        return Mono.defer(() -> {
            ConversationTurn turn = openTurn(session.id(), userMessage);
            log.debug("Turn started sessionId={} historyMessages={}", session.id(), turn.getMessages().size() - 2);
            return orchestrateLoop(turn)
                    .doOnNext(outcome -> remember(session, userMessage, outcome))
                    .doOnNext(outcome -> log.info("Turn completed sessionId={} rounds={} mutated={} truncated={}",
                            session.id(), outcome.rounds(), outcome.mutated(), outcome.truncated()))
                    .onErrorMap(ModelInvocationException.class,
                            error -> ModelInvocationException.duringTurn(error, turn.isMutated()));
        });
    }

    private ConversationTurn openTurn(String sessionId, String userMessage) {
        List<Map<String, Object>> opening = new ArrayList<>();
        opening.add(Map.of("role", "system", "content", SystemPrompt.forDate(LocalDate.now(clock))));
        if (memoryEnabled) {
            opening.addAll(memoryService.getHistory(sessionId));
        }
        opening.add(Map.of("role", "user", "content", userMessage));
        return new ConversationTurn(sessionId, userMessage, opening);
    }

    private Mono<TurnOutcome> orchestrateLoop(ConversationTurn turn) {
        int round = turn.nextRound();
        return gateway.call(new ArrayList<>(turn.getMessages()))
                .flatMap(decision -> {
                    if (!decision.hasToolCalls()) {
                        log.debug("Model answered with text on round {} sessionId={}", round, turn.getSessionId());
                        return Mono.just(finish(turn, decision.getContent()));
                    }
                    log.info("Model requested {} tool call(s) on round {} sessionId={}",
                            decision.getToolCalls().size(), round, turn.getSessionId());
                    dispatchTools(turn, decision);
                    if (round >= maxToolLoops) {
                        log.warn("Reached max tool loops {} sessionId={} - ending turn", maxToolLoops, turn.getSessionId());
                        return Mono.just(new TurnOutcome(TRUNCATION_TEXT, turn.isMutated(), true, round));
                    }
                    return orchestrateLoop(turn);
                });
    }

    private void dispatchTools(ConversationTurn turn, ModelDecision decision) {
        List<AiToolExecutor.ToolCall> calls = decision.getToolCalls().stream()
                .map(call -> call.forSession(turn.getSessionId()))
                .toList();
        List<ToolResult> results = toolExecutor.executeAll(calls);

        List<Map<String, Object>> toolMessages = new ArrayList<>(calls.size() + 1);
        toolMessages.add(toolExecutor.toAssistantToolCallsMessage(decision.getContent(), calls));
        for (int i = 0; i < calls.size(); i++) {
            ToolResult result = results.get(i);
            if (result.mutatedStore()) {
                turn.markMutated();
            } else if (!result.succeeded()) {
                log.warn("Tool '{}' returned {} sessionId={}: {}",
                        result.toolName(), result.status(), turn.getSessionId(), result.text());
            }
            toolMessages.add(toolExecutor.toToolMessage(calls.get(i), result));
        }
        turn.append(toolMessages);
    }

    private TurnOutcome finish(ConversationTurn turn, String content) {
        String text = StringUtils.hasText(content) ? content : EMPTY_REPLY_TEXT;
        return new TurnOutcome(text, turn.isMutated(), false, turn.getRounds());
    }

    private void remember(ChatSession session, String userMessage, TurnOutcome outcome) {
        if (!memoryEnabled) {
            return;
        }
        if (!session.isLive()) {
            log.debug("Session id={} closed during the turn; not storing memory", session.id());
            return;
        }
        memoryService.appendMessages(session.id(), List.of(
                Map.of("role", "user", "content", userMessage),
                Map.of("role", "assistant", "content", outcome.finalText())
        ));
        // a disconnect may have cleared the window between the check and the append
        if (!session.isLive()) {
            memoryService.clear(session.id());
        }
    }
}
