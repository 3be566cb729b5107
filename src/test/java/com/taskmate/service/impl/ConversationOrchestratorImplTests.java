package com.taskmate.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskmate.ai.SpringAiChatGateway;
import com.taskmate.config.AiProperties;
import com.taskmate.exception.ModelInvocationException;
import com.taskmate.model.Task;
import com.taskmate.model.TaskQuery;
import com.taskmate.repository.InMemoryTaskRepository;
import com.taskmate.service.impl.dto.ModelDecision;
import com.taskmate.service.impl.dto.ToolCall;
import com.taskmate.service.impl.dto.TurnOutcome;
import com.taskmate.session.ChatSession;
import com.taskmate.session.SessionRegistry;
import com.taskmate.support.MutableClock;
import com.taskmate.support.RecordingConnection;
import com.taskmate.tools.AiToolExecutor;
import com.taskmate.tools.ToolRegistry;
import com.taskmate.tools.impl.CreateTaskTool;
import com.taskmate.tools.impl.DeleteTaskTool;
import com.taskmate.tools.impl.FilterTasksTool;
import com.taskmate.tools.impl.ListTasksTool;
import com.taskmate.tools.impl.UpdateTaskTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConversationOrchestratorImplTests {

    private SpringAiChatGateway gateway;
    private InMemoryTaskRepository repository;
    private InMemoryConversationMemoryService memory;
    private AiProperties properties;
    private SessionRegistry sessions;
    private ChatSession session;

    @BeforeEach
    void setUp() {
        gateway = Mockito.mock(SpringAiChatGateway.class);
        MutableClock clock = MutableClock.at("2026-10-19T08:00:00Z");
        repository = new InMemoryTaskRepository(clock);
        properties = new AiProperties();
        properties.getTools().setMaxLoops(3);
        memory = new InMemoryConversationMemoryService(properties);
        sessions = new SessionRegistry();
        session = sessions.register(new RecordingConnection("s1"));
    }

    @Test
    void plainAnswerEndsTurnAfterOneCall() {
        when(gateway.call(anyList())).thenReturn(Mono.just(ModelDecision.finalOnly("Hi! How can I help?")));

        TurnOutcome outcome = orchestrator().run(session, "hello").block();

        assertThat(outcome.finalText()).isEqualTo("Hi! How can I help?");
        assertThat(outcome.mutated()).isFalse();
        assertThat(outcome.truncated()).isFalse();
        assertThat(outcome.rounds()).isEqualTo(1);
    }

    @Test
    void firstCallCarriesDatedSystemPromptAndUserMessage() {
        when(gateway.call(anyList())).thenReturn(Mono.just(ModelDecision.finalOnly("ok")));

        orchestrator().run(session, "what is due?").block();

        List<Map<String, Object>> messages = capturedCalls(1).get(0);
        assertThat(messages).hasSize(2);
        assertThat(messages.get(0)).containsEntry("role", "system");
        assertThat((String) messages.get(0).get("content")).contains("Today's date is 2026-10-19").contains("2026-10-20");
        assertThat(messages.get(1)).containsEntry("role", "user").containsEntry("content", "what is due?");
    }

    @Test
    void toolRoundFeedsResultsBackBeforeFinalAnswer() {
        when(gateway.call(anyList())).thenReturn(
                Mono.just(ModelDecision.tools(List.of(new ToolCall("call-1", "create_task", "{\"title\":\"buy groceries\"}")))),
                Mono.just(ModelDecision.finalOnly("I created 'buy groceries' (ID 1).")));

        TurnOutcome outcome = orchestrator().run(session, "create a task to buy groceries").block();

        assertThat(outcome.mutated()).isTrue();
        assertThat(outcome.rounds()).isEqualTo(2);
        assertThat(outcome.finalText()).contains("buy groceries");
        assertThat(repository.findAll(TaskQuery.all())).extracting(Task::title).containsExactly("buy groceries");

        List<Map<String, Object>> second = capturedCalls(2).get(1);
        assertThat(second).hasSize(4);
        assertThat(second.get(2)).containsEntry("role", "assistant").containsKey("tool_calls");
        assertThat(second.get(3)).containsEntry("role", "tool")
                .containsEntry("tool_call_id", "call-1")
                .containsEntry("name", "create_task");
        assertThat((String) second.get(3).get("content")).contains("created successfully with ID 1");
    }

    @Test
    void toolCallsOfOneResponseRunInOrder() {
        when(gateway.call(anyList())).thenReturn(
                Mono.just(ModelDecision.tools(List.of(
                        new ToolCall("call-1", "create_task", "{\"title\":\"first\"}"),
                        new ToolCall("call-2", "list_tasks", "{}")))),
                Mono.just(ModelDecision.finalOnly("done")));

        orchestrator().run(session, "add first and show me").block();

        List<Map<String, Object>> second = capturedCalls(2).get(1);
        assertThat(second.get(3)).containsEntry("tool_call_id", "call-1");
        assertThat(second.get(4)).containsEntry("tool_call_id", "call-2");
        assertThat((String) second.get(4).get("content")).contains("Title: first");
    }

    @Test
    void missingTaskIsReportedToModelWithoutMutation() {
        when(gateway.call(anyList())).thenReturn(
                Mono.just(ModelDecision.tools(List.of(new ToolCall("call-1", "delete_task", "{\"task_id\":999}")))),
                Mono.just(ModelDecision.finalOnly("I couldn't find task 999.")));

        TurnOutcome outcome = orchestrator().run(session, "delete task 999").block();

        assertThat(outcome.mutated()).isFalse();
        assertThat(outcome.finalText()).contains("couldn't find");
        assertThat(capturedCalls(2).get(1).get(3)).containsEntry("content", "Task with ID 999 not found");
    }

    @Test
    void modelThatNeverStopsIsCutOffAtTheBound() {
        when(gateway.call(anyList())).thenReturn(
                Mono.just(ModelDecision.tools(List.of(new ToolCall("call-1", "create_task", "{\"title\":\"loop\"}")))));

        TurnOutcome outcome = orchestrator().run(session, "keep going").block();

        assertThat(outcome.truncated()).isTrue();
        assertThat(outcome.rounds()).isEqualTo(3);
        assertThat(outcome.finalText()).isEqualTo(ConversationOrchestratorImpl.TRUNCATION_TEXT);
        assertThat(outcome.mutated()).isTrue();
        assertThat(repository.findAll(TaskQuery.all())).hasSize(3);
        verify(gateway, times(3)).call(anyList());
    }

    @Test
    void readOnlyLoopIsCutOffWithoutMutation() {
        when(gateway.call(anyList())).thenReturn(
                Mono.just(ModelDecision.tools(List.of(new ToolCall("call-1", "list_tasks", "{}")))));

        TurnOutcome outcome = orchestrator().run(session, "show tasks forever").block();

        assertThat(outcome.truncated()).isTrue();
        assertThat(outcome.mutated()).isFalse();
    }

    @Test
    void emptyModelTextGetsFallbackReply() {
        when(gateway.call(anyList())).thenReturn(Mono.just(ModelDecision.finalOnly("  ")));

        TurnOutcome outcome = orchestrator().run(session, "hm").block();

        assertThat(outcome.finalText()).isEqualTo(ConversationOrchestratorImpl.EMPTY_REPLY_TEXT);
    }

    @Test
    void modelFailureAfterMutationIsFlagged() {
        when(gateway.call(anyList())).thenReturn(
                Mono.just(ModelDecision.tools(List.of(new ToolCall("call-1", "create_task", "{\"title\":\"x\"}")))),
                Mono.error(new ModelInvocationException("The assistant is unavailable right now: 503", null)));

        assertThatThrownBy(() -> orchestrator().run(session, "create x").block())
                .isInstanceOfSatisfying(ModelInvocationException.class, error -> {
                    assertThat(error.isMutatedBeforeFailure()).isTrue();
                    assertThat(error.getMessage()).contains("503");
                });
    }

    @Test
    void modelFailureOnFirstCallIsNotFlagged() {
        when(gateway.call(anyList())).thenReturn(
                Mono.error(new ModelInvocationException("The assistant is unavailable right now: timeout", null)));

        assertThatThrownBy(() -> orchestrator().run(session, "hello").block())
                .isInstanceOfSatisfying(ModelInvocationException.class,
                        error -> assertThat(error.isMutatedBeforeFailure()).isFalse());
    }

    @Test
    void priorExchangesOfTheSameSessionAreReplayed() {
        when(gateway.call(anyList())).thenReturn(
                Mono.just(ModelDecision.finalOnly("first answer")),
                Mono.just(ModelDecision.finalOnly("second answer")));
        ConversationOrchestratorImpl orchestrator = orchestrator();

        orchestrator.run(session, "first question").block();
        orchestrator.run(session, "second question").block();

        List<Map<String, Object>> second = capturedCalls(2).get(1);
        assertThat(second).extracting(message -> message.get("content"))
                .containsSubsequence("first question", "first answer", "second question");
        assertThat(memory.getHistory("s1")).hasSize(4);
    }

    @Test
    void closedSessionDoesNotKeepMemory() {
        when(gateway.call(anyList())).thenReturn(Mono.just(ModelDecision.finalOnly("ok")));
        sessions.unregister(session);

        TurnOutcome outcome = orchestrator().run(session, "late message").block();

        assertThat(outcome.finalText()).isEqualTo("ok");
        assertThat(memory.getHistory("s1")).isEmpty();
    }

    @Test
    void disconnectDuringMemoryWriteLeavesNoWindowBehind() {
        when(gateway.call(anyList())).thenReturn(Mono.just(ModelDecision.finalOnly("ok")));
        memory = new InMemoryConversationMemoryService(properties) {
            @Override
            public void appendMessages(String sessionId, List<Map<String, Object>> messages) {
                sessions.unregister(session);
                clear(sessionId);
                super.appendMessages(sessionId, messages);
            }
        };

        TurnOutcome outcome = orchestrator().run(session, "bye").block();

        assertThat(outcome.finalText()).isEqualTo("ok");
        assertThat(memory.getHistory("s1")).isEmpty();
    }

    @Test
    void textSentAlongsideToolCallsStaysInTheTurn() {
        when(gateway.call(anyList())).thenReturn(
                Mono.just(ModelDecision.tools(List.of(new ToolCall("call-1", "list_tasks", "{}")), "Let me check your tasks.")),
                Mono.just(ModelDecision.finalOnly("You have no tasks.")));

        orchestrator().run(session, "what do I have?").block();

        Map<String, Object> assistantToolMessage = capturedCalls(2).get(1).get(2);
        assertThat(assistantToolMessage).containsEntry("role", "assistant")
                .containsEntry("content", "Let me check your tasks.")
                .containsKey("tool_calls");
    }

    @Test
    void disabledMemoryIsNeitherReadNorWritten() {
        properties.getMemory().setEnabled(false);
        when(gateway.call(anyList())).thenReturn(Mono.just(ModelDecision.finalOnly("ok")));
        ConversationOrchestratorImpl orchestrator = orchestrator();

        orchestrator.run(session, "one").block();
        orchestrator.run(session, "two").block();

        assertThat(capturedCalls(2).get(1)).hasSize(2);
        assertThat(memory.getHistory("s1")).isEmpty();
    }

    private ConversationOrchestratorImpl orchestrator() {
        ToolRegistry registry = new ToolRegistry(List.of(
                new CreateTaskTool(repository),
                new UpdateTaskTool(repository),
                new DeleteTaskTool(repository),
                new ListTasksTool(repository),
                new FilterTasksTool(repository)));
        AiToolExecutor executor = new AiToolExecutor(registry, new ObjectMapper());
        return new ConversationOrchestratorImpl(gateway, executor, memory, properties,
                MutableClock.at("2026-10-19T08:00:00Z"));
    }

    @SuppressWarnings("unchecked")
    private List<List<Map<String, Object>>> capturedCalls(int expected) {
        ArgumentCaptor<List<Map<String, Object>>> captor = ArgumentCaptor.forClass(List.class);
        verify(gateway, times(expected)).call(captor.capture());
        return captor.getAllValues();
    }
}
