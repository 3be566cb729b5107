package com.taskmate.ai;

import com.taskmate.ai.tools.SpringAiToolAdapter;
import com.taskmate.config.AiProperties;
import com.taskmate.exception.ModelInvocationException;
import com.taskmate.service.impl.dto.ModelDecision;
import com.taskmate.service.impl.dto.ToolCall;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.model.tool.ToolCallingChatOptions;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Single entry point to the language model. Takes the turn's messages in role/content map form,
 * advertises the task tools and returns either final text or the requested tool calls.
 *
 * <p>Timeout and retry live here. Whatever still fails afterwards is reported as
 * {@link ModelInvocationException}.</p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpringAiChatGateway {

    private final ChatModel chatModel;
    private final SpringAiToolAdapter toolAdapter;
    private final AiProperties properties;

    public Mono<ModelDecision> call(List<Map<String, Object>> messages) {
        return Mono.fromCallable(() -> executeCall(messages))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(requestTimeout())
                .retryWhen(retrySpec())
                .onErrorMap(error -> !(error instanceof ModelInvocationException), this::toInvocationException);
    }

    private ModelDecision executeCall(List<Map<String, Object>> messageMaps) {
        List<Message> messages = messageMaps.stream()
                .map(this::mapToMessage)
                .filter(Objects::nonNull)
                .toList();
        ToolCallingChatOptions options = ToolCallingChatOptions.builder()
                .model(properties.getModel())
                .temperature(properties.getTemperature())
                .toolCallbacks(toolAdapter.toolCallbacks())
                .internalToolExecutionEnabled(false)
                .build();

        log.debug("Executing chat call with model={} mode={} messages={}",
                properties.getModel(), properties.getMode(), messages.size());
        ChatResponse response = chatModel.call(new Prompt(messages, options));
        return toDecision(response);
    }

    private ModelDecision toDecision(ChatResponse response) {
        Generation generation = response != null ? response.getResult() : null;
        AssistantMessage message = generation != null ? generation.getOutput() : null;
        if (message == null) {
            throw new ModelInvocationException("The model returned an empty response", null);
        }
        if (message.hasToolCalls()) {
            List<ToolCall> calls = new ArrayList<>();
            for (AssistantMessage.ToolCall call : message.getToolCalls()) {
                String id = StringUtils.hasText(call.id()) ? call.id() : "call-" + UUID.randomUUID();
                calls.add(new ToolCall(id, call.name(), StringUtils.hasText(call.arguments()) ? call.arguments() : "{}"));
            }
            log.debug("Model requested tools {}", calls.stream().map(ToolCall::getName).toList());
            return ModelDecision.tools(calls, message.getText());
        }
        String text = message.getText();
        return ModelDecision.finalOnly(text != null ? text : "");
    }

    private Message mapToMessage(Map<String, Object> source) {
        if (source == null) return null;
        String role = asString(source.get("role"));
        String content = Objects.toString(source.get("content"), "");
        if ("system".equalsIgnoreCase(role)) return new SystemMessage(content);
        if ("user".equalsIgnoreCase(role)) return new UserMessage(content);
        if ("assistant".equalsIgnoreCase(role)) {
            return new AssistantMessage(content, new HashMap<>(), extractToolCalls(source.get("tool_calls")));
        }
        if ("tool".equalsIgnoreCase(role)) {
            String id = asString(source.get("tool_call_id"));
            String name = asString(source.get("name"));
            ToolResponseMessage.ToolResponse response = new ToolResponseMessage.ToolResponse(
                    id != null ? id : "tool-" + System.nanoTime(),
                    name != null ? name : "",
                    content
            );
            return new ToolResponseMessage(List.of(response));
        }
        return new UserMessage(content);
    }

    private List<AssistantMessage.ToolCall> extractToolCalls(Object toolCallsObj) {
        if (!(toolCallsObj instanceof List<?> list)) return Collections.emptyList();
        List<AssistantMessage.ToolCall> calls = new ArrayList<>();
        for (Object entry : list) {
            if (entry instanceof Map<?, ?> map) {
                String id = asString(map.get("id"));
                String type = asString(map.get("type"));
                Object fn = map.get("function");
                String name = fn instanceof Map<?, ?> fnMap ? asString(fnMap.get("name")) : null;
                String arguments = fn instanceof Map<?, ?> fnMap ? asString(fnMap.get("arguments")) : null;
                calls.add(new AssistantMessage.ToolCall(
                        id != null ? id : "call-" + System.nanoTime(),
                        type != null ? type : "function",
                        name != null ? name : "",
                        arguments != null ? arguments : "{}"
                ));
            }
        }
        return calls;
    }

    private ModelInvocationException toInvocationException(Throwable error) {
        if (error instanceof TimeoutException) {
            log.warn("Model call timed out after {} ms", requestTimeout().toMillis());
            return new ModelInvocationException(
                    "The assistant did not answer within " + requestTimeout().toSeconds() + " seconds. Please try again.", error);
        }
        log.warn("Model call failed: {}", error.toString());
        String detail = StringUtils.hasText(error.getMessage()) ? error.getMessage() : error.getClass().getSimpleName();
        return new ModelInvocationException("The assistant is unavailable right now: " + detail, error);
    }

    private boolean isRetryableError(Throwable throwable) {
        if (throwable instanceof ModelInvocationException || throwable instanceof NonTransientAiException) {
            return false;
        }
        return !(throwable instanceof IllegalArgumentException);
    }

    private Duration requestTimeout() {
        return Duration.ofMillis(Math.max(properties.getClient().getTimeoutMs(), 1000));
    }

    private Retry retrySpec() {
        AiProperties.Retry retry = properties.getClient().getRetry();
        int attempts = Math.max(retry.getMaxAttempts(), 0);
        Duration backoff = Duration.ofMillis(Math.max(retry.getBackoffMs(), 100));
        return Retry.backoff(attempts, backoff)
                .filter(this::isRetryableError)
                .doBeforeRetry(signal -> log.info("Retrying model call (attempt {}) after {}",
                        signal.totalRetries() + 1, signal.failure().toString()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    private String asString(Object value) {
        return value == null ? null : value.toString();
    }
}
