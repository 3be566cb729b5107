package com.taskmate.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Model selection and orchestration limits.
 *
 * <p>{@link #mode} picks which Spring AI {@code ChatModel} backs the assistant. The provider
 * specific settings (keys, base URLs) stay under {@code spring.ai.openai.*} and
 * {@code spring.ai.ollama.*}.</p>
 */
@Data
@ConfigurationProperties(prefix = "ai")
public class AiProperties {

    public enum Mode {
        OPENAI, OLLAMA
    }

    private Mode mode = Mode.OPENAI;

    private String model = "gpt-4o-mini";
    private Double temperature = 0.1;

    private Tools tools = new Tools();
    private Memory memory = new Memory();
    private Client client = new Client();

    @Data
    public static class Tools {
        /** Model calls allowed per turn before the turn is cut short. */
        private int maxLoops = 6;
    }

    @Data
    public static class Memory {
        private boolean enabled = true;
        private int maxMessages = 12;
    }

    @Data
    public static class Client {
        private long timeoutMs = 60_000;
        private Retry retry = new Retry();
    }

    @Data
    public static class Retry {
        private int maxAttempts = 2;
        private long backoffMs = 300;
    }
}
