package com.taskmate.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "taskmate")
public class TaskMateProperties {

    private Store store = new Store();
    private WebSocket websocket = new WebSocket();

    @Data
    public static class Store {
        /** {@code in-memory} or {@code database}. */
        private String storage = "in-memory";
    }

    @Data
    public static class WebSocket {
        private String path = "/ws/chat";
        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000"));
        private int sendTimeLimitMs = 10_000;
        private int bufferSizeLimit = 512 * 1024;
    }
}
