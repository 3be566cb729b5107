package com.taskmate.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskmate.session.ClientConnection;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** In-memory connection that records every frame it was sent. */
public final class RecordingConnection implements ClientConnection {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String id;
    private final List<String> frames = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;
    private volatile boolean failSends;

    public RecordingConnection(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void send(String payload) throws IOException {
        if (failSends) {
            throw new IOException("broken pipe");
        }
        frames.add(payload);
    }

    @Override
    public void close() {
        open = false;
    }

    public void failSends() {
        this.failSends = true;
    }

    public List<String> frames() {
        return List.copyOf(frames);
    }

    public List<JsonNode> events() {
        return frames.stream().map(RecordingConnection::read).toList();
    }

    public List<String> eventTypes() {
        return events().stream().map(node -> node.path("type").asText()).toList();
    }

    private static JsonNode read(String frame) {
        try {
            return MAPPER.readTree(frame);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
