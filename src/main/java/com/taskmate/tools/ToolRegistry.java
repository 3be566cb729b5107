package com.taskmate.tools;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
@Slf4j
public class ToolRegistry {
    private final Map<TaskOperation, AiTool> tools = new EnumMap<>(TaskOperation.class);

    public ToolRegistry(List<AiTool> toolBeans) {
        log.debug("Initializing ToolRegistry with {} tool bean(s)", toolBeans.size());
        for (AiTool tool : toolBeans) {
            AiTool previous = tools.putIfAbsent(tool.operation(), tool);
            if (previous != null) {
                throw new IllegalStateException("Operation " + tool.operation() + " is implemented by both "
                        + previous.getClass().getSimpleName() + " and " + tool.getClass().getSimpleName());
            }
            log.debug("Registered tool '{}' ({})", tool.name(), tool.getClass().getSimpleName());
        }
        for (TaskOperation operation : TaskOperation.values()) {
            if (!tools.containsKey(operation)) {
                throw new IllegalStateException("No tool registered for operation " + operation);
            }
        }
    }

    public Optional<AiTool> get(String name) {
        if (name == null) {
            log.debug("Tool lookup requested with null name");
            return Optional.empty();
        }
        Optional<AiTool> tool = TaskOperation.fromToolName(name).map(tools::get);
        if (tool.isEmpty()) {
            log.debug("Tool '{}' not found in registry", name);
        }
        return tool;
    }

    public Collection<AiTool> all() {
        return Collections.unmodifiableCollection(tools.values());
    }
}
