package com.taskmate.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Tag(name = "Health")
@RestController
@Slf4j
public class HealthController {

    @Operation(summary = "Liveness probe", description = "Always reports healthy while the server accepts requests.")
    @GetMapping("/health")
    public Map<String, String> health() {
        log.trace("Handling /health");
        return Map.of("status", "healthy");
    }
}
