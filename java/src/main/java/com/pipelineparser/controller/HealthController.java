package com.pipelineparser.controller;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Health check endpoints.
 */
@RestController
@RequestMapping
public class HealthController {

    @Value("${spring.application.name:pipeline-parser}")
    private String serviceName;

    @Value("${pipeline.version:1.0.0}")
    private String version;

    @GetMapping("/")
    public Mono<Map<String, String>> root() {
        return Mono.just(Map.of("Ping", "Pong"));
    }

    @GetMapping("/health")
    public Mono<Map<String, String>> health() {
        return Mono.just(Map.of(
            "status", "healthy",
            "service", serviceName,
            "version", version
        ));
    }
}
