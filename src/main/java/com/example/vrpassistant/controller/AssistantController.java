package com.example.vrpassistant.controller;

import com.example.vrpassistant.assistant.AssistantOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/assistant")
public class AssistantController {

    private static final Logger logger = LoggerFactory.getLogger(AssistantController.class);

    private final AssistantOrchestrator orchestrator;

    public AssistantController(AssistantOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping(value = "/chat", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<String>> chat(@RequestBody ChatRequest request) {
        if (request.getMessage() == null || request.getMessage().isBlank()) {
            return Flux.just(event("error", "{\"error\":\"message is required\",\"type\":\"validation\"}"));
        }

        return orchestrator.respond(request.getSessionId(), request.getMessage())
                .map(chunk -> event("message", chunk))
                .concatWith(Flux.just(event("done", "{\"status\":\"complete\"}")))
                .onErrorResume(throwable -> {
                    logger.error("Assistant turn failed for session {}", request.getSessionId(), throwable);
                    return Flux.just(event("error", "{\"error\":\"Assistant unavailable\",\"type\":\"server\"}"));
                });
    }

    @GetMapping("/tools")
    public Map<String, Object> tools() {
        return Map.of("tools", List.of(
                Map.of("name", "analyze_solution",
                        "description", "Analyze a specific aspect of the VRP solution (routes, utilization, constraints, efficiency)"),
                Map.of("name", "suggest_improvements",
                        "description", "Suggest specific improvements for the VRP solution based on current metrics")
        ));
    }

    private static ServerSentEvent<String> event(String name, String data) {
        return ServerSentEvent.<String>builder()
                .event(name)
                .data(data)
                .build();
    }
}
