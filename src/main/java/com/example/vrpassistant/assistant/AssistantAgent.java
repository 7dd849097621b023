package com.example.vrpassistant.assistant;

import reactor.core.publisher.Flux;

/**
 * The conversational runtime that turns context plus user input into streamed text.
 * Tool objects carry {@code @Tool}-annotated methods the agent may call while answering.
 */
public interface AssistantAgent {
    Flux<String> stream(String systemPrompt, String userInput, Object... tools);
}
