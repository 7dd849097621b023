package com.example.vrpassistant.assistant;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

@Component
public class ChatClientAssistantAgent implements AssistantAgent {

    private final ChatClient chatClient;

    public ChatClientAssistantAgent(ChatClient.Builder chatClientBuilder) {
        this.chatClient = chatClientBuilder.build();
    }

    @Override
    public Flux<String> stream(String systemPrompt, String userInput, Object... tools) {
        return chatClient.prompt()
                .system(systemPrompt)
                .user(userInput)
                .tools(tools)
                .stream()
                .content();
    }
}
