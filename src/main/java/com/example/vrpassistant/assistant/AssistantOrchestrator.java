package com.example.vrpassistant.assistant;

import com.example.vrpassistant.analysis.AnalysisEngine;
import com.example.vrpassistant.context.ContextStore;
import com.example.vrpassistant.model.SessionContext;
import com.example.vrpassistant.suggestion.SuggestionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Runs one conversational turn: looks up the session context, prepends it to the user's
 * message and hands both to the agent together with session-bound analysis tools.
 */
@Service
public class AssistantOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(AssistantOrchestrator.class);

    private final ContextStore contextStore;
    private final VrpContextFormatter formatter;
    private final AnalysisEngine analysisEngine;
    private final SuggestionEngine suggestionEngine;
    private final AssistantAgent agent;

    public AssistantOrchestrator(ContextStore contextStore, VrpContextFormatter formatter,
                                 AnalysisEngine analysisEngine, SuggestionEngine suggestionEngine,
                                 AssistantAgent agent) {
        this.contextStore = contextStore;
        this.formatter = formatter;
        this.analysisEngine = analysisEngine;
        this.suggestionEngine = suggestionEngine;
        this.agent = agent;
    }

    public Flux<String> respond(String sessionId, String userMessage) {
        return Mono.fromCallable(() -> lookup(sessionId))
                .flatMapMany(context -> {
                    SessionContext snapshot = context.orElse(null);
                    String input = snapshot == null
                            ? userMessage
                            : formatter.format(snapshot) + "\n\nUser: " + userMessage;
                    SessionTools tools = new SessionTools(snapshot, analysisEngine, suggestionEngine);
                    return agent.stream(AssistantInstructions.SYSTEM_PROMPT, input, tools);
                });
    }

    private Optional<SessionContext> lookup(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            logger.warn("Assistant turn without session id, answering without VRP context");
            return Optional.empty();
        }
        Optional<SessionContext> context = contextStore.get(sessionId);
        if (context.isEmpty()) {
            logger.warn("No VRP context for session {}, answering without it", sessionId);
        } else {
            logger.info("Injecting VRP context for session {} (solution={})", sessionId, context.get().hasSolution());
        }
        return context;
    }
}
