package com.example.vrpassistant.mcp;

import com.example.vrpassistant.analysis.AnalysisEngine;
import com.example.vrpassistant.assistant.SessionTools;
import com.example.vrpassistant.context.ContextStore;
import com.example.vrpassistant.model.SessionContext;
import com.example.vrpassistant.suggestion.SuggestionEngine;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Session-addressed analysis tools for external MCP clients.
 */
@Service
public class VrpTools {

    private final ContextStore contextStore;
    private final AnalysisEngine analysisEngine;
    private final SuggestionEngine suggestionEngine;

    public VrpTools(ContextStore contextStore, AnalysisEngine analysisEngine, SuggestionEngine suggestionEngine) {
        this.contextStore = contextStore;
        this.analysisEngine = analysisEngine;
        this.suggestionEngine = suggestionEngine;
    }

    @Tool(description = "Analyze a specific aspect (routes, utilization, constraints, efficiency) of a session's VRP solution")
    public Object analyze_solution(@ToolParam(description = "Session ID") String sessionId,
                                   @ToolParam(description = "Aspect to analyze") String aspect) {
        return toolsFor(sessionId)
                .<Object>map(tools -> tools.analyze_solution(aspect))
                .orElseGet(() -> noContext(sessionId));
    }

    @Tool(description = "Suggest improvements for a session's VRP solution")
    public Object suggest_improvements(@ToolParam(description = "Session ID") String sessionId) {
        return toolsFor(sessionId)
                .<Object>map(SessionTools::suggest_improvements)
                .orElseGet(() -> noContext(sessionId));
    }

    @Tool(description = "List session IDs that currently hold VRP context")
    public Map<String, Object> list_sessions() {
        List<String> sessions = contextStore.listSessions();
        return Map.of("sessions", sessions, "count", sessions.size());
    }

    @Tool(description = "Get a summary of the VRP context stored for a session")
    public Map<String, Object> get_session_context(@ToolParam(description = "Session ID") String sessionId) {
        Optional<SessionContext> context = contextStore.get(sessionId);
        if (context.isEmpty()) {
            return noContext(sessionId);
        }
        SessionContext ctx = context.get();
        Map<String, Object> result = new HashMap<>();
        result.put("sessionId", ctx.getSessionId());
        result.put("jobs", ctx.getProblem().getJobs().size());
        result.put("resources", ctx.getProblem().getResources().size());
        result.put("hasSolution", ctx.hasSolution());
        result.put("updatedAt", ctx.getUpdatedAt().toString());
        ctx.solution().ifPresent(solution -> {
            result.put("trips", solution.getTrips().size());
            result.put("unserved", solution.getUnserved().size());
        });
        return result;
    }

    private Optional<SessionTools> toolsFor(String sessionId) {
        return contextStore.get(sessionId)
                .map(ctx -> new SessionTools(ctx, analysisEngine, suggestionEngine));
    }

    private static Map<String, Object> noContext(String sessionId) {
        return Map.of(
                "error", "No VRP context for session " + sessionId,
                "suggestion", "Please solve a VRP problem first");
    }
}
