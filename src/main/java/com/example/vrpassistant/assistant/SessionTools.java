package com.example.vrpassistant.assistant;

import com.example.vrpassistant.analysis.AnalysisAspect;
import com.example.vrpassistant.analysis.AnalysisEngine;
import com.example.vrpassistant.analysis.AnalysisResult;
import com.example.vrpassistant.model.SessionContext;
import com.example.vrpassistant.suggestion.SuggestionEngine;
import com.example.vrpassistant.suggestion.SuggestionList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;

/**
 * Analysis tools bound to one session snapshot for the length of a conversational turn.
 */
public class SessionTools {

    private static final Logger logger = LoggerFactory.getLogger(SessionTools.class);

    private final SessionContext context;
    private final AnalysisEngine analysisEngine;
    private final SuggestionEngine suggestionEngine;

    public SessionTools(SessionContext context, AnalysisEngine analysisEngine, SuggestionEngine suggestionEngine) {
        this.context = context;
        this.analysisEngine = analysisEngine;
        this.suggestionEngine = suggestionEngine;
    }

    @Tool(description = "Analyze a specific aspect of the VRP solution (routes, utilization, constraints, efficiency)")
    public AnalysisResult analyze_solution(
            @ToolParam(description = "Aspect to analyze: routes, utilization, constraints, efficiency or overview") String aspect) {
        logger.debug("Tool analyze_solution({}) for session {}", aspect, sessionId());
        if (context == null) {
            return AnalysisResult.noSolution(AnalysisAspect.fromText(aspect));
        }
        return analysisEngine.analyze(aspect, context.getSolution(), context.getProblem());
    }

    @Tool(description = "Suggest specific improvements for the VRP solution based on current metrics")
    public SuggestionList suggest_improvements() {
        logger.debug("Tool suggest_improvements for session {}", sessionId());
        if (context == null) {
            return suggestionEngine.suggest(null, null);
        }
        return suggestionEngine.suggest(context.getSolution(), context.getProblem());
    }

    private String sessionId() {
        return context == null ? "<none>" : context.getSessionId();
    }
}
