package com.example.vrpassistant.suggestion;

import com.example.vrpassistant.analysis.AnalysisEngine;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SuggestionList {
    boolean solutionAvailable;
    String message;
    @Singular
    List<Suggestion> suggestions;

    public int getTotalFound() {
        return suggestions.size();
    }

    static SuggestionList noSolution() {
        return SuggestionList.builder()
                .solutionAvailable(false)
                .message(AnalysisEngine.NO_SOLUTION_MESSAGE)
                .build();
    }
}
