package com.example.vrpassistant.mcp;

import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
public class CapabilitiesTools {

    static final List<String> TOOL_NAMES = List.of(
            "analyze_solution", "suggest_improvements", "list_sessions", "get_session_context", "capabilities_list");

    @Tool(description = "List available tool names and counts for introspection")
    public Map<String, Object> capabilities_list() {
        return Map.of(
                "server", Map.of("name", "vrp-assistant", "version", "0.1.0"),
                "tools", TOOL_NAMES,
                "count", TOOL_NAMES.size()
        );
    }
}
