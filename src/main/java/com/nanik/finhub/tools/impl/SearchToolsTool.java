package com.nanik.finhub.tools.impl;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.nanik.finhub.Hub;
import com.nanik.finhub.catalog.ToolDescriptor;
import com.nanik.finhub.protocol.McpRequest;
import com.nanik.finhub.tools.SchemaBuilder;
import com.nanik.finhub.tools.ToolDefinition;
import com.nanik.finhub.tools.ToolHandler;
import com.nanik.finhub.tools.ToolResult;

import java.util.*;

/**
 * Keyword search over the tools currently offered by healthy instances.
 *
 * Scoring: query equals the tool id 10, tool id contains the query 5; then per
 * query word, 3 for an exact word of the description, otherwise 1 if the word
 * occurs anywhere in the id or description. Only the best 10 matches are returned.
 */
public class SearchToolsTool implements ToolHandler {

    static final int MAX_RESULTS = 10;

    private static final ToolDefinition DEFINITION = new ToolDefinition(
            "hub_search_tools",
            "Search the available worker tools by keyword, best matches first.",
            new SchemaBuilder()
                    .addString("query", "Keywords to look for in tool names and descriptions", true)
                    .build());

    private final Hub hub;

    public SearchToolsTool(Hub hub) {
        this.hub = hub;
    }

    @Override
    public ToolDefinition getDefinition() {
        return DEFINITION;
    }

    @Override
    public ToolResult execute(McpRequest request) {
        String query = request.requireStringParam("query");

        List<Match> matches = new ArrayList<>();
        for (ToolDescriptor tool : hub.getCatalog().discoverableTools()) {
            int relevance = relevance(query, tool.getToolId(), tool.getDescription());
            if (relevance > 0) {
                matches.add(new Match(tool, relevance));
            }
        }
        matches.sort(Comparator.comparingInt((Match m) -> m.relevance).reversed()
                .thenComparing(m -> m.tool.getToolId()));

        JsonArray top = new JsonArray();
        for (Match match : matches.subList(0, Math.min(MAX_RESULTS, matches.size()))) {
            JsonObject obj = new JsonObject();
            obj.addProperty("name", match.tool.getToolId());
            obj.addProperty("description", match.tool.getDescription());
            obj.addProperty("relevance", match.relevance);
            top.add(obj);
        }

        JsonObject result = new JsonObject();
        result.addProperty("query", query);
        result.addProperty("total_matches", matches.size());
        result.add("matching_tools", top);
        return ToolResult.json(result);
    }

    static int relevance(String query, String name, String description) {
        String q = query.trim().toLowerCase(Locale.ROOT);
        String n = name.toLowerCase(Locale.ROOT);
        String d = description == null ? "" : description.toLowerCase(Locale.ROOT);

        int score = 0;
        if (n.equals(q)) {
            score += 10;
        } else if (n.contains(q)) {
            score += 5;
        }

        Set<String> descriptionWords = new HashSet<>(Arrays.asList(d.split("[^a-z0-9_]+")));
        for (String word : q.split("\\s+")) {
            if (word.isEmpty()) {
                continue;
            }
            if (descriptionWords.contains(word)) {
                score += 3;
            } else if (n.contains(word) || d.contains(word)) {
                score += 1;
            }
        }
        return score;
    }

    private static final class Match {
        final ToolDescriptor tool;
        final int relevance;

        Match(ToolDescriptor tool, int relevance) {
            this.tool = tool;
            this.relevance = relevance;
        }
    }
}
