package com.nanik.finhub.tools;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Represents the result of a tool execution.
 *
 * MCP tool results have this structure:
 * {
 *   "content": [
 *     {"type": "text", "text": "..."}
 *   ],
 *   "isError": false
 * }
 */
public class ToolResult {

    private static final Gson PRETTY = new GsonBuilder().setPrettyPrinting().create();

    private final List<Content> content;
    private final boolean isError;

    private ToolResult(List<Content> content, boolean isError) {
        this.content = content;
        this.isError = isError;
    }

    /**
     * Create a success result with text content.
     */
    public static ToolResult success(String text) {
        List<Content> content = new ArrayList<>();
        content.add(new Content("text", text));
        return new ToolResult(content, false);
    }

    /**
     * Create a success result holding a JSON document as pretty-printed text.
     */
    public static ToolResult json(JsonElement payload) {
        return success(PRETTY.toJson(payload));
    }

    /**
     * Create an error result.
     */
    public static ToolResult error(String errorMessage) {
        List<Content> content = new ArrayList<>();
        content.add(new Content("text", errorMessage));
        return new ToolResult(content, true);
    }

    /**
     * Wrap a worker's reply. A reply that already carries MCP {@code content}
     * is passed through, any other payload is rendered as JSON text.
     */
    public static ToolResult fromWorker(JsonElement output) {
        if (output != null && output.isJsonObject() && output.getAsJsonObject().has("content")
                && output.getAsJsonObject().get("content").isJsonArray()) {
            List<Content> content = new ArrayList<>();
            for (JsonElement item : output.getAsJsonObject().getAsJsonArray("content")) {
                if (item.isJsonObject() && item.getAsJsonObject().has("text")) {
                    JsonObject obj = item.getAsJsonObject();
                    String type = obj.has("type") ? obj.get("type").getAsString() : "text";
                    content.add(new Content(type, obj.get("text").getAsString()));
                }
            }
            return new ToolResult(content, false);
        }
        return output == null ? success("null") : json(output);
    }

    public List<Content> getContent() {
        return content;
    }

    public boolean isError() {
        return isError;
    }

    /**
     * MCP wire form.
     */
    public JsonObject toJson() {
        JsonObject resultObj = new JsonObject();
        JsonArray contentArray = new JsonArray();
        for (Content item : content) {
            JsonObject contentObj = new JsonObject();
            contentObj.addProperty("type", item.getType());
            contentObj.addProperty("text", item.getText());
            contentArray.add(contentObj);
        }
        resultObj.add("content", contentArray);
        if (isError) {
            resultObj.addProperty("isError", true);
        }
        return resultObj;
    }

    /**
     * Content item in a tool result.
     */
    public static class Content {
        private final String type;
        private final String text;

        public Content(String type, String text) {
            this.type = type;
            this.text = text;
        }

        public String getType() {
            return type;
        }

        public String getText() {
            return text;
        }
    }
}
