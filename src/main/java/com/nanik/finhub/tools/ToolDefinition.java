package com.nanik.finhub.tools;

import com.google.gson.JsonObject;
import com.nanik.finhub.catalog.ToolDescriptor;

/**
 * Definition of a tool as advertised in {@code tools/list}.
 *
 * MCP tool definition structure:
 * {
 *   "name": "stock_quote",
 *   "description": "Get real-time stock quote data",
 *   "inputSchema": {
 *     "type": "object",
 *     "properties": {
 *       "symbol": {"type": "string", "description": "..."}
 *     },
 *     "required": ["symbol"]
 *   }
 * }
 */
public class ToolDefinition {

    private final String name;
    private final String description;
    private final JsonObject inputSchema;

    public ToolDefinition(String name, String description, JsonObject inputSchema) {
        this.name = name;
        this.description = description;
        this.inputSchema = inputSchema;
    }

    /**
     * Create a tool definition with no parameters.
     */
    public static ToolDefinition noParams(String name, String description) {
        return new ToolDefinition(name, description, new SchemaBuilder().build());
    }

    /**
     * Advertise a worker tool under its tool id.
     */
    public static ToolDefinition of(ToolDescriptor descriptor) {
        JsonObject schema = descriptor.getInputSchema() != null
                ? descriptor.getInputSchema()
                : new SchemaBuilder().build();
        return new ToolDefinition(descriptor.getToolId(), descriptor.getDescription(), schema);
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public JsonObject getInputSchema() {
        return inputSchema;
    }

    /**
     * MCP wire form.
     */
    public JsonObject toJson() {
        JsonObject toolObj = new JsonObject();
        toolObj.addProperty("name", name);
        toolObj.addProperty("description", description);
        toolObj.add("inputSchema", inputSchema);
        return toolObj;
    }
}
