package com.nanik.finhub.tools;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * Helper class for building JSON Schema objects for tool input definitions.
 */
public class SchemaBuilder {

    private final JsonObject schema;
    private final JsonObject properties;
    private final JsonArray required;

    public SchemaBuilder() {
        this.schema = new JsonObject();
        this.properties = new JsonObject();
        this.required = new JsonArray();

        schema.addProperty("type", "object");
        schema.add("properties", properties);
    }

    /**
     * Add a string property.
     */
    public SchemaBuilder addString(String name, String description, boolean isRequired) {
        return addProperty(name, "string", description, isRequired);
    }

    /**
     * Add an integer property.
     */
    public SchemaBuilder addInteger(String name, String description, boolean isRequired) {
        return addProperty(name, "integer", description, isRequired);
    }

    /**
     * Add an integer property with default value.
     */
    public SchemaBuilder addInteger(String name, String description, boolean isRequired, int defaultValue) {
        addProperty(name, "integer", description, isRequired);
        properties.getAsJsonObject(name).addProperty("default", defaultValue);
        return this;
    }

    public SchemaBuilder addBoolean(String name, String description, boolean isRequired) {
        return addProperty(name, "boolean", description, isRequired);
    }

    /**
     * Add an array property whose items follow the given schema.
     */
    public SchemaBuilder addArray(String name, String description, JsonObject itemSchema, boolean isRequired) {
        addProperty(name, "array", description, isRequired);
        properties.getAsJsonObject(name).add("items", itemSchema);
        return this;
    }

    private SchemaBuilder addProperty(String name, String type, String description, boolean isRequired) {
        JsonObject prop = new JsonObject();
        prop.addProperty("type", type);
        prop.addProperty("description", description);
        properties.add(name, prop);

        if (isRequired) {
            required.add(name);
        }
        return this;
    }

    /**
     * Build the final schema.
     */
    public JsonObject build() {
        if (required.size() > 0) {
            schema.add("required", required);
        }
        return schema;
    }
}
