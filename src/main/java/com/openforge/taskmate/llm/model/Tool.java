package com.openforge.taskmate.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Entry of the "tools" array:
 * {"type":"function","function":{"name":..,"description":..,"parameters":{..}}}
 *
 * parameters is a JSON Schema object passed through verbatim.
 */
public record Tool(
        String type,
        Definition function
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Definition(String name, String description, JsonNode parameters) {}

    public static Tool function(String name, String description, JsonNode parameters) {
        return new Tool("function", new Definition(name, description, parameters));
    }
}
