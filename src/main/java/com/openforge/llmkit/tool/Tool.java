package com.openforge.llmkit.tool;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;

import java.util.Objects;

/**
 * A named, schema-described function the model may ask to invoke.
 *
 * @param name        unique key inside a {@link ToolRegistry}
 * @param description the primary signal the model uses to decide when to call the tool
 * @param parameters  JSON Schema of the arguments object
 * @param executor    the code that runs when the model calls the tool
 */
@Builder
public record Tool(
        String name,
        String description,
        JsonNode parameters,
        ToolExecutor executor
) {

    public Tool {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(executor, "executor must not be null");
        parameters = parameters == null ? null : parameters.deepCopy();
    }

    /** The provider-agnostic descriptor sent in the request's "tools" array. */
    public ToolDefinition toDefinition() {
        return ToolDefinition.ofFunction(new ToolFunction(name, description, parameters));
    }
}
