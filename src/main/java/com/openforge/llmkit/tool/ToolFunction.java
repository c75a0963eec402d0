package com.openforge.llmkit.tool;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * The "function" sub-object inside a tool definition.
 *
 * "parameters" is typed as JsonNode so that the JSON Schema a tool was
 * registered with is re-serialized verbatim.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolFunction(
        String name,
        String description,
        JsonNode parameters
) {}
