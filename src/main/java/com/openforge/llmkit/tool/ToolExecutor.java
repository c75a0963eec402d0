package com.openforge.llmkit.tool;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The callable behind a {@link Tool}.
 *
 * Receives the arguments the model produced (a JSON object) and returns the raw
 * text that is fed back into the conversation as the tool's output.
 */
@FunctionalInterface
public interface ToolExecutor {

    String execute(JsonNode arguments) throws ToolException;
}
