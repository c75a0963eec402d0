package com.openforge.llmkit.llm.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A tool invocation the model asked for, together with what the tool returned.
 *
 * Lives only inside a {@link PromptResponse}; the output text itself is also
 * appended to the conversation as a tool-role message.
 */
public record ToolCall(
        String   name,
        JsonNode arguments,
        String   result
) {

    public ToolCall {
        arguments = arguments == null ? null : arguments.deepCopy();
    }
}
