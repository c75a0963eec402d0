package com.openforge.llmkit.llm.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A tool call as the model emitted it, before execution.
 *
 * @param id           provider-assigned call id (OpenAI); null for providers that have none
 * @param type         call type, "function" in practice
 * @param name         requested tool name
 * @param arguments    decoded arguments object
 * @param rawArguments the arguments exactly as received, echoed back in envelopes
 */
public record RequestedToolCall(
        String   id,
        String   type,
        String   name,
        JsonNode arguments,
        String   rawArguments
) {}
