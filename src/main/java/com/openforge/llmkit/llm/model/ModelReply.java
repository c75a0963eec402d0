package com.openforge.llmkit.llm.model;

import java.util.List;

/**
 * Provider-neutral view of a decoded chat response: the assistant text plus
 * any tool calls the model asked for.
 */
public record ModelReply(
        String content,
        List<RequestedToolCall> toolCalls
) {

    public ModelReply {
        content   = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
