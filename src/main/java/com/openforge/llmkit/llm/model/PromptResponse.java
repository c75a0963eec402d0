package com.openforge.llmkit.llm.model;

import java.util.List;

/**
 * Result of one {@code converse} call.
 *
 * Either a plain assistant reply ({@code role = ASSISTANT}, {@code content} set,
 * no tool calls) or the outcome of a tool round ({@code role = TOOL}, one
 * {@link ToolCall} per executed tool, empty content).
 */
public record PromptResponse(
        Role role,
        String content,
        List<ToolCall> toolCalls
) {

    public PromptResponse {
        content   = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static PromptResponse assistant(String content) {
        return new PromptResponse(Role.ASSISTANT, content, List.of());
    }

    public static PromptResponse toolResults(List<ToolCall> toolCalls) {
        return new PromptResponse(Role.TOOL, "", toolCalls);
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
