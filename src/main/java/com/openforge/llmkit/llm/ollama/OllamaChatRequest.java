package com.openforge.llmkit.llm.ollama;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.llmkit.tool.ToolDefinition;

import java.util.List;

/**
 * Request body for POST /api/chat.
 *
 * {
 *   "model": "qwen2.5",
 *   "messages": [ { "role": "user", "content": "..." } ],
 *   "tools": [ { "type": "function", "function": { ... } } ],
 *   "stream": false,
 *   "options": { "temperature": 0.2 }
 * }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OllamaChatRequest(
        String model,
        List<ObjectNode> messages,
        List<ToolDefinition> tools,
        boolean stream,
        OllamaOptions options
) {}
