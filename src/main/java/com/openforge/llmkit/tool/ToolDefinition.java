package com.openforge.llmkit.tool;

/**
 * One entry in the "tools" array of an outgoing chat request.
 *
 * Wire format (shared by OpenAI and Ollama):
 * {
 *   "type": "function",
 *   "function": { "name": "...", "description": "...", "parameters": { ... } }
 * }
 */
public record ToolDefinition(
        String type,
        ToolFunction function
) {
    /** Both providers only know the "function" type. */
    public static ToolDefinition ofFunction(ToolFunction function) {
        return new ToolDefinition("function", function);
    }
}
