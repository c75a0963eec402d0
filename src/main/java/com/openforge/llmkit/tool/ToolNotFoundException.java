package com.openforge.llmkit.tool;

import lombok.Getter;

/**
 * The requested tool name is not registered.
 */
@Getter
public class ToolNotFoundException extends ToolException {

    private final String toolName;

    public ToolNotFoundException(String toolName) {
        super("tool not found: " + toolName);
        this.toolName = toolName;
    }
}
