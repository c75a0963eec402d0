package com.openforge.llmkit.tool;

/**
 * Raised by a tool implementation when its own logic fails
 * (bad arguments, upstream API down, unknown entity ...).
 */
public class ToolException extends Exception {

    public ToolException(String message) { super(message); }

    public ToolException(String message, Throwable cause) { super(message, cause); }
}
