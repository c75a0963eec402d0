package com.openforge.llmkit.llm;

import lombok.Getter;

/**
 * Base of every failure surfaced by an {@link LlmBackend} call.
 *
 * Callers treat any LlmException as "this turn failed" and may retry the
 * whole call themselves; backends never back off or retry on their own,
 * apart from the single no-tools retry after an unknown tool call.
 */
public class LlmException extends RuntimeException {

    public LlmException(String message) { super(message); }

    public LlmException(String message, Throwable cause) { super(message, cause); }

    // ── Local failures before any response ──────────────────────────────────

    /** The request body could not be serialized. */
    public static class RequestMarshalException extends LlmException {
        public RequestMarshalException(String message, Throwable cause) { super(message, cause); }
    }

    /** Connection failure, timeout or interruption while talking to the backend. */
    public static class TransportException extends LlmException {
        public TransportException(String message, Throwable cause) { super(message, cause); }
    }

    // ── Backend replied, but not with something usable ──────────────────────

    /** Non-2xx HTTP status. */
    @Getter
    public static class BackendHttpException extends LlmException {
        private final int    status;
        private final String body;

        public BackendHttpException(String backend, int status, String body) {
            super("Backend [%s] returned HTTP %d: %s".formatted(backend, status, body));
            this.status = status;
            this.body   = body;
        }
    }

    /** HTTP 429. */
    public static class RateLimitException extends BackendHttpException {
        public RateLimitException(String backend, String body) {
            super(backend, 429, body);
        }
    }

    /** Malformed JSON or a JSON document of an unexpected shape. */
    public static class DecodeException extends LlmException {
        public DecodeException(String message) { super(message); }
        public DecodeException(String message, Throwable cause) { super(message, cause); }
    }

    // ── Tool round failures ─────────────────────────────────────────────────

    /** The model asked for a tool that is not registered, and the no-tools retry did not help. */
    @Getter
    public static class UnknownToolException extends LlmException {
        private final String toolName;

        public UnknownToolException(String toolName, Throwable cause) {
            super("Model requested unknown tool: " + toolName, cause);
            this.toolName = toolName;
        }
    }

    /** A registered tool failed; the cause is the tool's own exception. */
    @Getter
    public static class ToolExecutionException extends LlmException {
        private final String toolName;

        public ToolExecutionException(String toolName, Throwable cause) {
            super("Tool '%s' failed: %s".formatted(toolName, cause.getMessage()), cause);
            this.toolName = toolName;
        }
    }
}
