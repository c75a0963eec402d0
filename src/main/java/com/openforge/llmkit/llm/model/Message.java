package com.openforge.llmkit.llm.model;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * A single entry in the conversation history.
 *
 * {@code fields} carries provider-specific envelope data (a tool-call id,
 * the echoed tool_calls array ...) that must be sent back verbatim on the
 * next request. It is copied on the way in and on the way out, so a Message
 * is effectively immutable.
 */
public record Message(
        Role role,

        /** Text content. Empty for assistant envelopes that only carry tool_calls. */
        String content,

        ObjectNode fields
) {

    public Message {
        Objects.requireNonNull(role, "role must not be null");
        content = content == null ? "" : content;
        fields  = fields == null ? JsonNodeFactory.instance.objectNode() : fields.deepCopy();
    }

    @Override
    public ObjectNode fields() {
        return fields.deepCopy();
    }

    public boolean hasFields() {
        return !fields.isEmpty();
    }

    // ── Static factory helpers ──────────────────────────────────────────────

    public static Message of(Role role, String content) {
        return new Message(role, content, null);
    }

    public static Message system(String content) {
        return of(Role.SYSTEM, content);
    }

    public static Message user(String content) {
        return of(Role.USER, content);
    }

    public static Message assistant(String content) {
        return of(Role.ASSISTANT, content);
    }

    public static Message tool(String content) {
        return of(Role.TOOL, content);
    }
}
