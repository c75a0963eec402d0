package com.openforge.llmkit.llm.model;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.llmkit.tool.ToolRegistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One logical dialogue: the ordered message log, the generation parameters
 * and the tools the model may call.
 *
 * Messages are only ever appended. The message list is not synchronized; a
 * conversation must not be driven by two backend calls at the same time.
 * The {@link ToolRegistry} is the only part designed for concurrent use.
 */
public class Conversation {

    private final List<Message>  messages = new ArrayList<>();
    private final ToolRegistry   tools;
    private GenerationParameters parameters = GenerationParameters.defaults();

    public Conversation() {
        this(new ToolRegistry());
    }

    public Conversation(ToolRegistry tools) {
        this.tools = Objects.requireNonNull(tools, "tools must not be null");
    }

    // ── Mutation ─────────────────────────────────────────────────────────────

    public Conversation addMessage(Role role, String content) {
        messages.add(Message.of(role, content));
        return this;
    }

    /** Appends a message that may carry provider envelope fields. */
    public Conversation appendMessage(Message message) {
        messages.add(Objects.requireNonNull(message, "message must not be null"));
        return this;
    }

    public Conversation setParameters(GenerationParameters parameters) {
        this.parameters = parameters == null ? GenerationParameters.defaults() : parameters;
        return this;
    }

    // ── Accessors ────────────────────────────────────────────────────────────

    public List<Message> messages() {
        return Collections.unmodifiableList(messages);
    }

    public int size() {
        return messages.size();
    }

    public Message lastMessage() {
        if (messages.isEmpty()) {
            throw new IllegalStateException("Conversation has no messages");
        }
        return messages.get(messages.size() - 1);
    }

    public GenerationParameters parameters() {
        return parameters;
    }

    public ToolRegistry tools() {
        return tools;
    }

    // ── Wire view ────────────────────────────────────────────────────────────

    /**
     * Flattens every message into {@code {role, content, ...fields}}.
     * Envelope fields are written last; by construction they never reuse the
     * "role" or "content" keys.
     */
    public List<ObjectNode> toWireMessages() {
        List<ObjectNode> wire = new ArrayList<>(messages.size());
        for (Message message : messages) {
            ObjectNode node = JsonNodeFactory.instance.objectNode();
            node.put("role", message.role().wireName());
            node.put("content", message.content());
            node.setAll(message.fields());
            wire.add(node);
        }
        return wire;
    }
}
