package com.openforge.llmkit.llm;

import com.openforge.llmkit.llm.model.Conversation;
import com.openforge.llmkit.llm.model.PromptResponse;

import java.time.Duration;
import java.util.List;

/**
 * One LLM provider integration.
 *
 * Every call blocks the invoking thread until the backend answers, the
 * timeout elapses or the thread is interrupted. Failures surface as
 * {@link LlmException} subclasses.
 */
public interface LlmBackend {

    /** Provider identifier, e.g. "openai" or "ollama". */
    String name();

    /** Model used for every call made through this backend. */
    String model();

    /**
     * Single-shot completion over the conversation's messages. Tools are never
     * offered and the conversation is left untouched.
     */
    String generate(Conversation conversation, Duration timeout);

    /**
     * Tool-aware turn. Appends the assistant reply, or the tool results of
     * every tool call the model made, to the conversation.
     */
    PromptResponse converse(Conversation conversation, Duration timeout);

    List<Float> embed(String input, Duration timeout);

    Duration defaultTimeout();

    default String generate(Conversation conversation) {
        return generate(conversation, defaultTimeout());
    }

    default PromptResponse converse(Conversation conversation) {
        return converse(conversation, defaultTimeout());
    }

    default List<Float> embed(String input) {
        return embed(input, defaultTimeout());
    }
}
