package com.openforge.llmkit.llm.openai;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.llmkit.llm.model.Conversation;
import com.openforge.llmkit.llm.model.GenerationParameters;
import com.openforge.llmkit.tool.ToolDefinition;
import lombok.Builder;

import java.util.List;

/**
 * The request body sent to POST /v1/chat/completions.
 *
 * "tools" is omitted entirely when empty: the API rejects an empty array.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OpenAiChatRequest(
        String model,
        List<ObjectNode> messages,
        List<ToolDefinition> tools,
        Boolean stream,
        Integer maxTokens,
        Double temperature,
        Double topP,
        Double frequencyPenalty,
        Double presencePenalty
) {

    public static OpenAiChatRequest of(String model, Conversation conversation, List<ToolDefinition> tools) {
        GenerationParameters params = conversation.parameters();
        return OpenAiChatRequest.builder()
                .model(model)
                .messages(conversation.toWireMessages())
                .tools(tools == null || tools.isEmpty() ? null : tools)
                .stream(false)
                .maxTokens(params.maxTokens())
                .temperature(params.temperature())
                .topP(params.topP())
                .frequencyPenalty(params.frequencyPenalty())
                .presencePenalty(params.presencePenalty())
                .build();
    }
}
