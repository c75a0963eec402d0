package com.openforge.llmkit.llm.ollama;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.openforge.llmkit.llm.model.GenerationParameters;

/**
 * Sampling options, sent as the "options" object of /api/chat and /api/generate.
 * Ollama calls the token limit "num_predict".
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OllamaOptions(
        @JsonProperty("num_predict")       Integer numPredict,
        @JsonProperty("temperature")       Double temperature,
        @JsonProperty("top_p")             Double topP,
        @JsonProperty("frequency_penalty") Double frequencyPenalty,
        @JsonProperty("presence_penalty")  Double presencePenalty
) {

    /** Null when no parameter is set, so the whole object is left out. */
    public static OllamaOptions from(GenerationParameters params) {
        if (params == null || params.isEmpty()) {
            return null;
        }
        return new OllamaOptions(
                params.maxTokens(),
                params.temperature(),
                params.topP(),
                params.frequencyPenalty(),
                params.presencePenalty());
    }
}
