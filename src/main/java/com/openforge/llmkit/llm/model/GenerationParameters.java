package com.openforge.llmkit.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

/**
 * Sampling settings for a completion. Every field is optional; a null value
 * is left out of the request so the provider applies its own default.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GenerationParameters(
        Integer maxTokens,
        Double  temperature,
        Double  topP,
        Double  frequencyPenalty,
        Double  presencePenalty
) {

    private static final GenerationParameters DEFAULTS =
            new GenerationParameters(null, null, null, null, null);

    public static GenerationParameters defaults() {
        return DEFAULTS;
    }

    public boolean isEmpty() {
        return maxTokens == null && temperature == null && topP == null
                && frequencyPenalty == null && presencePenalty == null;
    }
}
