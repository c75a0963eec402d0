package com.openforge.llmkit.llm.openai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.llmkit.llm.AbstractLlmBackend;
import com.openforge.llmkit.llm.LlmException;
import com.openforge.llmkit.llm.LlmProperties;
import com.openforge.llmkit.llm.model.Conversation;
import com.openforge.llmkit.llm.model.Message;
import com.openforge.llmkit.llm.model.ModelReply;
import com.openforge.llmkit.llm.model.RequestedToolCall;
import com.openforge.llmkit.llm.model.Role;
import com.openforge.llmkit.tool.ToolDefinition;
import lombok.extern.slf4j.Slf4j;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Backend for the OpenAI chat-completions API and any server that speaks it.
 *
 * Tool results are replayed as two messages per call: an assistant envelope
 * echoing that single tool_call, then a "tool" message carrying the output
 * and the matching tool_call_id.
 */
@Slf4j
public class OpenAiBackend extends AbstractLlmBackend {

    public static final String NAME             = "openai";
    public static final String DEFAULT_BASE_URL = "https://api.openai.com";

    static final String CHAT_PATH       = "/v1/chat/completions";
    static final String EMBEDDINGS_PATH = "/v1/embeddings";

    public OpenAiBackend(HttpClient httpClient,
                         ObjectMapper objectMapper,
                         LlmProperties.ProviderConfig config,
                         String model) {
        super(httpClient, objectMapper, config, model, DEFAULT_BASE_URL);
    }

    @Override
    public String name() {
        return NAME;
    }

    // ── Generation / embeddings ──────────────────────────────────────────────

    @Override
    public String generate(Conversation conversation, Duration timeout) {
        String body = post(CHAT_PATH, chatRequest(conversation, List.of()), timeout);
        return decodeChatReply(body).content();
    }

    @Override
    public List<Float> embed(String input, Duration timeout) {
        String body = post(EMBEDDINGS_PATH, new OpenAiEmbeddingRequest(model, input), timeout);
        List<Float> embedding = decode(body, OpenAiEmbeddingResponse.class).firstEmbedding();
        if (embedding == null) {
            throw new LlmException.DecodeException(
                    "Backend [%s] returned no embedding data".formatted(NAME));
        }
        return List.copyOf(embedding);
    }

    // ── Provider hooks ───────────────────────────────────────────────────────

    @Override
    protected String chatPath() {
        return CHAT_PATH;
    }

    @Override
    protected Object chatRequest(Conversation conversation, List<ToolDefinition> tools) {
        return OpenAiChatRequest.of(model, conversation, tools);
    }

    @Override
    protected void authorize(HttpRequest.Builder request) {
        String apiKey = config.apiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            request.header("Authorization", "Bearer " + apiKey);
        }
    }

    @Override
    protected ModelReply decodeChatReply(String body) {
        OpenAiChatResponse.ResponseMessage message = decode(body, OpenAiChatResponse.class).firstMessage();
        if (message == null) {
            throw new LlmException.DecodeException(
                    "Backend [%s] returned no choices".formatted(NAME));
        }

        List<RequestedToolCall> calls = new ArrayList<>();
        if (message.toolCalls() != null) {
            for (OpenAiToolCall call : message.toolCalls()) {
                calls.add(toRequestedCall(call));
            }
        }
        return new ModelReply(message.content(), calls);
    }

    @Override
    protected List<Message> toolResultMessages(RequestedToolCall call, String output) {
        ObjectNode envelope = objectMapper.createObjectNode();
        ArrayNode  echoed   = envelope.putArray("tool_calls");
        ObjectNode entry    = echoed.addObject();
        entry.put("id", call.id());
        entry.put("type", call.type());
        ObjectNode function = entry.putObject("function");
        function.put("name", call.name());
        function.put("arguments", call.rawArguments());

        ObjectNode result = objectMapper.createObjectNode();
        result.put("tool_call_id", call.id());

        return List.of(
                new Message(Role.ASSISTANT, "", envelope),
                new Message(Role.TOOL, output, result));
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private RequestedToolCall toRequestedCall(OpenAiToolCall call) {
        if (call == null || call.function() == null || call.function().name() == null) {
            throw new LlmException.DecodeException(
                    "Backend [%s] returned a tool call without a function name".formatted(NAME));
        }
        JsonNode raw = call.function().arguments();
        String   rawArguments;
        JsonNode arguments;
        if (raw == null || raw.isNull()) {
            rawArguments = "{}";
            arguments    = objectMapper.createObjectNode();
        } else if (raw.isTextual()) {
            rawArguments = raw.asText();
            arguments    = parseArguments(call.function().name(), rawArguments);
        } else {
            rawArguments = raw.toString();
            arguments    = raw;
        }
        String type = call.type() == null ? "function" : call.type();
        return new RequestedToolCall(call.id(), type, call.function().name(), arguments, rawArguments);
    }

    private JsonNode parseArguments(String toolName, String rawArguments) {
        if (rawArguments.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(rawArguments);
        } catch (JsonProcessingException e) {
            log.warn("[{}] Could not parse arguments for tool '{}': {}", NAME, toolName, rawArguments);
            throw new LlmException.DecodeException(
                    "Invalid arguments for tool call '%s' from backend [%s]".formatted(toolName, NAME), e);
        }
    }
}
