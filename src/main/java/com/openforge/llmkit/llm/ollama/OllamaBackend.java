package com.openforge.llmkit.llm.ollama;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Backend for a local Ollama server.
 *
 * Ollama tool calls carry no id. Each executed call is replayed as an
 * assistant message echoing the call, followed by a "tool" message with the
 * output.
 */
public class OllamaBackend extends AbstractLlmBackend {

    public static final String NAME             = "ollama";
    public static final String DEFAULT_BASE_URL = "http://localhost:11434";

    static final String CHAT_PATH       = "/api/chat";
    static final String GENERATE_PATH   = "/api/generate";
    static final String EMBEDDINGS_PATH = "/api/embeddings";

    public OllamaBackend(HttpClient httpClient,
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

    /**
     * Flattens the conversation into one prompt, a "role: content" line per
     * message, and calls /api/generate.
     */
    @Override
    public String generate(Conversation conversation, Duration timeout) {
        StringBuilder prompt = new StringBuilder();
        for (Message message : conversation.messages()) {
            prompt.append(message.role().wireName())
                  .append(": ")
                  .append(message.content())
                  .append('\n');
        }

        OllamaGenerateRequest request = new OllamaGenerateRequest(
                model, prompt.toString(), false, OllamaOptions.from(conversation.parameters()));
        OllamaResponse response = decode(post(GENERATE_PATH, request, timeout), OllamaResponse.class);
        if (response.response() == null) {
            throw new LlmException.DecodeException(
                    "Backend [%s] returned no \"response\" field".formatted(NAME));
        }
        return response.response();
    }

    @Override
    public List<Float> embed(String input, Duration timeout) {
        String body = post(EMBEDDINGS_PATH, new OllamaEmbeddingRequest(model, input), timeout);
        OllamaEmbeddingResponse response = decode(body, OllamaEmbeddingResponse.class);
        if (response.embedding() == null) {
            throw new LlmException.DecodeException(
                    "Backend [%s] returned no embedding".formatted(NAME));
        }
        return List.copyOf(response.embedding());
    }

    // ── Provider hooks ───────────────────────────────────────────────────────

    @Override
    protected String chatPath() {
        return CHAT_PATH;
    }

    @Override
    protected Object chatRequest(Conversation conversation, List<ToolDefinition> tools) {
        return new OllamaChatRequest(
                model,
                conversation.toWireMessages(),
                tools.isEmpty() ? null : tools,
                false,
                OllamaOptions.from(conversation.parameters()));
    }

    @Override
    protected ModelReply decodeChatReply(String body) {
        OllamaResponse response = decode(body, OllamaResponse.class);
        OllamaResponse.ResponseMessage message = response.message();
        if (message == null) {
            throw new LlmException.DecodeException(
                    "Backend [%s] returned no \"message\" field".formatted(NAME));
        }

        List<RequestedToolCall> calls = new ArrayList<>();
        if (message.toolCalls() != null) {
            for (OllamaToolCall call : message.toolCalls()) {
                if (call == null || call.function() == null || call.function().name() == null) {
                    throw new LlmException.DecodeException(
                            "Backend [%s] returned a tool call without a function name".formatted(NAME));
                }
                JsonNode arguments = call.function().arguments();
                if (arguments == null || arguments.isNull()) {
                    arguments = objectMapper.createObjectNode();
                }
                calls.add(new RequestedToolCall(
                        null, "function", call.function().name(), arguments, arguments.toString()));
            }
        }
        return new ModelReply(message.content(), calls);
    }

    @Override
    protected List<Message> toolResultMessages(RequestedToolCall call, String output) {
        ObjectNode envelope = objectMapper.createObjectNode();
        ObjectNode function = envelope.putArray("tool_calls").addObject().putObject("function");
        function.put("name", call.name());
        function.set("arguments", call.arguments().deepCopy());

        return List.of(
                new Message(Role.ASSISTANT, "", envelope),
                Message.tool(output));
    }
}
