package com.openforge.llmkit.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.llmkit.llm.model.Conversation;
import com.openforge.llmkit.llm.model.Message;
import com.openforge.llmkit.llm.model.ModelReply;
import com.openforge.llmkit.llm.model.PromptResponse;
import com.openforge.llmkit.llm.model.RequestedToolCall;
import com.openforge.llmkit.llm.model.Role;
import com.openforge.llmkit.llm.model.ToolCall;
import com.openforge.llmkit.tool.ToolDefinition;
import com.openforge.llmkit.tool.ToolException;
import com.openforge.llmkit.tool.ToolNotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Shared HTTP plumbing and conversation driver for every backend.
 *
 * One {@link #converse} call:
 *
 *   START → REQUEST_SENT ─┬─ no tool calls  → append assistant reply → DONE
 *                         └─ tool calls     → EXECUTE_EACH ─┬─ all ok          → append results → DONE
 *                                                           ├─ unknown tool    → RETRY_NO_TOOLS (once)
 *                                                           └─ other failure   → FAILED
 *
 * Tool results are staged and committed only after the whole batch
 * succeeded, so a failed attempt never leaves partial messages behind and
 * the no-tools retry replays exactly the same messages.
 *
 * Subclasses supply the provider's request shape, response decoding and the
 * messages that record a tool result in the conversation.
 */
@Slf4j
public abstract class AbstractLlmBackend implements LlmBackend {

    protected final HttpClient                   httpClient;
    protected final ObjectMapper                 objectMapper;
    protected final LlmProperties.ProviderConfig config;
    protected final String                       baseUrl;
    protected final String                       model;

    protected AbstractLlmBackend(HttpClient httpClient,
                                 ObjectMapper objectMapper,
                                 LlmProperties.ProviderConfig config,
                                 String model,
                                 String defaultBaseUrl) {
        this.httpClient   = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.config       = Objects.requireNonNull(config, "config must not be null");
        this.model        = model;
        this.baseUrl      = stripTrailingSlash(
                config.baseUrl() == null || config.baseUrl().isBlank() ? defaultBaseUrl : config.baseUrl());
    }

    // ── Provider hooks ───────────────────────────────────────────────────────

    protected abstract String chatPath();

    /** Request body for the chat endpoint; {@code tools} is empty when tools must not be offered. */
    protected abstract Object chatRequest(Conversation conversation, List<ToolDefinition> tools);

    protected abstract ModelReply decodeChatReply(String body);

    /** Messages that record one executed tool call, in the order the provider wants to replay them. */
    protected abstract List<Message> toolResultMessages(RequestedToolCall call, String output);

    /** Adds authentication headers; no-op for providers without auth. */
    protected void authorize(HttpRequest.Builder request) {
    }

    // ── LlmBackend ───────────────────────────────────────────────────────────

    @Override
    public String model() {
        return model;
    }

    @Override
    public Duration defaultTimeout() {
        return config.timeout();
    }

    @Override
    public PromptResponse converse(Conversation conversation, Duration timeout) {
        try {
            return converseRoundTrip(conversation, timeout, false);
        } catch (LlmException.UnknownToolException e) {
            // Some models answer every request with a tool call when tools are
            // offered, inventing a name if nothing fits. Ask again without tools.
            log.warn("[{}] Model requested unknown tool '{}', retrying once without tools",
                    name(), e.getToolName());
            return converseRoundTrip(conversation, timeout, true);
        }
    }

    private PromptResponse converseRoundTrip(Conversation conversation, Duration timeout, boolean disableTools) {
        List<ToolDefinition> tools = disableTools || conversation.tools().isEmpty()
                ? List.of()
                : conversation.tools().describe();

        String    body  = post(chatPath(), chatRequest(conversation, tools), timeout);
        ModelReply reply = decodeChatReply(body);

        if (!reply.hasToolCalls()) {
            conversation.addMessage(Role.ASSISTANT, reply.content());
            return PromptResponse.assistant(reply.content());
        }

        List<Message>  staged   = new ArrayList<>();
        List<ToolCall> executed = new ArrayList<>(reply.toolCalls().size());
        for (RequestedToolCall call : reply.toolCalls()) {
            String output = executeTool(conversation, call);
            staged.addAll(toolResultMessages(call, output));
            executed.add(new ToolCall(call.name(), call.arguments(), output));
        }
        staged.forEach(conversation::appendMessage);

        log.debug("[{}] Tool round finished: {} call(s), conversation size={}",
                name(), executed.size(), conversation.size());
        return PromptResponse.toolResults(executed);
    }

    private String executeTool(Conversation conversation, RequestedToolCall call) {
        log.info("[{}] Executing tool: {} args={}", name(), call.name(), call.rawArguments());
        try {
            return conversation.tools().execute(call.name(), call.arguments().deepCopy());
        } catch (ToolNotFoundException e) {
            throw new LlmException.UnknownToolException(call.name(), e);
        } catch (ToolException | RuntimeException e) {
            throw new LlmException.ToolExecutionException(call.name(), e);
        }
    }

    // ── HTTP helpers ─────────────────────────────────────────────────────────

    /**
     * POSTs a JSON body and returns the response body of a 2xx reply.
     */
    protected String post(String path, Object requestBody, Duration timeout) {
        String body = serialize(requestBody);
        log.debug("[{}] → POST {} model={} body-length={}", name(), path, model, body.length());

        HttpRequest.Builder request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .header("Content-Type", "application/json")
                    .timeout(timeout == null ? defaultTimeout() : timeout)
                    .POST(HttpRequest.BodyPublishers.ofString(body));
        } catch (IllegalArgumentException e) {
            throw new LlmException.RequestMarshalException(
                    "Invalid request for backend [%s]: %s".formatted(name(), e.getMessage()), e);
        }
        authorize(request);

        HttpResponse<String> response;
        try {
            response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException.TransportException(
                    "Interrupted while calling backend [%s]".formatted(name()), e);
        } catch (IOException e) {
            throw new LlmException.TransportException(
                    "HTTP request to backend [%s] failed: %s".formatted(name(), e.getMessage()), e);
        }

        int    status       = response.statusCode();
        String responseBody = response.body();
        log.debug("[{}] ← HTTP {} body-length={}", name(), status,
                responseBody == null ? 0 : responseBody.length());

        if (status == 429) {
            throw new LlmException.RateLimitException(name(), responseBody);
        }
        if (status < 200 || status >= 300) {
            throw new LlmException.BackendHttpException(name(), status, responseBody);
        }
        return responseBody;
    }

    protected <T> T decode(String body, Class<T> type) {
        T value;
        try {
            value = objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new LlmException.DecodeException(
                    "Failed to decode response from backend [%s]: %s".formatted(name(), e.getOriginalMessage()), e);
        }
        if (value == null) {
            throw new LlmException.DecodeException(
                    "Backend [%s] returned an empty JSON document".formatted(name()));
        }
        return value;
    }

    protected String serialize(Object requestBody) {
        try {
            return objectMapper.writeValueAsString(requestBody);
        } catch (JsonProcessingException e) {
            throw new LlmException.RequestMarshalException(
                    "Failed to serialize request for backend [%s]".formatted(name()), e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
