package com.openforge.llmkit.llm.ollama;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.llmkit.config.AppConfig;
import com.openforge.llmkit.llm.LlmException;
import com.openforge.llmkit.llm.LlmProperties;
import com.openforge.llmkit.llm.StubLlmServer;
import com.openforge.llmkit.llm.model.Conversation;
import com.openforge.llmkit.llm.model.GenerationParameters;
import com.openforge.llmkit.llm.model.Message;
import com.openforge.llmkit.llm.model.PromptResponse;
import com.openforge.llmkit.llm.model.Role;
import com.openforge.llmkit.tool.Tool;
import com.openforge.llmkit.tool.ToolRegistry;
import com.openforge.llmkit.tool.WeatherTool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Ollama backend")
class OllamaBackendTest {

    private final AppConfig    appConfig = new AppConfig();
    private final ObjectMapper mapper    = appConfig.objectMapper();

    private StubLlmServer server;
    private OllamaBackend backend;
    private ToolRegistry  tools;

    @BeforeEach
    void setUp() {
        server  = new StubLlmServer();
        backend = new OllamaBackend(appConfig.httpClient(), mapper,
                new LlmProperties.ProviderConfig(server.baseUrl(), null, "qwen2.5", "mxbai-embed-large", 5),
                "qwen2.5");
        tools = new ToolRegistry();
        tools.register(WeatherTool.create());
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    // ── Canned responses ─────────────────────────────────────────────────────

    private String chatReply(String content) {
        ObjectNode message = mapper.createObjectNode().put("role", "assistant").put("content", content);
        return chat(message);
    }

    private ObjectNode toolCall(String name, String city) {
        ObjectNode call = mapper.createObjectNode();
        ObjectNode function = call.putObject("function").put("name", name);
        ObjectNode arguments = function.putObject("arguments");
        if (city != null) arguments.put("city", city);
        return call;
    }

    private String toolReply(ObjectNode... calls) {
        ObjectNode message = mapper.createObjectNode().put("role", "assistant").put("content", "");
        ArrayNode array = message.putArray("tool_calls");
        for (ObjectNode call : calls) array.add(call);
        return chat(message);
    }

    private String chat(ObjectNode message) {
        ObjectNode root = mapper.createObjectNode()
                .put("model", "qwen2.5")
                .put("created_at", "2024-07-22T20:33:28.123648Z");
        root.set("message", message);
        root.put("done", true).put("done_reason", "stop");
        return root.toString();
    }

    private Conversation weatherConversation(String question) {
        return new Conversation(tools)
                .addMessage(Role.SYSTEM, "You are a helpful assistant.")
                .addMessage(Role.USER, question);
    }

    // ── converse ─────────────────────────────────────────────────────────────

    @Test
    @DisplayName("Plain reply is returned and appended as an assistant message")
    void converse_plainReply_appendsAssistantMessage() {
        // Given
        server.enqueue(chatReply("Hello! How can I help?"));
        Conversation conversation = new Conversation()
                .addMessage(Role.SYSTEM, "You are a helpful assistant.")
                .addMessage(Role.USER, "Hi");

        // When
        PromptResponse response = backend.converse(conversation);

        // Then
        assertEquals(Role.ASSISTANT, response.role());
        assertEquals("Hello! How can I help?", response.content());
        assertEquals(3, conversation.size());
        assertEquals("Hello! How can I help?", conversation.lastMessage().content());

        StubLlmServer.RecordedRequest request = server.request(0);
        assertEquals("/api/chat", request.path());
        assertNull(request.header("Authorization"));
        JsonNode body = request.json();
        assertEquals("qwen2.5", body.get("model").asText());
        assertFalse(body.get("stream").asBoolean());
        assertFalse(body.has("tools"));
        assertFalse(body.has("options"));
        assertEquals("user", body.at("/messages/1/role").asText());
    }

    @Test
    @DisplayName("Generation parameters go into the options object")
    void converse_sendsOptions() {
        server.enqueue(chatReply("ok"));
        Conversation conversation = new Conversation()
                .addMessage(Role.USER, "Hi")
                .setParameters(GenerationParameters.builder()
                        .maxTokens(64).temperature(0.1).presencePenalty(0.5).build());

        backend.converse(conversation);

        JsonNode options = server.request(0).json().get("options");
        assertEquals(64, options.get("num_predict").asInt());
        assertEquals(0.1, options.get("temperature").asDouble());
        assertEquals(0.5, options.get("presence_penalty").asDouble());
        assertFalse(options.has("top_p"));
    }

    @Test
    @DisplayName("Tool call is executed and recorded in the conversation")
    void converse_toolCall_executesAndAppendsResults() {
        // Given
        server.enqueue(toolReply(toolCall("weather", "London")));
        Conversation conversation = weatherConversation("What's the weather in London?");

        // When
        PromptResponse response = backend.converse(conversation);

        // Then
        assertEquals(Role.TOOL, response.role());
        assertEquals(1, response.toolCalls().size());
        assertTrue(response.toolCalls().get(0).result().contains("15°C"));
        assertEquals("weather", server.request(0).json().at("/tools/0/function/name").asText());

        assertEquals(4, conversation.size());
        Message envelope = conversation.messages().get(2);
        assertEquals(Role.ASSISTANT, envelope.role());
        assertEquals("weather", envelope.fields().at("/tool_calls/0/function/name").asText());
        assertEquals("London", envelope.fields().at("/tool_calls/0/function/arguments/city").asText());

        Message toolMessage = conversation.lastMessage();
        assertEquals(Role.TOOL, toolMessage.role());
        assertFalse(toolMessage.hasFields(), "Ollama tool messages carry no call id");
        assertTrue(toolMessage.content().contains("Rainy"));
    }

    @Test
    @DisplayName("Tool results are replayed to the model on the next turn")
    void converse_afterToolRound_replaysResults() {
        server.enqueue(toolReply(toolCall("weather", "Stockholm")));
        server.enqueue(chatReply("Stockholm is cloudy at 8°C."));
        Conversation conversation = weatherConversation("Weather in Stockholm?");

        backend.converse(conversation);
        PromptResponse answer = backend.converse(conversation);

        assertEquals("Stockholm is cloudy at 8°C.", answer.content());
        JsonNode messages = server.request(1).json().get("messages");
        assertEquals(4, messages.size());
        assertEquals("Stockholm", messages.at("/2/tool_calls/0/function/arguments/city").asText());
        assertEquals("tool", messages.at("/3/role").asText());
        assertTrue(messages.at("/3/content").asText().contains("Cloudy"));
    }

    @Test
    @DisplayName("Unknown tool triggers exactly one retry without tools")
    void converse_unknownTool_retriesOnceWithoutTools() {
        // Given
        server.enqueue(toolReply(toolCall("get_current_time", null)));
        server.enqueue(chatReply("Hi there!"));
        Conversation conversation = weatherConversation("Hello");

        // When
        PromptResponse response = backend.converse(conversation);

        // Then
        assertEquals("Hi there!", response.content());
        assertEquals(2, server.requests().size());
        assertTrue(server.request(0).json().has("tools"));
        assertFalse(server.request(1).json().has("tools"));
        assertEquals(3, conversation.size());
    }

    @Test
    @DisplayName("Unknown tool on the retry surfaces as UnknownToolException")
    void converse_unknownToolTwice_fails() {
        server.enqueue(toolReply(toolCall("get_current_time", null)));
        server.enqueue(toolReply(toolCall("get_current_time", null)));
        Conversation conversation = weatherConversation("Hello");

        LlmException.UnknownToolException e = assertThrows(LlmException.UnknownToolException.class,
                () -> backend.converse(conversation));

        assertEquals("get_current_time", e.getToolName());
        assertEquals(2, server.requests().size());
        assertEquals(2, conversation.size());
    }

    @Test
    @DisplayName("Executor changing its arguments does not alter the echoed call or the reported arguments")
    void converse_mutatingExecutor_keepsEnvelopeIntact() {
        // Given: a tool that rewrites the arguments it receives
        tools.register(Tool.builder().name("rewrite").executor(args -> {
            ((ObjectNode) args).put("city", "Changed");
            return "done";
        }).build());
        server.enqueue(toolReply(toolCall("rewrite", "London")));
        Conversation conversation = weatherConversation("Rewrite London");

        // When
        PromptResponse response = backend.converse(conversation);

        // Then
        assertEquals("London", response.toolCalls().get(0).arguments().get("city").asText());
        Message envelope = conversation.messages().get(2);
        assertEquals("London", envelope.fields().at("/tool_calls/0/function/arguments/city").asText());
    }

    @Test
    @DisplayName("One unknown call in a batch discards the whole batch and retries")
    void converse_batchWithUnknownTool_discardsBatch() {
        server.enqueue(toolReply(toolCall("weather", "London"), toolCall("stock_price", null)));
        server.enqueue(chatReply("London is rainy; I can't look up stocks."));
        Conversation conversation = weatherConversation("London weather and ACME price?");

        PromptResponse response = backend.converse(conversation);

        assertFalse(response.hasToolCalls());
        assertEquals(2, server.requests().size());
        assertFalse(server.request(1).json().has("tools"));
        assertEquals(3, conversation.size());
        assertTrue(conversation.messages().stream().noneMatch(m -> m.role() == Role.TOOL));
    }

    @Test
    @DisplayName("Malformed JSON is a decode error")
    void converse_malformedJson_throwsDecodeException() {
        server.enqueue("{\"message\": {");
        Conversation conversation = new Conversation().addMessage(Role.USER, "Hi");

        assertThrows(LlmException.DecodeException.class, () -> backend.converse(conversation));
        assertEquals(1, conversation.size());
    }

    @Test
    @DisplayName("Failing tool aborts without retry and leaves the conversation unchanged")
    void converse_toolFails_throwsToolExecutionException() {
        server.enqueue(toolReply(toolCall("weather", "Atlantis")));
        Conversation conversation = weatherConversation("Weather in Atlantis?");

        LlmException.ToolExecutionException e = assertThrows(LlmException.ToolExecutionException.class,
                () -> backend.converse(conversation));

        assertEquals("weather", e.getToolName());
        assertEquals(1, server.requests().size());
        assertEquals(2, conversation.size());
    }

    @Test
    @DisplayName("Response without a message is a decode error")
    void converse_missingMessage_throwsDecodeException() {
        server.enqueue("{\"model\":\"qwen2.5\",\"done\":true}");

        assertThrows(LlmException.DecodeException.class,
                () -> backend.converse(new Conversation().addMessage(Role.USER, "Hi")));
    }

    @Test
    @DisplayName("HTTP errors carry the status code")
    void converse_notFound_throwsBackendHttpException() {
        server.enqueue(404, "{\"error\":\"model 'qwen2.5' not found\"}");

        LlmException.BackendHttpException e = assertThrows(LlmException.BackendHttpException.class,
                () -> backend.converse(new Conversation().addMessage(Role.USER, "Hi")));

        assertEquals(404, e.getStatus());
        assertTrue(e.getMessage().contains("ollama"));
    }

    @Test
    @DisplayName("Slow backend fails with a transport error after the timeout")
    void converse_timeout_throwsTransportException() {
        server.enqueueDelayed(2_000, chatReply("too late"));

        assertThrows(LlmException.TransportException.class,
                () -> backend.converse(new Conversation().addMessage(Role.USER, "Hi"), Duration.ofMillis(200)));
    }

    // ── generate / embed ─────────────────────────────────────────────────────

    @Test
    @DisplayName("Generate flattens the conversation into a role-prefixed prompt")
    void generate_flattensPrompt() {
        // Given
        server.enqueue("{\"model\":\"qwen2.5\",\"response\":\"Rain taps the window.\",\"done\":true}");
        Conversation conversation = weatherConversation("Write a haiku.");

        // When
        String text = backend.generate(conversation);

        // Then
        assertEquals("Rain taps the window.", text);
        assertEquals(2, conversation.size());
        StubLlmServer.RecordedRequest request = server.request(0);
        assertEquals("/api/generate", request.path());
        assertEquals("system: You are a helpful assistant.\nuser: Write a haiku.\n",
                request.json().get("prompt").asText());
        assertFalse(request.json().get("stream").asBoolean());
        assertFalse(request.json().has("tools"));
    }

    @Test
    @DisplayName("Generate response without the response field is a decode error")
    void generate_missingResponse_throwsDecodeException() {
        server.enqueue("{\"model\":\"qwen2.5\",\"done\":true}");

        assertThrows(LlmException.DecodeException.class,
                () -> backend.generate(new Conversation().addMessage(Role.USER, "Hi")));
    }

    @Test
    @DisplayName("Embed posts model and prompt and returns the vector")
    void embed_returnsVector() {
        server.enqueue("{\"embedding\":[0.5,0.25,-0.125]}");

        List<Float> vector = backend.embed("hello world");

        assertEquals(List.of(0.5f, 0.25f, -0.125f), vector);
        StubLlmServer.RecordedRequest request = server.request(0);
        assertEquals("/api/embeddings", request.path());
        assertEquals("qwen2.5", request.json().get("model").asText());
        assertEquals("hello world", request.json().get("prompt").asText());
    }

    @Test
    @DisplayName("Embedding response without a vector is a decode error")
    void embed_missingVector_throwsDecodeException() {
        server.enqueue("{}");

        assertThrows(LlmException.DecodeException.class, () -> backend.embed("hello"));
    }

    @Test
    @DisplayName("Backend reports its name and configured timeout")
    void describesItself() {
        OllamaBackend local = new OllamaBackend(appConfig.httpClient(), mapper,
                new LlmProperties.ProviderConfig(null, null, "qwen2.5", null, 30), "qwen2.5");

        assertEquals("ollama", local.name());
        assertEquals(Duration.ofSeconds(30), local.defaultTimeout());
    }
}
