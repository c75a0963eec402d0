package com.openforge.llmkit.llm.model;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.llmkit.tool.ToolRegistry;
import com.openforge.llmkit.tool.WeatherTool;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Conversation model")
class ConversationTest {

    @Test
    @DisplayName("Messages are kept in insertion order")
    void addMessage_keepsOrder() {
        // Given
        Conversation conversation = new Conversation()
                .addMessage(Role.SYSTEM, "You are a helpful assistant.")
                .addMessage(Role.USER, "Hi")
                .addMessage(Role.ASSISTANT, "Hello!");

        // Then
        assertEquals(3, conversation.size());
        assertEquals(List.of(Role.SYSTEM, Role.USER, Role.ASSISTANT),
                conversation.messages().stream().map(Message::role).toList());
        assertEquals("Hello!", conversation.lastMessage().content());
    }

    @Test
    @DisplayName("Message list is read-only from the outside")
    void messages_isUnmodifiable() {
        Conversation conversation = new Conversation().addMessage(Role.USER, "Hi");

        assertThrows(UnsupportedOperationException.class,
                () -> conversation.messages().add(Message.user("sneaky")));
        assertEquals(1, conversation.size());
    }

    @Test
    @DisplayName("Empty conversation has no last message")
    void lastMessage_emptyConversation_throws() {
        assertThrows(IllegalStateException.class, () -> new Conversation().lastMessage());
    }

    @Test
    @DisplayName("Null content is stored as an empty string")
    void message_nullContent_becomesEmpty() {
        assertEquals("", Message.of(Role.ASSISTANT, null).content());
        assertThrows(NullPointerException.class, () -> Message.of(null, "x"));
    }

    @Test
    @DisplayName("Envelope fields are copied in and out")
    void message_fieldsAreCopied() {
        ObjectNode fields = JsonNodeFactory.instance.objectNode().put("tool_call_id", "call_1");
        Message message = new Message(Role.TOOL, "out", fields);

        fields.put("tool_call_id", "changed");
        message.fields().put("tool_call_id", "changed again");

        assertEquals("call_1", message.fields().get("tool_call_id").asText());
        assertTrue(message.hasFields());
        assertFalse(Message.user("x").hasFields());
    }

    @Test
    @DisplayName("Wire view flattens role, content and envelope fields")
    void toWireMessages_flattensFields() {
        // Given
        ObjectNode fields = JsonNodeFactory.instance.objectNode().put("tool_call_id", "call_7");
        Conversation conversation = new Conversation()
                .addMessage(Role.USER, "Weather in London?")
                .appendMessage(new Message(Role.TOOL, "{\"conditions\":\"Rainy\"}", fields));

        // When
        List<ObjectNode> wire = conversation.toWireMessages();

        // Then
        assertEquals(2, wire.size());
        assertEquals("user", wire.get(0).get("role").asText());
        assertEquals("Weather in London?", wire.get(0).get("content").asText());
        assertEquals(2, wire.get(0).size());
        assertEquals("tool", wire.get(1).get("role").asText());
        assertEquals("call_7", wire.get(1).get("tool_call_id").asText());
    }

    @Test
    @DisplayName("Repeated serialization without mutation yields the same shape")
    void serialization_isIdempotent() {
        ToolRegistry registry = new ToolRegistry();
        registry.register(WeatherTool.create());
        Conversation conversation = new Conversation(registry)
                .addMessage(Role.SYSTEM, "You are a helpful assistant.")
                .addMessage(Role.USER, "Weather in Brno?");

        assertEquals(conversation.toWireMessages(), conversation.toWireMessages());
        assertEquals(registry.describe(), registry.describe());
        assertEquals(2, conversation.size());
    }

    @Test
    @DisplayName("Parameters default to empty and reset on null")
    void parameters_defaultsAndReset() {
        Conversation conversation = new Conversation();
        assertTrue(conversation.parameters().isEmpty());

        conversation.setParameters(GenerationParameters.builder().maxTokens(128).temperature(0.2).build());
        assertEquals(128, conversation.parameters().maxTokens());
        assertFalse(conversation.parameters().isEmpty());

        conversation.setParameters(null);
        assertTrue(conversation.parameters().isEmpty());
    }

    @Test
    @DisplayName("Conversation exposes the registry it was built with")
    void tools_isTheGivenRegistry() {
        ToolRegistry registry = new ToolRegistry();
        registry.register(WeatherTool.create());

        Conversation conversation = new Conversation(registry);

        assertSame(registry, conversation.tools());
        assertTrue(new Conversation().tools().isEmpty());
    }

    @Test
    @DisplayName("Roles map to lower-case wire names")
    void role_wireNames() {
        assertEquals("assistant", Role.ASSISTANT.wireName());
        assertEquals(Role.TOOL, Role.fromWireName("TOOL"));
        assertThrows(IllegalArgumentException.class, () -> Role.fromWireName("robot"));
    }
}
