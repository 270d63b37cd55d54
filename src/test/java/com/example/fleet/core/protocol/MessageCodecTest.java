package com.example.fleet.core.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MessageCodecTest {
    private final MessageCodec codec = new MessageCodec();
    private final ObjectMapper om = new ObjectMapper();

    @Test
    void testDecode_fullEnvelope() {
        Message msg = codec.decode("{\"type\":\"tool_call\",\"id\":\"alpha-1\",\"timestamp\":\"2024-05-01T10:00:00Z\","
                + "\"data\":{\"tool\":\"echo\",\"arguments\":{\"x\":1}}}");

        assertEquals(MessageType.TOOL_CALL, msg.type());
        assertEquals("alpha-1", msg.id());
        assertEquals(Instant.parse("2024-05-01T10:00:00Z"), msg.timestamp());
        SlaveMessages.ToolCall call = codec.payload(msg, SlaveMessages.ToolCall.class);
        assertEquals("echo", call.tool());
        assertEquals(1, call.arguments().get("x").asInt());
    }

    @Test
    void testDecode_optionalFieldsMayBeAbsent() {
        Message msg = codec.decode("{\"type\":\"heartbeat\",\"timestamp\":\"yesterday\"}");

        assertEquals(MessageType.HEARTBEAT, msg.type());
        assertNull(msg.id());
        assertNull(msg.data());
        assertNull(msg.timestamp());
    }

    @Test
    void testDecode_rejectsUnknownTypeAndMalformedFrames() {
        ProtocolException unknown = assertThrows(ProtocolException.class, () -> codec.decode("{\"type\":\"shutdown\"}"));
        assertEquals("Unknown message type: shutdown", unknown.getMessage());
        assertThrows(ProtocolException.class, () -> codec.decode("{\"type\":"));
        assertThrows(ProtocolException.class, () -> codec.decode("[1,2]"));
        assertThrows(ProtocolException.class, () -> codec.decode("{\"id\":\"x\"}"));
    }

    @Test
    void testEncode_usesWireNamesAndOmitsNulls() throws Exception {
        String frame = codec.encode(Message.control(MessageType.MASTER_TOOL_CALL));

        JsonNode node = om.readTree(frame);
        assertEquals("master_tool_call", node.get("type").asText());
        assertFalse(node.has("id"));
        assertFalse(node.has("data"));
        assertTrue(node.get("timestamp").isTextual());
    }

    @Test
    void testPayload_missingOrMistypedDataIsRejected() {
        Message empty = Message.control(MessageType.REGISTER);
        assertThrows(ProtocolException.class, () -> codec.payload(empty, SlaveMessages.Register.class));

        Message mistyped = codec.decode("{\"type\":\"register\",\"data\":{\"tools\":\"not-a-list\"}}");
        assertThrows(ProtocolException.class, () -> codec.payload(mistyped, SlaveMessages.Register.class));
    }

    @Test
    void testRegisterPayload_defaultsToEmptyToolsAndIgnoresUnknownFields() {
        Message msg = codec.decode("{\"type\":\"register\",\"data\":{\"hostname\":\"alpha\",\"os\":\"linux\"}}");

        SlaveMessages.Register reg = codec.payload(msg, SlaveMessages.Register.class);

        assertEquals("alpha", reg.hostname());
        assertTrue(reg.tools().isEmpty());
    }

    @Test
    void testMasterTools_usesSnakeCaseMappingsKey() {
        JsonNode data = codec.toData(new SlaveMessages.MasterTools(
                Map.of("files", List.of()), Map.of("work", List.of("files"))));

        assertTrue(data.has("servers"));
        assertEquals("files", data.get("context_mappings").get("work").get(0).asText());
    }

    @Test
    void testToolCallResponse_failedOmitsResult() {
        JsonNode data = codec.toData(SlaveMessages.ToolCallResponse.failed("boom"));

        assertFalse(data.get("success").asBoolean());
        assertFalse(data.has("result"));
        assertEquals("boom", data.get("error").asText());
    }
}
