package com.zephyrus.agent.protocol;

import com.zephyrus.agent.exception.ValidationException;
import com.zephyrus.agent.model.AgentSpec;
import com.zephyrus.agent.model.ScheduleSpec;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProtocolCodecTest {

    private final ProtocolCodec codec = new ProtocolCodec();

    @Test
    void shouldDecodeEnvelope() throws Exception {
        InboundMessage message = codec.decode("{\"type\":\"start_agent\",\"data\":{\"agent_id\":\"a1\"}}");

        assertEquals(MessageType.START_AGENT, message.getType());
        assertEquals("a1", message.text("agent_id"));
    }

    @Test
    void shouldCloseOnUndecodableFrames() {
        assertThrows(MalformedFrameException.class, () -> codec.decode("not json"));
        assertThrows(MalformedFrameException.class, () -> codec.decode("[1,2]"));
        assertThrows(MalformedFrameException.class, () -> codec.decode("{\"data\":{}}"));
        assertThrows(MalformedFrameException.class, () -> codec.decode("{\"type\":42}"));
    }

    @Test
    void shouldRejectNonObjectData() {
        assertThrows(ValidationException.class, () -> codec.decode("{\"type\":\"execute\",\"data\":[1]}"));
        assertThrows(ValidationException.class, () -> codec.decode("{\"type\":\"execute\",\"data\":\"oops\"}"));
    }

    @Test
    void shouldKeepUnknownTypesDecodable() throws Exception {
        InboundMessage message = codec.decode("{\"type\":\"dance\"}");

        assertNull(message.getType());
        assertEquals("dance", message.getRawType());
        assertEquals(0, message.getData().size());
    }

    @Test
    void shouldNormalizeAgentIdFromEveryAcceptedShape() throws Exception {
        assertEquals("a1", codec.decode("{\"type\":\"execute\",\"agent_id\":\"a1\"}").text("agent_id"));
        assertEquals("a2", codec.decode("{\"type\":\"execute\",\"agentId\":\"a2\",\"data\":{}}").text("agent_id"));
        assertEquals("a3", codec.decode("{\"type\":\"execute\",\"data\":{\"agentId\":\"a3\"}}").text("agent_id"));
        assertEquals("a4", codec.decode("{\"type\":\"execute\",\"data\":\"{\\\"agent_id\\\":\\\"a4\\\"}\"}").text("agent_id"));
    }

    @Test
    void shouldPreferAgentIdInsideData() throws Exception {
        InboundMessage message = codec.decode("{\"type\":\"execute\",\"agent_id\":\"outer\",\"data\":{\"agent_id\":\"inner\"}}");

        assertEquals("inner", message.text("agent_id"));
    }

    @Test
    void shouldResolveDeprecatedAliases() throws Exception {
        InboundMessage message = codec.decode("{\"type\":\"websocket_execution\",\"data\":{\"agent_id\":\"a1\"}}");

        assertEquals(MessageType.EXECUTE, message.getType());
        assertTrue(message.getType().isAlias("websocket_execution"));
        assertEquals("execution_response", message.getType().responseType());
        assertEquals(MessageType.LOAD_AGENT, MessageType.fromWire("add_agent").orElseThrow());
        assertEquals("create_agent_response", MessageType.CREATE_AGENT.responseType());
    }

    @Test
    void shouldBindSnakeCaseAndCamelCasePayloads() throws Exception {
        AgentSpec snake = codec.bind(codec.decode(
            "{\"type\":\"create_agent\",\"data\":{\"name\":\"n\",\"contract_address\":\"0xabc\",\"gas_limit\":\"300000\"}}").getData(),
            AgentSpec.class);
        AgentSpec camel = codec.bind(codec.decode(
            "{\"type\":\"create_agent\",\"data\":{\"name\":\"n\",\"contractAddress\":\"0xabc\",\"gasLimit\":\"300000\"}}").getData(),
            AgentSpec.class);

        assertEquals("0xabc", snake.getContractAddress());
        assertEquals("300000", snake.getGasLimit());
        assertEquals(snake, camel);
    }

    @Test
    void shouldReportBindingErrorsAsValidation() throws Exception {
        InboundMessage message = codec.decode("{\"type\":\"create_schedule\",\"data\":{\"interval_seconds\":\"soon\"}}");

        assertThrows(ValidationException.class, () -> codec.bind(message.getData(), ScheduleSpec.class));
    }

    @Test
    void shouldEncodeSnakeCaseEnvelope() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("success", true);
        data.put("agent_id", "a1");

        String frame = codec.encode(Envelope.of("start_agent_response", data));

        assertEquals("{\"type\":\"start_agent_response\",\"data\":{\"success\":true,\"agent_id\":\"a1\"}}", frame);
    }
}
