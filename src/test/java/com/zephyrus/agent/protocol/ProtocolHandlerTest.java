package com.zephyrus.agent.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zephyrus.agent.AgentFixtures;
import com.zephyrus.agent.AgentFixtures.ManualExecutor;
import com.zephyrus.agent.AgentFixtures.MutableClock;
import com.zephyrus.agent.AgentFixtures.RecordingConnection;
import com.zephyrus.agent.client.CallResult;
import com.zephyrus.agent.client.ContractCallClient;
import com.zephyrus.agent.client.ContractStateProvider;
import com.zephyrus.agent.client.Decision;
import com.zephyrus.agent.client.DecisionOracle;
import com.zephyrus.agent.model.AgentStatus;
import com.zephyrus.agent.model.ExecutionRecord;
import com.zephyrus.agent.service.AgentManagerService;
import com.zephyrus.agent.service.AgentSchedulerService;
import com.zephyrus.agent.service.ConnectionRegistryService;
import com.zephyrus.agent.service.ExecutionPipelineService;
import com.zephyrus.agent.service.NotificationService;
import com.zephyrus.agent.service.ParameterValidator;
import com.zephyrus.agent.store.AgentStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProtocolHandlerTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    @Mock
    private DecisionOracle oracle;

    @Mock
    private ContractCallClient callClient;

    @Mock
    private ContractStateProvider stateProvider;

    @Mock
    private AgentStore store;

    @Mock
    private NotificationService notifications;

    private ExecutorService callPool;
    private ManualExecutor workers;
    private AgentSchedulerService scheduler;
    private AgentManagerService manager;
    private ProtocolHandler handler;
    private RecordingConnection connection;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        ProtocolCodec codec = new ProtocolCodec();
        ConnectionRegistryService registry = new ConnectionRegistryService(codec, clock);
        callPool = Executors.newCachedThreadPool();
        workers = new ManualExecutor();
        scheduler = new AgentSchedulerService(clock, workers, 250);
        ExecutionPipelineService pipeline = new ExecutionPipelineService(oracle, callClient, stateProvider, store,
            new ParameterValidator(), clock, callPool, 2000);
        manager = new AgentManagerService(scheduler, pipeline, registry, notifications, store, clock, 3, 57054L);
        handler = new ProtocolHandler(codec, registry, manager);

        connection = new RecordingConnection("c1");
        handler.onOpen(connection, null);
    }

    @AfterEach
    void tearDown() {
        callPool.shutdownNow();
    }

    private JsonNode send(String type, Map<String, Object> data) throws Exception {
        int before = connection.getFrames().size();
        handler.onFrame(connection.getId(), JSON.writeValueAsString(Map.of("type", type, "data", data)));
        List<String> frames = connection.getFrames();
        return frames.size() > before ? JSON.readTree(frames.get(frames.size() - 1)) : null;
    }

    private List<JsonNode> framesOfType(String type) throws Exception {
        List<JsonNode> matching = new ArrayList<>();
        for (String frame : connection.getFrames()) {
            JsonNode node = JSON.readTree(frame);
            if (type.equals(node.path("type").asText())) {
                matching.add(node);
            }
        }
        return matching;
    }

    private String createRunningAgent() throws Exception {
        JsonNode created = send("create_agent", Map.of(
            "name", "Treasury",
            "owner", AgentFixtures.OWNER,
            "contract_address", AgentFixtures.CONTRACT_ADDRESS,
            "abi", AgentFixtures.tokenAbi()));
        String agentId = created.path("data").path("agent_id").asText();
        send("create_function", Map.of("agent_id", agentId, "function_name", "totalSupply", "function_type", "read",
            "is_enabled", true));
        send("create_schedule", Map.of("agent_id", agentId, "schedule_type", "interval", "interval_seconds", 5));
        send("start_agent", Map.of("agent_id", agentId));
        return agentId;
    }

    @Test
    void shouldProduceExactlyOneRecordForConfigureStartExecuteSequence() throws Exception {
        when(stateProvider.readState(any())).thenReturn(Map.of());
        when(oracle.decide(any(), any())).thenReturn(Decision.call("totalSupply", Map.of()));
        when(callClient.call(any())).thenReturn(CallResult.value("1000"));

        String agentId = createRunningAgent();
        assertNull(send("execute", Map.of("agent_id", agentId)));
        workers.runAll();

        ArgumentCaptor<ExecutionRecord> record = ArgumentCaptor.forClass(ExecutionRecord.class);
        verify(store, times(1)).appendExecutionRecord(record.capture());
        assertEquals(agentId, record.getValue().getAgentId());

        List<JsonNode> executions = framesOfType("execution_response");
        assertEquals(2, executions.size());
        assertEquals("started", executions.get(0).path("data").path("status").asText());
        JsonNode completed = executions.get(1).path("data");
        assertEquals("completed", completed.path("status").asText());
        assertTrue(completed.path("success").asBoolean());
        assertEquals("1000", completed.path("execution").path("result").asText());
        assertFalse(framesOfType("log").isEmpty());
        assertTrue(framesOfType("execute_response").isEmpty());
    }

    @Test
    void shouldAnswerEachRequestWithMatchingResponseType() throws Exception {
        JsonNode created = send("create_agent", Map.of(
            "name", "Treasury",
            "owner", AgentFixtures.OWNER,
            "contract_address", AgentFixtures.CONTRACT_ADDRESS,
            "abi", AgentFixtures.tokenAbi()));
        String agentId = created.path("data").path("agent_id").asText();

        assertEquals("create_agent_response", created.path("type").asText());
        assertTrue(created.path("data").path("success").asBoolean());
        assertEquals("created", created.path("data").path("status").asText());

        JsonNode function = send("create_function", Map.of("agent_id", agentId, "function_name", "totalSupply"));
        assertEquals("create_function_response", function.path("type").asText());
        assertFalse(function.path("data").path("function_id").asText().isEmpty());

        JsonNode configured = send("configure_agent", Map.of("agent_id", agentId));
        assertEquals("configure_agent_response", configured.path("type").asText());
        assertEquals("configured", configured.path("data").path("agent").path("status").asText());

        JsonNode list = send("list_agents", Map.of());
        assertEquals(1, list.path("data").path("agents").size());
    }

    @Test
    void shouldFallBackToConnectionDefaultAgent() throws Exception {
        JsonNode created = send("create_agent", Map.of(
            "name", "Treasury",
            "owner", AgentFixtures.OWNER,
            "contract_address", AgentFixtures.CONTRACT_ADDRESS,
            "abi", AgentFixtures.tokenAbi()));
        String agentId = created.path("data").path("agent_id").asText();

        JsonNode function = send("create_function", Map.of("function_name", "totalSupply"));

        assertEquals(agentId, function.path("data").path("agent_id").asText());
    }

    @Test
    void shouldCreateAgentFromLastRegisteredContract() throws Exception {
        send("create_contract", Map.of("name", "Token", "address", AgentFixtures.CONTRACT_ADDRESS,
            "abi", AgentFixtures.tokenAbi()));

        JsonNode created = send("create_agent", Map.of("name", "Treasury", "owner", AgentFixtures.OWNER));

        assertTrue(created.path("data").path("success").asBoolean());
    }

    @Test
    void shouldCloseConnectionOnUndecodableFrame() {
        handler.onFrame(connection.getId(), "{not json");

        assertFalse(connection.isOpen());
        assertNotNull(connection.getCloseReason());
        assertTrue(connection.getFrames().isEmpty());
    }

    @Test
    void shouldAnswerUnknownTypeWithErrorAndStayOpen() throws Exception {
        JsonNode error = send("dance", Map.of());

        assertEquals("error", error.path("type").asText());
        assertEquals("validation", error.path("data").path("error_type").asText());
        assertEquals("dance", error.path("data").path("request_type").asText());
        assertTrue(connection.isOpen());
    }

    @Test
    void shouldReportManagerErrorsAsErrorFrames() throws Exception {
        JsonNode notFound = send("start_agent", Map.of("agent_id", "ghost"));

        assertEquals("error", notFound.path("type").asText());
        assertFalse(notFound.path("data").path("success").asBoolean());
        assertEquals("not_found", notFound.path("data").path("error_type").asText());
        assertEquals("ghost", notFound.path("data").path("agent_id").asText());

        JsonNode missingId = send("stop_agent", Map.of());
        assertEquals("validation", missingId.path("data").path("error_type").asText());
        assertTrue(connection.isOpen());
    }

    @Test
    void shouldRejectOverlappingManualExecution() throws Exception {
        String agentId = createRunningAgent();

        assertNull(send("websocket_execution", Map.of("agent_id", agentId)));
        JsonNode conflict = send("execute", Map.of("agent_id", agentId));

        assertEquals("conflict", conflict.path("data").path("error_type").asText());
        assertEquals("execute", conflict.path("data").path("request_type").asText());
    }

    @Test
    void shouldKeepAgentsRunningAfterDisconnect() throws Exception {
        String agentId = createRunningAgent();
        Instant nextDue = scheduler.nextDue(agentId).orElseThrow();

        handler.onClose(connection.getId());

        assertEquals(AgentStatus.RUNNING, manager.statusOf(agentId));
        assertEquals(nextDue, scheduler.nextDue(agentId).orElseThrow());
        assertEquals(5, manager.view(agentId).getSchedule().getIntervalSeconds());
    }

    @Test
    void shouldSubscribeToAgentFromConnectionPath() throws Exception {
        String agentId = createRunningAgent();
        RecordingConnection watcher = new RecordingConnection("c2");
        handler.onOpen(watcher, agentId);

        handler.onFrame("c2", "{\"type\":\"stop_agent\"}");

        assertEquals(AgentStatus.STOPPED, manager.statusOf(agentId));
        assertTrue(watcher.getFrames().stream().anyMatch(frame -> frame.contains("\"stop_agent_response\"")));
        assertTrue(connection.getFrames().stream().anyMatch(frame -> frame.contains("\"previous_status\":\"running\"")));
    }
}
