package com.zephyrus.agent.client;

import com.zephyrus.agent.model.AgentSnapshot;
import com.zephyrus.agent.model.ContractFunction;
import com.zephyrus.agent.model.FunctionDirection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class OpenAiDecisionOracleTest {

    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private OpenAiDecisionOracle oracle;
    private AgentSnapshot agent;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        oracle = new OpenAiDecisionOracle(restTemplate, "http://oracle", "sk-test", "gpt-4-turbo");
        agent = AgentSnapshot.builder()
            .agentId("a1")
            .description("Keep the vault topped up")
            .contractState(Map.of())
            .function(ContractFunction.builder().name("deposit").direction(FunctionDirection.WRITE).enabled(true).build())
            .function(ContractFunction.builder().name("balance").direction(FunctionDirection.READ).enabled(true).build())
            .build();
    }

    @Test
    void shouldParseToolCallIntoDecision() {
        server.expect(requestTo("http://oracle/chat/completions"))
            .andExpect(method(HttpMethod.POST))
            .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer sk-test"))
            .andExpect(jsonPath("$.model").value("gpt-4-turbo"))
            .andExpect(jsonPath("$.tools[0].function.name").value(OpenAiDecisionOracle.TOOL_NAME))
            .andExpect(jsonPath("$.tools[0].function.parameters.properties.function_name.enum[0]").value("deposit"))
            .andRespond(withSuccess("{\"choices\":[{\"message\":{\"tool_calls\":[{\"function\":{"
                + "\"name\":\"execute_contract_function\","
                + "\"arguments\":\"{\\\"function_name\\\":\\\"deposit\\\",\\\"parameters\\\":{\\\"amount\\\":10}}\"}}]}}]}",
                MediaType.APPLICATION_JSON));

        Decision decision = oracle.decide(agent, Map.of("balance", 3));

        assertFalse(decision.isNoAction());
        assertEquals("deposit", decision.getFunctionName());
        assertEquals(10, decision.getParameters().get("amount"));
        server.verify();
    }

    @Test
    void shouldTreatPlainReplyAsNoAction() {
        Decision decision = oracle.parseDecision("{\"choices\":[{\"message\":{\"content\":\"Nothing to do.\"}}]}");

        assertTrue(decision.isNoAction());
    }

    @Test
    void shouldIgnoreOtherTools() {
        Decision decision = oracle.parseDecision("{\"choices\":[{\"message\":{\"tool_calls\":[{\"function\":"
            + "{\"name\":\"something_else\",\"arguments\":\"{}\"}}]}}]}");

        assertTrue(decision.isNoAction());
    }

    @Test
    void shouldFailOnUnreadableResponse() {
        assertThrows(IllegalStateException.class, () -> oracle.parseDecision("<html>"));
    }

    @Test
    void shouldRefuseToCallWithoutApiKey() {
        OpenAiDecisionOracle unconfigured = new OpenAiDecisionOracle(restTemplate, "http://oracle", "", "gpt-4-turbo");

        assertThrows(IllegalStateException.class, () -> unconfigured.decide(agent, Map.of()));
    }

    @Test
    void shouldDescribeStateAndFunctionsInPrompt() {
        String prompt = oracle.buildPrompt(agent, Map.of("balance", 3));

        assertTrue(prompt.contains("Keep the vault topped up"));
        assertTrue(prompt.contains("\"balance\" : 3"));
        assertTrue(prompt.contains("deposit"));
    }
}
