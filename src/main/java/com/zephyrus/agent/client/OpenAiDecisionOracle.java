package com.zephyrus.agent.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zephyrus.agent.model.AgentSnapshot;
import com.zephyrus.agent.model.ContractFunction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Asks an OpenAI chat model to pick a function through the
 * {@code execute_contract_function} tool. A reply without a tool call is "no action".
 */
@Slf4j
@Component
public class OpenAiDecisionOracle implements DecisionOracle {

    static final String TOOL_NAME = "execute_contract_function";

    private static final String SYSTEM_PROMPT =
        "You are an autonomous agent managing a smart contract. Call " + TOOL_NAME
            + " only when the contract state requires an action; otherwise reply without a tool call.";

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
    private final String apiUrl;
    private final String apiKey;
    private final String model;

    public OpenAiDecisionOracle(RestTemplate restTemplate,
                                @Value("${openai.api.url:https://api.openai.com/v1}") String apiUrl,
                                @Value("${openai.api.key:}") String apiKey,
                                @Value("${openai.model:gpt-4-turbo}") String model) {
        this.restTemplate = restTemplate;
        this.apiUrl = apiUrl;
        this.apiKey = apiKey;
        this.model = model;
    }

    @Override
    public Decision decide(AgentSnapshot agent, Map<String, Object> contractState) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("openai.api.key is not configured");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(apiKey);

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("model", model);
        request.put("messages", List.of(
            Map.of("role", "system", "content", SYSTEM_PROMPT),
            Map.of("role", "user", "content", buildPrompt(agent, contractState))));
        request.put("tools", List.of(toolDefinition(agent)));
        request.put("tool_choice", "auto");

        String response = restTemplate.postForObject(
            apiUrl + "/chat/completions", new HttpEntity<>(request, headers), String.class);
        return parseDecision(response);
    }

    String buildPrompt(AgentSnapshot agent, Map<String, Object> contractState) {
        List<Map<String, Object>> functions = agent.getFunctions().stream()
            .map(this::describe)
            .toList();
        return "Current contract state:\n" + toJson(contractState)
            + "\n\nAgent description:\n" + (agent.getDescription() == null ? "" : agent.getDescription())
            + "\n\nAvailable functions:\n" + toJson(functions)
            + "\n\nBased on the current state and the agent's description, decide whether one of the"
            + " available functions should be called, and with which parameters.";
    }

    Decision parseDecision(String response) {
        try {
            JsonNode root = mapper.readTree(response);
            JsonNode toolCalls = root.path("choices").path(0).path("message").path("tool_calls");
            for (JsonNode toolCall : toolCalls) {
                JsonNode function = toolCall.path("function");
                if (!TOOL_NAME.equals(function.path("name").asText())) {
                    continue;
                }
                JsonNode arguments = mapper.readTree(function.path("arguments").asText("{}"));
                String functionName = arguments.path("function_name").asText(null);
                if (functionName == null || functionName.isBlank()) {
                    return Decision.noAction();
                }
                Map<String, Object> parameters = arguments.has("parameters")
                    ? mapper.convertValue(arguments.get("parameters"), Map.class)
                    : Map.of();
                log.debug("Decision oracle chose {} with {}", functionName, parameters);
                return Decision.call(functionName, parameters);
            }
            return Decision.noAction();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable decision oracle response: " + e.getOriginalMessage(), e);
        }
    }

    private Map<String, Object> toolDefinition(AgentSnapshot agent) {
        List<String> names = agent.getFunctions().stream().map(ContractFunction::getName).toList();
        return Map.of(
            "type", "function",
            "function", Map.of(
                "name", TOOL_NAME,
                "description", "Execute a function on the smart contract",
                "parameters", Map.of(
                    "type", "object",
                    "properties", Map.of(
                        "function_name", Map.of("type", "string", "enum", names),
                        "parameters", Map.of("type", "object")),
                    "required", List.of("function_name", "parameters"))));
    }

    private Map<String, Object> describe(ContractFunction function) {
        Map<String, Object> description = new LinkedHashMap<>();
        description.put("name", function.getName());
        description.put("signature", function.getSignature());
        description.put("type", function.getDirection().wireName());
        description.put("parameters", function.getParameters());
        description.put("validation_rules", function.getValidationRules());
        return description;
    }

    private String toJson(Object value) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
