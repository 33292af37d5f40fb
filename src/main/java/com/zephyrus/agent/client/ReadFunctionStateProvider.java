package com.zephyrus.agent.client;

import com.zephyrus.agent.model.AgentSnapshot;
import com.zephyrus.agent.model.ContractFunction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the contract state by calling every enabled read function that takes
 * no arguments, layered over the agent's static {@code contract_state}.
 */
@Slf4j
@Component
public class ReadFunctionStateProvider implements ContractStateProvider {

    private final ContractCallClient callClient;

    public ReadFunctionStateProvider(ContractCallClient callClient) {
        this.callClient = callClient;
    }

    @Override
    public Map<String, Object> readState(AgentSnapshot agent) {
        Map<String, Object> state = new LinkedHashMap<>(agent.getContractState());

        for (ContractFunction function : agent.getFunctions()) {
            if (!function.isRead() || !function.takesNoArguments()) {
                continue;
            }
            try {
                CallResult result = callClient.call(ContractCall.builder()
                    .contractAddress(agent.getContractAddress())
                    .abi(agent.getAbi())
                    .networkId(agent.getNetworkId())
                    .functionName(function.getName())
                    .arguments(List.of())
                    .direction(function.getDirection())
                    .build());
                state.put(function.getName(), result.getValue());
            } catch (RuntimeException e) {
                log.warn("Agent {}: reading {} for state snapshot failed: {}",
                    agent.getAgentId(), function.getName(), e.getMessage());
            }
        }
        return state;
    }
}
