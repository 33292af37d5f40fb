package com.zephyrus.agent.client;

import com.zephyrus.agent.model.AgentSnapshot;

import java.util.Map;

public interface ContractStateProvider {

    Map<String, Object> readState(AgentSnapshot agent);
}
