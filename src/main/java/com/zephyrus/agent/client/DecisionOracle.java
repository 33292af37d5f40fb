package com.zephyrus.agent.client;

import com.zephyrus.agent.model.AgentSnapshot;

import java.util.Map;

/**
 * Chooses which enabled function, if any, an agent should call this cycle.
 */
public interface DecisionOracle {

    Decision decide(AgentSnapshot agent, Map<String, Object> contractState);
}
