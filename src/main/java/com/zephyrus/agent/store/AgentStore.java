package com.zephyrus.agent.store;

import com.zephyrus.agent.model.AgentDefinition;
import com.zephyrus.agent.model.ExecutionRecord;

import java.io.IOException;
import java.util.List;

/**
 * Durable side of the service: stored agent definitions and the execution log.
 */
public interface AgentStore {

    void appendExecutionRecord(ExecutionRecord record) throws IOException;

    /**
     * @throws com.zephyrus.agent.exception.NotFoundException if no definition exists for {@code agentId}
     */
    AgentDefinition loadAgent(String agentId) throws IOException;

    List<AgentDefinition> loadAllAgents();

    /** Most recent records for one agent, newest last. */
    List<ExecutionRecord> recentExecutions(String agentId, int limit) throws IOException;
}
