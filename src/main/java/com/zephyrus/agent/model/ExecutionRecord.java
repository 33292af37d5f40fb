package com.zephyrus.agent.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * One execution attempt. Never mutated after the pipeline builds it.
 */
@Value
@Builder
@Jacksonized
public class ExecutionRecord {
    String executionId;
    String agentId;
    ExecutionTrigger trigger;
    /** Null when the decision step chose no action. */
    String functionName;
    Map<String, Object> parameters;
    ExecutionOutcome outcome;
    String errorDetail;
    /** Transaction hash for write calls. */
    String callId;
    /** Returned value for read calls. */
    Object result;
    /** Set when the failure should stop the agent without further retries. */
    boolean nonRecoverable;
    Instant startedAt;
    Instant finishedAt;

    @JsonIgnore
    public boolean isFailure() {
        return outcome == ExecutionOutcome.FAILURE;
    }
}
