package com.zephyrus.agent.service;

import com.zephyrus.agent.client.CallResult;
import com.zephyrus.agent.client.ContractCall;
import com.zephyrus.agent.client.ContractCallClient;
import com.zephyrus.agent.client.ContractStateProvider;
import com.zephyrus.agent.client.Decision;
import com.zephyrus.agent.client.DecisionOracle;
import com.zephyrus.agent.client.InterfaceRejectedException;
import com.zephyrus.agent.model.AgentSnapshot;
import com.zephyrus.agent.model.ContractFunction;
import com.zephyrus.agent.model.ExecutionOutcome;
import com.zephyrus.agent.model.ExecutionRecord;
import com.zephyrus.agent.model.ExecutionTrigger;
import com.zephyrus.agent.store.AgentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one decide-validate-call cycle for an agent snapshot and produces exactly
 * one {@link ExecutionRecord}. Failures of any collaborator end up in the record;
 * this service never throws to its caller.
 */
@Slf4j
@Service
public class ExecutionPipelineService {

    static final String TIMEOUT_DETAIL = "timeout";

    private final DecisionOracle oracle;
    private final ContractCallClient callClient;
    private final ContractStateProvider stateProvider;
    private final AgentStore store;
    private final ParameterValidator validator;
    private final Clock clock;
    private final ExecutorService callPool;
    private final long callTimeoutMillis;

    @Autowired
    public ExecutionPipelineService(DecisionOracle oracle,
                                    ContractCallClient callClient,
                                    ContractStateProvider stateProvider,
                                    AgentStore store,
                                    ParameterValidator validator,
                                    Clock clock,
                                    @Qualifier("collaboratorCallPool") ExecutorService callPool,
                                    @Value("${agent.execution.call-timeout-ms:30000}") long callTimeoutMillis) {
        this.oracle = oracle;
        this.callClient = callClient;
        this.stateProvider = stateProvider;
        this.store = store;
        this.validator = validator;
        this.clock = clock;
        this.callPool = callPool;
        this.callTimeoutMillis = callTimeoutMillis;
    }

    public ExecutionRecord execute(AgentSnapshot agent, ExecutionTrigger trigger) {
        return execute(agent, trigger, ExecutionObserver.NONE);
    }

    public ExecutionRecord execute(AgentSnapshot agent, ExecutionTrigger trigger, ExecutionObserver observer) {
        ExecutionRecord.ExecutionRecordBuilder record = ExecutionRecord.builder()
            .executionId(UUID.randomUUID().toString())
            .agentId(agent.getAgentId())
            .trigger(trigger)
            .parameters(Map.of())
            .startedAt(clock.instant());

        ExecutionRecord.ExecutionRecordBuilder outcome;
        try {
            outcome = run(agent, observer, record);
        } catch (RuntimeException e) {
            log.error("Agent {} run failed unexpectedly", agent.getAgentId(), e);
            outcome = fail(record, "internal error: " + describe(e));
        }
        ExecutionRecord finished = finish(outcome);
        persist(finished);
        log.info("Agent {} {} run finished: {}{}", agent.getAgentId(), trigger.wireName(),
            finished.getOutcome().wireName(),
            finished.getErrorDetail() != null ? " (" + finished.getErrorDetail() + ")" : "");
        return finished;
    }

    private ExecutionRecord.ExecutionRecordBuilder run(AgentSnapshot agent,
                                                       ExecutionObserver observer,
                                                       ExecutionRecord.ExecutionRecordBuilder record) {
        Map<String, Object> state;
        try {
            observer.onStep("Reading contract state");
            state = withTimeout(() -> stateProvider.readState(agent));
        } catch (TimeoutException e) {
            return fail(record, TIMEOUT_DETAIL);
        } catch (Exception e) {
            return fail(record, "state read failed: " + describe(e));
        }

        Decision decision;
        try {
            observer.onStep("Requesting decision");
            decision = withTimeout(() -> oracle.decide(agent, state));
        } catch (TimeoutException e) {
            return fail(record, TIMEOUT_DETAIL);
        } catch (Exception e) {
            return fail(record, "decision failed: " + describe(e));
        }

        if (decision == null || decision.isNoAction()) {
            observer.onStep("No action chosen");
            return record.outcome(ExecutionOutcome.SKIPPED);
        }

        record.functionName(decision.getFunctionName()).parameters(decision.getParameters());
        observer.onStep("Decision: call " + decision.getFunctionName() + " with " + decision.getParameters());

        Optional<ContractFunction> match = agent.findFunction(decision.getFunctionName());
        if (match.isEmpty()) {
            return fail(record, "function " + decision.getFunctionName() + " is not enabled for this agent");
        }
        ContractFunction function = match.get();

        ContractCall call;
        try {
            Optional<String> violation = validator.firstViolation(function, decision.getParameters());
            if (violation.isPresent()) {
                return fail(record, "validation failed: " + violation.get());
            }
            record.parameters(validator.resolveArguments(function, decision.getParameters()));

            call = ContractCall.builder()
                .contractAddress(agent.getContractAddress())
                .abi(agent.getAbi())
                .networkId(agent.getNetworkId())
                .functionName(function.getName())
                .arguments(validator.orderedArguments(function, decision.getParameters()))
                .direction(function.getDirection())
                .gasLimit(agent.getGasLimit())
                .maxPriorityFee(agent.getMaxPriorityFee())
                .build();
        } catch (RuntimeException e) {
            log.warn("Agent {}: validating arguments of {} failed", agent.getAgentId(), function.getName(), e);
            return fail(record, "validation failed: " + describe(e));
        }

        CallResult result;
        try {
            observer.onStep("Calling " + function.getName());
            result = withTimeout(() -> callClient.call(call));
        } catch (TimeoutException e) {
            return fail(record, TIMEOUT_DETAIL);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof InterfaceRejectedException) {
                return fail(record, "call rejected: " + cause.getMessage()).nonRecoverable(true);
            }
            return fail(record, "call failed: " + cause.getMessage());
        } catch (Exception e) {
            return fail(record, "call failed: " + describe(e));
        }

        record.callId(result.getCallId()).result(result.getValue());

        if (function.isRead()) {
            Optional<String> returnViolation = validator.checkReturnValue(function, result.getValue());
            if (returnViolation.isPresent()) {
                return fail(record, "return validation failed: " + returnViolation.get());
            }
            observer.onStep("Read " + function.getName() + " = " + result.getValue());
        } else {
            observer.onStep("Submitted " + function.getName() + ", transaction " + result.getCallId());
        }
        return record.outcome(ExecutionOutcome.SUCCESS);
    }

    private ExecutionRecord finish(ExecutionRecord.ExecutionRecordBuilder record) {
        return record.finishedAt(clock.instant()).build();
    }

    private void persist(ExecutionRecord record) {
        try {
            store.appendExecutionRecord(record);
        } catch (IOException | RuntimeException e) {
            log.warn("Could not persist execution {} for agent {}: {}",
                record.getExecutionId(), record.getAgentId(), e.getMessage());
        }
    }

    private <T> T withTimeout(Callable<T> task) throws Exception {
        Future<T> future = callPool.submit(task);
        try {
            return future.get(callTimeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw e;
        }
    }

    private static ExecutionRecord.ExecutionRecordBuilder fail(ExecutionRecord.ExecutionRecordBuilder record,
                                                               String detail) {
        return record.outcome(ExecutionOutcome.FAILURE).errorDetail(detail);
    }

    private static String describe(Exception e) {
        Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
