package com.zephyrus.agent.service;

import com.zephyrus.agent.exception.ConflictException;
import com.zephyrus.agent.exception.NotFoundException;
import com.zephyrus.agent.exception.PreconditionException;
import com.zephyrus.agent.exception.ValidationException;
import com.zephyrus.agent.model.AgentDefinition;
import com.zephyrus.agent.model.AgentRecord;
import com.zephyrus.agent.model.AgentSnapshot;
import com.zephyrus.agent.model.AgentSpec;
import com.zephyrus.agent.model.AgentStatus;
import com.zephyrus.agent.model.AgentView;
import com.zephyrus.agent.model.ContractDefinition;
import com.zephyrus.agent.model.ContractFunction;
import com.zephyrus.agent.model.ContractSpec;
import com.zephyrus.agent.model.ExecutionRecord;
import com.zephyrus.agent.model.ExecutionTrigger;
import com.zephyrus.agent.model.FunctionDirection;
import com.zephyrus.agent.model.FunctionParameter;
import com.zephyrus.agent.model.FunctionSpec;
import com.zephyrus.agent.model.NotificationSpec;
import com.zephyrus.agent.model.NotificationTarget;
import com.zephyrus.agent.model.ParameterRule;
import com.zephyrus.agent.model.Schedule;
import com.zephyrus.agent.model.ScheduleSpec;
import com.zephyrus.agent.model.ScheduleType;
import com.zephyrus.agent.protocol.Envelope;
import com.zephyrus.agent.protocol.OutboundType;
import com.zephyrus.agent.store.AgentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Owns every agent record and is the only component that changes an agent's status.
 *
 * <p>Lifecycle: {@code created -> configured -> running <-> stopped}. A running
 * agent escalates to {@code error} after a non-recoverable failure or too many
 * consecutive failures; from there only {@code stop} and {@code remove} apply.
 * All public operations are serialized on this instance. Runs execute outside
 * the lock against an {@link AgentSnapshot}.
 */
@Slf4j
@Service
public class AgentManagerService {

    static final Pattern CONTRACT_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");
    static final Pattern FUNCTION_SIGNATURE = Pattern.compile("^([A-Za-z_$][A-Za-z0-9_$]*)\\(([^()]*)\\)$");

    private final AgentSchedulerService scheduler;
    private final ExecutionPipelineService pipeline;
    private final ConnectionRegistryService connections;
    private final NotificationService notifications;
    private final AgentStore store;
    private final Clock clock;
    private final int maxConsecutiveFailures;
    private final long defaultNetworkId;

    private final Map<String, AgentRecord> agents = new LinkedHashMap<>();
    private final Map<String, ContractDefinition> contracts = new LinkedHashMap<>();
    // status frames queued under the lock, published after it is released
    private final Queue<StatusFrame> outbox = new ConcurrentLinkedQueue<>();

    @Autowired
    public AgentManagerService(AgentSchedulerService scheduler,
                               ExecutionPipelineService pipeline,
                               ConnectionRegistryService connections,
                               NotificationService notifications,
                               AgentStore store,
                               Clock clock,
                               @Value("${agent.execution.max-consecutive-failures:3}") int maxConsecutiveFailures,
                               @Value("${blockchain.network-id:57054}") long defaultNetworkId) {
        this.scheduler = scheduler;
        this.pipeline = pipeline;
        this.connections = connections;
        this.notifications = notifications;
        this.store = store;
        this.clock = clock;
        this.maxConsecutiveFailures = maxConsecutiveFailures;
        this.defaultNetworkId = defaultNetworkId;
    }

    public synchronized ContractDefinition registerContract(ContractSpec spec) {
        if (isBlank(spec.getName())) {
            throw new ValidationException("Contract name is required");
        }
        requireAddress(spec.getAddress(), null);
        if (spec.getAbi() == null || spec.getAbi().isEmpty()) {
            throw new ValidationException("Contract ABI must not be empty");
        }
        ContractDefinition contract = ContractDefinition.builder()
            .contractId(UUID.randomUUID().toString())
            .name(spec.getName())
            .address(spec.getAddress())
            .abi(List.copyOf(spec.getAbi()))
            .networkId(spec.getNetworkId() != null ? spec.getNetworkId() : defaultNetworkId)
            .build();
        contracts.put(contract.getContractId(), contract);
        log.info("Contract {} registered at {}", contract.getName(), contract.getAddress());
        return contract;
    }

    public synchronized Optional<ContractDefinition> findContract(String contractId) {
        return Optional.ofNullable(contracts.get(contractId));
    }

    /**
     * Creates an agent in status {@code created}.
     *
     * @param connectionId      creating connection, recorded as owner for connection-scoped agents
     * @param fallbackContractId contract used when the spec names neither a contract id nor an address
     * @return the new agent id
     */
    public synchronized String create(AgentSpec spec, String connectionId, String fallbackContractId) {
        if (isBlank(spec.getName())) {
            throw new ValidationException("Agent name is required");
        }
        if (isBlank(spec.getOwner())) {
            throw new ValidationException("Agent owner is required");
        }

        String address = spec.getContractAddress();
        List<Map<String, Object>> abi = spec.getAbi();
        Long networkId = spec.getNetworkId();
        String contractId = spec.getContractId();
        if (contractId == null && isBlank(address) && fallbackContractId != null) {
            contractId = fallbackContractId;
        }
        if (contractId != null) {
            ContractDefinition contract = contracts.get(contractId);
            if (contract == null) {
                throw new NotFoundException("Unknown contract " + contractId);
            }
            address = isBlank(address) ? contract.getAddress() : address;
            abi = abi == null || abi.isEmpty() ? contract.getAbi() : abi;
            networkId = networkId != null ? networkId : contract.getNetworkId();
        }

        requireAddress(address, null);
        if (abi == null || abi.isEmpty()) {
            throw new ValidationException("Contract interface must not be empty");
        }

        String agentId = isBlank(spec.getAgentId()) ? UUID.randomUUID().toString() : spec.getAgentId();
        if (agents.containsKey(agentId)) {
            throw new ConflictException("Agent " + agentId + " already exists", agentId);
        }

        AgentRecord agent = new AgentRecord();
        agent.setId(agentId);
        agent.setName(spec.getName());
        agent.setDescription(spec.getDescription());
        agent.setOwner(spec.getOwner());
        agent.setContractId(contractId);
        agent.setContractAddress(address);
        agent.setAbi(new ArrayList<>(abi));
        agent.setNetworkId(networkId != null ? networkId : defaultNetworkId);
        agent.setGasLimit(spec.getGasLimit());
        agent.setMaxPriorityFee(spec.getMaxPriorityFee());
        if (spec.getContractState() != null) {
            agent.setContractState(new LinkedHashMap<>(spec.getContractState()));
        }
        agent.setConnectionScoped(spec.isConnectionScoped());
        agent.setOwnerConnectionId(spec.isConnectionScoped() ? connectionId : null);
        agent.setCreatedAt(clock.instant());
        agent.setUpdatedAt(agent.getCreatedAt());
        agents.put(agentId, agent);

        log.info("Agent {} ({}) created for contract {}", agentId, agent.getName(), address);
        return agentId;
    }

    /**
     * @return the function id
     */
    public synchronized String addFunction(String agentId, FunctionSpec spec) {
        AgentRecord agent = require(agentId);
        String name = spec.getFunctionName();
        if (isBlank(name)) {
            throw new ValidationException("Function name is required", agentId);
        }

        Map<String, Object> abiEntry = findAbiEntry(agent, name)
            .orElseThrow(() -> new ValidationException(
                "Function " + name + " does not exist in the contract ABI", agentId));
        if (spec.getAbi() != null && !spec.getAbi().isEmpty()) {
            abiEntry = spec.getAbi();
        }

        FunctionDirection direction;
        if (spec.getFunctionType() != null) {
            direction = FunctionDirection.fromWire(spec.getFunctionType());
            if (direction == null) {
                throw new ValidationException("Unrecognized function type '" + spec.getFunctionType() + "'", agentId);
            }
        } else {
            direction = FunctionDirection.fromAbiEntry(abiEntry);
            if (direction == null) {
                throw new ValidationException("Cannot derive direction of " + name + " from its ABI", agentId);
            }
        }

        List<FunctionParameter> parameters = spec.getParameters() != null
            ? spec.getParameters()
            : parametersFromAbi(abiEntry);
        Set<String> parameterNames = new HashSet<>();
        for (FunctionParameter parameter : parameters) {
            if (parameter == null || isBlank(parameter.getName())) {
                throw new ValidationException("Every parameter of " + name + " needs a name", agentId);
            }
            if (!parameterNames.add(parameter.getName())) {
                throw new ValidationException("Duplicate parameter '" + parameter.getName() + "' in " + name, agentId);
            }
        }

        String signature = spec.getFunctionSignature();
        if (signature == null) {
            signature = name + "(" + String.join(",", parameters.stream().map(p -> String.valueOf(p.getType())).toList()) + ")";
        } else {
            var matcher = FUNCTION_SIGNATURE.matcher(signature.trim());
            if (!matcher.matches()) {
                throw new ValidationException("Malformed function signature '" + signature + "'", agentId);
            }
            if (!matcher.group(1).equals(name)) {
                throw new ValidationException("Signature " + signature + " does not name function " + name, agentId);
            }
            signature = signature.trim();
        }

        Map<String, ParameterRule> rules = spec.getValidationRules() != null ? spec.getValidationRules() : Map.of();
        checkRules(agentId, name, direction, parameters, rules, spec.getReturnRule());

        ContractFunction function = ContractFunction.builder()
            .functionId(UUID.randomUUID().toString())
            .name(name)
            .signature(signature)
            .direction(direction)
            .enabled(spec.getEnabled() == null || spec.getEnabled())
            .parameters(parameters)
            .validationRules(rules)
            .returnRule(spec.getReturnRule())
            .abi(abiEntry)
            .build();

        agent.getFunctions().values().removeIf(existing -> existing.getName().equals(name));
        agent.getFunctions().put(function.getFunctionId(), function);
        agent.setUpdatedAt(clock.instant());
        log.info("Agent {} function {} added ({}, {})", agentId, signature, direction.wireName(),
            function.isEnabled() ? "enabled" : "disabled");
        return function.getFunctionId();
    }

    /**
     * Replaces the agent's schedule. A running agent's schedule cannot change.
     */
    public synchronized Schedule setSchedule(String agentId, ScheduleSpec spec) {
        AgentRecord agent = require(agentId);
        if (agent.getStatus() == AgentStatus.RUNNING) {
            throw new ConflictException("Agent " + agentId + " is running; stop it before changing its schedule", agentId);
        }

        String type = spec.getScheduleType();
        if (type == null) {
            type = spec.getCronExpression() != null ? "cron" : "interval";
        }
        boolean active = spec.getActive() == null || spec.getActive();
        String scheduleId = UUID.randomUUID().toString();

        Schedule schedule;
        switch (type.toLowerCase(Locale.ROOT)) {
            case "interval" -> {
                if (spec.getIntervalSeconds() == null || spec.getIntervalSeconds() <= 0) {
                    throw new ValidationException("Interval must be a positive number of seconds", agentId);
                }
                schedule = Schedule.builder()
                    .scheduleId(scheduleId)
                    .type(ScheduleType.INTERVAL)
                    .intervalSeconds(spec.getIntervalSeconds())
                    .active(active)
                    .build();
            }
            case "cron" -> {
                if (!Schedule.isValidCron(spec.getCronExpression())) {
                    throw new ValidationException("Invalid cron expression '" + spec.getCronExpression() + "'", agentId);
                }
                schedule = Schedule.cron(scheduleId, spec.getCronExpression().trim(), active);
                if (active && !schedule.firesAfter(clock.instant())) {
                    throw new ValidationException("Cron expression '" + spec.getCronExpression() + "' never fires", agentId);
                }
            }
            default -> throw new ValidationException("Unrecognized schedule type '" + type + "'", agentId);
        }

        agent.setSchedule(schedule);
        agent.setUpdatedAt(clock.instant());
        log.info("Agent {} schedule set: {}", agentId, describe(schedule));
        return schedule;
    }

    /**
     * @return the notification id
     */
    public synchronized String addNotification(String agentId, NotificationSpec spec) {
        AgentRecord agent = require(agentId);
        if (isBlank(spec.getNotificationType())) {
            throw new ValidationException("Notification type is required", agentId);
        }
        Map<String, Object> configuration = spec.getConfiguration() != null ? spec.getConfiguration() : Map.of();
        Object channel = configuration.get("channel");
        if (NotificationService.SLACK.equalsIgnoreCase(spec.getNotificationType()) && (channel == null || channel.toString().isBlank())) {
            throw new ValidationException("Slack notifications need a channel", agentId);
        }
        NotificationTarget target = NotificationTarget.builder()
            .notificationId(UUID.randomUUID().toString())
            .type(spec.getNotificationType().toLowerCase(Locale.ROOT))
            .channel(channel != null ? channel.toString() : null)
            .notifyOnSuccess(Boolean.parseBoolean(String.valueOf(configuration.getOrDefault("notify_on_success", "false"))))
            .enabled(spec.getEnabled() == null || spec.getEnabled())
            .build();
        agent.getNotifications().add(target);
        agent.setUpdatedAt(clock.instant());
        log.info("Agent {} notification {} added ({})", agentId, target.getNotificationId(), target.getType());
        return target.getNotificationId();
    }

    /**
     * Applies optional overrides and completes setup.
     */
    public AgentView configure(String agentId, AgentSpec overrides) {
        try {
            return configureLocked(agentId, overrides);
        } finally {
            flushOutbox();
        }
    }

    private synchronized AgentView configureLocked(String agentId, AgentSpec overrides) {
        AgentRecord agent = require(agentId);
        if (agent.getStatus() == AgentStatus.RUNNING || agent.getStatus() == AgentStatus.ERROR) {
            throw new ConflictException("Agent " + agentId + " cannot be configured while " + agent.getStatus().wireName(), agentId);
        }
        if (agent.getFunctions().isEmpty()) {
            throw new PreconditionException("Agent " + agentId + " has no functions", agentId);
        }
        if (overrides != null) {
            if (!isBlank(overrides.getName())) {
                agent.setName(overrides.getName());
            }
            if (overrides.getDescription() != null) {
                agent.setDescription(overrides.getDescription());
            }
            if (overrides.getGasLimit() != null) {
                agent.setGasLimit(overrides.getGasLimit());
            }
            if (overrides.getMaxPriorityFee() != null) {
                agent.setMaxPriorityFee(overrides.getMaxPriorityFee());
            }
            if (overrides.getContractState() != null) {
                agent.setContractState(new LinkedHashMap<>(overrides.getContractState()));
            }
        }
        agent.setUpdatedAt(clock.instant());
        if (agent.getStatus() == AgentStatus.CREATED) {
            transition(agent, AgentStatus.CONFIGURED);
        }
        return view(agent);
    }

    public AgentView start(String agentId) {
        try {
            return startLocked(agentId);
        } finally {
            flushOutbox();
        }
    }

    private synchronized AgentView startLocked(String agentId) {
        AgentRecord agent = require(agentId);
        switch (agent.getStatus()) {
            case RUNNING -> throw new ConflictException("Agent " + agentId + " is already running", agentId);
            case ERROR -> throw new ConflictException("Agent " + agentId + " is in error; stop it before starting again", agentId);
            default -> {
            }
        }
        if (!agent.hasEnabledFunction()) {
            throw new PreconditionException("Agent " + agentId + " has no enabled function", agentId);
        }
        if (!agent.hasExecutableSchedule(clock.instant())) {
            throw new PreconditionException("Agent " + agentId + " has no active, valid schedule", agentId);
        }

        scheduler.register(agentId, agent.getSchedule(), () -> runCycle(agentId, ExecutionTrigger.SCHEDULED));
        agent.setConsecutiveFailures(0);
        transition(agent, AgentStatus.RUNNING);
        return view(agent);
    }

    /**
     * Stops scheduling. A run already in flight finishes normally.
     */
    public AgentView stop(String agentId) {
        try {
            return stopLocked(agentId);
        } finally {
            flushOutbox();
        }
    }

    private synchronized AgentView stopLocked(String agentId) {
        AgentRecord agent = require(agentId);
        if (agent.getStatus() != AgentStatus.RUNNING && agent.getStatus() != AgentStatus.ERROR) {
            throw new ConflictException("Agent " + agentId + " is not running", agentId);
        }
        scheduler.deregister(agentId);
        transition(agent, AgentStatus.STOPPED);
        return view(agent);
    }

    public synchronized void remove(String agentId) {
        AgentRecord agent = require(agentId);
        if (agent.getStatus() == AgentStatus.RUNNING) {
            throw new ConflictException("Agent " + agentId + " is running; stop it before removing", agentId);
        }
        scheduler.deregister(agentId);
        agents.remove(agentId);
        connections.forgetAgent(agentId);
        log.info("Agent {} removed", agentId);
    }

    /**
     * Starts a manual run now, outside the schedule.
     *
     * @throws ConflictException when a run for the agent is already in flight
     */
    public synchronized void execute(String agentId) {
        AgentRecord agent = require(agentId);
        if (!agent.hasEnabledFunction()) {
            throw new PreconditionException("Agent " + agentId + " has no enabled function", agentId);
        }
        if (!scheduler.dispatchNow(agentId, () -> runCycle(agentId, ExecutionTrigger.MANUAL))) {
            throw new ConflictException("Agent " + agentId + " already has a run in progress", agentId);
        }
        log.info("Agent {} manual run dispatched", agentId);
    }

    /**
     * Materializes a stored definition as a configured agent.
     */
    public String load(String agentId, String connectionId) {
        try {
            return loadLocked(agentId, connectionId);
        } finally {
            flushOutbox();
        }
    }

    private synchronized String loadLocked(String agentId, String connectionId) {
        if (agents.containsKey(agentId)) {
            throw new ConflictException("Agent " + agentId + " is already loaded", agentId);
        }
        AgentDefinition definition;
        try {
            definition = store.loadAgent(agentId);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read definition of agent " + agentId, e);
        }
        if (definition.getAgentId() == null) {
            definition.setAgentId(agentId);
        }
        return materializeLocked(definition, connectionId);
    }

    /**
     * Creates an agent with its functions, schedule and notifications in one step.
     * Nothing is kept if any part is rejected.
     */
    public String materialize(AgentDefinition definition, String connectionId) {
        try {
            return materializeLocked(definition, connectionId);
        } finally {
            flushOutbox();
        }
    }

    private synchronized String materializeLocked(AgentDefinition definition, String connectionId) {
        AgentSpec spec = definition.getAgent();
        if (spec == null) {
            throw new ValidationException("Definition has no 'agent' section", definition.getAgentId());
        }
        if (definition.getAgentId() != null) {
            spec.setAgentId(definition.getAgentId());
        }

        String agentId = create(spec, connectionId, null);
        try {
            for (FunctionSpec function : nonNull(definition.getFunctions())) {
                if (function == null) {
                    throw new ValidationException("Definition of " + agentId + " has an empty function entry", agentId);
                }
                addFunction(agentId, function);
            }
            if (definition.getSchedule() != null) {
                setSchedule(agentId, definition.getSchedule());
            }
            for (NotificationSpec notification : nonNull(definition.getNotifications())) {
                if (notification == null) {
                    throw new ValidationException("Definition of " + agentId + " has an empty notification entry", agentId);
                }
                addNotification(agentId, notification);
            }
            configureLocked(agentId, null);
        } catch (RuntimeException e) {
            agents.remove(agentId);
            throw e;
        }
        return agentId;
    }

    public synchronized AgentView view(String agentId) {
        return view(require(agentId));
    }

    public synchronized List<AgentView> list() {
        return agents.values().stream().map(this::view).toList();
    }

    public synchronized AgentStatus statusOf(String agentId) {
        return require(agentId).getStatus();
    }

    public synchronized boolean exists(String agentId) {
        return agents.containsKey(agentId);
    }

    public List<ExecutionRecord> history(String agentId, int limit) {
        synchronized (this) {
            require(agentId);
        }
        try {
            return store.recentExecutions(agentId, limit);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read execution history of agent " + agentId, e);
        }
    }

    /**
     * Stops and removes agents scoped to a closed connection. Other agents keep running.
     */
    public synchronized void releaseConnection(String connectionId) {
        List<String> owned = agents.values().stream()
            .filter(a -> a.isConnectionScoped() && connectionId.equals(a.getOwnerConnectionId()))
            .map(AgentRecord::getId)
            .toList();
        for (String agentId : owned) {
            scheduler.deregister(agentId);
            agents.remove(agentId);
            connections.forgetAgent(agentId);
            log.info("Agent {} removed with its connection {}", agentId, connectionId);
        }
    }

    void runCycle(String agentId, ExecutionTrigger trigger) {
        AgentSnapshot snapshot;
        synchronized (this) {
            AgentRecord agent = agents.get(agentId);
            if (agent == null) {
                log.debug("Agent {} removed before its run started", agentId);
                return;
            }
            snapshot = agent.toSnapshot();
        }

        Map<String, Object> started = new LinkedHashMap<>();
        started.put("success", true);
        started.put("status", "started");
        started.put("agent_id", agentId);
        started.put("trigger", trigger.wireName());
        connections.publish(agentId, Envelope.of(OutboundType.EXECUTION_RESPONSE, started));

        ExecutionRecord record = pipeline.execute(snapshot, trigger, message -> {
            Map<String, Object> line = new LinkedHashMap<>();
            line.put("agent_id", agentId);
            line.put("level", "info");
            line.put("message", message);
            connections.publish(agentId, Envelope.of(OutboundType.LOG, line));
        });

        String escalation = recordOutcome(agentId, record);
        flushOutbox();

        Map<String, Object> completed = new LinkedHashMap<>();
        completed.put("success", !record.isFailure());
        completed.put("status", "completed");
        completed.put("agent_id", agentId);
        completed.put("execution", record);
        if (record.getErrorDetail() != null) {
            completed.put("error", record.getErrorDetail());
        }
        connections.publish(agentId, Envelope.of(OutboundType.EXECUTION_RESPONSE, completed));

        notifications.notifyExecution(snapshot, record);
        if (escalation != null) {
            notifications.notifyEscalation(snapshot, escalation);
        }
    }

    /**
     * @return the escalation reason when this record moved the agent to {@code error}
     */
    synchronized String recordOutcome(String agentId, ExecutionRecord record) {
        AgentRecord agent = agents.get(agentId);
        if (agent == null) {
            return null;
        }
        agent.setLastExecutedAt(record.getFinishedAt());
        agent.setLastExecution(record);

        if (!record.isFailure()) {
            agent.setConsecutiveFailures(0);
            return null;
        }
        // only runs of a running agent count toward escalation
        if (agent.getStatus() != AgentStatus.RUNNING) {
            return null;
        }
        agent.setConsecutiveFailures(agent.getConsecutiveFailures() + 1);

        String reason = null;
        if (record.isNonRecoverable()) {
            reason = "non-recoverable failure: " + record.getErrorDetail();
        } else if (agent.getConsecutiveFailures() >= maxConsecutiveFailures) {
            reason = agent.getConsecutiveFailures() + " consecutive failures, last: " + record.getErrorDetail();
        }
        if (reason != null) {
            scheduler.deregister(agentId);
            transition(agent, AgentStatus.ERROR);
            log.warn("Agent {} escalated to error: {}", agentId, reason);
        }
        return reason;
    }

    private AgentRecord require(String agentId) {
        if (agentId == null) {
            throw new ValidationException("agent_id is required");
        }
        AgentRecord agent = agents.get(agentId);
        if (agent == null) {
            throw new NotFoundException("Unknown agent " + agentId, agentId);
        }
        return agent;
    }

    private AgentView view(AgentRecord agent) {
        return agent.toView(scheduler.nextDue(agent.getId()).orElse(null));
    }

    private void transition(AgentRecord agent, AgentStatus next) {
        AgentStatus previous = agent.getStatus();
        agent.setStatus(next);
        agent.setUpdatedAt(clock.instant());
        log.info("Agent {} {} -> {}", agent.getId(), previous.wireName(), next.wireName());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("agent_id", agent.getId());
        data.put("status", next.wireName());
        data.put("previous_status", previous.wireName());
        outbox.add(new StatusFrame(agent.getId(), Envelope.of(OutboundType.STATUS, data)));
    }

    private void flushOutbox() {
        StatusFrame frame;
        while ((frame = outbox.poll()) != null) {
            connections.publish(frame.agentId, frame.envelope);
        }
    }

    private void requireAddress(String address, String agentId) {
        if (address == null || !CONTRACT_ADDRESS.matcher(address).matches()) {
            throw new ValidationException("Invalid contract address '" + address + "'", agentId);
        }
    }

    private static Optional<Map<String, Object>> findAbiEntry(AgentRecord agent, String name) {
        return agent.getAbi().stream()
            .filter(entry -> entry.get("type") == null || "function".equals(entry.get("type")))
            .filter(entry -> name.equals(entry.get("name")))
            .findFirst();
    }

    private static List<FunctionParameter> parametersFromAbi(Map<String, Object> abiEntry) {
        Object inputs = abiEntry.get("inputs");
        if (!(inputs instanceof List<?> list)) {
            return List.of();
        }
        List<FunctionParameter> parameters = new ArrayList<>();
        for (int i = 0; i < list.size(); i++) {
            Map<?, ?> input = list.get(i) instanceof Map<?, ?> m ? m : Map.of();
            Object name = input.get("name");
            parameters.add(FunctionParameter.builder()
                .name(name == null || name.toString().isBlank() ? "arg" + i : name.toString())
                .type(input.get("type") != null ? input.get("type").toString() : null)
                .build());
        }
        return parameters;
    }

    private static void checkRules(String agentId, String functionName, FunctionDirection direction,
                                   List<FunctionParameter> parameters, Map<String, ParameterRule> rules,
                                   ParameterRule returnRule) {
        for (String ruleName : rules.keySet()) {
            if (parameters.stream().noneMatch(p -> p.getName().equals(ruleName))) {
                throw new ValidationException("Rule for unknown parameter '" + ruleName + "' of " + functionName, agentId);
            }
        }
        if (direction == FunctionDirection.WRITE) {
            for (FunctionParameter parameter : parameters) {
                if (!parameter.hasDefault() && !rules.containsKey(parameter.getName())) {
                    throw new ValidationException("Write function " + functionName
                        + " needs a validation rule for parameter '" + parameter.getName() + "'", agentId);
                }
            }
        }
        List<ParameterRule> all = new ArrayList<>(rules.values());
        if (returnRule != null) {
            all.add(returnRule);
        }
        for (ParameterRule rule : all) {
            if (rule.getPattern() != null) {
                try {
                    Pattern.compile(rule.getPattern());
                } catch (PatternSyntaxException e) {
                    throw new ValidationException("Invalid pattern '" + rule.getPattern() + "' for " + functionName, agentId);
                }
            }
            if (rule.getMin() != null && rule.getMax() != null && rule.getMin().compareTo(rule.getMax()) > 0) {
                throw new ValidationException("Rule min exceeds max for " + functionName, agentId);
            }
        }
    }

    private static String describe(Schedule schedule) {
        String cadence = schedule.getType() == ScheduleType.INTERVAL
            ? "every " + schedule.getIntervalSeconds() + "s"
            : "cron '" + schedule.getCronExpression() + "'";
        return cadence + (schedule.isActive() ? "" : " (inactive)");
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static <T> List<T> nonNull(List<T> values) {
        return values != null ? values : List.of();
    }

    private static final class StatusFrame {
        private final String agentId;
        private final Envelope envelope;

        private StatusFrame(String agentId, Envelope envelope) {
            this.agentId = agentId;
            this.envelope = envelope;
        }
    }
}
