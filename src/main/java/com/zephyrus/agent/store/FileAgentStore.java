package com.zephyrus.agent.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.zephyrus.agent.exception.NotFoundException;
import com.zephyrus.agent.exception.ValidationException;
import com.zephyrus.agent.model.AgentDefinition;
import com.zephyrus.agent.model.ExecutionRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Agent definitions are YAML files named {@code <agent_id>.yaml} under
 * {@code agent.config.path}; execution records are appended as JSON lines to
 * {@code <agent.data.path>/executions.jsonl}.
 */
@Slf4j
@Service
public class FileAgentStore implements AgentStore {

    static final String EXECUTIONS_FILE = "executions.jsonl";

    private static final Pattern STORED_ID = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9._-]*$");

    @Value("${agent.config.path:config/agents}")
    private String configPath;

    @Value("${agent.data.path:data}")
    private String dataPath;

    private final ObjectMapper yamlMapper;
    private final ObjectMapper jsonMapper;

    public FileAgentStore() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        this.yamlMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        this.jsonMapper = new ObjectMapper();
        this.jsonMapper.registerModule(new JavaTimeModule());
        this.jsonMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        this.jsonMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.jsonMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public void setConfigPath(String path) {
        this.configPath = path;
    }

    public void setDataPath(String path) {
        this.dataPath = path;
    }

    @Override
    public synchronized void appendExecutionRecord(ExecutionRecord record) throws IOException {
        Path file = Paths.get(dataPath, EXECUTIONS_FILE);
        Files.createDirectories(file.getParent());
        String json = jsonMapper.writeValueAsString(record);
        Files.writeString(file, json + "\n", StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    @Override
    public AgentDefinition loadAgent(String agentId) throws IOException {
        if (agentId == null || !STORED_ID.matcher(agentId).matches()) {
            throw new ValidationException("Invalid stored agent id '" + agentId + "'", agentId);
        }
        Path configDir = Paths.get(configPath).toAbsolutePath().normalize();
        for (String extension : List.of(".yaml", ".yml")) {
            Path candidate = configDir.resolve(agentId + extension).normalize();
            if (!configDir.equals(candidate.getParent())) {
                throw new ValidationException("Invalid stored agent id '" + agentId + "'", agentId);
            }
            File file = candidate.toFile();
            if (file.isFile()) {
                return readDefinition(file, agentId);
            }
        }
        throw new NotFoundException("No stored definition for agent " + agentId, agentId);
    }

    @Override
    public List<AgentDefinition> loadAllAgents() {
        File configDir = new File(configPath);
        if (!configDir.isDirectory()) {
            log.info("Agent definition directory not found: {}", configPath);
            return List.of();
        }

        File[] yamlFiles = configDir.listFiles((dir, name) -> name.endsWith(".yaml") || name.endsWith(".yml"));
        if (yamlFiles == null) {
            return List.of();
        }

        List<AgentDefinition> definitions = new ArrayList<>();
        for (File file : yamlFiles) {
            String fileId = file.getName().replaceFirst("\\.ya?ml$", "");
            try {
                definitions.add(readDefinition(file, fileId));
            } catch (IOException e) {
                log.error("Failed to load agent definition from {}: {}", file.getName(), e.getMessage());
            }
        }
        return definitions;
    }

    @Override
    public synchronized List<ExecutionRecord> recentExecutions(String agentId, int limit) throws IOException {
        Path file = Paths.get(dataPath, EXECUTIONS_FILE);
        if (!Files.exists(file) || limit <= 0) {
            return List.of();
        }

        Deque<ExecutionRecord> window = new ArrayDeque<>(limit);
        try (Stream<String> lines = Files.lines(file)) {
            lines.forEach(line -> {
                ExecutionRecord record = parseRecord(line);
                if (record != null && agentId.equals(record.getAgentId())) {
                    if (window.size() == limit) {
                        window.removeFirst();
                    }
                    window.addLast(record);
                }
            });
        }
        return new ArrayList<>(window);
    }

    private AgentDefinition readDefinition(File file, String fallbackId) throws IOException {
        AgentDefinition definition = yamlMapper.readValue(file, AgentDefinition.class);
        if (definition.getAgentId() == null) {
            definition.setAgentId(fallbackId);
        }
        return definition;
    }

    private ExecutionRecord parseRecord(String line) {
        try {
            return jsonMapper.readValue(line, ExecutionRecord.class);
        } catch (IOException e) {
            log.warn("Skipping malformed execution log line: {}", e.getMessage());
            return null;
        }
    }
}
