package com.zephyrus.agent.config;

import com.zephyrus.agent.exception.AgentOperationException;
import com.zephyrus.agent.model.AgentDefinition;
import com.zephyrus.agent.service.AgentManagerService;
import com.zephyrus.agent.store.AgentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Loads every stored agent definition at startup and starts those marked
 * {@code auto_start}.
 */
@Slf4j
@Configuration
public class AgentBootstrapLoader {

    @Bean
    @ConditionalOnProperty(name = "agent.bootstrap.enabled", havingValue = "true", matchIfMissing = true)
    public CommandLineRunner bootstrapAgents(AgentStore store, AgentManagerService manager) {
        return args -> {
            int loaded = 0;
            for (AgentDefinition definition : store.loadAllAgents()) {
                try {
                    String agentId = manager.materialize(definition, null);
                    loaded++;
                    if (definition.isAutoStart()) {
                        manager.start(agentId);
                    }
                    log.info("Bootstrapped agent {}{}", agentId, definition.isAutoStart() ? " (started)" : "");
                } catch (AgentOperationException e) {
                    log.error("Failed to bootstrap agent {}: {}", definition.getAgentId(), e.getMessage());
                } catch (RuntimeException e) {
                    log.error("Unexpected error bootstrapping agent {}", definition.getAgentId(), e);
                }
            }
            log.info("Bootstrap finished, {} agent(s) loaded", loaded);
        };
    }
}
