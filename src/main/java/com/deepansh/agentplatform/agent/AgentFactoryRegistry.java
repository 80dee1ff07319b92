package com.deepansh.agentplatform.agent;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central index of {@link AgentFactory} implementations by agent type.
 *
 * Spring injects every AgentFactory bean; further factories can be added with
 * {@link #register}. An agent type maps to exactly one factory, and the
 * registry itself never holds agent-specific logic.
 */
@Component
@Slf4j
public class AgentFactoryRegistry {

    private final Map<String, AgentFactory> factories = new ConcurrentHashMap<>();

    public AgentFactoryRegistry(List<AgentFactory> factoryBeans) {
        factoryBeans.forEach(this::register);
        log.info("Total agent factories registered: {}", factories.size());
    }

    public void register(AgentFactory factory) {
        String type = factory.getAgentType();
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("agent factory " + factory.getClass().getName() + " has no agent type");
        }
        AgentFactory existing = factories.putIfAbsent(type, factory);
        if (existing != null) {
            throw new IllegalStateException("duplicate factory for agent type '" + type + "': "
                    + existing.getClass().getName() + " and " + factory.getClass().getName());
        }
        log.info("Registered agent factory [agentType={}, factory={}]", type, factory.getClass().getSimpleName());
    }

    public Optional<AgentFactory> find(String agentType) {
        return Optional.ofNullable(factories.get(agentType));
    }

    public boolean hasFactory(String agentType) {
        return factories.containsKey(agentType);
    }

    public List<String> getAgentTypes() {
        return factories.keySet().stream().sorted().toList();
    }

    public int factoryCount() {
        return factories.size();
    }
}
