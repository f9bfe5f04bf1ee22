package com.pandora.orchestrator.agent;

import com.pandora.orchestrator.skill.DefinitionRegistry;
import com.pandora.orchestrator.skill.DuplicatePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Catalog of {@link AgentDefinition}s. Lenient by default: re-registering an
 * agent replaces the previous definition, which is how reloaded definitions
 * take effect.
 */
public class AgentRegistry extends DefinitionRegistry<AgentDefinition> {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    public AgentRegistry(DuplicatePolicy duplicatePolicy) {
        super("agent", duplicatePolicy);
    }

    public AgentRegistry() {
        this(DuplicatePolicy.REPLACE);
    }

    /**
     * @return false if no agent with that id is registered
     */
    public boolean setEnabled(String agentId, boolean enabled) {
        return get(agentId).map(agent -> {
            replace(agentId, agent.withEnabled(enabled));
            log.info("Agent '{}' {}", agentId, enabled ? "enabled" : "disabled");
            return true;
        }).orElse(false);
    }

    public List<AgentDefinition> listEnabled() {
        return list().stream()
                .filter(AgentDefinition::enabled)
                .toList();
    }
}
