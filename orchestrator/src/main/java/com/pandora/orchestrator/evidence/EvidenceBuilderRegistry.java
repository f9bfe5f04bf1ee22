package com.pandora.orchestrator.evidence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Skill id to evidence builder, collected from every {@link SkillEvidenceBuilder} bean.
 */
@Component
public class EvidenceBuilderRegistry {

    private static final Logger log = LoggerFactory.getLogger(EvidenceBuilderRegistry.class);

    private final Map<String, SkillEvidenceBuilder> builders = new ConcurrentHashMap<>();

    public EvidenceBuilderRegistry(List<SkillEvidenceBuilder> allBuilders) {
        for (SkillEvidenceBuilder builder : allBuilders) {
            if (builders.putIfAbsent(builder.skillId(), builder) != null) {
                throw new IllegalStateException("Two evidence builders registered for skill '" + builder.skillId() + "'");
            }
            log.info("Registered evidence builder for skill '{}'", builder.skillId());
        }
    }

    public Optional<SkillEvidenceBuilder> find(String skillId) {
        return Optional.ofNullable(builders.get(skillId));
    }
}
