package com.pandora.orchestrator.runtime;

public class SkillNotFoundException extends RuntimeException {
    public SkillNotFoundException(String skillId) {
        super("No skill registered with id: '" + skillId + "'");
    }
}
