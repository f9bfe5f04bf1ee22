package com.pandora.orchestrator.runtime;

/**
 * The step graph of a skill is malformed. Raised before any step executes.
 */
public class InvalidGraphException extends RuntimeException {

    private final String skillId;
    private final String stepId;

    public InvalidGraphException(String skillId, String stepId, String reason) {
        super("Invalid step graph in skill '" + skillId + "' at step '" + stepId + "': " + reason);
        this.skillId = skillId;
        this.stepId = stepId;
    }

    public String getSkillId() { return skillId; }
    public String getStepId()  { return stepId; }
}
