package com.pandora.orchestrator.skill;

public class DuplicateDefinitionException extends RuntimeException {

    private final String definitionId;

    public DuplicateDefinitionException(String registryName, String definitionId) {
        super("Duplicate id '" + definitionId + "' in " + registryName + " registry");
        this.definitionId = definitionId;
    }

    public String getDefinitionId() { return definitionId; }
}
