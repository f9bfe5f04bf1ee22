package com.pandora.orchestrator.claude;

/**
 * Collaborator that runs MODEL-tier steps. Implementations throw
 * {@link ModelInvocationException} for any provider-side failure.
 */
public interface ModelInvoker {

    ModelResponse invoke(ModelRequest request);
}
