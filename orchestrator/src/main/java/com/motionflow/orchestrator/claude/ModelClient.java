package com.motionflow.orchestrator.claude;

/**
 * Seam between the phase driver and the model provider.
 */
public interface ModelClient {

    /**
     * @throws ExternalCallException on any transport or API failure
     */
    ModelResponse complete(ModelRequest request);
}
