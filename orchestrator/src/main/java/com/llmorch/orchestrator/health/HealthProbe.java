package com.llmorch.orchestrator.health;

/**
 * Probe of one subsystem. Returns a short message when healthy and throws
 * when it is not; the exception message becomes the reported reason.
 */
@FunctionalInterface
public interface HealthProbe {

    String check() throws Exception;
}
