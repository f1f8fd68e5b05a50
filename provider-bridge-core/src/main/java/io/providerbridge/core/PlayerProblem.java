package io.providerbridge.core;

/**
 * A problem reported by a provider during initialization.
 *
 * @param severity "error", "warn" or "info"
 * @param message human readable description
 * @param tip optional hint for resolving it (may be null)
 */
public record PlayerProblem(String severity, String message, String tip) {}
