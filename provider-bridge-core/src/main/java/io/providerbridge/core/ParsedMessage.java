package io.providerbridge.core;

/**
 * A message already decoded into an in-memory object graph.
 *
 * <p>Never allowed across the bridge; see {@link ProviderBridgeException.ContractViolation}.
 */
public record ParsedMessage(String topic, Time receiveTime, Object message) {}
