package io.providerbridge.core;

/**
 * A message exposed as a lazily-read object view over its bytes.
 *
 * <p>Never allowed across the bridge; see {@link ProviderBridgeException.ContractViolation}.
 */
public record ObjectMessage(String topic, Time receiveTime, Object object) {}
