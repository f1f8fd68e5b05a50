package io.providerbridge.core;

/**
 * Payload of {@link Protocol#INITIALIZE}.
 */
public record InitializeRequest(ProviderDescriptor childDescriptor) {}
