package io.providerbridge.core;

/**
 * Half-open fraction range {@code [start, end)} of the provider's time span, both in {@code [0, 1]}.
 */
public record Range(double start, double end) {}
