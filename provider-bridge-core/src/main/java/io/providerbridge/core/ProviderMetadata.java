package io.providerbridge.core;

import java.util.Map;
import java.util.Objects;

/**
 * Out-of-band metadata pushed through {@code reportMetadataCallback}.
 *
 * <p>The bridge does not interpret {@code attributes}; it forwards them as reported.
 *
 * @param type metadata kind, for example {@code "average_throughput"}
 * @param attributes kind-specific values
 */
public record ProviderMetadata(String type, Map<String, Object> attributes) {
    public ProviderMetadata {
        Objects.requireNonNull(type, "type");
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}
