package io.providerbridge.core;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Serializable description of a provider tree.
 *
 * <p>{@code name} selects the provider kind and is resolved by a registry on the hosting side;
 * {@code args} is opaque to the bridge. Instances are immutable once built.
 *
 * @param name provider kind
 * @param args provider-specific arguments (never null)
 * @param children nested descriptors (never null)
 */
public record ProviderDescriptor(String name, Map<String, Object> args, List<ProviderDescriptor> children) {

    public ProviderDescriptor {
        Objects.requireNonNull(name, "name");
        args = args == null ? Map.of() : Map.copyOf(args);
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static ProviderDescriptor of(String name) {
        return new ProviderDescriptor(name, Map.of(), List.of());
    }

    public static ProviderDescriptor of(String name, Map<String, Object> args, ProviderDescriptor... children) {
        return new ProviderDescriptor(name, args, List.of(children));
    }
}
