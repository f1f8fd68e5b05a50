package io.providerbridge.provider.spi;

import io.providerbridge.core.ProviderBridgeException;
import io.providerbridge.core.ProviderDescriptor;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@link DataProviderFactory} that dispatches on the descriptor's name.
 *
 * <p>Use {@link #builder()} to create a registry with explicit registration:
 * <pre>{@code
 * DataProviderRegistry registry = DataProviderRegistry.builder()
 *     .register(new BagDataProviderDefinition())
 *     .register(new MemoryCacheDefinition())
 *     .build();
 * DataProvider root = registry.create(descriptor);
 * }</pre>
 *
 * <p>Children are created through the same registry, so any registered kind can wrap any other.
 */
public final class DataProviderRegistry implements DataProviderFactory {

    private final Map<String, DataProviderDefinition> definitions;

    private DataProviderRegistry(Map<String, DataProviderDefinition> definitions) {
        this.definitions = Map.copyOf(definitions);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public DataProvider create(ProviderDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        DataProviderDefinition definition = definitions.get(descriptor.name());
        if (definition == null) {
            throw new ProviderBridgeException.UnknownProvider("unknown provider: " + descriptor.name());
        }
        return definition.create(descriptor, this);
    }

    /**
     * Registered kind names.
     */
    public Set<String> names() {
        return definitions.keySet();
    }

    /**
     * Builder for creating a {@link DataProviderRegistry}.
     */
    public static final class Builder {
        private final Map<String, DataProviderDefinition> definitions = new HashMap<>();

        private Builder() {}

        /**
         * Register a provider kind.
         *
         * @param definition the definition to register
         * @return this builder
         * @throws IllegalArgumentException if the name is blank or already registered
         */
        public Builder register(DataProviderDefinition definition) {
            Objects.requireNonNull(definition, "definition");
            String name = definition.name();
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("definition name must not be null or blank");
            }
            if (definitions.putIfAbsent(name, definition) != null) {
                throw new IllegalArgumentException("provider already registered: " + name);
            }
            return this;
        }

        /**
         * Register multiple definitions.
         *
         * @param definitions the definitions to register
         * @return this builder
         */
        public Builder registerAll(Iterable<? extends DataProviderDefinition> definitions) {
            for (DataProviderDefinition d : definitions) {
                register(d);
            }
            return this;
        }

        public DataProviderRegistry build() {
            return new DataProviderRegistry(definitions);
        }
    }
}
