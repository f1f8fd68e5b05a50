package io.providerbridge.remote;

import io.providerbridge.core.ProviderDescriptor;
import io.providerbridge.provider.spi.DataProvider;
import io.providerbridge.provider.spi.DataProviderDefinition;
import io.providerbridge.provider.spi.DataProviderDefinitionProvider;
import io.providerbridge.provider.spi.DataProviderFactory;
import io.providerbridge.provider.spi.DataProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * {@link DataProviderFactory} backed by {@link java.util.ServiceLoader}.
 *
 * <p>Collects the definitions of every {@link DataProviderDefinitionProvider} visible to the class
 * loader. Two definitions with the same name are a configuration error.
 */
public final class ServiceLoaderProviderRegistry implements DataProviderFactory {

    private static final Logger log = LoggerFactory.getLogger(ServiceLoaderProviderRegistry.class);

    private final DataProviderRegistry registry;

    public ServiceLoaderProviderRegistry(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        DataProviderRegistry.Builder builder = DataProviderRegistry.builder();

        ServiceLoader<DataProviderDefinitionProvider> loader = ServiceLoader.load(DataProviderDefinitionProvider.class, cl);
        for (DataProviderDefinitionProvider p : loader) {
            for (DataProviderDefinition d : p.definitions()) {
                if (d == null) continue;
                builder.register(d);
            }
        }
        this.registry = builder.build();
        log.debug("Loaded provider kinds {}", registry.names());
    }

    public static ServiceLoaderProviderRegistry defaultRegistry() {
        return new ServiceLoaderProviderRegistry(Thread.currentThread().getContextClassLoader());
    }

    @Override
    public DataProvider create(ProviderDescriptor descriptor) {
        return registry.create(descriptor);
    }

    public Set<String> names() {
        return registry.names();
    }
}
