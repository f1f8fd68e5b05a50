package io.providerbridge.remote;

import io.providerbridge.core.ProviderDescriptor;
import io.providerbridge.provider.spi.DataProvider;
import io.providerbridge.provider.spi.DataProviderDefinition;
import io.providerbridge.provider.spi.DataProviderDefinitionProvider;
import io.providerbridge.provider.spi.DataProviderFactory;

import java.util.List;

/**
 * Registered in {@code META-INF/services} for {@link ServiceLoaderProviderRegistryTest}.
 */
public final class TestProviderDefinitions implements DataProviderDefinitionProvider {

    static final String SCRIPTED = "scripted";

    @Override
    public List<DataProviderDefinition> definitions() {
        return List.of(new DataProviderDefinition() {
            @Override
            public String name() {
                return SCRIPTED;
            }

            @Override
            public DataProvider create(ProviderDescriptor descriptor, DataProviderFactory children) {
                return new ScriptedProvider();
            }
        });
    }
}
