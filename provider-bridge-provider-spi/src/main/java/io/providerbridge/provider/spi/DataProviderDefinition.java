package io.providerbridge.provider.spi;

import io.providerbridge.core.ProviderDescriptor;

/**
 * One provider kind, addressed by {@link ProviderDescriptor#name()}.
 */
public interface DataProviderDefinition {

    /**
     * Kind name matched against {@link ProviderDescriptor#name()}.
     */
    String name();

    /**
     * Create a provider for the descriptor.
     *
     * @param descriptor descriptor whose name equals {@link #name()}
     * @param children factory for the descriptor's nested children
     * @return a new, uninitialized provider
     */
    DataProvider create(ProviderDescriptor descriptor, DataProviderFactory children);
}
