package io.providerbridge.provider.spi;

import io.providerbridge.core.ProviderDescriptor;

/**
 * Builds the provider a descriptor names. Supplied by the hosting environment.
 */
@FunctionalInterface
public interface DataProviderFactory {

    /**
     * @param descriptor provider descriptor
     * @return a new, uninitialized provider
     * @throws io.providerbridge.core.ProviderBridgeException.UnknownProvider if the kind is not known
     */
    DataProvider create(ProviderDescriptor descriptor);
}
