package io.providerbridge.provider.spi;

import java.util.List;

/**
 * {@link java.util.ServiceLoader} SPI for contributing provider kinds.
 */
public interface DataProviderDefinitionProvider {
    List<DataProviderDefinition> definitions();
}
