package io.providerbridge.provider.spi;

import io.providerbridge.core.NotifyPlayerManagerData;
import io.providerbridge.core.Progress;
import io.providerbridge.core.ProviderMetadata;

/**
 * Push-style callbacks a {@link DataProvider} uses outside of the request/reply cycle.
 *
 * <p>Implementations must be safe to call from any thread and must not block.
 */
public interface ExtensionPoint {

    void progressCallback(Progress progress);

    void reportMetadataCallback(ProviderMetadata metadata);

    void notifyPlayerManager(NotifyPlayerManagerData data);

    /**
     * An extension point that discards every callback.
     */
    static ExtensionPoint discarding() {
        return new ExtensionPoint() {
            @Override
            public void progressCallback(Progress progress) {}

            @Override
            public void reportMetadataCallback(ProviderMetadata metadata) {}

            @Override
            public void notifyPlayerManager(NotifyPlayerManagerData data) {}
        };
    }
}
