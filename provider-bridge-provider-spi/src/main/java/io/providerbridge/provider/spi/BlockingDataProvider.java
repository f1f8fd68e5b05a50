package io.providerbridge.provider.spi;

import io.providerbridge.core.GetMessagesResult;
import io.providerbridge.core.GetMessagesTopics;
import io.providerbridge.core.InitializationResult;
import io.providerbridge.core.Time;

/**
 * Synchronous counterpart of {@link DataProvider}, for implementations built on blocking I/O.
 *
 * <p>Wrap with {@link BlockingToAsyncAdapter} to use it where a {@link DataProvider} is expected.
 */
public interface BlockingDataProvider {

    InitializationResult initialize(ExtensionPoint extensionPoint) throws Exception;

    GetMessagesResult getMessages(Time start, Time end, GetMessagesTopics topics) throws Exception;

    void close() throws Exception;
}
