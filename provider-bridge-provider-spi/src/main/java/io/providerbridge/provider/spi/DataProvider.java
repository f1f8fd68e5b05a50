package io.providerbridge.provider.spi;

import io.providerbridge.core.GetMessagesResult;
import io.providerbridge.core.GetMessagesTopics;
import io.providerbridge.core.InitializationResult;
import io.providerbridge.core.Time;

import java.util.concurrent.CompletableFuture;

/**
 * A source of time-ranged message batches.
 *
 * <p>All operations return {@link CompletableFuture} and must not block the calling thread.
 * For adapting a synchronous implementation, see {@link BlockingToAsyncAdapter}.
 *
 * <p>Lifecycle: {@link #initialize} exactly once, then any number of {@link #getMessages} calls
 * (possibly concurrent), then {@link #close}.
 */
public interface DataProvider {

    /**
     * Initialize the provider.
     *
     * <p>The extension point stays valid for the provider's whole lifetime and may be invoked
     * from any thread, including before the returned future completes.
     *
     * @param extensionPoint callbacks for progress, metadata and upstream notifications
     * @return future completing with the provider's time span, topics and definitions
     */
    CompletableFuture<InitializationResult> initialize(ExtensionPoint extensionPoint);

    /**
     * Read messages in {@code [start, end]}.
     *
     * <p>Bounds are inclusive. How messages stamped exactly on a bound are handled is up to the
     * implementation and should be documented by it. Callers may pass {@code start > end}; the
     * implementation decides what that means.
     *
     * @param start first timestamp
     * @param end last timestamp
     * @param topics topics to read, per representation
     * @return future completing with the messages found
     */
    CompletableFuture<GetMessagesResult> getMessages(Time start, Time end, GetMessagesTopics topics);

    /**
     * Release all resources held by the provider.
     *
     * @return future completing once the provider is closed
     */
    CompletableFuture<Void> close();
}
