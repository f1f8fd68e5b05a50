package io.providerbridge.provider.spi;

import io.providerbridge.core.GetMessagesResult;
import io.providerbridge.core.GetMessagesTopics;
import io.providerbridge.core.InitializationResult;
import io.providerbridge.core.Time;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Adapter that wraps a {@link BlockingDataProvider} to provide the {@link DataProvider} interface.
 *
 * <p>This adapter runs all blocking operations on the provided {@link Executor}. Example usage:
 * <pre>{@code
 * BlockingDataProvider bag = new BagFileProvider(path);
 * ExecutorService io = Executors.newFixedThreadPool(2);
 * DataProvider provider = new BlockingToAsyncAdapter(bag, io);
 * }</pre>
 *
 * <p>Checked exceptions thrown by the delegate complete the returned future exceptionally with
 * an {@link AsyncProviderException}; unchecked exceptions are passed through unchanged.
 */
public final class BlockingToAsyncAdapter implements DataProvider {

    private final BlockingDataProvider delegate;
    private final Executor executor;

    /**
     * Creates an async adapter for the given blocking provider.
     *
     * @param delegate the blocking provider to wrap
     * @param executor executor to run blocking operations on
     */
    public BlockingToAsyncAdapter(BlockingDataProvider delegate, Executor executor) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public CompletableFuture<InitializationResult> initialize(ExtensionPoint extensionPoint) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return delegate.initialize(extensionPoint);
            } catch (Exception e) {
                throw wrapException(e);
            }
        }, executor);
    }

    @Override
    public CompletableFuture<GetMessagesResult> getMessages(Time start, Time end, GetMessagesTopics topics) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return delegate.getMessages(start, end, topics);
            } catch (Exception e) {
                throw wrapException(e);
            }
        }, executor);
    }

    @Override
    public CompletableFuture<Void> close() {
        return CompletableFuture.runAsync(() -> {
            try {
                delegate.close();
            } catch (Exception e) {
                throw wrapException(e);
            }
        }, executor);
    }

    /**
     * Returns the underlying blocking provider.
     */
    public BlockingDataProvider delegate() {
        return delegate;
    }

    /**
     * Returns the executor used for async operations.
     */
    public Executor executor() {
        return executor;
    }

    private static RuntimeException wrapException(Exception e) {
        if (e instanceof RuntimeException re) {
            return re;
        }
        return new AsyncProviderException(e);
    }

    /**
     * Exception wrapper for checked exceptions from blocking provider operations.
     */
    public static final class AsyncProviderException extends RuntimeException {
        public AsyncProviderException(Throwable cause) {
            super(cause.getMessage(), cause);
        }
    }
}
