package io.providerbridge.remote;

import io.providerbridge.core.ExtensionPointCallback;
import io.providerbridge.core.NotifyPlayerManagerData;
import io.providerbridge.core.Progress;
import io.providerbridge.core.Protocol;
import io.providerbridge.core.ProviderMetadata;
import io.providerbridge.provider.spi.ExtensionPoint;
import io.providerbridge.rpc.Rpc;
import io.providerbridge.rpc.RpcException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * {@link ExtensionPoint} that turns every callback into an {@code extensionPointCallback} event.
 *
 * <p>Callbacks are queued and posted from a serial sink, never from the provider's thread, so
 * events leave in emission order. After {@link #shutdown()} callbacks are dropped.
 */
final class ChannelExtensionPoint implements ExtensionPoint {

    private static final Logger log = LoggerFactory.getLogger(ChannelExtensionPoint.class);

    private final Rpc rpc;
    private final Executor sink;
    private boolean open = true; // guarded by this

    ChannelExtensionPoint(Rpc rpc, Executor executor) {
        this.rpc = Objects.requireNonNull(rpc, "rpc");
        this.sink = new SerialExecutor(executor);
    }

    @Override
    public void progressCallback(Progress progress) {
        emit(Protocol.PROGRESS_CALLBACK, progress);
    }

    @Override
    public void reportMetadataCallback(ProviderMetadata metadata) {
        emit(Protocol.REPORT_METADATA_CALLBACK, metadata);
    }

    @Override
    public void notifyPlayerManager(NotifyPlayerManagerData data) {
        emit(Protocol.NOTIFY_PLAYER_MANAGER, data);
    }

    /**
     * Stop accepting callbacks.
     *
     * @return future completing once every callback accepted before this call has been posted
     */
    CompletableFuture<Void> shutdown() {
        CompletableFuture<Void> flushed = new CompletableFuture<>();
        synchronized (this) {
            if (open) {
                open = false;
                try {
                    sink.execute(() -> flushed.complete(null));
                    return flushed;
                } catch (RejectedExecutionException e) {
                    log.warn("Callback executor rejected the flush marker", e);
                }
            }
        }
        flushed.complete(null);
        return flushed;
    }

    private void emit(String type, Object data) {
        ExtensionPointCallback callback = new ExtensionPointCallback(type, data);
        synchronized (this) {
            if (!open) {
                log.debug("Endpoint closed, dropping {}", type);
                return;
            }
            try {
                sink.execute(() -> post(callback));
            } catch (RejectedExecutionException e) {
                log.warn("Callback executor rejected {}", type, e);
            }
        }
    }

    private void post(ExtensionPointCallback callback) {
        try {
            rpc.post(Protocol.EXTENSION_POINT_CALLBACK, callback);
        } catch (RpcException e) {
            log.warn("Failed to forward {}", callback.type(), e);
        }
    }
}
