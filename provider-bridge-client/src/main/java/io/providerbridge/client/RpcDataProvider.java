package io.providerbridge.client;

import io.providerbridge.core.ExtensionPointCallback;
import io.providerbridge.core.GetMessagesReply;
import io.providerbridge.core.GetMessagesRequest;
import io.providerbridge.core.GetMessagesResult;
import io.providerbridge.core.GetMessagesTopics;
import io.providerbridge.core.InitializationResult;
import io.providerbridge.core.InitializeRequest;
import io.providerbridge.core.NotifyPlayerManagerData;
import io.providerbridge.core.Progress;
import io.providerbridge.core.Protocol;
import io.providerbridge.core.ProviderBridgeException;
import io.providerbridge.core.ProviderDescriptor;
import io.providerbridge.core.ProviderMetadata;
import io.providerbridge.core.Time;
import io.providerbridge.provider.spi.DataProvider;
import io.providerbridge.provider.spi.ExtensionPoint;
import io.providerbridge.rpc.RemoteRpcException;
import io.providerbridge.rpc.Rpc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link DataProvider} whose work happens on the other side of an {@link Rpc} channel.
 *
 * <p>The remote side runs a {@code RemoteBridgeEndpoint} that builds the provider named by
 * {@code childDescriptor}. This class only translates calls into requests and
 * {@code extensionPointCallback} events back into {@link ExtensionPoint} calls:
 * <pre>{@code
 * Rpc rpc = new Rpc(StreamRpcTransport.builder(child.getInputStream(), child.getOutputStream(), codec).build());
 * DataProvider provider = new RpcDataProvider(rpc, ProviderDescriptor.of("bag-file", Map.of("path", path)));
 * InitializationResult init = provider.initialize(extensionPoint).get();
 * }</pre>
 *
 * <p>Only raw records can be requested. Remote failures complete the returned futures with the
 * matching {@link ProviderBridgeException} subtype.
 */
public final class RpcDataProvider implements DataProvider {

    private static final Logger log = LoggerFactory.getLogger(RpcDataProvider.class);

    private final Rpc rpc;
    private final ProviderDescriptor childDescriptor;
    private final AtomicReference<ExtensionPoint> boundExtensionPoint = new AtomicReference<>();

    public RpcDataProvider(Rpc rpc, ProviderDescriptor childDescriptor) {
        this.rpc = Objects.requireNonNull(rpc, "rpc");
        this.childDescriptor = Objects.requireNonNull(childDescriptor, "childDescriptor");
    }

    /**
     * Ask the remote side to build and initialize the provider. Callback events from then on go
     * to {@code extensionPoint}.
     *
     * @throws IllegalStateException if an earlier call bound a different extension point
     */
    @Override
    public CompletableFuture<InitializationResult> initialize(ExtensionPoint extensionPoint) {
        Objects.requireNonNull(extensionPoint, "extensionPoint");
        if (boundExtensionPoint.compareAndSet(null, extensionPoint)) {
            rpc.receive(Protocol.EXTENSION_POINT_CALLBACK, ExtensionPointCallback.class, callback -> {
                dispatch(extensionPoint, callback);
                return null;
            });
        } else if (boundExtensionPoint.get() != extensionPoint) {
            throw new IllegalStateException("already initialized with another extension point");
        }
        return translate(rpc.send(Protocol.INITIALIZE, new InitializeRequest(childDescriptor), InitializationResult.class));
    }

    /**
     * Read raw records in {@code [start, end]}. The range is sent as given.
     *
     * @throws IllegalArgumentException if {@code topics} asks for parsed or object records
     */
    @Override
    public CompletableFuture<GetMessagesResult> getMessages(Time start, Time end, GetMessagesTopics topics) {
        Objects.requireNonNull(topics, "topics");
        if (!topics.rawOnlyRequest()) {
            throw new IllegalArgumentException("only raw messages can be requested over the bridge");
        }
        GetMessagesRequest request = new GetMessagesRequest(start, end, topics.rawMessages());
        return translate(rpc.send(Protocol.GET_MESSAGES, request, GetMessagesReply.class))
                .thenApply(reply -> GetMessagesResult.raw(reply == null ? null : reply.messages()));
    }

    @Override
    public CompletableFuture<Void> close() {
        return translate(rpc.send(Protocol.CLOSE, null, Void.class));
    }

    private void dispatch(ExtensionPoint extensionPoint, ExtensionPointCallback callback) {
        switch (callback.type()) {
            case Protocol.PROGRESS_CALLBACK ->
                    extensionPoint.progressCallback(rpc.decode(callback.data(), Progress.class));
            case Protocol.REPORT_METADATA_CALLBACK ->
                    extensionPoint.reportMetadataCallback(rpc.decode(callback.data(), ProviderMetadata.class));
            case Protocol.NOTIFY_PLAYER_MANAGER ->
                    extensionPoint.notifyPlayerManager(rpc.decode(callback.data(), NotifyPlayerManagerData.class));
            default -> log.warn("Ignoring extension point callback of unknown type {}", callback.type());
        }
    }

    private static <T> CompletableFuture<T> translate(CompletableFuture<T> future) {
        CompletableFuture<T> out = new CompletableFuture<>();
        future.whenComplete((value, e) -> {
            if (e == null) {
                out.complete(value);
                return;
            }
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RemoteRpcException remote) {
                out.completeExceptionally(ProviderBridgeException.fromWire(remote.errorType(), remote.getMessage()));
            } else {
                out.completeExceptionally(cause);
            }
        });
        return out;
    }
}
