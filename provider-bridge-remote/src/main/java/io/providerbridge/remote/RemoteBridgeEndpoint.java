package io.providerbridge.remote;

import io.providerbridge.core.GetMessagesReply;
import io.providerbridge.core.GetMessagesRequest;
import io.providerbridge.core.GetMessagesResult;
import io.providerbridge.core.GetMessagesTopics;
import io.providerbridge.core.InitializeRequest;
import io.providerbridge.core.Protocol;
import io.providerbridge.core.ProviderBridgeException;
import io.providerbridge.core.RawMessage;
import io.providerbridge.provider.spi.DataProvider;
import io.providerbridge.provider.spi.DataProviderFactory;
import io.providerbridge.rpc.Rpc;
import io.providerbridge.rpc.RpcReply;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Drives a single provider on behalf of a caller on the other end of an {@link Rpc} channel.
 *
 * <p>Use {@link #builder(Rpc, DataProviderFactory)} to create and register an endpoint:
 * <pre>{@code
 * InProcessTransport.Pair pair = InProcessTransport.pair();
 * RemoteBridgeEndpoint endpoint = RemoteBridgeEndpoint.builder(new Rpc(pair.remote()), registry)
 *     .callbackExecutor(callbackPool)
 *     .build();
 * }</pre>
 *
 * <p>Lifecycle:
 * <ul>
 *   <li>{@code initialize} builds the provider through the factory, exactly once. A second call
 *       fails with {@link ProviderBridgeException.AlreadyInitialized}. If the factory throws,
 *       nothing is built and {@code initialize} may be sent again.</li>
 *   <li>{@code getMessages} before {@code initialize} fails with
 *       {@link ProviderBridgeException.NotInitialized}.</li>
 *   <li>Once {@code close} arrives every request, including another {@code close}, fails with
 *       {@link ProviderBridgeException.EndpointClosed}. Callbacks emitted before the provider
 *       finishes closing are posted before the close reply; later ones are dropped.</li>
 * </ul>
 *
 * <p>Failures are request-scoped. Provider errors reach the caller as
 * {@link ProviderBridgeException.ProviderFailure}; bridge errors keep their own type. Neither
 * tears down the provider or the channel.
 */
public final class RemoteBridgeEndpoint {

    private static final Logger log = LoggerFactory.getLogger(RemoteBridgeEndpoint.class);

    static final String RAW_ONLY_MESSAGE =
            "RpcDataProvider only accepts raw messages (that still need to be parsed with ParseMessagesDataProvider)";

    private enum State { IDLE, INITIALIZING, ACTIVE, CLOSING, CLOSED }

    private final Rpc rpc;
    private final DataProviderFactory factory;
    private final ExecutorService ownedExecutor;
    private final ChannelExtensionPoint extensionPoint;
    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);
    private volatile DataProvider provider;

    /**
     * Creates a new builder.
     *
     * @param rpc the channel end facing the caller (required)
     * @param factory builds the provider named by the {@code initialize} descriptor (required)
     * @return a new builder instance
     */
    public static Builder builder(Rpc rpc, DataProviderFactory factory) {
        return new Builder(rpc, factory);
    }

    private RemoteBridgeEndpoint(Builder builder) {
        this.rpc = builder.rpc;
        this.factory = builder.factory;
        if (builder.callbackExecutor != null) {
            this.ownedExecutor = null;
            this.extensionPoint = new ChannelExtensionPoint(rpc, builder.callbackExecutor);
        } else {
            this.ownedExecutor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "provider-bridge-callbacks");
                t.setDaemon(true);
                return t;
            });
            this.extensionPoint = new ChannelExtensionPoint(rpc, ownedExecutor);
        }

        rpc.receive(Protocol.INITIALIZE, InitializeRequest.class, this::initialize);
        rpc.receive(Protocol.GET_MESSAGES, GetMessagesRequest.class, this::getMessages);
        rpc.receive(Protocol.CLOSE, Object.class, request -> close());
    }

    /**
     * Builder for {@link RemoteBridgeEndpoint}.
     */
    public static final class Builder {
        private final Rpc rpc;
        private final DataProviderFactory factory;
        private Executor callbackExecutor;

        private Builder(Rpc rpc, DataProviderFactory factory) {
            this.rpc = Objects.requireNonNull(rpc, "rpc");
            this.factory = Objects.requireNonNull(factory, "factory");
        }

        /**
         * Sets the executor that posts callback events. Events stay in emission order whatever
         * the executor's parallelism. Default: a dedicated daemon thread owned by the endpoint.
         */
        public Builder callbackExecutor(Executor callbackExecutor) {
            this.callbackExecutor = callbackExecutor;
            return this;
        }

        /**
         * Creates the endpoint and registers its receivers on the channel.
         */
        public RemoteBridgeEndpoint build() {
            return new RemoteBridgeEndpoint(this);
        }
    }

    /**
     * Whether {@code close} has been received.
     */
    public boolean isClosed() {
        State s = state.get();
        return s == State.CLOSING || s == State.CLOSED;
    }

    private CompletionStage<RpcReply> initialize(InitializeRequest request) {
        if (!state.compareAndSet(State.IDLE, State.INITIALIZING)) {
            return CompletableFuture.failedFuture(isClosed()
                    ? closedError(Protocol.INITIALIZE)
                    : new ProviderBridgeException.AlreadyInitialized("initialize has already been called"));
        }
        if (request == null || request.childDescriptor() == null) {
            state.compareAndSet(State.INITIALIZING, State.IDLE);
            return CompletableFuture.failedFuture(new ProviderBridgeException.ProviderFailure("initialize requires a childDescriptor"));
        }

        DataProvider created;
        try {
            created = factory.create(request.childDescriptor());
            if (created == null) {
                throw new ProviderBridgeException.ProviderFailure("factory returned no provider for " + request.childDescriptor().name());
            }
        } catch (RuntimeException e) {
            state.compareAndSet(State.INITIALIZING, State.IDLE);
            log.warn("Could not create provider {}", request.childDescriptor().name(), e);
            return CompletableFuture.failedFuture(bridgeFailure(e));
        }

        provider = created;
        if (!state.compareAndSet(State.INITIALIZING, State.ACTIVE)) {
            // close arrived while the factory ran
            invoke(created::close).whenComplete((v, e) -> {
                if (e != null) log.warn("Closing provider built during close failed", e);
            });
            return CompletableFuture.failedFuture(closedError(Protocol.INITIALIZE));
        }
        log.debug("Initializing provider {}", request.childDescriptor().name());

        return invoke(() -> created.initialize(extensionPoint))
                .thenApply(RpcReply::of);
    }

    private CompletionStage<RpcReply> getMessages(GetMessagesRequest request) {
        if (isClosed()) {
            return CompletableFuture.failedFuture(closedError(Protocol.GET_MESSAGES));
        }
        DataProvider p = provider;
        if (p == null) {
            return CompletableFuture.failedFuture(
                    new ProviderBridgeException.NotInitialized("getMessages called before initialize"));
        }

        GetMessagesTopics topics = GetMessagesTopics.rawOnly(request.topics());
        if (log.isDebugEnabled()) {
            log.debug("getMessages [{}, {}] for {} topic(s)", request.start(), request.end(), request.topics().size());
        }
        return invoke(() -> p.getMessages(request.start(), request.end(), topics))
                .thenApply(RemoteBridgeEndpoint::toReply);
    }

    private CompletionStage<RpcReply> close() {
        State prev = state.getAndUpdate(RemoteBridgeEndpoint::closing);
        if (prev == State.CLOSING || prev == State.CLOSED) {
            return CompletableFuture.failedFuture(closedError(Protocol.CLOSE));
        }
        return release(prev).thenApply(v -> {
            log.debug("Provider closed");
            return RpcReply.empty();
        });
    }

    /**
     * Closes the provider without a {@code close} request, for when the channel to the caller is
     * gone. Completes at once if {@code close} was already received.
     *
     * @return future completing once the provider has closed, or failing with its close error
     */
    public CompletableFuture<Void> shutdown() {
        State prev = state.getAndUpdate(RemoteBridgeEndpoint::closing);
        if (prev == State.CLOSING || prev == State.CLOSED) {
            return CompletableFuture.completedFuture(null);
        }
        log.debug("Shutting down without close request, provider state {}", prev);
        return release(prev);
    }

    private static State closing(State s) {
        return s == State.CLOSING || s == State.CLOSED ? s : State.CLOSING;
    }

    private CompletableFuture<Void> release(State prev) {
        // a provider still being built is closed by initialize itself
        DataProvider p = prev == State.ACTIVE ? provider : null;
        CompletableFuture<Void> closed = p == null
                ? CompletableFuture.completedFuture(null)
                : invoke(p::close);

        CompletableFuture<Void> done = new CompletableFuture<>();
        closed.whenComplete((v, e) -> {
            state.set(State.CLOSED);
            extensionPoint.shutdown().whenComplete((flushed, ignored) -> {
                if (ownedExecutor != null) {
                    ownedExecutor.shutdown();
                }
                if (e != null) {
                    done.completeExceptionally(e);
                } else {
                    done.complete(null);
                }
            });
        });
        return done;
    }

    static RpcReply toReply(GetMessagesResult result) {
        if (result == null) {
            return RpcReply.of(new GetMessagesReply(List.of()));
        }
        if (result.hasParsedMessages() || result.hasObjectMessages()) {
            throw new ProviderBridgeException.ContractViolation(RAW_ONLY_MESSAGE);
        }
        List<RawMessage> raw = result.rawMessagesOrEmpty();
        TransferSet transfer = TransferSet.of(raw);
        return RpcReply.of(new GetMessagesReply(raw), transfer.buffers());
    }

    /**
     * Calls into the provider, turning synchronous throws and failed stages into bridge errors.
     */
    private static <T> CompletableFuture<T> invoke(Supplier<? extends CompletionStage<T>> call) {
        CompletionStage<T> stage;
        try {
            stage = call.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(bridgeFailure(e));
        }
        if (stage == null) {
            return CompletableFuture.failedFuture(new ProviderBridgeException.ProviderFailure("provider returned no result"));
        }

        CompletableFuture<T> out = new CompletableFuture<>();
        stage.whenComplete((value, e) -> {
            if (e != null) {
                out.completeExceptionally(bridgeFailure(e));
            } else {
                out.complete(value);
            }
        });
        return out;
    }

    static ProviderBridgeException bridgeFailure(Throwable t) {
        Throwable cause = t;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof ProviderBridgeException pbe) {
            return pbe;
        }
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new ProviderBridgeException.ProviderFailure(message, cause);
    }

    private static ProviderBridgeException closedError(String method) {
        return new ProviderBridgeException.EndpointClosed(method + " received after close");
    }
}
