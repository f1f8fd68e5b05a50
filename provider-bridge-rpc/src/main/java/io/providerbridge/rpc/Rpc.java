package io.providerbridge.rpc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Request/reply and event multiplexer over one {@link RpcTransport}.
 *
 * <p>Both sides of a channel wrap their transport end in an {@code Rpc}:
 * <pre>{@code
 * InProcessTransport.Pair pair = InProcessTransport.pair();
 * Rpc remote = new Rpc(pair.remote());
 * remote.receive("echo", String.class, s -> CompletableFuture.completedFuture(RpcReply.of(s)));
 *
 * Rpc caller = new Rpc(pair.caller());
 * String echoed = caller.send("echo", "hi", String.class).get();
 * }</pre>
 *
 * <p>Every request gets exactly one reply: the handler's result, the handler's failure as a
 * {@link RemoteRpcException}, or {@code NoReceiver} when nothing listens on the topic. Replies are
 * correlated by id, so concurrent requests may complete in any order. Events ({@link #post}) get
 * no reply and have no ordering guarantee relative to replies beyond the transport's FIFO.
 */
public final class Rpc implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Rpc.class);

    static final String NO_RECEIVER = "NoReceiver";

    private final RpcTransport transport;
    private final Map<String, Receiver<?>> receivers = new ConcurrentHashMap<>();
    private final Map<Long, Pending<?>> pending = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong();
    private volatile boolean closed;

    public Rpc(RpcTransport transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
        transport.onMessage(this::dispatch);
        transport.onClose(this::closedUnderneath);
    }

    /**
     * Send a request and await its reply.
     *
     * @param topic method name
     * @param payload request payload
     * @param replyType expected reply type; {@code Void.class} when the reply carries nothing
     * @return future completing with the decoded reply, or failing with {@link RemoteRpcException}
     *         or {@link RpcException}
     */
    public <R> CompletableFuture<R> send(String topic, Object payload, Class<R> replyType) {
        return send(topic, payload, replyType, List.of());
    }

    /**
     * Send a request, handing {@code transferables} over to the transport.
     */
    public <R> CompletableFuture<R> send(String topic, Object payload, Class<R> replyType, List<ByteBuffer> transferables) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(replyType, "replyType");
        if (closed) {
            return CompletableFuture.failedFuture(new RpcException("channel closed"));
        }

        long id = nextId.incrementAndGet();
        CompletableFuture<R> future = new CompletableFuture<>();
        pending.put(id, new Pending<>(replyType, future));
        try {
            transport.postMessage(RpcEnvelope.request(topic, id, payload), transferables);
        } catch (RuntimeException e) {
            pending.remove(id);
            future.completeExceptionally(e);
            return future;
        }
        // close may have drained the pending map between the check above and the put
        if (closed && pending.remove(id) != null) {
            future.completeExceptionally(new RpcException("channel closed"));
        }
        return future;
    }

    /**
     * Post a fire-and-forget event.
     *
     * @throws RpcException if the channel is closed
     */
    public void post(String topic, Object payload) {
        Objects.requireNonNull(topic, "topic");
        if (closed) {
            throw new RpcException("channel closed");
        }
        transport.postMessage(RpcEnvelope.event(topic, payload), List.of());
    }

    /**
     * Register the handler for a method name. Requests and events on {@code topic} are decoded to
     * {@code requestType} before the handler sees them.
     *
     * @throws IllegalStateException if the topic already has a handler
     */
    public <T> void receive(String topic, Class<T> requestType, RpcHandler<? super T> handler) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(requestType, "requestType");
        Objects.requireNonNull(handler, "handler");
        if (RpcEnvelope.RESPONSE_TOPIC.equals(topic)) {
            throw new IllegalArgumentException("topic is reserved: " + topic);
        }
        if (receivers.putIfAbsent(topic, new Receiver<>(requestType, handler)) != null) {
            throw new IllegalStateException("receiver already registered for topic: " + topic);
        }
    }

    /**
     * Decode a payload received inside another payload, for example callback data.
     */
    public <T> T decode(Object payload, Class<T> type) {
        return transport.decode(payload, type);
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        failPending();
        transport.close();
    }

    private void closedUnderneath() {
        closed = true;
        failPending();
    }

    private void failPending() {
        for (Long id : pending.keySet()) {
            Pending<?> p = pending.remove(id);
            if (p != null) {
                p.future.completeExceptionally(new RpcException("channel closed"));
            }
        }
    }

    private void dispatch(RpcEnvelope envelope) {
        if (envelope.replyEnvelope()) {
            completePending(envelope);
            return;
        }

        Receiver<?> receiver = receivers.get(envelope.topic());
        if (receiver == null) {
            if (envelope.expectsReply()) {
                respond(envelope, null, new RpcError(NO_RECEIVER, "no receiver for topic: " + envelope.topic()));
            } else {
                log.warn("Dropping event on topic {} with no receiver", envelope.topic());
            }
            return;
        }

        CompletionStage<RpcReply> result;
        try {
            result = receiver.invoke(envelope.data());
            if (result == null) {
                result = CompletableFuture.completedFuture(RpcReply.empty());
            }
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        }

        if (!envelope.expectsReply()) {
            result.whenComplete((r, e) -> {
                if (e != null) {
                    log.warn("Handler for event {} failed", envelope.topic(), RpcError.unwrap(e));
                }
            });
            return;
        }

        result.whenComplete((r, e) -> {
            if (e != null) {
                log.debug("Request {} #{} failed", envelope.topic(), envelope.id(), RpcError.unwrap(e));
                respond(envelope, null, RpcError.from(e));
            } else {
                respond(envelope, r, null);
            }
        });
    }

    private void respond(RpcEnvelope request, RpcReply reply, RpcError error) {
        if (closed) {
            log.debug("Channel closed, discarding reply to {} #{}", request.topic(), request.id());
            return;
        }
        if (error == null) {
            RpcReply r = reply == null ? RpcReply.empty() : reply;
            try {
                transport.postMessage(RpcEnvelope.reply(request.id(), r.data()), r.transferables());
                return;
            } catch (RpcException e) {
                // the request still gets a reply: the send failure
                log.warn("Cannot send reply to {} #{}, sending failure instead", request.topic(), request.id(), e);
                error = RpcError.from(e);
            }
        }
        try {
            transport.postMessage(RpcEnvelope.failure(request.id(), error), List.of());
        } catch (RpcException e) {
            log.warn("Failed to send failure reply to {} #{}", request.topic(), request.id(), e);
        }
    }

    private void completePending(RpcEnvelope envelope) {
        Pending<?> p = pending.remove(envelope.id());
        if (p == null) {
            log.debug("Reply for unknown request #{}", envelope.id());
            return;
        }
        if (envelope.error() != null) {
            p.future.completeExceptionally(new RemoteRpcException(envelope.error().type(), envelope.error().message()));
            return;
        }
        p.complete(envelope.data());
    }

    private final class Receiver<T> {
        private final Class<T> requestType;
        private final RpcHandler<? super T> handler;

        Receiver(Class<T> requestType, RpcHandler<? super T> handler) {
            this.requestType = requestType;
            this.handler = handler;
        }

        CompletionStage<RpcReply> invoke(Object data) {
            return handler.handle(transport.decode(data, requestType));
        }
    }

    private final class Pending<R> {
        private final Class<R> replyType;
        private final CompletableFuture<R> future;

        Pending(Class<R> replyType, CompletableFuture<R> future) {
            this.replyType = replyType;
            this.future = future;
        }

        void complete(Object data) {
            R value;
            try {
                value = transport.decode(data, replyType);
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
                return;
            }
            future.complete(value);
        }
    }
}
