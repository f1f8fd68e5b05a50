package io.providerbridge.rpc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * One end of an in-JVM channel.
 *
 * <p>Each end owns a single delivery thread, so the two sides behave like separate execution
 * contexts: handlers on one end never run on the other end's thread, and envelopes arrive in the
 * order they were posted. Payloads are handed over by reference, which makes every transfer a
 * move: the sender must not touch a transferred buffer after posting it.
 *
 * <p>Closing either end closes both.
 */
public final class InProcessTransport implements RpcTransport {

    private static final Logger log = LoggerFactory.getLogger(InProcessTransport.class);

    private final String name;
    private final ExecutorService inbox;
    private final AtomicReference<Consumer<RpcEnvelope>> listener = new AtomicReference<>();
    private final List<Runnable> closeListeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile InProcessTransport peer;

    private InProcessTransport(String name) {
        this.name = name;
        this.inbox = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Create two connected ends named {@code provider-bridge-caller} and {@code provider-bridge-remote}.
     */
    public static Pair pair() {
        return pair("provider-bridge-caller", "provider-bridge-remote");
    }

    /**
     * Create two connected ends whose delivery threads carry the given names.
     */
    public static Pair pair(String callerThreadName, String remoteThreadName) {
        InProcessTransport caller = new InProcessTransport(Objects.requireNonNull(callerThreadName, "callerThreadName"));
        InProcessTransport remote = new InProcessTransport(Objects.requireNonNull(remoteThreadName, "remoteThreadName"));
        caller.peer = remote;
        remote.peer = caller;
        return new Pair(caller, remote);
    }

    @Override
    public void postMessage(RpcEnvelope envelope, List<ByteBuffer> transferables) {
        Objects.requireNonNull(envelope, "envelope");
        if (closed.get()) {
            throw new RpcException("transport closed");
        }
        if (log.isTraceEnabled()) {
            log.trace("{} posting {} #{} with {} transferable buffer(s)",
                    name, envelope.topic(), envelope.id(), transferables == null ? 0 : transferables.size());
        }
        peer.deliver(envelope);
    }

    private void deliver(RpcEnvelope envelope) {
        try {
            inbox.execute(() -> {
                Consumer<RpcEnvelope> l = listener.get();
                if (l == null) {
                    log.warn("{} has no listener, dropping {} #{}", name, envelope.topic(), envelope.id());
                    return;
                }
                try {
                    l.accept(envelope);
                } catch (RuntimeException e) {
                    log.error("{} listener failed on {} #{}", name, envelope.topic(), envelope.id(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            throw new RpcException("transport closed", e);
        }
    }

    @Override
    public void onMessage(Consumer<RpcEnvelope> listener) {
        Objects.requireNonNull(listener, "listener");
        if (!this.listener.compareAndSet(null, listener)) {
            throw new IllegalStateException("listener already registered");
        }
    }

    @Override
    public void onClose(Runnable listener) {
        closeListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public <T> T decode(Object payload, Class<T> type) {
        if (payload == null || type == Void.class) return null;
        if (!type.isInstance(payload)) {
            throw new RpcException("expected " + type.getName() + " but got " + payload.getClass().getName());
        }
        return type.cast(payload);
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        inbox.shutdown();
        for (Runnable r : closeListeners) {
            try {
                r.run();
            } catch (RuntimeException e) {
                log.warn("{} close listener failed", name, e);
            }
        }
        InProcessTransport p = peer;
        if (p != null) p.close();
    }

    /**
     * The two ends of a channel.
     */
    public record Pair(InProcessTransport caller, InProcessTransport remote) implements AutoCloseable {
        @Override
        public void close() {
            caller.close();
        }
    }
}
