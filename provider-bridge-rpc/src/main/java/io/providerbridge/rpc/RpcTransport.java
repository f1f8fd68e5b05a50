package io.providerbridge.rpc;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.function.Consumer;

/**
 * Bidirectional message transport beneath an {@link Rpc}.
 *
 * <p>Implementations deliver envelopes to the single registered listener in the order they were
 * posted. Sending is fire-and-forget and must not block on the peer.
 */
public interface RpcTransport extends AutoCloseable {

    /**
     * Post an envelope to the peer.
     *
     * @param envelope the envelope
     * @param transferables buffers referenced by the envelope that may be moved rather than copied;
     *                      the caller gives up ownership of them
     * @throws RpcException if the transport is closed or the envelope cannot be encoded
     */
    void postMessage(RpcEnvelope envelope, List<ByteBuffer> transferables);

    /**
     * Register the listener receiving the peer's envelopes.
     *
     * @throws IllegalStateException if a listener is already registered
     */
    void onMessage(Consumer<RpcEnvelope> listener);

    /**
     * Register a callback run once when the transport closes, from either side.
     */
    void onClose(Runnable listener);

    /**
     * Turn a received payload into the type the receiving code expects.
     *
     * @return the typed payload, {@code null} for a {@code null} payload or {@link Void}
     * @throws RpcException if the payload does not match the type
     */
    <T> T decode(Object payload, Class<T> type);

    @Override
    void close();
}
