package io.providerbridge.rpc;

import io.providerbridge.json.spi.JsonCodec;
import io.providerbridge.json.spi.JsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * {@link RpcTransport} over a pair of byte streams, such as a child process's stdin/stdout or a socket.
 *
 * <p>Wire format, one frame per envelope:
 * <pre>
 * Offset  Size  Field
 * ------  ----  -----
 * 0       4     length N (big-endian, excludes itself)
 * 4       N     envelope as UTF-8 JSON
 * </pre>
 *
 * <p>Byte buffers are base64 inside the JSON, so a transfer list cannot avoid the copy here; the
 * buffers are still released to the transport and the sender must not reuse them.
 *
 * <p>A frame announcing more than {@link Builder#maxFrameBytes(int)} bytes is a protocol error and
 * closes the transport. A frame that is well-formed but not a valid envelope is logged and skipped.
 * End of input closes the transport.
 *
 * <pre>{@code
 * StreamRpcTransport transport = StreamRpcTransport.builder(process.getInputStream(), process.getOutputStream(), codec)
 *     .maxFrameBytes(16 * 1024 * 1024)
 *     .build();
 * Rpc rpc = new Rpc(transport);
 * }</pre>
 */
public final class StreamRpcTransport implements RpcTransport {

    private static final Logger log = LoggerFactory.getLogger(StreamRpcTransport.class);

    /**
     * Default frame limit: 64 MiB.
     */
    public static final int DEFAULT_MAX_FRAME_BYTES = 64 * 1024 * 1024;

    private final DataInputStream in;
    private final DataOutputStream out;
    private final JsonCodec codec;
    private final int maxFrameBytes;
    private final String threadName;
    private final AtomicReference<Consumer<RpcEnvelope>> listener = new AtomicReference<>();
    private final List<Runnable> closeListeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final Object writeLock = new Object();

    public static Builder builder(InputStream in, OutputStream out, JsonCodec codec) {
        return new Builder(in, out, codec);
    }

    private StreamRpcTransport(Builder builder) {
        this.in = new DataInputStream(new BufferedInputStream(builder.in));
        this.out = new DataOutputStream(new BufferedOutputStream(builder.out));
        this.codec = builder.codec;
        this.maxFrameBytes = builder.maxFrameBytes > 0 ? builder.maxFrameBytes : DEFAULT_MAX_FRAME_BYTES;
        this.threadName = builder.threadName != null ? builder.threadName : "provider-bridge-reader";
    }

    /**
     * Builder for {@link StreamRpcTransport}.
     */
    public static final class Builder {
        private final InputStream in;
        private final OutputStream out;
        private final JsonCodec codec;
        private int maxFrameBytes;
        private String threadName;

        private Builder(InputStream in, OutputStream out, JsonCodec codec) {
            this.in = Objects.requireNonNull(in, "in");
            this.out = Objects.requireNonNull(out, "out");
            this.codec = Objects.requireNonNull(codec, "codec");
        }

        /** Sets the largest accepted frame, in either direction. Default: 64 MiB. */
        public Builder maxFrameBytes(int maxFrameBytes) {
            this.maxFrameBytes = maxFrameBytes;
            return this;
        }

        /** Sets the name of the reader thread. Default: {@code provider-bridge-reader}. */
        public Builder threadName(String threadName) {
            this.threadName = threadName;
            return this;
        }

        public StreamRpcTransport build() {
            return new StreamRpcTransport(this);
        }
    }

    @Override
    public void postMessage(RpcEnvelope envelope, List<ByteBuffer> transferables) {
        Objects.requireNonNull(envelope, "envelope");
        if (closed.get()) {
            throw new RpcException("transport closed");
        }

        byte[] body;
        try {
            body = codec.writeBytes(envelope);
        } catch (JsonException e) {
            throw new RpcException("cannot encode " + envelope.topic() + " #" + envelope.id(), e);
        }
        if (body.length > maxFrameBytes) {
            throw new RpcException("frame of " + body.length + " bytes exceeds limit of " + maxFrameBytes);
        }

        try {
            synchronized (writeLock) {
                out.writeInt(body.length);
                out.write(body);
                out.flush();
            }
        } catch (IOException e) {
            log.error("Write failed, closing transport", e);
            close();
            throw new RpcException("write failed", e);
        }
    }

    /**
     * Registers the listener and starts the reader thread.
     */
    @Override
    public void onMessage(Consumer<RpcEnvelope> listener) {
        Objects.requireNonNull(listener, "listener");
        if (!this.listener.compareAndSet(null, listener)) {
            throw new IllegalStateException("listener already registered");
        }
        Thread reader = new Thread(this::readLoop, threadName);
        reader.setDaemon(true);
        reader.start();
    }

    @Override
    public void onClose(Runnable listener) {
        closeListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public <T> T decode(Object payload, Class<T> type) {
        if (payload == null || type == Void.class) return null;
        try {
            return codec.convertValue(payload, type);
        } catch (JsonException e) {
            throw new RpcException("cannot decode payload as " + type.getName(), e);
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    private void readLoop() {
        Consumer<RpcEnvelope> l = listener.get();
        try {
            while (!closed.get()) {
                int length;
                try {
                    length = in.readInt();
                } catch (EOFException eof) {
                    log.debug("End of input");
                    break;
                }
                if (length < 0 || length > maxFrameBytes) {
                    log.error("Frame length {} outside [0, {}], closing transport", length, maxFrameBytes);
                    break;
                }

                byte[] frame = new byte[length];
                in.readFully(frame);

                RpcEnvelope envelope;
                try {
                    envelope = codec.readValue(frame, RpcEnvelope.class);
                } catch (JsonException e) {
                    log.warn("Skipping undecodable frame of {} bytes", length, e);
                    continue;
                }

                try {
                    l.accept(envelope);
                } catch (RuntimeException e) {
                    log.error("Listener failed on {} #{}", envelope.topic(), envelope.id(), e);
                }
            }
        } catch (IOException e) {
            if (!closed.get()) {
                log.error("Read failed, closing transport", e);
            }
        } finally {
            close();
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        try {
            in.close();
        } catch (IOException e) {
            log.debug("Error closing input", e);
        }
        try {
            synchronized (writeLock) {
                out.close();
            }
        } catch (IOException e) {
            log.debug("Error closing output", e);
        }
        for (Runnable r : closeListeners) {
            try {
                r.run();
            } catch (RuntimeException e) {
                log.warn("Close listener failed", e);
            }
        }
    }
}
