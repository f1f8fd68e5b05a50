package io.providerbridge.host;

import io.providerbridge.json.spi.JsonCodec;
import io.providerbridge.json.spi.JsonCodecs;
import io.providerbridge.provider.spi.DataProviderFactory;
import io.providerbridge.remote.RemoteBridgeEndpoint;
import io.providerbridge.remote.ServiceLoaderProviderRegistry;
import io.providerbridge.rpc.Rpc;
import io.providerbridge.rpc.StreamRpcTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Runs a {@link RemoteBridgeEndpoint} over a pair of byte streams.
 *
 * <p>As a child process, {@link #main(String[])} serves on stdin/stdout with every provider kind
 * found through {@link ServiceLoaderProviderRegistry}. Logging must stay off stdout.
 *
 * <p>Embedded:
 * <pre>{@code
 * ProviderHost host = ProviderHost.start(socket.getInputStream(), socket.getOutputStream(), registry, HostConfiguration.load());
 * host.terminated().join();
 * }</pre>
 */
public final class ProviderHost implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProviderHost.class);

    private final Rpc rpc;
    private final RemoteBridgeEndpoint endpoint;
    private final CompletableFuture<Void> terminated = new CompletableFuture<>();

    private ProviderHost(InputStream in, OutputStream out, DataProviderFactory factory, JsonCodec codec, HostConfiguration config) {
        StreamRpcTransport transport = StreamRpcTransport.builder(in, out, codec)
                .maxFrameBytes(config.maxFrameBytes())
                .threadName(config.threadName())
                .build();
        this.rpc = new Rpc(transport);
        this.endpoint = RemoteBridgeEndpoint.builder(rpc, factory).build();
        transport.onClose(this::channelClosed);
        if (transport.isClosed()) {
            channelClosed();
        }
    }

    private void channelClosed() {
        endpoint.shutdown().whenComplete((v, e) -> {
            if (e != null) {
                log.warn("Provider failed to close after the channel closed", e);
            }
            terminated.complete(null);
        });
    }

    /**
     * Start serving with the {@link JsonCodec} found on the class path.
     */
    public static ProviderHost start(InputStream in, OutputStream out, DataProviderFactory factory, HostConfiguration config) {
        return start(in, out, factory, JsonCodecs.load(), config);
    }

    public static ProviderHost start(InputStream in, OutputStream out, DataProviderFactory factory, JsonCodec codec,
                                     HostConfiguration config) {
        Objects.requireNonNull(in, "in");
        Objects.requireNonNull(out, "out");
        Objects.requireNonNull(factory, "factory");
        Objects.requireNonNull(codec, "codec");
        Objects.requireNonNull(config, "config");
        ProviderHost host = new ProviderHost(in, out, factory, codec, config);
        log.debug("Provider host started, max frame {} bytes", config.maxFrameBytes());
        return host;
    }

    /**
     * Completes when the channel has closed, from either side, and the provider with it.
     */
    public CompletableFuture<Void> terminated() {
        return terminated;
    }

    /**
     * Whether the caller has sent {@code close}.
     */
    public boolean providerClosed() {
        return endpoint.isClosed();
    }

    @Override
    public void close() {
        rpc.close();
    }

    public static void main(String[] args) {
        HostConfiguration config = HostConfiguration.load();
        ServiceLoaderProviderRegistry registry = ServiceLoaderProviderRegistry.defaultRegistry();
        log.info("Serving provider kinds {} on stdin/stdout", registry.names());

        ProviderHost host = start(System.in, System.out, registry, config);
        host.terminated().join();
        log.info("Channel closed, exiting");
    }
}
