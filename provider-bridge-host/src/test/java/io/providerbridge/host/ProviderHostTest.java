package io.providerbridge.host;

import io.providerbridge.client.RpcDataProvider;
import io.providerbridge.core.GetMessagesResult;
import io.providerbridge.core.GetMessagesTopics;
import io.providerbridge.core.InitializationResult;
import io.providerbridge.core.ProviderBridgeException;
import io.providerbridge.core.ProviderDescriptor;
import io.providerbridge.core.RawMessage;
import io.providerbridge.core.Time;
import io.providerbridge.core.Topic;
import io.providerbridge.json.spi.JsonCodec;
import io.providerbridge.json.spi.JsonCodecs;
import io.providerbridge.provider.spi.DataProvider;
import io.providerbridge.provider.spi.DataProviderDefinition;
import io.providerbridge.provider.spi.DataProviderFactory;
import io.providerbridge.provider.spi.DataProviderRegistry;
import io.providerbridge.provider.spi.ExtensionPoint;
import io.providerbridge.rpc.Rpc;
import io.providerbridge.rpc.StreamRpcTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderHostTest {

    private final JsonCodec codec = JsonCodecs.load();
    private ServerSocket server;
    private Socket callerSocket;
    private Socket hostSocket;
    private final CountingDefinition counting = new CountingDefinition();
    private ProviderHost host;
    private Rpc caller;

    @BeforeEach
    void setUp() throws Exception {
        server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
        callerSocket = new Socket(InetAddress.getLoopbackAddress(), server.getLocalPort());
        hostSocket = server.accept();

        DataProviderRegistry registry = DataProviderRegistry.builder()
                .register(counting)
                .build();
        host = ProviderHost.start(hostSocket.getInputStream(), hostSocket.getOutputStream(), registry,
                new HostConfiguration(1024 * 1024, "host-under-test"));
        caller = new Rpc(StreamRpcTransport.builder(callerSocket.getInputStream(), callerSocket.getOutputStream(), codec).build());
    }

    @AfterEach
    void tearDown() throws Exception {
        host.close();
        callerSocket.close();
        hostSocket.close();
        server.close();
    }

    @Test
    void servesAProviderTreeNamedByTheCaller() throws Exception {
        RpcDataProvider provider = new RpcDataProvider(caller, ProviderDescriptor.of("counting", Map.of("count", 3)));

        InitializationResult init = provider.initialize(ExtensionPoint.discarding()).get(5, TimeUnit.SECONDS);
        GetMessagesResult result = provider.getMessages(new Time(0, 0), new Time(10, 0), GetMessagesTopics.rawOnly(Set.of("/count")))
                .get(5, TimeUnit.SECONDS);

        assertThat(init.topics()).containsExactly(new Topic("/count", "std_msgs/UInt8"));
        assertThat(result.rawMessages()).hasSize(3);
        assertThat(result.rawMessages()).extracting(m -> m.message().get(m.message().position()))
                .containsExactly((byte) 0, (byte) 1, (byte) 2);

        provider.close().get(5, TimeUnit.SECONDS);
        assertThat(host.providerClosed()).isTrue();
    }

    @Test
    void unknownKindIsReportedAndHostKeepsServing() throws Exception {
        RpcDataProvider wrong = new RpcDataProvider(caller, ProviderDescriptor.of("bag-file"));

        assertThatThrownBy(() -> wrong.initialize(ExtensionPoint.discarding()).get(5, TimeUnit.SECONDS))
                .hasCauseInstanceOf(ProviderBridgeException.UnknownProvider.class);
        assertThat(host.terminated()).isNotDone();
    }

    @Test
    void callerDisconnectTerminatesHost() throws Exception {
        callerSocket.shutdownOutput();

        host.terminated().get(5, TimeUnit.SECONDS);

        assertThat(host.terminated()).isCompleted();
    }

    @Test
    void callerDisconnectClosesTheProvider() throws Exception {
        RpcDataProvider provider = new RpcDataProvider(caller, ProviderDescriptor.of("counting"));
        provider.initialize(ExtensionPoint.discarding()).get(5, TimeUnit.SECONDS);

        callerSocket.shutdownOutput();
        host.terminated().get(5, TimeUnit.SECONDS);

        assertThat(counting.closes).hasValue(1);
        assertThat(host.providerClosed()).isTrue();
    }

    /**
     * Serves {@code count} one-byte records on {@code /count}, all backed by one chunk.
     */
    private static final class CountingDefinition implements DataProviderDefinition {
        final AtomicInteger closes = new AtomicInteger();

        @Override
        public String name() {
            return "counting";
        }

        @Override
        public DataProvider create(ProviderDescriptor descriptor, DataProviderFactory children) {
            int count = ((Number) descriptor.args().getOrDefault("count", 1)).intValue();
            return new DataProvider() {
                @Override
                public CompletableFuture<InitializationResult> initialize(ExtensionPoint extensionPoint) {
                    return CompletableFuture.completedFuture(new InitializationResult(
                            new Time(0, 0), new Time(count, 0), List.of(new Topic("/count", "std_msgs/UInt8")),
                            Map.of("/count", "uint8 data"), false, List.of()));
                }

                @Override
                public CompletableFuture<GetMessagesResult> getMessages(Time start, Time end, GetMessagesTopics topics) {
                    byte[] chunk = new byte[count];
                    List<RawMessage> out = new ArrayList<>();
                    for (int i = 0; i < count; i++) {
                        chunk[i] = (byte) i;
                        out.add(new RawMessage("/count", new Time(i, 0), ByteBuffer.wrap(chunk, i, 1)));
                    }
                    return CompletableFuture.completedFuture(GetMessagesResult.raw(out));
                }

                @Override
                public CompletableFuture<Void> close() {
                    closes.incrementAndGet();
                    return CompletableFuture.completedFuture(null);
                }
            };
        }
    }
}
