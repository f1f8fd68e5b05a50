package io.providerbridge.remote;

import io.providerbridge.core.ExtensionPointCallback;
import io.providerbridge.core.NotifyPlayerManagerData;
import io.providerbridge.core.Progress;
import io.providerbridge.core.Protocol;
import io.providerbridge.core.ProviderMetadata;
import io.providerbridge.rpc.InProcessTransport;
import io.providerbridge.rpc.Rpc;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ChannelExtensionPointTest {

    private InProcessTransport.Pair pair;
    private ExecutorService executor;
    private final List<ExtensionPointCallback> received = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        pair = InProcessTransport.pair();
        executor = Executors.newFixedThreadPool(2);
        new Rpc(pair.caller()).receive(Protocol.EXTENSION_POINT_CALLBACK, ExtensionPointCallback.class, e -> {
            received.add(e);
            return null;
        });
    }

    @AfterEach
    void tearDown() {
        pair.close();
        executor.shutdownNow();
    }

    @Test
    void eachSlotIsTaggedWithItsKind() throws Exception {
        ChannelExtensionPoint ep = new ChannelExtensionPoint(new Rpc(pair.remote()), executor);

        ep.progressCallback(new Progress(List.of()));
        ep.reportMetadataCallback(new ProviderMetadata("stats", Map.of()));
        ep.notifyPlayerManager(NotifyPlayerManagerData.updateReconnecting(false));
        ep.shutdown().get(5, TimeUnit.SECONDS);

        awaitReceived(3);
        assertThat(received).extracting(ExtensionPointCallback::type).containsExactly(
                Protocol.PROGRESS_CALLBACK, Protocol.REPORT_METADATA_CALLBACK, Protocol.NOTIFY_PLAYER_MANAGER);
        assertThat(received.get(2).data()).isEqualTo(new NotifyPlayerManagerData("updateReconnecting", false));
    }

    @Test
    void callbacksAfterShutdownAreDropped() throws Exception {
        ChannelExtensionPoint ep = new ChannelExtensionPoint(new Rpc(pair.remote()), executor);
        ep.shutdown().get(5, TimeUnit.SECONDS);

        ep.progressCallback(new Progress(List.of()));

        assertThat(ep.shutdown()).isCompleted();
        Thread.sleep(50);
        assertThat(received).isEmpty();
    }

    @Test
    void closedChannelDoesNotBreakTheProvider() throws Exception {
        Rpc remote = new Rpc(pair.remote());
        ChannelExtensionPoint ep = new ChannelExtensionPoint(remote, executor);
        remote.close();

        ep.progressCallback(new Progress(List.of()));

        assertThat(ep.shutdown().get(5, TimeUnit.SECONDS)).isNull();
    }

    @Test
    void serialExecutorRunsTasksInSubmissionOrder() throws Exception {
        SerialExecutor serial = new SerialExecutor(executor);
        List<Integer> order = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(200);

        for (int i = 0; i < 200; i++) {
            int n = i;
            serial.execute(() -> {
                order.add(n);
                done.countDown();
            });
        }

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(order).isSorted().hasSize(200);
    }

    private void awaitReceived(int count) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (received.size() < count && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
    }
}
