package io.providerbridge.provider.spi;

import io.providerbridge.core.GetMessagesResult;
import io.providerbridge.core.GetMessagesTopics;
import io.providerbridge.core.InitializationResult;
import io.providerbridge.core.ProviderBridgeException;
import io.providerbridge.core.ProviderDescriptor;
import io.providerbridge.core.Time;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DataProviderRegistryTest {

    @Test
    void dispatchesOnDescriptorName() {
        DataProviderRegistry registry = DataProviderRegistry.builder()
                .register(new LeafDefinition("a"))
                .register(new LeafDefinition("b"))
                .build();

        DataProvider provider = registry.create(ProviderDescriptor.of("b"));

        assertThat(provider).isInstanceOf(Leaf.class);
        assertThat(((Leaf) provider).kind).isEqualTo("b");
        assertThat(registry.names()).containsExactlyInAnyOrder("a", "b");
    }

    @Test
    void buildsNestedTreesThroughTheSameRegistry() {
        DataProviderRegistry registry = DataProviderRegistry.builder()
                .register(new WrapperDefinition())
                .register(new LeafDefinition("leaf"))
                .build();

        ProviderDescriptor tree = ProviderDescriptor.of("wrapper", Map.of(),
                ProviderDescriptor.of("wrapper", Map.of(), ProviderDescriptor.of("leaf")));

        Wrapper outer = (Wrapper) registry.create(tree);

        assertThat(outer.children).hasSize(1);
        Wrapper inner = (Wrapper) outer.children.get(0);
        assertThat(inner.children).singleElement().isInstanceOf(Leaf.class);
    }

    @Test
    void unknownNameFailsWithUnknownProvider() {
        DataProviderRegistry registry = DataProviderRegistry.builder().build();

        assertThatThrownBy(() -> registry.create(ProviderDescriptor.of("nope")))
                .isInstanceOf(ProviderBridgeException.UnknownProvider.class)
                .hasMessageContaining("nope");
    }

    @Test
    void rejectsDuplicateAndBlankNames() {
        DataProviderRegistry.Builder builder = DataProviderRegistry.builder().register(new LeafDefinition("a"));

        assertThatThrownBy(() -> builder.register(new LeafDefinition("a")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("already registered");
        assertThatThrownBy(() -> builder.register(new LeafDefinition(" ")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private record LeafDefinition(String name) implements DataProviderDefinition {
        @Override
        public DataProvider create(ProviderDescriptor descriptor, DataProviderFactory children) {
            return new Leaf(descriptor.name());
        }
    }

    private static final class WrapperDefinition implements DataProviderDefinition {
        @Override
        public String name() {
            return "wrapper";
        }

        @Override
        public DataProvider create(ProviderDescriptor descriptor, DataProviderFactory children) {
            List<DataProvider> built = new ArrayList<>();
            for (ProviderDescriptor child : descriptor.children()) {
                built.add(children.create(child));
            }
            return new Wrapper(built);
        }
    }

    private static class Leaf implements DataProvider {
        final String kind;

        Leaf(String kind) {
            this.kind = kind;
        }

        @Override
        public CompletableFuture<InitializationResult> initialize(ExtensionPoint extensionPoint) {
            return CompletableFuture.completedFuture(new InitializationResult(new Time(0, 0), new Time(1, 0), null, null, false, null));
        }

        @Override
        public CompletableFuture<GetMessagesResult> getMessages(Time start, Time end, GetMessagesTopics topics) {
            return CompletableFuture.completedFuture(GetMessagesResult.raw(List.of()));
        }

        @Override
        public CompletableFuture<Void> close() {
            return CompletableFuture.completedFuture(null);
        }
    }

    private static final class Wrapper extends Leaf {
        final List<DataProvider> children;

        Wrapper(List<DataProvider> children) {
            super("wrapper");
            this.children = children;
        }
    }
}
