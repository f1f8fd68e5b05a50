package io.providerbridge.json.jackson;

import io.providerbridge.core.ExtensionPointCallback;
import io.providerbridge.core.GetMessagesReply;
import io.providerbridge.core.InitializeRequest;
import io.providerbridge.core.Progress;
import io.providerbridge.core.ProviderDescriptor;
import io.providerbridge.core.Range;
import io.providerbridge.core.RawMessage;
import io.providerbridge.core.Time;
import io.providerbridge.json.spi.JsonCodec;
import io.providerbridge.json.spi.JsonCodecs;
import io.providerbridge.json.spi.JsonException;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonJsonCodecTest {

    private final JsonCodec codec = new JacksonJsonCodec();

    @Test
    void serviceLoaderFindsJacksonCodec() {
        assertThat(JsonCodecs.load()).isInstanceOf(JacksonJsonCodec.class);
    }

    @Test
    void nestedDescriptorSurvivesTheWire() throws Exception {
        ProviderDescriptor descriptor = ProviderDescriptor.of(
                "cache",
                Map.of("maxBytes", 1024),
                ProviderDescriptor.of("bag", Map.of("path", "/data/run.bag")));

        byte[] json = codec.writeBytes(new InitializeRequest(descriptor));
        InitializeRequest read = codec.readValue(json, InitializeRequest.class);

        assertThat(read.childDescriptor().name()).isEqualTo("cache");
        assertThat(read.childDescriptor().children()).hasSize(1);
        assertThat(read.childDescriptor().children().get(0).args()).containsEntry("path", "/data/run.bag");
    }

    @Test
    void rawMessageBytesAreCarriedExactly() throws Exception {
        byte[] payload = {0, 1, 2, (byte) 0xff, 127};
        RawMessage m = new RawMessage("/imu", new Time(12, 34), ByteBuffer.wrap(payload));

        byte[] json = codec.writeBytes(new GetMessagesReply(List.of(m)));
        GetMessagesReply read = codec.readValue(json, GetMessagesReply.class);

        RawMessage back = read.messages().get(0);
        assertThat(back.topic()).isEqualTo("/imu");
        assertThat(back.receiveTime()).isEqualTo(new Time(12, 34));
        byte[] bytes = new byte[back.message().remaining()];
        back.message().get(bytes);
        assertThat(bytes).containsExactly(payload);
    }

    @Test
    void onlyTheRemainingBytesOfASliceAreWritten() throws Exception {
        ByteBuffer chunk = ByteBuffer.wrap("headerBODY".getBytes(StandardCharsets.US_ASCII));
        chunk.position(6);
        RawMessage m = new RawMessage("/t", new Time(0, 0), chunk);

        GetMessagesReply read = codec.readValue(codec.writeBytes(new GetMessagesReply(List.of(m))), GetMessagesReply.class);

        assertThat(StandardCharsets.US_ASCII.decode(read.messages().get(0).message()).toString()).isEqualTo("BODY");
    }

    @Test
    void genericCallbackDataConvertsToItsRecord() throws Exception {
        ExtensionPointCallback sent = new ExtensionPointCallback(
                "progressCallback", new Progress(List.of(new Range(0.0, 0.5))));

        ExtensionPointCallback received = codec.readValue(codec.writeBytes(sent), ExtensionPointCallback.class);

        assertThat(received.data()).isInstanceOf(Map.class);
        Progress progress = codec.convertValue(received.data(), Progress.class);
        assertThat(progress.fullyLoadedFractionRanges()).containsExactly(new Range(0.0, 0.5));
    }

    @Test
    void convertValueReturnsInstancesOfTargetTypeUnchanged() throws Exception {
        Progress progress = new Progress(List.of());

        assertThat(codec.convertValue(progress, Progress.class)).isSameAs(progress);
        assertThat(codec.convertValue(null, Progress.class)).isNull();
    }

    @Test
    void malformedJsonIsReportedAsJsonException() {
        assertThatThrownBy(() -> codec.readValue("{not json".getBytes(StandardCharsets.UTF_8), InitializeRequest.class))
                .isInstanceOf(JsonException.class)
                .hasMessageContaining(InitializeRequest.class.getName());
    }

    @Test
    void invalidRecordStateIsReportedAsJsonException() {
        assertThatThrownBy(() -> codec.convertValue(Map.of("sec", 1, "nsec", -5), Time.class))
                .isInstanceOf(JsonException.class);
    }
}
