package io.providerbridge.core;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * A byte-exact, unparsed message.
 *
 * <p>The bytes between {@code message.position()} and {@code message.limit()} are the payload.
 * Several records may share one buffer; the bridge deduplicates by buffer identity when it
 * builds a transfer list, so providers should hand out the same {@link ByteBuffer} instance
 * rather than duplicates when records come from one chunk.
 *
 * @param topic topic the message was recorded on
 * @param receiveTime receive timestamp
 * @param message payload buffer
 */
public record RawMessage(String topic, Time receiveTime, ByteBuffer message) {
    public RawMessage {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(receiveTime, "receiveTime");
        Objects.requireNonNull(message, "message");
    }
}
