package io.providerbridge.remote;

import io.providerbridge.core.RawMessage;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Distinct storage behind a batch of raw records, in first-seen order.
 *
 * <p>Two records share storage when they reference the same {@link ByteBuffer} instance or, for
 * heap buffers, views over the same backing array. Each distinct storage contributes one buffer.
 * For a heap array that buffer spans the whole array, so it covers every record's bytes whichever
 * view came first; other buffers are listed as the first record holds them. Content equality does
 * not count, so two separate buffers holding the same bytes are both listed.
 *
 * <p>Once handed to a transport the buffers are consumed and must not be read again by the sender.
 */
public final class TransferSet {

    private static final TransferSet EMPTY = new TransferSet(List.of());

    private final List<ByteBuffer> buffers;

    private TransferSet(List<ByteBuffer> buffers) {
        this.buffers = buffers;
    }

    public static TransferSet of(Collection<RawMessage> messages) {
        Objects.requireNonNull(messages, "messages");
        if (messages.isEmpty()) return EMPTY;

        Set<Object> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        List<ByteBuffer> out = new ArrayList<>();
        for (RawMessage m : messages) {
            ByteBuffer buffer = m.message();
            if (seen.add(storageOf(buffer))) {
                out.add(covering(buffer));
            }
        }
        return new TransferSet(List.copyOf(out));
    }

    private static Object storageOf(ByteBuffer buffer) {
        // read-only heap buffers hide their array, so they fall back to instance identity
        return buffer.hasArray() ? buffer.array() : buffer;
    }

    private static ByteBuffer covering(ByteBuffer buffer) {
        if (!buffer.hasArray()) return buffer;
        byte[] array = buffer.array();
        boolean whole = buffer.arrayOffset() == 0 && buffer.position() == 0 && buffer.limit() == array.length;
        return whole ? buffer : ByteBuffer.wrap(array);
    }

    public List<ByteBuffer> buffers() {
        return buffers;
    }

    public int size() {
        return buffers.size();
    }

    public boolean isEmpty() {
        return buffers.isEmpty();
    }

    @Override
    public String toString() {
        return "TransferSet[" + buffers.size() + " buffer(s)]";
    }
}
