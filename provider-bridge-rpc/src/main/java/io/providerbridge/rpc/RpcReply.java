package io.providerbridge.rpc;

import java.nio.ByteBuffer;
import java.util.List;

/**
 * What a handler answers a request with.
 *
 * @param data reply payload (may be null)
 * @param transferables buffers referenced by {@code data} that the transport may move instead of
 *                      copy; the handler must not touch them once the reply is returned
 */
public record RpcReply(Object data, List<ByteBuffer> transferables) {

    private static final RpcReply EMPTY = new RpcReply(null, List.of());

    public RpcReply {
        transferables = transferables == null ? List.of() : List.copyOf(transferables);
    }

    public static RpcReply of(Object data) {
        return new RpcReply(data, List.of());
    }

    public static RpcReply of(Object data, List<ByteBuffer> transferables) {
        return new RpcReply(data, transferables);
    }

    public static RpcReply empty() {
        return EMPTY;
    }
}
