package io.providerbridge.rpc;

import java.util.concurrent.CompletionStage;

/**
 * Handles one method name on the receiving side of an {@link Rpc}.
 *
 * <p>The handler runs on the transport's delivery thread and must not block; long work belongs in
 * the returned stage. Throwing and returning a failed stage are equivalent.
 */
@FunctionalInterface
public interface RpcHandler<T> {
    CompletionStage<RpcReply> handle(T request);
}
