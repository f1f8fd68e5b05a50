package io.providerbridge.rpc;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Failure carried by a reply envelope.
 *
 * @param type simple class name of the exception raised by the handler
 * @param message exception message
 */
public record RpcError(String type, String message) {

    public static RpcError from(Throwable t) {
        Throwable cause = unwrap(t);
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
        return new RpcError(cause.getClass().getSimpleName(), message);
    }

    static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }
}
