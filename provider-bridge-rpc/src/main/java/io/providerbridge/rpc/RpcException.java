package io.providerbridge.rpc;

/**
 * Channel-level failure: the transport is closed, a frame could not be encoded or decoded, or a
 * payload did not match the expected type.
 */
public class RpcException extends RuntimeException {
    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
