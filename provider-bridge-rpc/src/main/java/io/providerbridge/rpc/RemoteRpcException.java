package io.providerbridge.rpc;

/**
 * A request failed on the other side of the channel.
 */
public final class RemoteRpcException extends RpcException {
    private final String errorType;

    public RemoteRpcException(String errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    /**
     * Name of the error as reported by the remote side.
     */
    public String errorType() {
        return errorType;
    }
}
