package io.providerbridge.rpc;

import java.util.Objects;

/**
 * Unit of transport.
 *
 * <ul>
 *   <li>request: {@code topic} is the method name, {@code id > 0}</li>
 *   <li>event: {@code topic} is the method name, {@code id == 0}, no reply</li>
 *   <li>reply: {@code topic} is {@link #RESPONSE_TOPIC}, {@code id} is the request's, and either
 *       {@code data} or {@code error} is set</li>
 * </ul>
 */
public record RpcEnvelope(String topic, long id, Object data, RpcError error) {

    /**
     * Reserved topic carrying replies.
     */
    public static final String RESPONSE_TOPIC = "$$response";

    public RpcEnvelope {
        Objects.requireNonNull(topic, "topic");
        if (id < 0) throw new IllegalArgumentException("id must be non-negative");
    }

    public static RpcEnvelope request(String topic, long id, Object data) {
        if (id == 0) throw new IllegalArgumentException("request id must be positive");
        return new RpcEnvelope(topic, id, data, null);
    }

    public static RpcEnvelope event(String topic, Object data) {
        return new RpcEnvelope(topic, 0, data, null);
    }

    public static RpcEnvelope reply(long id, Object data) {
        return new RpcEnvelope(RESPONSE_TOPIC, id, data, null);
    }

    public static RpcEnvelope failure(long id, RpcError error) {
        return new RpcEnvelope(RESPONSE_TOPIC, id, null, Objects.requireNonNull(error, "error"));
    }

    public boolean expectsReply() {
        return id > 0 && !RESPONSE_TOPIC.equals(topic);
    }

    public boolean replyEnvelope() {
        return RESPONSE_TOPIC.equals(topic);
    }
}
