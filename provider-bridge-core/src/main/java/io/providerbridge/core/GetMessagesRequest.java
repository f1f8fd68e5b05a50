package io.providerbridge.core;

import java.util.Set;

/**
 * Payload of {@link Protocol#GET_MESSAGES}. Bounds are inclusive and forwarded unmodified.
 */
public record GetMessagesRequest(Time start, Time end, Set<String> topics) {
    public GetMessagesRequest {
        topics = topics == null ? Set.of() : Set.copyOf(topics);
    }
}
