package io.providerbridge.core;

import java.util.List;

/**
 * Reply to {@link Protocol#GET_MESSAGES}: raw records only.
 */
public record GetMessagesReply(List<RawMessage> messages) {
    public GetMessagesReply {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }
}
