package io.providerbridge.core;

import java.util.Set;

/**
 * Topics requested from a provider, split by the representation wanted for each.
 *
 * <p>A {@code null} set means that representation is not requested at all.
 */
public record GetMessagesTopics(Set<String> rawMessages, Set<String> parsedMessages, Set<String> objectMessages) {

    public GetMessagesTopics {
        rawMessages = rawMessages == null ? null : Set.copyOf(rawMessages);
        parsedMessages = parsedMessages == null ? null : Set.copyOf(parsedMessages);
        objectMessages = objectMessages == null ? null : Set.copyOf(objectMessages);
    }

    /**
     * Request raw records only.
     */
    public static GetMessagesTopics rawOnly(Set<String> topics) {
        return new GetMessagesTopics(topics == null ? Set.of() : topics, null, null);
    }

    public boolean rawOnlyRequest() {
        return parsedMessages == null && objectMessages == null;
    }
}
