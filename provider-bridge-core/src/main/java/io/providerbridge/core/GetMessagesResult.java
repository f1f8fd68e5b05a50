package io.providerbridge.core;

import java.util.List;

/**
 * Result of a provider read over a time range.
 *
 * <p>Each list is {@code null} when the provider did not produce that representation. The bridge
 * accepts only results whose parsed and object lists are both absent.
 */
public record GetMessagesResult(
        List<RawMessage> rawMessages,
        List<ParsedMessage> parsedMessages,
        List<ObjectMessage> objectMessages
) {

    public GetMessagesResult {
        rawMessages = rawMessages == null ? null : List.copyOf(rawMessages);
        parsedMessages = parsedMessages == null ? null : List.copyOf(parsedMessages);
        objectMessages = objectMessages == null ? null : List.copyOf(objectMessages);
    }

    public static GetMessagesResult raw(List<RawMessage> messages) {
        return new GetMessagesResult(messages, null, null);
    }

    public boolean hasParsedMessages() {
        return parsedMessages != null;
    }

    public boolean hasObjectMessages() {
        return objectMessages != null;
    }

    /**
     * Raw records, or an empty list when none were produced.
     */
    public List<RawMessage> rawMessagesOrEmpty() {
        return rawMessages == null ? List.of() : rawMessages;
    }
}
