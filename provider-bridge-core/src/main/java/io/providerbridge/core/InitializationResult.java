package io.providerbridge.core;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * What a provider resolves {@code initialize} with.
 *
 * @param start first timestamp available
 * @param end last timestamp available
 * @param topics topics the provider can serve
 * @param messageDefinitionsByTopic raw message definition text, keyed by topic
 * @param providesParsedMessages whether the provider is able to produce parsed messages at all
 * @param problems problems encountered while initializing
 */
public record InitializationResult(
        Time start,
        Time end,
        List<Topic> topics,
        Map<String, String> messageDefinitionsByTopic,
        boolean providesParsedMessages,
        List<PlayerProblem> problems
) {

    public InitializationResult {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        topics = topics == null ? List.of() : List.copyOf(topics);
        messageDefinitionsByTopic = messageDefinitionsByTopic == null ? Map.of() : Map.copyOf(messageDefinitionsByTopic);
        problems = problems == null ? List.of() : List.copyOf(problems);
    }
}
