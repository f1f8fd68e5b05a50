package io.providerbridge.core;

import java.util.Objects;

/**
 * Upstream notification pushed through {@code notifyPlayerManager}.
 */
public record NotifyPlayerManagerData(String type, boolean reconnecting) {

    public static final String UPDATE_RECONNECTING = "updateReconnecting";

    public NotifyPlayerManagerData {
        Objects.requireNonNull(type, "type");
    }

    public static NotifyPlayerManagerData updateReconnecting(boolean reconnecting) {
        return new NotifyPlayerManagerData(UPDATE_RECONNECTING, reconnecting);
    }
}
