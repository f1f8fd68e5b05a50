package io.providerbridge.core;

import java.util.Objects;

/**
 * Payload of {@link Protocol#EXTENSION_POINT_CALLBACK}.
 *
 * @param type one of {@link Protocol#PROGRESS_CALLBACK}, {@link Protocol#REPORT_METADATA_CALLBACK},
 *             {@link Protocol#NOTIFY_PLAYER_MANAGER}
 * @param data {@link Progress}, {@link ProviderMetadata} or {@link NotifyPlayerManagerData};
 *             a generic structure when it crossed a serializing transport
 */
public record ExtensionPointCallback(String type, Object data) {
    public ExtensionPointCallback {
        Objects.requireNonNull(type, "type");
    }
}
