package io.providerbridge.core;

/**
 * Method names and callback kinds of the provider bridge channel.
 */
public final class Protocol {
    private Protocol() {}

    // Caller -> bridge
    public static final String INITIALIZE = "initialize";
    public static final String GET_MESSAGES = "getMessages";
    public static final String CLOSE = "close";

    // Bridge -> caller
    public static final String EXTENSION_POINT_CALLBACK = "extensionPointCallback";

    // extensionPointCallback.type
    public static final String PROGRESS_CALLBACK = "progressCallback";
    public static final String REPORT_METADATA_CALLBACK = "reportMetadataCallback";
    public static final String NOTIFY_PLAYER_MANAGER = "notifyPlayerManager";
}
