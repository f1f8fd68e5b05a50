package io.providerbridge.host;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Properties;

/**
 * Settings of a {@link ProviderHost}.
 *
 * <p>{@link #load()} reads {@value #RESOURCE} from the class path and lets system properties of
 * the same name override it. Missing keys keep their defaults.
 *
 * @param maxFrameBytes largest accepted frame, in either direction
 * @param threadName name of the frame reader thread
 */
public record HostConfiguration(int maxFrameBytes, String threadName) {

    public static final String RESOURCE = "provider-bridge.properties";
    public static final String MAX_FRAME_BYTES = "provider-bridge.max-frame-bytes";
    public static final String THREAD_NAME = "provider-bridge.thread-name";

    public static final int DEFAULT_MAX_FRAME_BYTES = 64 * 1024 * 1024;
    public static final String DEFAULT_THREAD_NAME = "provider-bridge-host";

    public HostConfiguration {
        if (maxFrameBytes <= 0) {
            throw new IllegalArgumentException(MAX_FRAME_BYTES + " must be positive: " + maxFrameBytes);
        }
        Objects.requireNonNull(threadName, "threadName");
        if (threadName.isBlank()) {
            throw new IllegalArgumentException(THREAD_NAME + " must not be blank");
        }
    }

    public static HostConfiguration defaults() {
        return new HostConfiguration(DEFAULT_MAX_FRAME_BYTES, DEFAULT_THREAD_NAME);
    }

    /**
     * Class path resource, then system properties.
     *
     * @throws UncheckedIOException if the resource exists but cannot be read
     * @throws IllegalArgumentException if a value is invalid
     */
    public static HostConfiguration load() {
        Properties props = new Properties();
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        try (InputStream in = cl == null ? null : cl.getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + RESOURCE, e);
        }
        for (String name : new String[] {MAX_FRAME_BYTES, THREAD_NAME}) {
            String override = System.getProperty(name);
            if (override != null) {
                props.setProperty(name, override);
            }
        }
        return fromProperties(props);
    }

    public static HostConfiguration fromProperties(Properties props) {
        Objects.requireNonNull(props, "props");
        int maxFrameBytes = DEFAULT_MAX_FRAME_BYTES;
        String raw = props.getProperty(MAX_FRAME_BYTES);
        if (raw != null) {
            try {
                maxFrameBytes = Integer.parseInt(raw.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(MAX_FRAME_BYTES + " is not an integer: " + raw, e);
            }
        }
        String threadName = props.getProperty(THREAD_NAME, DEFAULT_THREAD_NAME).trim();
        return new HostConfiguration(maxFrameBytes, threadName);
    }
}
