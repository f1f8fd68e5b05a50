package io.providerbridge.core;

/**
 * Base class for provider bridge errors.
 *
 * <p>Every subtype is request-scoped: it fails the request it was raised for and leaves the
 * channel and the provider usable. The simple class name of a subtype is its wire name, so a
 * failure raised on the remote side can be rebuilt on the caller side with
 * {@link #fromWire(String, String)}.
 */
public abstract class ProviderBridgeException extends RuntimeException {

    protected ProviderBridgeException(String message) {
        super(message);
    }

    protected ProviderBridgeException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Stable name of this error on the wire.
     */
    public String errorType() {
        return getClass().getSimpleName();
    }

    /**
     * Rebuild a bridge exception from its wire form.
     *
     * @param type wire name as returned by {@link #errorType()}
     * @param message error message
     * @return the matching subtype, or {@link ProviderFailure} for unknown names
     */
    public static ProviderBridgeException fromWire(String type, String message) {
        if (type == null) return new ProviderFailure(message);
        return switch (type) {
            case "ContractViolation" -> new ContractViolation(message);
            case "NotInitialized" -> new NotInitialized(message);
            case "AlreadyInitialized" -> new AlreadyInitialized(message);
            case "EndpointClosed" -> new EndpointClosed(message);
            case "UnknownProvider" -> new UnknownProvider(message);
            default -> new ProviderFailure(message);
        };
    }

    /**
     * Raised when a provider returns a forbidden payload shape (parsed or object records).
     *
     * <p>Not retryable: it means the provider and the caller disagree about the byte-exact contract.
     */
    public static class ContractViolation extends ProviderBridgeException {
        public ContractViolation(String message) {
            super(message);
        }
    }

    /**
     * Raised when the provider itself fails during initialize, getMessages or close.
     */
    public static class ProviderFailure extends ProviderBridgeException {
        public ProviderFailure(String message) {
            super(message);
        }

        public ProviderFailure(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when a request that needs a provider arrives before {@code initialize}.
     */
    public static class NotInitialized extends ProviderBridgeException {
        public NotInitialized(String message) {
            super(message);
        }
    }

    /**
     * Raised on a second {@code initialize}; the first provider stays in place.
     */
    public static class AlreadyInitialized extends ProviderBridgeException {
        public AlreadyInitialized(String message) {
            super(message);
        }
    }

    /**
     * Raised for any request that arrives once {@code close} has begun.
     */
    public static class EndpointClosed extends ProviderBridgeException {
        public EndpointClosed(String message) {
            super(message);
        }
    }

    /**
     * Raised when a descriptor names a provider kind no registry knows.
     */
    public static class UnknownProvider extends ProviderBridgeException {
        public UnknownProvider(String message) {
            super(message);
        }
    }
}
