/**
 * The side of the bridge that lives next to the provider tree.
 *
 * <p>{@link io.providerbridge.remote.RemoteBridgeEndpoint} turns {@code initialize},
 * {@code getMessages} and {@code close} requests into calls on a single owned provider and
 * pushes the provider's extension point callbacks back as {@code extensionPointCallback} events.
 */
package io.providerbridge.remote;
