/**
 * Protocol-centric core for the provider bridge.
 *
 * <p>This module is deliberately transport-neutral. It contains only:
 * <ul>
 *   <li>Protocol constants (method names, callback kinds)</li>
 *   <li>The message model exchanged between the caller and the remote endpoint</li>
 *   <li>The {@link io.providerbridge.core.ProviderBridgeException} taxonomy</li>
 * </ul>
 *
 * <p>Channel bindings live in {@code provider-bridge-rpc}; the endpoint itself lives in
 * {@code provider-bridge-remote}.
 */
package io.providerbridge.core;
