/**
 * Caller side of the bridge: a {@link io.providerbridge.provider.spi.DataProvider} backed by a
 * remote endpoint.
 */
package io.providerbridge.client;
