/**
 * Provider-side SPI: the capability the bridge drives and the seams through which a host
 * supplies provider implementations.
 */
package io.providerbridge.provider.spi;
