/**
 * Child-process host for the remote bridge endpoint.
 */
package io.providerbridge.host;
