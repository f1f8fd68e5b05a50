/**
 * Method-name-addressed asynchronous channel.
 *
 * <p>{@link io.providerbridge.rpc.Rpc} multiplexes request/reply pairs and fire-and-forget events
 * over a single {@link io.providerbridge.rpc.RpcTransport}. Two transports are provided:
 * <ul>
 *   <li>{@link io.providerbridge.rpc.InProcessTransport}: two ends in one JVM, each delivering on
 *       its own thread; payloads and buffers pass by reference</li>
 *   <li>{@link io.providerbridge.rpc.StreamRpcTransport}: length-prefixed JSON frames over a byte
 *       stream, for a child process or a socket peer</li>
 * </ul>
 *
 * <p>Reliability, reconnects and retries are the transport's business, not this package's.
 */
package io.providerbridge.rpc;
