/**
 * Server core for the token relay.
 *
 * <p>{@link io.tokenrelay.server.core.TokenRelay} wires the connection registry, the buffer
 * manager, the transform pipeline, the stream orchestrator and the lifecycle timers around a
 * {@link io.tokenrelay.server.spi.RelayStore} and a
 * {@link io.tokenrelay.server.spi.FragmentProducer}. Transport adapters (servlet, Spring) only
 * create connections, start streams and drain {@link io.tokenrelay.server.core.EventChannel}s.
 */
package io.tokenrelay.server.core;
