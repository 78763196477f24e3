/**
 * Protocol-centric core for the token relay.
 *
 * <p>This module is deliberately framework-neutral. It contains only:
 * <ul>
 *   <li>Protocol constants and small models (events, fragments, statuses)</li>
 *   <li>The {@link io.tokenrelay.core.RelayException} taxonomy</li>
 *   <li>A minimal parser for the relay's SSE wire format</li>
 * </ul>
 *
 * <p>Server-side buffering, transforms and lifecycle management live in other modules.
 */
package io.tokenrelay.core;
