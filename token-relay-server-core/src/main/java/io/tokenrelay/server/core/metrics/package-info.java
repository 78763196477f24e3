/**
 * Per-connection and aggregate relay metrics.
 */
package io.tokenrelay.server.core.metrics;
