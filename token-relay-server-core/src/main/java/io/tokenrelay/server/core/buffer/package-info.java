/**
 * Per-connection chunk buffers with threshold, capacity and idle flushing.
 */
package io.tokenrelay.server.core.buffer;
