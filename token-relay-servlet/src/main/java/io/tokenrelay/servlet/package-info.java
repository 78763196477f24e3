/**
 * Jakarta Servlet transport: accepts a stream request and relays its events as
 * {@code text/event-stream}.
 */
package io.tokenrelay.servlet;
