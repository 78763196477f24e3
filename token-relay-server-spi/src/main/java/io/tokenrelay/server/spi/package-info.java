/**
 * Server-side SPI for the token relay.
 *
 * <p>The relay treats the upstream generation service, the durable store and the metrics
 * cache as collaborators. This package holds their interfaces and the immutable records
 * exchanged with them. The SPI is blocking and minimal; the server core runs these calls on
 * its own executors.
 */
package io.tokenrelay.server.spi;
