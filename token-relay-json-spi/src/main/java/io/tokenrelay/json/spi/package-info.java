/**
 * Library-neutral JSON SPI used by the relay for event and record serialization.
 */
package io.tokenrelay.json.spi;
