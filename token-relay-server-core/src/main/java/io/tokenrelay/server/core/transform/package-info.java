/**
 * Payload transforms applied at flush time: compression, then authenticated encryption.
 */
package io.tokenrelay.server.core.transform;
