/**
 * Open connections, their lifecycle state and admission control.
 */
package io.tokenrelay.server.core.registry;
