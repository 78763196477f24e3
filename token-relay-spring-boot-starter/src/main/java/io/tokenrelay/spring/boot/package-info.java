/**
 * Spring Boot auto-configuration for the token relay.
 */
package io.tokenrelay.spring.boot;
