/**
 * Spring Boot auto-configuration for pgcom, bound to the {@code pgcom.*} properties.
 */
package io.pgcom.spring.boot;
