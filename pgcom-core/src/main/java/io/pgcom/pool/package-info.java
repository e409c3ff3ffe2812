/**
 * Pooled {@link io.pgcom.Connector} with liveness checking and backoff-driven pool rebuilds.
 */
package io.pgcom.pool;
