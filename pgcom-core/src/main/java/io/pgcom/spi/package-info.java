/**
 * Service provider interfaces implemented by driver and pool modules.
 *
 * <ul>
 *   <li>{@link io.pgcom.spi.ConnectionPool} / {@link io.pgcom.spi.ConnectionPoolFactory} -
 *       the pooling primitive the connector wraps</li>
 *   <li>{@link io.pgcom.spi.NotificationSource} - blocking wait for LISTEN/NOTIFY payloads</li>
 *   <li>{@link io.pgcom.spi.MetricsExporter} - counters for restarts, failures and notifications</li>
 * </ul>
 */
package io.pgcom.spi;
