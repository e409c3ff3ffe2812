/**
 * PostgreSQL bindings: the HikariCP connection pool, the pgJDBC notification source and the
 * {@link io.pgcom.jdbc.Commuter} helpers built on {@link io.pgcom.CommandExecutor}.
 */
package io.pgcom.jdbc;
