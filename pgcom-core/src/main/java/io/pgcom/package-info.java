/**
 * Core API: connection settings, the {@link io.pgcom.Connector} abstraction with its scoped
 * connections, and the {@link io.pgcom.CommandExecutor} that runs every command in its own
 * transaction.
 *
 * <p>This module has no third-party dependencies. The HikariCP pool and the pgJDBC
 * notification source live in {@code pgcom-jdbc}.
 */
package io.pgcom;
