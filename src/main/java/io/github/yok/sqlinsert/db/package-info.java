/**
 * Executor contract and JDBC adapters.
 *
 * <p>
 * {@link io.github.yok.sqlinsert.db.InsertExecutor} and
 * {@link io.github.yok.sqlinsert.db.PreparedHandle} are the only surface the statement builder
 * depends on. Adapters for a plain {@link java.sql.Connection} and for a Spring-managed
 * {@link javax.sql.DataSource} are provided.
 * </p>
 */
package io.github.yok.sqlinsert.db;
