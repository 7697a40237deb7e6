/**
 * SQLInsert: parameterized {@code INSERT} statements and bind arguments from row records.
 *
 * <p>
 * Rows are described by {@link io.github.yok.sqlinsert.record.InsertRecord}s (or annotated beans),
 * rendered by {@link io.github.yok.sqlinsert.core.InsertStatement} into a column clause, a
 * placeholder clause and a flat argument list, and optionally executed through an
 * {@link io.github.yok.sqlinsert.db.InsertExecutor}.
 * </p>
 */
package io.github.yok.sqlinsert;
