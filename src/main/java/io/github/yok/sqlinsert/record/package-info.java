/**
 * Row record model.
 *
 * <p>
 * Defines {@link io.github.yok.sqlinsert.record.RecordField} descriptors, the
 * {@link io.github.yok.sqlinsert.record.InsertRecord} capability implemented by row types, and the
 * {@link io.github.yok.sqlinsert.record.ColumnTag}-based adapter for plain beans.
 * </p>
 */
package io.github.yok.sqlinsert.record;
