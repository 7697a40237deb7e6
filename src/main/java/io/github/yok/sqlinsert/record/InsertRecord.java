package io.github.yok.sqlinsert.record;

import java.util.List;

/**
 * Capability of a row type to expose its fields for an {@code INSERT} statement.
 *
 * <p>
 * Implementations return the fields in column order. Every record of one batch must return the
 * same number of fields with the same names in the same order; statement builders read the shape
 * of the first record only and do not verify the others.
 * </p>
 *
 * <pre>
 * public class Candy implements InsertRecord {
 *     &#64;Override
 *     public List&lt;RecordField&gt; fields() {
 *         return RecordFields.builder().add("id", id).add("candy_name", name).build();
 *     }
 * }
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 * @see RecordFields
 * @see AnnotatedRecords
 */
@FunctionalInterface
public interface InsertRecord {

    /**
     * Returns the ordered fields of this record.
     *
     * @return fields in column order, never {@code null}
     */
    List<RecordField> fields();
}
