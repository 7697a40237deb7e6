package io.github.yok.sqlinsert.record;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Builder of ordered {@link RecordField} lists.
 *
 * <p>
 * Positions are assigned in the order fields are added, starting at 1.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class RecordFields {

    private final ImmutableList.Builder<RecordField> fields = ImmutableList.builder();

    private int nextPosition = 1;

    private RecordFields() {}

    /**
     * Starts a new field list.
     *
     * @return empty builder
     */
    public static RecordFields builder() {
        return new RecordFields();
    }

    /**
     * Appends a field.
     *
     * @param name column name
     * @param value bind value, may be {@code null}
     * @return this builder
     */
    public RecordFields add(String name, Object value) {
        fields.add(new RecordField(name, nextPosition++, value));
        return this;
    }

    /**
     * Returns the fields added so far.
     *
     * @return immutable list of fields
     */
    public List<RecordField> build() {
        return fields.build();
    }

    /**
     * Wraps a pre-built field list as a record.
     *
     * @param fields ordered fields
     * @return record returning {@code fields}
     */
    public static InsertRecord asRecord(List<RecordField> fields) {
        List<RecordField> copy = ImmutableList.copyOf(fields);
        return () -> copy;
    }
}
