package io.github.yok.sqlinsert.record;

import com.google.common.base.Preconditions;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Immutable descriptor of one field of a row record.
 *
 * <p>
 * A field carries the column name used in the column clause and in named placeholders, its
 * 1-based position inside the record, and the value that is bound to the statement. The value is
 * opaque: it is moved from the record to the argument list without being inspected and may be
 * {@code null}.
 * </p>
 *
 * <p>
 * Statements are rendered and bound in list order. The position is informational and is not used
 * to number ordinal placeholders.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RecordField {

    // Column name (may be empty when the metadata source provides no name)
    private final String name;

    // 1-based ordinal position inside the record
    private final int position;

    // Bind value, passed through unexamined
    private final Object value;

    /**
     * Creates a field descriptor.
     *
     * @param name column name; an empty string is allowed
     * @param position 1-based ordinal position
     * @param value bind value, may be {@code null}
     * @throws NullPointerException if {@code name} is {@code null}
     * @throws IllegalArgumentException if {@code position} is less than 1
     */
    public RecordField(String name, int position, Object value) {
        Preconditions.checkNotNull(name, "name must not be null");
        Preconditions.checkArgument(position >= 1, "position must be 1-based: %s", position);
        this.name = name;
        this.position = position;
        this.value = value;
    }
}
