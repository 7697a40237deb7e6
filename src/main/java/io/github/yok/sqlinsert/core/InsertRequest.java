package io.github.yok.sqlinsert.core;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.github.yok.sqlinsert.record.AnnotatedRecords;
import io.github.yok.sqlinsert.record.InsertRecord;
import java.util.Arrays;
import java.util.List;
import lombok.Getter;
import lombok.ToString;

/**
 * Table name and the records to insert into it.
 *
 * <p>
 * A request holds one or more records in insertion order. The table name is used verbatim: it is
 * neither quoted nor escaped, so callers must pass a safe identifier.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public final class InsertRequest {

    // Target table, used verbatim
    private final String table;

    // Records in insertion order, never empty
    private final List<InsertRecord> records;

    private InsertRequest(String table, List<? extends InsertRecord> records) {
        Preconditions.checkNotNull(table, "table must not be null");
        Preconditions.checkNotNull(records, "records must not be null");
        Preconditions.checkArgument(!records.isEmpty(),
                "At least one record is required for table %s", table);
        this.table = table;
        this.records = ImmutableList.copyOf(records);
    }

    /**
     * Creates a request for one or more records.
     *
     * @param table target table
     * @param records records in insertion order
     * @return request
     * @throws IllegalArgumentException if no record is given
     */
    public static InsertRequest of(String table, InsertRecord... records) {
        Preconditions.checkNotNull(records, "records must not be null");
        return new InsertRequest(table, Arrays.asList(records));
    }

    /**
     * Creates a request for a batch of records.
     *
     * @param table target table
     * @param records records in insertion order
     * @return request
     * @throws IllegalArgumentException if {@code records} is empty
     */
    public static InsertRequest of(String table, List<? extends InsertRecord> records) {
        return new InsertRequest(table, records);
    }

    /**
     * Creates a request from annotated beans.
     *
     * @param table target table
     * @param data a bean, an array of beans or an {@link Iterable} of beans
     * @param annotationKey tag key to read column names from
     * @return request
     * @throws IllegalArgumentException if {@code data} is empty or not a bean
     * @see AnnotatedRecords
     */
    public static InsertRequest ofBeans(String table, Object data, String annotationKey) {
        return new InsertRequest(table, AnnotatedRecords.listOf(data, annotationKey));
    }

    /**
     * Returns the number of records.
     *
     * @return record count, at least 1
     */
    public int size() {
        return records.size();
    }

    /**
     * Returns the first record, whose shape defines the statement.
     *
     * @return first record
     */
    public InsertRecord first() {
        return records.get(0);
    }
}
