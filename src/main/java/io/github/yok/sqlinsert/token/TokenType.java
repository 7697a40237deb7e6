package io.github.yok.sqlinsert.token;

import io.github.yok.sqlinsert.record.RecordField;

/**
 * Rendering styles for the tokens of an {@code INSERT} statement.
 *
 * <p>
 * {@link #COLUMN_NAME} renders the column clause; the other constants render value placeholders.
 * </p>
 *
 * <ul>
 * <li>COLUMN_NAME: {@code INSERT INTO tbl (foo, bar, baz)}</li>
 * <li>QUESTION_MARK: {@code VALUES (?, ?, ?)}, MySQL and SingleStore</li>
 * <li>AT_COLUMN_NAME: {@code VALUES (@foo, @bar, @baz)}, MySQL, SingleStore and SQL Server</li>
 * <li>ORDINAL_NUMBER: {@code VALUES ($1, $2, $3)}, PostgreSQL</li>
 * <li>COLON: {@code VALUES (:foo, :bar, :baz)}, Oracle</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public enum TokenType {

    // Column name of the field
    COLUMN_NAME {
        @Override
        public String render(RecordField field, int ordinal) {
            return field.getName();
        }
    },

    // Literal question mark
    QUESTION_MARK {
        @Override
        public String render(RecordField field, int ordinal) {
            return "?";
        }
    },

    // @ followed by the column name
    AT_COLUMN_NAME {
        @Override
        public String render(RecordField field, int ordinal) {
            return "@" + field.getName();
        }
    },

    // $ followed by the 1-based index of the field in the rendered list
    ORDINAL_NUMBER {
        @Override
        public String render(RecordField field, int ordinal) {
            return "$" + ordinal;
        }
    },

    // : followed by the column name
    COLON {
        @Override
        public String render(RecordField field, int ordinal) {
            return ":" + field.getName();
        }
    };

    /**
     * Renders the token of one field.
     *
     * @param field field to render
     * @param ordinal 1-based index of the field in the list being rendered
     * @return token text
     */
    public abstract String render(RecordField field, int ordinal);
}
