package io.github.yok.sqlinsert.token;

import com.google.common.base.Preconditions;
import io.github.yok.sqlinsert.record.RecordField;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import lombok.Generated;

/**
 * Translates the fields of one record into the tokens of a column or value clause.
 *
 * <p>
 * Tokens are produced in field order and joined with the separator of the given
 * {@link TokenFormat}. Ordinal placeholders are numbered by the index of the field in the given
 * list, not by {@link RecordField#getPosition()}. The result is not wrapped; callers apply
 * {@link TokenFormat#wrap(String)} where a group is needed. An empty field list yields an empty
 * string.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class Tokenizer {

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private Tokenizer() {}

    /**
     * Tokenizes with {@link TokenFormat#SPACED}.
     *
     * @param fields ordered fields of one record
     * @param tokenType rendering style
     * @return joined tokens
     */
    public static String tokenize(List<RecordField> fields, TokenType tokenType) {
        return tokenize(fields, tokenType, TokenFormat.SPACED);
    }

    /**
     * Tokenizes the fields of one record.
     *
     * @param fields ordered fields of one record
     * @param tokenType rendering style
     * @param format separator to join with
     * @return joined tokens, or an empty string when {@code fields} is empty
     */
    public static String tokenize(List<RecordField> fields, TokenType tokenType,
            TokenFormat format) {
        Preconditions.checkNotNull(fields, "fields must not be null");
        Preconditions.checkNotNull(tokenType, "tokenType must not be null");
        Preconditions.checkNotNull(format, "format must not be null");
        return IntStream.range(0, fields.size())
                .mapToObj(i -> tokenType.render(fields.get(i), i + 1))
                .collect(Collectors.joining(format.getSeparator()));
    }
}
