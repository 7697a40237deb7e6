package io.github.yok.sqlinsert.config;

import io.github.yok.sqlinsert.record.ColumnTag;
import io.github.yok.sqlinsert.token.TokenFormat;
import io.github.yok.sqlinsert.token.TokenType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that binds the {@code sqlinsert} section in {@code application.yml}.
 *
 * <pre>
 * sqlinsert:
 *   token-type: ORDINAL_NUMBER
 *   annotation-key: col
 *   format:
 *     separator: ", "
 *     open: "("
 *     close: ")"
 * </pre>
 *
 * <p>
 * The bound values are turned into an immutable {@link InsertConfig} by {@link #toInsertConfig()}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@ConfigurationProperties(prefix = "sqlinsert")
public class SqlInsertProperties {

    /**
     * Placeholder style used when a call does not name one.
     */
    private TokenType tokenType = TokenType.QUESTION_MARK;

    /**
     * Tag key read from annotated beans.
     */
    private String annotationKey = ColumnTag.DEFAULT_KEY;

    /**
     * Separator and group wrapper.
     */
    private Format format = new Format();

    /**
     * Converts the bound properties into an immutable config.
     *
     * @return insert config
     */
    public InsertConfig toInsertConfig() {
        return InsertConfig.builder().tokenType(tokenType).annotationKey(annotationKey)
                .format(TokenFormat.of(format.getSeparator(), format.getOpen(), format.getClose()))
                .build();
    }

    /**
     * Inner class that holds the token group presentation.
     */
    @Data
    public static class Format {
        // Separator between tokens and between row groups
        private String separator = ", ";
        // Text placed before a group
        private String open = "(";
        // Text placed after a group
        private String close = ")";
    }
}
