package io.github.yok.sqlinsert.config;

import io.github.yok.sqlinsert.record.ColumnTag;
import io.github.yok.sqlinsert.token.TokenFormat;
import io.github.yok.sqlinsert.token.TokenType;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * Immutable settings applied when an {@code INSERT} statement is built.
 *
 * <p>
 * A config is passed explicitly to every statement; nothing reads shared mutable state while a
 * statement renders. Callers that need a different placeholder style for one call either pass a
 * {@link TokenType} to that call or derive a config with {@link #toBuilder()}.
 * </p>
 *
 * <ul>
 * <li>{@code tokenType}: placeholder style used when a call does not name one (default
 * {@link TokenType#QUESTION_MARK})</li>
 * <li>{@code annotationKey}: {@link ColumnTag#key()} read from annotated beans (default
 * {@code col})</li>
 * <li>{@code format}: separator and group wrapper (default {@link TokenFormat#SPACED})</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
@Builder(toBuilder = true)
public final class InsertConfig {

    private static final InsertConfig DEFAULTS = InsertConfig.builder().build();

    /**
     * Placeholder style used when a call does not name one.
     */
    @NonNull
    @Builder.Default
    private final TokenType tokenType = TokenType.QUESTION_MARK;

    /**
     * Tag key read from annotated beans.
     */
    @NonNull
    @Builder.Default
    private final String annotationKey = ColumnTag.DEFAULT_KEY;

    /**
     * Separator and group wrapper.
     */
    @NonNull
    @Builder.Default
    private final TokenFormat format = TokenFormat.SPACED;

    /**
     * Returns the default settings.
     *
     * @return shared default config
     */
    public static InsertConfig defaults() {
        return DEFAULTS;
    }
}
