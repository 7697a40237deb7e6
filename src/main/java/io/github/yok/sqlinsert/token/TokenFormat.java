package io.github.yok.sqlinsert.token;

import com.google.common.base.Preconditions;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Presentation of a token group: the separator between tokens and the wrapper around a group.
 *
 * <p>
 * The same separator joins the groups of a multi-row {@code VALUES} list.
 * </p>
 *
 * <ul>
 * <li>{@link #SPACED}: {@code (id, name), (id, name)}</li>
 * <li>{@link #COMPACT}: {@code (id,name),(id,name)}</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
public final class TokenFormat {

    /**
     * Comma plus space, wrapped in parentheses.
     */
    public static final TokenFormat SPACED = new TokenFormat(", ", "(", ")");

    /**
     * Bare comma, wrapped in parentheses.
     */
    public static final TokenFormat COMPACT = new TokenFormat(",", "(", ")");

    // Separator between tokens and between groups
    private final String separator;

    // Text placed before a group
    private final String open;

    // Text placed after a group
    private final String close;

    private TokenFormat(String separator, String open, String close) {
        this.separator = separator;
        this.open = open;
        this.close = close;
    }

    /**
     * Creates a custom format.
     *
     * @param separator token and group separator
     * @param open text placed before a group
     * @param close text placed after a group
     * @return format
     */
    public static TokenFormat of(String separator, String open, String close) {
        Preconditions.checkNotNull(separator, "separator must not be null");
        Preconditions.checkNotNull(open, "open must not be null");
        Preconditions.checkNotNull(close, "close must not be null");
        return new TokenFormat(separator, open, close);
    }

    /**
     * Wraps a joined token sequence into a group.
     *
     * @param tokens joined tokens
     * @return wrapped group
     */
    public String wrap(String tokens) {
        return open + tokens + close;
    }
}
