package io.github.yok.sqlinsert.util;

import java.util.List;
import lombok.Generated;
import org.apache.commons.lang3.StringUtils;

/**
 * Utility for rendering bind arguments in logs.
 *
 * <p>
 * Long text is abbreviated and binary values are reported by length so that debug logs stay
 * readable when a batch carries large payloads.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class BindArgLogUtil {

    /**
     * Maximum rendered length of one text value.
     */
    public static final int MAX_VALUE_LENGTH = 64;

    /**
     * Maximum number of arguments rendered before the rest is summarized.
     */
    public static final int MAX_ARGS = 50;

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private BindArgLogUtil() {}

    /**
     * Renders one argument.
     *
     * @param value bind value
     * @return log text
     */
    public static String renderValue(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof byte[]) {
            return "<" + ((byte[]) value).length + " bytes>";
        }
        if (value instanceof CharSequence) {
            return "'" + StringUtils.abbreviate(value.toString(), MAX_VALUE_LENGTH) + "'";
        }
        return StringUtils.abbreviate(String.valueOf(value), MAX_VALUE_LENGTH);
    }

    /**
     * Renders an argument list.
     *
     * @param args bind arguments
     * @return log text such as {@code ['x', 1.5]}
     */
    public static String renderArgs(List<?> args) {
        if (args == null) {
            return "<null>";
        }
        StringBuilder builder = new StringBuilder("[");
        int shown = Math.min(args.size(), MAX_ARGS);
        for (int i = 0; i < shown; i++) {
            if (i > 0) {
                builder.append(", ");
            }
            builder.append(renderValue(args.get(i)));
        }
        if (args.size() > shown) {
            builder.append(", ... (").append(args.size() - shown).append(" more)");
        }
        return builder.append("]").toString();
    }
}
