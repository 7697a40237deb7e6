package io.github.yok.sqlinsert.record;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Assigns a column name to a bean field for {@link AnnotatedRecords}.
 *
 * <p>
 * The tag is keyed: {@link AnnotatedRecords} only reads the tag whose {@link #key()} equals its
 * configured annotation key ({@code col} by default). A field can carry several tags to serve
 * different keys.
 * </p>
 *
 * <pre>
 * public class Candy {
 *     &#64;ColumnTag("id")
 *     private String id;
 *
 *     &#64;ColumnTag("candy_name")
 *     &#64;ColumnTag(key = "legacy", value = "NAME")
 *     private String name;
 * }
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Repeatable(ColumnTags.class)
public @interface ColumnTag {

    /**
     * Default annotation key.
     */
    String DEFAULT_KEY = "col";

    /**
     * Column name.
     *
     * @return column name
     */
    String value();

    /**
     * Key this tag belongs to.
     *
     * @return tag key
     */
    String key() default DEFAULT_KEY;
}
