package io.github.yok.sqlinsert.record;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Container for repeated {@link ColumnTag} annotations.
 *
 * @author Yasuharu.Okawauchi
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface ColumnTags {

    /**
     * Repeated tags.
     *
     * @return tags
     */
    ColumnTag[] value();
}
