package io.github.yok.sqlinsert.record;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.lang.reflect.Field;
import java.lang.reflect.InaccessibleObjectException;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.Generated;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Field metadata source that turns beans annotated with {@link ColumnTag} into
 * {@link InsertRecord}s.
 *
 * <p>
 * The declared instance fields of a bean class are read in declaration order. The column name of a
 * field is taken from the {@link ColumnTag} whose key matches the requested annotation key; a field
 * without such a tag gets an empty name and is still rendered and bound.
 * </p>
 *
 * <p>
 * The field shape (names, positions and reflective accessors) is derived once per bean class and
 * annotation key and cached. Values are read each time a bean is converted, and the resulting
 * record is a snapshot: later changes to the bean are not visible through it.
 * </p>
 *
 * <p>
 * Shapes are attached to their bean class through a {@link ClassValue}, so the cache holds no
 * strong reference to the class and does not keep a redeployed class loader alive.
 * </p>
 *
 * <p>
 * Single beans, arrays of beans and {@link Iterable}s of beans are accepted by
 * {@link #listOf(Object, String)} and produce identical records for identical data.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class AnnotatedRecords {

    // bean class -> annotation key -> shape
    private static final ClassValue<Map<String, List<ShapeField>>> SHAPES = new ClassValue<>() {
        @Override
        protected Map<String, List<ShapeField>> computeValue(Class<?> type) {
            return new ConcurrentHashMap<>();
        }
    };

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private AnnotatedRecords() {}

    /**
     * Converts one bean using the default {@code col} key.
     *
     * @param bean annotated bean
     * @return record snapshot of {@code bean}
     */
    public static InsertRecord of(Object bean) {
        return of(bean, ColumnTag.DEFAULT_KEY);
    }

    /**
     * Converts one bean.
     *
     * @param bean annotated bean
     * @param annotationKey {@link ColumnTag#key()} to read column names from
     * @return record snapshot of {@code bean}
     * @throws IllegalArgumentException if {@code bean} is a batch or not a bean
     * @throws IllegalStateException if a field cannot be read
     */
    public static InsertRecord of(Object bean, String annotationKey) {
        Preconditions.checkNotNull(bean, "bean must not be null");
        Preconditions.checkNotNull(annotationKey, "annotationKey must not be null");
        Preconditions.checkArgument(!isBatch(bean),
                "Expected a single bean but got a batch: %s", bean.getClass().getName());
        List<RecordField> fields = read(shapeOf(bean.getClass(), annotationKey), bean);
        return () -> fields;
    }

    /**
     * Converts a bean, an array of beans or an {@link Iterable} of beans.
     *
     * @param data bean or batch of beans
     * @param annotationKey {@link ColumnTag#key()} to read column names from
     * @return records in input order; a single bean yields a one-element list
     * @throws IllegalArgumentException if an element is not a bean
     */
    public static List<InsertRecord> listOf(Object data, String annotationKey) {
        Preconditions.checkNotNull(data, "data must not be null");
        if (data instanceof InsertRecord) {
            return ImmutableList.of((InsertRecord) data);
        }
        if (!isBatch(data)) {
            return ImmutableList.of(of(data, annotationKey));
        }
        List<Object> elements = new ArrayList<>();
        if (data instanceof Object[]) {
            for (Object element : (Object[]) data) {
                elements.add(element);
            }
        } else {
            for (Object element : (Iterable<?>) data) {
                elements.add(element);
            }
        }
        ImmutableList.Builder<InsertRecord> records = ImmutableList.builder();
        for (Object element : elements) {
            Preconditions.checkNotNull(element, "batch must not contain null elements");
            if (element instanceof InsertRecord) {
                records.add((InsertRecord) element);
            } else {
                records.add(of(element, annotationKey));
            }
        }
        return records.build();
    }

    /**
     * Returns the column name a field renders with for the given key.
     *
     * @param field bean field
     * @param annotationKey tag key
     * @return tag value, or an empty string when the field has no tag for the key
     */
    static String columnName(Field field, String annotationKey) {
        for (ColumnTag tag : field.getAnnotationsByType(ColumnTag.class)) {
            if (annotationKey.equals(tag.key())) {
                return tag.value();
            }
        }
        return "";
    }

    /**
     * Drops the cached shapes of a bean class.
     *
     * @param type bean class
     */
    static void clearCache(Class<?> type) {
        SHAPES.remove(type);
    }

    /**
     * Returns the number of cached shapes for a bean class.
     *
     * @param type bean class
     * @return cached shape count
     */
    static int cachedShapeCount(Class<?> type) {
        return SHAPES.get(type).size();
    }

    private static boolean isBatch(Object data) {
        return data instanceof Object[] || data instanceof Iterable;
    }

    private static List<ShapeField> shapeOf(Class<?> type, String annotationKey) {
        return SHAPES.get(type).computeIfAbsent(annotationKey, key -> deriveShape(type, key));
    }

    private static List<ShapeField> deriveShape(Class<?> type, String annotationKey) {
        Preconditions.checkArgument(!type.isPrimitive() && !type.isArray() && !type.isEnum()
                && !type.getName().startsWith("java."), "Not a record bean: %s", type.getName());
        ImmutableList.Builder<ShapeField> shape = ImmutableList.builder();
        int position = 1;
        for (Field field : type.getDeclaredFields()) {
            if (Modifier.isStatic(field.getModifiers()) || field.isSynthetic()) {
                continue;
            }
            try {
                field.setAccessible(true);
            } catch (InaccessibleObjectException | SecurityException e) {
                throw new IllegalStateException(
                        "Cannot access field " + type.getName() + "." + field.getName(), e);
            }
            shape.add(new ShapeField(columnName(field, annotationKey), position++, field));
        }
        List<ShapeField> derived = shape.build();
        log.debug("Derived record shape. type={}, key={}, fields={}", type.getName(),
                annotationKey, derived.size());
        return derived;
    }

    private static List<RecordField> read(List<ShapeField> shape, Object bean) {
        ImmutableList.Builder<RecordField> fields = ImmutableList.builder();
        for (ShapeField shapeField : shape) {
            try {
                fields.add(new RecordField(shapeField.name, shapeField.position,
                        shapeField.field.get(bean)));
            } catch (IllegalAccessException e) {
                throw new IllegalStateException("Cannot read field "
                        + bean.getClass().getName() + "." + shapeField.field.getName(), e);
            }
        }
        return fields.build();
    }

    /**
     * One cached field of a bean shape.
     */
    @RequiredArgsConstructor
    private static final class ShapeField {
        // Column name resolved from the tag (may be empty)
        private final String name;
        // 1-based position
        private final int position;
        // Reflective accessor
        private final Field field;
    }
}
