/**
 * Statement building package.
 *
 * <p>
 * Turns an {@link io.github.yok.sqlinsert.core.InsertRequest} into SQL text and bind arguments and
 * drives the prepare/execute cycle. Database access itself is delegated to executors in
 * {@code db}.
 * </p>
 */
package io.github.yok.sqlinsert.core;
