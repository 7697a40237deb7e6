/**
 * Configuration package for SQLInsert.
 *
 * <p>
 * Holds the immutable {@link io.github.yok.sqlinsert.config.InsertConfig}, the
 * {@code application.yml} binding and the Spring Boot auto-configuration.
 * </p>
 */
package io.github.yok.sqlinsert.config;
