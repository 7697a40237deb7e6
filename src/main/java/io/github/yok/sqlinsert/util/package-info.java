/**
 * Utility package for SQLInsert.
 */
package io.github.yok.sqlinsert.util;
