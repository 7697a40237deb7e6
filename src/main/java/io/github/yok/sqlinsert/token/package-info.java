/**
 * Tokenizer package: renders the fields of one record into column names or placeholders.
 */
package io.github.yok.sqlinsert.token;
