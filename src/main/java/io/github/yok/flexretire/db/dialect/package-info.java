/**
 * Per-product SQL templates for the bounded retire statements.
 */
package io.github.yok.flexretire.db.dialect;
