/**
 * Utilities: identifier validation, fatal error reporting, log masking and foreign key metadata.
 */
package io.github.yok.flexretire.util;
