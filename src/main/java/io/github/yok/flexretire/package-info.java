/**
 * Metadata-driven archive and purge engine: CLI entry point.
 */
package io.github.yok.flexretire;
