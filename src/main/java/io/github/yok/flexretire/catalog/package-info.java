/**
 * Job catalog and execution log.
 *
 * <p>
 * The catalog ({@code ArchiveConfig}) is the configuration surface administrators edit; the log
 * ({@code ProcessingLog}) is the observability surface monitoring reads. Both live in the
 * operational store and are accessed through Spring's {@code JdbcTemplate}.
 * </p>
 */
package io.github.yok.flexretire.catalog;
