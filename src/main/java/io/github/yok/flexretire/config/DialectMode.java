package io.github.yok.flexretire.config;

/**
 * Enumerates the SQL dialects the store connectors can speak.
 *
 * <p>
 * Each constant selects the query templates used for bounded selects and deletes, and the quoting
 * style for identifiers.
 * </p>
 *
 * <ul>
 * <li>SQLSERVER: for Microsoft SQL Server ({@code TOP (?)}, bracket quoting)</li>
 * <li>POSTGRESQL: for PostgreSQL ({@code LIMIT ?}, {@code ctid} bounded delete)</li>
 * <li>MYSQL: for MySQL ({@code LIMIT ?}, backtick quoting)</li>
 * <li>ORACLE: for Oracle Database 12c and later ({@code FETCH FIRST}, {@code ROWID} bounded
 * delete)</li>
 * <li>H2: for the H2 database ({@code FETCH FIRST} on select and delete)</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public enum DialectMode {
    // Microsoft SQL Server
    SQLSERVER,
    // PostgreSQL
    POSTGRESQL,
    // MySQL
    MYSQL,
    // Oracle DB
    ORACLE,
    // H2 (embedded / test)
    H2
}
