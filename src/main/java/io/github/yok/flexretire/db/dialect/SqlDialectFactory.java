package io.github.yok.flexretire.db.dialect;

import io.github.yok.flexretire.config.DialectMode;
import io.github.yok.flexretire.config.StoreConfig;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Factory that selects the {@link SqlDialect} for a store entry.
 *
 * <p>
 * Resolution priority is the explicit {@code dialect} setting, then {@code driver-class}, then
 * the JDBC URL.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class SqlDialectFactory {

    /**
     * Creates the dialect for a store entry.
     *
     * @param entry store entry
     * @return dialect
     * @throws IllegalArgumentException if the database type cannot be determined
     */
    public SqlDialect create(StoreConfig.Entry entry) {
        DialectMode mode = resolveMode(entry);
        log.debug("[{}] Dialect resolved -> {}", entry.getId(), mode);
        return create(mode);
    }

    /**
     * Creates the dialect for a mode.
     *
     * @param mode dialect mode
     * @return dialect
     */
    public SqlDialect create(DialectMode mode) {
        switch (mode) {
            case SQLSERVER:
                return new SqlServerDialect();
            case POSTGRESQL:
                return new PostgresqlDialect();
            case MYSQL:
                return new MySqlDialect();
            case ORACLE:
                return new OracleDialect();
            case H2:
                return new H2Dialect();
            default:
                throw new IllegalArgumentException("Unsupported dialect: " + mode);
        }
    }

    /**
     * Resolves the database type for a store entry.
     *
     * @param entry store entry
     * @return resolved database type
     * @throws IllegalArgumentException if the database type cannot be determined
     */
    DialectMode resolveMode(StoreConfig.Entry entry) {
        if (entry.getDialect() != null) {
            return entry.getDialect();
        }
        DialectMode fromDriverClass = resolveModeFromDriverClass(entry.getDriverClass());
        if (fromDriverClass != null) {
            return fromDriverClass;
        }
        DialectMode fromUrl = resolveModeFromJdbcUrl(entry.getUrl());
        if (fromUrl != null) {
            return fromUrl;
        }
        throw new IllegalArgumentException("Unsupported database dialect for store id="
                + entry.getId() + " (driver-class=" + entry.getDriverClass() + ")");
    }

    private DialectMode resolveModeFromDriverClass(String driverClass) {
        String normalized = normalizeLower(driverClass);
        if (normalized == null) {
            return null;
        }
        switch (normalized) {
            case "com.microsoft.sqlserver.jdbc.sqlserverdriver":
                return DialectMode.SQLSERVER;
            case "org.postgresql.driver":
                return DialectMode.POSTGRESQL;
            case "com.mysql.cj.jdbc.driver":
            case "com.mysql.jdbc.driver":
                return DialectMode.MYSQL;
            case "oracle.jdbc.oracledriver":
                return DialectMode.ORACLE;
            case "org.h2.driver":
                return DialectMode.H2;
            default:
                return null;
        }
    }

    private DialectMode resolveModeFromJdbcUrl(String jdbcUrl) {
        String normalized = normalizeLower(jdbcUrl);
        if (normalized == null) {
            return null;
        }
        if (normalized.startsWith("jdbc:sqlserver:")) {
            return DialectMode.SQLSERVER;
        }
        if (normalized.startsWith("jdbc:postgresql:")) {
            return DialectMode.POSTGRESQL;
        }
        if (normalized.startsWith("jdbc:mysql:")) {
            return DialectMode.MYSQL;
        }
        if (normalized.startsWith("jdbc:oracle:")) {
            return DialectMode.ORACLE;
        }
        if (normalized.startsWith("jdbc:h2:")) {
            return DialectMode.H2;
        }
        return null;
    }

    private String normalizeLower(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
