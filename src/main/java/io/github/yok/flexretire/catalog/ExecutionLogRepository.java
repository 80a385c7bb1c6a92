package io.github.yok.flexretire.catalog;

import io.github.yok.flexretire.config.RetireConfig;
import io.github.yok.flexretire.util.IdentifierValidator;
import java.sql.Timestamp;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * JDBC repository for the execution log table (default {@code dbo.ProcessingLog}).
 *
 * <p>
 * Append-only. The engine reads only {@code MAX(BatchNumber)} to derive the next run number; the
 * rows themselves are for external reporting. Write failures are fatal and propagate.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ExecutionLogRepository {

    private final JdbcTemplate jdbc;

    private final String maxRunSql;

    private final String insertSql;

    /**
     * Creates a repository over the configured log table.
     *
     * @param jdbc template bound to the metadata store
     * @param config engine settings holding the log table name
     * @throws IllegalArgumentException if the configured schema or table name is invalid
     */
    public ExecutionLogRepository(JdbcTemplate jdbc, RetireConfig config) {
        this.jdbc = jdbc;
        String table = IdentifierValidator.validate(config.getMetadataSchema(), "metadata schema")
                + "." + IdentifierValidator.validate(config.getLogTable(), "log table");
        this.maxRunSql = "SELECT COALESCE(MAX(BatchNumber), 0) FROM " + table;
        this.insertSql = "INSERT INTO " + table
                + " (BatchNumber, ConfigID, ActionType, TableName, RowsAffected, IsTestRun,"
                + " LogDate, DurationMs, ErrorMessage) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";
    }

    /**
     * Derives the run number for a new run: one more than the highest recorded, or 1 for an empty
     * log.
     *
     * @return next run number
     */
    public int nextRunNumber() {
        Integer max = jdbc.queryForObject(maxRunSql, Integer.class);
        return (max == null ? 0 : max) + 1;
    }

    /**
     * Appends one entry.
     *
     * @param entry entry to write
     */
    public void append(ExecutionLogEntry entry) {
        jdbc.update(insertSql, entry.getRunNumber(), entry.getJobId(), entry.getActionLabel(),
                entry.getTableName(), entry.getRowsAffected(), entry.isDryRun(),
                Timestamp.valueOf(entry.getStartedAt()), entry.getDurationMs(),
                entry.getErrorMessage());
        log.debug("[run={}] Logged job={} label={} rows={}", entry.getRunNumber(),
                entry.getJobId(), entry.getActionLabel(), entry.getRowsAffected());
    }
}
