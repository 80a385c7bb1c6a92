package io.github.yok.flexretire.catalog;

import io.github.yok.flexretire.config.RetireConfig;
import io.github.yok.flexretire.util.IdentifierValidator;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

/**
 * JDBC repository for the job catalog table (default {@code dbo.ArchiveConfig}).
 *
 * <p>
 * Read-only. Any {@link org.springframework.dao.DataAccessException} raised here means the catalog
 * is unreadable, which is fatal for the run, so it is propagated unchanged.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class JobCatalogRepository {

    private static final RowMapper<JobDefinition> ROW_MAPPER = (rs, n) -> JobDefinition.builder()
            .id(rs.getLong("ConfigID"))
            .sourceSchema(rs.getString("SourceSchema"))
            .sourceTable(rs.getString("SourceTable"))
            .dateColumn(rs.getString("DateColumn"))
            .targetStore(rs.getString("TargetLinkedServer"))
            .targetDatabase(rs.getString("TargetDatabase"))
            .targetSchema(rs.getString("TargetSchema"))
            .targetTable(rs.getString("TargetTable"))
            .retentionDays(rs.getObject("RetentionDays", Integer.class))
            .batchSize(rs.getObject("BatchSize", Integer.class))
            .actionCode(rs.getString("ActionType"))
            .dryRun(rs.getBoolean("TestMode"))
            .processingOrder(rs.getInt("ProcessingOrder"))
            .enabled(rs.getBoolean("IsEnabled"))
            .notes(rs.getString("Notes"))
            .build();

    private final JdbcTemplate jdbc;

    private final String selectEnabledSql;

    /**
     * Creates a repository over the configured catalog table.
     *
     * @param jdbc template bound to the metadata store
     * @param config engine settings holding the catalog table name
     * @throws IllegalArgumentException if the configured schema or table name is invalid
     */
    public JobCatalogRepository(JdbcTemplate jdbc, RetireConfig config) {
        this.jdbc = jdbc;
        String table = IdentifierValidator.validate(config.getMetadataSchema(), "metadata schema")
                + "." + IdentifierValidator.validate(config.getCatalogTable(), "catalog table");
        this.selectEnabledSql = "SELECT ConfigID, SourceSchema, SourceTable, DateColumn,"
                + " TargetLinkedServer, TargetDatabase, TargetSchema, TargetTable,"
                + " RetentionDays, BatchSize, ActionType, TestMode, ProcessingOrder, IsEnabled,"
                + " Notes FROM " + table
                + " WHERE IsEnabled = ? ORDER BY ProcessingOrder ASC, ConfigID ASC";
    }

    /**
     * Loads all enabled jobs in processing order; ties are broken by id.
     *
     * @return enabled jobs, ordered
     */
    public List<JobDefinition> findEnabledInProcessingOrder() {
        List<JobDefinition> jobs = jdbc.query(selectEnabledSql, ROW_MAPPER, Boolean.TRUE);
        log.info("Loaded {} enabled job(s) from catalog.", jobs.size());
        return jobs;
    }
}
