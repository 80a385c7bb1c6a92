package io.github.yok.flexretire.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that binds the {@code retire} section in {@code application.yml}. Centralizes
 * the behavior of the run orchestrator and the batch executor.
 *
 * <p>
 * The catalog and log table names are assembled as {@code metadataSchema.catalogTable} and
 * {@code metadataSchema.logTable} and must pass identifier validation.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "retire")
@Data
public class RetireConfig {

    /**
     * Alias of the operational store. Source tables, the job catalog and the execution log all live
     * there.
     */
    private String sourceStore = "local";

    /**
     * Schema holding the catalog and log tables.
     */
    private String metadataSchema = "dbo";

    /**
     * Job catalog table.
     */
    private String catalogTable = "ArchiveConfig";

    /**
     * Execution log table.
     */
    private String logTable = "ProcessingLog";

    /**
     * Pause between two non-empty batches of the same job.
     */
    private Duration batchPause = Duration.ofMillis(100);

    /**
     * Wall-clock budget for one run. {@code null} means no deadline.
     */
    private Duration runDeadline;

    /**
     * When {@code true}, the processing order of enabled jobs is compared with the foreign keys of
     * the source store and suspicious orderings are logged. The order itself is never changed.
     */
    private boolean verifyProcessingOrder = true;
}
