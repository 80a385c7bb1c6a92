package io.github.yok.flexretire.catalog;

import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * One row of the execution log: the outcome of one job in one run.
 *
 * <p>
 * {@code actionLabel} is the catalog code ({@code ARCHIVE}/{@code DELETE}), its dry-run variant
 * ({@code TEST-ARCHIVE}/{@code TEST-DELETE}) or {@code ERROR}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class ExecutionLogEntry {

    /**
     * Label written for a failed job.
     */
    public static final String ERROR_LABEL = "ERROR";

    /**
     * Prefix of the label written for a dry run.
     */
    public static final String DRY_RUN_PREFIX = "TEST-";

    int runNumber;
    long jobId;
    String actionLabel;
    String tableName;
    long rowsAffected;
    boolean dryRun;
    LocalDateTime startedAt;
    long durationMs;
    String errorMessage;
}
