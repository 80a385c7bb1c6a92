package io.github.yok.flexretire.catalog;

import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/**
 * One row of the job catalog: a retirement rule for a single source table.
 *
 * <p>
 * Values are kept as read from the catalog, unvalidated. Administrators edit the catalog directly,
 * so {@link JobDefinitionValidator} re-checks every definition before it runs. The engine never
 * writes this row.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder(toBuilder = true)
public class JobDefinition {

    // ConfigID
    long id;

    // Source locator
    String sourceSchema;
    String sourceTable;
    String dateColumn;

    // Target locator; targetStore == null means "same store as the source"
    String targetStore;
    String targetDatabase;
    String targetSchema;
    String targetTable;

    // Policy
    Integer retentionDays;
    Integer batchSize;
    String actionCode;
    boolean dryRun;
    int processingOrder;
    boolean enabled;
    String notes;

    /**
     * Resolves the catalog action code.
     *
     * @return resolved action
     * @throws IllegalArgumentException if the code is missing or unknown
     */
    public RetireAction getAction() {
        return RetireAction.fromCatalogCode(actionCode);
    }

    /**
     * Returns the retention period.
     *
     * @return retention as a {@link Duration} of whole days
     * @throws IllegalStateException if {@code RetentionDays} is {@code null}
     */
    public Duration getRetention() {
        if (retentionDays == null) {
            throw new IllegalStateException("RetentionDays is not set for job " + id);
        }
        return Duration.ofDays(retentionDays);
    }

    /**
     * Returns whether this job moves rows to another store.
     *
     * @return {@code true} when a target store alias is set
     */
    public boolean isRemoteTarget() {
        return targetStore != null;
    }
}
