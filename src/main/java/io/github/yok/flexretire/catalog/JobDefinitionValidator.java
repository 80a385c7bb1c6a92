package io.github.yok.flexretire.catalog;

import io.github.yok.flexretire.util.IdentifierValidator;
import org.apache.commons.lang3.Validate;

/**
 * Re-validates a job definition before it runs.
 *
 * <p>
 * These checks belong at catalog-write time, but the catalog is edited by hand, so the engine
 * repeats them. A failure is a per-job error: the job is logged as {@code ERROR} and the run moves
 * on.
 * </p>
 *
 * <ul>
 * <li>source schema, table and date column pass {@link IdentifierValidator}</li>
 * <li>retention days and batch size are positive</li>
 * <li>the action code is known</li>
 * <li>{@code ARCHIVE} has a valid target schema and table (target database optional); the target
 * locator is not looked at for {@code DELETE}</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public final class JobDefinitionValidator {

    private JobDefinitionValidator() {
        throw new AssertionError("JobDefinitionValidator must not be instantiated.");
    }

    /**
     * Validates the definition.
     *
     * @param job job definition
     * @return the resolved action
     * @throws IllegalArgumentException if any check fails
     */
    public static RetireAction validate(JobDefinition job) {
        Validate.isTrue(job != null, "job must not be null.");

        IdentifierValidator.validate(job.getSourceSchema(), "source schema");
        IdentifierValidator.validate(job.getSourceTable(), "source table");
        IdentifierValidator.validate(job.getDateColumn(), "date column");

        Validate.isTrue(job.getRetentionDays() != null && job.getRetentionDays() > 0,
                "RetentionDays must be positive (job=%d, value=%s).", job.getId(),
                job.getRetentionDays());
        Validate.isTrue(job.getBatchSize() != null && job.getBatchSize() > 0,
                "BatchSize must be positive (job=%d, value=%s).", job.getId(),
                job.getBatchSize());

        RetireAction action = job.getAction();
        if (action.requiresTarget()) {
            Validate.isTrue(job.getTargetTable() != null,
                    "ARCHIVE requires TargetTable (job=%d).", job.getId());
            IdentifierValidator.validate(job.getTargetTable(), "target table");
            IdentifierValidator.validate(job.getTargetSchema(), "target schema");
            IdentifierValidator.validateOptional(job.getTargetDatabase(), "target database");
            IdentifierValidator.validateOptional(job.getTargetStore(), "target store alias");
        }
        return action;
    }
}
