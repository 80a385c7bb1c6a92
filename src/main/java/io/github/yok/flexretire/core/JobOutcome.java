package io.github.yok.flexretire.core;

import io.github.yok.flexretire.catalog.ExecutionLogEntry;
import lombok.Value;

/**
 * Result of one job invocation, as it will be written to the execution log.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class JobOutcome {

    long jobId;
    String label;
    long rowsAffected;
    String errorMessage;
    boolean failed;
    boolean deadlineReached;

    /**
     * Creates a successful outcome.
     *
     * @param jobId job id
     * @param label effective label
     * @param rowsAffected rows moved, deleted or counted
     * @return outcome
     */
    public static JobOutcome success(long jobId, String label, long rowsAffected) {
        return new JobOutcome(jobId, label, rowsAffected, null, false, false);
    }

    /**
     * Creates the outcome of a job stopped early by the run deadline. Committed batches stay.
     *
     * @param jobId job id
     * @param label effective label
     * @param rowsAffected rows committed before the stop
     * @return outcome
     */
    public static JobOutcome deferred(long jobId, String label, long rowsAffected) {
        return new JobOutcome(jobId, label, rowsAffected, RunDeadline.DEFERRED_MESSAGE, false,
                true);
    }

    /**
     * Creates a failed outcome: label {@code ERROR}, zero rows.
     *
     * @param jobId job id
     * @param errorMessage error message
     * @return outcome
     */
    public static JobOutcome failure(long jobId, String errorMessage) {
        return new JobOutcome(jobId, ExecutionLogEntry.ERROR_LABEL, 0L, errorMessage, true, false);
    }
}
