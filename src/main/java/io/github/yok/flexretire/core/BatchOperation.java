package io.github.yok.flexretire.core;

import io.github.yok.flexretire.catalog.RetireAction;

/**
 * Statement set used for one job invocation.
 */
public enum BatchOperation {

    /**
     * Select a batch, insert it into the target, delete the same keys from the source.
     */
    COPY_THEN_DELETE,

    /**
     * Bounded delete on the source.
     */
    DELETE_ONLY,

    /**
     * Single count of qualifying rows; no writes.
     */
    COUNT_ONLY;

    /**
     * Selects the operation for an action.
     *
     * @param action resolved action
     * @param dryRun whether the job runs in test mode
     * @return operation
     */
    public static BatchOperation of(RetireAction action, boolean dryRun) {
        if (dryRun) {
            return COUNT_ONLY;
        }
        return action == RetireAction.COPY_THEN_DELETE ? COPY_THEN_DELETE : DELETE_ONLY;
    }
}
