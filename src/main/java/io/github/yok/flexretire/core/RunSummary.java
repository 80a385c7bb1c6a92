package io.github.yok.flexretire.core;

import lombok.Value;

/**
 * Totals of one run, for the console log. The execution log holds the per-job detail.
 */
@Value
public class RunSummary {

    int runNumber;
    int jobsProcessed;
    int jobsFailed;
    long totalRowsAffected;
}
