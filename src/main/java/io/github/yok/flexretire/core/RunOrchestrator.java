package io.github.yok.flexretire.core;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import io.github.yok.flexretire.catalog.ExecutionLogEntry;
import io.github.yok.flexretire.catalog.ExecutionLogRepository;
import io.github.yok.flexretire.catalog.JobCatalogRepository;
import io.github.yok.flexretire.catalog.JobDefinition;
import io.github.yok.flexretire.catalog.RetireAction;
import io.github.yok.flexretire.config.RetireConfig;
import io.github.yok.flexretire.db.StoreConnectorFactory;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs every enabled job of the catalog once, in processing order, and writes one execution log
 * entry per job.
 *
 * <p>
 * <strong>Error handling:</strong>
 * </p>
 * <ul>
 * <li>per-job failures are recorded as {@code ERROR} entries and the run continues</li>
 * <li>catalog read failures, log write failures and unknown store aliases propagate; the run
 * stops</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class RunOrchestrator {

    private final JobCatalogRepository catalog;
    private final ExecutionLogRepository executionLog;
    private final BatchExecutor executor;
    private final StoreConnectorFactory connectorFactory;
    // null when the advisory check is disabled
    private final ProcessingOrderAdvisor advisor;
    private final RetireConfig config;
    private final Clock clock;
    private final Ticker ticker;

    /**
     * Runs all enabled jobs.
     *
     * @return run totals
     * @throws IllegalStateException if an enabled job references an unusable store alias
     * @throws org.springframework.dao.DataAccessException if the catalog or the log fails
     */
    public RunSummary runAll() {
        RunDeadline deadline = config.getRunDeadline() == null ? RunDeadline.none()
                : RunDeadline.after(config.getRunDeadline(), ticker);
        int runNumber = executionLog.nextRunNumber();
        List<JobDefinition> jobs = catalog.findEnabledInProcessingOrder();
        log.info("[run={}] {} enabled jobs", runNumber, jobs.size());

        verifyStores(jobs);
        if (advisor != null) {
            advisor.check(jobs);
        }

        int failed = 0;
        long totalRows = 0;
        for (JobDefinition job : jobs) {
            LocalDateTime startedAt = LocalDateTime.now(clock);
            Stopwatch stopwatch = Stopwatch.createStarted(ticker);
            JobOutcome outcome;
            if (deadline.isReached()) {
                outcome = JobOutcome.failure(job.getId(), RunDeadline.NOT_STARTED_MESSAGE);
            } else {
                outcome = executor.runJob(job, startedAt, deadline);
            }
            long durationMs = stopwatch.elapsed(TimeUnit.MILLISECONDS);

            executionLog.append(ExecutionLogEntry.builder().runNumber(runNumber)
                    .jobId(job.getId()).actionLabel(outcome.getLabel())
                    .tableName(job.getSourceTable()).rowsAffected(outcome.getRowsAffected())
                    .dryRun(job.isDryRun()).startedAt(startedAt).durationMs(durationMs)
                    .errorMessage(outcome.getErrorMessage()).build());

            if (outcome.isFailed()) {
                failed++;
            }
            totalRows += outcome.getRowsAffected();
            log.info("[run={}] job={} {} rows={} ({} ms)", runNumber, job.getId(),
                    outcome.getLabel(), outcome.getRowsAffected(), durationMs);
        }
        return new RunSummary(runNumber, jobs.size(), failed, totalRows);
    }

    /**
     * Checks the store aliases of enabled cross-store jobs before any job runs.
     *
     * @param jobs enabled jobs
     * @throws IllegalStateException if an alias is unknown or cannot join a two-phase unit of work
     */
    private void verifyStores(List<JobDefinition> jobs) {
        String source = config.getSourceStore();
        for (JobDefinition job : jobs) {
            boolean archive = RetireAction.find(job.getActionCode())
                    .map(a -> a == RetireAction.COPY_THEN_DELETE).orElse(false);
            String target = job.getTargetStore();
            if (!archive || target == null || target.equalsIgnoreCase(source)) {
                continue;
            }
            if (!connectorFactory.isKnown(target)) {
                throw new IllegalStateException(
                        "Unknown store alias '" + target + "' referenced by job " + job.getId());
            }
            if (!connectorFactory.isXaCapable(target) || !connectorFactory.isXaCapable(source)) {
                throw new IllegalStateException("Job " + job.getId() + " moves rows from '"
                        + source + "' to '" + target
                        + "' but both stores need an xa-data-source-class");
            }
        }
    }
}
