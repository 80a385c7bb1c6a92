package io.github.yok.flexretire.core;

import io.github.yok.flexretire.catalog.ExecutionLogEntry;
import io.github.yok.flexretire.catalog.JobDefinition;
import io.github.yok.flexretire.catalog.JobDefinitionValidator;
import io.github.yok.flexretire.catalog.RetireAction;
import io.github.yok.flexretire.db.CutoffPredicate;
import io.github.yok.flexretire.db.RowBatch;
import io.github.yok.flexretire.db.StoreConnector;
import io.github.yok.flexretire.db.StoreConnectorFactory;
import io.github.yok.flexretire.db.TableLocator;
import io.github.yok.flexretire.db.tx.TransactionCoordinator;
import java.sql.SQLException;
import java.time.Duration;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Runs one retire job as a sequence of bounded, individually committed batches.
 *
 * <p>
 * <strong>Batch loop:</strong>
 * </p>
 * <ol>
 * <li>begin a unit of work (local, or two-phase when the target lives in another store)</li>
 * <li>copy-then-delete: select up to {@code batchSize} rows, insert them into the target, delete
 * the same keys from the source; delete-only: bounded delete</li>
 * <li>commit; a zero-row batch ends the loop, otherwise pause and continue</li>
 * </ol>
 *
 * <p>
 * A failing batch is rolled back and ends the job. Batches committed before it stay committed; the
 * job is still reported with label {@code ERROR} and zero rows. Every exception raised while the
 * job runs is turned into a {@link JobOutcome}; nothing propagates to the caller.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class BatchExecutor {

    private final StoreConnectorFactory connectorFactory;
    private final String sourceStore;
    private final Duration batchPause;
    private final BatchPause pause;

    /**
     * Runs a job without a run deadline.
     *
     * @param job job definition
     * @param now reference time for the cutoff
     * @return outcome
     */
    public JobOutcome runJob(JobDefinition job, LocalDateTime now) {
        return runJob(job, now, RunDeadline.none());
    }

    /**
     * Runs a job.
     *
     * @param job job definition
     * @param now reference time; the cutoff is {@code now - retention}, computed once
     * @param deadline run deadline, checked before every batch after the first
     * @return outcome
     */
    public JobOutcome runJob(JobDefinition job, LocalDateTime now, RunDeadline deadline) {
        try {
            RetireAction action = JobDefinitionValidator.validate(job);
            BatchOperation operation = BatchOperation.of(action, job.isDryRun());
            CutoffPredicate predicate =
                    new CutoffPredicate(job.getDateColumn(), now.minus(job.getRetention()));
            TableLocator source = TableLocator.of(job.getSourceSchema(), job.getSourceTable());
            log.info("[job={}] {} {} (cutoff={}, batchSize={})", job.getId(), operation, source,
                    predicate.getCutoff(), job.getBatchSize());

            if (operation == BatchOperation.COUNT_ONLY) {
                return countOnly(job, action, source, predicate);
            }
            return execute(job, action, operation, source, predicate, deadline);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[job={}] Interrupted between batches", job.getId());
            return JobOutcome.failure(job.getId(), "Interrupted between batches");

        } catch (Exception e) {
            log.warn("[job={}] Job failed: {}", job.getId(), e.getMessage(), e);
            return JobOutcome.failure(job.getId(), ExceptionUtils.getMessage(e));
        }
    }

    private JobOutcome countOnly(JobDefinition job, RetireAction action, TableLocator source,
            CutoffPredicate predicate) throws SQLException {
        try (StoreConnector connector = connectorFactory.openLocal(sourceStore)) {
            long count = connector.count(source, predicate);
            String label = ExecutionLogEntry.DRY_RUN_PREFIX + action.getCatalogCode();
            log.info("[job={}] {} qualifying rows (dry run)", job.getId(), count);
            return JobOutcome.success(job.getId(), label, count);
        }
    }

    private JobOutcome execute(JobDefinition job, RetireAction action, BatchOperation operation,
            TableLocator source, CutoffPredicate predicate, RunDeadline deadline)
            throws SQLException, InterruptedException {
        boolean crossStore = operation == BatchOperation.COPY_THEN_DELETE
                && job.isRemoteTarget()
                && !job.getTargetStore().equalsIgnoreCase(sourceStore);
        TableLocator target = operation == BatchOperation.COPY_THEN_DELETE
                ? new TableLocator(job.getTargetDatabase(), job.getTargetSchema(),
                        job.getTargetTable())
                : null;
        String label = action.getCatalogCode();
        TransactionCoordinator coordinator = connectorFactory.newCoordinator(crossStore);

        try (StoreConnector src = crossStore ? connectorFactory.openXa(sourceStore)
                : connectorFactory.openLocal(sourceStore);
                StoreConnector remote =
                        crossStore ? connectorFactory.openXa(job.getTargetStore()) : null) {
            StoreConnector writer = remote != null ? remote : src;
            src.joinTransaction(coordinator);
            if (remote != null) {
                remote.joinTransaction(coordinator);
            }

            long total = 0;
            int batchNo = 0;
            while (true) {
                if (batchNo > 0 && deadline.isReached()) {
                    log.info("[job={}] Run deadline reached after {} batches ({} rows)",
                            job.getId(), batchNo, total);
                    return JobOutcome.deferred(job.getId(), label, total);
                }
                batchNo++;
                int rows = runBatch(job, operation, src, writer, source, target, predicate);
                log.debug("[job={}] batch {} -> {} rows", job.getId(), batchNo, rows);
                if (rows == 0) {
                    break;
                }
                total += rows;
                pause.pause(batchPause);
            }
            log.info("[job={}] {} completed: {} rows in {} batches", job.getId(), label, total,
                    batchNo);
            return JobOutcome.success(job.getId(), label, total);
        }
    }

    /**
     * Runs one batch inside its own unit of work.
     *
     * @return rows moved or deleted by the batch
     */
    private int runBatch(JobDefinition job, BatchOperation operation, StoreConnector src,
            StoreConnector writer, TableLocator source, TableLocator target,
            CutoffPredicate predicate) throws SQLException {
        try {
            src.begin();
            int rows;
            if (operation == BatchOperation.COPY_THEN_DELETE) {
                rows = copyBatch(job, src, writer, source, target, predicate);
            } else {
                rows = src.deleteBatch(source, predicate, job.getBatchSize());
            }
            src.commit();
            return rows;
        } catch (SQLException | RuntimeException e) {
            try {
                src.rollback();
            } catch (SQLException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
            }
            throw e;
        }
    }

    private int copyBatch(JobDefinition job, StoreConnector src, StoreConnector writer,
            TableLocator source, TableLocator target, CutoffPredicate predicate)
            throws SQLException {
        RowBatch batch = src.selectBatch(source, predicate, job.getBatchSize());
        if (batch.isEmpty()) {
            return 0;
        }
        int inserted = writer.insertBatch(target, batch);
        if (inserted != batch.size()) {
            throw new IllegalStateException("Inserted " + inserted + " of " + batch.size()
                    + " selected rows into " + target);
        }
        int deleted = src.deleteByKeys(source, batch);
        if (deleted != inserted) {
            throw new IllegalStateException("Deleted " + deleted + " rows from " + source
                    + " but copied " + inserted + " to " + target);
        }
        return deleted;
    }
}
