package io.github.yok.flexretire.db.tx;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Two-phase coordinator over XA participants.
 *
 * <p>
 * Every participant gets a branch of one global id. Commit runs prepare on all branches first; if
 * any branch fails to prepare, every branch is rolled back and the commit fails. A single
 * participant is committed in one phase.
 * </p>
 *
 * <p>
 * <strong>Phase 2:</strong> prepared branches are committed in reverse enlistment order, so the
 * target (enlisted after the source) commits before the source delete. Until the first branch has
 * committed, a commit failure still rolls every branch back. Once one branch has committed the
 * outcome is commit: a branch that keeps failing is left prepared for the resource manager to
 * recover and is never rolled back, and {@link #rollback()} no longer touches any branch.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class XaTransactionCoordinator implements TransactionCoordinator {

    static final int COMMIT_ATTEMPTS = 3;

    private enum State {
        IDLE, ACTIVE
    }

    private final List<TransactionParticipant> participants = new ArrayList<>();
    private byte[] globalId;
    private State state = State.IDLE;

    @Override
    public void enlist(TransactionParticipant participant) {
        if (!participants.contains(participant)) {
            participants.add(participant);
        }
    }

    @Override
    public void begin() throws SQLException {
        if (participants.isEmpty()) {
            throw new IllegalStateException("No participant enlisted");
        }
        globalId = BranchXid.newGlobalId();
        for (int i = 0; i < participants.size(); i++) {
            try {
                participants.get(i).begin(BranchXid.of(globalId, i));
            } catch (SQLException | RuntimeException e) {
                log.warn("Start failed on {}; rolling back {} started branches",
                        participants.get(i).getName(), i);
                rollbackAll(participants.subList(0, i), e);
                throw e;
            }
        }
        state = State.ACTIVE;
    }

    @Override
    public void commit() throws SQLException {
        if (state != State.ACTIVE) {
            throw new IllegalStateException("No active unit of work to commit");
        }
        state = State.IDLE;
        if (participants.size() == 1) {
            commitOnePhase(participants.get(0));
            return;
        }
        List<TransactionParticipant> voters = new ArrayList<>();
        for (TransactionParticipant participant : participants) {
            try {
                if (participant.prepare()) {
                    voters.add(participant);
                }
            } catch (SQLException e) {
                log.warn("Prepare failed on {}; rolling back all branches", participant.getName());
                rollbackAll(participants, e);
                throw e;
            }
        }
        commitPrepared(voters);
    }

    @Override
    public void rollback() throws SQLException {
        if (state != State.ACTIVE) {
            log.debug("No active unit of work; nothing to roll back");
            return;
        }
        state = State.IDLE;
        SQLException first = null;
        for (TransactionParticipant participant : participants) {
            try {
                participant.rollback();
            } catch (SQLException e) {
                if (first == null) {
                    first = e;
                } else {
                    first.addSuppressed(e);
                }
            }
        }
        if (first != null) {
            throw first;
        }
    }

    private void commitOnePhase(TransactionParticipant participant) throws SQLException {
        try {
            participant.commit(true);
        } catch (SQLException e) {
            rollbackAll(participants, e);
            throw e;
        }
    }

    /**
     * Commits prepared branches, last enlisted first.
     *
     * @param voters branches that prepared with work to commit
     * @throws SQLException when a branch could not be committed; if another branch had already
     *         committed, the failed branch stays prepared
     */
    private void commitPrepared(List<TransactionParticipant> voters) throws SQLException {
        SQLException inDoubt = null;
        boolean decided = false;
        for (int i = voters.size() - 1; i >= 0; i--) {
            TransactionParticipant participant = voters.get(i);
            try {
                commitWithRetry(participant);
                decided = true;
            } catch (SQLException e) {
                if (!decided) {
                    log.warn("Commit failed on {} before any branch committed; rolling back",
                            participant.getName());
                    rollbackAll(voters, e);
                    throw e;
                }
                log.error("Commit failed on {} after another branch committed;"
                        + " branch left prepared for recovery", participant.getName(), e);
                if (inDoubt == null) {
                    inDoubt = new SQLException("Branch " + participant.getName()
                            + " left prepared for recovery after a partial commit", e);
                } else {
                    inDoubt.addSuppressed(e);
                }
            }
        }
        if (inDoubt != null) {
            throw inDoubt;
        }
    }

    private void commitWithRetry(TransactionParticipant participant) throws SQLException {
        SQLException last = null;
        for (int attempt = 1; attempt <= COMMIT_ATTEMPTS; attempt++) {
            try {
                participant.commit(false);
                return;
            } catch (SQLException e) {
                log.debug("Commit attempt {} failed on {}: {}", attempt, participant.getName(),
                        e.getMessage());
                if (last != null) {
                    e.addSuppressed(last);
                }
                last = e;
            }
        }
        throw last;
    }

    private void rollbackAll(List<TransactionParticipant> branches, Exception cause) {
        for (TransactionParticipant participant : branches) {
            try {
                participant.rollback();
            } catch (SQLException e) {
                cause.addSuppressed(e);
            }
        }
    }
}
