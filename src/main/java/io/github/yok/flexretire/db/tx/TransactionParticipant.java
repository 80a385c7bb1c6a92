package io.github.yok.flexretire.db.tx;

import java.sql.SQLException;
import javax.transaction.xa.Xid;

/**
 * One resource taking part in a unit of work.
 */
public interface TransactionParticipant {

    /**
     * Returns a name used in log and error messages.
     *
     * @return participant name
     */
    String getName();

    /**
     * Starts the participant's branch of a unit of work.
     *
     * @param xid branch identifier; local participants ignore it
     * @throws SQLException on failure
     */
    void begin(Xid xid) throws SQLException;

    /**
     * Ends the branch and votes.
     *
     * @return {@code true} when there is work to commit, {@code false} for a read-only branch
     * @throws SQLException when the branch cannot be prepared
     */
    boolean prepare() throws SQLException;

    /**
     * Commits the branch.
     *
     * @param onePhase {@code true} when {@link #prepare()} was skipped
     * @throws SQLException on failure
     */
    void commit(boolean onePhase) throws SQLException;

    /**
     * Rolls the branch back.
     *
     * @throws SQLException on failure
     */
    void rollback() throws SQLException;
}
