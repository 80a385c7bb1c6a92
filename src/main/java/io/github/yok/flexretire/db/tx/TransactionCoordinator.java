package io.github.yok.flexretire.db.tx;

import java.sql.SQLException;

/**
 * Drives a unit of work across the participants that joined it.
 *
 * <p>
 * A coordinator is reused for every batch of a job: {@link #begin()}, then exactly one of
 * {@link #commit()} or {@link #rollback()}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface TransactionCoordinator {

    /**
     * Adds a participant.
     *
     * @param participant participant
     * @throws IllegalStateException if the coordinator cannot take another participant
     */
    void enlist(TransactionParticipant participant);

    /**
     * Starts a unit of work on every participant.
     *
     * @throws SQLException on failure
     */
    void begin() throws SQLException;

    /**
     * Commits the unit of work on every participant, or none.
     *
     * @throws SQLException when the unit of work could not be committed
     */
    void commit() throws SQLException;

    /**
     * Rolls back the unit of work on every participant.
     *
     * @throws SQLException on failure
     */
    void rollback() throws SQLException;
}
