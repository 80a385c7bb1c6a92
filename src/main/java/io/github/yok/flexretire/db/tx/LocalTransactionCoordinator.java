package io.github.yok.flexretire.db.tx;

import java.sql.SQLException;

/**
 * Coordinator for a single local store. Refuses a second participant.
 *
 * @author Yasuharu.Okawauchi
 */
public class LocalTransactionCoordinator implements TransactionCoordinator {

    private TransactionParticipant participant;

    @Override
    public void enlist(TransactionParticipant p) {
        if (participant != null && participant != p) {
            throw new IllegalStateException("Local transaction already bound to "
                    + participant.getName() + "; cannot enlist " + p.getName());
        }
        participant = p;
    }

    @Override
    public void begin() throws SQLException {
        required().begin(null);
    }

    @Override
    public void commit() throws SQLException {
        required().commit(true);
    }

    @Override
    public void rollback() throws SQLException {
        required().rollback();
    }

    private TransactionParticipant required() {
        if (participant == null) {
            throw new IllegalStateException("No participant enlisted");
        }
        return participant;
    }
}
