package io.github.yok.flexretire.db.tx;

import java.sql.Connection;
import java.sql.SQLException;
import javax.transaction.xa.Xid;
import lombok.RequiredArgsConstructor;

/**
 * Participant backed by a plain JDBC connection with auto-commit disabled.
 *
 * @author Yasuharu.Okawauchi
 */
@RequiredArgsConstructor
public class JdbcTransactionParticipant implements TransactionParticipant {

    private final String name;
    private final Connection connection;

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void begin(Xid xid) throws SQLException {
        if (connection.getAutoCommit()) {
            connection.setAutoCommit(false);
        }
    }

    @Override
    public boolean prepare() {
        return true;
    }

    @Override
    public void commit(boolean onePhase) throws SQLException {
        connection.commit();
    }

    @Override
    public void rollback() throws SQLException {
        connection.rollback();
    }
}
