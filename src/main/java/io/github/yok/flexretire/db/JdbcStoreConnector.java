package io.github.yok.flexretire.db;

import io.github.yok.flexretire.db.dialect.SqlDialect;
import io.github.yok.flexretire.db.tx.JdbcTransactionParticipant;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Connector over a single local JDBC connection. Units of work are local transactions.
 *
 * @author Yasuharu.Okawauchi
 */
public class JdbcStoreConnector extends AbstractJdbcStoreConnector {

    /**
     * Creates a connector and disables auto-commit on the connection.
     *
     * @param alias store alias
     * @param dialect dialect
     * @param connection open connection, owned by this connector
     * @throws SQLException if auto-commit cannot be disabled
     */
    public JdbcStoreConnector(String alias, SqlDialect dialect, Connection connection)
            throws SQLException {
        super(alias, dialect, connection, new JdbcTransactionParticipant(alias, connection));
        connection.setAutoCommit(false);
    }

    @Override
    public void close() throws SQLException {
        connection.close();
    }
}
