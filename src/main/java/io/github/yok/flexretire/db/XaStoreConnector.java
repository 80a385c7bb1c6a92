package io.github.yok.flexretire.db;

import io.github.yok.flexretire.db.dialect.SqlDialect;
import io.github.yok.flexretire.db.tx.XaTransactionParticipant;
import java.sql.SQLException;
import javax.sql.XAConnection;

/**
 * Connector over an {@link XAConnection}. Units of work are branches of a global transaction.
 *
 * @author Yasuharu.Okawauchi
 */
public class XaStoreConnector extends AbstractJdbcStoreConnector {

    private final XAConnection xaConnection;

    /**
     * Creates a connector over an XA connection.
     *
     * @param alias store alias
     * @param dialect dialect
     * @param xaConnection open XA connection, owned by this connector
     * @throws SQLException if the logical connection or XA resource cannot be obtained
     */
    public XaStoreConnector(String alias, SqlDialect dialect, XAConnection xaConnection)
            throws SQLException {
        super(alias, dialect, xaConnection.getConnection(),
                new XaTransactionParticipant(alias, xaConnection.getXAResource()));
        this.xaConnection = xaConnection;
    }

    @Override
    public void close() throws SQLException {
        try {
            connection.close();
        } finally {
            xaConnection.close();
        }
    }
}
