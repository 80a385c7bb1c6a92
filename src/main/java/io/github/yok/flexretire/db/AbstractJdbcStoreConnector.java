package io.github.yok.flexretire.db;

import com.google.common.collect.ImmutableList;
import io.github.yok.flexretire.db.dialect.BoundQuery;
import io.github.yok.flexretire.db.dialect.SqlDialect;
import io.github.yok.flexretire.db.tx.TransactionCoordinator;
import io.github.yok.flexretire.db.tx.TransactionParticipant;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;

/**
 * JDBC implementation of the statements shared by local and XA connectors.
 *
 * <p>
 * Identifiers are folded to the case the store keeps unquoted identifiers in (upper for H2 and
 * Oracle, lower for PostgreSQL, unchanged for SQL Server and MySQL) before they are quoted, so an
 * unquoted catalog entry such as {@code Orders} still finds a table created as {@code ORDERS}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public abstract class AbstractJdbcStoreConnector implements StoreConnector {

    protected final String alias;
    protected final SqlDialect dialect;
    protected final Connection connection;
    private final TransactionParticipant participant;
    private TransactionCoordinator coordinator;
    private Boolean upperCase;
    private Boolean lowerCase;

    protected AbstractJdbcStoreConnector(String alias, SqlDialect dialect, Connection connection,
            TransactionParticipant participant) {
        this.alias = alias;
        this.dialect = dialect;
        this.connection = connection;
        this.participant = participant;
    }

    @Override
    public String getAlias() {
        return alias;
    }

    @Override
    public SqlDialect getDialect() {
        return dialect;
    }

    @Override
    public long count(TableLocator source, CutoffPredicate predicate) throws SQLException {
        TableLocator table = fold(source);
        CutoffPredicate folded = fold(predicate);
        String sql = dialect.countSql(table, folded);
        log.debug("[{}] {}", alias, sql);
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setTimestamp(1, folded.cutoffTimestamp());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        }
    }

    @Override
    public RowBatch selectBatch(TableLocator source, CutoffPredicate predicate, int limit)
            throws SQLException {
        TableLocator table = fold(source);
        CutoffPredicate folded = fold(predicate);
        List<String> primaryKey = readPrimaryKey(table);
        if (primaryKey.isEmpty()) {
            throw new SQLException("Table " + table + " has no primary key; rows cannot be"
                    + " copied and deleted safely");
        }
        BoundQuery query = dialect.selectBatch(table, folded);
        log.debug("[{}] {}", alias, query.getSql());
        try (PreparedStatement ps = connection.prepareStatement(query.getSql())) {
            query.bind(ps, folded, limit);
            try (ResultSet rs = ps.executeQuery()) {
                ResultSetMetaData md = rs.getMetaData();
                List<String> columns = new ArrayList<>();
                for (int i = 1; i <= md.getColumnCount(); i++) {
                    columns.add(md.getColumnLabel(i));
                }
                List<String> keys = matchKeyColumns(table, primaryKey, columns);
                ImmutableList.Builder<Object[]> rows = ImmutableList.builder();
                int n = 0;
                while (rs.next() && n < limit) {
                    Object[] row = new Object[columns.size()];
                    for (int i = 0; i < row.length; i++) {
                        row[i] = rs.getObject(i + 1);
                    }
                    rows.add(row);
                    n++;
                }
                return new RowBatch(ImmutableList.copyOf(columns), ImmutableList.copyOf(keys),
                        rows.build());
            }
        }
    }

    @Override
    public int insertBatch(TableLocator target, RowBatch batch) throws SQLException {
        if (batch.isEmpty()) {
            return 0;
        }
        String sql = dialect.insertSql(fold(target), batch.getColumns());
        log.debug("[{}] {} ({} rows)", alias, sql, batch.size());
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            for (Object[] row : batch.getRows()) {
                for (int i = 0; i < row.length; i++) {
                    ps.setObject(i + 1, row[i]);
                }
                ps.addBatch();
            }
            return sum(ps.executeBatch());
        }
    }

    @Override
    public int deleteByKeys(TableLocator source, RowBatch batch) throws SQLException {
        if (batch.isEmpty()) {
            return 0;
        }
        String sql = dialect.deleteByKeySql(fold(source), batch.getKeyColumns());
        log.debug("[{}] {} ({} keys)", alias, sql, batch.size());
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            for (int r = 0; r < batch.size(); r++) {
                Object[] key = batch.keyValues(r);
                for (int k = 0; k < key.length; k++) {
                    ps.setObject(k + 1, key[k]);
                }
                ps.addBatch();
            }
            return sum(ps.executeBatch());
        }
    }

    @Override
    public int deleteBatch(TableLocator source, CutoffPredicate predicate, int limit)
            throws SQLException {
        TableLocator table = fold(source);
        CutoffPredicate folded = fold(predicate);
        BoundQuery query = dialect.deleteBatch(table, folded);
        log.debug("[{}] {}", alias, query.getSql());
        try (PreparedStatement ps = connection.prepareStatement(query.getSql())) {
            query.bind(ps, folded, limit);
            return ps.executeUpdate();
        }
    }

    @Override
    public void joinTransaction(TransactionCoordinator transactionCoordinator) {
        transactionCoordinator.enlist(participant);
        this.coordinator = transactionCoordinator;
    }

    @Override
    public void begin() throws SQLException {
        joined().begin();
    }

    @Override
    public void commit() throws SQLException {
        joined().commit();
    }

    @Override
    public void rollback() throws SQLException {
        joined().rollback();
    }

    private TransactionCoordinator joined() {
        if (coordinator == null) {
            throw new IllegalStateException("Store " + alias + " has not joined a transaction");
        }
        return coordinator;
    }

    /**
     * Reads the primary key columns in key-sequence order.
     *
     * @param table folded table locator
     * @return key column names, empty when the table has no primary key
     * @throws SQLException if metadata retrieval fails
     */
    private List<String> readPrimaryKey(TableLocator table) throws SQLException {
        DatabaseMetaData meta = connection.getMetaData();
        TreeMap<Short, String> keys = new TreeMap<>();
        try (ResultSet rs =
                meta.getPrimaryKeys(table.getCatalog(), table.getSchema(), table.getTable())) {
            while (rs.next()) {
                keys.put(rs.getShort("KEY_SEQ"), rs.getString("COLUMN_NAME"));
            }
        }
        return new ArrayList<>(keys.values());
    }

    private List<String> matchKeyColumns(TableLocator table, List<String> primaryKey,
            List<String> columns) throws SQLException {
        List<String> keys = new ArrayList<>();
        for (String key : primaryKey) {
            String match = columns.stream().filter(c -> c.equalsIgnoreCase(key)).findFirst()
                    .orElseThrow(() -> new SQLException(
                            "Primary key column " + key + " not selected from " + table));
            keys.add(match);
        }
        return keys;
    }

    private TableLocator fold(TableLocator locator) {
        return locator.map(this::foldIdentifier);
    }

    private CutoffPredicate fold(CutoffPredicate predicate) {
        return new CutoffPredicate(foldIdentifier(predicate.getDateColumn()),
                predicate.getCutoff());
    }

    /**
     * Folds an unquoted identifier the way the store stores it.
     *
     * @param identifier identifier
     * @return folded identifier
     */
    private String foldIdentifier(String identifier) {
        if (upperCase == null) {
            try {
                DatabaseMetaData meta = connection.getMetaData();
                upperCase = meta.storesUpperCaseIdentifiers();
                lowerCase = meta.storesLowerCaseIdentifiers();
            } catch (SQLException e) {
                log.debug("[{}] identifier case unknown, using names as given", alias, e);
                upperCase = false;
                lowerCase = false;
            }
        }
        if (upperCase) {
            return identifier.toUpperCase(Locale.ROOT);
        }
        if (lowerCase) {
            return identifier.toLowerCase(Locale.ROOT);
        }
        return identifier;
    }

    private static int sum(int[] counts) {
        int total = 0;
        for (int c : counts) {
            if (c == Statement.SUCCESS_NO_INFO) {
                total += 1;
            } else if (c > 0) {
                total += c;
            }
        }
        return total;
    }
}
