package io.github.yok.flexretire.db;

import io.github.yok.flexretire.db.dialect.SqlDialect;
import io.github.yok.flexretire.db.tx.TransactionCoordinator;
import java.sql.SQLException;

/**
 * Connection to one data store, exposing the closed set of statements a retire job needs.
 *
 * <p>
 * Work happens inside units of work driven by the {@link TransactionCoordinator} the connector
 * joined. {@link #count} is the only statement that runs outside a unit of work.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface StoreConnector extends AutoCloseable {

    /**
     * Returns the store alias.
     *
     * @return alias
     */
    String getAlias();

    /**
     * Returns the dialect used to render statements.
     *
     * @return dialect
     */
    SqlDialect getDialect();

    /**
     * Counts rows older than the cutoff.
     *
     * @param source source table
     * @param predicate retention predicate
     * @return number of qualifying rows
     * @throws SQLException on SQL failure
     */
    long count(TableLocator source, CutoffPredicate predicate) throws SQLException;

    /**
     * Selects up to {@code limit} qualifying rows together with their primary key.
     *
     * @param source source table
     * @param predicate retention predicate
     * @param limit maximum rows
     * @return selected rows
     * @throws SQLException on SQL failure, or when the table has no primary key
     */
    RowBatch selectBatch(TableLocator source, CutoffPredicate predicate, int limit)
            throws SQLException;

    /**
     * Inserts rows into the target table with an explicit column list.
     *
     * @param target target table
     * @param batch rows to insert
     * @return rows inserted
     * @throws SQLException on SQL failure
     */
    int insertBatch(TableLocator target, RowBatch batch) throws SQLException;

    /**
     * Deletes exactly the rows of a batch by primary key.
     *
     * @param source source table
     * @param batch rows previously selected from {@code source}
     * @return rows deleted
     * @throws SQLException on SQL failure
     */
    int deleteByKeys(TableLocator source, RowBatch batch) throws SQLException;

    /**
     * Deletes up to {@code limit} qualifying rows.
     *
     * @param source source table
     * @param predicate retention predicate
     * @param limit maximum rows
     * @return rows deleted
     * @throws SQLException on SQL failure
     */
    int deleteBatch(TableLocator source, CutoffPredicate predicate, int limit)
            throws SQLException;

    /**
     * Enlists this connector in a coordinator; {@link #begin()}, {@link #commit()} and
     * {@link #rollback()} then drive that coordinator.
     *
     * @param coordinator coordinator
     */
    void joinTransaction(TransactionCoordinator coordinator);

    /**
     * Starts a unit of work on the joined coordinator.
     *
     * @throws SQLException on failure
     */
    void begin() throws SQLException;

    /**
     * Commits the unit of work on the joined coordinator.
     *
     * @throws SQLException on failure
     */
    void commit() throws SQLException;

    /**
     * Rolls back the unit of work on the joined coordinator.
     *
     * @throws SQLException on failure
     */
    void rollback() throws SQLException;

    @Override
    void close() throws SQLException;
}
