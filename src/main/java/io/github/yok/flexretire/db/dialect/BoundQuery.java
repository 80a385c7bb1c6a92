package io.github.yok.flexretire.db.dialect;

import io.github.yok.flexretire.db.CutoffPredicate;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import lombok.Value;

/**
 * A bounded query template: SQL text with two parameters, the cutoff and the row limit.
 *
 * <p>
 * Dialects disagree on where the limit goes ({@code TOP (?)} before the predicate on SQL Server,
 * {@code LIMIT ?} / {@code FETCH FIRST ? ROWS ONLY} after it elsewhere), so the template records
 * the parameter order.
 * </p>
 */
@Value
public class BoundQuery {

    String sql;
    boolean limitFirst;

    /**
     * Binds the cutoff and the limit in the order this template expects.
     *
     * @param ps prepared statement created from {@link #getSql()}
     * @param predicate retention predicate
     * @param limit maximum rows
     * @throws SQLException if binding fails
     */
    public void bind(PreparedStatement ps, CutoffPredicate predicate, int limit)
            throws SQLException {
        if (limitFirst) {
            ps.setInt(1, limit);
            ps.setTimestamp(2, predicate.cutoffTimestamp());
        } else {
            ps.setTimestamp(1, predicate.cutoffTimestamp());
            ps.setInt(2, limit);
        }
    }
}
