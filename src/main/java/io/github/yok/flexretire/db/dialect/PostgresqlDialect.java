package io.github.yok.flexretire.db.dialect;

import io.github.yok.flexretire.config.DialectMode;
import io.github.yok.flexretire.db.CutoffPredicate;
import io.github.yok.flexretire.db.TableLocator;

/**
 * PostgreSQL templates. {@code DELETE} has no limit clause, so the bounded delete goes through
 * {@code ctid}.
 *
 * @author Yasuharu.Okawauchi
 */
public class PostgresqlDialect extends AnsiQuotingDialect {

    @Override
    public DialectMode getMode() {
        return DialectMode.POSTGRESQL;
    }

    @Override
    public BoundQuery selectBatch(TableLocator source, CutoffPredicate predicate) {
        return new BoundQuery("SELECT * FROM " + qualify(source) + " WHERE "
                + quoteIdentifier(predicate.getDateColumn()) + " < ? LIMIT ?", false);
    }

    @Override
    public BoundQuery deleteBatch(TableLocator source, CutoffPredicate predicate) {
        String table = qualify(source);
        return new BoundQuery("DELETE FROM " + table + " WHERE ctid = ANY(ARRAY(SELECT ctid FROM "
                + table + " WHERE " + quoteIdentifier(predicate.getDateColumn())
                + " < ? LIMIT ?))", false);
    }
}
