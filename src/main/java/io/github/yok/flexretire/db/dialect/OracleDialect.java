package io.github.yok.flexretire.db.dialect;

import io.github.yok.flexretire.config.DialectMode;
import io.github.yok.flexretire.db.CutoffPredicate;
import io.github.yok.flexretire.db.TableLocator;

/**
 * Oracle Database (12c and later) templates. The bounded delete goes through {@code ROWID}.
 *
 * @author Yasuharu.Okawauchi
 */
public class OracleDialect extends AnsiQuotingDialect {

    @Override
    public DialectMode getMode() {
        return DialectMode.ORACLE;
    }

    @Override
    public BoundQuery selectBatch(TableLocator source, CutoffPredicate predicate) {
        return new BoundQuery("SELECT * FROM " + qualify(source) + " WHERE "
                + quoteIdentifier(predicate.getDateColumn()) + " < ? FETCH FIRST ? ROWS ONLY",
                false);
    }

    @Override
    public BoundQuery deleteBatch(TableLocator source, CutoffPredicate predicate) {
        String table = qualify(source);
        return new BoundQuery("DELETE FROM " + table + " WHERE ROWID IN (SELECT ROWID FROM "
                + table + " WHERE " + quoteIdentifier(predicate.getDateColumn())
                + " < ? FETCH FIRST ? ROWS ONLY)", false);
    }
}
