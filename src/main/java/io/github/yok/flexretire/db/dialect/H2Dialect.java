package io.github.yok.flexretire.db.dialect;

import io.github.yok.flexretire.config.DialectMode;
import io.github.yok.flexretire.db.CutoffPredicate;
import io.github.yok.flexretire.db.TableLocator;

/**
 * H2 templates: {@code FETCH FIRST ? ROWS ONLY} is accepted on both select and delete.
 *
 * @author Yasuharu.Okawauchi
 */
public class H2Dialect extends AnsiQuotingDialect {

    @Override
    public DialectMode getMode() {
        return DialectMode.H2;
    }

    @Override
    public BoundQuery selectBatch(TableLocator source, CutoffPredicate predicate) {
        return new BoundQuery("SELECT * FROM " + qualify(source) + " WHERE "
                + quoteIdentifier(predicate.getDateColumn()) + " < ? FETCH FIRST ? ROWS ONLY",
                false);
    }

    @Override
    public BoundQuery deleteBatch(TableLocator source, CutoffPredicate predicate) {
        return new BoundQuery("DELETE FROM " + qualify(source) + " WHERE "
                + quoteIdentifier(predicate.getDateColumn()) + " < ? FETCH FIRST ? ROWS ONLY",
                false);
    }
}
