package io.github.yok.flexretire.db.dialect;

import io.github.yok.flexretire.config.DialectMode;
import io.github.yok.flexretire.db.CutoffPredicate;
import io.github.yok.flexretire.db.TableLocator;

/**
 * MySQL templates: {@code LIMIT ?} on select and delete, backtick quoting.
 *
 * @author Yasuharu.Okawauchi
 */
public class MySqlDialect implements SqlDialect {

    @Override
    public DialectMode getMode() {
        return DialectMode.MYSQL;
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return "`" + identifier.replace("`", "``") + "`";
    }

    @Override
    public BoundQuery selectBatch(TableLocator source, CutoffPredicate predicate) {
        return new BoundQuery("SELECT * FROM " + qualify(source) + " WHERE "
                + quoteIdentifier(predicate.getDateColumn()) + " < ? LIMIT ?", false);
    }

    @Override
    public BoundQuery deleteBatch(TableLocator source, CutoffPredicate predicate) {
        return new BoundQuery("DELETE FROM " + qualify(source) + " WHERE "
                + quoteIdentifier(predicate.getDateColumn()) + " < ? LIMIT ?", false);
    }
}
