package io.github.yok.flexretire.db.dialect;

import io.github.yok.flexretire.config.DialectMode;
import io.github.yok.flexretire.db.CutoffPredicate;
import io.github.yok.flexretire.db.TableLocator;

/**
 * Microsoft SQL Server templates: {@code TOP (?)} limits and bracket quoting.
 *
 * @author Yasuharu.Okawauchi
 */
public class SqlServerDialect implements SqlDialect {

    @Override
    public DialectMode getMode() {
        return DialectMode.SQLSERVER;
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return "[" + identifier.replace("]", "]]") + "]";
    }

    @Override
    public BoundQuery selectBatch(TableLocator source, CutoffPredicate predicate) {
        return new BoundQuery("SELECT TOP (?) * FROM " + qualify(source) + " WHERE "
                + quoteIdentifier(predicate.getDateColumn()) + " < ?", true);
    }

    @Override
    public BoundQuery deleteBatch(TableLocator source, CutoffPredicate predicate) {
        return new BoundQuery("DELETE TOP (?) FROM " + qualify(source) + " WHERE "
                + quoteIdentifier(predicate.getDateColumn()) + " < ?", true);
    }
}
