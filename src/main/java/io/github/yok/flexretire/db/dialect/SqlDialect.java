package io.github.yok.flexretire.db.dialect;

import io.github.yok.flexretire.config.DialectMode;
import io.github.yok.flexretire.db.CutoffPredicate;
import io.github.yok.flexretire.db.TableLocator;
import java.util.List;

/**
 * SQL templates for one database product.
 *
 * <p>
 * The set of statements is closed: count, bounded select, bounded delete, insert by column list,
 * delete by key. Identifiers are quoted here; values are always left as {@code ?} parameters.
 * Callers validate identifiers before they reach a dialect.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface SqlDialect {

    /**
     * Returns the dialect type.
     *
     * @return dialect mode
     */
    DialectMode getMode();

    /**
     * Quotes identifier in dialect style.
     *
     * @param identifier identifier
     * @return quoted identifier
     */
    String quoteIdentifier(String identifier);

    /**
     * Renders a table locator as a (possibly three-part) quoted name.
     *
     * @param table table locator
     * @return qualified name
     */
    default String qualify(TableLocator table) {
        StringBuilder sb = new StringBuilder();
        if (table.getCatalog() != null) {
            sb.append(quoteIdentifier(table.getCatalog())).append('.');
        }
        return sb.append(quoteIdentifier(table.getSchema())).append('.')
                .append(quoteIdentifier(table.getTable())).toString();
    }

    /**
     * Returns {@code SELECT COUNT(*) ... WHERE col < ?}. One parameter: the cutoff.
     *
     * @param source source table
     * @param predicate retention predicate
     * @return SQL
     */
    default String countSql(TableLocator source, CutoffPredicate predicate) {
        return "SELECT COUNT(*) FROM " + qualify(source) + " WHERE "
                + quoteIdentifier(predicate.getDateColumn()) + " < ?";
    }

    /**
     * Returns a select of all columns of at most {@code limit} qualifying rows.
     *
     * @param source source table
     * @param predicate retention predicate
     * @return bound template
     */
    BoundQuery selectBatch(TableLocator source, CutoffPredicate predicate);

    /**
     * Returns a delete of at most {@code limit} qualifying rows.
     *
     * @param source source table
     * @param predicate retention predicate
     * @return bound template
     */
    BoundQuery deleteBatch(TableLocator source, CutoffPredicate predicate);

    /**
     * Returns {@code INSERT INTO t (c1, ...) VALUES (?, ...)}.
     *
     * @param target target table
     * @param columns column names
     * @return SQL
     */
    default String insertSql(TableLocator target, List<String> columns) {
        StringBuilder cols = new StringBuilder();
        StringBuilder params = new StringBuilder();
        for (String column : columns) {
            if (cols.length() > 0) {
                cols.append(", ");
                params.append(", ");
            }
            cols.append(quoteIdentifier(column));
            params.append('?');
        }
        return "INSERT INTO " + qualify(target) + " (" + cols + ") VALUES (" + params + ")";
    }

    /**
     * Returns {@code DELETE FROM t WHERE k1 = ? AND ...}.
     *
     * @param source source table
     * @param keyColumns key columns
     * @return SQL
     */
    default String deleteByKeySql(TableLocator source, List<String> keyColumns) {
        StringBuilder where = new StringBuilder();
        for (String key : keyColumns) {
            if (where.length() > 0) {
                where.append(" AND ");
            }
            where.append(quoteIdentifier(key)).append(" = ?");
        }
        return "DELETE FROM " + qualify(source) + " WHERE " + where;
    }
}
