package io.github.yok.flexretire.db;

import java.util.function.UnaryOperator;
import lombok.Value;

/**
 * Identifies a table inside a store: optional catalog (database), schema, table.
 *
 * <p>
 * Parts are validated identifiers; the dialect quotes them when the locator is rendered into SQL.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class TableLocator {

    // Catalog / database qualifier; null for the connection's current database
    String catalog;
    String schema;
    String table;

    /**
     * Creates a locator without catalog qualifier.
     *
     * @param schema schema name
     * @param table table name
     * @return locator
     */
    public static TableLocator of(String schema, String table) {
        return new TableLocator(null, schema, table);
    }

    /**
     * Returns a copy whose parts were transformed, used for identifier case folding.
     *
     * @param folding transformation applied to every non-null part
     * @return transformed locator
     */
    public TableLocator map(UnaryOperator<String> folding) {
        return new TableLocator(catalog == null ? null : folding.apply(catalog),
                folding.apply(schema), folding.apply(table));
    }

    @Override
    public String toString() {
        return (catalog == null ? "" : catalog + ".") + schema + "." + table;
    }
}
