package io.github.yok.flexretire.util;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;

/**
 * Reads foreign key relations between tables through JDBC metadata.
 *
 * <h2>Identifier handling</h2>
 *
 * <p>
 * Drivers match {@link DatabaseMetaData#getImportedKeys(String, String, String)} against the
 * names as stored in the catalog (lower-case on PostgreSQL, upper-case on H2 and Oracle), so
 * schema and table arguments are normalized with
 * {@link DatabaseMetaData#storesLowerCaseIdentifiers()} and
 * {@link DatabaseMetaData#storesUpperCaseIdentifiers()} first.
 * </p>
 *
 * <h2>Result keys</h2>
 *
 * <p>
 * Tables are keyed as lower-case {@code schema.table}. Self references are ignored. Parents
 * outside the given table list are kept, so a caller can tell a child of an unlisted parent.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ForeignKeyDependencyReader {

    private ForeignKeyDependencyReader() {
        throw new AssertionError("ForeignKeyDependencyReader must not be instantiated.");
    }

    /**
     * Builds a key for a schema-qualified table.
     *
     * @param schema schema name
     * @param table table name
     * @return lower-case {@code schema.table}
     */
    public static String key(String schema, String table) {
        return (schema + "." + table).toLowerCase(Locale.ROOT);
    }

    /**
     * Reads the parents of each table.
     *
     * @param conn JDBC connection used only for metadata access
     * @param tables schema-qualified tables as {@code [schema, table]} pairs
     * @return child key to the set of parent keys; tables without parents map to an empty set
     * @throws SQLException if metadata retrieval fails
     */
    public static Map<String, Set<String>> readParents(Connection conn, List<String[]> tables)
            throws SQLException {
        Validate.isTrue(conn != null, "conn must not be null.");
        Map<String, Set<String>> parents = new LinkedHashMap<>();
        if (tables == null || tables.isEmpty()) {
            return parents;
        }
        DatabaseMetaData meta = conn.getMetaData();
        for (String[] table : tables) {
            String childKey = key(table[0], table[1]);
            if (parents.containsKey(childKey)) {
                continue;
            }
            Set<String> found = new LinkedHashSet<>();
            try (ResultSet rs = meta.getImportedKeys(null, normalize(meta, table[0]),
                    normalize(meta, table[1]))) {
                while (rs.next()) {
                    String parentKey =
                            key(rs.getString("PKTABLE_SCHEM"), rs.getString("PKTABLE_NAME"));
                    if (!parentKey.equals(childKey)) {
                        found.add(parentKey);
                    }
                }
            }
            log.debug("FK parents of {}: {}", childKey, found);
            parents.put(childKey, found);
        }
        return parents;
    }

    private static String normalize(DatabaseMetaData meta, String identifier)
            throws SQLException {
        if (identifier == null) {
            return null;
        }
        if (meta.storesLowerCaseIdentifiers()) {
            return identifier.toLowerCase(Locale.ROOT);
        }
        if (meta.storesUpperCaseIdentifiers()) {
            return identifier.toUpperCase(Locale.ROOT);
        }
        return identifier;
    }
}
