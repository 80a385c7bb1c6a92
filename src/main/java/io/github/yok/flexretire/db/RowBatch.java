package io.github.yok.flexretire.db;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Value;

/**
 * Rows selected from a source table for one copy batch, with the key columns that identify each
 * row.
 *
 * <p>
 * The delete half of a copy batch removes exactly these keys, never "whatever matches the cutoff
 * now", so a row that becomes eligible between the copy and the delete is left for the next batch.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class RowBatch {

    // Selected column labels, in result-set order
    ImmutableList<String> columns;
    // Primary key columns (subset of columns), in key-sequence order
    ImmutableList<String> keyColumns;
    // Row values, aligned with columns
    ImmutableList<Object[]> rows;

    /**
     * Returns an empty batch for the given columns.
     *
     * @param columns column labels
     * @param keyColumns key columns
     * @return empty batch
     */
    public static RowBatch empty(List<String> columns, List<String> keyColumns) {
        return new RowBatch(ImmutableList.copyOf(columns), ImmutableList.copyOf(keyColumns),
                ImmutableList.of());
    }

    /**
     * Returns the number of rows.
     *
     * @return row count
     */
    public int size() {
        return rows.size();
    }

    /**
     * Returns whether the batch has no rows.
     *
     * @return {@code true} when empty
     */
    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Extracts the key values of one row.
     *
     * @param rowIndex row index
     * @return key values in {@link #getKeyColumns()} order
     */
    public Object[] keyValues(int rowIndex) {
        Object[] row = rows.get(rowIndex);
        Object[] key = new Object[keyColumns.size()];
        for (int k = 0; k < keyColumns.size(); k++) {
            key[k] = row[columns.indexOf(keyColumns.get(k))];
        }
        return key;
    }
}
