package io.github.yok.flexretire.db;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import lombok.Value;

/**
 * The retention predicate {@code dateColumn < cutoff}.
 *
 * <p>
 * The column is an identifier rendered by the dialect; the cutoff is always bound as a
 * {@link Timestamp} parameter.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class CutoffPredicate {

    String dateColumn;
    LocalDateTime cutoff;

    /**
     * Returns the cutoff as a JDBC timestamp.
     *
     * @return bound value
     */
    public Timestamp cutoffTimestamp() {
        return Timestamp.valueOf(cutoff);
    }
}
