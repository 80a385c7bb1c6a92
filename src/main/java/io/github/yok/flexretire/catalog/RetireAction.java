package io.github.yok.flexretire.catalog;

import java.util.Locale;
import java.util.Optional;

/**
 * What a retire job does with expired rows.
 *
 * <p>
 * The catalog stores the short codes {@code ARCHIVE} and {@code DELETE}; the enum names are
 * accepted as well.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public enum RetireAction {

    /**
     * Copy expired rows to the target table, then delete the copied rows from the source.
     */
    COPY_THEN_DELETE("ARCHIVE"),

    /**
     * Delete expired rows from the source. No target is involved.
     */
    DELETE_ONLY("DELETE");

    private final String catalogCode;

    RetireAction(String catalogCode) {
        this.catalogCode = catalogCode;
    }

    /**
     * Returns the code stored in the catalog's {@code ActionType} column and written to the log.
     *
     * @return catalog code
     */
    public String getCatalogCode() {
        return catalogCode;
    }

    /**
     * Returns whether the action writes to a target table.
     *
     * @return {@code true} for {@link #COPY_THEN_DELETE}
     */
    public boolean requiresTarget() {
        return this == COPY_THEN_DELETE;
    }

    /**
     * Resolves a catalog value.
     *
     * @param code {@code ARCHIVE}, {@code DELETE}, or an enum name (case-insensitive, trimmed)
     * @return resolved action
     * @throws IllegalArgumentException if the code is {@code null} or unknown
     */
    public static RetireAction fromCatalogCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("ActionType must not be null.");
        }
        return find(code).orElseThrow(() -> new IllegalArgumentException(
                "Unknown ActionType '" + code + "' (expected ARCHIVE or DELETE)."));
    }

    /**
     * Looks up a catalog value without failing.
     *
     * @param code catalog value, may be {@code null}
     * @return resolved action, or empty when the code is {@code null} or unknown
     */
    public static Optional<RetireAction> find(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        for (RetireAction action : values()) {
            if (action.catalogCode.equals(normalized) || action.name().equals(normalized)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
