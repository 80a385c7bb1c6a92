package io.github.yok.flexretire.util;

import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * Allow-list validation for SQL identifiers taken from the job catalog or configuration.
 *
 * <p>
 * Schema, table and column names end up inside SQL text (quoted by the dialect), so they are
 * checked against a strict syntax before any statement is built: ASCII letter or underscore first,
 * then letters, digits or underscores, at most {@value #MAX_LENGTH} characters. Values (cutoff,
 * batch size, keys) are always bound as parameters and never pass through here.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class IdentifierValidator {

    /**
     * Maximum identifier length (SQL Server {@code sysname} is 128).
     */
    public static final int MAX_LENGTH = 128;

    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]{0,127}$");

    private IdentifierValidator() {
        throw new AssertionError("IdentifierValidator must not be instantiated.");
    }

    /**
     * Validates one identifier.
     *
     * @param identifier identifier to check
     * @param kind what the identifier names, for the error message (e.g., "source table")
     * @return the identifier unchanged
     * @throws IllegalArgumentException if the identifier is blank or outside the allowed syntax
     */
    public static String validate(String identifier, String kind) {
        Validate.isTrue(StringUtils.isNotBlank(identifier), "%s must not be blank.", kind);
        if (!IDENTIFIER.matcher(identifier).matches()) {
            log.warn("Rejected {} identifier: '{}'", kind, identifier);
            throw new IllegalArgumentException(String.format(
                    "Invalid %s '%s': only ASCII letters, digits and underscores are allowed "
                            + "(starting with a letter or underscore, max %d characters).",
                    kind, identifier, MAX_LENGTH));
        }
        return identifier;
    }

    /**
     * Validates an optional identifier.
     *
     * @param identifier identifier to check; {@code null} is accepted
     * @param kind what the identifier names, for the error message
     * @return the identifier unchanged (may be {@code null})
     * @throws IllegalArgumentException if the identifier is non-null and invalid
     */
    public static String validateOptional(String identifier, String kind) {
        if (identifier == null) {
            return null;
        }
        return validate(identifier, kind);
    }

    /**
     * Returns whether the identifier passes validation, without throwing.
     *
     * @param identifier identifier to check
     * @return {@code true} when valid
     */
    public static boolean isValid(String identifier) {
        return identifier != null && IDENTIFIER.matcher(identifier).matches();
    }
}
