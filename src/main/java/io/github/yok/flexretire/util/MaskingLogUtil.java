package io.github.yok.flexretire.util;

import io.github.yok.flexretire.config.StoreConfig;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility for masking credentials before store details are written to the log.
 *
 * <p>
 * Masks embedded credentials in authority-style JDBC URLs and {@code password=} properties in
 * both query-style ({@code ?a=b&password=x}) and SQL Server style ({@code ;password=x}) URLs.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class MaskingLogUtil {

    private static final Pattern JDBC_AUTH_PATTERN =
            Pattern.compile("(jdbc:[^:]+://[^:/?#;]+:)([^@/]+)(@.*)", Pattern.CASE_INSENSITIVE);

    private static final Pattern PASSWORD_PROPERTY_PATTERN =
            Pattern.compile("(?i)(password=)([^;&]+)");

    private MaskingLogUtil() {}

    /**
     * Masks password-like fragments in a JDBC URL.
     *
     * @param url JDBC URL
     * @return masked URL, or {@code null} when input is {@code null}
     */
    public static String maskJdbcUrl(String url) {
        if (url == null) {
            return null;
        }
        String masked = url;
        Matcher authMatcher = JDBC_AUTH_PATTERN.matcher(masked);
        if (authMatcher.find()) {
            masked = authMatcher.replaceFirst("$1***$3");
        }
        return PASSWORD_PROPERTY_PATTERN.matcher(masked).replaceAll("$1***");
    }

    /**
     * Formats a store entry for logging with masked sensitive values. The password itself is
     * never printed.
     *
     * @param entry store entry
     * @return formatted log string
     */
    public static String describe(StoreConfig.Entry entry) {
        if (entry == null) {
            return "<null>";
        }
        return "id=" + entry.getId() + ", url=" + maskJdbcUrl(entry.getUrl()) + ", user="
                + entry.getUser() + ", xa=" + (entry.getXaDataSourceClass() != null);
    }
}
