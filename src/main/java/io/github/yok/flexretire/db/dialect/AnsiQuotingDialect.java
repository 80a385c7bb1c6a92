package io.github.yok.flexretire.db.dialect;

/**
 * Base for dialects that quote identifiers with double quotes.
 */
abstract class AnsiQuotingDialect implements SqlDialect {

    @Override
    public String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
