package io.github.yok.stagemerge.db;

/**
 * Identifier and naming rules for each warehouse dialect.
 */
public interface DialectSqlOperations {

    /**
     * Returns the provider tag (e.g. {@code "POSTGRES"}).
     *
     * @return provider tag
     */
    String getProvider();

    /**
     * Quotes an identifier in dialect style.
     *
     * @param identifier identifier
     * @return quoted identifier
     */
    String quoteIdentifier(String identifier);

    /**
     * Returns the schema-qualified, quoted name of a table.
     *
     * @param namespace schema
     * @param table table
     * @return qualified name
     */
    default String qualify(String namespace, String table) {
        return quoteIdentifier(namespace) + "." + quoteIdentifier(table);
    }

    /**
     * Converts an identifier to the case the provider stores unquoted names in.
     *
     * @param identifier identifier
     * @return provider-cased identifier
     */
    String toProviderCase(String identifier);

    /**
     * Returns the prefix shared by every staging table of this provider.
     *
     * @return staging table prefix
     */
    String getStagingTablePrefix();

    /**
     * Returns the longest identifier the provider keeps without truncation.
     *
     * @return identifier length limit
     */
    int getMaxIdentifierLength();
}
