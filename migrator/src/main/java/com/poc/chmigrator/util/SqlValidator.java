package com.poc.chmigrator.util;

import java.util.regex.Pattern;

/**
 * Utility class for identifier validation and quoting. Table and column names are
 * interpolated into MySQL and ClickHouse statements, so they are checked first.
 */
public class SqlValidator {
    
    /**
     * Letters, digits, underscores, hyphens and dollar signs; no quotes, spaces or semicolons.
     */
    private static final Pattern IDENTIFIER = Pattern.compile("^[a-zA-Z0-9_$-]{1,64}$");
    
    private SqlValidator() {
        // Utility class - prevent instantiation
    }
    
    public static boolean isValidIdentifier(String identifier) {
        return identifier != null && IDENTIFIER.matcher(identifier).matches();
    }
    
    /**
     * Throws exception if table name is invalid.
     */
    public static void validateTableName(String tableName) {
        if (!isValidIdentifier(tableName)) {
            throw new IllegalArgumentException("Invalid table name: " + tableName);
        }
    }
    
    /**
     * Throws exception if database name is invalid.
     */
    public static void validateDatabaseName(String databaseName) {
        if (!isValidIdentifier(databaseName)) {
            throw new IllegalArgumentException("Invalid database name: " + databaseName);
        }
    }
    
    /**
     * Backtick-quotes an identifier for MySQL and ClickHouse. Column names come from
     * the source catalog and may contain characters the table rules reject, so
     * embedded backticks are escaped instead of refused.
     */
    public static String quote(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be empty");
        }
        return "`" + identifier.replace("`", "``") + "`";
    }
    
    /**
     * Validates and quotes {@code database.table}.
     */
    public static String qualifiedTable(String database, String table) {
        validateDatabaseName(database);
        validateTableName(table);
        return quote(database) + "." + quote(table);
    }
}
