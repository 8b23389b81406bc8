package com.poc.chmigrator.util;

import java.io.IOException;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;

/**
 * Classifies failures that are worth retrying: dropped connections, timeouts and
 * other network trouble anywhere in the cause chain.
 */
public final class TransientErrors {

    /**
     * SQLSTATE class 08 is "connection exception".
     */
    private static final String CONNECTION_STATE_CLASS = "08";

    private TransientErrors() {
        // Utility class - prevent instantiation
    }

    public static boolean isTransient(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 16) {
            if (current instanceof SQLTransientException
                    || current instanceof SQLRecoverableException
                    || current instanceof SQLNonTransientConnectionException
                    || current instanceof IOException) {
                return true;
            }
            if (current instanceof SQLException) {
                String state = ((SQLException) current).getSQLState();
                if (state != null && state.startsWith(CONNECTION_STATE_CLASS)) {
                    return true;
                }
            }
            current = current.getCause();
        }
        return false;
    }
}
