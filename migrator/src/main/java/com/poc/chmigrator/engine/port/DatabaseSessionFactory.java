package com.poc.chmigrator.engine.port;

import java.sql.SQLException;

/**
 * Opens exclusive source and destination handles for one table migration.
 */
public interface DatabaseSessionFactory {

    SourceDatabase openSource() throws SQLException;

    DestinationDatabase openDestination() throws SQLException;
}
