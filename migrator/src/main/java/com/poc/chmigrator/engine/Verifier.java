package com.poc.chmigrator.engine;

import com.poc.chmigrator.engine.model.VerificationResult;
import com.poc.chmigrator.engine.port.DestinationDatabase;
import com.poc.chmigrator.engine.port.SourceDatabase;
import com.poc.chmigrator.exception.VerificationException;
import com.poc.chmigrator.util.Formats;
import lombok.extern.slf4j.Slf4j;

import java.sql.SQLException;

/**
 * Compares source and destination row counts of a migrated table. A mismatch is
 * reported, never retried.
 */
@Slf4j
public class Verifier {

    public VerificationResult verify(String sourceTable, String destinationTable,
                                     SourceDatabase source, DestinationDatabase destination) {
        long sourceCount;
        long destinationCount;
        try {
            sourceCount = source.countRows(sourceTable);
        } catch (SQLException e) {
            throw new VerificationException("Count query failed for source table " + sourceTable
                + ": " + e.getMessage(), e);
        }
        try {
            destinationCount = destination.countRows(destinationTable);
        } catch (SQLException e) {
            throw new VerificationException("Count query failed for destination table " + destinationTable
                + ": " + e.getMessage(), e);
        }

        VerificationResult result = VerificationResult.of(sourceCount, destinationCount);
        log.info("[VERIFY] MySQL: {} | ClickHouse: {}",
                Formats.number(sourceCount), Formats.number(destinationCount));
        if (result.match()) {
            log.info("  ✓ PASS - {} rows", Formats.number(sourceCount));
        } else {
            log.error("  ✗ FAIL - {} != {}. Diff: {}", Formats.number(sourceCount),
                    Formats.number(destinationCount), Formats.number(result.difference()));
        }
        return result;
    }
}
