package com.poc.chmigrator.engine.model;

/**
 * Row counts of both sides of a migrated table.
 */
public record VerificationResult(long sourceCount, long destinationCount, boolean match) {

    public static VerificationResult of(long sourceCount, long destinationCount) {
        return new VerificationResult(sourceCount, destinationCount, sourceCount == destinationCount);
    }

    public long difference() {
        return Math.abs(sourceCount - destinationCount);
    }
}
