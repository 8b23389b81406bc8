package com.poc.chmigrator.engine;

import com.poc.chmigrator.util.Formats;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Logs a progress bar with throughput and ETA while a table streams. Lines are
 * emitted for the first batch, every tenth batch, and whenever the configured
 * interval has passed.
 */
@Slf4j
class ProgressReporter {

    private static final int BAR_WIDTH = 40;

    private final String table;
    private final long expectedRows;
    private final long expectedBatches;
    private final Duration interval;
    private final Instant start;

    private Instant lastLog;
    private long rowsAtLastLog;

    ProgressReporter(String table, long expectedRows, int batchSize, Duration interval) {
        this.table = table;
        this.expectedRows = expectedRows;
        this.expectedBatches = expectedRows > 0 ? (expectedRows + batchSize - 1) / batchSize : 0;
        this.interval = interval;
        this.start = Instant.now();
        this.lastLog = start;
        log.info("[INFO] Migration plan for {}:", table);
        log.info("  - Total rows: {}", expectedRows >= 0 ? Formats.number(expectedRows) : "unknown");
        log.info("  - Batch size: {}", Formats.number(batchSize));
        log.info("  - Total batches: {}", Formats.number(expectedBatches));
    }

    void batchWritten(int batchCount, long rowsWritten) {
        Instant now = Instant.now();
        boolean due = Duration.between(lastLog, now).compareTo(interval) >= 0
            || batchCount % 10 == 0
            || batchCount == 1;
        if (!due) {
            return;
        }

        double elapsedSeconds = Math.max(Duration.between(start, now).toMillis(), 1) / 1000.0;
        double recentSeconds = Math.max(Duration.between(lastLog, now).toMillis(), 1) / 1000.0;
        long recentSpeed = (long) ((rowsWritten - rowsAtLastLog) / recentSeconds);
        long averageSpeed = (long) (rowsWritten / elapsedSeconds);

        if (expectedRows > 0) {
            double progress = Math.min(100.0, rowsWritten * 100.0 / expectedRows);
            long remaining = Math.max(expectedRows - rowsWritten, 0);
            Duration eta = averageSpeed > 0 ? Duration.ofSeconds(remaining / averageSpeed) : Duration.ofSeconds(-1);
            log.info("[PROGRESS] [{}] {}% | {}/{} rows | Batch {}/{} | Speed: {} rows/s | ETA: {}",
                    bar(progress), String.format(Locale.ROOT, "%.2f", progress),
                    Formats.number(rowsWritten), Formats.number(expectedRows),
                    Formats.number(batchCount), Formats.number(expectedBatches),
                    Formats.number(recentSpeed), Formats.duration(eta));
        } else {
            log.info("[PROGRESS] {} | {} rows | Batch {} | Speed: {} rows/s",
                    table, Formats.number(rowsWritten), Formats.number(batchCount), Formats.number(recentSpeed));
        }
        lastLog = now;
        rowsAtLastLog = rowsWritten;
    }

    void finished(long rowsWritten) {
        Duration elapsed = Duration.between(start, Instant.now());
        long millis = Math.max(elapsed.toMillis(), 1);
        log.info("[STATS] {} | Rows: {} | Time: {} | Speed: {} rows/s", table,
                Formats.number(rowsWritten), Formats.duration(elapsed),
                Formats.number(rowsWritten * 1000 / millis));
    }

    private static String bar(double progress) {
        int filled = (int) (BAR_WIDTH * progress / 100);
        if (filled >= BAR_WIDTH) {
            return "=".repeat(BAR_WIDTH);
        }
        return "=".repeat(filled) + ">" + ".".repeat(BAR_WIDTH - filled - 1);
    }
}
