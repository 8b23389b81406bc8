package com.poc.chmigrator.util;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.sql.SQLSyntaxErrorException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryUtilTest {

    @Test
    void returnsAsSoonAsAnAttemptSucceeds() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        String result = RetryUtil.executeWithRetry(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new IOException("flaky");
            }
            return "ok";
        }, 5, 0, "flaky op", TransientErrors::isTransient);

        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(3);
    }

    @Test
    void reportsAttemptsWhenExhausted() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> RetryUtil.executeWithRetry(() -> {
            calls.incrementAndGet();
            throw new IOException("down");
        }, 4, 0, "down op", TransientErrors::isTransient))
            .isInstanceOfSatisfying(RetryUtil.RetriesExhaustedException.class,
                e -> assertThat(e.getAttempts()).isEqualTo(4))
            .hasCauseInstanceOf(IOException.class);
        assertThat(calls).hasValue(4);
    }

    @Test
    void rethrowsNonRetryableErrorsImmediately() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> RetryUtil.executeWithRetry(() -> {
            calls.incrementAndGet();
            throw new SQLSyntaxErrorException("bad sql");
        }, 4, 0, "bad op", TransientErrors::isTransient))
            .isInstanceOf(SQLSyntaxErrorException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    void doublesTheDelayUpToTheCap() {
        assertThat(RetryUtil.backoffDelay(2000, 1)).isEqualTo(2000);
        assertThat(RetryUtil.backoffDelay(2000, 2)).isEqualTo(4000);
        assertThat(RetryUtil.backoffDelay(2000, 3)).isEqualTo(8000);
        assertThat(RetryUtil.backoffDelay(2000, 10)).isEqualTo(RetryUtil.MAX_DELAY_MS);
        assertThat(RetryUtil.backoffDelay(0, 3)).isZero();
    }
}
