package me.golemcore.warden.domain.loop;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.warden.domain.exception.TransientInfraException;
import me.golemcore.warden.infrastructure.config.WardenProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeoutException;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;

/**
 * Exponential backoff for transient failures: {@code initial * 2^attempt}
 * capped at the configured maximum, scaled by a random factor within
 * {@code 1 +/- jitter}.
 */
@Component
@Slf4j
public class RetryPolicy {

    /**
     * Sleep hook, replaced in tests.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final WardenProperties.RetryProperties properties;
    private final Sleeper sleeper;
    private final DoubleSupplier random;

    @Autowired
    public RetryPolicy(WardenProperties properties) {
        this(properties.getRetry(), Thread::sleep, () -> ThreadLocalRandom.current().nextDouble());
    }

    RetryPolicy(WardenProperties.RetryProperties properties, Sleeper sleeper, DoubleSupplier random) {
        this.properties = properties;
        this.sleeper = sleeper;
        this.random = random;
    }

    /**
     * Runs {@code action}, retrying transient failures until
     * {@code max-attempts} is reached. The last failure is rethrown.
     */
    public <T> T execute(String operation, Supplier<T> action) {
        int attempt = 0;
        while (true) {
            try {
                return action.get();
            } catch (RuntimeException e) {
                attempt++;
                if (!isTransient(e) || attempt >= properties.getMaxAttempts()) {
                    throw e;
                }
                long backoff = backoffMillis(attempt - 1);
                log.warn("[Retry] {} failed (attempt {}/{}), retrying in {}ms: {}", operation, attempt,
                        properties.getMaxAttempts(), backoff, e.getMessage());
                sleep(backoff);
            }
        }
    }

    public int getMaxAttempts() {
        return Math.max(1, properties.getMaxAttempts());
    }

    public long backoffMillis(int attempt) {
        long base = properties.getInitialBackoffMs() * (1L << Math.min(attempt, 30));
        long capped = Math.min(base, properties.getMaxBackoffMs());
        double jitter = properties.getJitter();
        double factor = 1.0 - jitter + random.getAsDouble() * 2 * jitter;
        return Math.max(0L, (long) (capped * factor));
    }

    /**
     * Sleeps for a backoff delay.
     *
     * @throws CancellationException
     *             if the thread is interrupted while waiting
     */
    public void sleep(long millis) {
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted during retry backoff");
        }
    }

    /**
     * Network errors, timeouts and provider overload responses are transient.
     */
    public static boolean isTransient(Throwable error) {
        Throwable cursor = error;
        int depth = 0;
        while (cursor != null && depth++ < 8) {
            if (cursor instanceof TransientInfraException || cursor instanceof IOException
                    || cursor instanceof UncheckedIOException || cursor instanceof TimeoutException) {
                return true;
            }
            String message = cursor.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                if (lower.contains("429") || lower.contains("502") || lower.contains("503")
                        || lower.contains("timeout") || lower.contains("timed out") || lower.contains("connection")) {
                    return true;
                }
            }
            if (cursor.getCause() == cursor) {
                break;
            }
            cursor = cursor.getCause();
        }
        return false;
    }
}
