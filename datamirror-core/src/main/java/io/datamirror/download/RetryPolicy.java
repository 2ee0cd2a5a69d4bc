package io.datamirror.download;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.time.Duration;

/// Bounded retry with exponential backoff.
///
/// After failed attempt `k` (counting from 0) the caller waits `baseDelay * 2^k`, but only
/// if another attempt remains. With 3 retries and a 1 second base the waits are 1s and 2s.
///
/// @param retries The total number of attempts, at least 1
/// @param baseDelay The wait after the first failed attempt, not negative
public record RetryPolicy(int retries, Duration baseDelay) {

    public static final RetryPolicy DEFAULT = new RetryPolicy(3, Duration.ofSeconds(1));

    public RetryPolicy {
        if (retries < 1) {
            throw new IllegalArgumentException("retries must be at least 1, was " + retries);
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("retry delay must not be negative, was " + baseDelay);
        }
    }

    /// @param attempt A failed attempt, counting from 0
    /// @return true if another attempt follows it
    public boolean hasAttemptAfter(int attempt) {
        return attempt < retries - 1;
    }

    /// @param attempt A failed attempt, counting from 0
    /// @return the wait before the next attempt
    public Duration delayAfterAttempt(int attempt) {
        return baseDelay.multipliedBy(1L << Math.min(attempt, 30));
    }
}
