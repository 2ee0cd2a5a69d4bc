package io.datamirror.command.common;

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

import picocli.CommandLine;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.format.DateTimeParseException;

/**
 * Converts option values to {@link Duration}s.
 * Accepts ISO-8601 durations such as {@code PT1.5S} and plain seconds such as {@code 1.5}.
 */
public class DurationConverter implements CommandLine.ITypeConverter<Duration> {

    @Override
    public Duration convert(String value) {
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            throw new CommandLine.TypeConversionException("empty duration");
        }
        if (Character.toUpperCase(trimmed.charAt(0)) == 'P') {
            try {
                return Duration.parse(trimmed);
            } catch (DateTimeParseException e) {
                throw new CommandLine.TypeConversionException("'" + value + "' is not an ISO-8601 duration");
            }
        }
        try {
            BigDecimal seconds = new BigDecimal(trimmed);
            return Duration.ofNanos(seconds.movePointRight(9).longValueExact());
        } catch (NumberFormatException | ArithmeticException e) {
            throw new CommandLine.TypeConversionException("'" + value + "' is not a number of seconds");
        }
    }
}
