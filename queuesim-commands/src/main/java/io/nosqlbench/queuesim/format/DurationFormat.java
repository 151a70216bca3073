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

package io.nosqlbench.queuesim.format;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Conversion between durations in seconds and human-readable text.
///
/// Accepted input is either a plain number of seconds, like `90` or `12.5`,
/// or a sequence of `<number><unit>` terms, like `1m 30s` or `1h30m`:
///
/// | unit | spellings |
/// |------|-----------|
/// | nanoseconds | `ns`, `nsec`, `nanos` |
/// | microseconds | `us`, `usec`, `micros` |
/// | milliseconds | `ms`, `msec`, `millis` |
/// | seconds | `s`, `sec`, `secs`, `second`, `seconds` |
/// | minutes | `m`, `min`, `mins`, `minute`, `minutes` |
/// | hours | `h`, `hr`, `hrs`, `hour`, `hours` |
/// | days | `d`, `day`, `days` |
/// | weeks | `w`, `week`, `weeks` |
public final class DurationFormat {

    private static final Pattern PLAIN_SECONDS = Pattern.compile("[+-]?\\d+(?:\\.\\d+)?(?:[eE][+-]?\\d+)?");
    private static final Pattern TERM = Pattern.compile("\\s*(\\d+(?:\\.\\d+)?)\\s*([a-zA-Z]+)\\s*");
    private static final int FIXED_WIDTH = 30;

    private DurationFormat() {
    }

    /// Read a duration.
    /// @param text a plain number of seconds or a sequence of unit terms
    /// @return the duration in seconds
    /// @throws DurationFormatException if the text is not a duration
    public static double parse(String text) {
        if (text == null || text.isBlank()) {
            throw new DurationFormatException(String.valueOf(text), "A duration must not be empty.");
        }
        String trimmed = text.trim();
        if (PLAIN_SECONDS.matcher(trimmed).matches()) {
            return Double.parseDouble(trimmed);
        }

        Matcher matcher = TERM.matcher(trimmed);
        double total = 0.0d;
        int position = 0;
        while (position < trimmed.length()) {
            if (!matcher.find(position) || matcher.start() != position) {
                throw new DurationFormatException(text,
                    "Expected human-readable format (e.g., '1m 30s') or a number of seconds.");
            }
            total += Double.parseDouble(matcher.group(1)) * unitSeconds(text, matcher.group(2));
            position = matcher.end();
        }
        return total;
    }

    private static double unitSeconds(String text, String unit) {
        switch (unit.toLowerCase(Locale.ROOT)) {
            case "ns":
            case "nsec":
            case "nanos":
                return 1e-9d;
            case "us":
            case "usec":
            case "micros":
                return 1e-6d;
            case "ms":
            case "msec":
            case "millis":
                return 1e-3d;
            case "s":
            case "sec":
            case "secs":
            case "second":
            case "seconds":
                return 1.0d;
            case "m":
            case "min":
            case "mins":
            case "minute":
            case "minutes":
                return 60.0d;
            case "h":
            case "hr":
            case "hrs":
            case "hour":
            case "hours":
                return 3600.0d;
            case "d":
            case "day":
            case "days":
                return 86_400.0d;
            case "w":
            case "week":
            case "weeks":
                return 604_800.0d;
            default:
                throw new DurationFormatException(text, "Unknown time unit '" + unit + "'.");
        }
    }

    /// Format a duration compactly, rounded to milliseconds.
    ///
    /// `90.0` becomes `1m 30s`, zero becomes `0s`. Negative durations are
    /// formatted as zero.
    /// @param seconds the duration in seconds
    /// @return the non-zero components, largest first
    public static String format(double seconds) {
        long totalMillis = Math.round(Math.max(0.0d, seconds) * 1000.0d);
        if (totalMillis == 0L) {
            return "0s";
        }
        long millis = totalMillis % 1000;
        long totalSecs = totalMillis / 1000;
        long secs = totalSecs % 60;
        long totalMins = totalSecs / 60;
        long mins = totalMins % 60;
        long totalHours = totalMins / 60;
        long hours = totalHours % 24;
        long days = totalHours / 24;

        List<String> parts = new ArrayList<>();
        if (days > 0) {
            parts.add(days + "d");
        }
        if (hours > 0) {
            parts.add(hours + "h");
        }
        if (mins > 0) {
            parts.add(mins + "m");
        }
        if (secs > 0) {
            parts.add(secs + "s");
        }
        if (millis > 0) {
            parts.add(millis + "ms");
        }
        return String.join(" ", parts);
    }

    /// Format a duration for column output, right aligned in 30 characters.
    ///
    /// Components are years, months of 30 days, days, hours, minutes,
    /// seconds and milliseconds. The leading component is unpadded and every
    /// following one is zero padded, so `3723.5` becomes `1h 02min 03s 500ms`.
    /// Trailing zero components are dropped. Negative input gives `INVALID`.
    /// @param seconds the duration in seconds
    /// @return the formatted text, exactly 30 characters unless it overflows
    public static String formatFixedWidth(double seconds) {
        if (seconds < 0.0d || Double.isNaN(seconds)) {
            return pad("INVALID");
        }
        long totalMillis = Math.round(seconds * 1000.0d);
        long millis = totalMillis % 1000;
        long totalSecs = totalMillis / 1000;
        long totalMins = totalSecs / 60;
        long totalHours = totalMins / 60;
        long totalDays = totalHours / 24;
        long totalMonths = totalDays / 30;

        long[] values = {totalMonths / 12, totalMonths % 12, totalDays % 30, totalHours % 24,
            totalMins % 60, totalSecs % 60, millis};
        String[] suffixes = {"y", "m", "d", "h", "min", "s", "ms"};
        int[] widths = {4, 2, 2, 2, 2, 2, 3};

        List<String> parts = new ArrayList<>();
        boolean started = false;
        for (int i = 0; i < values.length; i++) {
            boolean restNonZero = false;
            for (int j = i + 1; j < values.length; j++) {
                restNonZero |= values[j] > 0;
            }
            if (values[i] > 0 || (started && restNonZero)) {
                if (started || i == 0) {
                    parts.add(String.format(Locale.ROOT, "%0" + widths[i] + "d%s", values[i], suffixes[i]));
                } else {
                    parts.add(values[i] + suffixes[i]);
                }
                started = true;
            }
        }
        if (parts.isEmpty()) {
            parts.add("0ms");
        }
        return pad(String.join(" ", parts));
    }

    private static String pad(String text) {
        return String.format(Locale.ROOT, "%" + FIXED_WIDTH + "s", text);
    }
}
