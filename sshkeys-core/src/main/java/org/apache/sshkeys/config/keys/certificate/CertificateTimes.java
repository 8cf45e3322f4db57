/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements. See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership. The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied. See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package org.apache.sshkeys.config.keys.certificate;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.sshkeys.common.util.ValidateUtils;

/**
 * Parses the validity bounds of certificates. A bound is either a number of seconds since the epoch or one of:
 * <UL>
 * <LI>{@code now}</LI>
 * <LI>an absolute local date {@code YYYYMMDD}</LI>
 * <LI>an absolute local time {@code YYYYMMDDHHMMSS}</LI>
 * <LI>a relative interval added to the current time - e.g., {@code +52w}, {@code -1d}, {@code 1h30m}</LI>
 * </UL>
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public final class CertificateTimes {
    public static final String NOW = "now";

    /**
     * Interval unit suffixes and their value in seconds - an empty suffix means seconds
     */
    public static final Map<String, Long> TIME_UNITS;

    private static final Pattern ABS_DATE = Pattern.compile("\\d{8}");
    private static final Pattern ABS_TIME = Pattern.compile("\\d{14}");
    private static final Pattern INTERVAL_PART = Pattern.compile("([+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+))([A-Za-z]?)");

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("uuuuMMdd", Locale.ROOT);
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("uuuuMMddHHmmss", Locale.ROOT);

    static {
        Map<String, Long> units = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        units.put("", 1L);
        units.put("s", 1L);
        units.put("m", TimeUnit.MINUTES.toSeconds(1L));
        units.put("h", TimeUnit.HOURS.toSeconds(1L));
        units.put("d", TimeUnit.DAYS.toSeconds(1L));
        units.put("w", TimeUnit.DAYS.toSeconds(7L));
        TIME_UNITS = Collections.unmodifiableMap(units);
    }

    private CertificateTimes() {
        throw new UnsupportedOperationException("No instance");
    }

    public static long parseTime(String value) {
        return parseTime(value, Clock.systemDefaultZone());
    }

    /**
     * @param  value                    The time value
     * @param  clock                    The {@link Clock} supplying the current time and zone
     * @return                          The time in seconds since the epoch
     * @throws IllegalArgumentException If the value is not recognized
     */
    public static long parseTime(String value, Clock clock) {
        ValidateUtils.checkTrue(value != null, "Unrecognized time value");
        long now = TimeUnit.MILLISECONDS.toSeconds(clock.millis());
        if (NOW.equals(value)) {
            return now;
        }

        try {
            if (ABS_DATE.matcher(value).matches()) {
                return LocalDate.parse(value, DATE_FORMAT).atStartOfDay(clock.getZone()).toEpochSecond();
            }
            if (ABS_TIME.matcher(value).matches()) {
                return LocalDateTime.parse(value, TIME_FORMAT).atZone(clock.getZone()).toEpochSecond();
            }
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Unrecognized time value", e);
        }

        return (long) (now + parseTimeInterval(value));
    }

    /**
     * @param  value                    A sequence of numbers each followed by an optional unit - e.g., {@code 1w2d}
     * @return                          The total number of seconds
     * @throws IllegalArgumentException If the interval is malformed
     */
    public static double parseTimeInterval(String value) {
        ValidateUtils.checkTrue((value != null) && (!value.isEmpty()), "Unrecognized time value");
        Matcher m = INTERVAL_PART.matcher(value);
        double total = 0.0d;
        int pos = 0;
        while (pos < value.length()) {
            ValidateUtils.checkTrue(m.find(pos) && (m.start() == pos), "Unrecognized time value");
            Long unit = TIME_UNITS.get(m.group(2));
            ValidateUtils.checkTrue(unit != null, "Unrecognized time value");
            total += Double.parseDouble(m.group(1)) * unit;
            pos = m.end();
        }
        return total;
    }
}
