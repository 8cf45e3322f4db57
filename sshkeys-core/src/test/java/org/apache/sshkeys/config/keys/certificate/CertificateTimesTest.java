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
import java.time.Instant;
import java.time.ZoneOffset;

import org.apache.sshkeys.util.test.JUnitTestSupport;
import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@TestMethodOrder(MethodName.class)
class CertificateTimesTest extends JUnitTestSupport {
    private static final long NOW = 1700000000L;
    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC);

    CertificateTimesTest() {
        super();
    }

    @Test
    void absoluteTimes() {
        assertEquals(NOW, CertificateTimes.parseTime(CertificateTimes.NOW, CLOCK));
        assertEquals(1577836800L, CertificateTimes.parseTime("20200101", CLOCK));
        assertEquals(1577880000L, CertificateTimes.parseTime("20200101120000", CLOCK));
    }

    @Test
    void relativeTimes() {
        assertEquals(NOW + 3600L, CertificateTimes.parseTime("+1h", CLOCK));
        assertEquals(NOW - 86400L, CertificateTimes.parseTime("-1d", CLOCK));
        assertEquals(NOW + 5400L, CertificateTimes.parseTime("1h30m", CLOCK));
        assertEquals(NOW + 30L, CertificateTimes.parseTime("30", CLOCK));
    }

    @Test
    void intervals() {
        assertEquals(8.0d * 86400.0d, CertificateTimes.parseTimeInterval("1w1d"), 0.0d);
        assertEquals(90.0d, CertificateTimes.parseTimeInterval("1.5m"), 0.0d);
    }

    @Test
    void malformedValues() {
        for (String value : new String[] { "", "yesterday", "1x", "20201301" }) {
            assertThrows(IllegalArgumentException.class, () -> CertificateTimes.parseTime(value, CLOCK), value);
        }
    }
}
