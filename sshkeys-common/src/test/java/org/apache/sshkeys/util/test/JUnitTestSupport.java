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

package org.apache.sshkeys.util.test;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.security.Key;
import java.security.interfaces.DSAKey;
import java.security.interfaces.DSAParams;
import java.security.interfaces.ECKey;
import java.security.interfaces.RSAKey;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.bridge.SLF4JBridgeHandler;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;

/**
 * Common base for the unit tests - test name tracking, resource loading and key comparison helpers
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public abstract class JUnitTestSupport {
    // useful test sizes for keys
    public static final List<Integer> RSA_SIZES = Collections.unmodifiableList(Arrays.asList(1024, 2048, 3072));

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private String currentTestName;

    protected JUnitTestSupport() {
        super();
    }

    @BeforeAll
    public static void replaceJULLoggers() {
        if (!SLF4JBridgeHandler.isInstalled()) {
            SLF4JBridgeHandler.removeHandlersForRootLogger();
            SLF4JBridgeHandler.install();
        }
    }

    @BeforeEach
    public void captureTestName(TestInfo info) {
        currentTestName = info.getTestMethod().map(m -> m.getName()).orElseGet(info::getDisplayName);
    }

    public final String getCurrentTestName() {
        return currentTestName;
    }

    /**
     * @param  name        A resource name relative to the test class package
     * @return             The resource bytes
     * @throws IOException If the resource is missing or cannot be read
     */
    protected byte[] getTestResourceBytes(String name) throws IOException {
        URL url = getClass().getResource(name);
        assertNotNull(url, "Missing test resource: " + name);
        try (InputStream input = url.openStream()) {
            return input.readAllBytes();
        }
    }

    public static void assertKeyEquals(String message, Key expected, Key actual) {
        if (expected == actual) {
            return;
        }

        assertNotNull(actual, message + " - no actual key");
        assertEquals(expected.getAlgorithm(), actual.getAlgorithm(), message + "[algorithm]");

        if (expected instanceof RSAKey) {
            assertEquals(((RSAKey) expected).getModulus(), ((RSAKey) actual).getModulus(), message + "[modulus]");
        } else if (expected instanceof DSAKey) {
            DSAParams p1 = ((DSAKey) expected).getParams();
            DSAParams p2 = ((DSAKey) actual).getParams();
            assertEquals(p1.getP(), p2.getP(), message + "[P]");
            assertEquals(p1.getQ(), p2.getQ(), message + "[Q]");
            assertEquals(p1.getG(), p2.getG(), message + "[G]");
        } else if (expected instanceof ECKey) {
            assertEquals(((ECKey) expected).getParams().getCurve(), ((ECKey) actual).getParams().getCurve(),
                    message + "[curve]");
        }

        assertArrayEquals(expected.getEncoded(), actual.getEncoded(), message + "[encoded]");
    }

    public static <T> T assertObjectInstanceOf(String message, Class<? extends T> expected, Object obj) {
        assertNotNull(obj, message + " - no actual object");
        if (!expected.isInstance(obj)) {
            assertSame(expected, obj.getClass(), message + " - mismatched type");
        }
        return Objects.requireNonNull(expected.cast(obj));
    }
}
