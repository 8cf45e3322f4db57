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

package org.apache.sshkeys.common.digest;

import java.nio.charset.StandardCharsets;

import org.apache.sshkeys.util.test.JUnitTestSupport;
import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

@TestMethodOrder(MethodName.class)
@Tag("NoIoTestCase")
class DigestUtilsTest extends JUnitTestSupport {
    private static final byte[] DATA = "abc".getBytes(StandardCharsets.US_ASCII);

    DigestUtilsTest() {
        super();
    }

    @Test
    void md5FingerprintIsColonSeparatedHex() {
        assertEquals("MD5:90:01:50:98:3c:d2:4f:b0:d6:96:3f:7d:28:e1:7f:72",
                DigestUtils.getFingerPrint(BuiltinDigests.md5, DATA));
    }

    @Test
    void sha256FingerprintIsUnpaddedBase64() {
        String fp = DigestUtils.getFingerPrint(BuiltinDigests.sha256, DATA);
        assertEquals("SHA256:ungWv48Bz+pBQUDeXa4iI7ADYaOWF3qctBD/YfIAFa0", fp);
        assertFalse(fp.endsWith("="), "Padding not stripped");
    }

    @Test
    void fromFactoryNameIsCaseInsensitive() {
        for (BuiltinDigests d : BuiltinDigests.VALUES) {
            assertSame(d, BuiltinDigests.fromFactoryName(d.getName().toUpperCase()));
            assertEquals(d.getDigestSize(), d.create().getDigestLength(), d.getName());
        }
        assertNull(BuiltinDigests.fromFactoryName("sha3"));
        assertTrue(BuiltinDigests.VALUES.contains(BuiltinDigests.sha512));
    }
}
