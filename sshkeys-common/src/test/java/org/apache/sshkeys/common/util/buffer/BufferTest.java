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

package org.apache.sshkeys.common.util.buffer;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.math.BigInteger;
import java.nio.charset.CharacterCodingException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.sshkeys.util.test.JUnitTestSupport;
import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@TestMethodOrder(MethodName.class)
@Tag("NoIoTestCase")
class BufferTest extends JUnitTestSupport {
    BufferTest() {
        super();
    }

    @Test
    void getLong() throws Exception {
        long expected = 1234567890123456789L;

        try (ByteArrayOutputStream stream = new ByteArrayOutputStream()) {
            try (DataOutputStream ds = new DataOutputStream(stream)) {
                ds.writeLong(expected);
            }

            Buffer buffer = new ByteArrayBuffer(stream.toByteArray());
            assertEquals(expected, buffer.getLong(), "Mismatched recovered value");
        }
    }

    @Test
    void unsignedLongSurvivesWriteRead() {
        Buffer buffer = new ByteArrayBuffer();
        buffer.putLong(-1L);
        assertArrayEquals(new byte[] { -1, -1, -1, -1, -1, -1, -1, -1 }, buffer.getCompactData());
        assertEquals(-1L, buffer.getLong());
    }

    @Test
    void stringIsLengthPrefixedInBytes() {
        Buffer buffer = new ByteArrayBuffer();
        buffer.putString("été");
        byte[] data = buffer.getCompactData();
        assertEquals(4 + 5, data.length, "Length must count UTF-8 bytes");
        assertEquals(5L, BufferUtils.getUInt(data, 0, data.length));
        assertEquals("été", buffer.getString());
    }

    @Test
    void nameListRoundTrip() {
        List<String> names = Arrays.asList("ssh-ed25519", "ssh-rsa", "ecdsa-sha2-nistp256");
        Buffer buffer = new ByteArrayBuffer();
        buffer.putNameList(names);
        buffer.putNameList(Collections.emptyList());
        assertEquals(names, buffer.getNameList());
        assertEquals(Collections.emptyList(), buffer.getNameList());
    }

    @Test
    void mpintZeroIsEmptyString() {
        Buffer buffer = new ByteArrayBuffer();
        buffer.putMPInt(BigInteger.ZERO);
        assertArrayEquals(new byte[4], buffer.getCompactData());
        assertEquals(BigInteger.ZERO, buffer.getMPInt());
    }

    @Test
    void mpintWithHighBitIsPadded() {
        Buffer buffer = new ByteArrayBuffer();
        buffer.putMPInt(new byte[] { (byte) 0x80, 0x01 });
        assertArrayEquals(new byte[] { 0, 0, 0, 3, 0, (byte) 0x80, 0x01 }, buffer.getCompactData());
        assertEquals(BigInteger.valueOf(0x8001), buffer.getMPInt());
    }

    @Test
    void truncatedStringIsRejected() {
        Buffer buffer = new ByteArrayBuffer(new byte[] { 0, 0, 0, 10, 'a', 'b' });
        assertThrows(BufferException.class, buffer::getBytes);
    }

    @Test
    void checkEndDetectsTrailingData() {
        Buffer buffer = new ByteArrayBuffer(new byte[] { 0, 0, 0, 1, 'a', 'b' });
        buffer.getBytes();
        assertThrows(BufferException.class, buffer::checkEnd);
        buffer.getByte();
        buffer.checkEnd();
    }

    @Test
    void strictStringRejectsMalformedUtf8() {
        Buffer buffer = new ByteArrayBuffer(new byte[] { 0, 0, 0, 2, (byte) 0xC3, 0x28 });
        assertThrows(CharacterCodingException.class, buffer::getStrictString);
    }

    @Test
    void bytesConsumedTracksReadPosition() {
        Buffer buffer = new ByteArrayBuffer();
        buffer.putString("abc");
        buffer.putInt(7);
        buffer.getString();
        assertArrayEquals(new byte[] { 0, 0, 0, 3, 'a', 'b', 'c' }, buffer.getBytesConsumed());
        assertArrayEquals(new byte[] { 0, 0, 0, 7 }, buffer.getRemainingBytes());
        assertEquals(0, buffer.available());
    }
}
