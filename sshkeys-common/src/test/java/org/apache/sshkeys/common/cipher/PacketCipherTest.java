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

package org.apache.sshkeys.common.cipher;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;

import org.apache.sshkeys.common.util.NumberUtils;
import org.apache.sshkeys.util.test.JUnitTestSupport;
import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.TestMethodOrder;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

@TestMethodOrder(MethodName.class)
@Tag("NoIoTestCase")
class PacketCipherTest extends JUnitTestSupport {
    PacketCipherTest() {
        super();
    }

    static Collection<BuiltinCiphers> parameters() {
        return EnumSet.allOf(BuiltinCiphers.class);
    }

    @MethodSource("parameters")
    @ParameterizedTest(name = "{0}")
    void encryptThenDecrypt(BuiltinCiphers type) throws Exception {
        PacketCipher cipher = new PacketCipher(
                type, keyMaterial(type.getKdfSize(), 1), keyMaterial(type.getIVSize(), 7));
        byte[] plain = paddedPlaintext(type);

        PacketCipher.EncryptedPacket packet = cipher.encryptPacket(0L, null, plain);
        assertEquals(type.getAuthenticationTagSize(), NumberUtils.length(packet.getMac()), "Tag size");
        assertFalse(Arrays.equals(plain, packet.getCiphertext()), "Data not encrypted");

        byte[] recovered = cipher.decryptPacket(0L, null, packet.getCiphertext(), 0, packet.getMac());
        assertArrayEquals(plain, recovered, "Mismatched recovered data");
    }

    @MethodSource("parameters")
    @ParameterizedTest(name = "{0}")
    void tamperedCiphertextFailsAuthentication(BuiltinCiphers type) throws Exception {
        if (type.getAuthenticationTagSize() <= 0) {
            return;
        }

        PacketCipher cipher = new PacketCipher(
                type, keyMaterial(type.getKdfSize(), 3), keyMaterial(type.getIVSize(), 5));
        PacketCipher.EncryptedPacket packet = cipher.encryptPacket(0L, null, paddedPlaintext(type));
        byte[] data = packet.getCiphertext();
        data[data.length / 2] ^= 0x01;
        assertNull(cipher.decryptPacket(0L, null, data, 0, packet.getMac()), "Tampered data must not decrypt");
    }

    private static byte[] keyMaterial(int len, int seed) {
        byte[] key = new byte[len];
        for (int index = 0; index < len; index++) {
            key[index] = (byte) (index * seed + 11);
        }
        return key;
    }

    private static byte[] paddedPlaintext(CipherInformation type) {
        byte[] text = PacketCipherTest.class.getName().getBytes(StandardCharsets.UTF_8);
        return Arrays.copyOf(text, NumberUtils.roundUp(text.length, type.getCipherBlockSize()));
    }
}
