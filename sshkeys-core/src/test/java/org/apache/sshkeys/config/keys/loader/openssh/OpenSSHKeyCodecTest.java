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


package org.apache.sshkeys.config.keys.loader.openssh;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import org.apache.sshkeys.common.util.buffer.Buffer;
import org.apache.sshkeys.common.util.buffer.ByteArrayBuffer;
import org.apache.sshkeys.config.keys.KeyEncryptionException;
import org.apache.sshkeys.config.keys.KeyImportException;
import org.apache.sshkeys.config.keys.SshKey;
import org.apache.sshkeys.config.keys.SshKeys;
import org.apache.sshkeys.config.keys.loader.PrivateKeyEncryptionContext;
import org.apache.sshkeys.config.keys.loader.openssh.kdf.BCryptKdfOptions;
import org.apache.sshkeys.util.test.JUnitTestSupport;
import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Reads private keys written by {@code ssh-keygen} with each of the ciphers it offers
 */
@TestMethodOrder(MethodName.class)
class OpenSSHKeyCodecTest extends JUnitTestSupport {
    OpenSSHKeyCodecTest() {
        super();
    }

    static List<String> parameters() {
        return Arrays.asList("ed25519-aes256-ctr", "ed25519-chacha20", "ecdsa-aes256-gcm");
    }

    @MethodSource("parameters")
    @ParameterizedTest(name = "{0}")
    void decryptKeygenFile(String name) throws Exception {
        SshKey key = SshKeys.importPrivateKey(getTestResourceBytes(name), "secret");
        SshKey expected = SshKeys.importPublicKey(getTestResourceBytes(name + ".pub"));
        assertArrayEquals(expected.getPublicData(), key.getPublicData(), "Mismatched public data");
        assertEquals(expected.getComment(), key.getComment(), "Mismatched comment");

        byte[] sig = key.sign(name.getBytes(StandardCharsets.UTF_8), key.getSigAlgorithms().get(0));
        assertTrue(expected.verify(name.getBytes(StandardCharsets.UTF_8), sig), "Signature not verified by public key");
    }

    @MethodSource("parameters")
    @ParameterizedTest(name = "{0}")
    void wrongPassphraseIsEncryptionError(String name) throws Exception {
        byte[] data = getTestResourceBytes(name);
        assertThrows(KeyEncryptionException.class, () -> SshKeys.importPrivateKey(data, "not-the-secret"));
        KeyImportException e = assertThrows(KeyImportException.class, () -> SshKeys.importPrivateKey(data, null));
        assertTrue(e.getMessage().startsWith("Passphrase"), e.getMessage());
    }

    @MethodSource("parameters")
    @ParameterizedTest(name = "{0}")
    void publicKeyFromEncryptedFile(String name) throws Exception {
        // the public part of an OpenSSH container is readable without the passphrase
        SshKey pub = SshKeys.importPublicKey(getTestResourceBytes(name));
        SshKey expected = SshKeys.importPublicKey(getTestResourceBytes(name + ".pub"));
        assertArrayEquals(expected.getPublicData(), pub.getPublicData());
    }

    @Test
    void unencryptedKeygenFiles() throws Exception {
        SshKey rsa = SshKeys.importPrivateKey(getTestResourceBytes("rsa-plain"), null);
        assertEquals("ssh-rsa", rsa.getAlgorithm());
        assertEquals("rsa@test", rsa.getComment());

        SshKey ecdsa = SshKeys.importPrivateKey(getTestResourceBytes("ecdsa384-plain"), null);
        assertEquals("ecdsa-sha2-nistp384", ecdsa.getAlgorithm());
        assertNull(ecdsa.getComment(), "Unexpected comment");
        assertArrayEquals(SshKeys.importPublicKey(getTestResourceBytes("ecdsa384-plain.pub")).getPublicData(),
                ecdsa.getPublicData());
    }

    @Test
    void reEncryptWithEachCipher() throws Exception {
        SshKey key = SshKeys.importPrivateKey(getTestResourceBytes("rsa-plain"), null);
        for (String cipher : Arrays.asList("aes128-ctr", "aes256-ctr", "aes256-cbc", "aes128-gcm@openssh.com",
                "aes256-gcm@openssh.com", "chacha20-poly1305@openssh.com")) {
            PrivateKeyEncryptionContext context = new PrivateKeyEncryptionContext(getCurrentTestName(), cipher);
            context.setKdfRounds(2);
            byte[] exported = key.exportPrivateKey(SshKey.FORMAT_OPENSSH, context);
            assertEquals(key, SshKeys.importPrivateKey(exported, getCurrentTestName()), cipher);
            assertThrows(KeyEncryptionException.class, () -> SshKeys.importPrivateKey(exported, cipher), cipher);
        }
    }

    @Test
    void corruptedContainer() throws Exception {
        byte[] data = getTestResourceBytes("rsa-plain");
        String text = new String(data);
        String corrupted = text.replace("b3BlbnNzaC1rZXktdjEAAAAA", "b3BlbnNzaC1rZXktdjIAAAAA");
        assertThrows(KeyImportException.class, () -> SshKeys.importPrivateKey(corrupted, null));
    }

    @Test
    void unusableKdfOptionsAreEncryptionErrors() throws Exception {
        SshKey key = SshKeys.generatePrivateKey("ssh-ed25519");
        byte[] zeroRounds = container(key, new BCryptKdfOptions(new byte[BCryptKdfOptions.DEFAULT_SALT_SIZE], 0));
        KeyEncryptionException rounds = assertThrows(KeyEncryptionException.class,
                () -> OpenSSHKeyCodec.INSTANCE.decodePrivateKey(zeroRounds, "passphrase"));
        assertTrue(rounds.getMessage().startsWith("Bad rounds value"), rounds.getMessage());

        byte[] noSalt = container(key, new BCryptKdfOptions(new byte[0], 16));
        assertThrows(KeyEncryptionException.class,
                () -> OpenSSHKeyCodec.INSTANCE.decodePrivateKey(noSalt, "passphrase"));
    }

    private static byte[] container(SshKey key, BCryptKdfOptions options) {
        Buffer buffer = new ByteArrayBuffer();
        buffer.putRawBytes((OpenSSHKeyCodec.AUTH_MAGIC + "\0").getBytes(StandardCharsets.US_ASCII));
        buffer.putString("aes256-ctr");
        buffer.putString(BCryptKdfOptions.NAME);
        buffer.putBytes(options.encode());
        buffer.putUInt(1L);
        buffer.putBytes(key.getPublicData());
        buffer.putBytes(new byte[32]);
        return buffer.getCompactData();
    }
}
