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


package org.apache.sshkeys.config.keys;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.sshkeys.common.util.buffer.Buffer;
import org.apache.sshkeys.common.util.buffer.ByteArrayBuffer;
import org.apache.sshkeys.config.keys.impl.DSSKeyHandler;
import org.apache.sshkeys.config.keys.impl.ECCurves;
import org.apache.sshkeys.config.keys.impl.EdDSAKeyHandler;
import org.apache.sshkeys.config.keys.impl.RSAKeyHandler;
import org.apache.sshkeys.config.keys.loader.PrivateKeyEncryptionContext;
import org.apache.sshkeys.util.test.JUnitTestSupport;
import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@TestMethodOrder(MethodName.class)
class SshKeyTest extends JUnitTestSupport {
    private static final byte[] DATA = SshKeyTest.class.getName().getBytes(StandardCharsets.UTF_8);
    private static final Map<String, SshKey> KEYS = new HashMap<>();

    SshKeyTest() {
        super();
    }

    static List<String> parameters() {
        return Arrays.asList(
                EdDSAKeyHandler.ED25519_KEY_TYPE, EdDSAKeyHandler.ED448_KEY_TYPE,
                ECCurves.nistp256.getKeyType(), ECCurves.nistp384.getKeyType(), ECCurves.nistp521.getKeyType(),
                RSAKeyHandler.KEY_TYPE, DSSKeyHandler.KEY_TYPE);
    }

    static synchronized SshKey getKey(String algorithm) throws Exception {
        SshKey key = KEYS.get(algorithm);
        if (key == null) {
            key = SshKeys.generatePrivateKey(algorithm, "test@" + algorithm, null);
            KEYS.put(algorithm, key);
        }
        return key;
    }

    @MethodSource("parameters")
    @ParameterizedTest(name = "{0}")
    void sshPublicEncodingRoundTrip(String algorithm) throws Exception {
        SshKey key = getKey(algorithm);
        assertEquals(algorithm, key.getAlgorithm(), "Mismatched algorithm");

        SshKey decoded = SshKeys.decodeSshPublicKey(key.getPublicData());
        assertFalse(decoded.hasPrivateKey(), "Public data must not yield a private key");
        assertArrayEquals(key.getPublicData(), decoded.getPublicData(), "Mismatched public data");
        assertEquals(key.convertToPublic(), decoded, "Mismatched public key");
        assertKeyEquals(algorithm, key.getPublicKey(), decoded.getPublicKey());
    }

    @MethodSource("parameters")
    @ParameterizedTest(name = "{0}")
    void opensshPublicExportReimport(String algorithm) throws Exception {
        SshKey key = getKey(algorithm);
        String exported = new String(key.exportPublicKey(), StandardCharsets.UTF_8);
        assertTrue(exported.startsWith(algorithm + " "), "Bad export prefix: " + exported);
        assertTrue(exported.endsWith(" test@" + algorithm + "\n"), "Comment not exported: " + exported);

        SshKey imported = SshKeys.importPublicKey(exported);
        assertEquals(algorithm, imported.getAlgorithm(), "Mismatched algorithm");
        assertEquals("test@" + algorithm, imported.getComment(), "Mismatched comment");
        assertEquals(key.getFingerprint(), imported.getFingerprint(), "Fingerprint changed across export/import");
    }

    @MethodSource("parameters")
    @ParameterizedTest(name = "{0}")
    void fingerprintsDependOnHashOnly(String algorithm) throws Exception {
        SshKey key = getKey(algorithm);
        SshKey copy = SshKeys.decodeSshPublicKey(key.getPublicData());
        for (String hash : SshKey.FINGERPRINT_HASHES) {
            assertEquals(key.getFingerprint(hash), copy.getFingerprint(hash), hash);
        }

        assertTrue(key.getFingerprint("sha256").startsWith("SHA256:"), "Bad SHA256 prefix");
        assertTrue(key.getFingerprint("md5").startsWith("MD5:"), "Bad MD5 prefix");
        assertNotEquals(key.getFingerprint("sha1"), key.getFingerprint("sha512"));
        assertThrows(IllegalArgumentException.class, () -> key.getFingerprint("sha3"));
    }

    @MethodSource("parameters")
    @ParameterizedTest(name = "{0}")
    void opensshPrivateRoundTrip(String algorithm) throws Exception {
        SshKey key = getKey(algorithm);
        SshKey imported = SshKeys.importPrivateKey(key.exportPrivateKey(), null);
        assertEquals(key, imported, "Mismatched key");
        assertArrayEquals(key.getPrivateData(), imported.getPrivateData(), "Mismatched private data");
        assertEquals(key.getComment(), imported.getComment(), "Mismatched comment");
    }

    @MethodSource("parameters")
    @ParameterizedTest(name = "{0}")
    void encryptedOpensshPrivateRoundTrip(String algorithm) throws Exception {
        SshKey key = getKey(algorithm);
        PrivateKeyEncryptionContext context = PrivateKeyEncryptionContext.forPassword(getCurrentTestName());
        context.setKdfRounds(4);
        byte[] exported = key.exportPrivateKey(SshKey.FORMAT_OPENSSH, context);

        SshKey imported = SshKeys.importPrivateKey(exported, getCurrentTestName());
        assertArrayEquals(key.getPrivateData(), imported.getPrivateData(), "Mismatched private data");

        assertThrows(KeyEncryptionException.class, () -> SshKeys.importPrivateKey(exported, "wrong"));
        KeyImportException e = assertThrows(KeyImportException.class, () -> SshKeys.importPrivateKey(exported, null));
        assertTrue(e.getMessage().startsWith("Passphrase"), "Unexpected message: " + e.getMessage());
    }

    @MethodSource("parameters")
    @ParameterizedTest(name = "{0}")
    void pkcs8RoundTrip(String algorithm) throws Exception {
        SshKey key = getKey(algorithm);
        for (String format : Arrays.asList(SshKey.FORMAT_PKCS8_DER, SshKey.FORMAT_PKCS8_PEM)) {
            SshKey priv = SshKeys.importPrivateKey(key.exportPrivateKey(format, null), null);
            assertArrayEquals(key.getPrivateData(), priv.getPrivateData(), format + "[private]");

            SshKey pub = SshKeys.importPublicKey(key.exportPublicKey(format));
            assertArrayEquals(key.getPublicData(), pub.getPublicData(), format + "[public]");
        }

        PrivateKeyEncryptionContext context = PrivateKeyEncryptionContext.forPassword("secret");
        byte[] encrypted = key.exportPrivateKey(SshKey.FORMAT_PKCS8_PEM, context);
        assertTrue(new String(encrypted, StandardCharsets.US_ASCII).contains("ENCRYPTED PRIVATE KEY"),
                "Not encrypted");
        assertEquals(key, SshKeys.importPrivateKey(encrypted, "secret"), "Mismatched decrypted key");
        assertThrows(KeyImportException.class, () -> SshKeys.importPrivateKey(encrypted, "wrong"));
    }

    @MethodSource("parameters")
    @ParameterizedTest(name = "{0}")
    void pkcs1RoundTripWhereSupported(String algorithm) throws Exception {
        SshKey key = getKey(algorithm);
        if (algorithm.startsWith("ssh-ed")) {
            assertThrows(KeyExportException.class, () -> key.exportPrivateKey(SshKey.FORMAT_PKCS1_PEM, null));
            assertThrows(KeyExportException.class, () -> key.exportPublicKey(SshKey.FORMAT_PKCS1_DER));
            return;
        }

        for (String format : Arrays.asList(SshKey.FORMAT_PKCS1_DER, SshKey.FORMAT_PKCS1_PEM)) {
            assertEquals(key, SshKeys.importPrivateKey(key.exportPrivateKey(format, null), null), format);
        }

        PrivateKeyEncryptionContext context = new PrivateKeyEncryptionContext("secret", "aes128-cbc");
        byte[] encrypted = key.exportPrivateKey(SshKey.FORMAT_PKCS1_PEM, context);
        assertTrue(new String(encrypted, StandardCharsets.US_ASCII).contains("Proc-Type: 4,ENCRYPTED"),
                "Not encrypted");
        assertEquals(key, SshKeys.importPrivateKey(encrypted, "secret"), "Mismatched decrypted key");
        assertThrows(KeyImportException.class, () -> SshKeys.importPrivateKey(encrypted, "wrong"));
    }

    @MethodSource("parameters")
    @ParameterizedTest(name = "{0}")
    void rfc4716PublicRoundTrip(String algorithm) throws Exception {
        SshKey key = getKey(algorithm);
        byte[] exported = key.exportPublicKey(SshKey.FORMAT_RFC4716);
        assertTrue(new String(exported, StandardCharsets.US_ASCII).startsWith("---- BEGIN SSH2 PUBLIC KEY ----"),
                "Bad RFC4716 header");

        SshKey imported = SshKeys.importPublicKey(exported);
        assertArrayEquals(key.getPublicData(), imported.getPublicData(), "Mismatched public data");
        assertEquals(key.getComment(), imported.getComment(), "Mismatched comment");
    }

    @MethodSource("parameters")
    @ParameterizedTest(name = "{0}")
    void signThenVerify(String algorithm) throws Exception {
        SshKey key = getKey(algorithm);
        SshKey pub = key.convertToPublic();
        for (String sigAlgorithm : key.getSigAlgorithms()) {
            byte[] sig = key.sign(DATA, sigAlgorithm);
            assertTrue(pub.verify(DATA, sig), sigAlgorithm);

            byte[] other = DATA.clone();
            other[0] ^= 0x01;
            assertFalse(pub.verify(other, sig), sigAlgorithm + "[tampered]");
        }

        assertThrows(IllegalArgumentException.class, () -> key.sign(DATA, "no-such-signature"));
        assertThrows(IllegalStateException.class, () -> pub.sign(DATA, key.getSigAlgorithms().get(0)));
    }

    @Test
    void malformedDsaSignatureRejected() throws Exception {
        SshKey key = getKey(DSSKeyHandler.KEY_TYPE);
        byte[] sig = key.sign(DATA, DSSKeyHandler.KEY_TYPE);
        Buffer buffer = new ByteArrayBuffer(sig);
        buffer.getString();
        byte[] blob = buffer.getBytes();

        // s == 0 has no inverse modulo q
        byte[] zeroS = blob.clone();
        Arrays.fill(zeroS, zeroS.length / 2, zeroS.length, (byte) 0);
        assertFalse(key.verify(DATA, encodeSignature(DSSKeyHandler.KEY_TYPE, zeroS)), "zero s");

        byte[] allOnes = new byte[blob.length];
        Arrays.fill(allOnes, (byte) 0xFF);
        assertFalse(key.verify(DATA, encodeSignature(DSSKeyHandler.KEY_TYPE, allOnes)), "out of range");
        assertFalse(key.verify(DATA, encodeSignature(DSSKeyHandler.KEY_TYPE, new byte[blob.length])), "all zero");
    }

    private static byte[] encodeSignature(String algorithm, byte[] blob) {
        Buffer buffer = new ByteArrayBuffer();
        buffer.putString(algorithm);
        buffer.putBytes(blob);
        return buffer.getCompactData();
    }
}
