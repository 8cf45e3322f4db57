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


package org.apache.sshkeys.config.keys.loader.pem;

import java.nio.charset.StandardCharsets;

import org.apache.sshkeys.config.keys.KeyEncryptionException;
import org.apache.sshkeys.config.keys.KeyImportException;
import org.apache.sshkeys.config.keys.SshKey;
import org.apache.sshkeys.config.keys.SshKeys;
import org.apache.sshkeys.config.keys.loader.PrivateKeyEncryptionContext;
import org.apache.sshkeys.util.test.JUnitTestSupport;
import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Reads PKCS#1 and PKCS#8 files written by {@code openssl}
 */
@TestMethodOrder(MethodName.class)
class PKCSKeyCodecTest extends JUnitTestSupport {
    PKCSKeyCodecTest() {
        super();
    }

    @Test
    void plainRsaFiles() throws Exception {
        SshKey expected = SshKeys.importPublicKey(getTestResourceBytes("rsa.pub"));
        SshKey pkcs8 = SshKeys.importPrivateKey(getTestResourceBytes("rsa-pkcs8.pem"), null);
        SshKey pkcs1 = SshKeys.importPrivateKey(getTestResourceBytes("rsa-pkcs1.pem"), null);
        assertArrayEquals(expected.getPublicData(), pkcs8.getPublicData(), "PKCS#8");
        assertArrayEquals(expected.getPublicData(), pkcs1.getPublicData(), "PKCS#1");
        assertArrayEquals(pkcs8.getPrivateData(), pkcs1.getPrivateData(), "Mismatched private data");
    }

    @Test
    void encryptedPkcs8() throws Exception {
        byte[] data = getTestResourceBytes("rsa-pkcs8-enc.pem");
        SshKey key = SshKeys.importPrivateKey(data, "secret");
        SshKey plain = SshKeys.importPrivateKey(getTestResourceBytes("rsa-pkcs8.pem"), null);
        assertEquals(plain, key, "Mismatched decrypted key");

        KeyEncryptionException e = assertThrows(KeyEncryptionException.class,
                () -> SshKeys.importPrivateKey(data, null));
        assertEquals("Passphrase must be specified to import encrypted private keys", e.getMessage());
        assertThrows(KeyImportException.class, () -> SshKeys.importPrivateKey(data, "wrong"));
    }

    @Test
    void encryptedPkcs1() throws Exception {
        byte[] data = getTestResourceBytes("rsa-pkcs1-enc.pem");
        assertTrue(new String(data, StandardCharsets.US_ASCII).contains("DEK-Info: AES-128-CBC"), "Bad fixture");

        SshKey key = SshKeys.importPrivateKey(data, "secret");
        SshKey plain = SshKeys.importPrivateKey(getTestResourceBytes("rsa-pkcs1.pem"), null);
        assertEquals(plain, key, "Mismatched decrypted key");

        assertThrows(KeyEncryptionException.class, () -> SshKeys.importPrivateKey(data, null));
        assertThrows(KeyImportException.class, () -> SshKeys.importPrivateKey(data, "wrong"));
    }

    @Test
    void ecPkcs1AndDerPkcs8() throws Exception {
        SshKey expected = SshKeys.importPublicKey(getTestResourceBytes("ec.pub"));
        SshKey pem = SshKeys.importPrivateKey(getTestResourceBytes("ec-pkcs1.pem"), null);
        SshKey der = SshKeys.importPrivateKey(getTestResourceBytes("ec-pkcs8.der"), null);
        assertEquals("ecdsa-sha2-nistp256", pem.getAlgorithm());
        assertArrayEquals(expected.getPublicData(), pem.getPublicData(), "PEM");
        assertArrayEquals(expected.getPublicData(), der.getPublicData(), "DER");
    }

    @Test
    void ed25519Pkcs8() throws Exception {
        SshKey expected = SshKeys.importPublicKey(getTestResourceBytes("ed25519.pub"));
        SshKey key = SshKeys.importPrivateKey(getTestResourceBytes("ed25519-pkcs8.pem"), null);
        assertEquals("ssh-ed25519", key.getAlgorithm());
        assertArrayEquals(expected.getPublicData(), key.getPublicData());

        byte[] sig = key.sign(expected.getPublicData(), "ssh-ed25519");
        assertTrue(expected.verify(expected.getPublicData(), sig), "Signature not verified");
    }

    @Test
    void pkcs8ExportHashAndCipherChoices() throws Exception {
        SshKey key = SshKeys.importPrivateKey(getTestResourceBytes("ec-pkcs1.pem"), null);
        for (String cipher : new String[] { "aes128-cbc", "aes192-cbc", "aes256-cbc", "des3-cbc" }) {
            for (String hash : new String[] { "sha1", "sha256", "sha512" }) {
                PrivateKeyEncryptionContext context = new PrivateKeyEncryptionContext("secret", cipher);
                context.setHashName(hash);
                byte[] exported = key.exportPrivateKey(SshKey.FORMAT_PKCS8_DER, context);
                assertEquals(key, SshKeys.importPrivateKey(exported, "secret"), cipher + "/" + hash);
            }
        }

        PrivateKeyEncryptionContext pbes1 = new PrivateKeyEncryptionContext("secret", "des3-cbc");
        pbes1.setPbeVersion(1);
        pbes1.setHashName("sha1");
        assertEquals(key, SshKeys.importPrivateKey(key.exportPrivateKey(SshKey.FORMAT_PKCS8_PEM, pbes1), "secret"),
                "PBES1");
    }

    @Test
    void unknownExportCipher() throws Exception {
        SshKey key = SshKeys.importPrivateKey(getTestResourceBytes("ec-pkcs1.pem"), null);
        PrivateKeyEncryptionContext context = new PrivateKeyEncryptionContext("secret", "blowfish-cbc");
        assertThrows(KeyEncryptionException.class, () -> key.exportPrivateKey(SshKey.FORMAT_PKCS8_PEM, context));
        assertThrows(KeyEncryptionException.class, () -> key.exportPrivateKey(SshKey.FORMAT_PKCS1_PEM, context));
    }
}
