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
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.apache.sshkeys.common.util.buffer.Buffer;
import org.apache.sshkeys.common.util.buffer.ByteArrayBuffer;
import org.apache.sshkeys.config.keys.impl.RSASshKey;
import org.apache.sshkeys.util.test.JUnitTestSupport;
import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@TestMethodOrder(MethodName.class)
class SshKeysTest extends JUnitTestSupport {
    @TempDir
    Path tempDir;

    SshKeysTest() {
        super();
    }

    @Test
    void certificateSubjectPrefixes() throws Exception {
        assertEquals("CN=foo", SshKeys.importCertificateSubject("x509v3-ssh-rsa Subject:CN=foo"));
        assertEquals("/C=US/CN=bar", SshKeys.importCertificateSubject("x509v3-ssh-ed25519 DN=/C=US/CN=bar"));
        assertEquals("CN=baz", SshKeys.importCertificateSubject("  x509v3-sign-rsa distinguished name: CN=baz\n"));
        assertEquals("O=x, CN=y", SshKeys.importCertificateSubject("x509v3-ssh-dss Subject: O=x, CN=y"));
    }

    @Test
    void certificateSubjectRejections() {
        KeyImportException e = assertThrows(KeyImportException.class,
                () -> SshKeys.importCertificateSubject("x509v3-ssh-rsa"));
        assertEquals("Missing certificate subject algorithm", e.getMessage());

        e = assertThrows(KeyImportException.class, () -> SshKeys.importCertificateSubject("ssh-rsa Subject:CN=foo"));
        assertEquals("Invalid certificate subject", e.getMessage());

        e = assertThrows(KeyImportException.class, () -> SshKeys.importCertificateSubject("x509v3-ssh-rsa CN=foo"));
        assertEquals("Invalid certificate subject", e.getMessage());
    }

    @Test
    void registryQueries() {
        List<String> keys = SshKeys.getPublicKeyAlgorithms();
        assertTrue(keys.containsAll(Arrays.asList("ssh-ed25519", "ssh-ed448", "ecdsa-sha2-nistp256", "ssh-rsa",
                "ssh-dss", "sk-ssh-ed25519@openssh.com", "sk-ecdsa-sha2-nistp256@openssh.com")), keys.toString());

        List<String> defaults = SshKeys.getDefaultPublicKeyAlgorithms();
        assertTrue(defaults.contains("ssh-ed25519"), "Ed25519 not enabled by default");
        assertFalse(defaults.contains("ssh-dss"), "DSA enabled by default");

        List<String> certs = SshKeys.getCertificateAlgorithms();
        assertTrue(certs.contains("ssh-ed25519-cert-v01@openssh.com"), certs.toString());
        assertTrue(certs.contains("rsa-sha2-256-cert-v01@openssh.com"), certs.toString());
        assertFalse(SshKeys.getDefaultCertificateAlgorithms().contains("ssh-dss-cert-v01@openssh.com"));

        List<String> x509 = SshKeys.getX509CertificateAlgorithms();
        assertTrue(x509.containsAll(Arrays.asList("x509v3-ssh-ed25519", "x509v3-ecdsa-sha2-nistp256",
                "x509v3-rsa2048-sha256", "x509v3-ssh-rsa")), x509.toString());
        assertFalse(SshKeys.getDefaultX509CertificateAlgorithms().contains("x509v3-ssh-dss"));
    }

    @Test
    void generateUnknownAlgorithm() {
        KeyGenerationException e = assertThrows(KeyGenerationException.class,
                () -> SshKeys.generatePrivateKey("ssh-unknown"));
        assertEquals("Unknown algorithm: ssh-unknown", e.getMessage());
    }

    @Test
    void generateRsaWithOptions() throws Exception {
        SshKey key = SshKeys.generatePrivateKey("ssh-rsa", "sized",
                new KeyGenerationOptions().keySize(1024).exponent(3L));
        RSASshKey rsa = assertObjectInstanceOf("Generated key", RSASshKey.class, key);
        assertEquals(1024, rsa.getPublicKey().getModulus().bitLength(), "Mismatched modulus size");
        assertEquals(3L, rsa.getPublicKey().getPublicExponent().longValue(), "Mismatched exponent");
        assertEquals("sized", key.getComment(), "Mismatched comment");

        assertThrows(KeyGenerationException.class,
                () -> SshKeys.generatePrivateKey("ssh-rsa", null, new KeyGenerationOptions().keySize(512)));
        assertThrows(KeyGenerationException.class,
                () -> SshKeys.generatePrivateKey("ssh-rsa", null, new KeyGenerationOptions().exponent(17L)));
    }

    @Test
    void decodeSshPublicKeyRejectsMalformedData() throws Exception {
        SshKey key = SshKeys.generatePrivateKey("ssh-ed25519");
        byte[] data = key.getPublicData();

        byte[] trailing = Arrays.copyOf(data, data.length + 1);
        assertThrows(KeyImportException.class, () -> SshKeys.decodeSshPublicKey(trailing));

        byte[] truncated = Arrays.copyOf(data, data.length - 1);
        KeyImportException e = assertThrows(KeyImportException.class, () -> SshKeys.decodeSshPublicKey(truncated));
        assertEquals("Invalid public key", e.getMessage());

        Buffer buffer = new ByteArrayBuffer();
        buffer.putString("ssh-unknown");
        buffer.putBytes(new byte[8]);
        e = assertThrows(KeyImportException.class, () -> SshKeys.decodeSshPublicKey(buffer.getCompactData()));
        assertEquals("Unknown key algorithm: ssh-unknown", e.getMessage());
    }

    @Test
    void importGarbage() throws Exception {
        byte[] garbage = "not a key at all".getBytes(StandardCharsets.US_ASCII);
        assertThrows(KeyImportException.class, () -> SshKeys.importPrivateKey(garbage, null));
        assertThrows(KeyImportException.class, () -> SshKeys.importPublicKey(garbage));
        assertThrows(KeyImportException.class, () -> SshKeys.importCertificate(garbage));
        assertNull(SshKeys.importCertificateChain(new byte[0]), "Empty chain data");
    }

    @Test
    void filenameIsCommentFallback() throws Exception {
        SshKey key = SshKeys.generatePrivateKey("ecdsa-sha2-nistp256");
        Path file = tempDir.resolve("id_ecdsa");
        key.writePrivateKey(file, SshKey.FORMAT_OPENSSH, null);
        key.writePublicKey(tempDir.resolve("id_ecdsa.pub"), SshKey.FORMAT_OPENSSH);

        SshKey priv = SshKeys.readPrivateKey(file, null);
        assertFalse(priv.hasComment(), "Unexpected comment");
        assertEquals(file.toString(), priv.getComment(), "File name not used as comment");
        assertArrayEquals(file.toString().getBytes(StandardCharsets.UTF_8), priv.getFilename());

        // the file name is never written back as a comment
        String exported = new String(priv.exportPublicKey(), StandardCharsets.UTF_8);
        assertEquals(2, exported.trim().split(" ").length, exported);

        SshKey pub = SshKeys.readPublicKey(tempDir.resolve("id_ecdsa.pub"));
        assertEquals(priv.convertToPublic(), pub, "Mismatched public key");
    }

    @Test
    void readKeyLists() throws Exception {
        SshKey k1 = SshKeys.generatePrivateKey("ssh-ed25519", "first", null);
        SshKey k2 = SshKeys.generatePrivateKey("ecdsa-sha2-nistp384", "second", null);

        Path priv = tempDir.resolve("keys");
        k1.writePrivateKey(priv, SshKey.FORMAT_OPENSSH, null);
        k2.appendPrivateKey(priv, SshKey.FORMAT_PKCS8_PEM, null);
        List<SshKey> privs = SshKeys.readPrivateKeyList(priv, null);
        assertEquals(Arrays.asList(k1, k2), privs, "Mismatched private keys");

        Path pub = tempDir.resolve("keys.pub");
        k1.writePublicKey(pub, SshKey.FORMAT_OPENSSH);
        k2.appendPublicKey(pub, SshKey.FORMAT_RFC4716);
        List<SshKey> pubs = SshKeys.readPublicKeyList(pub);
        assertEquals(Arrays.asList(k1.convertToPublic(), k2.convertToPublic()), pubs, "Mismatched public keys");
        assertEquals("second", pubs.get(1).getComment(), "RFC4716 comment lost");
    }
}
