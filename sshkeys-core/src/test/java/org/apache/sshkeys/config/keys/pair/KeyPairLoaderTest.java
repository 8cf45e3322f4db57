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


package org.apache.sshkeys.config.keys.pair;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ForkJoinPool;

import org.apache.sshkeys.config.keys.KeyImportException;
import org.apache.sshkeys.config.keys.SshKey;
import org.apache.sshkeys.config.keys.SshKeys;
import org.apache.sshkeys.config.keys.certificate.OpenSshCertificate;
import org.apache.sshkeys.config.keys.certificate.SshCertificate;
import org.apache.sshkeys.config.keys.sk.ResidentKey;
import org.apache.sshkeys.config.keys.sk.SecurityKeyAuthenticator;
import org.apache.sshkeys.config.keys.x509.SshX509Certificate;
import org.apache.sshkeys.util.test.JUnitTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@TestMethodOrder(MethodName.class)
class KeyPairLoaderTest extends JUnitTestSupport {
    private static final String OPENSSH_RESOURCES = "/org/apache/sshkeys/config/keys/loader/openssh/";
    private static final String CERT_RESOURCES = "/org/apache/sshkeys/config/keys/certificate/";

    @TempDir
    Path tempDir;

    private KeyPairLoader loader;
    private Path sshFolder;

    KeyPairLoaderTest() {
        super();
    }

    @BeforeEach
    void setUp() throws IOException {
        loader = new KeyPairLoader();
        loader.setUserHomeFolder(tempDir);
        sshFolder = Files.createDirectories(tempDir.resolve(KeyPairLoader.SSH_FOLDER_NAME));
    }

    @Test
    void defaultKeyPairsSkipEncryptedKeys() throws Exception {
        installDefaultKeys();

        List<SshKeyPair> pairs = loader.loadDefaultKeyPairs(FilePasswordProvider.EMPTY, null);
        assertEquals(1, pairs.size(), "Loaded pairs");
        assertEquals("ssh-rsa", pairs.get(0).getAlgorithm());
        assertEquals("rsa@test", pairs.get(0).getComment());
        assertFalse(pairs.get(0).hasCertificate(), "Unexpected certificate");
    }

    @Test
    void defaultKeyPairsWithPassphrase() throws Exception {
        installDefaultKeys();

        List<SshKeyPair> pairs = loader.loadDefaultKeyPairs(FilePasswordProvider.of("secret"), null);
        assertEquals(3, pairs.size(), "Loaded pairs");

        SshKeyPair certified = pairs.get(0);
        assertTrue(certified.hasCertificate(), "No certificate");
        assertEquals("ssh-ed25519-cert-v01@openssh.com", certified.getAlgorithm());
        assertEquals("ssh-ed25519", certified.getSigAlgorithm());
        assertEquals("tst", certified.getComment());
        assertArrayEquals(certified.getCertificate().getPublicData(), certified.getPublicData());

        SshKeyPair plain = pairs.get(1);
        assertFalse(plain.hasCertificate(), "Unexpected certificate");
        assertEquals("ssh-ed25519", plain.getAlgorithm());
        assertArrayEquals(certified.getKeyPublicData(), plain.getPublicData());

        assertEquals("ssh-rsa", pairs.get(2).getAlgorithm());

        byte[] data = getCurrentTestName().getBytes(StandardCharsets.UTF_8);
        SshKey publicKey = SshKeys.readPublicKey(sshFolder.resolve("id_ed25519.pub"));
        assertTrue(publicKey.verify(data, certified.sign(data)), "Certified pair signature");
    }

    @Test
    void defaultKeyPairsWithoutHomeFolder() throws Exception {
        loader.setUserHomeFolder(null);
        assertTrue(loader.loadDefaultKeyPairs(null, null).isEmpty(), "Unexpected pairs");
        assertTrue(loader.loadDefaultIdentities().isEmpty(), "Unexpected identities");
    }

    @Test
    void defaultIdentities() throws Exception {
        installDefaultKeys();

        List<byte[]> identities = loader.loadDefaultIdentities();
        assertEquals(3, identities.size(), "Identities");
        assertArrayEquals(SshKeys.readCertificate(sshFolder.resolve("id_ed25519-cert.pub")).getPublicData(),
                identities.get(0));
        assertArrayEquals(SshKeys.readPublicKey(sshFolder.resolve("id_ed25519.pub")).getPublicData(),
                identities.get(1));
        assertArrayEquals(SshKeys.readPublicKey(sshFolder.resolve("id_rsa.pub")).getPublicData(),
                identities.get(2));
    }

    @Test
    void identitiesFromFiles() throws Exception {
        installDefaultKeys();
        Path garbage = Files.write(tempDir.resolve("garbage"), "not a key".getBytes(StandardCharsets.UTF_8));

        List<Path> paths = Arrays.asList(
                sshFolder.resolve("id_ed25519-cert.pub"), garbage, sshFolder.resolve("id_rsa"));
        assertThrows(KeyImportException.class, () -> loader.loadIdentities(paths, false));

        List<byte[]> identities = loader.loadIdentities(paths, true);
        assertEquals(2, identities.size(), "Identities");
        assertArrayEquals(SshKeys.readCertificate(paths.get(0)).getPublicData(), identities.get(0));
        // a private key file yields its public key
        assertArrayEquals(SshKeys.readPublicKey(sshFolder.resolve("id_rsa.pub")).getPublicData(), identities.get(1));
    }

    @Test
    void mismatchedPublicKeyRejected() throws Exception {
        Path keyFile = install(OPENSSH_RESOURCES + "rsa-plain", tempDir.resolve("id_rsa"));
        install(OPENSSH_RESOURCES + "ecdsa384-plain.pub", tempDir.resolve("id_rsa.pub"));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> loader.loadKeyPairs(keyFile, null, null));
        assertEquals("Public key mismatch", e.getMessage());
    }

    @Test
    void appendedX509ChainYieldsSinglePair() throws Exception {
        SshKey key = SshKeys.generatePrivateKey("ecdsa-sha2-nistp256");
        SshX509Certificate cert = key.generateX509SelfSignedCertificate("CN=loader");
        Path keyFile = tempDir.resolve("id_ecdsa");
        key.writePrivateKey(keyFile, SshKey.FORMAT_PKCS8_PEM, null);
        Files.write(keyFile, cert.exportCertificate(SshCertificate.FORMAT_PEM), StandardOpenOption.APPEND);

        List<SshKeyPair> pairs = loader.loadKeyPairs(keyFile, null, null);
        assertEquals(1, pairs.size(), "Loaded pairs");

        SshKeyPair pair = pairs.get(0);
        assertTrue(pair.hasX509Chain(), "No X.509 chain");
        assertEquals("x509v3-ecdsa-sha2-nistp256", pair.getAlgorithm());
        assertArrayEquals(pair.getCertificate().getPublicData(), pair.getPublicData());
        assertArrayEquals(key.getPublicData(), pair.getKeyPublicData());
    }

    @Test
    void extraCertificatesMatchedByKey() throws Exception {
        Path keyFile = install(OPENSSH_RESOURCES + "rsa-plain", tempDir.resolve("id_rsa"));
        SshKey ca = SshKeys.importPrivateKey(getTestResourceBytes(CERT_RESOURCES + "ca"), null);
        SshKey userKey = SshKeys.readPrivateKey(keyFile, null);
        OpenSshCertificate cert = ca.generateUserCertificate(userKey, "rsa-user", Collections.singletonList("alice"));
        OpenSshCertificate other = ca.generateUserCertificate(
                SshKeys.generatePrivateKey("ssh-ed25519"), "other", Collections.emptyList());

        List<SshKeyPair> pairs = loader.loadKeyPairs(keyFile, null, Arrays.asList(other, cert));
        assertEquals(2, pairs.size(), "Loaded pairs");
        assertSame(cert, pairs.get(0).getCertificate());
        assertNull(pairs.get(1).getCertificate(), "Unexpected certificate");
    }

    @Test
    void sourceCompanions() throws Exception {
        byte[] keyData = getTestResourceBytes(OPENSSH_RESOURCES + "rsa-plain");
        SshKey key = SshKeys.importPrivateKey(keyData, null);
        SshKey ca = SshKeys.importPrivateKey(getTestResourceBytes(CERT_RESOURCES + "ca"), null);
        OpenSshCertificate cert = ca.generateUserCertificate(key, "rsa-user", Collections.singletonList("alice"));

        List<SshKeyPair> pairs = loader.loadKeyPairs(Arrays.asList(
                KeyPairSource.of(keyData).withCompanion(getTestResourceBytes(OPENSSH_RESOURCES + "rsa-plain.pub")),
                KeyPairSource.of(key).withCertificates(Collections.singletonList(cert)),
                KeyPairSource.of(keyData).withCompanion(cert.exportCertificate())),
                null, null, false, false);
        assertEquals(5, pairs.size(), "Loaded pairs");
        assertFalse(pairs.get(0).hasCertificate(), "Unexpected certificate");
        assertEquals("rsa@test", pairs.get(0).getComment());
        assertEquals(cert, pairs.get(1).getCertificate());
        assertFalse(pairs.get(2).hasCertificate(), "Unexpected certificate");
        assertEquals(cert, pairs.get(3).getCertificate());

        KeyPairSource mismatch = KeyPairSource.of(key)
                .withPublicKey(SshKeys.importPublicKey(getTestResourceBytes(OPENSSH_RESOURCES + "ecdsa384-plain.pub")));
        assertThrows(IllegalArgumentException.class,
                () -> loader.loadKeyPairs(Collections.singletonList(mismatch), null, null, false, false));
    }

    @Test
    void encryptedSourceHandling() throws Exception {
        List<KeyPairSource> sources = Collections.singletonList(
                KeyPairSource.of(getTestResourceBytes(OPENSSH_RESOURCES + "ed25519-aes256-ctr")));
        assertThrows(KeyImportException.class, () -> loader.loadKeyPairs(sources, null, null, false, false));
        assertTrue(loader.loadKeyPairs(sources, null, null, false, true).isEmpty(), "Encrypted key loaded");
        assertEquals(1, loader.loadKeyPairs(sources, FilePasswordProvider.of("secret"), null, false, false).size());
    }

    @Test
    void deferredPassphrase() throws Exception {
        List<KeyPairSource> sources = Collections.singletonList(
                KeyPairSource.of(getTestResourceBytes(OPENSSH_RESOURCES + "ed25519-aes256-ctr")));
        CompletableFuture<String> passphrase = new CompletableFuture<>();
        ForkJoinPool.commonPool().execute(() -> passphrase.complete("secret"));
        assertEquals(1, loader.loadKeyPairs(sources, FilePasswordProvider.of(passphrase), null, false, false).size());

        CompletableFuture<String> failed = new CompletableFuture<>();
        failed.completeExceptionally(new IOException("Prompt cancelled"));
        IOException e = assertThrows(IOException.class,
                () -> loader.loadKeyPairs(sources, FilePasswordProvider.of(failed), null, false, false));
        assertEquals("Prompt cancelled", e.getMessage());
    }

    @Test
    void residentKeys() throws Exception {
        byte[] publicValue = getTestResourceBytes(OPENSSH_RESOURCES + "ed25519-aes256-ctr.pub");
        byte[] rawKey = SshKeys.importPublicKey(publicValue).getPublicData();
        // the raw Ed25519 key is the trailing string of the public data
        byte[] point = Arrays.copyOfRange(rawKey, rawKey.length - 32, rawKey.length);
        byte[] keyHandle = "handle".getBytes(StandardCharsets.UTF_8);

        SecurityKeyAuthenticator authenticator = mock(SecurityKeyAuthenticator.class);
        when(authenticator.getResidentKeys(any(), any(), any())).thenReturn(Collections.singletonList(
                new ResidentKey(SecurityKeyAuthenticator.SSH_SK_ED25519, "alice", point, keyHandle)));

        List<SshKey> keys = loader.loadResidentKeys(authenticator, "1234");
        assertEquals(1, keys.size(), "Resident keys");
        SshKey key = keys.get(0);
        assertEquals("sk-ssh-ed25519@openssh.com", key.getAlgorithm());
        assertEquals("alice", key.getComment());
        assertTrue(key.hasPrivateKey(), "No key handle");
        assertTrue(key.isTouchRequired(), "Touch not required");

        when(authenticator.getResidentKeys(any(), any(), any())).thenReturn(Collections.singletonList(
                new ResidentKey(-257, "bob", point, keyHandle)));
        KeyImportException e = assertThrows(KeyImportException.class,
                () -> loader.loadResidentKeys(authenticator, "1234"));
        assertEquals("Unsupported security key algorithm: -257", e.getMessage());

        when(authenticator.getResidentKeys(any(), any(), any())).thenThrow(new IOException("PIN invalid"));
        e = assertThrows(KeyImportException.class, () -> loader.loadResidentKeys(authenticator, "0000"));
        assertEquals("PIN invalid", e.getMessage());
    }

    private void installDefaultKeys() throws IOException {
        install(OPENSSH_RESOURCES + "ed25519-aes256-ctr", sshFolder.resolve("id_ed25519"));
        install(OPENSSH_RESOURCES + "ed25519-aes256-ctr.pub", sshFolder.resolve("id_ed25519.pub"));
        install(CERT_RESOURCES + "user-cert.pub", sshFolder.resolve("id_ed25519-cert.pub"));
        install(OPENSSH_RESOURCES + "rsa-plain", sshFolder.resolve("id_rsa"));
        install(OPENSSH_RESOURCES + "rsa-plain.pub", sshFolder.resolve("id_rsa.pub"));
    }

    private Path install(String resource, Path target) throws IOException {
        return Files.write(target, getTestResourceBytes(resource));
    }
}
