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


package org.apache.sshkeys.config.keys.x509;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.sshkeys.common.util.buffer.ByteArrayBuffer;
import org.apache.sshkeys.config.keys.KeyExportException;
import org.apache.sshkeys.config.keys.SshKey;
import org.apache.sshkeys.config.keys.SshKeys;
import org.apache.sshkeys.config.keys.certificate.SshCertificate;
import org.apache.sshkeys.util.test.JUnitTestSupport;
import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@TestMethodOrder(MethodName.class)
class SshX509CertificateTest extends JUnitTestSupport {
    private static final String ROOT_HASH = "3a542908";
    private static final List<String> CLIENT = Collections.singletonList(X509Purposes.SECURE_SHELL_CLIENT);
    private static final List<String> SERVER = Collections.singletonList(X509Purposes.SECURE_SHELL_SERVER);

    @TempDir
    Path tempDir;

    SshX509CertificateTest() {
        super();
    }

    @Test
    void opensslGeneratedCertificate() throws Exception {
        SshX509Certificate pem = readCertificate("root.pem");
        SshX509Certificate der = readCertificate("root.der");
        SshX509Certificate trusted = readCertificate("root-trusted.pem");
        assertEquals(pem, der, "DER");
        assertEquals(pem, trusted, "TRUSTED CERTIFICATE");

        assertEquals("x509v3-ecdsa-sha2-nistp256", pem.getAlgorithm());
        assertTrue(pem.isX509(), "Not X.509");
        assertFalse(pem.isX509Chain(), "Unexpected chain");
        assertTrue(pem.isSelfIssued(), "Not self-issued");

        SshKey key = SshKeys.importPublicKey(getTestResourceBytes("root-key.pub"));
        assertArrayEquals(key.getPublicData(), pem.getKey().getPublicData(), "Certified key");

        assertEquals(Collections.singletonList("alice@example.com"), pem.getUserPrincipals());
        assertEquals(Collections.singletonList("host.example.com"), pem.getHostPrincipals());
        assertEquals(X509Purposes.resolve(CLIENT), pem.getPurposes());
    }

    @Test
    void opensslNameHash() throws Exception {
        SshX509Certificate cert = readCertificate("root.pem");
        assertEquals(ROOT_HASH, cert.getIssuerHash());
        assertEquals(ROOT_HASH, X509NameUtils.getNameHash(cert.getSubject()));
        assertEquals(ROOT_HASH, X509NameUtils.getNameHash(X509NameUtils.parseName("/C=US/O=Test Org/CN=Test Root")));
        assertThrows(IllegalArgumentException.class, () -> X509NameUtils.parseName("/CN"));
    }

    @Test
    void opensslCertificateValidation() throws Exception {
        SshX509Certificate cert = readCertificate("root.pem");
        cert.validateChain(Collections.emptyList(), Collections.singletonList(cert), Collections.emptyList(),
                CLIENT, "alice@example.com", "host.example.com");

        IllegalArgumentException purpose = assertThrows(IllegalArgumentException.class,
                () -> cert.validateChain(Collections.emptyList(), Collections.singletonList(cert),
                        Collections.emptyList(), SERVER, null, null));
        assertEquals("Certificate purpose mismatch", purpose.getMessage());

        IllegalArgumentException user = assertThrows(IllegalArgumentException.class,
                () -> cert.validateChain(Collections.emptyList(), Collections.singletonList(cert),
                        Collections.emptyList(), CLIENT, "bob@example.com", null));
        assertEquals("Certificate principal mismatch", user.getMessage());

        assertThrows(IllegalArgumentException.class,
                () -> cert.validateChain(Collections.emptyList(), Collections.emptyList(), Collections.emptyList(),
                        CLIENT, null, null));
    }

    @Test
    void selfSignedGeneration() throws Exception {
        SshKey key = SshKeys.generatePrivateKey("ssh-ed25519", "self@test", null);
        SshX509Certificate cert = key.generateX509SelfSignedCertificate("/O=Test/CN=Self");
        assertEquals("x509v3-ssh-ed25519", cert.getAlgorithm());
        assertEquals("self@test", cert.getComment());
        assertEquals(cert.getSubject(), cert.getIssuer());

        SshX509Certificate imported = assertInstanceOf(SshX509Certificate.class,
                SshKeys.importCertificate(cert.exportCertificate(SshCertificate.FORMAT_PEM)));
        assertEquals(cert, imported);
        assertEquals("self@test", imported.getComment());
        imported.validateChain(null, Collections.singletonList(cert), null, CLIENT, null, null);

        assertThrows(KeyExportException.class, () -> cert.exportCertificate(SshCertificate.FORMAT_RFC4716));
    }

    @Test
    void rsaCertificateAlgorithms() throws Exception {
        SshKey key = SshKeys.generatePrivateKey("ssh-rsa");
        SshX509Certificate cert = key.generateX509SelfSignedCertificate("/CN=RSA");
        assertEquals("x509v3-ssh-rsa", cert.getAlgorithm());
        assertEquals(Arrays.asList("x509v3-rsa2048-sha256", "x509v3-ssh-rsa", "x509v3-sign-rsa"),
                cert.getSigAlgorithms());
    }

    @Test
    void issuedChain() throws Exception {
        SshKey rootKey = SshKeys.generatePrivateKey("ecdsa-sha2-nistp256");
        SshKey caKey = SshKeys.generatePrivateKey("ecdsa-sha2-nistp256");
        SshKey userKey = SshKeys.generatePrivateKey("ecdsa-sha2-nistp384");

        SshX509Certificate root = SshX509CertificateBuilder.certificate(rootKey, "/CN=Root").ca(true).sign(rootKey);
        SshX509Certificate ca = rootKey.generateX509CaCertificate(caKey, "/CN=Issuing CA", "/CN=Root");
        SshX509Certificate user = SshX509CertificateBuilder.certificate(userKey, "/CN=User")
                .issuer("/CN=Issuing CA")
                .purposes(X509Purposes.SECURE_SHELL_CLIENT)
                .userPrincipals(Collections.singletonList("alice"))
                .sign(caKey);
        assertEquals(X509NameUtils.getNameHash(ca.getSubject()), user.getIssuerHash());

        SshX509CertificateChain chain = SshX509CertificateChain.fromCertificates(Arrays.asList(user, ca));
        assertTrue(chain.isX509Chain(), "Not a chain");
        assertFalse(chain.isX509(), "Chain reported as single certificate");
        assertEquals("x509v3-ecdsa-sha2-nistp384", chain.getAlgorithm());
        assertEquals(user.getSubject(), chain.getSubject());
        assertEquals(ca.getIssuer(), chain.getIssuer());

        SshX509CertificateChain decoded = assertInstanceOf(SshX509CertificateChain.class,
                SshKeys.decodeSshCertificate(chain.getPublicData()));
        assertEquals(Arrays.asList(user, ca), decoded.getCertificates());

        List<SshX509Certificate> trusted = Collections.singletonList(root);
        decoded.validateChain(trusted, null, null, CLIENT, "alice", null);
        assertThrows(IllegalArgumentException.class,
                () -> decoded.validateChain(trusted, null, null, CLIENT, "bob", null));
        assertThrows(IllegalArgumentException.class,
                () -> decoded.validateChain(trusted, null, null, SERVER, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> user.validateChain(null, trusted, null, CLIENT, null, null));

        IllegalArgumentException revoked = assertThrows(IllegalArgumentException.class,
                () -> decoded.validateChain(trusted, null, Collections.singleton(ca), CLIENT, null, null));
        assertEquals("Revoked X.509 certificate in certificate chain", revoked.getMessage());

        byte[] adjusted = chain.adjustPublicData("x509v3-sign-dss");
        assertEquals("x509v3-sign-dss", new ByteArrayBuffer(adjusted).getString());
        assertEquals("x509v3-ecdsa-sha2-nistp384", chain.getAlgorithm());
    }

    @Test
    void trustDirectoryWithCycle() throws Exception {
        SshKey rootKey = SshKeys.generatePrivateKey("ecdsa-sha2-nistp256");
        SshKey aKey = SshKeys.generatePrivateKey("ecdsa-sha2-nistp256");
        SshKey bKey = SshKeys.generatePrivateKey("ecdsa-sha2-nistp256");
        SshKey leafKey = SshKeys.generatePrivateKey("ecdsa-sha2-nistp256");

        SshX509Certificate root = SshX509CertificateBuilder.certificate(rootKey, "/CN=Root").ca(true).sign(rootKey);
        SshX509Certificate aByB = bKey.generateX509CaCertificate(aKey, "/CN=Intermediate A", "/CN=Intermediate B");
        SshX509Certificate aByRoot = rootKey.generateX509CaCertificate(aKey, "/CN=Intermediate A", "/CN=Root");
        SshX509Certificate bByA = aKey.generateX509CaCertificate(bKey, "/CN=Intermediate B", "/CN=Intermediate A");
        SshX509Certificate leaf = aKey.generateX509UserCertificate(leafKey, "/CN=Leaf", "/CN=Intermediate A");

        store(aByB, 0);
        store(bByA, 0);
        List<Path> dirs = Collections.singletonList(tempDir);
        assertThrows(IllegalArgumentException.class,
                () -> leaf.validateChain(null, null, dirs, CLIENT, null, null));

        store(aByRoot, 1);
        store(root, 0);
        leaf.validateChain(null, null, dirs, CLIENT, null, null);
    }

    @Test
    void trustExpansionStopsAtKnownCertificates() throws Exception {
        SshKey aKey = SshKeys.generatePrivateKey("ssh-ed25519");
        SshKey bKey = SshKeys.generatePrivateKey("ssh-ed25519");
        SshX509Certificate aByB = bKey.generateX509CaCertificate(aKey, "/CN=A", "/CN=B");
        SshX509Certificate bByA = aKey.generateX509CaCertificate(bKey, "/CN=B", "/CN=A");
        store(aByB, 0);
        store(bByA, 0);

        X509TrustStore store = new X509TrustStore(Collections.singletonList(tempDir));
        Set<SshX509Certificate> found = new LinkedHashSet<>();
        assertEquals(2, store.expand(aByB, found));
        assertEquals(0, store.expand(bByA, found));
    }

    private void store(SshX509Certificate cert, int index) throws Exception {
        cert.writeCertificate(tempDir.resolve(X509NameUtils.getNameHash(cert.getSubject()) + "." + index),
                SshCertificate.FORMAT_PEM);
    }

    private SshX509Certificate readCertificate(String name) throws Exception {
        return assertInstanceOf(SshX509Certificate.class, SshKeys.importCertificate(getTestResourceBytes(name)));
    }
}
