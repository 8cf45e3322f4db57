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

import java.nio.charset.StandardCharsets;
import java.util.Collections;

import org.apache.sshkeys.common.util.buffer.Buffer;
import org.apache.sshkeys.common.util.buffer.ByteArrayBuffer;
import org.apache.sshkeys.config.keys.SshKey;
import org.apache.sshkeys.config.keys.SshKeys;
import org.apache.sshkeys.config.keys.certificate.OpenSshCertificate;
import org.apache.sshkeys.config.keys.certificate.OpenSshCertificateBuilder;
import org.apache.sshkeys.config.keys.x509.SshX509Certificate;
import org.apache.sshkeys.config.keys.x509.SshX509CertificateChain;
import org.apache.sshkeys.util.test.JUnitTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@TestMethodOrder(MethodName.class)
class SshLocalKeyPairTest extends JUnitTestSupport {
    private static final String CERT_RESOURCES = "/org/apache/sshkeys/config/keys/certificate/";
    private static final String OPENSSH_RESOURCES = "/org/apache/sshkeys/config/keys/loader/openssh/";

    private SshKey ca;
    private SshKey rsaKey;
    private byte[] data;

    SshLocalKeyPairTest() {
        super();
    }

    @BeforeEach
    void setUp() throws Exception {
        ca = SshKeys.importPrivateKey(getTestResourceBytes(CERT_RESOURCES + "ca"), null);
        rsaKey = SshKeys.importPrivateKey(getTestResourceBytes(OPENSSH_RESOURCES + "rsa-plain"), null);
        data = getCurrentTestName().getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void plainKeyPair() throws Exception {
        SshLocalKeyPair pair = new SshLocalKeyPair(rsaKey);
        assertEquals(SshKeyPair.LOCAL_KEY_TYPE, pair.getKeyType());
        assertEquals("ssh-rsa", pair.getAlgorithm());
        assertEquals("ssh-rsa", pair.getSigAlgorithm());
        assertEquals(rsaKey.getSigAlgorithms(), pair.getSigAlgorithms());
        assertEquals(rsaKey.getSigAlgorithms(), pair.getHostKeyAlgorithms());
        assertArrayEquals(rsaKey.getPublicData(), pair.getPublicData());
        assertEquals("rsa@test", pair.getComment());

        pair.setSigAlgorithm("rsa-sha2-512");
        assertEquals("rsa-sha2-512", pair.getAlgorithm());
        byte[] sig = pair.sign(data);
        assertEquals("rsa-sha2-512", new ByteArrayBuffer(sig).getString());
        assertTrue(rsaKey.verify(data, sig), "Signature rejected");
    }

    @Test
    void openSshCertificatePair() throws Exception {
        OpenSshCertificate cert = ca.generateUserCertificate(rsaKey, "rsa-user", Collections.singletonList("alice"));
        SshLocalKeyPair pair = new SshLocalKeyPair(rsaKey, null, cert);
        assertTrue(pair.hasCertificate(), "No certificate");
        assertFalse(pair.hasX509Chain(), "Unexpected X.509 chain");
        assertEquals(cert.getAlgorithm(), pair.getAlgorithm());
        assertArrayEquals(cert.getPublicData(), pair.getPublicData());
        assertArrayEquals(rsaKey.getPublicData(), pair.getKeyPublicData());
        assertEquals(cert.getHostKeyAlgorithms(), pair.getHostKeyAlgorithms());

        pair.setSigAlgorithm("rsa-sha2-512-cert-v01@openssh.com");
        assertEquals("rsa-sha2-512", pair.getSigAlgorithm());
        assertEquals(cert.getAlgorithm(), pair.getAlgorithm());
        assertTrue(rsaKey.verify(data, pair.sign(data)), "Signature rejected");

        pair.setCertificate(null);
        assertEquals("ssh-rsa", pair.getAlgorithm());
        assertArrayEquals(rsaKey.getPublicData(), pair.getPublicData());
    }

    @Test
    void certificateKeyMismatch() throws Exception {
        SshKey other = SshKeys.generatePrivateKey("ssh-ed25519");
        OpenSshCertificate cert = ca.generateUserCertificate(other, "other", Collections.emptyList());

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new SshLocalKeyPair(rsaKey, null, cert));
        assertEquals("Certificate key mismatch", e.getMessage());

        SshLocalKeyPair pair = new SshLocalKeyPair(rsaKey);
        assertThrows(IllegalArgumentException.class, () -> pair.setCertificate(cert));
        assertNull(pair.getCertificate(), "Certificate attached");

        e = assertThrows(IllegalArgumentException.class, () -> new SshLocalKeyPair(rsaKey, other, null));
        assertEquals("Public key mismatch", e.getMessage());
    }

    @Test
    void commentResolution() throws Exception {
        SshKey key = SshKeys.generatePrivateKey("ssh-ed25519");
        OpenSshCertificate cert = OpenSshCertificateBuilder.userCertificate(key)
                .keyId("commented")
                .comment("certified")
                .sign(ca);
        assertEquals("certified", new SshLocalKeyPair(key, null, cert).getComment());

        SshKey publicKey = key.convertToPublic();
        publicKey.setComment("from-public");
        assertEquals("from-public", new SshLocalKeyPair(key, publicKey, null).getComment());

        key.setComment("own");
        assertEquals("own", new SshLocalKeyPair(key, publicKey, cert).getComment());

        SshKey anonymous = SshKeys.generatePrivateKey("ssh-ed25519");
        anonymous.setFilename("id_anonymous");
        assertEquals("id_anonymous", new SshLocalKeyPair(anonymous).getComment());
    }

    @Test
    void x509ChainPair() throws Exception {
        SshX509Certificate cert = rsaKey.generateX509SelfSignedCertificate("CN=pair");
        SshX509CertificateChain chain = SshX509CertificateChain.fromCertificates(Collections.singletonList(cert));
        SshLocalKeyPair pair = new SshLocalKeyPair(rsaKey, null, chain);
        assertTrue(pair.hasX509Chain(), "No X.509 chain");
        assertEquals(chain.getAlgorithm(), pair.getSigAlgorithm());

        pair.setSigAlgorithm("x509v3-rsa2048-sha256");
        assertEquals("x509v3-rsa2048-sha256", pair.getAlgorithm());
        assertArrayEquals(chain.adjustPublicData("x509v3-rsa2048-sha256"), pair.getPublicData());
        assertEquals("x509v3-rsa2048-sha256", new ByteArrayBuffer(pair.getPublicData()).getString());

        byte[] sig = pair.sign(data);
        assertEquals("rsa2048-sha256", new ByteArrayBuffer(sig).getString());
        assertTrue(rsaKey.verify(data, sig), "Signature rejected");
    }

    @Test
    void agentPrivateKey() throws Exception {
        SshKey key = SshKeys.generatePrivateKey("ssh-ed25519");
        Buffer expected = new ByteArrayBuffer();
        expected.putString("ssh-ed25519");
        key.encodeSshPrivate(expected);
        assertArrayEquals(expected.getCompactData(), new SshLocalKeyPair(key).getAgentPrivateKey());

        OpenSshCertificate cert = ca.generateUserCertificate(key, "agent", Collections.singletonList("alice"));
        expected = new ByteArrayBuffer();
        expected.putString(cert.getAlgorithm());
        expected.putBytes(cert.getPublicData());
        key.encodeAgentCertPrivate(expected);
        assertArrayEquals(expected.getCompactData(), new SshLocalKeyPair(key, null, cert).getAgentPrivateKey());
    }
}
