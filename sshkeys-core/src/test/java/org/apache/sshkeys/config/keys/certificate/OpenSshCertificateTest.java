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


package org.apache.sshkeys.config.keys.certificate;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.sshkeys.common.util.buffer.Buffer;
import org.apache.sshkeys.common.util.buffer.ByteArrayBuffer;
import org.apache.sshkeys.config.keys.KeyExportException;
import org.apache.sshkeys.config.keys.KeyImportException;
import org.apache.sshkeys.config.keys.SshKey;
import org.apache.sshkeys.config.keys.SshKeys;
import org.apache.sshkeys.util.test.JUnitTestSupport;
import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@TestMethodOrder(MethodName.class)
class OpenSshCertificateTest extends JUnitTestSupport {
    private static final long JAN_2020 = 1577836800L;
    private static final long JAN_2100 = 4102444800L;
    private static final Instant IN_RANGE = Instant.ofEpochSecond(1700000000L);

    OpenSshCertificateTest() {
        super();
    }

    static List<String> signingAlgorithms() {
        return Arrays.asList("ssh-ed25519", "ssh-ed448", "ecdsa-sha2-nistp256", "ssh-rsa", "ssh-dss");
    }

    @Test
    void keygenUserCertificate() throws Exception {
        OpenSshCertificate cert = readCertificate("user-cert.pub");
        SshKey ca = SshKeys.importPublicKey(getTestResourceBytes("ca.pub"));
        SshKey user = SshKeys.importPublicKey(getTestResourceBytes("user.pub"));

        assertEquals("ssh-ed25519-cert-v01@openssh.com", cert.getAlgorithm());
        assertEquals(OpenSshCertificate.Type.USER, cert.getType());
        assertEquals("test-user", cert.getKeyId());
        assertEquals(Arrays.asList("alice", "bob"), cert.getPrincipals());
        assertEquals(JAN_2020, cert.getValidAfter());
        assertEquals(JAN_2100, cert.getValidBefore());
        assertEquals("tst", cert.getComment());
        assertArrayEquals(user.getPublicData(), cert.getKey().getPublicData(), "Certified key");
        assertArrayEquals(ca.getPublicData(), cert.getSigningKey().getPublicData(), "Signing key");

        Map<String, Object> options = cert.getOptions();
        assertEquals("/bin/true", options.get(OpenSshCertificateOptions.FORCE_COMMAND));
        List<?> addresses = assertInstanceOf(List.class, options.get(OpenSshCertificateOptions.SOURCE_ADDRESS));
        assertEquals("[10.0.0.0/8, 192.168.1.1/32]", addresses.toString());
        assertEquals(Boolean.TRUE, options.get(OpenSshCertificateOptions.PERMIT_AGENT_FORWARDING));
        assertEquals(Boolean.TRUE, options.get(OpenSshCertificateOptions.PERMIT_USER_RC));
        assertFalse(options.containsKey(OpenSshCertificateOptions.PERMIT_PTY), "Unexpected permit-pty");
    }

    @Test
    void keygenHostCertificate() throws Exception {
        OpenSshCertificate cert = readCertificate("host-cert.pub");
        assertEquals("ssh-rsa-cert-v01@openssh.com", cert.getAlgorithm());
        assertEquals(OpenSshCertificate.Type.HOST, cert.getType());
        assertEquals(Collections.singletonList("host.example.com"), cert.getPrincipals());
        assertTrue(cert.getOptions().isEmpty(), "Unexpected options: " + cert.getOptions());

        cert.validate(OpenSshCertificate.Type.HOST, "host.example.com", IN_RANGE);
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> cert.validate(OpenSshCertificate.Type.USER, "host.example.com", IN_RANGE));
        assertEquals("Invalid certificate type", e.getMessage());
    }

    @Test
    void validityWindow() throws Exception {
        OpenSshCertificate cert = readCertificate("user-cert.pub");
        cert.validate(OpenSshCertificate.Type.USER, "alice", Instant.ofEpochSecond(JAN_2020));
        cert.validate(OpenSshCertificate.Type.USER, "alice", Instant.ofEpochSecond(JAN_2100 - 1L));

        IllegalArgumentException early = assertThrows(IllegalArgumentException.class,
                () -> cert.validate(OpenSshCertificate.Type.USER, "alice", Instant.ofEpochSecond(JAN_2020 - 1L)));
        assertEquals("Certificate not yet valid", early.getMessage());
        IllegalArgumentException late = assertThrows(IllegalArgumentException.class,
                () -> cert.validate(OpenSshCertificate.Type.USER, "alice", Instant.ofEpochSecond(JAN_2100)));
        assertEquals("Certificate expired", late.getMessage());
    }

    @Test
    void principalMatching() throws Exception {
        OpenSshCertificate cert = readCertificate("user-cert.pub");
        cert.validate(OpenSshCertificate.Type.USER, "bob", IN_RANGE);
        cert.validate(OpenSshCertificate.Type.USER, null, IN_RANGE);
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> cert.validate(OpenSshCertificate.Type.USER, "carol", IN_RANGE));
        assertEquals("Certificate principal mismatch", e.getMessage());

        SshKey ca = SshKeys.importPrivateKey(getTestResourceBytes("ca"), null);
        OpenSshCertificate any = ca.generateUserCertificate(cert.getKey(), "any", Collections.emptyList());
        any.validate(OpenSshCertificate.Type.USER, "carol");
    }

    @Test
    void corruptedSignature() throws Exception {
        OpenSshCertificate cert = readCertificate("user-cert.pub");
        byte[] data = cert.getPublicData();
        data[data.length - 1] ^= 0x01;
        KeyImportException e = assertThrows(KeyImportException.class, () -> SshKeys.decodeSshCertificate(data));
        assertEquals("Invalid certificate signature", e.getMessage());
    }

    @MethodSource("signingAlgorithms")
    @ParameterizedTest(name = "{0}")
    void tamperedSignedRegionRejected(String algorithm) throws Exception {
        SshKey ca = SshKeys.generatePrivateKey(algorithm);
        SshKey user = SshKeys.generatePrivateKey("ssh-ed25519");
        byte[] data = ca.generateUserCertificate(user, "tampered", Collections.singletonList("alice")).getPublicData();
        SshKeys.decodeSshCertificate(data);

        // everything up to and including the signature key is signed
        byte[] caData = ca.getPublicData();
        int signedLength = lastIndexOf(data, caData) + caData.length;
        assertTrue(signedLength > caData.length, "Signature key not found");
        for (int index = 0; index < signedLength; index++) {
            for (int mask : new int[] { 0x01, 0x80 }) {
                byte[] tampered = data.clone();
                tampered[index] ^= (byte) mask;
                assertThrows(KeyImportException.class, () -> SshKeys.decodeSshCertificate(tampered),
                        "index=" + index + ", mask=" + mask);
            }
        }
    }

    @Test
    void unknownCriticalOptionRejected() throws Exception {
        SshKey ca = SshKeys.importPrivateKey(getTestResourceBytes("ca"), null);
        SshKey user = SshKeys.importPublicKey(getTestResourceBytes("user.pub"));

        byte[] critical = encodeOption("verify-required");
        KeyImportException e = assertThrows(KeyImportException.class,
                () -> SshKeys.decodeSshCertificate(frame(ca, user, critical, new byte[0])));
        assertEquals("Unrecognized critical option: verify-required", e.getMessage());

        OpenSshCertificate cert = assertInstanceOf(OpenSshCertificate.class,
                SshKeys.decodeSshCertificate(frame(ca, user, new byte[0], encodeOption("unknown@example.com"))));
        assertTrue(cert.getOptions().isEmpty(), "Unknown extension kept: " + cert.getOptions());
    }

    @Test
    void rsaHostCertificateRoundTrip() throws Exception {
        SshKey ca = SshKeys.importPrivateKey(getTestResourceBytes("ca"), null);
        SshKey host = SshKeys.importPublicKey(getTestResourceBytes("host.pub"));
        OpenSshCertificate cert = OpenSshCertificateBuilder.hostCertificate(host)
                .keyId("round-trip")
                .principals("a.example.com, b.example.com")
                .serial(42L)
                .sign(ca);
        assertEquals(OpenSshCertificate.MIN_EPOCH, cert.getValidAfter());
        assertEquals(OpenSshCertificate.INFINITY, cert.getValidBefore());
        assertEquals("host@test", cert.getComment());

        for (String format : new String[] { SshCertificate.FORMAT_OPENSSH, SshCertificate.FORMAT_RFC4716 }) {
            OpenSshCertificate imported = assertInstanceOf(OpenSshCertificate.class,
                    SshKeys.importCertificate(cert.exportCertificate(format)));
            assertEquals(cert, imported, format);
            assertEquals(42L, imported.getSerial(), format);
            assertEquals(Arrays.asList("a.example.com", "b.example.com"), imported.getPrincipals(), format);
            imported.validate(OpenSshCertificate.Type.HOST, "b.example.com");
            assertThrows(IllegalArgumentException.class,
                    () -> imported.validate(OpenSshCertificate.Type.USER, "b.example.com"), format);
        }

        assertThrows(KeyExportException.class, () -> cert.exportCertificate(SshCertificate.FORMAT_DER));
        assertThrows(KeyExportException.class, () -> cert.exportCertificate(SshCertificate.FORMAT_PEM));
    }

    @Test
    void builderOptions() throws Exception {
        SshKey ca = SshKeys.importPrivateKey(getTestResourceBytes("ca"), null);
        SshKey user = SshKeys.importPublicKey(getTestResourceBytes("user.pub"));
        OpenSshCertificate cert = OpenSshCertificateBuilder.userCertificate(user)
                .keyId("options")
                .forceCommand("/usr/bin/uptime")
                .sourceAddress(Arrays.asList("10.1.0.0/16", "::1"))
                .permitPty(false)
                .touchRequired(false)
                .option("no-such-option", "ignored")
                .comment("certified")
                .sign(ca);

        OpenSshCertificate imported = assertInstanceOf(OpenSshCertificate.class,
                SshKeys.importCertificate(cert.exportCertificate()));
        Map<String, Object> options = imported.getOptions();
        assertEquals("/usr/bin/uptime", options.get(OpenSshCertificateOptions.FORCE_COMMAND));
        assertEquals(Arrays.asList(SourceAddress.valueOf("10.1.0.0/16"), SourceAddress.valueOf("::1")),
                options.get(OpenSshCertificateOptions.SOURCE_ADDRESS));
        assertEquals(Boolean.TRUE, options.get(OpenSshCertificateOptions.NO_TOUCH_REQUIRED));
        assertFalse(options.containsKey(OpenSshCertificateOptions.PERMIT_PTY), "permit-pty still granted");
        assertFalse(options.containsKey("no-such-option"), "Unknown option encoded");
        assertEquals("certified", imported.getComment());
    }

    @Test
    void builderRejectsEmptyValidity() throws Exception {
        SshKey ca = SshKeys.importPrivateKey(getTestResourceBytes("ca"), null);
        OpenSshCertificateBuilder builder = OpenSshCertificateBuilder.userCertificate(ca)
                .keyId("empty")
                .validAfter(JAN_2100)
                .validBefore(JAN_2020);
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> builder.sign(ca));
        assertEquals("Valid before time must be later than valid after time", e.getMessage());

        assertThrows(IllegalStateException.class, () -> OpenSshCertificateBuilder.hostCertificate(ca).sign(ca));
    }

    @Test
    void sourceAddressParsing() {
        assertEquals("192.168.0.0/24", SourceAddress.valueOf("192.168.0.0/24").toString());
        assertThrows(IllegalArgumentException.class, () -> SourceAddress.valueOf("192.168.0.1/24"));
        assertThrows(IllegalArgumentException.class, () -> SourceAddress.valueOf("10.0.0.0/33"));
        assertThrows(IllegalArgumentException.class, () -> SourceAddress.valueOf("example.com"));
    }

    private OpenSshCertificate readCertificate(String name) throws Exception {
        return assertInstanceOf(OpenSshCertificate.class, SshKeys.importCertificate(getTestResourceBytes(name)));
    }

    private static int lastIndexOf(byte[] data, byte[] pattern) {
        for (int index = data.length - pattern.length; index >= 0; index--) {
            if (Arrays.equals(data, index, index + pattern.length, pattern, 0, pattern.length)) {
                return index;
            }
        }
        return -1;
    }

    private static byte[] encodeOption(String name) {
        Buffer buffer = new ByteArrayBuffer();
        buffer.putString(name);
        buffer.putBytes(new byte[0]);
        return buffer.getCompactData();
    }

    private static byte[] frame(SshKey ca, SshKey key, byte[] critical, byte[] extensions) throws Exception {
        Buffer principals = new ByteArrayBuffer();
        principals.putString("alice");

        Buffer buffer = new ByteArrayBuffer();
        buffer.putString("ssh-ed25519-cert-v01@openssh.com");
        buffer.putBytes(new byte[OpenSshCertificateCodec.NONCE_SIZE]);
        key.encodeSshPublic(buffer);
        buffer.putLong(1L);
        buffer.putUInt(OpenSshCertificate.Type.USER.getCode());
        buffer.putString("hand-made", StandardCharsets.UTF_8);
        buffer.putBytes(principals.getCompactData());
        buffer.putLong(OpenSshCertificate.MIN_EPOCH);
        buffer.putLong(OpenSshCertificate.INFINITY);
        buffer.putBytes(critical);
        buffer.putBytes(extensions);
        buffer.putString("");
        buffer.putBytes(ca.getPublicData());
        buffer.putBytes(ca.sign(buffer.getCompactData(), "ssh-ed25519"));
        return buffer.getCompactData();
    }
}
