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


package org.apache.sshkeys.config.keys.sk;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.MessageDigest;
import java.security.PrivateKey;
import java.security.Signature;
import java.security.interfaces.ECPublicKey;
import java.security.spec.ECGenParameterSpec;
import java.util.Arrays;

import org.apache.sshkeys.config.keys.KeyGenerationException;
import org.apache.sshkeys.config.keys.KeyGenerationOptions;
import org.apache.sshkeys.config.keys.SshKey;
import org.apache.sshkeys.config.keys.SshKeys;
import org.apache.sshkeys.config.keys.impl.AbstractSecurityKeySshKey;
import org.apache.sshkeys.config.keys.impl.ECCurves;
import org.apache.sshkeys.util.test.JUnitTestSupport;
import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Enrolls and signs with a mocked token backed by a software key pair
 */
@TestMethodOrder(MethodName.class)
class SecurityKeySshKeyTest extends JUnitTestSupport {
    private static final byte[] KEY_HANDLE = "key-handle".getBytes(StandardCharsets.UTF_8);
    private static final byte[] DATA = "data to sign".getBytes(StandardCharsets.UTF_8);

    SecurityKeySshKeyTest() {
        super();
    }

    @Test
    void ed25519EnrollAndSign() throws Exception {
        KeyPair token = KeyPairGenerator.getInstance("Ed25519").generateKeyPair();
        SecurityKeyAuthenticator authenticator = mockToken(
                SecurityKeyAuthenticator.SSH_SK_ED25519, ed25519PublicValue(token), token.getPrivate(), "Ed25519",
                SecurityKeyAuthenticator.SSH_SK_USER_PRESENCE_REQD);

        SshKey key = SshKeys.generatePrivateKey("sk-ssh-ed25519@openssh.com", "token@test",
                new KeyGenerationOptions().authenticator(authenticator).pin("1234"));
        assertEquals("sk-ssh-ed25519@openssh.com", key.getAlgorithm());
        assertTrue(key.hasPrivateKey(), "No key handle");
        verify(authenticator).enroll(eq(SecurityKeyAuthenticator.SSH_SK_ED25519),
                eq("ssh:".getBytes(StandardCharsets.UTF_8)), any(), eq("1234"), eq(false), eq(true));

        byte[] sig = key.sign(DATA, "sk-ssh-ed25519@openssh.com");
        assertTrue(key.verify(DATA, sig), "Token signature not verified");
        assertTrue(key.convertToPublic().verify(DATA, sig), "Public key did not verify");
        assertFalse(key.verify("other data".getBytes(StandardCharsets.UTF_8), sig), "Verified other data");
    }

    @Test
    void ecdsaEnrollAndSign() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
        generator.initialize(new ECGenParameterSpec("secp256r1"));
        KeyPair token = generator.generateKeyPair();
        byte[] point = ECCurves.nistp256.encodePoint(((ECPublicKey) token.getPublic()).getW());
        SecurityKeyAuthenticator authenticator = mockToken(
                SecurityKeyAuthenticator.SSH_SK_ECDSA, point, token.getPrivate(), "SHA256withECDSA",
                SecurityKeyAuthenticator.SSH_SK_USER_PRESENCE_REQD);

        SshKey key = SshKeys.generatePrivateKey("sk-ecdsa-sha2-nistp256@openssh.com", null,
                new KeyGenerationOptions().authenticator(authenticator));
        byte[] sig = key.sign(DATA, "sk-ecdsa-sha2-nistp256@openssh.com");
        assertTrue(key.verify(DATA, sig), "Token signature not verified");
    }

    @Test
    void missingTouchRejected() throws Exception {
        KeyPair token = KeyPairGenerator.getInstance("Ed25519").generateKeyPair();
        SecurityKeyAuthenticator authenticator = mockToken(
                SecurityKeyAuthenticator.SSH_SK_ED25519, ed25519PublicValue(token), token.getPrivate(), "Ed25519", 0);

        SshKey touch = SshKeys.generatePrivateKey("sk-ssh-ed25519@openssh.com", null,
                new KeyGenerationOptions().authenticator(authenticator));
        assertFalse(touch.verify(DATA, touch.sign(DATA, "sk-ssh-ed25519@openssh.com")), "Untouched signature");

        SshKey noTouch = SshKeys.generatePrivateKey("sk-ssh-ed25519@openssh.com", null,
                new KeyGenerationOptions().authenticator(authenticator).touchRequired(false));
        assertTrue(noTouch.verify(DATA, noTouch.sign(DATA, "sk-ssh-ed25519@openssh.com")), "Signature rejected");
    }

    @Test
    void privateExportKeepsKeyHandle() throws Exception {
        KeyPair token = KeyPairGenerator.getInstance("Ed25519").generateKeyPair();
        SecurityKeyAuthenticator authenticator = mockToken(
                SecurityKeyAuthenticator.SSH_SK_ED25519, ed25519PublicValue(token), token.getPrivate(), "Ed25519",
                SecurityKeyAuthenticator.SSH_SK_USER_PRESENCE_REQD);
        SshKey key = SshKeys.generatePrivateKey("sk-ssh-ed25519@openssh.com", "token@test",
                new KeyGenerationOptions().authenticator(authenticator).application("ssh:test"));

        AbstractSecurityKeySshKey imported = assertInstanceOf(AbstractSecurityKeySshKey.class,
                SshKeys.importPrivateKey(key.exportPrivateKey(), null));
        assertEquals(key, imported);
        assertArrayEquals(KEY_HANDLE, imported.getKeyHandle());
        assertArrayEquals("ssh:test".getBytes(StandardCharsets.UTF_8), imported.getApplication());
        assertNull(imported.getAuthenticator(), "Unexpected authenticator");
        assertThrows(IllegalStateException.class, () -> imported.sign(DATA, "sk-ssh-ed25519@openssh.com"));

        imported.setAuthenticator(authenticator);
        assertTrue(key.verify(DATA, imported.sign(DATA, "sk-ssh-ed25519@openssh.com")), "Signature rejected");
    }

    @Test
    void enrollmentFailures() throws Exception {
        assertThrows(KeyGenerationException.class,
                () -> SshKeys.generatePrivateKey("sk-ssh-ed25519@openssh.com", null, null));

        SecurityKeyAuthenticator authenticator = mock(SecurityKeyAuthenticator.class);
        when(authenticator.enroll(anyInt(), any(), any(), any(), anyBoolean(), anyBoolean()))
                .thenThrow(new IOException("No token present"));
        KeyGenerationException e = assertThrows(KeyGenerationException.class,
                () -> SshKeys.generatePrivateKey("sk-ssh-ed25519@openssh.com", null,
                        new KeyGenerationOptions().authenticator(authenticator)));
        assertTrue(e.getMessage().contains("No token present"), e.getMessage());
    }

    static byte[] ed25519PublicValue(KeyPair pair) {
        byte[] encoded = pair.getPublic().getEncoded();
        // the raw key is the tail of the X.509 encoding
        return Arrays.copyOfRange(encoded, encoded.length - 32, encoded.length);
    }

    static SecurityKeyAuthenticator mockToken(
            int alg, byte[] publicValue, PrivateKey privateKey, String signatureAlgorithm, int tokenFlags)
            throws Exception {
        SecurityKeyAuthenticator authenticator = mock(SecurityKeyAuthenticator.class);
        when(authenticator.enroll(eq(alg), any(), any(), any(), anyBoolean(), anyBoolean()))
                .thenReturn(new SecurityKeyEnrollment(publicValue, KEY_HANDLE));
        when(authenticator.sign(any(), any(), any(), anyInt())).thenAnswer(invocation -> {
            byte[] messageHash = invocation.getArgument(0);
            byte[] application = invocation.getArgument(1);
            long counter = 7L;
            ByteBuffer message = ByteBuffer.allocate(32 + 1 + Integer.BYTES + messageHash.length);
            message.put(MessageDigest.getInstance("SHA-256").digest(application));
            message.put((byte) tokenFlags);
            message.putInt((int) counter);
            message.put(messageHash);

            Signature signer = Signature.getInstance(signatureAlgorithm);
            signer.initSign(privateKey);
            signer.update(message.array());
            return new SecurityKeySignature(tokenFlags, counter, signer.sign());
        });
        return authenticator;
    }
}
