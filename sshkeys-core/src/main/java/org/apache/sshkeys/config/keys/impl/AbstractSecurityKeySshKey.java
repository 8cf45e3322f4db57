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

package org.apache.sshkeys.config.keys.impl;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.SignatureException;

import org.apache.sshkeys.common.digest.BuiltinDigests;
import org.apache.sshkeys.common.digest.DigestUtils;
import org.apache.sshkeys.common.util.ValidateUtils;
import org.apache.sshkeys.common.util.buffer.Buffer;
import org.apache.sshkeys.common.util.buffer.ByteArrayBuffer;
import org.apache.sshkeys.config.keys.SshKey;
import org.apache.sshkeys.config.keys.sk.SecurityKeyAuthenticator;
import org.apache.sshkeys.config.keys.sk.SecurityKeySignature;

/**
 * A key whose private half lives on a FIDO2/U2F token. The private encoding holds the token key handle instead of
 * the private value, and signing goes through a {@link SecurityKeyAuthenticator}.
 * <P>
 * A signature covers {@code sha256(application) || flags || uint32(counter) || sha256(data)}. When
 * {@link #isTouchRequired() touch is required} a signature without the user presence flag is rejected.
 * </P>
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public abstract class AbstractSecurityKeySshKey extends SshKey {
    private final byte[] application;
    private final int flags;
    private final byte[] keyHandle;
    private final byte[] reserved;
    private SecurityKeyAuthenticator authenticator;

    /**
     * @param algorithm   The key algorithm
     * @param application The application the key was enrolled for
     * @param flags       The key flags
     * @param keyHandle   The token key handle - {@code null} for a public key
     * @param reserved    The reserved field of the private encoding
     */
    protected AbstractSecurityKeySshKey(
                                        String algorithm, byte[] application, int flags, byte[] keyHandle,
                                        byte[] reserved) {
        super(algorithm);
        this.application = ValidateUtils.checkNotNull(application, "No application").clone();
        this.flags = flags & 0xFF;
        this.keyHandle = (keyHandle == null) ? null : keyHandle.clone();
        this.reserved = (reserved == null) ? new byte[0] : reserved.clone();
        setTouchRequired((keyHandle == null) || ((flags & SecurityKeyAuthenticator.SSH_SK_USER_PRESENCE_REQD) != 0));
    }

    public byte[] getApplication() {
        return application.clone();
    }

    public int getFlags() {
        return flags;
    }

    public byte[] getKeyHandle() {
        return (keyHandle == null) ? null : keyHandle.clone();
    }

    public SecurityKeyAuthenticator getAuthenticator() {
        return authenticator;
    }

    public void setAuthenticator(SecurityKeyAuthenticator authenticator) {
        this.authenticator = authenticator;
    }

    @Override
    public PrivateKey getPrivateKey() {
        return null;
    }

    @Override
    public boolean hasPrivateKey() {
        return keyHandle != null;
    }

    /**
     * Writes the fields that follow the public ones in the private encoding
     *
     * @param buffer The target {@link Buffer}
     */
    protected void encodeTokenFields(Buffer buffer) {
        buffer.putByte((byte) flags);
        buffer.putBytes(keyHandle);
        buffer.putBytes(reserved);
    }

    @Override
    protected void signSsh(Buffer out, byte[] data, String sigAlgorithm) throws GeneralSecurityException {
        SecurityKeyAuthenticator auth = getAuthenticator();
        ValidateUtils.checkState(auth != null, "No security key authenticator configured for %s", getAlgorithm());

        SecurityKeySignature result;
        try {
            result = auth.sign(DigestUtils.digest(BuiltinDigests.sha256, data), application, keyHandle, flags);
        } catch (IOException e) {
            throw new SignatureException("Security key signing failed: " + e.getMessage(), e);
        }

        putTokenSignature(out, result.getSignature());
        out.putByte((byte) result.getFlags());
        out.putUInt(result.getCounter());
    }

    @Override
    protected boolean verifySsh(byte[] data, String sigAlgorithm, Buffer buffer) throws GeneralSecurityException {
        byte[] sig = buffer.getBytes();
        int sigFlags = buffer.getUByte();
        long counter = buffer.getUInt();
        buffer.checkEnd();

        if (isTouchRequired() && ((sigFlags & SecurityKeyAuthenticator.SSH_SK_USER_PRESENCE_REQD) == 0)) {
            return false;
        }

        Buffer message = new ByteArrayBuffer(2 * BuiltinDigests.sha256.getDigestSize() + Integer.BYTES + 1);
        message.putRawBytes(DigestUtils.digest(BuiltinDigests.sha256, application));
        message.putByte((byte) sigFlags);
        message.putUInt(counter);
        message.putRawBytes(DigestUtils.digest(BuiltinDigests.sha256, data));
        return verifyTokenSignature(message.getCompactData(), sig);
    }

    /**
     * @param out       The target {@link Buffer}
     * @param signature The raw signature returned by the token
     */
    protected abstract void putTokenSignature(Buffer out, byte[] signature) throws GeneralSecurityException;

    /**
     * @param  message                  The signed message
     * @param  sig                      The signature blob as it appears in the SSH signature
     * @return                          {@code true} if valid
     * @throws GeneralSecurityException If failed to initialize the verifier
     */
    protected abstract boolean verifyTokenSignature(byte[] message, byte[] sig) throws GeneralSecurityException;
}
