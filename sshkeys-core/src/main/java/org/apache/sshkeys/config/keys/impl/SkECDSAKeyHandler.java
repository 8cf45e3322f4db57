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

import java.security.interfaces.ECPublicKey;

import org.apache.sshkeys.common.util.buffer.Buffer;
import org.apache.sshkeys.config.keys.KeyImportException;
import org.apache.sshkeys.config.keys.sk.SecurityKeyAuthenticator;

/**
 * {@code sk-ecdsa-sha2-nistp256@openssh.com} keys
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public class SkECDSAKeyHandler extends AbstractSecurityKeyHandler {
    public static final String KEY_TYPE = "sk-ecdsa-sha2-nistp256@openssh.com";

    public static final SkECDSAKeyHandler INSTANCE = new SkECDSAKeyHandler();

    public SkECDSAKeyHandler() {
        super(KEY_TYPE, SecurityKeyAuthenticator.SSH_SK_ECDSA);
    }

    @Override
    public SkECDSASshKey decodeSshPublic(String algorithm, Buffer buffer) throws KeyImportException {
        checkCurve(buffer.getString());
        byte[] q = buffer.getBytes();
        byte[] application = buffer.getBytes();
        return new SkECDSASshKey(toPublicKey(q), application, 0, null, null);
    }

    @Override
    public SkECDSASshKey decodeSshPrivate(String algorithm, Buffer buffer) throws KeyImportException {
        checkCurve(buffer.getString());
        byte[] q = buffer.getBytes();
        byte[] application = buffer.getBytes();
        int flags = buffer.getUByte();
        byte[] keyHandle = buffer.getBytes();
        byte[] reserved = buffer.getBytes();
        return new SkECDSASshKey(toPublicKey(q), application, flags, keyHandle, reserved);
    }

    @Override
    public SkECDSASshKey makePrivate(
            byte[] publicValue, byte[] application, int flags, byte[] keyHandle, byte[] reserved)
            throws KeyImportException {
        return new SkECDSASshKey(toPublicKey(publicValue), application, flags, keyHandle, reserved);
    }

    protected ECPublicKey toPublicKey(byte[] q) throws KeyImportException {
        return ECDSAKeyHandler.INSTANCE.toPublicKey(ECCurves.nistp256, q);
    }

    private static void checkCurve(String curveName) throws KeyImportException {
        if (!ECCurves.nistp256.getName().equals(curveName)) {
            throw new KeyImportException("Unsupported security key curve: " + curveName);
        }
    }
}
