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

import java.security.PublicKey;

import org.apache.sshkeys.common.util.NumberUtils;
import org.apache.sshkeys.common.util.buffer.Buffer;
import org.apache.sshkeys.config.keys.KeyImportException;
import org.apache.sshkeys.config.keys.sk.SecurityKeyAuthenticator;

/**
 * {@code sk-ssh-ed25519@openssh.com} keys
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public class SkED25519KeyHandler extends AbstractSecurityKeyHandler {
    public static final String KEY_TYPE = "sk-ssh-ed25519@openssh.com";

    public static final SkED25519KeyHandler INSTANCE = new SkED25519KeyHandler();

    public SkED25519KeyHandler() {
        super(KEY_TYPE, SecurityKeyAuthenticator.SSH_SK_ED25519);
    }

    @Override
    public SkED25519SshKey decodeSshPublic(String algorithm, Buffer buffer) throws KeyImportException {
        byte[] pub = buffer.getBytes();
        byte[] application = buffer.getBytes();
        return new SkED25519SshKey(toPublicKey(pub), application, 0, null, null);
    }

    @Override
    public SkED25519SshKey decodeSshPrivate(String algorithm, Buffer buffer) throws KeyImportException {
        byte[] pub = buffer.getBytes();
        byte[] application = buffer.getBytes();
        int flags = buffer.getUByte();
        byte[] keyHandle = buffer.getBytes();
        byte[] reserved = buffer.getBytes();
        return new SkED25519SshKey(toPublicKey(pub), application, flags, keyHandle, reserved);
    }

    @Override
    public SkED25519SshKey makePrivate(
            byte[] publicValue, byte[] application, int flags, byte[] keyHandle, byte[] reserved)
            throws KeyImportException {
        return new SkED25519SshKey(toPublicKey(publicValue), application, flags, keyHandle, reserved);
    }

    protected PublicKey toPublicKey(byte[] pub) throws KeyImportException {
        if (NumberUtils.length(pub) != EdDSAKeyHandler.ED25519.getKeySize()) {
            throw new KeyImportException("Invalid " + KEY_TYPE + " public key");
        }
        return EdDSAKeyHandler.ED25519.toPublicKey(pub);
    }
}
