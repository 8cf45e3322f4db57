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

import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.security.Signature;
import java.util.Objects;

import org.apache.sshkeys.common.util.buffer.Buffer;
import org.apache.sshkeys.config.keys.SshKeyHandler;

/**
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public class SkED25519SshKey extends AbstractSecurityKeySshKey {
    private final PublicKey publicKey;

    public SkED25519SshKey(PublicKey publicKey, byte[] application, int flags, byte[] keyHandle, byte[] reserved) {
        super(SkED25519KeyHandler.KEY_TYPE, application, flags, keyHandle, reserved);
        this.publicKey = Objects.requireNonNull(publicKey, "No public key");
    }

    @Override
    public SshKeyHandler getHandler() {
        return SkED25519KeyHandler.INSTANCE;
    }

    @Override
    public PublicKey getPublicKey() {
        return publicKey;
    }

    @Override
    public void encodeSshPublic(Buffer buffer) {
        buffer.putBytes(EdDSAKeyHandler.ED25519.getPublicValue(publicKey));
        buffer.putBytes(getApplication());
    }

    @Override
    public void encodeSshPrivate(Buffer buffer) {
        encodeSshPublic(buffer);
        encodeTokenFields(buffer);
    }

    @Override
    protected void putTokenSignature(Buffer out, byte[] signature) {
        out.putBytes(signature);
    }

    @Override
    protected boolean verifyTokenSignature(byte[] message, byte[] sig) throws GeneralSecurityException {
        Signature verifier = AbstractKeyHandler.getSignature(EdDSAKeyHandler.ED25519.getJcaAlgorithm());
        verifier.initVerify(publicKey);
        verifier.update(message);
        return verifier.verify(sig);
    }
}
