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
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.util.Objects;

import org.apache.sshkeys.common.util.buffer.Buffer;
import org.apache.sshkeys.config.keys.SshKey;
import org.apache.sshkeys.config.keys.SshKeyHandler;

/**
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public class EdDSASshKey extends SshKey {
    private final EdDSAKeyHandler handler;
    private final PublicKey publicKey;
    private final PrivateKey privateKey;

    public EdDSASshKey(EdDSAKeyHandler handler, PublicKey publicKey, PrivateKey privateKey) {
        super(Objects.requireNonNull(handler, "No handler").getKeyType());
        this.handler = handler;
        this.publicKey = Objects.requireNonNull(publicKey, "No public key");
        this.privateKey = privateKey;
    }

    @Override
    public SshKeyHandler getHandler() {
        return handler;
    }

    @Override
    public PublicKey getPublicKey() {
        return publicKey;
    }

    @Override
    public PrivateKey getPrivateKey() {
        return privateKey;
    }

    @Override
    public boolean hasPrivateKey() {
        return privateKey != null;
    }

    public byte[] getPublicValue() {
        return handler.getPublicValue(publicKey);
    }

    @Override
    public void encodeSshPublic(Buffer buffer) {
        buffer.putBytes(getPublicValue());
    }

    @Override
    public void encodeSshPrivate(Buffer buffer) {
        encodeAgentCertPrivate(buffer);
    }

    @Override
    public void encodeAgentCertPrivate(Buffer buffer) {
        byte[] pub = getPublicValue();
        byte[] seed = handler.getPrivateValue(privateKey);
        byte[] prv = new byte[seed.length + pub.length];
        System.arraycopy(seed, 0, prv, 0, seed.length);
        System.arraycopy(pub, 0, prv, seed.length, pub.length);
        buffer.putBytes(pub);
        buffer.putBytes(prv);
    }

    @Override
    protected void signSsh(Buffer out, byte[] data, String sigAlgorithm) throws GeneralSecurityException {
        Signature signer = AbstractKeyHandler.getSignature(handler.getJcaAlgorithm());
        signer.initSign(privateKey);
        signer.update(data);
        out.putBytes(signer.sign());
    }

    @Override
    protected boolean verifySsh(byte[] data, String sigAlgorithm, Buffer buffer) throws GeneralSecurityException {
        byte[] sig = buffer.getBytes();
        buffer.checkEnd();

        Signature verifier = AbstractKeyHandler.getSignature(handler.getJcaAlgorithm());
        verifier.initVerify(publicKey);
        verifier.update(data);
        return verifier.verify(sig);
    }
}
