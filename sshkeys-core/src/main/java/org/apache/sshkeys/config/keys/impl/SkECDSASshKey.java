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

import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.Signature;
import java.security.SignatureException;
import java.security.interfaces.ECPublicKey;
import java.util.Objects;

import org.apache.sshkeys.common.util.buffer.Buffer;
import org.apache.sshkeys.common.util.buffer.ByteArrayBuffer;
import org.apache.sshkeys.config.keys.SshKeyHandler;
import org.bouncycastle.asn1.ASN1Integer;
import org.bouncycastle.asn1.ASN1Sequence;

/**
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public class SkECDSASshKey extends AbstractSecurityKeySshKey {
    private final ECPublicKey publicKey;

    public SkECDSASshKey(ECPublicKey publicKey, byte[] application, int flags, byte[] keyHandle, byte[] reserved) {
        super(SkECDSAKeyHandler.KEY_TYPE, application, flags, keyHandle, reserved);
        this.publicKey = Objects.requireNonNull(publicKey, "No public key");
    }

    @Override
    public SshKeyHandler getHandler() {
        return SkECDSAKeyHandler.INSTANCE;
    }

    @Override
    public ECPublicKey getPublicKey() {
        return publicKey;
    }

    @Override
    public void encodeSshPublic(Buffer buffer) {
        buffer.putString(ECCurves.nistp256.getName());
        buffer.putBytes(ECCurves.nistp256.encodePoint(publicKey.getW()));
        buffer.putBytes(getApplication());
    }

    @Override
    public void encodeSshPrivate(Buffer buffer) {
        encodeSshPublic(buffer);
        encodeTokenFields(buffer);
    }

    @Override
    protected void putTokenSignature(Buffer out, byte[] signature) throws GeneralSecurityException {
        ASN1Sequence seq;
        try {
            seq = ASN1Sequence.getInstance(signature);
        } catch (IllegalArgumentException e) {
            throw new SignatureException("Invalid security key ECDSA signature", e);
        }
        if (seq.size() != 2) {
            throw new SignatureException("Invalid security key ECDSA signature");
        }

        BigInteger r = ASN1Integer.getInstance(seq.getObjectAt(0)).getValue();
        BigInteger s = ASN1Integer.getInstance(seq.getObjectAt(1)).getValue();
        Buffer rs = new ByteArrayBuffer();
        rs.putMPInt(r);
        rs.putMPInt(s);
        out.putBytes(rs.getCompactData());
    }

    @Override
    protected boolean verifyTokenSignature(byte[] message, byte[] sig) throws GeneralSecurityException {
        byte[] raw = ECDSAKeyHandler.toRawSignature(sig, ECCurves.nistp256.getNumPointOctets());
        if (raw == null) {
            return false;
        }

        Signature verifier = AbstractKeyHandler.getSignature(ECCurves.nistp256.getSignatureAlgorithm());
        verifier.initVerify(publicKey);
        verifier.update(message);
        return verifier.verify(raw);
    }
}
