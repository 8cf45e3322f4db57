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
import java.security.Signature;
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.ECPublicKey;
import java.util.Objects;

import org.apache.sshkeys.common.util.buffer.Buffer;
import org.apache.sshkeys.config.keys.SshKey;
import org.apache.sshkeys.config.keys.SshKeyHandler;
import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.DERBitString;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.asn1.x509.AlgorithmIdentifier;
import org.bouncycastle.asn1.x9.X9ObjectIdentifiers;

/**
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public class ECDSASshKey extends SshKey {
    private final ECCurves curve;
    private final ECPublicKey publicKey;
    private final ECPrivateKey privateKey;

    public ECDSASshKey(ECCurves curve, ECPublicKey publicKey, ECPrivateKey privateKey) {
        super(Objects.requireNonNull(curve, "No curve").getKeyType());
        this.curve = curve;
        this.publicKey = Objects.requireNonNull(publicKey, "No public key");
        this.privateKey = privateKey;
    }

    public ECCurves getCurve() {
        return curve;
    }

    @Override
    public SshKeyHandler getHandler() {
        return ECDSAKeyHandler.INSTANCE;
    }

    @Override
    public ECPublicKey getPublicKey() {
        return publicKey;
    }

    @Override
    public ECPrivateKey getPrivateKey() {
        return privateKey;
    }

    @Override
    public boolean hasPrivateKey() {
        return privateKey != null;
    }

    public byte[] getPublicValue() {
        return curve.encodePoint(publicKey.getW());
    }

    @Override
    public void encodeSshPublic(Buffer buffer) {
        buffer.putString(curve.getName());
        buffer.putBytes(getPublicValue());
    }

    @Override
    public void encodeSshPrivate(Buffer buffer) {
        encodeSshPublic(buffer);
        buffer.putMPInt(privateKey.getS());
    }

    @Override
    public void encodeAgentCertPrivate(Buffer buffer) {
        buffer.putMPInt(privateKey.getS());
    }

    @Override
    public ASN1Encodable encodePkcs1PrivateKey() {
        return toECPrivateKey(new ASN1ObjectIdentifier(curve.getOID()));
    }

    @Override
    public PrivateKeyInfo encodePkcs8PrivateKey() {
        AlgorithmIdentifier algId = new AlgorithmIdentifier(
                X9ObjectIdentifiers.id_ecPublicKey, new ASN1ObjectIdentifier(curve.getOID()));
        try {
            return new PrivateKeyInfo(algId, toECPrivateKey(null));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode EC private key", e);
        }
    }

    private org.bouncycastle.asn1.sec.ECPrivateKey toECPrivateKey(ASN1Encodable params) {
        return new org.bouncycastle.asn1.sec.ECPrivateKey(
                curve.getNumPointOctets() * Byte.SIZE, privateKey.getS(), new DERBitString(getPublicValue()), params);
    }

    @Override
    protected void signSsh(Buffer out, byte[] data, String sigAlgorithm) throws GeneralSecurityException {
        Signature signer = AbstractKeyHandler.getSignature(curve.getSignatureAlgorithm());
        signer.initSign(privateKey);
        signer.update(data);
        ECDSAKeyHandler.putRawSignature(out, signer.sign());
    }

    @Override
    protected boolean verifySsh(byte[] data, String sigAlgorithm, Buffer buffer) throws GeneralSecurityException {
        byte[] blob = buffer.getBytes();
        buffer.checkEnd();

        byte[] raw = ECDSAKeyHandler.toRawSignature(blob, curve.getNumPointOctets());
        if (raw == null) {
            return false;
        }

        Signature verifier = AbstractKeyHandler.getSignature(curve.getSignatureAlgorithm());
        verifier.initVerify(publicKey);
        verifier.update(data);
        return verifier.verify(raw);
    }
}
