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
import java.security.Signature;
import java.security.interfaces.DSAParams;
import java.security.interfaces.DSAPrivateKey;
import java.security.interfaces.DSAPublicKey;
import java.util.Objects;

import org.apache.sshkeys.common.util.buffer.Buffer;
import org.apache.sshkeys.config.keys.SshKey;
import org.apache.sshkeys.config.keys.SshKeyHandler;
import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1EncodableVector;
import org.bouncycastle.asn1.ASN1Integer;
import org.bouncycastle.asn1.DERSequence;

/**
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public class DSSSshKey extends SshKey {
    private final DSAPublicKey publicKey;
    private final DSAPrivateKey privateKey;

    public DSSSshKey(DSAPublicKey publicKey, DSAPrivateKey privateKey) {
        super(DSSKeyHandler.KEY_TYPE);
        this.publicKey = Objects.requireNonNull(publicKey, "No public key");
        this.privateKey = privateKey;
    }

    @Override
    public SshKeyHandler getHandler() {
        return DSSKeyHandler.INSTANCE;
    }

    @Override
    public DSAPublicKey getPublicKey() {
        return publicKey;
    }

    @Override
    public DSAPrivateKey getPrivateKey() {
        return privateKey;
    }

    @Override
    public boolean hasPrivateKey() {
        return privateKey != null;
    }

    @Override
    public void encodeSshPublic(Buffer buffer) {
        DSAParams params = publicKey.getParams();
        buffer.putMPInt(params.getP());
        buffer.putMPInt(params.getQ());
        buffer.putMPInt(params.getG());
        buffer.putMPInt(publicKey.getY());
    }

    @Override
    public void encodeSshPrivate(Buffer buffer) {
        encodeSshPublic(buffer);
        buffer.putMPInt(privateKey.getX());
    }

    @Override
    public void encodeAgentCertPrivate(Buffer buffer) {
        buffer.putMPInt(privateKey.getX());
    }

    @Override
    public ASN1Encodable encodePkcs1PrivateKey() {
        DSAParams params = publicKey.getParams();
        ASN1EncodableVector v = new ASN1EncodableVector(6);
        v.add(new ASN1Integer(0L));
        v.add(new ASN1Integer(params.getP()));
        v.add(new ASN1Integer(params.getQ()));
        v.add(new ASN1Integer(params.getG()));
        v.add(new ASN1Integer(publicKey.getY()));
        v.add(new ASN1Integer(privateKey.getX()));
        return new DERSequence(v);
    }

    @Override
    public ASN1Encodable encodePkcs1PublicKey() {
        DSAParams params = publicKey.getParams();
        ASN1EncodableVector v = new ASN1EncodableVector(4);
        v.add(new ASN1Integer(publicKey.getY()));
        v.add(new ASN1Integer(params.getP()));
        v.add(new ASN1Integer(params.getQ()));
        v.add(new ASN1Integer(params.getG()));
        return new DERSequence(v);
    }

    @Override
    protected void signSsh(Buffer out, byte[] data, String sigAlgorithm) throws GeneralSecurityException {
        Signature signer = AbstractKeyHandler.getSignature(DSSKeyHandler.SIGNATURE_ALGORITHM);
        signer.initSign(privateKey);
        signer.update(data);
        out.putBytes(signer.sign());
    }

    @Override
    protected boolean verifySsh(byte[] data, String sigAlgorithm, Buffer buffer) throws GeneralSecurityException {
        byte[] sig = buffer.getBytes();
        buffer.checkEnd();

        Signature verifier = AbstractKeyHandler.getSignature(DSSKeyHandler.SIGNATURE_ALGORITHM);
        verifier.initVerify(publicKey);
        verifier.update(data);
        return verifier.verify(sig);
    }
}
