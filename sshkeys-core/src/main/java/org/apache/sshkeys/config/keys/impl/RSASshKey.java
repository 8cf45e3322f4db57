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
import java.security.interfaces.RSAPrivateCrtKey;
import java.security.interfaces.RSAPublicKey;
import java.util.Objects;

import org.apache.sshkeys.common.util.buffer.Buffer;
import org.apache.sshkeys.config.keys.SshKey;
import org.apache.sshkeys.config.keys.SshKeyHandler;
import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.pkcs.RSAPrivateKey;

/**
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public class RSASshKey extends SshKey {
    private final RSAPublicKey publicKey;
    private final RSAPrivateCrtKey privateKey;

    public RSASshKey(RSAPublicKey publicKey, RSAPrivateCrtKey privateKey) {
        super(RSAKeyHandler.KEY_TYPE);
        this.publicKey = Objects.requireNonNull(publicKey, "No public key");
        this.privateKey = privateKey;
    }

    @Override
    public SshKeyHandler getHandler() {
        return RSAKeyHandler.INSTANCE;
    }

    @Override
    public RSAPublicKey getPublicKey() {
        return publicKey;
    }

    @Override
    public RSAPrivateCrtKey getPrivateKey() {
        return privateKey;
    }

    @Override
    public boolean hasPrivateKey() {
        return privateKey != null;
    }

    @Override
    public void encodeSshPublic(Buffer buffer) {
        buffer.putMPInt(publicKey.getPublicExponent());
        buffer.putMPInt(publicKey.getModulus());
    }

    @Override
    public void encodeSshPrivate(Buffer buffer) {
        buffer.putMPInt(privateKey.getModulus());
        buffer.putMPInt(privateKey.getPublicExponent());
        buffer.putMPInt(privateKey.getPrivateExponent());
        buffer.putMPInt(privateKey.getCrtCoefficient());
        buffer.putMPInt(privateKey.getPrimeP());
        buffer.putMPInt(privateKey.getPrimeQ());
    }

    @Override
    public void encodeAgentCertPrivate(Buffer buffer) {
        buffer.putMPInt(privateKey.getPrivateExponent());
        buffer.putMPInt(privateKey.getCrtCoefficient());
        buffer.putMPInt(privateKey.getPrimeP());
        buffer.putMPInt(privateKey.getPrimeQ());
    }

    @Override
    public ASN1Encodable encodePkcs1PrivateKey() {
        return new RSAPrivateKey(
                privateKey.getModulus(), privateKey.getPublicExponent(), privateKey.getPrivateExponent(),
                privateKey.getPrimeP(), privateKey.getPrimeQ(), privateKey.getPrimeExponentP(),
                privateKey.getPrimeExponentQ(), privateKey.getCrtCoefficient());
    }

    @Override
    public ASN1Encodable encodePkcs1PublicKey() {
        return new org.bouncycastle.asn1.pkcs.RSAPublicKey(publicKey.getModulus(), publicKey.getPublicExponent());
    }

    @Override
    protected void signSsh(Buffer out, byte[] data, String sigAlgorithm) throws GeneralSecurityException {
        Signature signer = AbstractKeyHandler.getSignature(RSAKeyHandler.SIGNATURES.get(sigAlgorithm));
        signer.initSign(privateKey);
        signer.update(data);
        out.putBytes(signer.sign());
    }

    @Override
    protected boolean verifySsh(byte[] data, String sigAlgorithm, Buffer buffer) throws GeneralSecurityException {
        byte[] sig = buffer.getBytes();
        buffer.checkEnd();

        // signatures with leading zero bytes stripped are still valid
        int modulusLength = (publicKey.getModulus().bitLength() + Byte.SIZE - 1) / Byte.SIZE;
        if (sig.length < modulusLength) {
            byte[] padded = new byte[modulusLength];
            System.arraycopy(sig, 0, padded, modulusLength - sig.length, sig.length);
            sig = padded;
        }

        Signature verifier = AbstractKeyHandler.getSignature(RSAKeyHandler.SIGNATURES.get(sigAlgorithm));
        verifier.initVerify(publicKey);
        verifier.update(data);
        return verifier.verify(sig);
    }

    public BigInteger getModulus() {
        return publicKey.getModulus();
    }
}
