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
import java.security.KeyPair;
import java.security.interfaces.DSAPrivateKey;
import java.security.interfaces.DSAPublicKey;
import java.security.spec.DSAPrivateKeySpec;
import java.security.spec.DSAPublicKeySpec;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.sshkeys.common.util.GenericUtils;
import org.apache.sshkeys.common.util.buffer.Buffer;
import org.apache.sshkeys.config.keys.KeyGenerationException;
import org.apache.sshkeys.config.keys.KeyGenerationOptions;
import org.apache.sshkeys.config.keys.KeyImportException;
import org.bouncycastle.asn1.ASN1Integer;
import org.bouncycastle.asn1.ASN1Primitive;
import org.bouncycastle.asn1.ASN1Sequence;
import org.bouncycastle.asn1.x509.AlgorithmIdentifier;
import org.bouncycastle.asn1.x509.DSAParameter;
import org.bouncycastle.asn1.x9.X9ObjectIdentifiers;

/**
 * {@code ssh-dss} keys
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public class DSSKeyHandler extends AbstractKeyHandler {
    public static final String KEY_TYPE = "ssh-dss";
    public static final String SIGNATURE_ALGORITHM = "SHA1withDSAinP1363Format";
    public static final int KEY_SIZE = 1024;

    public static final List<String> SIG_ALGORITHMS = Collections.singletonList(KEY_TYPE);
    public static final List<String> X509_ALGORITHMS = GenericUtils.unmodifiableList(
            "x509v3-ssh-dss", "x509v3-sign-dss");
    public static final Set<String> ALL_SIG_ALGORITHMS = Collections.unmodifiableSet(
            new LinkedHashSet<>(GenericUtils.unmodifiableList(KEY_TYPE, "sign-dss")));

    public static final DSSKeyHandler INSTANCE = new DSSKeyHandler();

    public DSSKeyHandler() {
        super("DSA", X9ObjectIdentifiers.id_dsa.getId());
    }

    @Override
    public List<String> getSigAlgorithms(String algorithm) {
        return SIG_ALGORITHMS;
    }

    @Override
    public Collection<String> getAllSigAlgorithms(String algorithm) {
        return ALL_SIG_ALGORITHMS;
    }

    @Override
    public List<String> getX509Algorithms(String algorithm) {
        return X509_ALGORITHMS;
    }

    @Override
    public String getDefaultX509Hash(String algorithm) {
        return "sha256";
    }

    @Override
    public DSSSshKey generate(String algorithm, KeyGenerationOptions options) throws KeyGenerationException {
        KeyPair kp = generateKeyPair("DSA", KEY_SIZE);
        return new DSSSshKey((DSAPublicKey) kp.getPublic(), (DSAPrivateKey) kp.getPrivate());
    }

    @Override
    public DSSSshKey decodeSshPublic(String algorithm, Buffer buffer) throws KeyImportException {
        BigInteger p = buffer.getMPInt();
        BigInteger q = buffer.getMPInt();
        BigInteger g = buffer.getMPInt();
        BigInteger y = buffer.getMPInt();
        return makePublic(p, q, g, y);
    }

    @Override
    public DSSSshKey decodeSshPrivate(String algorithm, Buffer buffer) throws KeyImportException {
        BigInteger p = buffer.getMPInt();
        BigInteger q = buffer.getMPInt();
        BigInteger g = buffer.getMPInt();
        BigInteger y = buffer.getMPInt();
        BigInteger x = buffer.getMPInt();
        return makePrivate(p, q, g, y, x);
    }

    @Override
    public DSSSshKey decodePkcs1Private(ASN1Primitive data) throws KeyImportException {
        if (!RSAKeyHandler.isIntegerSequence(data, 6, 6)) {
            return null;
        }

        ASN1Sequence seq = (ASN1Sequence) data;
        return makePrivate(intAt(seq, 1), intAt(seq, 2), intAt(seq, 3), intAt(seq, 4), intAt(seq, 5));
    }

    @Override
    public DSSSshKey decodePkcs1Public(ASN1Primitive data) throws KeyImportException {
        if (!RSAKeyHandler.isIntegerSequence(data, 4, 4)) {
            return null;
        }

        ASN1Sequence seq = (ASN1Sequence) data;
        return makePublic(intAt(seq, 1), intAt(seq, 2), intAt(seq, 3), intAt(seq, 0));
    }

    @Override
    public DSSSshKey decodePkcs8Private(AlgorithmIdentifier algorithm, byte[] data) throws KeyImportException {
        DSAParameter params = getParameters(algorithm);
        ASN1Primitive value = RSAKeyHandler.parseQuietly(data);
        if ((params == null) || !(value instanceof ASN1Integer)) {
            return null;
        }

        BigInteger x = ((ASN1Integer) value).getValue();
        BigInteger y = params.getG().modPow(x, params.getP());
        return makePrivate(params.getP(), params.getQ(), params.getG(), y, x);
    }

    @Override
    public DSSSshKey decodePkcs8Public(AlgorithmIdentifier algorithm, byte[] data) throws KeyImportException {
        DSAParameter params = getParameters(algorithm);
        ASN1Primitive value = RSAKeyHandler.parseQuietly(data);
        if ((params == null) || !(value instanceof ASN1Integer)) {
            return null;
        }

        return makePublic(params.getP(), params.getQ(), params.getG(), ((ASN1Integer) value).getValue());
    }

    public DSSSshKey makePublic(BigInteger p, BigInteger q, BigInteger g, BigInteger y) throws KeyImportException {
        if (!isPositive(p) || !isPositive(q) || !isPositive(g) || !isPositive(y)) {
            throw new KeyImportException("Invalid DSA public key");
        }
        return new DSSSshKey((DSAPublicKey) generatePublicKey("DSA", new DSAPublicKeySpec(y, p, q, g)), null);
    }

    public DSSSshKey makePrivate(BigInteger p, BigInteger q, BigInteger g, BigInteger y, BigInteger x)
            throws KeyImportException {
        if (!isPositive(x)) {
            throw new KeyImportException("Invalid DSA private key");
        }

        DSSSshKey pub = makePublic(p, q, g, y);
        DSAPrivateKey prv = (DSAPrivateKey) generatePrivateKey("DSA", new DSAPrivateKeySpec(x, p, q, g));
        return new DSSSshKey(pub.getPublicKey(), prv);
    }

    private static DSAParameter getParameters(AlgorithmIdentifier algorithm) {
        ASN1Primitive params = (algorithm.getParameters() == null)
                ? null : algorithm.getParameters().toASN1Primitive();
        return RSAKeyHandler.isIntegerSequence(params, 3, 3) ? DSAParameter.getInstance(params) : null;
    }

    private static BigInteger intAt(ASN1Sequence seq, int index) {
        return ((ASN1Integer) seq.getObjectAt(index)).getValue();
    }
}
