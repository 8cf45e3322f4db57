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
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.sshkeys.common.util.NumberUtils;
import org.apache.sshkeys.common.util.buffer.Buffer;
import org.apache.sshkeys.config.keys.KeyGenerationException;
import org.apache.sshkeys.config.keys.KeyGenerationOptions;
import org.apache.sshkeys.config.keys.KeyImportException;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.ASN1OctetString;
import org.bouncycastle.asn1.ASN1Primitive;
import org.bouncycastle.asn1.DEROctetString;
import org.bouncycastle.asn1.edec.EdECObjectIdentifiers;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.asn1.x509.AlgorithmIdentifier;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed448PrivateKeyParameters;

/**
 * {@code ssh-ed25519} and {@code ssh-ed448} keys. The JCA keys are built from their raw encodings through the
 * standard X.509/PKCS#8 structures, and BouncyCastle derives the public value from a private seed.
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public class EdDSAKeyHandler extends AbstractKeyHandler {
    public static final String ED25519_KEY_TYPE = "ssh-ed25519";
    public static final String ED448_KEY_TYPE = "ssh-ed448";

    public static final EdDSAKeyHandler ED25519 = new EdDSAKeyHandler(
            ED25519_KEY_TYPE, "Ed25519", EdECObjectIdentifiers.id_Ed25519.getId(),
            Ed25519PrivateKeyParameters.KEY_SIZE);
    public static final EdDSAKeyHandler ED448 = new EdDSAKeyHandler(
            ED448_KEY_TYPE, "Ed448", EdECObjectIdentifiers.id_Ed448.getId(), Ed448PrivateKeyParameters.KEY_SIZE);

    private final String keyType;
    private final String jcaAlgorithm;
    private final int keySize;

    protected EdDSAKeyHandler(String keyType, String jcaAlgorithm, String oid, int keySize) {
        super(null, oid);
        this.keyType = keyType;
        this.jcaAlgorithm = jcaAlgorithm;
        this.keySize = keySize;
    }

    public String getKeyType() {
        return keyType;
    }

    /**
     * @return The JCA key and signature algorithm name
     */
    public String getJcaAlgorithm() {
        return jcaAlgorithm;
    }

    /**
     * @return Size in bytes of both the public value and the private seed
     */
    public int getKeySize() {
        return keySize;
    }

    @Override
    public List<String> getSigAlgorithms(String algorithm) {
        return Collections.singletonList(keyType);
    }

    @Override
    public List<String> getX509Algorithms(String algorithm) {
        return Collections.singletonList("x509v3-" + keyType);
    }

    @Override
    public EdDSASshKey generate(String algorithm, KeyGenerationOptions options) throws KeyGenerationException {
        KeyPair kp = generateKeyPair(jcaAlgorithm, null);
        return new EdDSASshKey(this, kp.getPublic(), kp.getPrivate());
    }

    @Override
    public EdDSASshKey decodeSshPublic(String algorithm, Buffer buffer) throws KeyImportException {
        return makePublic(buffer.getBytes());
    }

    @Override
    public EdDSASshKey decodeSshPrivate(String algorithm, Buffer buffer) throws KeyImportException {
        byte[] pub = buffer.getBytes();
        byte[] prv = buffer.getBytes();
        if ((pub.length != keySize) || (prv.length != 2 * keySize)) {
            throw new KeyImportException("Invalid " + keyType + " private key");
        }

        EdDSASshKey key = makePrivate(Arrays.copyOf(prv, keySize));
        if (!Arrays.equals(pub, key.getPublicValue())) {
            throw new KeyImportException("Invalid " + keyType + " private key: public value mismatch");
        }
        return key;
    }

    @Override
    public EdDSASshKey decodePkcs8Private(AlgorithmIdentifier algorithm, byte[] data) throws KeyImportException {
        ASN1Primitive value = RSAKeyHandler.parseQuietly(data);
        if (!(value instanceof ASN1OctetString)) {
            return null;
        }
        return makePrivate(((ASN1OctetString) value).getOctets());
    }

    @Override
    public EdDSASshKey decodePkcs8Public(AlgorithmIdentifier algorithm, byte[] data) throws KeyImportException {
        return makePublic(data);
    }

    public EdDSASshKey makePublic(byte[] publicValue) throws KeyImportException {
        if (NumberUtils.length(publicValue) != keySize) {
            throw new KeyImportException("Invalid " + keyType + " public key");
        }
        return new EdDSASshKey(this, toPublicKey(publicValue), null);
    }

    public EdDSASshKey makePrivate(byte[] seed) throws KeyImportException {
        if (NumberUtils.length(seed) != keySize) {
            throw new KeyImportException("Invalid " + keyType + " private key");
        }

        byte[] publicValue = (keySize == Ed25519PrivateKeyParameters.KEY_SIZE)
                ? new Ed25519PrivateKeyParameters(seed, 0).generatePublicKey().getEncoded()
                : new Ed448PrivateKeyParameters(seed, 0).generatePublicKey().getEncoded();

        AlgorithmIdentifier algId = new AlgorithmIdentifier(new ASN1ObjectIdentifier(getPkcs8Oid()));
        PrivateKey prv;
        try {
            prv = generatePrivateKey(jcaAlgorithm,
                    new PKCS8EncodedKeySpec(new PrivateKeyInfo(algId, new DEROctetString(seed)).getEncoded()));
        } catch (IOException e) {
            throw new KeyImportException("Invalid " + keyType + " private key: " + e.getMessage(), e);
        }
        return new EdDSASshKey(this, toPublicKey(publicValue), prv);
    }

    protected PublicKey toPublicKey(byte[] publicValue) throws KeyImportException {
        AlgorithmIdentifier algId = new AlgorithmIdentifier(new ASN1ObjectIdentifier(getPkcs8Oid()));
        try {
            return generatePublicKey(jcaAlgorithm,
                    new X509EncodedKeySpec(new SubjectPublicKeyInfo(algId, publicValue).getEncoded()));
        } catch (IOException e) {
            throw new KeyImportException("Invalid " + keyType + " public key: " + e.getMessage(), e);
        }
    }

    /**
     * @param  key A JCA public key of this family
     * @return     The raw public value
     */
    public byte[] getPublicValue(PublicKey key) {
        return SubjectPublicKeyInfo.getInstance(key.getEncoded()).getPublicKeyData().getOctets();
    }

    /**
     * @param  key A JCA private key of this family
     * @return     The raw private seed
     */
    public byte[] getPrivateValue(PrivateKey key) {
        try {
            PrivateKeyInfo info = PrivateKeyInfo.getInstance(key.getEncoded());
            return ASN1OctetString.getInstance(info.parsePrivateKey()).getOctets();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to extract " + keyType + " private value", e);
        }
    }

    @Override
    public String toString() {
        return super.toString() + "[" + keyType + "]";
    }
}
