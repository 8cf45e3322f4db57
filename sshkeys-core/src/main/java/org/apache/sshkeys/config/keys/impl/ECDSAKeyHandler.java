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
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.ECPublicKey;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.ECPoint;
import java.security.spec.ECPrivateKeySpec;
import java.security.spec.ECPublicKeySpec;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.sshkeys.common.util.buffer.Buffer;
import org.apache.sshkeys.common.util.buffer.ByteArrayBuffer;
import org.apache.sshkeys.config.keys.KeyGenerationException;
import org.apache.sshkeys.config.keys.KeyGenerationOptions;
import org.apache.sshkeys.config.keys.KeyImportException;
import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1Integer;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.ASN1OctetString;
import org.bouncycastle.asn1.ASN1Primitive;
import org.bouncycastle.asn1.ASN1Sequence;
import org.bouncycastle.asn1.ASN1TaggedObject;
import org.bouncycastle.asn1.DERBitString;
import org.bouncycastle.asn1.x509.AlgorithmIdentifier;
import org.bouncycastle.asn1.x9.X9ObjectIdentifiers;

/**
 * {@code ecdsa-sha2-nistp256}, {@code ecdsa-sha2-nistp384} and {@code ecdsa-sha2-nistp521} keys
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public class ECDSAKeyHandler extends AbstractKeyHandler {
    public static final ECDSAKeyHandler INSTANCE = new ECDSAKeyHandler();

    public ECDSAKeyHandler() {
        super("EC", X9ObjectIdentifiers.id_ecPublicKey.getId());
    }

    @Override
    public List<String> getSigAlgorithms(String algorithm) {
        return Collections.singletonList(algorithm);
    }

    @Override
    public List<String> getX509Algorithms(String algorithm) {
        return Collections.singletonList("x509v3-" + algorithm);
    }

    @Override
    public String getDefaultX509Hash(String algorithm) {
        ECCurves curve = ECCurves.fromKeyType(algorithm);
        return (curve == null) ? null : curve.getDigest().getName();
    }

    @Override
    public ECDSASshKey generate(String algorithm, KeyGenerationOptions options) throws KeyGenerationException {
        ECCurves curve = ECCurves.fromKeyType(algorithm);
        if (curve == null) {
            throw new KeyGenerationException("Unknown ECDSA curve for " + algorithm);
        }

        KeyPair kp = generateKeyPair("EC", new ECGenParameterSpec(curve.getSecName()));
        return new ECDSASshKey(curve, (ECPublicKey) kp.getPublic(), (ECPrivateKey) kp.getPrivate());
    }

    @Override
    public ECDSASshKey decodeSshPublic(String algorithm, Buffer buffer) throws KeyImportException {
        ECCurves curve = resolveCurve(algorithm, buffer.getString());
        byte[] q = buffer.getBytes();
        return makePublic(curve, q);
    }

    @Override
    public ECDSASshKey decodeSshPrivate(String algorithm, Buffer buffer) throws KeyImportException {
        ECCurves curve = resolveCurve(algorithm, buffer.getString());
        byte[] q = buffer.getBytes();
        BigInteger d = buffer.getMPInt();
        return makePrivate(curve, d, q);
    }

    /**
     * Decodes a SEC1 {@code ECPrivateKey} - this is what {@code EC PRIVATE KEY} PEM blocks hold
     */
    @Override
    public ECDSASshKey decodePkcs1Private(ASN1Primitive data) throws KeyImportException {
        if (!(data instanceof ASN1Sequence)) {
            return null;
        }

        ASN1Sequence seq = (ASN1Sequence) data;
        if ((seq.size() < 3) || !isVersion1(seq.getObjectAt(0)) || !(seq.getObjectAt(1) instanceof ASN1OctetString)) {
            return null;
        }

        ASN1TaggedObject params = taggedAt(seq, 2, 0);
        if (params == null) {
            return null;
        }

        return decodeECPrivateKey(params.getExplicitBaseObject(), seq);
    }

    @Override
    public ECDSASshKey decodePkcs8Private(AlgorithmIdentifier algorithm, byte[] data) throws KeyImportException {
        ASN1Primitive value = RSAKeyHandler.parseQuietly(data);
        if (!(value instanceof ASN1Sequence)) {
            return null;
        }

        ASN1Sequence seq = (ASN1Sequence) value;
        if ((seq.size() < 2) || !isVersion1(seq.getObjectAt(0)) || !(seq.getObjectAt(1) instanceof ASN1OctetString)) {
            return null;
        }

        return decodeECPrivateKey(algorithm.getParameters(), seq);
    }

    @Override
    public ECDSASshKey decodePkcs8Public(AlgorithmIdentifier algorithm, byte[] data) throws KeyImportException {
        ECCurves curve = curveOf(algorithm.getParameters());
        return (curve == null) ? null : makePublic(curve, data);
    }

    public ECDSASshKey makePublic(ECCurves curve, byte[] q) throws KeyImportException {
        return new ECDSASshKey(curve, toPublicKey(curve, q), null);
    }

    /**
     * @param  curve              The curve
     * @param  d                  The private scalar
     * @param  q                  The public point - if {@code null} it is derived from the private value
     * @return                    The key pair
     * @throws KeyImportException If the values do not describe a valid key
     */
    public ECDSASshKey makePrivate(ECCurves curve, BigInteger d, byte[] q) throws KeyImportException {
        if (!isPositive(d)) {
            throw new KeyImportException("Invalid ECDSA private key");
        }

        ECPublicKey pub = (q == null)
                ? (ECPublicKey) generatePublicKey(
                        "EC", new ECPublicKeySpec(curve.derivePublicPoint(d), curve.getParameters()))
                : toPublicKey(curve, q);
        ECPrivateKey prv = (ECPrivateKey) generatePrivateKey("EC", new ECPrivateKeySpec(d, curve.getParameters()));
        return new ECDSASshKey(curve, pub, prv);
    }

    protected ECPublicKey toPublicKey(ECCurves curve, byte[] q) throws KeyImportException {
        ECPoint point;
        try {
            point = curve.decodePoint(q);
        } catch (IllegalArgumentException e) {
            throw new KeyImportException("Invalid ECDSA public key: " + e.getMessage(), e);
        }
        return (ECPublicKey) generatePublicKey("EC", new ECPublicKeySpec(point, curve.getParameters()));
    }

    private ECDSASshKey decodeECPrivateKey(ASN1Encodable params, ASN1Sequence seq) throws KeyImportException {
        ECCurves curve = curveOf(params);
        if (curve == null) {
            return null;
        }

        BigInteger d = new BigInteger(1, ((ASN1OctetString) seq.getObjectAt(1)).getOctets());
        byte[] q = null;
        for (int index = 2; index < seq.size(); index++) {
            ASN1TaggedObject pub = taggedAt(seq, index, 1);
            if (pub != null) {
                q = DERBitString.getInstance(pub, true).getOctets();
            }
        }

        return makePrivate(curve, d, q);
    }

    private static ECCurves resolveCurve(String algorithm, String curveName) throws KeyImportException {
        ECCurves curve = ECCurves.fromCurveName(curveName);
        if (curve == null) {
            throw new KeyImportException("Unknown ECDSA curve: " + curveName);
        }
        if (!curve.getKeyType().equals(algorithm)) {
            throw new KeyImportException("ECDSA curve " + curveName + " does not match " + algorithm);
        }
        return curve;
    }

    private static ECCurves curveOf(ASN1Encodable params) {
        return (params instanceof ASN1ObjectIdentifier)
                ? ECCurves.fromOID(((ASN1ObjectIdentifier) params).getId()) : null;
    }

    private static boolean isVersion1(ASN1Encodable value) {
        return (value instanceof ASN1Integer) && ((ASN1Integer) value).hasValue(1);
    }

    private static ASN1TaggedObject taggedAt(ASN1Sequence seq, int index, int tag) {
        if (index >= seq.size()) {
            return null;
        }

        ASN1Encodable value = seq.getObjectAt(index);
        if ((value instanceof ASN1TaggedObject) && (((ASN1TaggedObject) value).getTagNo() == tag)) {
            return (ASN1TaggedObject) value;
        }
        return null;
    }

    /**
     * Writes a raw {@code r || s} signature as {@code string(mpint(r) || mpint(s))}
     *
     * @param out The target {@link Buffer}
     * @param raw The raw signature - two equal length halves
     */
    public static void putRawSignature(Buffer out, byte[] raw) {
        int half = raw.length / 2;
        Buffer rs = new ByteArrayBuffer(raw.length + 2 * Integer.BYTES + 2);
        rs.putMPInt(new BigInteger(1, Arrays.copyOfRange(raw, 0, half)));
        rs.putMPInt(new BigInteger(1, Arrays.copyOfRange(raw, half, raw.length)));
        out.putBytes(rs.getCompactData());
    }

    /**
     * @param  blob      The {@code mpint(r) || mpint(s)} encoding
     * @param  numOctets Size of each half of the raw signature
     * @return           The raw {@code r || s} signature - {@code null} if either value does not fit
     */
    public static byte[] toRawSignature(byte[] blob, int numOctets) {
        Buffer rs = new ByteArrayBuffer(blob);
        BigInteger r = rs.getMPInt();
        BigInteger s = rs.getMPInt();
        rs.checkEnd();

        byte[] raw = new byte[2 * numOctets];
        if (!putUnsigned(r, raw, 0, numOctets) || !putUnsigned(s, raw, numOctets, numOctets)) {
            return null;
        }
        return raw;
    }

    private static boolean putUnsigned(BigInteger value, byte[] buf, int offset, int len) {
        if ((value.signum() < 0) || (value.bitLength() > len * Byte.SIZE)) {
            return false;
        }

        byte[] bytes = value.toByteArray();
        int start = (bytes.length > len) ? bytes.length - len : 0;
        System.arraycopy(bytes, start, buf, offset + len - (bytes.length - start), bytes.length - start);
        return true;
    }
}
