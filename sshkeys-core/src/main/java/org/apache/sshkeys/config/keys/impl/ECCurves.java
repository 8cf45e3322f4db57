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
import java.security.AlgorithmParameters;
import java.security.GeneralSecurityException;
import java.security.interfaces.ECKey;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.ECParameterSpec;
import java.security.spec.ECPoint;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import org.apache.sshkeys.common.digest.BuiltinDigests;
import org.apache.sshkeys.common.util.GenericUtils;
import org.apache.sshkeys.common.util.ValidateUtils;
import org.bouncycastle.asn1.x9.ECNamedCurveTable;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.math.ec.ECCurve;

/**
 * The NIST curves used by the {@code ecdsa-sha2-*} key types (RFC 5656)
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public enum ECCurves {
    nistp256("nistp256", "secp256r1", "1.2.840.10045.3.1.7", 32, BuiltinDigests.sha256),
    nistp384("nistp384", "secp384r1", "1.3.132.0.34", 48, BuiltinDigests.sha384),
    nistp521("nistp521", "secp521r1", "1.3.132.0.35", 66, BuiltinDigests.sha512);

    public static final String ECDSA_SHA2_PREFIX = "ecdsa-sha2-";

    public static final Set<ECCurves> VALUES = Collections.unmodifiableSet(EnumSet.allOf(ECCurves.class));

    private final String name;
    private final String secName;
    private final String keyType;
    private final String oid;
    private final int numOctets;
    private final BuiltinDigests digest;

    private ECParameterSpec params;
    private X9ECParameters x9params;

    ECCurves(String name, String secName, String oid, int numOctets, BuiltinDigests digest) {
        this.name = name;
        this.secName = secName;
        this.keyType = ECDSA_SHA2_PREFIX + name;
        this.oid = oid;
        this.numOctets = numOctets;
        this.digest = digest;
    }

    public final String getName() {
        return name;
    }

    /**
     * @return The SEC name used by JCA and BouncyCastle - e.g., {@code secp256r1}
     */
    public final String getSecName() {
        return secName;
    }

    public final String getKeyType() {
        return keyType;
    }

    public final String getOID() {
        return oid;
    }

    /**
     * @return Number of octets of a field element
     */
    public final int getNumPointOctets() {
        return numOctets;
    }

    public final BuiltinDigests getDigest() {
        return digest;
    }

    /**
     * @return The JCA signature algorithm producing raw {@code r || s} signatures
     */
    public final String getSignatureAlgorithm() {
        return digest.getAlgorithm().replace("-", "") + "withECDSAinP1363Format";
    }

    public final ECParameterSpec getParameters() {
        synchronized (this) {
            if (params == null) {
                try {
                    AlgorithmParameters factory = AlgorithmParameters.getInstance("EC");
                    factory.init(new ECGenParameterSpec(secName));
                    params = factory.getParameterSpec(ECParameterSpec.class);
                } catch (GeneralSecurityException e) {
                    throw new IllegalStateException("No EC params for " + name, e);
                }
            }
            return params;
        }
    }

    private X9ECParameters getX9Parameters() {
        synchronized (this) {
            if (x9params == null) {
                x9params = ValidateUtils.checkNotNull(ECNamedCurveTable.getByName(secName), "No curve for %s", name);
            }
            return x9params;
        }
    }

    /**
     * @param  octets                   An uncompressed or compressed point encoding
     * @return                          The matching JCA point
     * @throws IllegalArgumentException If the encoding is invalid or the point is not on the curve
     */
    public ECPoint decodePoint(byte[] octets) {
        ECCurve curve = getX9Parameters().getCurve();
        org.bouncycastle.math.ec.ECPoint point = curve.decodePoint(octets).normalize();
        ValidateUtils.checkTrue(point.isValid() && !point.isInfinity(), "Invalid EC point for %s", name);
        return new ECPoint(point.getAffineXCoord().toBigInteger(), point.getAffineYCoord().toBigInteger());
    }

    /**
     * @param  point The JCA point
     * @return       The uncompressed encoding - {@code 0x04 || X || Y}
     */
    public byte[] encodePoint(ECPoint point) {
        byte[] m = new byte[2 * numOctets + 1];
        m[0] = 0x04;
        putFieldElement(point.getAffineX(), m, 1);
        putFieldElement(point.getAffineY(), m, 1 + numOctets);
        return m;
    }

    private void putFieldElement(BigInteger value, byte[] buf, int offset) {
        byte[] bytes = value.toByteArray();
        int start = 0;
        while ((bytes.length - start > numOctets) && (bytes[start] == 0)) {
            start++;
        }
        int len = bytes.length - start;
        System.arraycopy(bytes, start, buf, offset + numOctets - len, len);
    }

    /**
     * @param  d The private scalar
     * @return   The public point {@code d * G}
     */
    public ECPoint derivePublicPoint(BigInteger d) {
        org.bouncycastle.math.ec.ECPoint q = getX9Parameters().getG().multiply(d).normalize();
        return new ECPoint(q.getAffineXCoord().toBigInteger(), q.getAffineYCoord().toBigInteger());
    }

    public static ECCurves fromCurveName(String name) {
        if (GenericUtils.isEmpty(name)) {
            return null;
        }

        for (ECCurves c : VALUES) {
            if (name.equals(c.getName())) {
                return c;
            }
        }

        return null;
    }

    public static ECCurves fromKeyType(String type) {
        if (GenericUtils.isEmpty(type)) {
            return null;
        }

        for (ECCurves c : VALUES) {
            if (type.equals(c.getKeyType())) {
                return c;
            }
        }

        return null;
    }

    public static ECCurves fromOID(String oid) {
        if (GenericUtils.isEmpty(oid)) {
            return null;
        }

        for (ECCurves c : VALUES) {
            if (oid.equals(c.getOID())) {
                return c;
            }
        }

        return null;
    }

    public static ECCurves fromECKey(ECKey key) {
        if (key == null) {
            return null;
        }

        int fieldSize = key.getParams().getCurve().getField().getFieldSize();
        for (ECCurves c : VALUES) {
            if (c.getParameters().getCurve().getField().getFieldSize() == fieldSize) {
                return c;
            }
        }

        return null;
    }
}
