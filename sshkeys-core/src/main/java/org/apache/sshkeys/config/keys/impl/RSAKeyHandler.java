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
import java.math.BigInteger;
import java.security.KeyPair;
import java.security.interfaces.RSAPrivateCrtKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.RSAKeyGenParameterSpec;
import java.security.spec.RSAPrivateCrtKeySpec;
import java.security.spec.RSAPublicKeySpec;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.sshkeys.common.util.GenericUtils;
import org.apache.sshkeys.common.util.buffer.Buffer;
import org.apache.sshkeys.config.keys.KeyGenerationException;
import org.apache.sshkeys.config.keys.KeyGenerationOptions;
import org.apache.sshkeys.config.keys.KeyImportException;
import org.bouncycastle.asn1.ASN1Integer;
import org.bouncycastle.asn1.ASN1Primitive;
import org.bouncycastle.asn1.ASN1Sequence;
import org.bouncycastle.asn1.DERNull;
import org.bouncycastle.asn1.pkcs.PKCSObjectIdentifiers;
import org.bouncycastle.asn1.pkcs.RSAPrivateKey;
import org.bouncycastle.asn1.x509.AlgorithmIdentifier;

/**
 * {@code ssh-rsa} keys along with the SHA-2 signature variants
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public class RSAKeyHandler extends AbstractKeyHandler {
    public static final String KEY_TYPE = "ssh-rsa";
    public static final String RSA_SHA256 = "rsa-sha2-256";
    public static final String RSA_SHA512 = "rsa-sha2-512";

    public static final int MIN_KEY_SIZE = 1024;

    /**
     * Signature algorithm name to JCA signature - in the order the algorithms are offered
     */
    public static final Map<String, String> SIGNATURES;

    public static final List<String> SIG_ALGORITHMS;

    public static final List<String> CERT_ALGORITHMS = GenericUtils.unmodifiableList(
            RSA_SHA256 + OPENSSH_CERT_SUFFIX, RSA_SHA512 + OPENSSH_CERT_SUFFIX, KEY_TYPE + OPENSSH_CERT_SUFFIX);

    public static final List<String> X509_ALGORITHMS = GenericUtils.unmodifiableList(
            "x509v3-rsa2048-sha256", "x509v3-ssh-rsa", "x509v3-sign-rsa");

    public static final Set<String> ALL_SIG_ALGORITHMS;

    public static final RSAKeyHandler INSTANCE = new RSAKeyHandler();

    static {
        Map<String, String> sigs = new LinkedHashMap<>();
        sigs.put(RSA_SHA256, "SHA256withRSA");
        sigs.put(RSA_SHA512, "SHA512withRSA");
        sigs.put("ssh-rsa-sha224@ssh.com", "SHA224withRSA");
        sigs.put("ssh-rsa-sha256@ssh.com", "SHA256withRSA");
        sigs.put("ssh-rsa-sha384@ssh.com", "SHA384withRSA");
        sigs.put("ssh-rsa-sha512@ssh.com", "SHA512withRSA");
        sigs.put(KEY_TYPE, "SHA1withRSA");
        SIG_ALGORITHMS = GenericUtils.unmodifiableList(sigs.keySet());

        // names only seen inside X.509 certificate algorithms
        sigs.put("rsa2048-sha256", "SHA256withRSA");
        sigs.put("sign-rsa", "SHA1withRSA");
        SIGNATURES = Collections.unmodifiableMap(sigs);
        ALL_SIG_ALGORITHMS = Collections.unmodifiableSet(new LinkedHashSet<>(sigs.keySet()));
    }

    public RSAKeyHandler() {
        super("RSA", PKCSObjectIdentifiers.rsaEncryption.getId());
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
    public List<String> getCertAlgorithms(String algorithm) {
        return CERT_ALGORITHMS;
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
    public RSASshKey generate(String algorithm, KeyGenerationOptions options) throws KeyGenerationException {
        int keySize = (options.getKeySize() > 0) ? options.getKeySize() : KeyGenerationOptions.DEFAULT_RSA_KEY_SIZE;
        long exponent = options.getExponent();
        if (keySize < MIN_KEY_SIZE) {
            throw new KeyGenerationException("RSA key size must be at least " + MIN_KEY_SIZE + " bits");
        }
        if ((exponent != 3L) && (exponent != 65537L)) {
            throw new KeyGenerationException("RSA public exponent must be 3 or 65537");
        }

        KeyPair kp = generateKeyPair("RSA", new RSAKeyGenParameterSpec(keySize, BigInteger.valueOf(exponent)));
        return new RSASshKey((RSAPublicKey) kp.getPublic(), (RSAPrivateCrtKey) kp.getPrivate());
    }

    @Override
    public RSASshKey decodeSshPublic(String algorithm, Buffer buffer) throws KeyImportException {
        BigInteger e = buffer.getMPInt();
        BigInteger n = buffer.getMPInt();
        return makePublic(n, e);
    }

    @Override
    public RSASshKey decodeSshPrivate(String algorithm, Buffer buffer) throws KeyImportException {
        BigInteger n = buffer.getMPInt();
        BigInteger e = buffer.getMPInt();
        BigInteger d = buffer.getMPInt();
        BigInteger iqmp = buffer.getMPInt();
        BigInteger p = buffer.getMPInt();
        BigInteger q = buffer.getMPInt();
        return makePrivate(n, e, d, p, q, iqmp);
    }

    @Override
    public RSASshKey decodePkcs1Private(ASN1Primitive data) throws KeyImportException {
        if (!isIntegerSequence(data, 9, Integer.MAX_VALUE)) {
            return null;
        }

        RSAPrivateKey key = RSAPrivateKey.getInstance(data);
        return makePrivate(key.getModulus(), key.getPublicExponent(), key.getPrivateExponent(),
                key.getPrime1(), key.getPrime2(), key.getCoefficient());
    }

    @Override
    public RSASshKey decodePkcs1Public(ASN1Primitive data) throws KeyImportException {
        if (!isIntegerSequence(data, 2, 2)) {
            return null;
        }

        org.bouncycastle.asn1.pkcs.RSAPublicKey key = org.bouncycastle.asn1.pkcs.RSAPublicKey.getInstance(data);
        return makePublic(key.getModulus(), key.getPublicExponent());
    }

    @Override
    public RSASshKey decodePkcs8Private(AlgorithmIdentifier algorithm, byte[] data) throws KeyImportException {
        if (!isNullParameters(algorithm)) {
            return null;
        }
        return decodePkcs1Private(parseQuietly(data));
    }

    @Override
    public RSASshKey decodePkcs8Public(AlgorithmIdentifier algorithm, byte[] data) throws KeyImportException {
        if (!isNullParameters(algorithm)) {
            return null;
        }
        return decodePkcs1Public(parseQuietly(data));
    }

    public RSASshKey makePublic(BigInteger n, BigInteger e) throws KeyImportException {
        if (!isPositive(n) || !isPositive(e)) {
            throw new KeyImportException("Invalid RSA public key");
        }
        return new RSASshKey((RSAPublicKey) generatePublicKey("RSA", new RSAPublicKeySpec(n, e)), null);
    }

    public RSASshKey makePrivate(BigInteger n, BigInteger e, BigInteger d, BigInteger p, BigInteger q, BigInteger iqmp)
            throws KeyImportException {
        if (!isPositive(n) || !isPositive(e) || !isPositive(d) || !isPositive(p) || !isPositive(q)) {
            throw new KeyImportException("Invalid RSA private key");
        }
        if (!n.equals(p.multiply(q))) {
            throw new KeyImportException("Invalid RSA private key: modulus does not match primes");
        }

        BigInteger dmp1 = d.mod(p.subtract(BigInteger.ONE));
        BigInteger dmq1 = d.mod(q.subtract(BigInteger.ONE));
        RSAPrivateCrtKey prv = (RSAPrivateCrtKey) generatePrivateKey(
                "RSA", new RSAPrivateCrtKeySpec(n, e, d, p, q, dmp1, dmq1, iqmp));
        RSAPublicKey pub = (RSAPublicKey) generatePublicKey("RSA", new RSAPublicKeySpec(n, e));
        return new RSASshKey(pub, prv);
    }

    static boolean isIntegerSequence(ASN1Primitive data, int minSize, int maxSize) {
        if (!(data instanceof ASN1Sequence)) {
            return false;
        }

        ASN1Sequence seq = (ASN1Sequence) data;
        if ((seq.size() < minSize) || (seq.size() > maxSize)) {
            return false;
        }

        return Arrays.stream(seq.toArray()).allMatch(ASN1Integer.class::isInstance);
    }

    static boolean isNullParameters(AlgorithmIdentifier algorithm) {
        return (algorithm.getParameters() == null) || DERNull.INSTANCE.equals(algorithm.getParameters());
    }

    /**
     * @param  data Some DER encoded bytes
     * @return      The parsed structure - {@code null} if not valid DER
     */
    static ASN1Primitive parseQuietly(byte[] data) {
        try {
            return ASN1Primitive.fromByteArray(data);
        } catch (IOException | IllegalArgumentException e) {
            return null;
        }
    }
}
