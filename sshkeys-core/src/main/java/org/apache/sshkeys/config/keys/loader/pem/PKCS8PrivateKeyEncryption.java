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


package org.apache.sshkeys.config.keys.loader.pem;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.Provider;
import java.security.SecureRandom;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.PBEParameterSpec;

import org.apache.sshkeys.common.util.GenericUtils;
import org.apache.sshkeys.config.keys.KeyEncryptionException;
import org.apache.sshkeys.config.keys.loader.PrivateKeyEncryptionContext;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.ASN1Primitive;
import org.bouncycastle.asn1.DERNull;
import org.bouncycastle.asn1.nist.NISTObjectIdentifiers;
import org.bouncycastle.asn1.pkcs.EncryptedPrivateKeyInfo;
import org.bouncycastle.asn1.pkcs.PBEParameter;
import org.bouncycastle.asn1.pkcs.PKCSObjectIdentifiers;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.asn1.x509.AlgorithmIdentifier;
import org.bouncycastle.crypto.util.PBKDF2Config;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openssl.jcajce.JceOpenSSLPKCS8DecryptorProviderBuilder;
import org.bouncycastle.operator.InputDecryptorProvider;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.OutputEncryptor;
import org.bouncycastle.pkcs.PKCS8EncryptedPrivateKeyInfo;
import org.bouncycastle.pkcs.PKCS8EncryptedPrivateKeyInfoBuilder;
import org.bouncycastle.pkcs.PKCSException;
import org.bouncycastle.pkcs.jcajce.JcePKCSPBEOutputEncryptorBuilder;

/**
 * Password based encryption of PKCS#8 private keys into an {@code EncryptedPrivateKeyInfo}:
 * <UL>
 * <LI>PBES2 - PBKDF2 with the selected HMAC hash and an AES or 3DES cipher</LI>
 * <LI>PBES1 - the PKCS#12 SHA-1 schemes, or PKCS#5 v1.5 DES with MD5/SHA-1</LI>
 * </UL>
 * Decryption accepts any scheme understood by Bouncy Castle.
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public final class PKCS8PrivateKeyEncryption {
    public static final int PBES1 = 1;
    public static final int PBES2 = 2;

    public static final int DEFAULT_ITERATIONS = 2048;
    public static final int DEFAULT_SALT_SIZE = 16;

    private static final Provider PROVIDER = new BouncyCastleProvider();
    private static final SecureRandom RANDOM = new SecureRandom();

    private static final Map<String, ASN1ObjectIdentifier> PBES2_CIPHERS;
    private static final Map<String, AlgorithmIdentifier> PBES2_PRFS;
    private static final Map<String, ASN1ObjectIdentifier> PKCS12_CIPHERS;
    private static final Map<String, ASN1ObjectIdentifier> PKCS5_DES_HASHES;

    static {
        Map<String, ASN1ObjectIdentifier> ciphers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        ciphers.put("aes128-cbc", NISTObjectIdentifiers.id_aes128_CBC);
        ciphers.put("aes192-cbc", NISTObjectIdentifiers.id_aes192_CBC);
        ciphers.put("aes256-cbc", NISTObjectIdentifiers.id_aes256_CBC);
        ciphers.put("des3-cbc", PKCSObjectIdentifiers.des_EDE3_CBC);
        PBES2_CIPHERS = Collections.unmodifiableMap(ciphers);

        Map<String, AlgorithmIdentifier> prfs = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        prfs.put("sha1", hmacPrf(PKCSObjectIdentifiers.id_hmacWithSHA1));
        prfs.put("sha224", hmacPrf(PKCSObjectIdentifiers.id_hmacWithSHA224));
        prfs.put("sha256", hmacPrf(PKCSObjectIdentifiers.id_hmacWithSHA256));
        prfs.put("sha384", hmacPrf(PKCSObjectIdentifiers.id_hmacWithSHA384));
        prfs.put("sha512", hmacPrf(PKCSObjectIdentifiers.id_hmacWithSHA512));
        PBES2_PRFS = Collections.unmodifiableMap(prfs);

        Map<String, ASN1ObjectIdentifier> pkcs12 = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        pkcs12.put("des3-cbc", PKCSObjectIdentifiers.pbeWithSHAAnd3_KeyTripleDES_CBC);
        pkcs12.put("des2-cbc", PKCSObjectIdentifiers.pbeWithSHAAnd2_KeyTripleDES_CBC);
        pkcs12.put("rc4-40", PKCSObjectIdentifiers.pbeWithSHAAnd40BitRC4);
        pkcs12.put("rc4-128", PKCSObjectIdentifiers.pbeWithSHAAnd128BitRC4);
        PKCS12_CIPHERS = Collections.unmodifiableMap(pkcs12);

        Map<String, ASN1ObjectIdentifier> pkcs5 = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        pkcs5.put("md5", PKCSObjectIdentifiers.pbeWithMD5AndDES_CBC);
        pkcs5.put("sha1", PKCSObjectIdentifiers.pbeWithSHA1AndDES_CBC);
        PKCS5_DES_HASHES = Collections.unmodifiableMap(pkcs5);
    }

    private PKCS8PrivateKeyEncryption() {
        throw new UnsupportedOperationException("No instance");
    }

    /**
     * @param  info                   The clear {@code PrivateKeyInfo}
     * @param  context                The password along with the cipher, hash and PBE version
     * @return                        The DER encoded {@code EncryptedPrivateKeyInfo}
     * @throws KeyEncryptionException If the cipher/hash/version combination is not supported or encryption failed
     */
    public static byte[] encrypt(PrivateKeyInfo info, PrivateKeyEncryptionContext context)
            throws KeyEncryptionException {
        Objects.requireNonNull(context, "No encryption context");
        String cipherName = context.resolveCipherName(PrivateKeyEncryptionContext.DEFAULT_CIPHER_NAME);
        String hashName = GenericUtils.isEmpty(context.getHashName())
                ? PrivateKeyEncryptionContext.DEFAULT_HASH_NAME : context.getHashName();
        char[] password = context.getPassword().toCharArray();
        int version = context.getPbeVersion();
        try {
            if (version == PBES2) {
                return encryptPbes2(info, cipherName, hashName, password);
            } else if (version == PBES1) {
                if ("des-cbc".equalsIgnoreCase(cipherName)) {
                    return encryptPkcs5(info, hashName, password);
                }
                return encryptPkcs12(info, cipherName, hashName, password);
            } else {
                throw new KeyEncryptionException("Unknown PBE version: " + version);
            }
        } catch (OperatorCreationException | GeneralSecurityException | IOException e) {
            throw new KeyEncryptionException("Unable to encrypt PKCS#8 private key", e);
        }
    }

    /**
     * @param  data                   A decoded {@code EncryptedPrivateKeyInfo}
     * @param  password               The password
     * @return                        The decrypted {@code PrivateKeyInfo}
     * @throws KeyEncryptionException If the data is not an {@code EncryptedPrivateKeyInfo}, the scheme is unknown or
     *                                the password is wrong
     */
    public static PrivateKeyInfo decrypt(ASN1Primitive data, String password) throws KeyEncryptionException {
        EncryptedPrivateKeyInfo encrypted;
        try {
            encrypted = EncryptedPrivateKeyInfo.getInstance(data);
        } catch (IllegalArgumentException | IllegalStateException | ClassCastException e) {
            throw new KeyEncryptionException("Invalid PKCS#8 encrypted key format", e);
        }

        char[] pwd = (password == null) ? new char[0] : password.toCharArray();
        try {
            InputDecryptorProvider decryptor = new JceOpenSSLPKCS8DecryptorProviderBuilder()
                    .setProvider(PROVIDER)
                    .build(pwd);
            return new PKCS8EncryptedPrivateKeyInfo(encrypted).decryptPrivateKeyInfo(decryptor);
        } catch (OperatorCreationException | PKCSException | IllegalArgumentException | IllegalStateException e) {
            throw new KeyEncryptionException("Unable to decrypt PKCS#8 private key", e);
        }
    }

    private static AlgorithmIdentifier hmacPrf(ASN1ObjectIdentifier oid) {
        return new AlgorithmIdentifier(oid, DERNull.INSTANCE);
    }

    private static byte[] encryptPbes2(PrivateKeyInfo info, String cipherName, String hashName, char[] password)
            throws OperatorCreationException, IOException, KeyEncryptionException {
        ASN1ObjectIdentifier cipherOid = PBES2_CIPHERS.get(cipherName);
        if (cipherOid == null) {
            throw new KeyEncryptionException("Unknown PBES2 encryption algorithm: " + cipherName);
        }

        AlgorithmIdentifier prf = PBES2_PRFS.get(hashName);
        if (prf == null) {
            throw new KeyEncryptionException("Unknown PBES2 hash algorithm: " + hashName);
        }

        PBKDF2Config kdf = new PBKDF2Config.Builder()
                .withPRF(prf)
                .withIterationCount(DEFAULT_ITERATIONS)
                .withSaltLength(DEFAULT_SALT_SIZE)
                .build();
        OutputEncryptor encryptor = new JcePKCSPBEOutputEncryptorBuilder(kdf, cipherOid)
                .setProvider(PROVIDER)
                .setRandom(RANDOM)
                .build(password);
        return new PKCS8EncryptedPrivateKeyInfoBuilder(info).build(encryptor).getEncoded();
    }

    private static byte[] encryptPkcs12(PrivateKeyInfo info, String cipherName, String hashName, char[] password)
            throws OperatorCreationException, IOException, KeyEncryptionException {
        if (!"sha1".equalsIgnoreCase(hashName)) {
            throw new KeyEncryptionException("Unknown PBES1 hash algorithm: " + hashName);
        }

        ASN1ObjectIdentifier algorithm = PKCS12_CIPHERS.get(cipherName);
        if (algorithm == null) {
            throw new KeyEncryptionException("Unknown PBES1 encryption algorithm: " + cipherName);
        }

        OutputEncryptor encryptor = new JcePKCSPBEOutputEncryptorBuilder(algorithm)
                .setProvider(PROVIDER)
                .setRandom(RANDOM)
                .setIterationCount(DEFAULT_ITERATIONS)
                .build(password);
        return new PKCS8EncryptedPrivateKeyInfoBuilder(info).build(encryptor).getEncoded();
    }

    private static byte[] encryptPkcs5(PrivateKeyInfo info, String hashName, char[] password)
            throws GeneralSecurityException, IOException, KeyEncryptionException {
        ASN1ObjectIdentifier algorithm = PKCS5_DES_HASHES.get(hashName);
        if (algorithm == null) {
            throw new KeyEncryptionException("Unknown PBES1 hash algorithm: " + hashName);
        }

        byte[] salt = new byte[8];
        synchronized (RANDOM) {
            RANDOM.nextBytes(salt);
        }

        String jceName = algorithm.equals(PKCSObjectIdentifiers.pbeWithMD5AndDES_CBC)
                ? "PBEWithMD5AndDES" : "PBEWithSHA1AndDES";
        SecretKey key = SecretKeyFactory.getInstance(jceName, PROVIDER).generateSecret(new PBEKeySpec(password));
        Cipher cipher = Cipher.getInstance(jceName, PROVIDER);
        cipher.init(Cipher.ENCRYPT_MODE, key, new PBEParameterSpec(salt, DEFAULT_ITERATIONS));
        byte[] encrypted = cipher.doFinal(info.getEncoded());
        return new EncryptedPrivateKeyInfo(
                new AlgorithmIdentifier(algorithm, new PBEParameter(salt, DEFAULT_ITERATIONS)), encrypted).getEncoded();
    }
}
