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


package org.apache.sshkeys.config.keys.loader;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;

import org.apache.sshkeys.common.digest.BuiltinDigests;
import org.apache.sshkeys.common.util.GenericUtils;
import org.apache.sshkeys.common.util.NumberUtils;
import org.apache.sshkeys.common.util.ValidateUtils;

/**
 * CBC mode obfuscation with the key derived the way OpenSSL's {@code EVP_BytesToKey} does it (single MD5 iteration)
 * and PKCS#7 padding of the plaintext.
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public abstract class AbstractPrivateKeyObfuscator implements PrivateKeyObfuscator {
    public static final String DEFAULT_CIPHER_MODE = "CBC";

    private static final SecureRandom RANDOM = new SecureRandom();

    private final String cipherName;
    private final String dekName;
    private final String jceAlgorithm;
    private final int keySize;
    private final int ivSize;

    protected AbstractPrivateKeyObfuscator(String cipherName, String dekName, String jceAlgorithm,
                                           int keySize, int ivSize) {
        this.cipherName = ValidateUtils.checkNotNullAndNotEmpty(cipherName, "No cipher name specified");
        this.dekName = ValidateUtils.checkNotNullAndNotEmpty(dekName, "No DEK name specified");
        this.jceAlgorithm = ValidateUtils.checkNotNullAndNotEmpty(jceAlgorithm, "No JCE algorithm specified");
        this.keySize = keySize;
        this.ivSize = ivSize;
    }

    @Override
    public final String getCipherName() {
        return cipherName;
    }

    @Override
    public final String getDekName() {
        return dekName;
    }

    public final String getJceAlgorithm() {
        return jceAlgorithm;
    }

    @Override
    public final int getKeySize() {
        return keySize;
    }

    @Override
    public final int getIVSize() {
        return ivSize;
    }

    @Override
    public byte[] generateInitializationVector() {
        byte[] initVector = new byte[getIVSize()];
        synchronized (RANDOM) {
            RANDOM.nextBytes(initVector);
        }
        return initVector;
    }

    @Override
    public byte[] applyPrivateKeyCipher(byte[] bytes, String password, byte[] initVector, boolean encryptIt)
            throws GeneralSecurityException {
        Objects.requireNonNull(bytes, "No source data");
        ValidateUtils.checkTrue(NumberUtils.length(initVector) == getIVSize(),
                "Bad %s init vector length", getDekName());

        byte[] keyValue = deriveEncryptionKey(password, initVector, getKeySize());
        try {
            String xform = getJceAlgorithm() + "/" + DEFAULT_CIPHER_MODE + "/PKCS5Padding";
            Cipher cipher = Cipher.getInstance(xform);
            cipher.init(encryptIt ? Cipher.ENCRYPT_MODE : Cipher.DECRYPT_MODE,
                    new SecretKeySpec(keyValue, getJceAlgorithm()), new IvParameterSpec(initVector));
            return cipher.doFinal(bytes);
        } finally {
            Arrays.fill(keyValue, (byte) 0); // get rid of sensitive data a.s.a.p.
        }
    }

    // see http://www.ict.griffith.edu.au/anthony/info/crypto/openssl.hints (Password to Encryption Key section)
    protected byte[] deriveEncryptionKey(String password, byte[] initVector, int outputKeyLength)
            throws GeneralSecurityException {
        ValidateUtils.checkNotNullAndNotEmpty(password, "No encryption password");
        byte[] passBytes = password.getBytes(StandardCharsets.UTF_8);
        byte[] prevHash = GenericUtils.EMPTY_BYTE_ARRAY;
        try {
            byte[] keyValue = new byte[outputKeyLength];
            MessageDigest hash = MessageDigest.getInstance(BuiltinDigests.md5.getAlgorithm());
            for (int index = 0, remLen = keyValue.length; index < keyValue.length;) {
                hash.reset();

                hash.update(prevHash, 0, prevHash.length);
                hash.update(passBytes, 0, passBytes.length);
                hash.update(initVector, 0, Math.min(initVector.length, 8));

                prevHash = hash.digest();

                System.arraycopy(prevHash, 0, keyValue, index, Math.min(remLen, prevHash.length));
                index += prevHash.length;
                remLen -= prevHash.length;
            }

            return keyValue;
        } finally {
            Arrays.fill(passBytes, (byte) 0);
            Arrays.fill(prevHash, (byte) 0);
        }
    }

    @Override
    public String toString() {
        return getCipherName() + "[" + getDekName() + "]";
    }
}
