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

package org.apache.sshkeys.common.cipher;

import java.security.GeneralSecurityException;
import java.util.Arrays;

import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;

import org.apache.sshkeys.common.util.ValidateUtils;

/**
 * Base class for all Cipher implementations delegating to the JCE provider.
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public class BaseCipher implements Cipher {
    protected Mode mode;

    private javax.crypto.Cipher cipher;
    private final int ivsize;
    private final int authSize;
    private final int kdfSize;
    private final String algorithm;
    private final int keySize;
    private final int blkSize;
    private final String transformation;

    public BaseCipher(int ivsize, int authSize, int kdfSize, String algorithm,
                      int keySize, String transformation, int blkSize) {
        this.ivsize = ivsize;
        this.authSize = authSize;
        this.kdfSize = kdfSize;
        this.algorithm = ValidateUtils.checkNotNullAndNotEmpty(algorithm, "No algorithm");
        this.keySize = keySize;
        this.transformation = ValidateUtils.checkNotNullAndNotEmpty(transformation, "No transformation");
        this.blkSize = blkSize;
    }

    @Override
    public String getAlgorithm() {
        return algorithm;
    }

    @Override
    public int getKeySize() {
        return keySize;
    }

    @Override
    public String getTransformation() {
        return transformation;
    }

    @Override
    public int getIVSize() {
        return ivsize;
    }

    @Override
    public int getAuthenticationTagSize() {
        return authSize;
    }

    @Override
    public int getKdfSize() {
        return kdfSize;
    }

    @Override
    public int getCipherBlockSize() {
        return blkSize;
    }

    @Override
    public void init(Mode mode, byte[] key, byte[] iv) throws Exception {
        this.mode = mode;
        cipher = createCipherInstance(mode, resize(key, getKdfSize()), resize(iv, getIVSize()));
    }

    protected javax.crypto.Cipher getCipherInstance() {
        return cipher;
    }

    protected javax.crypto.Cipher createCipherInstance(Mode mode, byte[] key, byte[] iv) throws Exception {
        javax.crypto.Cipher instance = javax.crypto.Cipher.getInstance(getTransformation());
        instance.init(
                Mode.Encrypt.equals(mode)
                        ? javax.crypto.Cipher.ENCRYPT_MODE
                        : javax.crypto.Cipher.DECRYPT_MODE,
                new SecretKeySpec(key, getAlgorithm()),
                new IvParameterSpec(iv));
        return instance;
    }

    @Override
    public void update(byte[] input, int inputOffset, int inputLen) throws Exception {
        ValidateUtils.checkState(cipher != null, "Cipher not initialized");
        try {
            int stored = cipher.update(input, inputOffset, inputLen, input, inputOffset);
            if (stored < inputLen) {
                // Cipher.update() may buffer - the data is always a multiple of the block size
                stored += cipher.doFinal(input, inputOffset + stored);
                if (stored != inputLen) {
                    throw new GeneralSecurityException(
                            "Cipher.doFinal() did not return all bytes: " + stored + " != " + inputLen);
                }
            }
        } catch (GeneralSecurityException e) {
            throw new GeneralSecurityException("BaseCipher.update() for " + getTransformation()
                                               + '/' + getKeySize() + " failed (" + mode + ')',
                    e);
        }
    }

    protected static byte[] resize(byte[] data, int size) {
        ValidateUtils.checkTrue(data.length >= size, "Insufficient data: required=%d, available=%d", size, data.length);
        if (data.length > size) {
            return Arrays.copyOf(data, size);
        }
        return data;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + getAlgorithm() + ", ivSize=" + getIVSize()
               + ", kdfSize=" + getKdfSize() + "," + getTransformation() + ", blkSize=" + getCipherBlockSize() + "]";
    }
}
