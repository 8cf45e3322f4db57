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
import java.util.Objects;

import javax.crypto.AEADBadTagException;

import org.apache.sshkeys.common.util.NumberUtils;
import org.apache.sshkeys.common.util.ValidateUtils;

/**
 * Packet level view of a keyed {@link Cipher}. Each call initializes a fresh cipher instance, so an instance can be
 * shared. For {@link ChaCha20Poly1305Cipher} the packet sequence number is the nonce, for every other cipher the
 * configured initialization vector is used as-is.
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public class PacketCipher {
    private final BuiltinCiphers cipherType;
    private final byte[] key;
    private final byte[] iv;

    public PacketCipher(BuiltinCiphers cipherType, byte[] key, byte[] iv) {
        this.cipherType = Objects.requireNonNull(cipherType, "No cipher type");
        this.key = ValidateUtils.checkNotNull(key, "No key").clone();
        this.iv = (iv == null) ? new byte[0] : iv.clone();
    }

    public BuiltinCiphers getCipherType() {
        return cipherType;
    }

    /**
     * @param  seq                      The packet sequence number
     * @param  aad                      Additional data that is authenticated but not encrypted - may be
     *                                  {@code null}/empty
     * @param  data                     The data to encrypt - must be a multiple of the cipher block size
     * @return                          The ciphertext and authentication tag (empty if the cipher has none)
     * @throws GeneralSecurityException If failed to encrypt
     */
    public EncryptedPacket encryptPacket(long seq, byte[] aad, byte[] data) throws GeneralSecurityException {
        int tagSize = cipherType.getAuthenticationTagSize();
        byte[] work = Arrays.copyOf(data, data.length + tagSize);
        Cipher cipher = initialize(Cipher.Mode.Encrypt, seq);
        try {
            if ((tagSize > 0) && (NumberUtils.length(aad) > 0)) {
                cipher.updateAAD(aad, 0, aad.length);
            }
            cipher.update(work, 0, data.length);
        } catch (GeneralSecurityException e) {
            throw e;
        } catch (Exception e) {
            throw new GeneralSecurityException("Failed to encrypt with " + cipherType + ": " + e.getMessage(), e);
        }

        return new EncryptedPacket(
                Arrays.copyOfRange(work, 0, data.length), Arrays.copyOfRange(work, data.length, work.length));
    }

    /**
     * @param  seq                      The packet sequence number
     * @param  aad                      Additional authenticated data - may be {@code null}/empty
     * @param  data                     The packet data
     * @param  macOffset                Number of leading bytes of {@code data} that are authenticated but were not
     *                                  encrypted
     * @param  mac                      The authentication tag - empty for ciphers that have none
     * @return                          The decrypted data (including the leading clear bytes) - {@code null} if the
     *                                  authentication tag does not match
     * @throws GeneralSecurityException If failed to decrypt for any other reason
     */
    public byte[] decryptPacket(long seq, byte[] aad, byte[] data, int macOffset, byte[] mac)
            throws GeneralSecurityException {
        int tagSize = cipherType.getAuthenticationTagSize();
        ValidateUtils.checkTrue(NumberUtils.length(mac) == tagSize, "Bad MAC length: %d", NumberUtils.length(mac));
        ValidateUtils.checkTrue((macOffset >= 0) && (macOffset <= data.length), "Bad MAC offset: %d", macOffset);

        int len = data.length - macOffset;
        byte[] work = new byte[len + tagSize];
        System.arraycopy(data, macOffset, work, 0, len);
        if (tagSize > 0) {
            System.arraycopy(mac, 0, work, len, tagSize);
        }

        Cipher cipher = initialize(Cipher.Mode.Decrypt, seq);
        try {
            if ((tagSize > 0) && (NumberUtils.length(aad) > 0)) {
                cipher.updateAAD(aad, 0, aad.length);
            }
            if ((tagSize > 0) && (macOffset > 0)) {
                cipher.updateAAD(data, 0, macOffset);
            }
            cipher.update(work, 0, len);
        } catch (AEADBadTagException e) {
            return null;
        } catch (GeneralSecurityException e) {
            throw e;
        } catch (Exception e) {
            throw new GeneralSecurityException("Failed to decrypt with " + cipherType + ": " + e.getMessage(), e);
        }

        byte[] result = Arrays.copyOf(data, data.length);
        System.arraycopy(work, 0, result, macOffset, len);
        return result;
    }

    protected Cipher initialize(Cipher.Mode mode, long seq) throws GeneralSecurityException {
        Cipher cipher = cipherType.create();
        byte[] nonce = iv;
        if (cipher instanceof ChaCha20Poly1305Cipher) {
            nonce = new byte[ChaCha20Poly1305Cipher.NONCE_BYTES];
            for (int index = nonce.length - 1; index >= 0; index--) {
                nonce[index] = (byte) seq;
                seq >>>= Byte.SIZE;
            }
        }

        try {
            cipher.init(mode, key, nonce);
        } catch (GeneralSecurityException e) {
            throw e;
        } catch (Exception e) {
            throw new GeneralSecurityException("Failed to initialize " + cipherType + ": " + e.getMessage(), e);
        }
        return cipher;
    }

    /**
     * The result of {@link PacketCipher#encryptPacket(long, byte[], byte[])}
     */
    public static class EncryptedPacket {
        private final byte[] ciphertext;
        private final byte[] mac;

        public EncryptedPacket(byte[] ciphertext, byte[] mac) {
            this.ciphertext = ciphertext;
            this.mac = mac;
        }

        public byte[] getCiphertext() {
            return ciphertext;
        }

        public byte[] getMac() {
            return mac;
        }
    }
}
