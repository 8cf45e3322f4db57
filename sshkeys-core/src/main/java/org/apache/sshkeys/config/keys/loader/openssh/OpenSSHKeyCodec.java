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


package org.apache.sshkeys.config.keys.loader.openssh;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;

import org.apache.sshkeys.common.cipher.BuiltinCiphers;
import org.apache.sshkeys.common.cipher.PacketCipher;
import org.apache.sshkeys.common.cipher.PacketCipher.EncryptedPacket;
import org.apache.sshkeys.common.util.GenericUtils;
import org.apache.sshkeys.common.util.buffer.Buffer;
import org.apache.sshkeys.common.util.buffer.BufferException;
import org.apache.sshkeys.common.util.buffer.ByteArrayBuffer;
import org.apache.sshkeys.common.util.logging.AbstractLoggingBean;
import org.apache.sshkeys.config.keys.KeyAlgorithmRegistry;
import org.apache.sshkeys.config.keys.KeyEncryptionException;
import org.apache.sshkeys.config.keys.KeyImportException;
import org.apache.sshkeys.config.keys.SshKey;
import org.apache.sshkeys.config.keys.SshKeyHandler;
import org.apache.sshkeys.config.keys.SshKeys;
import org.apache.sshkeys.config.keys.loader.KeyResourceUtils;
import org.apache.sshkeys.config.keys.loader.PrivateKeyEncryptionContext;
import org.apache.sshkeys.config.keys.loader.openssh.kdf.BCryptKdfOptions;

/**
 * Encodes and decodes the <A HREF="https://github.com/openssh/openssh-portable/blob/master/PROTOCOL.key">OpenSSH
 * private key container</A>:
 *
 * <PRE>
 * "openssh-key-v1\0"
 * string  cipher name
 * string  kdf name
 * string  kdf options
 * uint32  number of keys (always 1)
 * string  public key
 * string  encrypted block
 * [authentication tag of AEAD ciphers]
 * </PRE>
 *
 * The (decrypted) block holds two equal check words, the private key, its comment and 1, 2, 3... padding bytes.
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public class OpenSSHKeyCodec extends AbstractLoggingBean {
    public static final String PEM_NAME = "OPENSSH";
    public static final String PEM_TYPE = PEM_NAME + " " + KeyResourceUtils.PRIVATE_KEY;

    public static final String AUTH_MAGIC = "openssh-key-v1";
    public static final String NONE = "none";

    /**
     * Padding block size when not encrypting, and the minimum one when encrypting
     */
    public static final int DEFAULT_BLOCK_SIZE = 8;
    public static final int MAX_PADDING_SIZE = 256;

    public static final OpenSSHKeyCodec INSTANCE = new OpenSSHKeyCodec();

    private static final byte[] AUTH_MAGIC_BYTES = (AUTH_MAGIC + "\0").getBytes(StandardCharsets.US_ASCII);
    private static final SecureRandom RANDOM = new SecureRandom();

    private final KeyAlgorithmRegistry registry;

    public OpenSSHKeyCodec() {
        this(null);
    }

    /**
     * @param registry The registry used to resolve the key algorithms - {@code null} for the default one
     */
    public OpenSSHKeyCodec(KeyAlgorithmRegistry registry) {
        this.registry = registry;
    }

    public KeyAlgorithmRegistry getRegistry() {
        return (registry == null) ? KeyAlgorithmRegistry.getDefault() : registry;
    }

    /**
     * @param  key                      The private key to export
     * @param  encryptionContext        Password and cipher - {@code null} or no password for an unencrypted
     *                                  container
     * @return                          The PEM encoded container
     * @throws GeneralSecurityException If failed to encrypt
     */
    public byte[] encodePrivateKey(SshKey key, PrivateKeyEncryptionContext encryptionContext)
            throws GeneralSecurityException {
        String cipherName = NONE;
        String kdfName = NONE;
        byte[] kdfData = GenericUtils.EMPTY_BYTE_ARRAY;
        int blockSize = DEFAULT_BLOCK_SIZE;
        PacketCipher cipher = null;
        if (PrivateKeyEncryptionContext.isEncrypting(encryptionContext)) {
            cipherName = encryptionContext.resolveCipherName(PrivateKeyEncryptionContext.DEFAULT_OPENSSH_CIPHER_NAME);
            BuiltinCiphers cipherType = BuiltinCiphers.fromFactoryName(cipherName);
            if (cipherType == null) {
                throw new KeyEncryptionException("Unknown cipher: " + cipherName);
            }

            BCryptKdfOptions kdfOptions = BCryptKdfOptions.generate(encryptionContext.getKdfRounds());
            kdfName = BCryptKdfOptions.NAME;
            kdfData = kdfOptions.encode();
            cipher = createCipher(cipherType, kdfOptions, encryptionContext.getPasswordBytes());
            blockSize = Math.max(cipherType.getCipherBlockSize(), DEFAULT_BLOCK_SIZE);
        }

        if (log.isDebugEnabled()) {
            log.debug("encodePrivateKey({}) cipher={}, kdf={}", key.getAlgorithm(), cipherName, kdfName);
        }

        byte[] comment = key.hasComment() ? key.getCommentBytes() : GenericUtils.EMPTY_BYTE_ARRAY;
        Buffer data = new ByteArrayBuffer();
        int check;
        synchronized (RANDOM) {
            check = RANDOM.nextInt();
        }
        data.putInt(check);
        data.putInt(check);
        data.putRawBytes(key.getPrivateData());
        data.putBytes(comment);

        int remainder = data.available() % blockSize;
        if (remainder != 0) {
            for (int index = 1; index <= blockSize - remainder; index++) {
                data.putByte((byte) index);
            }
        }

        byte[] blob = data.getCompactData();
        byte[] mac = GenericUtils.EMPTY_BYTE_ARRAY;
        try {
            if (cipher != null) {
                EncryptedPacket packet = cipher.encryptPacket(0L, null, blob);
                Arrays.fill(blob, (byte) 0);
                blob = packet.getCiphertext();
                mac = packet.getMac();
            }

            Buffer out = new ByteArrayBuffer(AUTH_MAGIC_BYTES.length + blob.length + mac.length + Long.SIZE);
            out.putRawBytes(AUTH_MAGIC_BYTES);
            out.putString(cipherName);
            out.putString(kdfName);
            out.putBytes(kdfData);
            out.putUInt(1L);
            out.putBytes(key.getPublicData());
            out.putBytes(blob);
            out.putRawBytes(mac);
            return KeyResourceUtils.encodePem(
                    PEM_TYPE, null, out.getCompactData(), KeyResourceUtils.OPENSSH_LINE_WIDTH);
        } finally {
            Arrays.fill(blob, (byte) 0);
        }
    }

    /**
     * @param  data                   The binary container - already Base64 decoded
     * @param  password               The password - ignored if the container is not encrypted
     * @return                        The private key with its comment
     * @throws KeyEncryptionException If the container is encrypted and the password is missing or wrong
     * @throws KeyImportException     If the container is malformed
     */
    public SshKey decodePrivateKey(byte[] data, String password) throws KeyImportException {
        try {
            Buffer buffer = validateMagic(data);
            String cipherName = buffer.getString();
            String kdfName = buffer.getString();
            byte[] kdfOptions = buffer.getBytes();
            long numKeys = buffer.getUInt();
            buffer.getBytes(); // public key
            byte[] keyData = buffer.getBytes();
            byte[] mac = buffer.getRemainingBytes();
            if (numKeys != 1L) {
                throw new KeyImportException("Invalid OpenSSH private key");
            }

            if (log.isDebugEnabled()) {
                log.debug("decodePrivateKey() cipher={}, kdf={}", cipherName, kdfName);
            }

            boolean encrypted = !NONE.equals(cipherName);
            if (!encrypted) {
                return decodePrivateKeyData(keyData, false);
            }

            byte[] decrypted = decryptPrivateKeyData(cipherName, kdfName, kdfOptions, keyData, mac, password);
            try {
                return decodePrivateKeyData(decrypted, true);
            } finally {
                Arrays.fill(decrypted, (byte) 0); // get rid of sensitive data a.s.a.p.
            }
        } catch (BufferException e) {
            throw new KeyImportException("Invalid OpenSSH private key", e);
        }
    }

    /**
     * @param  data               The binary container - already Base64 decoded
     * @return                    The public key stored in the clear part of the container
     * @throws KeyImportException If the container is malformed
     */
    public SshKey decodePublicKey(byte[] data) throws KeyImportException {
        try {
            Buffer buffer = validateMagic(data);
            buffer.getString(); // cipher name
            buffer.getString(); // kdf name
            buffer.getBytes(); // kdf options
            long numKeys = buffer.getUInt();
            byte[] publicData = buffer.getBytes();
            if (numKeys != 1L) {
                throw new KeyImportException("Invalid OpenSSH private key");
            }

            return SshKeys.decodeSshPublicKey(publicData);
        } catch (BufferException e) {
            throw new KeyImportException("Invalid OpenSSH private key", e);
        }
    }

    protected Buffer validateMagic(byte[] data) throws KeyImportException {
        int len = AUTH_MAGIC_BYTES.length;
        if ((data == null) || (data.length < len)
                || (!Arrays.equals(AUTH_MAGIC_BYTES, Arrays.copyOf(data, len)))) {
            throw new KeyImportException("Unrecognized OpenSSH private key type");
        }

        return new ByteArrayBuffer(data, len, data.length - len);
    }

    protected byte[] decryptPrivateKeyData(
            String cipherName, String kdfName, byte[] kdfOptions, byte[] keyData, byte[] mac, String password)
            throws KeyImportException {
        if (GenericUtils.isEmpty(password)) {
            throw new KeyEncryptionException("Passphrase must be specified to import encrypted private keys");
        }

        BuiltinCiphers cipherType = BuiltinCiphers.fromFactoryName(cipherName);
        if (cipherType == null) {
            throw new KeyEncryptionException("Unknown cipher: " + cipherName);
        }
        if (!BCryptKdfOptions.NAME.equals(kdfName)) {
            throw new KeyEncryptionException("Unknown kdf: " + kdfName);
        }

        BCryptKdfOptions options = BCryptKdfOptions.decode(kdfOptions);
        byte[] decrypted;
        try {
            PacketCipher cipher = createCipher(cipherType, options, password.getBytes(StandardCharsets.UTF_8));
            decrypted = cipher.decryptPacket(0L, null, keyData, 0, mac);
        } catch (KeyEncryptionException e) {
            throw e;
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new KeyImportException("Invalid OpenSSH private key", e);
        }

        if (decrypted == null) {
            throw new KeyEncryptionException("Incorrect passphrase");
        }
        return decrypted;
    }

    protected SshKey decodePrivateKeyData(byte[] keyData, boolean encrypted) throws KeyImportException {
        Buffer buffer = new ByteArrayBuffer(keyData);
        long check1 = buffer.getUInt();
        long check2 = buffer.getUInt();
        if (check1 != check2) {
            if (encrypted) {
                throw new KeyEncryptionException("Incorrect passphrase");
            }
            throw new KeyImportException("Invalid OpenSSH private key");
        }

        String algorithm = buffer.getString();
        SshKeyHandler handler = getRegistry().getPublicKeyHandler(algorithm);
        if (handler == null) {
            throw new KeyImportException("Unknown OpenSSH private key algorithm");
        }

        SshKey key = handler.decodeSshPrivate(algorithm, buffer);
        byte[] comment = buffer.getBytes();
        byte[] padding = buffer.getRemainingBytes();
        if (!isValidPadding(padding)) {
            throw new KeyImportException("Invalid OpenSSH private key");
        }

        key.setComment(comment);
        if (log.isTraceEnabled()) {
            log.trace("decodePrivateKeyData({}) padding={}", algorithm, padding.length);
        }
        return key;
    }

    protected PacketCipher createCipher(BuiltinCiphers cipherType, BCryptKdfOptions kdfOptions, byte[] password)
            throws KeyEncryptionException {
        int keySize = cipherType.getKdfSize();
        int ivSize = cipherType.getIVSize();
        byte[] derived = kdfOptions.deriveKey(password, keySize + ivSize);
        try {
            return new PacketCipher(cipherType,
                    Arrays.copyOfRange(derived, 0, keySize), Arrays.copyOfRange(derived, keySize, derived.length));
        } finally {
            Arrays.fill(derived, (byte) 0);
            Arrays.fill(password, (byte) 0);
        }
    }

    /**
     * @param  padding The trailing bytes of the private block
     * @return         {@code true} if less than {@link #MAX_PADDING_SIZE} bytes of 1, 2, 3...
     */
    public static boolean isValidPadding(byte[] padding) {
        if (padding.length >= MAX_PADDING_SIZE) {
            return false;
        }

        for (int index = 0; index < padding.length; index++) {
            if ((padding[index] & 0xFF) != (index + 1)) {
                return false;
            }
        }
        return true;
    }
}
