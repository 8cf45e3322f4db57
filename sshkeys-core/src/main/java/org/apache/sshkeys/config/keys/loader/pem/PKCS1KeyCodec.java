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
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import org.apache.sshkeys.common.util.GenericUtils;
import org.apache.sshkeys.common.util.buffer.BufferUtils;
import org.apache.sshkeys.common.util.logging.AbstractLoggingBean;
import org.apache.sshkeys.config.keys.KeyAlgorithmRegistry;
import org.apache.sshkeys.config.keys.KeyEncryptionException;
import org.apache.sshkeys.config.keys.KeyExportException;
import org.apache.sshkeys.config.keys.KeyImportException;
import org.apache.sshkeys.config.keys.SshKey;
import org.apache.sshkeys.config.keys.SshKeyHandler;
import org.apache.sshkeys.config.keys.loader.KeyResourceUtils;
import org.apache.sshkeys.config.keys.loader.PrivateKeyEncryptionContext;
import org.apache.sshkeys.config.keys.loader.PrivateKeyObfuscator;
import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1Encoding;
import org.bouncycastle.asn1.ASN1Primitive;

/**
 * Handles the algorithm specific (a.k.a. &quot;traditional&quot;) key encodings - {@code RSAPrivateKey},
 * {@code DSAPrivateKey}, {@code ECPrivateKey} and their public counterparts - including the OpenSSL style
 * {@code Proc-Type}/{@code DEK-Info} PEM encryption of private keys.
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public class PKCS1KeyCodec extends AbstractLoggingBean {
    public static final String PROC_TYPE_HEADER = "Proc-Type";
    public static final String ENCRYPTED_PROC_TYPE = "4,ENCRYPTED";
    public static final String DEK_INFO_HEADER = "DEK-Info";

    public static final PKCS1KeyCodec INSTANCE = new PKCS1KeyCodec();

    private final KeyAlgorithmRegistry registry;

    public PKCS1KeyCodec() {
        this(null);
    }

    public PKCS1KeyCodec(KeyAlgorithmRegistry registry) {
        this.registry = registry;
    }

    public KeyAlgorithmRegistry getRegistry() {
        return (registry == null) ? KeyAlgorithmRegistry.getDefault() : registry;
    }

    /**
     * @param  key                      The private key
     * @param  pem                      {@code true} for PEM, {@code false} for raw DER
     * @param  encryptionContext        Optional encryption - only supported with PEM
     * @return                          The encoded key
     * @throws KeyExportException       If the key type has no PKCS#1 encoding or encryption was requested for DER
     * @throws GeneralSecurityException If failed to encrypt
     */
    public byte[] encodePrivateKey(SshKey key, boolean pem, PrivateKeyEncryptionContext encryptionContext)
            throws GeneralSecurityException {
        byte[] data = encode(key.encodePkcs1PrivateKey());
        Map<String, String> headers = null;
        if (PrivateKeyEncryptionContext.isEncrypting(encryptionContext)) {
            if (!pem) {
                throw new KeyExportException("PKCS#1 DER format does not support private key encryption");
            }

            PrivateKeyObfuscator obfuscator = encryptionContext.resolvePrivateKeyObfuscator();
            if (obfuscator == null) {
                throw new KeyEncryptionException("Unknown cipher: "
                                                 + encryptionContext.resolveCipherName(
                                                         PrivateKeyEncryptionContext.DEFAULT_CIPHER_NAME));
            }

            byte[] iv = obfuscator.generateInitializationVector();
            data = obfuscator.applyPrivateKeyCipher(data, encryptionContext.getPassword(), iv, true);
            headers = new LinkedHashMap<>();
            headers.put(PROC_TYPE_HEADER, ENCRYPTED_PROC_TYPE);
            headers.put(DEK_INFO_HEADER,
                    obfuscator.getDekName() + "," + BufferUtils.toHex(iv).toUpperCase(Locale.ENGLISH));
            if (log.isDebugEnabled()) {
                log.debug("encodePrivateKey({}) encrypted with {}", key.getAlgorithm(), obfuscator.getDekName());
            }
        }

        return pem ? KeyResourceUtils.encodePem(key.getHandler().getPemName() + " " + KeyResourceUtils.PRIVATE_KEY,
                headers, data) : data;
    }

    public byte[] encodePublicKey(SshKey key, boolean pem) throws KeyExportException {
        byte[] data = encode(key.encodePkcs1PublicKey());
        return pem ? KeyResourceUtils.encodePem(key.getHandler().getPemName() + " " + KeyResourceUtils.PUBLIC_KEY,
                null, data) : data;
    }

    /**
     * @param  pemName            The PEM key type - e.g., {@code RSA}
     * @param  data               The decoded DER structure
     * @return                    The decoded private key
     * @throws KeyImportException If the type is unknown or the structure does not match it
     */
    public SshKey decodePrivateKey(String pemName, ASN1Primitive data) throws KeyImportException {
        SshKey key = resolveHandler(pemName).decodePkcs1Private(data);
        if (key == null) {
            throw new KeyImportException("Invalid " + pemName + " private key");
        }
        return key;
    }

    public SshKey decodePublicKey(String pemName, ASN1Primitive data) throws KeyImportException {
        SshKey key = resolveHandler(pemName).decodePkcs1Public(data);
        if (key == null) {
            throw new KeyImportException("Invalid " + pemName + " public key");
        }
        return key;
    }

    /**
     * @param  headers            The PEM headers
     * @return                    {@code true} if they mark the data as encrypted
     */
    public static boolean isEncrypted(Map<String, String> headers) {
        return ENCRYPTED_PROC_TYPE.equals(headers.get(PROC_TYPE_HEADER));
    }

    /**
     * @param  headers                The PEM headers holding the {@code DEK-Info}
     * @param  data                   The encrypted DER
     * @param  password               The password
     * @return                        The decrypted DER
     * @throws KeyEncryptionException If the password is missing or decryption fails
     * @throws KeyImportException     If the encryption parameters are malformed
     */
    public byte[] decryptPrivateKey(Map<String, String> headers, byte[] data, String password)
            throws KeyImportException {
        if (GenericUtils.isEmpty(password)) {
            throw new KeyEncryptionException("Passphrase must be specified to import encrypted private keys");
        }

        String[] dekInfo = GenericUtils.split(headers.getOrDefault(DEK_INFO_HEADER, ""), ',');
        if (dekInfo.length != 2) {
            throw new KeyImportException("Invalid PEM encryption params");
        }

        byte[] iv;
        try {
            iv = BufferUtils.decodeHex(KeyResourceUtils.strip(dekInfo[1]));
        } catch (NumberFormatException e) {
            throw new KeyImportException("Invalid PEM encryption params", e);
        }

        PrivateKeyObfuscator obfuscator = PrivateKeyEncryptionContext.getRegisteredPrivateKeyObfuscator(dekInfo[0]);
        if (obfuscator == null) {
            throw new KeyEncryptionException("Unable to decrypt PKCS#1 private key");
        }

        try {
            return obfuscator.applyPrivateKeyCipher(data, password, iv, false);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new KeyEncryptionException("Unable to decrypt PKCS#1 private key", e);
        }
    }

    protected SshKeyHandler resolveHandler(String pemName) throws KeyImportException {
        SshKeyHandler handler = getRegistry().getPemHandler(pemName);
        if (handler == null) {
            throw new KeyImportException("Unknown PEM key type: " + pemName);
        }
        return handler;
    }

    public static byte[] encode(ASN1Encodable value) throws KeyExportException {
        try {
            return value.toASN1Primitive().getEncoded(ASN1Encoding.DER);
        } catch (IOException e) {
            throw new KeyExportException("Failed to DER encode key: " + e.getMessage(), e);
        }
    }
}
