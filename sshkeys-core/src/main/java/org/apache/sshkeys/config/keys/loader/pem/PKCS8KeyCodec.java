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
import java.math.BigInteger;
import java.security.GeneralSecurityException;

import org.apache.sshkeys.common.util.GenericUtils;
import org.apache.sshkeys.common.util.logging.AbstractLoggingBean;
import org.apache.sshkeys.config.keys.KeyAlgorithmRegistry;
import org.apache.sshkeys.config.keys.KeyExportException;
import org.apache.sshkeys.config.keys.KeyImportException;
import org.apache.sshkeys.config.keys.SshKey;
import org.apache.sshkeys.config.keys.SshKeyHandler;
import org.apache.sshkeys.config.keys.loader.KeyResourceUtils;
import org.apache.sshkeys.config.keys.loader.PrivateKeyEncryptionContext;
import org.bouncycastle.asn1.ASN1BitString;
import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1Integer;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.ASN1OctetString;
import org.bouncycastle.asn1.ASN1Primitive;
import org.bouncycastle.asn1.ASN1Sequence;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.asn1.x509.AlgorithmIdentifier;

/**
 * Handles the algorithm neutral <A HREF="https://tools.ietf.org/html/rfc5208">PKCS#8</A> {@code PrivateKeyInfo}
 * and X.509 {@code SubjectPublicKeyInfo} key encodings, dispatching the payload by algorithm OID.
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public class PKCS8KeyCodec extends AbstractLoggingBean {
    /**
     * The PEM name prefix of an {@code EncryptedPrivateKeyInfo}
     */
    public static final String ENCRYPTED_PEM_NAME = "ENCRYPTED";

    public static final PKCS8KeyCodec INSTANCE = new PKCS8KeyCodec();

    private final KeyAlgorithmRegistry registry;

    public PKCS8KeyCodec() {
        this(null);
    }

    public PKCS8KeyCodec(KeyAlgorithmRegistry registry) {
        this.registry = registry;
    }

    public KeyAlgorithmRegistry getRegistry() {
        return (registry == null) ? KeyAlgorithmRegistry.getDefault() : registry;
    }

    public byte[] encodePrivateKey(SshKey key, boolean pem, PrivateKeyEncryptionContext encryptionContext)
            throws GeneralSecurityException {
        PrivateKeyInfo info = key.encodePkcs8PrivateKey();
        boolean encrypting = PrivateKeyEncryptionContext.isEncrypting(encryptionContext);
        byte[] data = encrypting
                ? PKCS8PrivateKeyEncryption.encrypt(info, encryptionContext)
                : PKCS1KeyCodec.encode(info);
        if (log.isDebugEnabled()) {
            log.debug("encodePrivateKey({}) pem={}, encrypted={}", key.getAlgorithm(), pem, encrypting);
        }

        if (!pem) {
            return data;
        }

        String type = encrypting
                ? ENCRYPTED_PEM_NAME + " " + KeyResourceUtils.PRIVATE_KEY
                : KeyResourceUtils.PRIVATE_KEY;
        return KeyResourceUtils.encodePem(type, null, data);
    }

    public byte[] encodePublicKey(SshKey key, boolean pem) throws KeyExportException {
        byte[] data = PKCS1KeyCodec.encode(key.encodePkcs8PublicKey());
        return pem ? KeyResourceUtils.encodePem(KeyResourceUtils.PUBLIC_KEY, null, data) : data;
    }

    /**
     * @param  data               A decoded {@code PrivateKeyInfo}
     * @return                    The decoded key
     * @throws KeyImportException If the structure is not a {@code PrivateKeyInfo}, its algorithm is unknown or its
     *                            payload does not match the algorithm
     */
    public SshKey decodePrivateKey(ASN1Primitive data) throws KeyImportException {
        ASN1Sequence seq = (data instanceof ASN1Sequence) ? (ASN1Sequence) data : null;
        if ((seq == null) || (seq.size() < 3)
                || (!isVersion(seq.getObjectAt(0)))
                || (!isAlgorithmIdentifier(seq.getObjectAt(1)))
                || (!(seq.getObjectAt(2) instanceof ASN1OctetString))) {
            throw new KeyImportException("Invalid PKCS#8 private key");
        }

        AlgorithmIdentifier algorithm = AlgorithmIdentifier.getInstance(seq.getObjectAt(1));
        SshKeyHandler handler = resolveHandler(algorithm);
        SshKey key = handler.decodePkcs8Private(algorithm, ((ASN1OctetString) seq.getObjectAt(2)).getOctets());
        if (key == null) {
            throw new KeyImportException("Invalid " + getKeyType(handler) + " private key");
        }
        return key;
    }

    /**
     * @param  data               A decoded {@code SubjectPublicKeyInfo}
     * @return                    The decoded key
     * @throws KeyImportException If the structure is not a {@code SubjectPublicKeyInfo}, its algorithm is unknown or
     *                            its payload does not match the algorithm
     */
    public SshKey decodePublicKey(ASN1Primitive data) throws KeyImportException {
        ASN1Sequence seq = (data instanceof ASN1Sequence) ? (ASN1Sequence) data : null;
        if ((seq == null) || (seq.size() != 2)
                || (!isAlgorithmIdentifier(seq.getObjectAt(0)))
                || (!(seq.getObjectAt(1) instanceof ASN1BitString))
                || (((ASN1BitString) seq.getObjectAt(1)).getPadBits() != 0)) {
            throw new KeyImportException("Invalid PKCS#8 public key");
        }

        AlgorithmIdentifier algorithm = AlgorithmIdentifier.getInstance(seq.getObjectAt(0));
        SshKeyHandler handler = resolveHandler(algorithm);
        SshKey key = handler.decodePkcs8Public(algorithm, ((ASN1BitString) seq.getObjectAt(1)).getOctets());
        if (key == null) {
            throw new KeyImportException("Invalid " + getKeyType(handler) + " public key");
        }
        return key;
    }

    /**
     * @param  data                   A decoded {@code EncryptedPrivateKeyInfo}
     * @param  password               The password
     * @return                        The decoded {@code PrivateKeyInfo} structure
     * @throws KeyImportException     If decryption failed
     */
    public ASN1Primitive decryptPrivateKey(ASN1Primitive data, String password) throws KeyImportException {
        PrivateKeyInfo info = PKCS8PrivateKeyEncryption.decrypt(data, password);
        try {
            return KeyResourceUtils.derDecode(info.getEncoded());
        } catch (IOException e) {
            throw new KeyImportException("Invalid PKCS#8 private key", e);
        }
    }

    protected SshKeyHandler resolveHandler(AlgorithmIdentifier algorithm) throws KeyImportException {
        SshKeyHandler handler = getRegistry().getPkcs8Handler(algorithm.getAlgorithm().getId());
        if (handler == null) {
            throw new KeyImportException("Unknown PKCS#8 algorithm");
        }
        return handler;
    }

    protected static String getKeyType(SshKeyHandler handler) {
        String pemName = handler.getPemName();
        return GenericUtils.isEmpty(pemName) ? "PKCS#8" : pemName;
    }

    protected static boolean isVersion(ASN1Encodable value) {
        if (!(value instanceof ASN1Integer)) {
            return false;
        }

        BigInteger version = ((ASN1Integer) value).getValue();
        return BigInteger.ZERO.equals(version) || BigInteger.ONE.equals(version);
    }

    protected static boolean isAlgorithmIdentifier(ASN1Encodable value) {
        if (!(value instanceof ASN1Sequence)) {
            return false;
        }

        ASN1Sequence seq = (ASN1Sequence) value;
        return (seq.size() >= 1) && (seq.size() <= 2) && (seq.getObjectAt(0) instanceof ASN1ObjectIdentifier);
    }
}
