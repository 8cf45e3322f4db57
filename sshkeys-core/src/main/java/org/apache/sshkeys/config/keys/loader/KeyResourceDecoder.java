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

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.sshkeys.common.util.buffer.Buffer;
import org.apache.sshkeys.common.util.buffer.BufferException;
import org.apache.sshkeys.common.util.buffer.ByteArrayBuffer;
import org.apache.sshkeys.common.util.logging.AbstractLoggingBean;
import org.apache.sshkeys.config.keys.KeyAlgorithmRegistry;
import org.apache.sshkeys.config.keys.KeyEncryptionException;
import org.apache.sshkeys.config.keys.KeyImportException;
import org.apache.sshkeys.config.keys.SshKey;
import org.apache.sshkeys.config.keys.SshKeyHandler;
import org.apache.sshkeys.config.keys.certificate.SshCertificate;
import org.apache.sshkeys.config.keys.loader.openssh.OpenSSHKeyCodec;
import org.apache.sshkeys.config.keys.loader.pem.PKCS1KeyCodec;
import org.apache.sshkeys.config.keys.loader.pem.PKCS8KeyCodec;
import org.apache.sshkeys.config.keys.x509.SshX509Certificate;
import org.bouncycastle.asn1.ASN1Primitive;

/**
 * Decodes keys and certificates from data that may hold any of the supported encodings - DER, PEM, OpenSSH and
 * RFC 4716 - optionally several of them concatenated. Each entry point locates the next matching block and then
 * tries the candidate decoders for it in turn.
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public class KeyResourceDecoder extends AbstractLoggingBean {
    public static final String TRUSTED_PEM_NAME = "TRUSTED";

    private final KeyAlgorithmRegistry registry;
    private final KeyBlockMatcher matcher;
    private final PKCS1KeyCodec pkcs1;
    private final PKCS8KeyCodec pkcs8;
    private final OpenSSHKeyCodec openssh;

    public KeyResourceDecoder() {
        this(KeyAlgorithmRegistry.getDefault());
    }

    public KeyResourceDecoder(KeyAlgorithmRegistry registry) {
        this.registry = registry;
        this.matcher = new KeyBlockMatcher(registry);
        this.pkcs1 = new PKCS1KeyCodec(registry);
        this.pkcs8 = new PKCS8KeyCodec(registry);
        this.openssh = new OpenSSHKeyCodec(registry);
    }

    public KeyAlgorithmRegistry getRegistry() {
        return registry;
    }

    /**
     * @param  data               An SSH encoded public key - {@code string(algorithm) || key fields}
     * @return                    The decoded key
     * @throws KeyImportException If the algorithm is unknown or the data malformed
     */
    public SshKey decodeSshPublicKey(byte[] data) throws KeyImportException {
        try {
            Buffer buffer = new ByteArrayBuffer(data);
            String algorithm = buffer.getString();
            SshKeyHandler handler = registry.getPublicKeyHandler(algorithm);
            if (handler == null) {
                throw new KeyImportException("Unknown key algorithm: " + algorithm);
            }

            SshKey key = handler.decodeSshPublic(algorithm, buffer);
            buffer.checkEnd();
            return key;
        } catch (BufferException e) {
            throw new KeyImportException("Invalid public key", e);
        }
    }

    /**
     * @param  data               An SSH encoded certificate
     * @param  comment            The comment to attach - may be {@code null}
     * @return                    The decoded certificate
     * @throws KeyImportException If the algorithm is unknown, the data malformed or the signature invalid
     */
    public SshCertificate decodeSshCertificate(byte[] data, byte[] comment) throws KeyImportException {
        try {
            Buffer buffer = new ByteArrayBuffer(data);
            String algorithm = buffer.getString();
            KeyAlgorithmRegistry.CertificateAlgorithm entry = registry.getCertificateHandler(algorithm);
            if (entry == null) {
                throw new KeyImportException("Unknown certificate algorithm: " + algorithm);
            }

            return entry.getCertificateHandler().decode(algorithm, entry.getKeyHandler(), buffer, comment);
        } catch (BufferException | IllegalArgumentException e) {
            throw new KeyImportException("Invalid OpenSSH certificate", e);
        }
    }

    /**
     * @param  data               The data to scan
     * @param  password           Password for encrypted keys - may be {@code null}
     * @return                    The first private key found and the offset past it - {@code null} if none found
     * @throws KeyImportException If a private key block was found but could not be decoded
     */
    public Decoded<SshKey> decodePrivateKey(byte[] data, String password) throws KeyImportException {
        KeyBlock block = matcher.matchNext(data, KeyResourceUtils.PRIVATE_KEY, false);
        if (block == null) {
            return null;
        }

        switch (block.getFormat()) {
            case DER:
                return new Decoded<>(decodeDerPrivateKey(block.getDerValue(), password), block.getEnd());
            case PEM:
                return new Decoded<>(decodePemPrivateKey(block, password), block.getEnd());
            default:
                return new Decoded<>(null, block.getEnd());
        }
    }

    /**
     * Public keys may also be extracted from private key data - from the clear part of an OpenSSH container or by
     * decoding an unencrypted private key.
     *
     * @param  data               The data to scan
     * @return                    The first public key found and the offset past it - {@code null} if none found
     * @throws KeyImportException If a key block was found but could not be decoded
     */
    public Decoded<SshKey> decodePublicKey(byte[] data) throws KeyImportException {
        KeyBlock block = matcher.matchNext(data, KeyResourceUtils.PUBLIC_KEY, true);
        if (block == null) {
            KeyBlock privateBlock = matcher.matchNext(data, KeyResourceUtils.PRIVATE_KEY, false);
            if (privateBlock == null) {
                return null;
            }

            if ((privateBlock.getFormat() == KeyBlock.Format.PEM)
                    && OpenSSHKeyCodec.PEM_NAME.equals(privateBlock.getPemName())) {
                return new Decoded<>(openssh.decodePublicKey(privateBlock.getData()), privateBlock.getEnd());
            }

            Decoded<SshKey> decoded = decodePrivateKey(data, null);
            SshKey key = decoded.getValue();
            return new Decoded<>((key == null) ? null : key.convertToPublic(), decoded.getEnd());
        }

        SshKey key;
        switch (block.getFormat()) {
            case DER:
                key = decodeDerPublicKey(block.getDerValue());
                break;
            case PEM:
                key = decodePkcsPublicKey(block.getPemName(), parseDer(block.getData(), "Invalid PEM public key"));
                break;
            case OPENSSH:
                key = decodeSshPublicKey(block.getData());
                if (!block.getAlgorithm().equals(key.getAlgorithm())) {
                    throw new KeyImportException("Public key algorithm mismatch");
                }
                key.setComment(block.getComment());
                break;
            case RFC4716:
                key = decodeSshPublicKey(block.getData());
                key.setComment(block.getComment());
                break;
            default:
                key = null;
        }
        return new Decoded<>(key, block.getEnd());
    }

    /**
     * @param  data               The data to scan
     * @return                    The first certificate found and the offset past it - {@code null} if none found
     * @throws KeyImportException If a certificate block was found but could not be decoded
     */
    public Decoded<SshCertificate> decodeCertificate(byte[] data) throws KeyImportException {
        KeyBlock block = matcher.matchNext(data, KeyResourceUtils.CERTIFICATE, true);
        if (block == null) {
            return null;
        }

        SshCertificate cert;
        switch (block.getFormat()) {
            case DER:
                cert = SshX509Certificate.fromDer(Arrays.copyOf(data, block.getEnd()), null);
                break;
            case PEM:
                cert = decodePemCertificate(block.getPemName(), block.getData());
                break;
            case OPENSSH:
                if (block.getAlgorithm().startsWith(SshKey.X509_ALGORITHM_PREFIX)) {
                    cert = SshX509Certificate.fromDer(block.getData(), block.getComment());
                } else {
                    cert = decodeSshCertificate(block.getData(), block.getComment());
                }
                break;
            case RFC4716:
                cert = decodeSshCertificate(block.getData(), block.getComment());
                break;
            default:
                cert = null;
        }
        return new Decoded<>(cert, block.getEnd());
    }

    public List<SshKey> decodePrivateKeys(byte[] data, String password) throws KeyImportException {
        return decodeAll(data, d -> decodePrivateKey(d, password));
    }

    public List<SshKey> decodePublicKeys(byte[] data) throws KeyImportException {
        return decodeAll(data, this::decodePublicKey);
    }

    public List<SshCertificate> decodeCertificates(byte[] data) throws KeyImportException {
        return decodeAll(data, this::decodeCertificate);
    }

    /**
     * Tries the encrypted PKCS#8 form first when a password is given, then plain PKCS#8 and finally every PKCS#1
     * key type
     *
     * @param  value              The decoded DER structure
     * @param  password           The password - may be {@code null}
     * @return                    The decoded key
     * @throws KeyImportException If none of the encodings apply
     */
    protected SshKey decodeDerPrivateKey(ASN1Primitive value, String password) throws KeyImportException {
        ASN1Primitive keyData = value;
        if (password != null) {
            try {
                keyData = pkcs8.decryptPrivateKey(value, password);
            } catch (KeyEncryptionException e) {
                if (log.isTraceEnabled()) {
                    log.trace("decodeDerPrivateKey() not encrypted PKCS#8: {}", e.getMessage());
                }
            }
        }

        try {
            return pkcs8.decodePrivateKey(keyData);
        } catch (KeyImportException e) {
            if (log.isTraceEnabled()) {
                log.trace("decodeDerPrivateKey() not PKCS#8: {}", e.getMessage());
            }
        }

        for (String pemName : registry.getPemNames()) {
            try {
                return pkcs1.decodePrivateKey(pemName, keyData);
            } catch (KeyImportException e) {
                if (log.isTraceEnabled()) {
                    log.trace("decodeDerPrivateKey() not PKCS#1 {}: {}", pemName, e.getMessage());
                }
            }
        }

        throw new KeyImportException("Invalid DER private key");
    }

    protected SshKey decodeDerPublicKey(ASN1Primitive value) throws KeyImportException {
        try {
            return pkcs8.decodePublicKey(value);
        } catch (KeyImportException e) {
            if (log.isTraceEnabled()) {
                log.trace("decodeDerPublicKey() not PKCS#8: {}", e.getMessage());
            }
        }

        for (String pemName : registry.getPemNames()) {
            try {
                return pkcs1.decodePublicKey(pemName, value);
            } catch (KeyImportException e) {
                if (log.isTraceEnabled()) {
                    log.trace("decodeDerPublicKey() not PKCS#1 {}: {}", pemName, e.getMessage());
                }
            }
        }

        throw new KeyImportException("Invalid DER public key");
    }

    protected SshKey decodePemPrivateKey(KeyBlock block, String password) throws KeyImportException {
        String pemName = block.getPemName();
        if (OpenSSHKeyCodec.PEM_NAME.equals(pemName)) {
            return openssh.decodePrivateKey(block.getData(), password);
        }

        byte[] data = block.getData();
        if (PKCS1KeyCodec.isEncrypted(block.getHeaders())) {
            data = pkcs1.decryptPrivateKey(block.getHeaders(), data, password);
        }

        ASN1Primitive keyData = parseDer(data, "Invalid PEM private key");
        if (PKCS8KeyCodec.ENCRYPTED_PEM_NAME.equals(pemName)) {
            if (password == null) {
                throw new KeyEncryptionException("Passphrase must be specified to import encrypted private keys");
            }
            return pkcs8.decodePrivateKey(pkcs8.decryptPrivateKey(keyData, password));
        }

        return pemName.isEmpty() ? pkcs8.decodePrivateKey(keyData) : pkcs1.decodePrivateKey(pemName, keyData);
    }

    protected SshKey decodePkcsPublicKey(String pemName, ASN1Primitive keyData) throws KeyImportException {
        return pemName.isEmpty() ? pkcs8.decodePublicKey(keyData) : pkcs1.decodePublicKey(pemName, keyData);
    }

    /**
     * @param  pemName            Empty for {@code CERTIFICATE}, {@value #TRUSTED_PEM_NAME} for an OpenSSL trusted
     *                            certificate whose trust settings follow the certificate
     * @param  data               The PEM payload
     * @return                    The decoded certificate
     * @throws KeyImportException If not a valid X.509 certificate
     */
    protected SshCertificate decodePemCertificate(String pemName, byte[] data) throws KeyImportException {
        byte[] certData = data;
        if (TRUSTED_PEM_NAME.equals(pemName)) {
            try {
                certData = Arrays.copyOf(data, KeyResourceUtils.derDecodePartial(data).getEnd());
            } catch (IOException e) {
                throw new KeyImportException("Invalid PEM trusted certificate", e);
            }
        } else if (!pemName.isEmpty()) {
            throw new KeyImportException("Invalid PEM certificate");
        }

        return SshX509Certificate.fromDer(certData, null);
    }

    protected static ASN1Primitive parseDer(byte[] data, String message) throws KeyImportException {
        try {
            return KeyResourceUtils.derDecode(data);
        } catch (IOException e) {
            throw new KeyImportException(message, e);
        }
    }

    protected static <T> List<T> decodeAll(byte[] data, DecodeStep<T> step) throws KeyImportException {
        List<T> result = new ArrayList<>();
        byte[] remaining = data;
        while (remaining.length > 0) {
            Decoded<T> decoded = step.decode(remaining);
            if (decoded == null) {
                break;
            }

            if (decoded.getValue() != null) {
                result.add(decoded.getValue());
            }

            int end = decoded.getEnd();
            if (end <= 0) {
                break;
            }
            remaining = Arrays.copyOfRange(remaining, Math.min(end, remaining.length), remaining.length);
        }
        return result.isEmpty() ? Collections.emptyList() : result;
    }

    @FunctionalInterface
    protected interface DecodeStep<T> {
        Decoded<T> decode(byte[] data) throws KeyImportException;
    }

    /**
     * A decoded value along with the offset just past its encoding in the scanned data
     *
     * @param <T> Type of decoded value
     */
    public static final class Decoded<T> {
        private final T value;
        private final int end;

        public Decoded(T value, int end) {
            this.value = value;
            this.end = end;
        }

        /**
         * @return The decoded value - {@code null} if the matched block yields nothing
         */
        public T getValue() {
            return value;
        }

        public int getEnd() {
            return end;
        }
    }
}
