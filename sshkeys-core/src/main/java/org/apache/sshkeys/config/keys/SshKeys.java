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


package org.apache.sshkeys.config.keys;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.sshkeys.common.util.GenericUtils;
import org.apache.sshkeys.common.util.io.IoUtils;
import org.apache.sshkeys.config.keys.certificate.SshCertificate;
import org.apache.sshkeys.config.keys.loader.KeyResourceDecoder;
import org.apache.sshkeys.config.keys.loader.KeyResourceUtils;
import org.apache.sshkeys.config.keys.x509.SshX509Certificate;
import org.apache.sshkeys.config.keys.x509.SshX509CertificateChain;

/**
 * Entry points for generating, importing and reading SSH keys and certificates using the built-in algorithms
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public final class SshKeys {
    /**
     * Prefixes accepted in front of a certificate subject name
     */
    public static final Pattern SUBJECT_PREFIX = Pattern.compile(
            "(?:Distinguished[ -_]?Name|Subject|DN)[=:]?\\s?", Pattern.CASE_INSENSITIVE);

    private SshKeys() {
        throw new UnsupportedOperationException("No instance");
    }

    public static KeyResourceDecoder getDecoder() {
        return DecoderHolder.DECODER;
    }

    public static SshKey decodeSshPublicKey(byte[] data) throws KeyImportException {
        return getDecoder().decodeSshPublicKey(data);
    }

    public static SshCertificate decodeSshCertificate(byte[] data) throws KeyImportException {
        return decodeSshCertificate(data, null);
    }

    public static SshCertificate decodeSshCertificate(byte[] data, byte[] comment) throws KeyImportException {
        return getDecoder().decodeSshCertificate(data, comment);
    }

    public static SshKey generatePrivateKey(String algorithm) throws KeyGenerationException {
        return generatePrivateKey(algorithm, null, new KeyGenerationOptions());
    }

    /**
     * @param  algorithm              The SSH key algorithm - e.g., {@code ssh-ed25519}
     * @param  comment                The comment to attach - may be {@code null}
     * @param  options                Algorithm specific parameters
     * @return                        The generated private key
     * @throws KeyGenerationException If the algorithm is unknown or the parameters do not apply to it
     */
    public static SshKey generatePrivateKey(String algorithm, String comment, KeyGenerationOptions options)
            throws KeyGenerationException {
        SshKeyHandler handler = KeyAlgorithmRegistry.getDefault().getPublicKeyHandler(algorithm);
        if (handler == null) {
            throw new KeyGenerationException("Unknown algorithm: " + algorithm);
        }

        SshKey key;
        try {
            key = handler.generate(algorithm, (options == null) ? new KeyGenerationOptions() : options);
        } catch (IllegalArgumentException e) {
            throw new KeyGenerationException(e.getMessage(), e);
        }
        key.setComment(comment);
        return key;
    }

    /**
     * @param  data               Private key data in any of the supported formats - the first key found is used
     * @param  passphrase         Passphrase for an encrypted key - may be {@code null}
     * @return                    The private key
     * @throws KeyImportException If no valid private key is found
     */
    public static SshKey importPrivateKey(byte[] data, String passphrase) throws KeyImportException {
        KeyResourceDecoder.Decoded<SshKey> decoded = getDecoder().decodePrivateKey(data, passphrase);
        if ((decoded == null) || (decoded.getValue() == null)) {
            throw new KeyImportException("Invalid private key");
        }
        return decoded.getValue();
    }

    public static SshKey importPrivateKey(String data, String passphrase) throws KeyImportException {
        return importPrivateKey(toBytes(data), passphrase);
    }

    /**
     * @param  data               A private key optionally followed by the X.509 certificates of its chain
     * @param  passphrase         Passphrase for an encrypted key - may be {@code null}
     * @return                    The private key and the certificate chain - {@code null} if no certificate follows
     * @throws KeyImportException If no valid private key is found or a certificate is invalid
     */
    public static Map.Entry<SshKey, SshX509CertificateChain> importPrivateKeyAndCerts(byte[] data, String passphrase)
            throws KeyImportException {
        KeyResourceDecoder.Decoded<SshKey> decoded = getDecoder().decodePrivateKey(data, passphrase);
        if ((decoded == null) || (decoded.getValue() == null)) {
            throw new KeyImportException("Invalid private key");
        }

        byte[] rest = Arrays.copyOfRange(data, Math.min(decoded.getEnd(), data.length), data.length);
        return new SimpleImmutableEntry<>(decoded.getValue(), importCertificateChain(rest));
    }

    public static SshKey importPublicKey(byte[] data) throws KeyImportException {
        KeyResourceDecoder.Decoded<SshKey> decoded = getDecoder().decodePublicKey(data);
        if ((decoded == null) || (decoded.getValue() == null)) {
            throw new KeyImportException("Invalid public key");
        }
        return decoded.getValue();
    }

    public static SshKey importPublicKey(String data) throws KeyImportException {
        return importPublicKey(toBytes(data));
    }

    public static SshCertificate importCertificate(byte[] data) throws KeyImportException {
        KeyResourceDecoder.Decoded<SshCertificate> decoded = getDecoder().decodeCertificate(data);
        if ((decoded == null) || (decoded.getValue() == null)) {
            throw new KeyImportException("Invalid certificate");
        }
        return decoded.getValue();
    }

    public static SshCertificate importCertificate(String data) throws KeyImportException {
        return importCertificate(toBytes(data));
    }

    /**
     * @param  data               X.509 certificates - leaf first
     * @return                    The chain - {@code null} if the data holds no certificate
     * @throws KeyImportException If a certificate is invalid or not an X.509 one
     */
    public static SshX509CertificateChain importCertificateChain(byte[] data) throws KeyImportException {
        List<SshCertificate> certs = getDecoder().decodeCertificates(data);
        if (certs.isEmpty()) {
            return null;
        }

        List<SshX509Certificate> chain = new ArrayList<>(certs.size());
        for (SshCertificate cert : certs) {
            if (!(cert instanceof SshX509Certificate)) {
                throw new KeyImportException("Invalid X.509 certificate chain");
            }
            chain.add((SshX509Certificate) cert);
        }
        return SshX509CertificateChain.fromCertificates(chain);
    }

    /**
     * @param  data               An {@code x509v3-*} algorithm followed by a subject name, optionally introduced by
     *                            {@code Subject:}, {@code DN=} or {@code Distinguished Name:}
     * @return                    The subject name
     * @throws KeyImportException If the data does not hold an X.509 subject
     */
    public static String importCertificateSubject(String data) throws KeyImportException {
        List<String> parts = KeyResourceUtils.splitWhitespace(GenericUtils.trimToEmpty(data), 1);
        if (parts.size() < 2) {
            throw new KeyImportException("Missing certificate subject algorithm");
        }

        String algorithm = parts.get(0);
        String subject = parts.get(1);
        if (algorithm.startsWith(SshKey.X509_ALGORITHM_PREFIX)) {
            Matcher matcher = SUBJECT_PREFIX.matcher(subject);
            if (matcher.lookingAt()) {
                return subject.substring(matcher.end());
            }
        }

        throw new KeyImportException("Invalid certificate subject");
    }

    public static SshKey readPrivateKey(Path path, String passphrase) throws IOException, KeyImportException {
        SshKey key = importPrivateKey(IoUtils.readAllBytes(path), passphrase);
        key.setFilename(path);
        return key;
    }

    public static Map.Entry<SshKey, SshX509CertificateChain> readPrivateKeyAndCerts(Path path, String passphrase)
            throws IOException, KeyImportException {
        Map.Entry<SshKey, SshX509CertificateChain> result = importPrivateKeyAndCerts(IoUtils.readAllBytes(path),
                passphrase);
        result.getKey().setFilename(path);
        return result;
    }

    public static SshKey readPublicKey(Path path) throws IOException, KeyImportException {
        SshKey key = importPublicKey(IoUtils.readAllBytes(path));
        key.setFilename(path);
        return key;
    }

    public static SshCertificate readCertificate(Path path) throws IOException, KeyImportException {
        return importCertificate(IoUtils.readAllBytes(path));
    }

    /**
     * @param  path               A file holding one or more private keys
     * @param  passphrase         Passphrase shared by all the encrypted keys - may be {@code null}
     * @return                    The keys in file order
     * @throws IOException        If the file cannot be read
     * @throws KeyImportException If a key cannot be decoded
     */
    public static List<SshKey> readPrivateKeyList(Path path, String passphrase)
            throws IOException, KeyImportException {
        List<SshKey> keys = getDecoder().decodePrivateKeys(IoUtils.readAllBytes(path), passphrase);
        keys.forEach(k -> k.setFilename(path));
        return keys;
    }

    public static List<SshKey> readPublicKeyList(Path path) throws IOException, KeyImportException {
        List<SshKey> keys = getDecoder().decodePublicKeys(IoUtils.readAllBytes(path));
        keys.forEach(k -> k.setFilename(path));
        return keys;
    }

    public static List<SshCertificate> importCertificateList(byte[] data) throws KeyImportException {
        return getDecoder().decodeCertificates(data);
    }

    public static List<SshKey> importPublicKeyList(byte[] data) throws KeyImportException {
        return getDecoder().decodePublicKeys(data);
    }

    public static List<SshCertificate> readCertificateList(Path path) throws IOException, KeyImportException {
        return getDecoder().decodeCertificates(IoUtils.readAllBytes(path));
    }

    public static List<String> getPublicKeyAlgorithms() {
        return KeyAlgorithmRegistry.getDefault().getPublicKeyAlgorithms();
    }

    public static List<String> getDefaultPublicKeyAlgorithms() {
        return KeyAlgorithmRegistry.getDefault().getDefaultPublicKeyAlgorithms();
    }

    public static List<String> getCertificateAlgorithms() {
        return KeyAlgorithmRegistry.getDefault().getCertificateAlgorithms();
    }

    public static List<String> getDefaultCertificateAlgorithms() {
        return KeyAlgorithmRegistry.getDefault().getDefaultCertificateAlgorithms();
    }

    public static List<String> getX509CertificateAlgorithms() {
        return KeyAlgorithmRegistry.getDefault().getX509CertificateAlgorithms();
    }

    public static List<String> getDefaultX509CertificateAlgorithms() {
        return KeyAlgorithmRegistry.getDefault().getDefaultX509CertificateAlgorithms();
    }

    private static byte[] toBytes(String data) {
        return (data == null) ? GenericUtils.EMPTY_BYTE_ARRAY : data.getBytes(StandardCharsets.UTF_8);
    }

    private static final class DecoderHolder {
        private static final KeyResourceDecoder DECODER = new KeyResourceDecoder();

        private DecoderHolder() {
            throw new UnsupportedOperationException("No instance");
        }
    }
}
