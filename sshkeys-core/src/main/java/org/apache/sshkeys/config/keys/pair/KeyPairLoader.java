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


package org.apache.sshkeys.config.keys.pair;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.apache.sshkeys.common.util.GenericUtils;
import org.apache.sshkeys.common.util.ValidateUtils;
import org.apache.sshkeys.common.util.io.IoUtils;
import org.apache.sshkeys.common.util.logging.AbstractLoggingBean;
import org.apache.sshkeys.config.keys.KeyAlgorithmRegistry;
import org.apache.sshkeys.config.keys.KeyImportException;
import org.apache.sshkeys.config.keys.PublicKeyIdentity;
import org.apache.sshkeys.config.keys.SshKey;
import org.apache.sshkeys.config.keys.SshKeys;
import org.apache.sshkeys.config.keys.certificate.SshCertificate;
import org.apache.sshkeys.config.keys.impl.AbstractSecurityKeySshKey;
import org.apache.sshkeys.config.keys.sk.ResidentKey;
import org.apache.sshkeys.config.keys.sk.SecurityKeyAuthenticator;
import org.apache.sshkeys.config.keys.x509.SshX509Certificate;
import org.apache.sshkeys.config.keys.x509.SshX509CertificateChain;

/**
 * Bulk loading of key pairs, public keys, certificates and identities - including the OpenSSH default locations
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public class KeyPairLoader extends AbstractLoggingBean {
    public static final String SSH_FOLDER_NAME = ".ssh";
    public static final String CERTIFICATE_FILE_SUFFIX = "-cert.pub";
    public static final String PUBLIC_KEY_FILE_SUFFIX = ".pub";
    public static final String DEFAULT_APPLICATION = "ssh:";

    /**
     * The user key files looked up under {@code ~/.ssh} - in order of preference
     */
    public static final List<String> DEFAULT_KEY_FILES = Collections.unmodifiableList(
            Arrays.asList("id_ed25519_sk", "id_ecdsa_sk", "id_ed448", "id_ed25519", "id_ecdsa", "id_rsa", "id_dsa"));

    public static final List<String> DEFAULT_HOST_KEY_DIRS = Collections.unmodifiableList(
            Arrays.asList("/opt/local/etc", "/opt/local/etc/ssh", "/usr/local/etc", "/usr/local/etc/ssh",
                    "/etc", "/etc/ssh"));

    public static final List<String> DEFAULT_HOST_KEY_FILES = Collections.unmodifiableList(
            Arrays.asList("ssh_host_ed448_key", "ssh_host_ed25519_key", "ssh_host_ecdsa_key", "ssh_host_rsa_key",
                    "ssh_host_dsa_key"));

    private final KeyAlgorithmRegistry registry;
    private Path userHomeFolder;
    private List<Path> hostKeyFolders;

    public KeyPairLoader() {
        this(KeyAlgorithmRegistry.getDefault());
    }

    public KeyPairLoader(KeyAlgorithmRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "No registry");
        this.userHomeFolder = IoUtils.getUserHomeFolder();
        List<Path> folders = new ArrayList<>(DEFAULT_HOST_KEY_DIRS.size());
        for (String dir : DEFAULT_HOST_KEY_DIRS) {
            folders.add(Paths.get(dir));
        }
        this.hostKeyFolders = Collections.unmodifiableList(folders);
    }

    public KeyAlgorithmRegistry getRegistry() {
        return registry;
    }

    public Path getUserHomeFolder() {
        return userHomeFolder;
    }

    public void setUserHomeFolder(Path userHomeFolder) {
        this.userHomeFolder = userHomeFolder;
    }

    public List<Path> getHostKeyFolders() {
        return hostKeyFolders;
    }

    public void setHostKeyFolders(Collection<Path> hostKeyFolders) {
        this.hostKeyFolders = GenericUtils.unmodifiableList(hostKeyFolders);
    }

    /**
     * @return The folder holding the user's default keys - {@code null} if the home folder is unknown
     */
    public Path getUserKeysFolder() {
        return (userHomeFolder == null) ? null : userHomeFolder.resolve(SSH_FOLDER_NAME);
    }

    /**
     * Loads the key pairs from a single file. If the file holds several private keys each one becomes a pair of its
     * own, otherwise the file is loaded along with its {@code -cert.pub} and {@code .pub} companions.
     *
     * @param  path                     The private key file
     * @param  passwordProvider         Resolves the passphrase of encrypted keys - may be {@code null}
     * @param  certificates             Extra certificates to match against the loaded keys - may be {@code null}
     * @return                          The loaded key pairs - a certified pair precedes the plain one for its key,
     *                                  a key followed by its X.509 chain yields the certified pair only
     * @throws IOException              If the file cannot be read
     * @throws GeneralSecurityException If a key or certificate cannot be decoded
     */
    public List<SshKeyPair> loadKeyPairs(
            Path path, FilePasswordProvider passwordProvider, Collection<? extends SshCertificate> certificates)
            throws IOException, GeneralSecurityException {
        return loadKeyPairs(path, passwordProvider, certificates, false, false);
    }

    public List<SshKeyPair> loadKeyPairs(
            Path path, FilePasswordProvider passwordProvider, Collection<? extends SshCertificate> certificates,
            boolean skipPublic, boolean ignoreEncrypted)
            throws IOException, GeneralSecurityException {
        Objects.requireNonNull(path, "No path");
        FilePasswordProvider provider = (passwordProvider == null) ? FilePasswordProvider.EMPTY : passwordProvider;
        String passphrase = provider.getPassword(path.toString());

        List<KeyPairSource> sources = null;
        try {
            List<SshKey> keys = SshKeys.readPrivateKeyList(path, passphrase);
            if (keys.size() > 1) {
                sources = new ArrayList<>(keys.size());
                for (SshKey key : keys) {
                    sources.add(KeyPairSource.of(key));
                }
            }
        } catch (KeyImportException e) {
            debug("loadKeyPairs({}) cannot pre-load key list: {}", path, e.getMessage(), e);
        }

        if (sources == null) {
            sources = Collections.singletonList(KeyPairSource.of(path));
        }

        return loadKeyPairs(sources, FilePasswordProvider.of(passphrase), certificates, skipPublic, ignoreEncrypted);
    }

    /**
     * @param  sources                  The private key sources
     * @param  passwordProvider         Resolves the passphrase of encrypted keys - may be {@code null}
     * @param  certificates             Extra certificates to match against the loaded keys - may be {@code null}
     * @param  skipPublic               Whether to skip sources that hold no private key
     * @param  ignoreEncrypted          Whether to skip encrypted keys for which no passphrase is available
     * @return                          The loaded key pairs - a certified pair precedes the plain one for its key
     * @throws IOException              If a file cannot be read
     * @throws GeneralSecurityException If a key or certificate cannot be decoded
     */
    public List<SshKeyPair> loadKeyPairs(
            Collection<KeyPairSource> sources, FilePasswordProvider passwordProvider,
            Collection<? extends SshCertificate> certificates, boolean skipPublic, boolean ignoreEncrypted)
            throws IOException, GeneralSecurityException {
        FilePasswordProvider provider = (passwordProvider == null) ? FilePasswordProvider.EMPTY : passwordProvider;
        List<SshCertificate> certList = GenericUtils.unmodifiableList(certificates);
        Map<ByteBuffer, SshCertificate> certsByKey = new HashMap<>();
        for (SshCertificate cert : certList) {
            certsByKey.put(ByteBuffer.wrap(cert.getKey().getPublicData()), cert);
        }

        List<SshKeyPair> result = new ArrayList<>();
        for (KeyPairSource source : sources) {
            loadKeyPairs(source, provider, certList, certsByKey, skipPublic, ignoreEncrypted, result);
        }
        return result;
    }

    protected void loadKeyPairs(
            KeyPairSource source, FilePasswordProvider provider, List<SshCertificate> certList,
            Map<ByteBuffer, SshCertificate> certsByKey, boolean skipPublic, boolean ignoreEncrypted,
            List<SshKeyPair> result)
            throws IOException, GeneralSecurityException {
        boolean allowCerts = !source.hasCompanion();
        SshKey key = null;
        SshKeyPair keyPair = source.getKeyPair();
        List<SshCertificate> appendedCerts = null;
        Path certsPath = null;
        Path publicKeyPath = null;
        try {
            Path path = source.getPath();
            byte[] data = source.getData();
            if (path != null) {
                String prefix = path.toString();
                String passphrase = provider.getPassword(prefix);
                if (allowCerts) {
                    Map.Entry<SshKey, SshX509CertificateChain> entry
                            = SshKeys.readPrivateKeyAndCerts(path, passphrase);
                    key = entry.getKey();
                    if (entry.getValue() != null) {
                        appendedCerts = Collections.singletonList(entry.getValue());
                    } else {
                        certsPath = Paths.get(prefix + CERTIFICATE_FILE_SUFFIX);
                    }
                } else {
                    key = SshKeys.readPrivateKey(path, passphrase);
                }
                publicKeyPath = Paths.get(prefix + PUBLIC_KEY_FILE_SUFFIX);
            } else if (data != null) {
                String passphrase = provider.getPassword(null);
                if (allowCerts) {
                    Map.Entry<SshKey, SshX509CertificateChain> entry
                            = SshKeys.importPrivateKeyAndCerts(data, passphrase);
                    key = entry.getKey();
                    if (entry.getValue() != null) {
                        appendedCerts = Collections.singletonList(entry.getValue());
                    }
                } else {
                    key = SshKeys.importPrivateKey(data, passphrase);
                }
            } else if (keyPair == null) {
                key = source.getKey();
            }
        } catch (KeyImportException e) {
            String message = e.getMessage();
            if (skipPublic || (ignoreEncrypted && (message != null) && message.startsWith("Passphrase"))) {
                debug("loadKeyPairs({}) skip: {}", source, message, e);
                return;
            }
            throw e;
        }

        List<SshCertificate> certs = null;
        Object publicKeyToLoad = publicKeyPath;
        Exception savedError = null;
        if (source.hasCompanion()) {
            if (source.getCompanionCertificates() != null) {
                certs = source.getCompanionCertificates();
            } else if (source.getCompanionKey() != null) {
                publicKeyToLoad = source.getCompanionKey();
            } else {
                try {
                    certs = (source.getCompanionPath() != null)
                            ? SshKeys.readCertificateList(source.getCompanionPath())
                            : SshKeys.importCertificateList(source.getCompanionData());
                } catch (IOException | KeyImportException e) {
                    savedError = e;
                }

                if (GenericUtils.isEmpty(certs)) {
                    publicKeyToLoad = (source.getCompanionPath() != null)
                            ? source.getCompanionPath() : source.getCompanionData();
                }
            }
        } else if (appendedCerts != null) {
            certs = appendedCerts;
        } else if (certsPath != null) {
            try {
                certs = SshKeys.readCertificateList(certsPath);
            } catch (IOException | KeyImportException e) {
                debug("loadKeyPairs({}) no certificates: {}", certsPath, e.getMessage(), e);
            }
        }

        SshKey publicKey = null;
        if (publicKeyToLoad != null) {
            try {
                publicKey = loadPublicKey(publicKeyToLoad);
                savedError = null;
            } catch (IOException | KeyImportException e) {
                debug("loadKeyPairs({}) no public key: {}", source, e.getMessage(), e);
            }
        }

        if (savedError instanceof IOException) {
            throw (IOException) savedError;
        } else if (savedError != null) {
            throw (KeyImportException) savedError;
        }

        SshCertificate cert;
        if (GenericUtils.isEmpty(certs)) {
            byte[] publicData = (keyPair != null) ? keyPair.getKeyPublicData() : key.getPublicData();
            cert = certsByKey.get(ByteBuffer.wrap(publicData));
            if ((cert != null) && cert.isX509()) {
                cert = toCertificateChain(certList);
            }
        } else if ((certs.size() == 1) && !certs.get(0).isX509()) {
            cert = certs.get(0);
        } else {
            cert = toCertificateChain(certs);
        }

        if (keyPair != null) {
            if (cert != null) {
                keyPair.setCertificate(cert);
            }
            result.add(keyPair);
        } else {
            if (cert != null) {
                result.add(new SshLocalKeyPair(key, publicKey, cert));
            }
            // a chain appended to the key data is bound to that key
            if ((cert == null) || (appendedCerts == null)) {
                result.add(new SshLocalKeyPair(key, publicKey, null));
            }
        }
    }

    /**
     * Loads the user's default key pairs from {@code ~/.ssh} - encrypted keys without a passphrase and missing files
     * are skipped
     *
     * @param  passwordProvider         Resolves the passphrase of encrypted keys - may be {@code null}
     * @param  certificates             Extra certificates to match against the loaded keys - may be {@code null}
     * @return                          The loaded key pairs
     * @throws GeneralSecurityException If a key or certificate cannot be decoded
     */
    public List<SshKeyPair> loadDefaultKeyPairs(
            FilePasswordProvider passwordProvider, Collection<? extends SshCertificate> certificates)
            throws GeneralSecurityException {
        Path folder = getUserKeysFolder();
        if (folder == null) {
            log.debug("loadDefaultKeyPairs() no user home folder");
            return Collections.emptyList();
        }

        List<SshKeyPair> result = new ArrayList<>();
        for (String file : DEFAULT_KEY_FILES) {
            Path path = folder.resolve(file);
            try {
                result.addAll(loadKeyPairs(path, passwordProvider, certificates, false, true));
            } catch (IOException e) {
                debug("loadDefaultKeyPairs({}) skip: {}", path, e.getMessage(), e);
            }
        }
        return result;
    }

    public List<SshKey> loadPublicKeys(Path path) throws IOException, GeneralSecurityException {
        return SshKeys.readPublicKeyList(path);
    }

    public List<SshKey> loadPublicKeys(Collection<Path> paths) throws IOException, GeneralSecurityException {
        List<SshKey> result = new ArrayList<>(paths.size());
        for (Path path : paths) {
            result.add(SshKeys.readPublicKey(path));
        }
        return result;
    }

    /**
     * @return The readable default host certificates followed by the readable default host public keys
     */
    public List<PublicKeyIdentity> loadDefaultHostPublicKeys() {
        List<PublicKeyIdentity> result = new ArrayList<>();
        for (Path folder : hostKeyFolders) {
            for (String file : DEFAULT_HOST_KEY_FILES) {
                Path path = folder.resolve(file + CERTIFICATE_FILE_SUFFIX);
                try {
                    result.add(SshKeys.readCertificate(path));
                } catch (IOException | KeyImportException e) {
                    log.trace("loadDefaultHostPublicKeys({}) skip: {}", path, e.toString());
                }
            }
        }

        for (Path folder : hostKeyFolders) {
            for (String file : DEFAULT_HOST_KEY_FILES) {
                Path path = folder.resolve(file + PUBLIC_KEY_FILE_SUFFIX);
                try {
                    result.add(SshKeys.readPublicKey(path));
                } catch (IOException | KeyImportException e) {
                    log.trace("loadDefaultHostPublicKeys({}) skip: {}", path, e.toString());
                }
            }
        }
        return result;
    }

    public List<SshCertificate> loadCertificates(Path path) throws IOException, GeneralSecurityException {
        return SshKeys.readCertificateList(path);
    }

    public List<SshCertificate> loadCertificates(Collection<Path> paths)
            throws IOException, GeneralSecurityException {
        List<SshCertificate> result = new ArrayList<>();
        for (Path path : paths) {
            result.addAll(SshKeys.readCertificateList(path));
        }
        return result;
    }

    public List<SshCertificate> loadCertificates(byte[] data) throws GeneralSecurityException {
        return SshKeys.importCertificateList(data);
    }

    /**
     * Reads the public data of each identity file - a certificate if the file holds one, otherwise a public key
     *
     * @param  paths                    The identity files
     * @param  skipPrivate              Whether to skip files holding neither (e.g., a private key)
     * @return                          The SSH public data of each identity
     * @throws IOException              If a file cannot be read
     * @throws GeneralSecurityException If a file holds no identity and {@code skipPrivate} is {@code false}
     */
    public List<byte[]> loadIdentities(Collection<Path> paths, boolean skipPrivate)
            throws IOException, GeneralSecurityException {
        List<byte[]> result = new ArrayList<>(paths.size());
        for (Path path : paths) {
            byte[] publicData;
            try {
                publicData = SshKeys.readCertificate(path).getPublicData();
            } catch (KeyImportException e) {
                try {
                    publicData = SshKeys.readPublicKey(path).getPublicData();
                } catch (KeyImportException e2) {
                    if (skipPrivate) {
                        debug("loadIdentities({}) skip: {}", path, e2.getMessage(), e2);
                        continue;
                    }
                    throw e2;
                }
            }
            result.add(publicData);
        }
        return result;
    }

    public List<byte[]> loadIdentities(Collection<? extends PublicKeyIdentity> identities) {
        List<byte[]> result = new ArrayList<>(identities.size());
        for (PublicKeyIdentity identity : identities) {
            result.add(identity.getPublicData());
        }
        return result;
    }

    /**
     * @return The public data of the readable default user certificates and public keys - each certificate
     *         preceding the public key of the same file
     */
    public List<byte[]> loadDefaultIdentities() {
        Path folder = getUserKeysFolder();
        if (folder == null) {
            log.debug("loadDefaultIdentities() no user home folder");
            return Collections.emptyList();
        }

        List<byte[]> result = new ArrayList<>();
        for (String file : DEFAULT_KEY_FILES) {
            Path certPath = folder.resolve(file + CERTIFICATE_FILE_SUFFIX);
            try {
                result.add(SshKeys.readCertificate(certPath).getPublicData());
            } catch (IOException | KeyImportException e) {
                log.trace("loadDefaultIdentities({}) skip: {}", certPath, e.toString());
            }

            Path keyPath = folder.resolve(file + PUBLIC_KEY_FILE_SUFFIX);
            try {
                result.add(SshKeys.readPublicKey(keyPath).getPublicData());
            } catch (IOException | KeyImportException e) {
                log.trace("loadDefaultIdentities({}) skip: {}", keyPath, e.toString());
            }
        }
        return result;
    }

    public List<SshKey> loadResidentKeys(SecurityKeyAuthenticator authenticator, String pin)
            throws KeyImportException {
        return loadResidentKeys(authenticator, pin, DEFAULT_APPLICATION, null, true);
    }

    /**
     * @param  authenticator      The security key to query
     * @param  pin                The token PIN
     * @param  application        The application the keys were enrolled with
     * @param  user               The user to filter on - {@code null} for all users
     * @param  touchRequired      Whether signing with the keys requires a touch
     * @return                    The resident keys - each one's comment is the user name stored with it
     * @throws KeyImportException If the token cannot be queried or reports an unsupported key
     */
    public List<SshKey> loadResidentKeys(
            SecurityKeyAuthenticator authenticator, String pin, String application, String user, boolean touchRequired)
            throws KeyImportException {
        Objects.requireNonNull(authenticator, "No authenticator");
        ValidateUtils.checkNotNullAndNotEmpty(application, "No application");
        byte[] appBytes = application.getBytes(StandardCharsets.UTF_8);
        int flags = touchRequired ? SecurityKeyAuthenticator.SSH_SK_USER_PRESENCE_REQD : 0;

        List<ResidentKey> residentKeys;
        try {
            residentKeys = authenticator.getResidentKeys(appBytes, user, pin);
        } catch (IOException | IllegalArgumentException e) {
            throw new KeyImportException(e.getMessage(), e);
        }

        List<SshKey> result = new ArrayList<>(residentKeys.size());
        for (ResidentKey residentKey : residentKeys) {
            KeyAlgorithmRegistry.SecurityKeyAlgorithm skAlgorithm
                    = registry.getSecurityKeyAlgorithm(residentKey.getAlg());
            if (skAlgorithm == null) {
                throw new KeyImportException("Unsupported security key algorithm: " + residentKey.getAlg());
            }

            AbstractSecurityKeySshKey key = skAlgorithm.getHandler().makePrivate(
                    residentKey.getPublicValue(), appBytes, flags, residentKey.getKeyHandle(), new byte[0]);
            key.setComment(residentKey.getName());
            key.setAuthenticator(authenticator);
            result.add(key);
        }
        return result;
    }

    protected SshKey loadPublicKey(Object source) throws IOException, KeyImportException {
        if (source instanceof Path) {
            return SshKeys.readPublicKey((Path) source);
        } else if (source instanceof byte[]) {
            return SshKeys.importPublicKey((byte[]) source);
        } else {
            return (SshKey) source;
        }
    }

    protected SshX509CertificateChain toCertificateChain(Collection<SshCertificate> certs) throws KeyImportException {
        List<SshX509Certificate> chain = new ArrayList<>(certs.size());
        for (SshCertificate cert : certs) {
            if (cert instanceof SshX509CertificateChain) {
                chain.addAll(((SshX509CertificateChain) cert).getCertificates());
            } else if (cert instanceof SshX509Certificate) {
                chain.add((SshX509Certificate) cert);
            } else {
                throw new KeyImportException("Invalid X.509 certificate chain");
            }
        }
        if (chain.isEmpty()) {
            throw new KeyImportException("No certificates present");
        }
        return SshX509CertificateChain.fromCertificates(chain);
    }
}
