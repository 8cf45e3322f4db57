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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.apache.sshkeys.common.util.GenericUtils;
import org.apache.sshkeys.common.util.ValidateUtils;
import org.apache.sshkeys.config.keys.certificate.SshCertificateHandler;
import org.apache.sshkeys.config.keys.impl.AbstractSecurityKeyHandler;
import org.apache.sshkeys.config.keys.x509.X509Support;

/**
 * The immutable mapping from algorithm names, PEM key types, PKCS#8 OIDs, certificate algorithms and security key
 * algorithm numbers to the handlers that implement them. Instances are populated once through a {@link Builder}
 * and only read afterwards, so they can be shared freely between threads.
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 * @see    BuiltinKeyAlgorithms
 */
public final class KeyAlgorithmRegistry {
    private final Map<String, SshKeyHandler> publicKeyHandlers;
    private final Map<String, SshKeyHandler> pemHandlers;
    private final Map<String, SshKeyHandler> pkcs8Handlers;
    private final Map<String, CertificateAlgorithm> certificateHandlers;
    private final Map<String, String> certificateSigAlgorithms;
    private final Map<String, String> certificateVersions;
    private final Map<Integer, SecurityKeyAlgorithm> securityKeyAlgorithms;
    private final List<String> publicKeyAlgorithms;
    private final List<String> defaultPublicKeyAlgorithms;
    private final List<String> certificateAlgorithms;
    private final List<String> defaultCertificateAlgorithms;
    private final List<String> x509CertificateAlgorithms;
    private final List<String> defaultX509CertificateAlgorithms;

    private KeyAlgorithmRegistry(Builder builder) {
        publicKeyHandlers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.publicKeyHandlers));
        pemHandlers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.pemHandlers));
        pkcs8Handlers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.pkcs8Handlers));
        certificateHandlers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.certificateHandlers));
        certificateSigAlgorithms = Collections.unmodifiableMap(new HashMap<>(builder.certificateSigAlgorithms));
        certificateVersions = Collections.unmodifiableMap(new HashMap<>(builder.certificateVersions));
        securityKeyAlgorithms = Collections.unmodifiableMap(new LinkedHashMap<>(builder.securityKeyAlgorithms));
        publicKeyAlgorithms = GenericUtils.unmodifiableList(builder.publicKeyAlgorithms);
        defaultPublicKeyAlgorithms = GenericUtils.unmodifiableList(builder.defaultPublicKeyAlgorithms);
        certificateAlgorithms = GenericUtils.unmodifiableList(builder.certificateAlgorithms);
        defaultCertificateAlgorithms = GenericUtils.unmodifiableList(builder.defaultCertificateAlgorithms);
        x509CertificateAlgorithms = GenericUtils.unmodifiableList(builder.x509CertificateAlgorithms);
        defaultX509CertificateAlgorithms = GenericUtils.unmodifiableList(builder.defaultX509CertificateAlgorithms);
    }

    /**
     * @return The registry holding all the built-in algorithms - built on first use
     */
    public static KeyAlgorithmRegistry getDefault() {
        return DefaultHolder.INSTANCE;
    }

    /**
     * @param  algorithm An SSH key algorithm name
     * @return           The matching handler - {@code null} if the algorithm is not supported
     */
    public SshKeyHandler getPublicKeyHandler(String algorithm) {
        return publicKeyHandlers.get(algorithm);
    }

    /**
     * @return The registered key algorithm names in registration order
     */
    public Collection<String> getKeyAlgorithms() {
        return publicKeyHandlers.keySet();
    }

    public SshKeyHandler getPemHandler(String pemName) {
        return pemHandlers.get(pemName);
    }

    /**
     * @return The PEM key types - in the order PKCS#1 decoding should try them
     */
    public Collection<String> getPemNames() {
        return pemHandlers.keySet();
    }

    public SshKeyHandler getPkcs8Handler(String oid) {
        return pkcs8Handlers.get(oid);
    }

    public CertificateAlgorithm getCertificateHandler(String certAlgorithm) {
        return certificateHandlers.get(certAlgorithm);
    }

    /**
     * @param  certAlgorithm A certificate algorithm name
     * @return               The signature algorithm the certificate algorithm implies - {@code null} if none
     */
    public String getCertificateSigAlgorithm(String certAlgorithm) {
        return certificateSigAlgorithms.get(certAlgorithm);
    }

    /**
     * @param  algorithm The algorithm of the key to be certified
     * @param  version   The certificate version
     * @return           The certificate algorithm name - {@code null} if no such version is registered
     */
    public String getCertificateAlgorithm(String algorithm, int version) {
        return certificateVersions.get(versionKey(algorithm, version));
    }

    public SecurityKeyAlgorithm getSecurityKeyAlgorithm(int skAlgorithm) {
        return securityKeyAlgorithms.get(skAlgorithm);
    }

    /**
     * @return The signature algorithms of every registered key type
     */
    public List<String> getPublicKeyAlgorithms() {
        return publicKeyAlgorithms;
    }

    public List<String> getDefaultPublicKeyAlgorithms() {
        return defaultPublicKeyAlgorithms;
    }

    public List<String> getCertificateAlgorithms() {
        return certificateAlgorithms;
    }

    public List<String> getDefaultCertificateAlgorithms() {
        return defaultCertificateAlgorithms;
    }

    public List<String> getX509CertificateAlgorithms() {
        return x509CertificateAlgorithms;
    }

    public List<String> getDefaultX509CertificateAlgorithms() {
        return defaultX509CertificateAlgorithms;
    }

    static String versionKey(String algorithm, int version) {
        return algorithm + "#" + version;
    }

    /**
     * The handlers registered for a certificate algorithm
     */
    public static final class CertificateAlgorithm {
        private final SshKeyHandler keyHandler;
        private final SshCertificateHandler certificateHandler;

        CertificateAlgorithm(SshKeyHandler keyHandler, SshCertificateHandler certificateHandler) {
            this.keyHandler = keyHandler;
            this.certificateHandler = Objects.requireNonNull(certificateHandler, "No certificate handler");
        }

        /**
         * @return The handler of the certified key - {@code null} for X.509 certificates
         */
        public SshKeyHandler getKeyHandler() {
            return keyHandler;
        }

        public SshCertificateHandler getCertificateHandler() {
            return certificateHandler;
        }
    }

    /**
     * A security key family along with the SSH algorithm name it creates
     */
    public static final class SecurityKeyAlgorithm {
        private final AbstractSecurityKeyHandler handler;
        private final String algorithm;

        SecurityKeyAlgorithm(AbstractSecurityKeyHandler handler, String algorithm) {
            this.handler = Objects.requireNonNull(handler, "No handler");
            this.algorithm = ValidateUtils.checkNotNullAndNotEmpty(algorithm, "No algorithm");
        }

        public AbstractSecurityKeyHandler getHandler() {
            return handler;
        }

        public String getAlgorithm() {
            return algorithm;
        }
    }

    private static final class DefaultHolder {
        private static final KeyAlgorithmRegistry INSTANCE = BuiltinKeyAlgorithms.createRegistry();

        private DefaultHolder() {
            throw new UnsupportedOperationException("No instance");
        }
    }

    /**
     * Collects the registrations - not thread-safe, all registrations must complete before {@link #build()}
     */
    public static final class Builder {
        private final Map<String, SshKeyHandler> publicKeyHandlers = new LinkedHashMap<>();
        private final Map<String, SshKeyHandler> pemHandlers = new LinkedHashMap<>();
        private final Map<String, SshKeyHandler> pkcs8Handlers = new LinkedHashMap<>();
        private final Map<String, CertificateAlgorithm> certificateHandlers = new LinkedHashMap<>();
        private final Map<String, String> certificateSigAlgorithms = new HashMap<>();
        private final Map<String, String> certificateVersions = new HashMap<>();
        private final Map<Integer, SecurityKeyAlgorithm> securityKeyAlgorithms = new LinkedHashMap<>();
        private final List<String> publicKeyAlgorithms = new ArrayList<>();
        private final List<String> defaultPublicKeyAlgorithms = new ArrayList<>();
        private final List<String> certificateAlgorithms = new ArrayList<>();
        private final List<String> defaultCertificateAlgorithms = new ArrayList<>();
        private final List<String> x509CertificateAlgorithms = new ArrayList<>();
        private final List<String> defaultX509CertificateAlgorithms = new ArrayList<>();

        public Builder() {
            super();
        }

        public Builder registerPublicKeyAlgorithm(String algorithm, SshKeyHandler handler, boolean isDefault) {
            return registerPublicKeyAlgorithm(algorithm, handler, isDefault, null);
        }

        /**
         * @param  algorithm     The key algorithm name
         * @param  handler       The handler creating keys of this algorithm
         * @param  isDefault     Whether the signature algorithms are enabled by default
         * @param  sigAlgorithms The signature algorithms to advertise - if {@code null}/empty those of the handler
         * @return               This builder
         */
        public Builder registerPublicKeyAlgorithm(
                String algorithm, SshKeyHandler handler, boolean isDefault, List<String> sigAlgorithms) {
            ValidateUtils.checkNotNullAndNotEmpty(algorithm, "No algorithm");
            Objects.requireNonNull(handler, "No handler");

            List<String> sigs = GenericUtils.isEmpty(sigAlgorithms)
                    ? handler.getSigAlgorithms(algorithm) : sigAlgorithms;
            publicKeyAlgorithms.addAll(sigs);
            if (isDefault) {
                defaultPublicKeyAlgorithms.addAll(sigs);
            }

            publicKeyHandlers.put(algorithm, handler);

            String pemName = handler.getPemName();
            if (GenericUtils.isNotEmpty(pemName)) {
                pemHandlers.put(pemName, handler);
            }

            String oid = handler.getPkcs8Oid();
            if (GenericUtils.isNotEmpty(oid)) {
                pkcs8Handlers.put(oid, handler);
            }
            return this;
        }

        /**
         * @param  version            The certificate version
         * @param  algorithm          The signature algorithm of the certified key
         * @param  certAlgorithm      The certificate algorithm name
         * @param  keyHandler         The handler of the certified key type
         * @param  certificateHandler The certificate decoder
         * @param  isDefault          Whether the algorithm is enabled by default
         * @return                    This builder
         */
        public Builder registerCertificateAlgorithm(
                int version, String algorithm, String certAlgorithm, SshKeyHandler keyHandler,
                SshCertificateHandler certificateHandler, boolean isDefault) {
            ValidateUtils.checkNotNullAndNotEmpty(certAlgorithm, "No certificate algorithm");
            certificateAlgorithms.add(certAlgorithm);
            if (isDefault) {
                defaultCertificateAlgorithms.add(certAlgorithm);
            }

            certificateHandlers.put(certAlgorithm, new CertificateAlgorithm(keyHandler, certificateHandler));
            certificateSigAlgorithms.put(certAlgorithm, algorithm);
            certificateVersions.put(versionKey(algorithm, version), certAlgorithm);
            return this;
        }

        /**
         * Registers an X.509 certificate algorithm - ignored if X.509 support is not available at runtime
         *
         * @param  certAlgorithm      The {@code x509v3-*} algorithm name
         * @param  certificateHandler The chain decoder
         * @param  isDefault          Whether the algorithm is enabled by default
         * @return                    This builder
         */
        public Builder registerX509CertificateAlgorithm(
                String certAlgorithm, SshCertificateHandler certificateHandler, boolean isDefault) {
            if (!X509Support.isAvailable()) {
                return this;
            }

            x509CertificateAlgorithms.add(certAlgorithm);
            if (isDefault) {
                defaultX509CertificateAlgorithms.add(certAlgorithm);
            }

            certificateHandlers.put(certAlgorithm, new CertificateAlgorithm(null, certificateHandler));
            return this;
        }

        public Builder registerSecurityKeyAlgorithm(
                int skAlgorithm, AbstractSecurityKeyHandler handler, String algorithm) {
            securityKeyAlgorithms.put(skAlgorithm, new SecurityKeyAlgorithm(handler, algorithm));
            return this;
        }

        public KeyAlgorithmRegistry build() {
            return new KeyAlgorithmRegistry(this);
        }
    }
}
