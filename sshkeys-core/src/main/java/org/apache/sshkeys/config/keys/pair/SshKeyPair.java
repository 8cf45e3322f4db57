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

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Arrays;
import java.util.List;

import org.apache.sshkeys.common.util.GenericUtils;
import org.apache.sshkeys.common.util.NumberUtils;
import org.apache.sshkeys.common.util.ValidateUtils;
import org.apache.sshkeys.config.keys.KeyAlgorithmRegistry;
import org.apache.sshkeys.config.keys.KeyExportException;
import org.apache.sshkeys.config.keys.certificate.SshCertificate;
import org.apache.sshkeys.config.keys.x509.SshX509CertificateChain;

/**
 * A key usable for signing along with the certificate (if any) presented with it. When a certificate is attached the
 * advertised algorithm, the public data and the allowed signature algorithms are taken from it.
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public abstract class SshKeyPair {
    public static final String LOCAL_KEY_TYPE = "local";

    private final String keyAlgorithm;
    private final byte[] keyPublicData;
    private final KeyAlgorithmRegistry registry;
    private final List<String> keySigAlgorithms;
    private byte[] comment;
    private byte[] filename;
    private SshCertificate certificate;
    private String algorithm;
    private String sigAlgorithm;
    private List<String> sigAlgorithms;
    private List<String> hostKeyAlgorithms;
    private byte[] publicData;

    protected SshKeyPair(String keyAlgorithm, String sigAlgorithm, List<String> sigAlgorithms,
                         byte[] keyPublicData, byte[] comment, SshCertificate certificate, byte[] filename) {
        this(KeyAlgorithmRegistry.getDefault(), keyAlgorithm, sigAlgorithm, sigAlgorithms, keyPublicData, comment,
             certificate, filename);
    }

    protected SshKeyPair(KeyAlgorithmRegistry registry, String keyAlgorithm, String sigAlgorithm,
                         List<String> sigAlgorithms, byte[] keyPublicData, byte[] comment,
                         SshCertificate certificate, byte[] filename) {
        this.registry = ValidateUtils.checkNotNull(registry, "No registry");
        this.keyAlgorithm = ValidateUtils.checkNotNullAndNotEmpty(keyAlgorithm, "No key algorithm");
        this.keyPublicData = ValidateUtils.checkNotNullAndNotEmpty(keyPublicData, "No key public data").clone();
        this.keySigAlgorithms = GenericUtils.unmodifiableList(sigAlgorithms);
        this.sigAlgorithm = ValidateUtils.checkNotNullAndNotEmpty(sigAlgorithm, "No signature algorithm");
        setComment(comment);
        this.filename = NumberUtils.isEmpty(filename) ? null : filename.clone();
        setCertificate(certificate);
    }

    /**
     * @return The kind of key pair - {@value #LOCAL_KEY_TYPE} for keys held in memory
     */
    public String getKeyType() {
        return LOCAL_KEY_TYPE;
    }

    public KeyAlgorithmRegistry getRegistry() {
        return registry;
    }

    public String getKeyAlgorithm() {
        return keyAlgorithm;
    }

    public byte[] getKeyPublicData() {
        return keyPublicData.clone();
    }

    /**
     * @return The algorithm advertised for this pair - the certificate one when a certificate is attached
     */
    public String getAlgorithm() {
        return algorithm;
    }

    public String getSigAlgorithm() {
        return sigAlgorithm;
    }

    public List<String> getSigAlgorithms() {
        return sigAlgorithms;
    }

    public List<String> getHostKeyAlgorithms() {
        return hostKeyAlgorithms;
    }

    /**
     * @return The public data advertised for this pair - the certificate one when a certificate is attached
     */
    public byte[] getPublicData() {
        return publicData.clone();
    }

    public SshCertificate getCertificate() {
        return certificate;
    }

    public boolean hasCertificate() {
        return certificate != null;
    }

    public boolean hasX509Chain() {
        return (certificate != null) && certificate.isX509Chain();
    }

    /**
     * @return The comment - or the file name the key was loaded from if there is no comment ({@code null} if neither)
     */
    public byte[] getCommentBytes() {
        byte[] value = (comment != null) ? comment : filename;
        return (value == null) ? null : value.clone();
    }

    public String getComment() {
        byte[] value = getCommentBytes();
        return NumberUtils.isEmpty(value) ? null : new String(value, StandardCharsets.UTF_8);
    }

    public void setComment(String comment) {
        setComment(GenericUtils.isEmpty(comment) ? null : comment.getBytes(StandardCharsets.UTF_8));
    }

    public void setComment(byte[] comment) {
        this.comment = NumberUtils.isEmpty(comment) ? null : comment.clone();
    }

    /**
     * Attaches a certificate to this pair - or detaches the current one
     *
     * @param  certificate              The certificate - {@code null} to present the bare key
     * @throws IllegalArgumentException If the certificate does not certify this pair's key
     */
    public void setCertificate(SshCertificate certificate) {
        if (certificate != null) {
            if (!Arrays.equals(certificate.getKey().getPublicData(), keyPublicData)) {
                throw new IllegalArgumentException("Certificate key mismatch");
            }

            this.algorithm = certificate.getAlgorithm();
            if (certificate.isX509Chain()) {
                this.sigAlgorithm = certificate.getAlgorithm();
            }
            this.sigAlgorithms = certificate.getSigAlgorithms();
            this.hostKeyAlgorithms = certificate.getHostKeyAlgorithms();
            this.publicData = certificate.getPublicData();
        } else {
            this.algorithm = keyAlgorithm;
            this.sigAlgorithms = keySigAlgorithms;
            this.hostKeyAlgorithms = keySigAlgorithms;
            this.publicData = keyPublicData.clone();
        }

        this.certificate = certificate;
    }

    /**
     * Selects the signature algorithm to use. A certificate algorithm name is mapped to the signature algorithm it
     * implies. Without a certificate the advertised algorithm follows the signature one, and with an X.509 chain the
     * chain is re-encoded under it.
     *
     * @param sigAlgorithm The signature or certificate algorithm name
     */
    public void setSigAlgorithm(String sigAlgorithm) {
        ValidateUtils.checkNotNullAndNotEmpty(sigAlgorithm, "No signature algorithm");
        String mapped = registry.getCertificateSigAlgorithm(sigAlgorithm);
        this.sigAlgorithm = (mapped == null) ? sigAlgorithm : mapped;

        if (certificate == null) {
            this.algorithm = this.sigAlgorithm;
        } else if (certificate.isX509Chain()) {
            this.algorithm = this.sigAlgorithm;
            this.publicData = ((SshX509CertificateChain) certificate).adjustPublicData(this.sigAlgorithm);
        }
    }

    /**
     * @return                     The private key in the form an SSH agent accepts
     * @throws KeyExportException If this pair cannot be exported to an agent
     */
    public byte[] getAgentPrivateKey() throws KeyExportException {
        throw new KeyExportException("Private key export to agent not supported");
    }

    /**
     * @param  data                     The data to sign
     * @return                          The SSH signature blob made with the current signature algorithm
     * @throws GeneralSecurityException If failed to sign
     */
    public abstract byte[] sign(byte[] data) throws GeneralSecurityException;

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + getAlgorithm() + "]";
    }
}
