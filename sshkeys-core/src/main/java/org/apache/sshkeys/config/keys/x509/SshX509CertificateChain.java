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


package org.apache.sshkeys.config.keys.x509;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

import org.apache.sshkeys.common.util.GenericUtils;
import org.apache.sshkeys.common.util.ValidateUtils;
import org.apache.sshkeys.common.util.buffer.Buffer;
import org.apache.sshkeys.common.util.buffer.BufferException;
import org.apache.sshkeys.common.util.buffer.ByteArrayBuffer;
import org.apache.sshkeys.config.keys.KeyImportException;
import org.apache.sshkeys.config.keys.certificate.SshCertificate;
import org.apache.sshkeys.config.keys.certificate.SshCertificateHandler;
import org.bouncycastle.asn1.x500.X500Name;

/**
 * The RFC 6187 {@code x509v3-*} public key - a leaf certificate followed by its issuers and optional OCSP responses:
 *
 * <pre>
 * string    algorithm
 * uint32    certificate-count
 * string    certificate[1..certificate-count]
 * uint32    ocsp-response-count
 * string    ocsp-response[0..ocsp-response-count]
 * </pre>
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public class SshX509CertificateChain extends SshCertificate {
    public static final SshCertificateHandler HANDLER = (algorithm, keyHandler, buffer, comment) -> {
        try {
            int count = buffer.getInt();
            ValidateUtils.checkTrue(count >= 0, "Invalid certificate count: %d", count);
            List<SshX509Certificate> certs = new ArrayList<>(Math.min(count, 16));
            for (int index = 0; index < count; index++) {
                certs.add(SshX509Certificate.fromDer(buffer.getBytes(), null));
            }

            int ocspCount = buffer.getInt();
            ValidateUtils.checkTrue(ocspCount >= 0, "Invalid OCSP response count: %d", ocspCount);
            List<byte[]> ocspResponses = new ArrayList<>(Math.min(ocspCount, 16));
            for (int index = 0; index < ocspCount; index++) {
                ocspResponses.add(buffer.getBytes());
            }
            buffer.checkEnd();

            if (certs.isEmpty()) {
                throw new KeyImportException("No certificates present");
            }
            return new SshX509CertificateChain(algorithm, certs, ocspResponses, comment);
        } catch (BufferException | IllegalArgumentException e) {
            throw new KeyImportException("Invalid X.509 certificate chain", e);
        }
    };

    private final List<SshX509Certificate> certificates;
    private final List<byte[]> ocspResponses;

    public SshX509CertificateChain(String algorithm, List<SshX509Certificate> certificates,
                                   List<byte[]> ocspResponses, byte[] comment) {
        super(algorithm, first(certificates).getKey().getX509Algorithms(),
              first(certificates).getKey().getX509Algorithms(), first(certificates).getKey(),
              encodePublicData(algorithm, certificates, ocspResponses), comment);
        this.certificates = GenericUtils.unmodifiableList(certificates);
        this.ocspResponses = GenericUtils.unmodifiableList(ocspResponses);
    }

    /**
     * @param  certificates The leaf certificate followed by its issuers
     * @return              A chain using the algorithm and comment of the leaf certificate, without OCSP responses
     */
    public static SshX509CertificateChain fromCertificates(List<SshX509Certificate> certificates) {
        SshX509Certificate leaf = first(certificates);
        return new SshX509CertificateChain(leaf.getAlgorithm(), certificates, null, leaf.getCommentBytes());
    }

    @Override
    public boolean isX509Chain() {
        return true;
    }

    public List<SshX509Certificate> getCertificates() {
        return certificates;
    }

    public List<byte[]> getOcspResponses() {
        return ocspResponses;
    }

    /**
     * @return The subject of the leaf certificate
     */
    public X500Name getSubject() {
        return certificates.get(0).getSubject();
    }

    /**
     * @return The issuer of the last certificate in the chain
     */
    public X500Name getIssuer() {
        return certificates.get(certificates.size() - 1).getIssuer();
    }

    public List<String> getUserPrincipals() {
        return certificates.get(0).getUserPrincipals();
    }

    /**
     * @param  algorithm The signature algorithm to advertise
     * @return           The public data re-encoded with the given algorithm - this chain is unchanged
     */
    public byte[] adjustPublicData(String algorithm) {
        return encodePublicData(algorithm, certificates, ocspResponses);
    }

    /**
     * Checks the chain against the revoked certificates, then validates the leaf certificate using the rest of the
     * chain as candidate issuers.
     *
     * @param  trustedCerts             The explicitly trusted certificates
     * @param  trustedCertPaths         Hashed certificate directories - may be empty
     * @param  revokedCerts             Certificates that must not appear in the chain - may be empty
     * @param  purposes                 The required purposes
     * @param  userPrincipal            The user to check for - ignored if {@code null}/empty
     * @param  hostPrincipal            The host to check for - ignored if {@code null}/empty
     * @throws IllegalArgumentException If the chain is not valid for the request
     * @see                             SshX509Certificate#validateChain(List, Collection, Collection, Collection,
     *                                  String, String)
     */
    public void validateChain(
            Collection<SshX509Certificate> trustedCerts, Collection<Path> trustedCertPaths,
            Set<SshX509Certificate> revokedCerts, Collection<String> purposes,
            String userPrincipal, String hostPrincipal) {
        if (GenericUtils.isNotEmpty(revokedCerts)) {
            for (SshX509Certificate cert : certificates) {
                ValidateUtils.checkTrue(!revokedCerts.contains(cert), "Revoked X.509 certificate in certificate chain");
            }
        }

        certificates.get(0).validateChain(certificates.subList(1, certificates.size()), trustedCerts,
                trustedCertPaths, purposes, userPrincipal, hostPrincipal);
    }

    protected static byte[] encodePublicData(
            String algorithm, List<SshX509Certificate> certificates, List<byte[]> ocspResponses) {
        Buffer buffer = new ByteArrayBuffer();
        buffer.putString(algorithm);
        buffer.putUInt(certificates.size());
        for (SshX509Certificate cert : certificates) {
            buffer.putBytes(cert.getPublicData());
        }
        buffer.putUInt(GenericUtils.size(ocspResponses));
        if (ocspResponses != null) {
            for (byte[] response : ocspResponses) {
                buffer.putBytes(response);
            }
        }
        return buffer.getCompactData();
    }

    private static SshX509Certificate first(List<SshX509Certificate> certificates) {
        ValidateUtils.checkTrue(GenericUtils.isNotEmpty(certificates), "No certificates present");
        return certificates.get(0);
    }
}
