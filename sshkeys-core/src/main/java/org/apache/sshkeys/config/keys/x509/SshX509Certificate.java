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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.cert.CertPathBuilder;
import java.security.cert.CertPathBuilderException;
import java.security.cert.CertStore;
import java.security.cert.CollectionCertStoreParameters;
import java.security.cert.PKIXBuilderParameters;
import java.security.cert.TrustAnchor;
import java.security.cert.X509CertSelector;
import java.security.cert.X509Certificate;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.sshkeys.common.util.GenericUtils;
import org.apache.sshkeys.common.util.ValidateUtils;
import org.apache.sshkeys.config.keys.KeyImportException;
import org.apache.sshkeys.config.keys.SshKey;
import org.apache.sshkeys.config.keys.certificate.SshCertificate;
import org.apache.sshkeys.config.keys.loader.pem.PKCS8KeyCodec;
import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.ASN1Sequence;
import org.bouncycastle.asn1.ASN1String;
import org.bouncycastle.asn1.ASN1TaggedObject;
import org.bouncycastle.asn1.misc.MiscObjectIdentifiers;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.ExtendedKeyUsage;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.Extensions;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;
import org.bouncycastle.asn1.x509.KeyPurposeId;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;

/**
 * A single X.509 v3 certificate used as an SSH public key. The public data is the certificate DER encoding and the
 * algorithm is {@code x509v3-} followed by the algorithm of the certified key.
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 * @see    <a href="https://tools.ietf.org/html/rfc6187">RFC 6187</a>
 */
public class SshX509Certificate extends SshCertificate {
    /**
     * The Microsoft user principal name {@code otherName} type used to carry user principals
     */
    public static final ASN1ObjectIdentifier USER_PRINCIPAL_NAME = new ASN1ObjectIdentifier("1.3.6.1.4.1.311.20.2.3");

    private final X509CertificateHolder holder;
    private final X500Name subject;
    private final X500Name issuer;
    private final String issuerHash;
    private final List<String> userPrincipals;
    private final List<String> hostPrincipals;
    private final Set<KeyPurposeId> purposes;

    protected SshX509Certificate(SshKey key, X509CertificateHolder holder, byte[] publicData, byte[] comment) {
        super(SshKey.X509_ALGORITHM_PREFIX + key.getAlgorithm(), key.getX509Algorithms(), key.getX509Algorithms(),
              key, publicData, comment);
        this.holder = holder;
        this.subject = holder.getSubject();
        this.issuer = holder.getIssuer();
        this.issuerHash = X509NameUtils.getNameHash(issuer);

        List<String> users = new ArrayList<>();
        List<String> hosts = new ArrayList<>();
        Extensions extensions = holder.getExtensions();
        GeneralNames altNames = GeneralNames.fromExtensions(extensions, Extension.subjectAlternativeName);
        if (altNames != null) {
            for (GeneralName name : altNames.getNames()) {
                collectPrincipal(name, users, hosts);
            }
        }
        this.userPrincipals = GenericUtils.unmodifiableList(users);
        this.hostPrincipals = GenericUtils.unmodifiableList(hosts);

        ExtendedKeyUsage eku = ExtendedKeyUsage.fromExtensions(extensions);
        this.purposes = (eku == null)
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(eku.getUsages())));
    }

    /**
     * @param  data               The certificate DER encoding
     * @param  comment            Comment to use if the certificate carries none of its own - may be {@code null}
     * @return                    The decoded certificate
     * @throws KeyImportException If the data is not a certificate for a supported key type
     */
    public static SshX509Certificate fromDer(byte[] data, byte[] comment) throws KeyImportException {
        if (!X509Support.isAvailable()) {
            throw new KeyImportException("X.509 certificate support not available");
        }

        X509CertificateHolder holder;
        try {
            holder = new X509CertificateHolder(data);
        } catch (IOException | RuntimeException e) {
            throw new KeyImportException("Invalid X.509 certificate", e);
        }

        SshKey key = PKCS8KeyCodec.INSTANCE.decodePublicKey(holder.getSubjectPublicKeyInfo().toASN1Primitive());
        if (GenericUtils.isEmpty(key.getX509Algorithms())) {
            throw new KeyImportException("X.509 certificates not supported for " + key.getAlgorithm() + " keys");
        }

        byte[] certComment = extractComment(holder);
        return new SshX509Certificate(key, holder, data, (certComment == null) ? comment : certComment);
    }

    @Override
    public boolean isX509() {
        return true;
    }

    public X509CertificateHolder getCertificateHolder() {
        return holder;
    }

    public X500Name getSubject() {
        return subject;
    }

    public X500Name getIssuer() {
        return issuer;
    }

    /**
     * @return The OpenSSL hash of the issuer name - used to look up the issuer in a trusted certificate directory
     */
    public String getIssuerHash() {
        return issuerHash;
    }

    public boolean isSelfIssued() {
        return subject.equals(issuer);
    }

    public List<String> getUserPrincipals() {
        return userPrincipals;
    }

    public List<String> getHostPrincipals() {
        return hostPrincipals;
    }

    /**
     * @return The extended key usages - empty if the certificate does not restrict its usage
     */
    public Set<KeyPurposeId> getPurposes() {
        return purposes;
    }

    public X509Certificate toX509Certificate() throws GeneralSecurityException {
        return new JcaX509CertificateConverter().getCertificate(holder);
    }

    /**
     * Validates this certificate against a trust store made of the issuing certificates presented along with it, the
     * explicitly trusted certificates and the issuers found in the trusted certificate directories. Only
     * self-signed trusted certificates act as trust anchors.
     *
     * @param  trustChain               The certificates presented with this one - may be empty
     * @param  trustedCerts             The explicitly trusted certificates
     * @param  trustedCertPaths         Directories holding {@code <issuer-hash>.<n>} certificate files - may be empty
     * @param  purposes                 The required purposes - see {@link X509Purposes#isUnrestricted(Collection)}
     * @param  userPrincipal            The user to check for - ignored if {@code null}/empty
     * @param  hostPrincipal            The host to check for - ignored if {@code null}/empty
     * @throws IllegalArgumentException If the certificate is not valid for the request
     */
    public void validateChain(
            List<SshX509Certificate> trustChain, Collection<SshX509Certificate> trustedCerts,
            Collection<Path> trustedCertPaths, Collection<String> purposes,
            String userPrincipal, String hostPrincipal) {
        Set<SshX509Certificate> trustStore = new LinkedHashSet<>();
        if (trustChain != null) {
            for (SshX509Certificate c : trustChain) {
                if (!c.isSelfIssued()) {
                    trustStore.add(c);
                }
            }
        }
        if (trustedCerts != null) {
            trustStore.addAll(trustedCerts);
        }

        if (GenericUtils.isNotEmpty(trustedCertPaths)) {
            X509TrustStore expander = new X509TrustStore(trustedCertPaths);
            expander.expand(this, trustStore);
            if (trustChain != null) {
                for (SshX509Certificate c : trustChain) {
                    expander.expand(c, trustStore);
                }
            }
        }

        validate(trustStore, purposes, userPrincipal, hostPrincipal, Instant.now());
    }

    protected void validate(
            Collection<SshX509Certificate> trustStore, Collection<String> requestedPurposes,
            String userPrincipal, String hostPrincipal, Instant now) {
        Date date = Date.from(now);
        try {
            X509Certificate target = toX509Certificate();
            if (trustStore.contains(this)) {
                target.checkValidity(date);
            } else {
                buildPath(target, trustStore, date);
            }
        } catch (GeneralSecurityException e) {
            throw new IllegalArgumentException("X.509 certificate validation failed: " + e.getMessage(), e);
        }

        if (!X509Purposes.isUnrestricted(requestedPurposes) && (!purposes.isEmpty())
                && (!purposes.contains(KeyPurposeId.anyExtendedKeyUsage))) {
            Set<KeyPurposeId> required = X509Purposes.resolve(requestedPurposes);
            ValidateUtils.checkTrue(!Collections.disjoint(required, purposes), "Certificate purpose mismatch");
        }

        if (GenericUtils.isNotEmpty(userPrincipal) && (!userPrincipals.isEmpty())) {
            ValidateUtils.checkTrue(userPrincipals.contains(userPrincipal), "Certificate principal mismatch");
        }
        if (GenericUtils.isNotEmpty(hostPrincipal) && (!hostPrincipals.isEmpty())) {
            ValidateUtils.checkTrue(hostPrincipals.contains(hostPrincipal), "Certificate principal mismatch");
        }
    }

    protected static void buildPath(X509Certificate target, Collection<SshX509Certificate> trustStore, Date date)
            throws GeneralSecurityException {
        Set<TrustAnchor> anchors = new HashSet<>();
        List<X509Certificate> intermediates = new ArrayList<>();
        intermediates.add(target);
        for (SshX509Certificate c : trustStore) {
            X509Certificate cert = c.toX509Certificate();
            if (c.isSelfIssued()) {
                anchors.add(new TrustAnchor(cert, null));
            } else {
                intermediates.add(cert);
            }
        }

        if (anchors.isEmpty()) {
            throw new CertPathBuilderException("No trusted root certificate available");
        }

        X509CertSelector selector = new X509CertSelector();
        selector.setCertificate(target);

        PKIXBuilderParameters params = new PKIXBuilderParameters(anchors, selector);
        params.setRevocationEnabled(false);
        params.setDate(date);
        params.addCertStore(CertStore.getInstance("Collection", new CollectionCertStoreParameters(intermediates)));
        CertPathBuilder.getInstance("PKIX").build(params);
    }

    protected static void collectPrincipal(GeneralName name, List<String> users, List<String> hosts) {
        switch (name.getTagNo()) {
            case GeneralName.dNSName:
                hosts.add(((ASN1String) name.getName()).getString());
                break;
            case GeneralName.rfc822Name:
                users.add(((ASN1String) name.getName()).getString());
                break;
            case GeneralName.otherName: {
                ASN1Sequence seq = ASN1Sequence.getInstance(name.getName());
                if ((seq.size() == 2) && USER_PRINCIPAL_NAME.equals(seq.getObjectAt(0))) {
                    ASN1Encodable value = ASN1TaggedObject.getInstance(seq.getObjectAt(1)).getExplicitBaseObject();
                    if (value instanceof ASN1String) {
                        users.add(((ASN1String) value).getString());
                    }
                }
                break;
            }
            default: // ignored
        }
    }

    protected static byte[] extractComment(X509CertificateHolder holder) {
        Extension ext = holder.getExtension(MiscObjectIdentifiers.netscapeCertComment);
        if (ext == null) {
            return null;
        }

        ASN1Encodable value = ext.getParsedValue();
        if (!(value instanceof ASN1String)) {
            return null;
        }

        String comment = ((ASN1String) value).getString();
        return GenericUtils.isEmpty(comment) ? null : comment.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return super.toString() + "[subject=" + subject + ", issuer=" + issuer + "]";
    }
}
