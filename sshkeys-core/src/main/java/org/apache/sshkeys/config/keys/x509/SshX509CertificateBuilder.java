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
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import org.apache.sshkeys.common.util.GenericUtils;
import org.apache.sshkeys.common.util.ValidateUtils;
import org.apache.sshkeys.config.keys.KeyGenerationException;
import org.apache.sshkeys.config.keys.SshKey;
import org.apache.sshkeys.config.keys.certificate.CertificateTimes;
import org.apache.sshkeys.config.keys.certificate.OpenSshCertificate;
import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.DERIA5String;
import org.bouncycastle.asn1.DERSequence;
import org.bouncycastle.asn1.DERTaggedObject;
import org.bouncycastle.asn1.DERUTF8String;
import org.bouncycastle.asn1.misc.MiscObjectIdentifiers;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.ExtendedKeyUsage;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;
import org.bouncycastle.asn1.x509.KeyPurposeId;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509ExtensionUtils;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;

/**
 * Holds all the data necessary to create a signed X.509 certificate for an SSH key
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public class SshX509CertificateBuilder {
    /**
     * The latest time an X.509 certificate can express - 9999-12-31T23:59:59Z
     */
    public static final long MAX_VALIDITY = 253402300799L;

    private static final SecureRandom RANDOM = new SecureRandom();

    protected final SshKey key;
    protected final X500Name subject;
    protected X500Name issuer;
    protected BigInteger serial;
    // the default validity is unlimited
    protected long validAfter = OpenSshCertificate.MIN_EPOCH;
    protected long validBefore = OpenSshCertificate.INFINITY;
    protected boolean ca;
    protected Integer caPathLen;
    protected List<String> purposes = Collections.singletonList(X509Purposes.ANY);
    protected List<String> userPrincipals = Collections.emptyList();
    protected List<String> hostPrincipals = Collections.emptyList();
    protected String hashName;
    protected byte[] comment;
    protected boolean commentSet;

    protected SshX509CertificateBuilder(SshKey key, String subject) {
        this.key = Objects.requireNonNull(key, "No certified key");
        this.subject = X509NameUtils.parseName(subject);
    }

    /**
     * @param  key     The key to certify - also used to sign
     * @param  subject The subject name - also used as issuer
     * @return         A builder for a self-signed certificate restricted to SSH client usage
     */
    public static SshX509CertificateBuilder selfSigned(SshKey key, String subject) {
        return new SshX509CertificateBuilder(key, subject)
                .purposes(X509Purposes.SECURE_SHELL_CLIENT);
    }

    /**
     * @param  key     The key to certify
     * @param  subject The subject name
     * @return         A builder with no usage restriction - the issuer defaults to the subject
     */
    public static SshX509CertificateBuilder certificate(SshKey key, String subject) {
        return new SshX509CertificateBuilder(key, subject);
    }

    /**
     * @param  issuer The issuer name - {@code null} means the certificate is self-issued
     * @return        Self reference
     */
    public SshX509CertificateBuilder issuer(String issuer) {
        this.issuer = GenericUtils.isEmpty(issuer) ? null : X509NameUtils.parseName(issuer);
        return this;
    }

    /**
     * @param  serial The serial number - {@code null} for a random one
     * @return        Self reference
     */
    public SshX509CertificateBuilder serial(BigInteger serial) {
        ValidateUtils.checkTrue((serial == null) || (serial.signum() > 0), "Serial number must be positive");
        this.serial = serial;
        return this;
    }

    public SshX509CertificateBuilder serial(long serial) {
        return serial(BigInteger.valueOf(serial));
    }

    public SshX509CertificateBuilder validAfter(long validAfter) {
        this.validAfter = validAfter;
        return this;
    }

    /**
     * @param  validAfter A time value as accepted by {@link CertificateTimes#parseTime(String)}
     * @return            Self reference
     */
    public SshX509CertificateBuilder validAfter(String validAfter) {
        return validAfter(CertificateTimes.parseTime(validAfter));
    }

    public SshX509CertificateBuilder validAfter(Instant validAfter) {
        return validAfter((validAfter == null) ? OpenSshCertificate.MIN_EPOCH : validAfter.getEpochSecond());
    }

    public SshX509CertificateBuilder validBefore(long validBefore) {
        this.validBefore = validBefore;
        return this;
    }

    public SshX509CertificateBuilder validBefore(String validBefore) {
        return validBefore(CertificateTimes.parseTime(validBefore));
    }

    public SshX509CertificateBuilder validBefore(Instant validBefore) {
        return validBefore((validBefore == null) ? OpenSshCertificate.INFINITY : validBefore.getEpochSecond());
    }

    public SshX509CertificateBuilder ca(boolean ca) {
        this.ca = ca;
        return this;
    }

    /**
     * @param  caPathLen Maximum number of intermediate CAs below this one - {@code null} for no limit
     * @return           Self reference
     */
    public SshX509CertificateBuilder caPathLen(Integer caPathLen) {
        if ((caPathLen != null) && (caPathLen < 0)) {
            throw new IllegalArgumentException("Invalid CA path length: " + caPathLen);
        }
        this.caPathLen = caPathLen;
        return this;
    }

    /**
     * @param  purposes The {@link X509Purposes} names - {@link X509Purposes#ANY} or none omits the extended key
     *                  usage
     * @return          Self reference
     */
    public SshX509CertificateBuilder purposes(String... purposes) {
        return purposes(Arrays.asList(purposes));
    }

    public SshX509CertificateBuilder purposes(Collection<String> purposes) {
        X509Purposes.resolve(purposes);
        this.purposes = GenericUtils.unmodifiableList(purposes);
        return this;
    }

    public SshX509CertificateBuilder userPrincipals(Collection<String> principals) {
        this.userPrincipals = GenericUtils.unmodifiableList(principals);
        return this;
    }

    public SshX509CertificateBuilder hostPrincipals(Collection<String> principals) {
        this.hostPrincipals = GenericUtils.unmodifiableList(principals);
        return this;
    }

    /**
     * @param  hashName The signature hash - {@code null} for the default of the signing key type, ignored for EdDSA
     * @return          Self reference
     */
    public SshX509CertificateBuilder hashName(String hashName) {
        this.hashName = hashName;
        return this;
    }

    /**
     * @param  comment The comment stored in the certificate - if never set the comment of the certified key is used
     * @return         Self reference
     */
    public SshX509CertificateBuilder comment(String comment) {
        return comment((comment == null) ? null : comment.getBytes(StandardCharsets.UTF_8));
    }

    public SshX509CertificateBuilder comment(byte[] comment) {
        this.comment = (comment == null) ? null : comment.clone();
        this.commentSet = true;
        return this;
    }

    /**
     * @param  signingKey               The issuer private key
     * @return                          The signed certificate
     * @throws IllegalArgumentException If the validity period is empty
     * @throws KeyGenerationException   If X.509 is not available or not supported by the key types
     * @throws GeneralSecurityException If failed to sign
     */
    public SshX509Certificate sign(SshKey signingKey) throws GeneralSecurityException {
        Objects.requireNonNull(signingKey, "No signing key");
        X509Support.checkAvailable();
        if (GenericUtils.isEmpty(signingKey.getX509Algorithms())) {
            throw new KeyGenerationException(
                    "X.509 certificate generation not supported for " + signingKey.getAlgorithm() + " keys");
        }
        ValidateUtils.checkState(signingKey.hasPrivateKey(), "Signing requires a private key");
        ValidateUtils.checkTrue(Long.compareUnsigned(validBefore, validAfter) > 0,
                "Valid before time must be later than valid after time");

        SubjectPublicKeyInfo subjectKeyInfo = key.encodePkcs8PublicKey();
        SubjectPublicKeyInfo issuerKeyInfo = signingKey.encodePkcs8PublicKey();
        X500Name issuerName = (issuer == null) ? subject : issuer;
        BigInteger serialNumber = (serial == null) ? new BigInteger(63, RANDOM).setBit(62) : serial;

        X509v3CertificateBuilder builder = new X509v3CertificateBuilder(
                issuerName, serialNumber, toDate(validAfter), toDate(validBefore), subject, subjectKeyInfo);
        try {
            JcaX509ExtensionUtils extUtils = new JcaX509ExtensionUtils();
            builder.addExtension(Extension.subjectKeyIdentifier, false,
                    extUtils.createSubjectKeyIdentifier(subjectKeyInfo));
            builder.addExtension(Extension.authorityKeyIdentifier, false,
                    extUtils.createAuthorityKeyIdentifier(issuerKeyInfo));
            builder.addExtension(Extension.basicConstraints, true,
                    (ca && (caPathLen != null)) ? new BasicConstraints(caPathLen) : new BasicConstraints(ca));
            builder.addExtension(Extension.keyUsage, true,
                    new KeyUsage(ca ? (KeyUsage.keyCertSign | KeyUsage.cRLSign) : KeyUsage.digitalSignature));

            if (!X509Purposes.isUnrestricted(purposes)) {
                builder.addExtension(Extension.extendedKeyUsage, false,
                        new ExtendedKeyUsage(X509Purposes.resolve(purposes).toArray(new KeyPurposeId[0])));
            }

            GeneralNames altNames = encodePrincipals();
            if (altNames != null) {
                builder.addExtension(Extension.subjectAlternativeName, false, altNames);
            }

            byte[] certComment = commentSet ? comment : key.getCommentBytes();
            if ((certComment != null) && (certComment.length > 0)) {
                builder.addExtension(MiscObjectIdentifiers.netscapeCertComment, false,
                        new DERIA5String(new String(certComment, StandardCharsets.UTF_8)));
            }
        } catch (IOException e) {
            throw new KeyGenerationException("Failed to encode X.509 certificate extensions", e);
        }

        X509CertificateHolder holder = builder.build(createSigner(signingKey));
        try {
            return SshX509Certificate.fromDer(holder.getEncoded(), null);
        } catch (IOException e) {
            throw new KeyGenerationException("Failed to encode X.509 certificate", e);
        }
    }

    protected ContentSigner createSigner(SshKey signingKey) throws KeyGenerationException {
        String algorithm = getSignatureAlgorithm(signingKey);
        PrivateKey privateKey = signingKey.getPrivateKey();
        try {
            return new JcaContentSignerBuilder(algorithm).build(privateKey);
        } catch (OperatorCreationException | IllegalArgumentException e) {
            throw new KeyGenerationException("Unable to sign X.509 certificate using " + algorithm, e);
        }
    }

    protected String getSignatureAlgorithm(SshKey signingKey) throws KeyGenerationException {
        String sshAlgorithm = signingKey.getAlgorithm();
        if (sshAlgorithm.endsWith("ed25519")) {
            return "Ed25519";
        }
        if (sshAlgorithm.endsWith("ed448")) {
            return "Ed448";
        }

        String hash = GenericUtils.isEmpty(hashName) ? signingKey.getDefaultX509Hash() : hashName;
        String digest;
        switch ((hash == null) ? "" : hash.toLowerCase(Locale.ENGLISH)) {
            case "sha1":
            case "sha224":
            case "sha256":
            case "sha384":
            case "sha512":
                digest = hash.toUpperCase(Locale.ENGLISH);
                break;
            default:
                throw new KeyGenerationException("Unknown hash algorithm: " + hash);
        }

        String keyAlgorithm = signingKey.getPrivateKey().getAlgorithm();
        switch (keyAlgorithm) {
            case "RSA":
                return digest + "withRSA";
            case "EC":
                return digest + "withECDSA";
            case "DSA":
                return digest + "withDSA";
            default:
                throw new KeyGenerationException("X.509 signing not supported for " + keyAlgorithm + " keys");
        }
    }

    protected GeneralNames encodePrincipals() {
        int count = userPrincipals.size() + hostPrincipals.size();
        if (count <= 0) {
            return null;
        }

        GeneralName[] names = new GeneralName[count];
        int index = 0;
        for (String user : userPrincipals) {
            names[index++] = new GeneralName(GeneralName.otherName, new DERSequence(new ASN1Encodable[] {
                    SshX509Certificate.USER_PRINCIPAL_NAME, new DERTaggedObject(true, 0, new DERUTF8String(user)) }));
        }
        for (String host : hostPrincipals) {
            names[index++] = new GeneralName(GeneralName.dNSName, host);
        }
        return new GeneralNames(names);
    }

    protected static Date toDate(long epochSeconds) {
        long clamped = (Long.compareUnsigned(epochSeconds, MAX_VALIDITY) > 0) ? MAX_VALIDITY : epochSeconds;
        return new Date(clamped * 1000L);
    }
}
