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
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SignatureException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import org.apache.sshkeys.common.digest.BuiltinDigests;
import org.apache.sshkeys.common.digest.DigestUtils;
import org.apache.sshkeys.common.util.GenericUtils;
import org.apache.sshkeys.common.util.NumberUtils;
import org.apache.sshkeys.common.util.ValidateUtils;
import org.apache.sshkeys.common.util.buffer.Buffer;
import org.apache.sshkeys.common.util.buffer.BufferException;
import org.apache.sshkeys.common.util.buffer.ByteArrayBuffer;
import org.apache.sshkeys.common.util.io.IoUtils;
import org.apache.sshkeys.config.keys.certificate.OpenSshCertificate;
import org.apache.sshkeys.config.keys.certificate.OpenSshCertificateBuilder;
import org.apache.sshkeys.config.keys.loader.KeyResourceUtils;
import org.apache.sshkeys.config.keys.loader.PrivateKeyEncryptionContext;
import org.apache.sshkeys.config.keys.loader.openssh.OpenSSHKeyCodec;
import org.apache.sshkeys.config.keys.loader.pem.PKCS1KeyCodec;
import org.apache.sshkeys.config.keys.loader.pem.PKCS8KeyCodec;
import org.apache.sshkeys.config.keys.loader.ssh2.Ssh2PublicKeyCodec;
import org.apache.sshkeys.config.keys.x509.SshX509Certificate;
import org.apache.sshkeys.config.keys.x509.SshX509CertificateBuilder;
import org.apache.sshkeys.config.keys.x509.X509Purposes;
import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;

/**
 * An SSH asymmetric key - either a public key on its own or a public/private pair. The SSH wire encodings are always
 * derived from the underlying key material:
 * <UL>
 * <LI>public data = {@code string(algorithm) || encodeSshPublic}</LI>
 * <LI>private data = {@code string(algorithm) || encodeSshPrivate}</LI>
 * </UL>
 * Concrete classes are created through the {@link SshKeyHandler} registered for the algorithm.
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public abstract class SshKey implements PublicKeyIdentity {
    public static final String X509_ALGORITHM_PREFIX = "x509v3-";

    /**
     * Hashes accepted by {@link #getFingerprint(String)}
     */
    public static final Set<String> FINGERPRINT_HASHES = Collections.unmodifiableSet(
            GenericUtils.asSortedSet(String.CASE_INSENSITIVE_ORDER,
                    BuiltinDigests.md5.getName(), BuiltinDigests.sha1.getName(), BuiltinDigests.sha256.getName(),
                    BuiltinDigests.sha384.getName(), BuiltinDigests.sha512.getName()));

    public static final String DEFAULT_FINGERPRINT_HASH = BuiltinDigests.sha256.getName();

    public static final String FORMAT_OPENSSH = "openssh";
    public static final String FORMAT_RFC4716 = "rfc4716";
    public static final String FORMAT_PKCS1_DER = "pkcs1-der";
    public static final String FORMAT_PKCS1_PEM = "pkcs1-pem";
    public static final String FORMAT_PKCS8_DER = "pkcs8-der";
    public static final String FORMAT_PKCS8_PEM = "pkcs8-pem";

    private final String algorithm;
    private byte[] comment;
    private byte[] filename;
    private boolean touchRequired;

    protected SshKey(String algorithm) {
        this.algorithm = ValidateUtils.checkNotNullAndNotEmpty(algorithm, "No key algorithm");
    }

    /**
     * @return The handler that created this key and knows how to decode its encodings
     */
    public abstract SshKeyHandler getHandler();

    /**
     * @return The JCA public key
     */
    public abstract PublicKey getPublicKey();

    /**
     * @return The JCA private key - {@code null} if only the public part is available or the private key is held by
     *         a security token
     */
    public abstract PrivateKey getPrivateKey();

    /**
     * @return {@code true} if this key can sign data
     */
    public abstract boolean hasPrivateKey();

    /**
     * Writes the algorithm specific public fields - without the leading algorithm name
     *
     * @param buffer The target {@link Buffer}
     */
    public abstract void encodeSshPublic(Buffer buffer);

    /**
     * Writes the algorithm specific private fields - without the leading algorithm name
     *
     * @param buffer The target {@link Buffer}
     */
    public abstract void encodeSshPrivate(Buffer buffer);

    /**
     * Writes the private fields an SSH agent expects along with a certificate
     *
     * @param  buffer              The target {@link Buffer}
     * @throws KeyExportException If the key type cannot be added to an agent with a certificate
     */
    public void encodeAgentCertPrivate(Buffer buffer) throws KeyExportException {
        throw new KeyExportException("Private key export to agent not supported");
    }

    /**
     * @param  out                      The target {@link Buffer} - the signature algorithm name has already been
     *                                  written
     * @param  data                     The data to sign
     * @param  sigAlgorithm             The signature algorithm - already validated against
     *                                  {@link #getAllSigAlgorithms()}
     * @throws GeneralSecurityException If failed to sign
     */
    protected abstract void signSsh(Buffer out, byte[] data, String sigAlgorithm) throws GeneralSecurityException;

    /**
     * @param  data                     The signed data
     * @param  sigAlgorithm             The signature algorithm read from the signature blob
     * @param  buffer                   The {@link Buffer} positioned after the signature algorithm name
     * @return                          {@code true} if the signature is valid
     * @throws GeneralSecurityException If failed to initialize the verifier
     */
    protected abstract boolean verifySsh(byte[] data, String sigAlgorithm, Buffer buffer)
            throws GeneralSecurityException;

    /**
     * @return                     The PKCS#1 private key structure
     * @throws KeyExportException If the key type has no PKCS#1 private encoding
     */
    public ASN1Encodable encodePkcs1PrivateKey() throws KeyExportException {
        throw new KeyExportException("PKCS#1 private key export not supported");
    }

    /**
     * @return                     The PKCS#1 public key structure
     * @throws KeyExportException If the key type has no PKCS#1 public encoding
     */
    public ASN1Encodable encodePkcs1PublicKey() throws KeyExportException {
        throw new KeyExportException("PKCS#1 public key export not supported");
    }

    /**
     * @return                     The PKCS#8 {@code PrivateKeyInfo} of this key
     * @throws KeyExportException If the key type has no PKCS#8 encoding or is public-only
     */
    public PrivateKeyInfo encodePkcs8PrivateKey() throws KeyExportException {
        PrivateKey key = getPrivateKey();
        if (key == null) {
            throw new KeyExportException("PKCS#8 private key export not supported");
        }
        return PrivateKeyInfo.getInstance(key.getEncoded());
    }

    /**
     * @return                     The PKCS#8 {@code SubjectPublicKeyInfo} of this key
     * @throws KeyExportException If the key type has no PKCS#8 encoding
     */
    public SubjectPublicKeyInfo encodePkcs8PublicKey() throws KeyExportException {
        if (getHandler().getPkcs8Oid() == null) {
            throw new KeyExportException("PKCS#8 public key export not supported");
        }
        return SubjectPublicKeyInfo.getInstance(getPublicKey().getEncoded());
    }

    @Override
    public String getAlgorithm() {
        return algorithm;
    }

    public List<String> getSigAlgorithms() {
        return getHandler().getSigAlgorithms(getAlgorithm());
    }

    /**
     * @return Every signature algorithm name this key accepts - including those only used inside X.509 certificates
     */
    public Collection<String> getAllSigAlgorithms() {
        return getHandler().getAllSigAlgorithms(getAlgorithm());
    }

    public List<String> getCertAlgorithms() {
        return getHandler().getCertAlgorithms(getAlgorithm());
    }

    public List<String> getX509Algorithms() {
        return getHandler().getX509Algorithms(getAlgorithm());
    }

    public String getDefaultX509Hash() {
        return getHandler().getDefaultX509Hash(getAlgorithm());
    }

    public boolean isTouchRequired() {
        return touchRequired;
    }

    public void setTouchRequired(boolean touchRequired) {
        this.touchRequired = touchRequired;
    }

    public boolean hasComment() {
        return NumberUtils.length(comment) > 0;
    }

    /**
     * @return The comment - or the file name the key was loaded from if there is no comment ({@code null} if neither)
     */
    public byte[] getCommentBytes() {
        byte[] value = hasComment() ? comment : filename;
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

    public byte[] getFilename() {
        return (filename == null) ? null : filename.clone();
    }

    public void setFilename(String filename) {
        setFilename(GenericUtils.isEmpty(filename) ? null : filename.getBytes(StandardCharsets.UTF_8));
    }

    public void setFilename(Path path) {
        setFilename((path == null) ? null : path.toString());
    }

    public void setFilename(byte[] filename) {
        this.filename = NumberUtils.isEmpty(filename) ? null : filename.clone();
    }

    @Override
    public byte[] getPublicData() {
        Buffer buffer = new ByteArrayBuffer();
        buffer.putString(getAlgorithm());
        encodeSshPublic(buffer);
        return buffer.getCompactData();
    }

    /**
     * @return                       The OpenSSH private key encoding
     * @throws IllegalStateException If this is a public key
     */
    public byte[] getPrivateData() {
        ValidateUtils.checkState(hasPrivateKey(), "No private key available for %s", getAlgorithm());
        Buffer buffer = new ByteArrayBuffer();
        buffer.putString(getAlgorithm());
        encodeSshPrivate(buffer);
        return buffer.getCompactData();
    }

    public String getFingerprint() {
        return getFingerprint(DEFAULT_FINGERPRINT_HASH);
    }

    /**
     * @param  hashName                 One of the {@link #FINGERPRINT_HASHES}
     * @return                          The fingerprint of the public data - e.g., {@code SHA256:...}
     * @throws IllegalArgumentException If the hash name is not supported
     */
    public String getFingerprint(String hashName) {
        BuiltinDigests digest = FINGERPRINT_HASHES.contains(hashName) ? BuiltinDigests.fromFactoryName(hashName) : null;
        ValidateUtils.checkTrue(digest != null, "Unknown hash algorithm");
        return DigestUtils.getFingerPrint(digest, getPublicData());
    }

    /**
     * @param  data                     The data to sign
     * @param  sigAlgorithm             The signature algorithm - an {@code x509v3-} prefix is ignored
     * @return                          The SSH encoded signature - {@code string(sigAlgorithm) || payload}
     * @throws IllegalArgumentException If the key does not support the signature algorithm
     * @throws GeneralSecurityException If failed to sign
     */
    public byte[] sign(byte[] data, String sigAlgorithm) throws GeneralSecurityException {
        String effective = sigAlgorithm;
        if ((effective != null) && effective.startsWith(X509_ALGORITHM_PREFIX)) {
            effective = effective.substring(X509_ALGORITHM_PREFIX.length());
        }
        ValidateUtils.checkTrue(
                (effective != null) && getAllSigAlgorithms().contains(effective), "Unrecognized signature algorithm");
        ValidateUtils.checkState(hasPrivateKey(), "No private key available for %s", getAlgorithm());

        Buffer out = new ByteArrayBuffer();
        out.putString(effective);
        signSsh(out, data, effective);
        return out.getCompactData();
    }

    /**
     * @param  data                     The signed data
     * @param  sig                      The SSH encoded signature
     * @return                          {@code true} if the signature is well formed, uses a signature algorithm
     *                                  this key accepts and matches the data
     * @throws GeneralSecurityException If failed to initialize the verifier
     */
    public boolean verify(byte[] data, byte[] sig) throws GeneralSecurityException {
        try {
            Buffer buffer = new ByteArrayBuffer(sig);
            String sigAlgorithm = buffer.getString();
            if (!getAllSigAlgorithms().contains(sigAlgorithm)) {
                return false;
            }
            return verifySsh(data, sigAlgorithm, buffer);
        } catch (BufferException | SignatureException | ArithmeticException | IllegalArgumentException e) {
            // provider rejected a malformed signature value
            return false;
        }
    }

    /**
     * @return A public-only copy of this key, preserving the comment and file name
     */
    public SshKey convertToPublic() {
        Buffer buffer = new ByteArrayBuffer(getPublicData());
        buffer.getString();

        SshKey result;
        try {
            result = getHandler().decodeSshPublic(getAlgorithm(), buffer);
        } catch (KeyImportException e) {
            throw new IllegalStateException("Failed to re-decode public data of " + getAlgorithm(), e);
        }
        result.comment = comment;
        result.filename = filename;
        return result;
    }

    public byte[] exportPrivateKey() throws GeneralSecurityException {
        return exportPrivateKey(FORMAT_OPENSSH, null);
    }

    /**
     * @param  format                   One of {@code openssh}, {@code pkcs1-der}, {@code pkcs1-pem},
     *                                  {@code pkcs8-der} or {@code pkcs8-pem}
     * @param  encryptionContext        Passphrase and cipher settings - {@code null} or no password for an
     *                                  unencrypted export
     * @return                          The exported private key
     * @throws KeyExportException       If the format is unknown or cannot carry this key or the encryption
     * @throws GeneralSecurityException If failed to encrypt
     */
    public byte[] exportPrivateKey(String format, PrivateKeyEncryptionContext encryptionContext)
            throws GeneralSecurityException {
        ValidateUtils.checkState(hasPrivateKey(), "No private key available for %s", getAlgorithm());
        String fmt = (format == null) ? "" : format;
        switch (fmt) {
            case FORMAT_OPENSSH:
                return OpenSSHKeyCodec.INSTANCE.encodePrivateKey(this, encryptionContext);
            case FORMAT_PKCS1_DER:
            case FORMAT_PKCS1_PEM:
                return PKCS1KeyCodec.INSTANCE.encodePrivateKey(this, FORMAT_PKCS1_PEM.equals(fmt), encryptionContext);
            case FORMAT_PKCS8_DER:
            case FORMAT_PKCS8_PEM:
                return PKCS8KeyCodec.INSTANCE.encodePrivateKey(this, FORMAT_PKCS8_PEM.equals(fmt), encryptionContext);
            default:
                throw new KeyExportException("Unknown export format");
        }
    }

    public byte[] exportPublicKey() throws GeneralSecurityException {
        return exportPublicKey(FORMAT_OPENSSH);
    }

    /**
     * @param  format                   One of {@code openssh}, {@code rfc4716}, {@code pkcs1-der},
     *                                  {@code pkcs1-pem}, {@code pkcs8-der} or {@code pkcs8-pem}
     * @return                          The exported public key
     * @throws KeyExportException       If the format is unknown or cannot carry this key
     * @throws GeneralSecurityException If failed to encode the key
     */
    public byte[] exportPublicKey(String format) throws GeneralSecurityException {
        String fmt = (format == null) ? "" : format;
        switch (fmt) {
            case FORMAT_OPENSSH:
                return KeyResourceUtils.encodeOpenSshPublic(getAlgorithm(), getPublicData(), comment);
            case FORMAT_RFC4716:
                return Ssh2PublicKeyCodec.INSTANCE.encodePublicKey(getPublicData(), comment);
            case FORMAT_PKCS1_DER:
            case FORMAT_PKCS1_PEM:
                return PKCS1KeyCodec.INSTANCE.encodePublicKey(this, FORMAT_PKCS1_PEM.equals(fmt));
            case FORMAT_PKCS8_DER:
            case FORMAT_PKCS8_PEM:
                return PKCS8KeyCodec.INSTANCE.encodePublicKey(this, FORMAT_PKCS8_PEM.equals(fmt));
            default:
                throw new KeyExportException("Unknown export format");
        }
    }

    public void writePrivateKey(Path path, String format, PrivateKeyEncryptionContext encryptionContext)
            throws IOException, GeneralSecurityException {
        IoUtils.write(path, exportPrivateKey(format, encryptionContext), false);
    }

    public void appendPrivateKey(Path path, String format, PrivateKeyEncryptionContext encryptionContext)
            throws IOException, GeneralSecurityException {
        IoUtils.write(path, exportPrivateKey(format, encryptionContext), true);
    }

    public void writePublicKey(Path path, String format) throws IOException, GeneralSecurityException {
        IoUtils.write(path, exportPublicKey(format), false);
    }

    public void appendPublicKey(Path path, String format) throws IOException, GeneralSecurityException {
        IoUtils.write(path, exportPublicKey(format), true);
    }

    /**
     * Signs an OpenSSH user certificate for the given key with all the default permissions and an unlimited
     * validity period. Use {@link OpenSshCertificateBuilder} directly for finer control.
     *
     * @param  userKey                  The certified key
     * @param  keyId                    The key identifier
     * @param  principals               The user names - empty means any user
     * @return                          The signed certificate
     * @throws GeneralSecurityException If failed to sign
     */
    public OpenSshCertificate generateUserCertificate(SshKey userKey, String keyId, Collection<String> principals)
            throws GeneralSecurityException {
        return OpenSshCertificateBuilder.userCertificate(userKey)
                .keyId(keyId)
                .principals(principals)
                .sign(this);
    }

    public OpenSshCertificate generateHostCertificate(SshKey hostKey, String keyId, Collection<String> principals)
            throws GeneralSecurityException {
        return OpenSshCertificateBuilder.hostCertificate(hostKey)
                .keyId(keyId)
                .principals(principals)
                .sign(this);
    }

    public SshX509Certificate generateX509SelfSignedCertificate(String subject) throws GeneralSecurityException {
        return SshX509CertificateBuilder.selfSigned(this, subject).sign(this);
    }

    public SshX509Certificate generateX509UserCertificate(SshKey userKey, String subject, String issuer)
            throws GeneralSecurityException {
        return SshX509CertificateBuilder.certificate(userKey, subject)
                .issuer(issuer)
                .purposes(X509Purposes.SECURE_SHELL_CLIENT)
                .sign(this);
    }

    public SshX509Certificate generateX509HostCertificate(SshKey hostKey, String subject, String issuer)
            throws GeneralSecurityException {
        return SshX509CertificateBuilder.certificate(hostKey, subject)
                .issuer(issuer)
                .purposes(X509Purposes.SECURE_SHELL_SERVER)
                .sign(this);
    }

    public SshX509Certificate generateX509CaCertificate(SshKey caKey, String subject, String issuer)
            throws GeneralSecurityException {
        return SshX509CertificateBuilder.certificate(caKey, subject)
                .issuer(issuer)
                .ca(true)
                .sign(this);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(getPublicData());
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if ((obj == null) || (obj.getClass() != getClass())) {
            return false;
        }

        SshKey other = (SshKey) obj;
        return (hasPrivateKey() == other.hasPrivateKey()) && Arrays.equals(getPublicData(), other.getPublicData());
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>(3);
        parts.add(getAlgorithm());
        parts.add(hasPrivateKey() ? "private" : "public");
        String c = getComment();
        if (c != null) {
            parts.add(c);
        }
        return getClass().getSimpleName() + parts;
    }
}
