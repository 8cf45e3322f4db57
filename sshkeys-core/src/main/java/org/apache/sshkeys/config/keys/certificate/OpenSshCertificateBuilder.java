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

package org.apache.sshkeys.config.keys.certificate;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.apache.sshkeys.common.util.GenericUtils;
import org.apache.sshkeys.common.util.ValidateUtils;
import org.apache.sshkeys.config.keys.KeyAlgorithmRegistry;
import org.apache.sshkeys.config.keys.KeyGenerationException;
import org.apache.sshkeys.config.keys.SshKey;

/**
 * Holds all the data necessary to create a signed OpenSSH Certificate
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public class OpenSshCertificateBuilder {
    protected final OpenSshCertificate.Type type;
    protected final SshKey key;
    protected final Map<String, Object> options = new LinkedHashMap<>();
    protected int version = OpenSshCertificateCodec.VERSION;
    protected long serial;
    protected String keyId;
    protected List<String> principals = Collections.emptyList();
    // match ssh-keygen behavior where the default would be forever
    protected long validAfter = OpenSshCertificate.MIN_EPOCH;
    // match ssh-keygen behavior where the default would be forever
    protected long validBefore = OpenSshCertificate.INFINITY;
    protected byte[] nonce;
    protected String sigAlgorithm;
    protected byte[] comment;
    protected boolean commentSet;
    protected KeyAlgorithmRegistry registry = KeyAlgorithmRegistry.getDefault();

    protected OpenSshCertificateBuilder(OpenSshCertificate.Type type, SshKey key) {
        this.type = Objects.requireNonNull(type, "No certificate type");
        this.key = Objects.requireNonNull(key, "No certified key");
    }

    /**
     * @param  key The user key to certify
     * @return     A builder with all the user permissions granted
     */
    public static OpenSshCertificateBuilder userCertificate(SshKey key) {
        return new OpenSshCertificateBuilder(OpenSshCertificate.Type.USER, key)
                .permitX11Forwarding(true)
                .permitAgentForwarding(true)
                .permitPortForwarding(true)
                .permitPty(true)
                .permitUserRc(true);
    }

    public static OpenSshCertificateBuilder hostCertificate(SshKey key) {
        return new OpenSshCertificateBuilder(OpenSshCertificate.Type.HOST, key);
    }

    public OpenSshCertificateBuilder version(int version) {
        this.version = version;
        return this;
    }

    public OpenSshCertificateBuilder serial(long serial) {
        this.serial = serial;
        return this;
    }

    public OpenSshCertificateBuilder keyId(String keyId) {
        this.keyId = keyId;
        return this;
    }

    public OpenSshCertificateBuilder principals(Collection<String> principals) {
        this.principals = GenericUtils.unmodifiableList(principals);
        return this;
    }

    /**
     * @param  principals Comma-separated principal names - surrounding whitespace is removed
     * @return            Self reference
     */
    public OpenSshCertificateBuilder principals(String principals) {
        List<String> names = new ArrayList<>();
        for (String p : GenericUtils.split(principals, ',')) {
            names.add(p.trim());
        }
        return principals(names);
    }

    public OpenSshCertificateBuilder validAfter(long validAfter) {
        this.validAfter = validAfter;
        return this;
    }

    /**
     * @param  validAfter A time value as accepted by {@link CertificateTimes#parseTime(String)}
     * @return            Self reference
     */
    public OpenSshCertificateBuilder validAfter(String validAfter) {
        return validAfter(CertificateTimes.parseTime(validAfter));
    }

    /**
     * If null, uses {@link OpenSshCertificate#MIN_EPOCH}
     *
     * @param  validAfter {@link Instant} to use for validAfter
     * @return            Self reference
     */
    public OpenSshCertificateBuilder validAfter(Instant validAfter) {
        if (validAfter == null) {
            return validAfter(OpenSshCertificate.MIN_EPOCH);
        } else if (Instant.EPOCH.compareTo(validAfter) <= 0) {
            return validAfter(validAfter.getEpochSecond());
        }
        throw new IllegalArgumentException("Valid-after cannot be < epoch");
    }

    public OpenSshCertificateBuilder validBefore(long validBefore) {
        this.validBefore = validBefore;
        return this;
    }

    public OpenSshCertificateBuilder validBefore(String validBefore) {
        return validBefore(CertificateTimes.parseTime(validBefore));
    }

    /**
     * If null, uses {@link OpenSshCertificate#INFINITY}
     *
     * @param  validBefore {@link Instant} to use for validBefore
     * @return             Self reference
     */
    public OpenSshCertificateBuilder validBefore(Instant validBefore) {
        if (validBefore == null) {
            return validBefore(OpenSshCertificate.INFINITY);
        } else if (Instant.EPOCH.compareTo(validBefore) <= 0) {
            return validBefore(validBefore.getEpochSecond());
        }
        throw new IllegalArgumentException("Valid-before cannot be < epoch");
    }

    public OpenSshCertificateBuilder forceCommand(String command) {
        return option(OpenSshCertificateOptions.FORCE_COMMAND, command);
    }

    /**
     * @param  addresses                Addresses or CIDR networks
     * @return                          Self reference
     * @throws IllegalArgumentException If an entry is not a valid network
     */
    public OpenSshCertificateBuilder sourceAddress(Collection<String> addresses) {
        List<SourceAddress> networks = new ArrayList<>();
        if (addresses != null) {
            for (String a : addresses) {
                networks.add(SourceAddress.valueOf(a));
            }
        }
        return option(OpenSshCertificateOptions.SOURCE_ADDRESS, networks);
    }

    public OpenSshCertificateBuilder permitX11Forwarding(boolean permit) {
        return option(OpenSshCertificateOptions.PERMIT_X11_FORWARDING, permit);
    }

    public OpenSshCertificateBuilder permitAgentForwarding(boolean permit) {
        return option(OpenSshCertificateOptions.PERMIT_AGENT_FORWARDING, permit);
    }

    public OpenSshCertificateBuilder permitPortForwarding(boolean permit) {
        return option(OpenSshCertificateOptions.PERMIT_PORT_FORWARDING, permit);
    }

    public OpenSshCertificateBuilder permitPty(boolean permit) {
        return option(OpenSshCertificateOptions.PERMIT_PTY, permit);
    }

    public OpenSshCertificateBuilder permitUserRc(boolean permit) {
        return option(OpenSshCertificateOptions.PERMIT_USER_RC, permit);
    }

    public OpenSshCertificateBuilder touchRequired(boolean required) {
        return option(OpenSshCertificateOptions.NO_TOUCH_REQUIRED, !required);
    }

    /**
     * @param  name  The option or extension name - names the certificate type does not define are not encoded
     * @param  value The value - {@code null}, {@code false} or empty removes the option
     * @return       Self reference
     */
    public OpenSshCertificateBuilder option(String name, Object value) {
        options.put(ValidateUtils.checkNotNullAndNotEmpty(name, "No option name"), value);
        return this;
    }

    public OpenSshCertificateBuilder nonce(byte[] nonce) {
        this.nonce = (nonce == null) ? null : nonce.clone();
        return this;
    }

    /**
     * @param  sigAlgorithm The algorithm to sign with - if {@code null} the first one of the signing key
     * @return              Self reference
     */
    public OpenSshCertificateBuilder sigAlgorithm(String sigAlgorithm) {
        this.sigAlgorithm = sigAlgorithm;
        return this;
    }

    /**
     * @param  comment The certificate comment - if never set the comment of the certified key is used
     * @return         Self reference
     */
    public OpenSshCertificateBuilder comment(String comment) {
        return comment((comment == null) ? null : comment.getBytes(StandardCharsets.UTF_8));
    }

    public OpenSshCertificateBuilder comment(byte[] comment) {
        this.comment = (comment == null) ? null : comment.clone();
        this.commentSet = true;
        return this;
    }

    public OpenSshCertificateBuilder registry(KeyAlgorithmRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "No registry");
        return this;
    }

    protected void validate() {
        // nonce should be 16 or 32 bytes according to
        // https://github.com/openssh/openssh-portable/blob/master/PROTOCOL.certkeys#L151-L153
        if (nonce != null && (nonce.length != 16 && nonce.length != 32)) {
            throw new IllegalStateException("'nonce' must be 16 or 32 bytes");
        }
        if (keyId == null) {
            throw new IllegalStateException("'keyId' is required");
        }
        ValidateUtils.checkTrue(Long.compareUnsigned(validBefore, validAfter) > 0,
                "Valid before time must be later than valid after time");
    }

    /**
     * Creates a certificate signed with the given CA key
     *
     * @param  signingKey               The CA private key
     * @return                          The signed certificate
     * @throws IllegalArgumentException If the validity period is empty
     * @throws KeyGenerationException   If the certificate version is not available for the key type
     * @throws GeneralSecurityException If failed to sign
     */
    public OpenSshCertificate sign(SshKey signingKey) throws GeneralSecurityException {
        Objects.requireNonNull(signingKey, "No signing key");
        validate();

        String certAlgorithm = registry.getCertificateAlgorithm(key.getAlgorithm(), version);
        if (certAlgorithm == null) {
            throw new KeyGenerationException("Unknown certificate version");
        }

        KeyAlgorithmRegistry.CertificateAlgorithm entry = registry.getCertificateHandler(certAlgorithm);
        OpenSshCertificateCodec codec = ValidateUtils.checkInstanceOf(entry.getCertificateHandler(),
                OpenSshCertificateCodec.class, "Not an OpenSSH certificate algorithm: %s", certAlgorithm);

        String sigAlg = (sigAlgorithm == null) ? signingKey.getSigAlgorithms().get(0) : sigAlgorithm;
        byte[] certComment = commentSet ? comment : key.getCommentBytes();
        return codec.encode(signingKey, certAlgorithm, key, nonce, serial, type, keyId, principals,
                validAfter, validBefore, options, sigAlg, certComment);
    }
}
