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

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.apache.sshkeys.common.util.GenericUtils;
import org.apache.sshkeys.common.util.ValidateUtils;
import org.apache.sshkeys.config.keys.SshKey;

/**
 * An OpenSSH certificate as specified by OpenSSH.
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 * @see    <a href= "https://cvsweb.openbsd.org/src/usr.bin/ssh/PROTOCOL.certkeys?annotate=HEAD">PROTOCOL.certkeys</a>
 */
public class OpenSshCertificate extends SshCertificate {
    /**
     * {@link OpenSshCertificate}s have a type indicating whether the certificate if for a host key (certifying a host
     * identity) or for a user key (certifying a user identity). <B>Note:</B> values order is significant
     */
    public enum Type {
        /** User key certificate. */
        USER,
        /** Host key certificate. */
        HOST,
        ;

        public static final List<Type> VALUES = Collections.unmodifiableList(Arrays.asList(values()));

        public int getCode() {
            return ordinal() + 1;
        }

        /**
         * @param  code The wire code
         * @return      The matching type - {@code null} if unknown
         */
        public static Type fromCode(long code) {
            return ((code > 0) && (code <= VALUES.size())) ? VALUES.get((int) (code - 1)) : null;
        }
    }

    /**
     * The minimal {@link #getValidAfter()} or {@link #getValidBefore()} value, corresponding to {@code Instant#EPOCH}.
     */
    public static final long MIN_EPOCH = 0L;

    /**
     * The maximum {@link #getValidAfter()} or {@link #getValidBefore()} value.
     * <p>
     * Note that timestamps in OpenSSH certificates are <em>unsigned</em> 64-bit values.
     * </p>
     */
    public static final long INFINITY = 0xffff_ffff_ffff_ffffL;

    private final int version;
    private final List<String> principals;
    private final Map<String, Object> options;
    private final SshKey signingKey;
    private final long serial;
    private final Type type;
    private final String keyId;
    private final long validAfter;
    private final long validBefore;

    @SuppressWarnings("checkstyle:ParameterNumber")
    public OpenSshCertificate(String algorithm, int version, SshKey key, byte[] publicData,
                              List<String> principals, Map<String, ?> options, SshKey signingKey,
                              long serial, Type type, String keyId, long validAfter, long validBefore,
                              byte[] comment) {
        super(algorithm, key.getSigAlgorithms(),
              GenericUtils.isEmpty(key.getCertAlgorithms())
                      ? Collections.singletonList(algorithm) : key.getCertAlgorithms(),
              key, publicData, comment);
        this.version = version;
        this.principals = GenericUtils.unmodifiableList(principals);
        this.options = Collections.unmodifiableMap(new LinkedHashMap<>(options));
        this.signingKey = Objects.requireNonNull(signingKey, "No signing key");
        this.serial = serial;
        this.type = Objects.requireNonNull(type, "No certificate type");
        this.keyId = Objects.requireNonNull(keyId, "No key ID");
        this.validAfter = validAfter;
        this.validBefore = validBefore;
    }

    public int getVersion() {
        return version;
    }

    /**
     * @return The principals - empty means valid for any principal
     */
    public List<String> getPrincipals() {
        return principals;
    }

    /**
     * @return The decoded critical options and extensions by name
     */
    public Map<String, Object> getOptions() {
        return options;
    }

    /**
     * @return The public key of the CA that signed this certificate
     */
    public SshKey getSigningKey() {
        return signingKey;
    }

    public long getSerial() {
        return serial;
    }

    public Type getType() {
        return type;
    }

    public String getKeyId() {
        return keyId;
    }

    /**
     * @return The number of seconds since the epoch <em>as an unsigned 64bit value</em>
     */
    public long getValidAfter() {
        return validAfter;
    }

    /**
     * @return The number of seconds since the epoch <em>as an unsigned 64bit value</em>
     */
    public long getValidBefore() {
        return validBefore;
    }

    /**
     * Checks the certificate can be used right now
     *
     * @param  type                     The expected certificate type
     * @param  principal                The principal to check - {@code null} to skip the check
     * @throws IllegalArgumentException If the type, validity period or principal do not match
     */
    public void validate(Type type, String principal) {
        validate(type, principal, Instant.now());
    }

    public void validate(Type type, String principal, Instant now) {
        ValidateUtils.checkTrue(this.type == type, "Invalid certificate type");

        long seconds = now.getEpochSecond();
        ValidateUtils.checkTrue(Long.compareUnsigned(seconds, validAfter) >= 0, "Certificate not yet valid");
        ValidateUtils.checkTrue(Long.compareUnsigned(seconds, validBefore) < 0, "Certificate expired");

        if ((principal != null) && (!principals.isEmpty())) {
            ValidateUtils.checkTrue(principals.contains(principal), "Certificate principal mismatch");
        }
    }

    @Override
    public String toString() {
        return super.toString() + "[type=" + type + ", id=" + keyId + ", serial=" + Long.toUnsignedString(serial) + "]";
    }
}
