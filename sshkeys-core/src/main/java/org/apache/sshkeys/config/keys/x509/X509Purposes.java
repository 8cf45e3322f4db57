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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.apache.sshkeys.common.util.GenericUtils;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.x509.KeyPurposeId;

/**
 * The extended key usage purposes recognized by name when generating and validating X.509 certificates
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public final class X509Purposes {
    /**
     * Disables purpose checking on validation and omits the extended key usage on generation
     */
    public static final String ANY = "any";

    public static final String SECURE_SHELL_CLIENT = "secureShellClient";
    public static final String SECURE_SHELL_SERVER = "secureShellServer";
    public static final String SERVER_AUTH = "serverAuth";
    public static final String CLIENT_AUTH = "clientAuth";
    public static final String CODE_SIGNING = "codeSigning";
    public static final String EMAIL_PROTECTION = "emailProtection";
    public static final String TIME_STAMPING = "timeStamping";
    public static final String OCSP_SIGNING = "OCSPSigning";

    private static final ASN1ObjectIdentifier ID_KP = new ASN1ObjectIdentifier("1.3.6.1.5.5.7.3");
    private static final Map<String, KeyPurposeId> PURPOSES;

    static {
        Map<String, KeyPurposeId> map = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        map.put(SECURE_SHELL_CLIENT, ssh("21"));
        map.put(SECURE_SHELL_SERVER, ssh("22"));
        map.put(SERVER_AUTH, KeyPurposeId.id_kp_serverAuth);
        map.put(CLIENT_AUTH, KeyPurposeId.id_kp_clientAuth);
        map.put(CODE_SIGNING, KeyPurposeId.id_kp_codeSigning);
        map.put(EMAIL_PROTECTION, KeyPurposeId.id_kp_emailProtection);
        map.put(TIME_STAMPING, KeyPurposeId.id_kp_timeStamping);
        map.put(OCSP_SIGNING, KeyPurposeId.id_kp_OCSPSigning);
        PURPOSES = Collections.unmodifiableMap(map);
    }

    private X509Purposes() {
        throw new UnsupportedOperationException("No instance");
    }

    /**
     * @param  purposes The purpose names - {@code null}/empty or containing {@link #ANY} means no restriction
     * @return          {@code true} if the purposes do not restrict the certificate usage
     */
    public static boolean isUnrestricted(Collection<String> purposes) {
        return GenericUtils.isEmpty(purposes) || purposes.stream().anyMatch(ANY::equalsIgnoreCase);
    }

    /**
     * @param  purposes                 The purpose names
     * @return                          The matching {@link KeyPurposeId}s - empty if unrestricted
     * @throws IllegalArgumentException If a name is not recognized
     */
    public static Set<KeyPurposeId> resolve(Collection<String> purposes) {
        if (isUnrestricted(purposes)) {
            return Collections.emptySet();
        }

        Set<KeyPurposeId> result = new LinkedHashSet<>(purposes.size());
        for (String name : purposes) {
            KeyPurposeId id = PURPOSES.get(name);
            if (id == null) {
                throw new IllegalArgumentException("Unknown X.509 certificate purpose: " + name);
            }
            result.add(id);
        }
        return result;
    }

    /**
     * RFC 6187 purposes under {@code id-kp}
     */
    private static KeyPurposeId ssh(String branch) {
        return KeyPurposeId.getInstance(ID_KP.branch(branch));
    }

    public static Set<String> getPurposeNames() {
        return PURPOSES.keySet();
    }
}
