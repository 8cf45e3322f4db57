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

package org.apache.sshkeys.config.keys.impl;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;

import org.apache.sshkeys.config.keys.KeyGenerationException;
import org.apache.sshkeys.config.keys.KeyGenerationOptions;
import org.apache.sshkeys.config.keys.KeyImportException;
import org.apache.sshkeys.config.keys.sk.SecurityKeyAuthenticator;
import org.apache.sshkeys.config.keys.sk.SecurityKeyEnrollment;

/**
 * Common handling of the security key families - enrollment through a {@link SecurityKeyAuthenticator}
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public abstract class AbstractSecurityKeyHandler extends AbstractKeyHandler {
    public static final String OPENSSH_DOMAIN = "@openssh.com";

    private final String keyType;
    private final int skAlgorithm;

    protected AbstractSecurityKeyHandler(String keyType, int skAlgorithm) {
        super(null, null);
        this.keyType = keyType;
        this.skAlgorithm = skAlgorithm;
    }

    public String getKeyType() {
        return keyType;
    }

    /**
     * @return The COSE algorithm number the token uses for this family
     */
    public int getSkAlgorithm() {
        return skAlgorithm;
    }

    @Override
    public List<String> getSigAlgorithms(String algorithm) {
        return Collections.singletonList(keyType);
    }

    /**
     * The certificate name drops the {@code @openssh.com} domain of the key type before the certificate suffix -
     * e.g., {@code sk-ssh-ed25519-cert-v01@openssh.com}
     */
    @Override
    public List<String> getCertAlgorithms(String algorithm) {
        String base = keyType.endsWith(OPENSSH_DOMAIN)
                ? keyType.substring(0, keyType.length() - OPENSSH_DOMAIN.length()) : keyType;
        return Collections.singletonList(base + OPENSSH_CERT_SUFFIX);
    }

    @Override
    public boolean isUseExecutor() {
        return true;
    }

    @Override
    public AbstractSecurityKeySshKey generate(String algorithm, KeyGenerationOptions options)
            throws KeyGenerationException {
        SecurityKeyAuthenticator authenticator = options.getAuthenticator();
        if (authenticator == null) {
            throw new KeyGenerationException("No security key authenticator configured");
        }

        byte[] application = options.getApplication().getBytes(StandardCharsets.UTF_8);
        int flags = options.isTouchRequired() ? SecurityKeyAuthenticator.SSH_SK_USER_PRESENCE_REQD : 0;
        SecurityKeyEnrollment enrollment;
        try {
            enrollment = authenticator.enroll(skAlgorithm, application, options.getUser(), options.getPin(),
                    options.isResident(), options.isTouchRequired());
        } catch (IOException e) {
            throw new KeyGenerationException("Security key enrollment failed: " + e.getMessage(), e);
        }

        AbstractSecurityKeySshKey key;
        try {
            key = makePrivate(enrollment.getPublicValue(), application, flags, enrollment.getKeyHandle(), null);
        } catch (KeyImportException e) {
            throw new KeyGenerationException("Invalid security key enrollment: " + e.getMessage(), e);
        }
        key.setAuthenticator(authenticator);
        return key;
    }

    /**
     * @param  publicValue        The raw public value reported by the token
     * @param  application        The application string
     * @param  flags              The key flags
     * @param  keyHandle          The token key handle
     * @param  reserved           The reserved field - may be {@code null}
     * @return                    The key
     * @throws KeyImportException If the public value is invalid
     */
    public abstract AbstractSecurityKeySshKey makePrivate(
            byte[] publicValue, byte[] application, int flags, byte[] keyHandle, byte[] reserved)
            throws KeyImportException;

    @Override
    public String toString() {
        return super.toString() + "[" + keyType + "]";
    }
}
