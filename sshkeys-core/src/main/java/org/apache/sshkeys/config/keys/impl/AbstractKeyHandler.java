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

import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.Signature;
import java.security.spec.AlgorithmParameterSpec;
import java.security.spec.KeySpec;
import java.util.Collections;
import java.util.List;

import org.apache.sshkeys.common.util.logging.AbstractLoggingBean;
import org.apache.sshkeys.config.keys.KeyGenerationException;
import org.apache.sshkeys.config.keys.KeyImportException;
import org.apache.sshkeys.config.keys.SshKeyHandler;

/**
 * Base class for the key family handlers - JCA factory access with the failures mapped to the key exceptions
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public abstract class AbstractKeyHandler extends AbstractLoggingBean implements SshKeyHandler {
    public static final String OPENSSH_CERT_SUFFIX = "-cert-v01@openssh.com";

    private final String pemName;
    private final String pkcs8Oid;

    protected AbstractKeyHandler(String pemName, String pkcs8Oid) {
        this.pemName = pemName;
        this.pkcs8Oid = pkcs8Oid;
    }

    @Override
    public final String getPemName() {
        return pemName;
    }

    @Override
    public final String getPkcs8Oid() {
        return pkcs8Oid;
    }

    @Override
    public List<String> getCertAlgorithms(String algorithm) {
        return Collections.singletonList(algorithm + OPENSSH_CERT_SUFFIX);
    }

    @Override
    public List<String> getX509Algorithms(String algorithm) {
        return Collections.emptyList();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }

    public static KeyFactory getKeyFactory(String algorithm) throws GeneralSecurityException {
        return KeyFactory.getInstance(algorithm);
    }

    public static Signature getSignature(String algorithm) throws GeneralSecurityException {
        return Signature.getInstance(algorithm);
    }

    protected PublicKey generatePublicKey(String algorithm, KeySpec spec) throws KeyImportException {
        try {
            return getKeyFactory(algorithm).generatePublic(spec);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new KeyImportException("Invalid " + algorithm + " public key: " + e.getMessage(), e);
        }
    }

    protected PrivateKey generatePrivateKey(String algorithm, KeySpec spec) throws KeyImportException {
        try {
            return getKeyFactory(algorithm).generatePrivate(spec);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new KeyImportException("Invalid " + algorithm + " private key: " + e.getMessage(), e);
        }
    }

    protected KeyPair generateKeyPair(String algorithm, int keySize) throws KeyGenerationException {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance(algorithm);
            generator.initialize(keySize, new SecureRandom());
            return generator.generateKeyPair();
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new KeyGenerationException("Failed to generate " + algorithm + " key: " + e.getMessage(), e);
        }
    }

    protected KeyPair generateKeyPair(String algorithm, AlgorithmParameterSpec params) throws KeyGenerationException {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance(algorithm);
            if (params != null) {
                generator.initialize(params, new SecureRandom());
            }
            return generator.generateKeyPair();
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new KeyGenerationException("Failed to generate " + algorithm + " key: " + e.getMessage(), e);
        }
    }

    /**
     * @param  value The value to check
     * @return       {@code true} if the value can be an RSA/DSA/EC field element
     */
    protected static boolean isPositive(BigInteger value) {
        return (value != null) && (value.signum() > 0);
    }
}
