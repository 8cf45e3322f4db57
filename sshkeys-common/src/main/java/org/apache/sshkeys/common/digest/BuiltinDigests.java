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

package org.apache.sshkeys.common.digest;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import org.apache.sshkeys.common.util.GenericUtils;

/**
 * Provides easy access to the digests used for fingerprints, signatures and key derivation
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public enum BuiltinDigests {
    md5("md5", "MD5", 16),
    sha1("sha1", "SHA-1", 20),
    sha224("sha224", "SHA-224", 28),
    sha256("sha256", "SHA-256", 32),
    sha384("sha384", "SHA-384", 48),
    sha512("sha512", "SHA-512", 64);

    public static final Set<BuiltinDigests> VALUES = Collections.unmodifiableSet(EnumSet.allOf(BuiltinDigests.class));

    private final String factoryName;
    private final String algorithm;
    private final int digestSize;

    BuiltinDigests(String factoryName, String algorithm, int digestSize) {
        this.factoryName = factoryName;
        this.algorithm = algorithm;
        this.digestSize = digestSize;
    }

    public final String getName() {
        return factoryName;
    }

    /**
     * @return The JCA {@link MessageDigest} algorithm name
     */
    public final String getAlgorithm() {
        return algorithm;
    }

    public final int getDigestSize() {
        return digestSize;
    }

    public final MessageDigest create() {
        try {
            return MessageDigest.getInstance(getAlgorithm());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Digest not available: " + getAlgorithm(), e);
        }
    }

    @Override
    public final String toString() {
        return getName();
    }

    /**
     * @param  name The factory name - ignored if {@code null}/empty
     * @return      The matching {@link BuiltinDigests} whose factory name matches (case <U>insensitive</U>) the digest
     *              factory name - {@code null} if no match found
     */
    public static BuiltinDigests fromFactoryName(String name) {
        if (GenericUtils.isEmpty(name)) {
            return null;
        }

        for (BuiltinDigests d : VALUES) {
            if (name.equalsIgnoreCase(d.getName())) {
                return d;
            }
        }

        return null;
    }
}
