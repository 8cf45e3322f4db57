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

import java.security.Provider;

import org.apache.sshkeys.config.keys.KeyGenerationException;
import org.bouncycastle.jce.provider.BouncyCastleProvider;

/**
 * Runtime detection of the Bouncy Castle PKIX classes the X.509 certificate support relies on
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public final class X509Support {
    public static final String HOLDER_CLASS_NAME = "org.bouncycastle.cert.X509CertificateHolder";

    private X509Support() {
        throw new UnsupportedOperationException("No instance");
    }

    /**
     * @return {@code true} if X.509 certificates can be parsed, generated and validated
     */
    public static boolean isAvailable() {
        return Holder.AVAILABLE;
    }

    /**
     * @throws KeyGenerationException If X.509 support is not available
     */
    public static void checkAvailable() throws KeyGenerationException {
        if (!isAvailable()) {
            throw new KeyGenerationException("X.509 certificate support not available");
        }
    }

    /**
     * @return A Bouncy Castle provider instance used for the certificate factory and path validation - not
     *         registered with the JCA
     */
    public static Provider getProvider() {
        return ProviderHolder.PROVIDER;
    }

    private static final class Holder {
        private static final boolean AVAILABLE = detect();

        private Holder() {
            throw new UnsupportedOperationException("No instance");
        }

        private static boolean detect() {
            try {
                Class.forName(HOLDER_CLASS_NAME, false, X509Support.class.getClassLoader());
                return true;
            } catch (ClassNotFoundException | LinkageError e) {
                return false;
            }
        }
    }

    private static final class ProviderHolder {
        private static final Provider PROVIDER = new BouncyCastleProvider();

        private ProviderHolder() {
            throw new UnsupportedOperationException("No instance");
        }
    }
}
