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

import java.util.List;

import org.apache.sshkeys.common.util.GenericUtils;
import org.apache.sshkeys.config.keys.certificate.OpenSshCertificateCodec;
import org.apache.sshkeys.config.keys.impl.AbstractSecurityKeyHandler;
import org.apache.sshkeys.config.keys.impl.DSSKeyHandler;
import org.apache.sshkeys.config.keys.impl.ECCurves;
import org.apache.sshkeys.config.keys.impl.ECDSAKeyHandler;
import org.apache.sshkeys.config.keys.impl.EdDSAKeyHandler;
import org.apache.sshkeys.config.keys.impl.RSAKeyHandler;
import org.apache.sshkeys.config.keys.impl.SkECDSAKeyHandler;
import org.apache.sshkeys.config.keys.impl.SkED25519KeyHandler;
import org.apache.sshkeys.config.keys.x509.SshX509CertificateChain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The key algorithms supported out of the box, in preference order
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public enum BuiltinKeyAlgorithms {
    sk_ed25519(SkED25519KeyHandler.KEY_TYPE, SkED25519KeyHandler.INSTANCE, true),
    sk_ecdsa(SkECDSAKeyHandler.KEY_TYPE, SkECDSAKeyHandler.INSTANCE, true),
    ed25519(EdDSAKeyHandler.ED25519_KEY_TYPE, EdDSAKeyHandler.ED25519, true),
    ed448(EdDSAKeyHandler.ED448_KEY_TYPE, EdDSAKeyHandler.ED448, true),
    nistp521(ECCurves.nistp521.getKeyType(), ECDSAKeyHandler.INSTANCE, true),
    nistp384(ECCurves.nistp384.getKeyType(), ECDSAKeyHandler.INSTANCE, true),
    nistp256(ECCurves.nistp256.getKeyType(), ECDSAKeyHandler.INSTANCE, true),
    rsa(RSAKeyHandler.KEY_TYPE, RSAKeyHandler.INSTANCE, true),
    dsa(DSSKeyHandler.KEY_TYPE, DSSKeyHandler.INSTANCE, false);

    public static final List<BuiltinKeyAlgorithms> VALUES = GenericUtils.unmodifiableList(values());

    private final String algorithm;
    private final SshKeyHandler handler;
    private final boolean isDefault;

    BuiltinKeyAlgorithms(String algorithm, SshKeyHandler handler, boolean isDefault) {
        this.algorithm = algorithm;
        this.handler = handler;
        this.isDefault = isDefault;
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public SshKeyHandler getHandler() {
        return handler;
    }

    /**
     * @return {@code true} if the algorithm is enabled unless explicitly configured otherwise
     */
    public boolean isDefault() {
        return isDefault;
    }

    /**
     * @return A new registry holding the public key, OpenSSH certificate, X.509 certificate and security key
     *         registrations of all the built-in algorithms
     */
    public static KeyAlgorithmRegistry createRegistry() {
        KeyAlgorithmRegistry.Builder builder = new KeyAlgorithmRegistry.Builder();
        for (BuiltinKeyAlgorithms a : VALUES) {
            register(builder, a.getAlgorithm(), a.getHandler(), a.isDefault());
        }

        KeyAlgorithmRegistry registry = builder.build();
        Logger log = LoggerFactory.getLogger(BuiltinKeyAlgorithms.class);
        if (log.isDebugEnabled()) {
            log.debug("createRegistry() keys={}, certificates={}, x509={}", registry.getKeyAlgorithms(),
                    registry.getCertificateAlgorithms(), registry.getX509CertificateAlgorithms());
        }
        return registry;
    }

    /**
     * Registers a key algorithm along with its version 01 OpenSSH certificates, its X.509 certificate algorithms and
     * - for security keys - its token algorithm number
     *
     * @param builder   The registry being built
     * @param algorithm The key algorithm
     * @param handler   The handler of the algorithm
     * @param isDefault Whether the algorithm is enabled by default
     */
    public static void register(
            KeyAlgorithmRegistry.Builder builder, String algorithm, SshKeyHandler handler, boolean isDefault) {
        builder.registerPublicKeyAlgorithm(algorithm, handler, isDefault);

        List<String> sigAlgorithms = handler.getSigAlgorithms(algorithm);
        for (String certAlgorithm : handler.getCertAlgorithms(algorithm)) {
            String sigAlgorithm = OpenSshCertificateCodec.getKeyAlgorithm(certAlgorithm);
            if (!sigAlgorithms.contains(sigAlgorithm)) {
                sigAlgorithm = algorithm;
            }
            builder.registerCertificateAlgorithm(OpenSshCertificateCodec.VERSION, sigAlgorithm, certAlgorithm,
                    handler, OpenSshCertificateCodec.INSTANCE, isDefault);
        }

        for (String x509Algorithm : handler.getX509Algorithms(algorithm)) {
            builder.registerX509CertificateAlgorithm(x509Algorithm, SshX509CertificateChain.HANDLER, isDefault);
        }

        if (handler instanceof AbstractSecurityKeyHandler) {
            AbstractSecurityKeyHandler skHandler = (AbstractSecurityKeyHandler) handler;
            builder.registerSecurityKeyAlgorithm(skHandler.getSkAlgorithm(), skHandler, algorithm);
        }
    }
}
