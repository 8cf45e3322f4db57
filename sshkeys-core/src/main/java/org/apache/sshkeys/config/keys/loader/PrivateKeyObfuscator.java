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


package org.apache.sshkeys.config.keys.loader;

import java.security.GeneralSecurityException;

/**
 * Password based encryption of a traditional (PKCS#1) PEM private key - the {@code Proc-Type: 4,ENCRYPTED} and
 * {@code DEK-Info} headers variant.
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public interface PrivateKeyObfuscator {
    /**
     * @return The SSH style cipher name - e.g., {@code aes128-cbc}
     */
    String getCipherName();

    /**
     * @return The name used in the {@code DEK-Info} header - e.g., {@code AES-128-CBC}
     */
    String getDekName();

    /**
     * @return Derived key size in bytes
     */
    int getKeySize();

    /**
     * @return Initialization vector size in bytes
     */
    int getIVSize();

    /**
     * @return A random initialization vector of {@link #getIVSize()} bytes
     */
    byte[] generateInitializationVector();

    /**
     * @param  bytes                    Original bytes
     * @param  password                 The password to derive the key from
     * @param  initVector               The initialization vector - its first 8 bytes also salt the key derivation
     * @param  encryptIt                If {@code true} then encrypt the original bytes, otherwise decrypt them
     * @return                          The result of applying the cipher to the original bytes
     * @throws GeneralSecurityException If cannot encrypt/decrypt - including bad padding after decryption
     */
    byte[] applyPrivateKeyCipher(byte[] bytes, String password, byte[] initVector, boolean encryptIt)
            throws GeneralSecurityException;
}
