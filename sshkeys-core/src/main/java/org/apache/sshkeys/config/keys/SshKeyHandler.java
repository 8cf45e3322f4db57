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

import java.util.Collection;
import java.util.List;

import org.apache.sshkeys.common.util.buffer.Buffer;
import org.bouncycastle.asn1.ASN1Primitive;
import org.bouncycastle.asn1.x509.AlgorithmIdentifier;

/**
 * Creates the {@link SshKey}s of one key family. One instance may serve several SSH algorithm names (e.g., all the
 * ECDSA curves), so every operation receives the algorithm it is invoked for.
 * <P>
 * The PKCS decoders return {@code null} when the structure does not have the shape this family expects, so that a
 * caller can try each registered family in turn.
 * </P>
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public interface SshKeyHandler {
    /**
     * @return The key type used in PKCS#1 PEM markers (e.g., {@code RSA}) - {@code null} if none
     */
    String getPemName();

    /**
     * @return The dotted PKCS#8 algorithm OID - {@code null} if the family has no PKCS#8 encoding
     */
    String getPkcs8Oid();

    List<String> getSigAlgorithms(String algorithm);

    /**
     * @param  algorithm The key algorithm
     * @return           The {@link #getSigAlgorithms(String)} plus any names only used with X.509 certificates
     */
    default Collection<String> getAllSigAlgorithms(String algorithm) {
        return getSigAlgorithms(algorithm);
    }

    List<String> getCertAlgorithms(String algorithm);

    List<String> getX509Algorithms(String algorithm);

    /**
     * @param  algorithm The key algorithm
     * @return           Hash used when signing X.509 certificates - {@code null} if the signature scheme has a
     *                   built-in hash
     */
    default String getDefaultX509Hash(String algorithm) {
        return null;
    }

    /**
     * @return {@code true} if signing blocks on a hardware token and should not run on a latency sensitive thread
     */
    default boolean isUseExecutor() {
        return false;
    }

    /**
     * @return {@code true} if signatures are produced in the WebAuthn format
     */
    default boolean isUseWebauthn() {
        return false;
    }

    SshKey generate(String algorithm, KeyGenerationOptions options) throws KeyGenerationException;

    /**
     * @param  algorithm          The key algorithm - already consumed from the buffer
     * @param  buffer             The {@link Buffer} positioned on the public fields - exactly those are consumed
     * @return                    The decoded public key
     * @throws KeyImportException If the fields are malformed
     */
    SshKey decodeSshPublic(String algorithm, Buffer buffer) throws KeyImportException;

    SshKey decodeSshPrivate(String algorithm, Buffer buffer) throws KeyImportException;

    default SshKey decodePkcs1Private(ASN1Primitive data) throws KeyImportException {
        return null;
    }

    default SshKey decodePkcs1Public(ASN1Primitive data) throws KeyImportException {
        return null;
    }

    /**
     * @param  algorithm          The PKCS#8 algorithm identifier - OID and optional parameters
     * @param  data               The private key octets
     * @return                    The decoded key - {@code null} if the payload does not match the family
     * @throws KeyImportException If the payload matches but holds invalid key material
     */
    default SshKey decodePkcs8Private(AlgorithmIdentifier algorithm, byte[] data) throws KeyImportException {
        return null;
    }

    default SshKey decodePkcs8Public(AlgorithmIdentifier algorithm, byte[] data) throws KeyImportException {
        return null;
    }
}
