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


package org.apache.sshkeys.config.keys.pair;

import java.security.GeneralSecurityException;
import java.util.Arrays;
import java.util.Objects;

import org.apache.sshkeys.common.util.buffer.Buffer;
import org.apache.sshkeys.common.util.buffer.ByteArrayBuffer;
import org.apache.sshkeys.config.keys.KeyExportException;
import org.apache.sshkeys.config.keys.SshKey;
import org.apache.sshkeys.config.keys.certificate.SshCertificate;

/**
 * A key pair whose private key is held in memory
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public class SshLocalKeyPair extends SshKeyPair {
    private final SshKey key;

    public SshLocalKeyPair(SshKey key) {
        this(key, null, null);
    }

    /**
     * @param  key                      The private key
     * @param  publicKey                A separately loaded copy of the public key - may be {@code null}
     * @param  certificate              The certificate to present - may be {@code null}
     * @throws IllegalArgumentException If the public key or the certificate do not match the private key
     */
    public SshLocalKeyPair(SshKey key, SshKey publicKey, SshCertificate certificate) {
        super(Objects.requireNonNull(key, "No key").getAlgorithm(), key.getAlgorithm(), key.getSigAlgorithms(),
              key.getPublicData(), resolveComment(key, publicKey, certificate), certificate, key.getFilename());
        if ((publicKey != null) && !Arrays.equals(publicKey.getPublicData(), key.getPublicData())) {
            throw new IllegalArgumentException("Public key mismatch");
        }
        this.key = key;
    }

    public SshKey getKey() {
        return key;
    }

    @Override
    public byte[] getAgentPrivateKey() throws KeyExportException {
        Buffer buffer = new ByteArrayBuffer();
        buffer.putString(getAlgorithm());
        if (hasCertificate()) {
            buffer.putBytes(getPublicData());
            key.encodeAgentCertPrivate(buffer);
        } else {
            key.encodeSshPrivate(buffer);
        }
        return buffer.getCompactData();
    }

    @Override
    public byte[] sign(byte[] data) throws GeneralSecurityException {
        return key.sign(data, getSigAlgorithm());
    }

    private static byte[] resolveComment(SshKey key, SshKey publicKey, SshCertificate certificate) {
        if (key.hasComment()) {
            return key.getCommentBytes();
        }
        if ((certificate != null) && certificate.hasComment()) {
            return certificate.getCommentBytes();
        }
        if ((publicKey != null) && publicKey.hasComment()) {
            return publicKey.getCommentBytes();
        }
        return null;
    }
}
