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

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

import org.apache.sshkeys.common.util.GenericUtils;
import org.apache.sshkeys.config.keys.SshKey;
import org.apache.sshkeys.config.keys.certificate.SshCertificate;

/**
 * Describes where a private key comes from and, optionally, what to present along with it. A bare file or in-memory
 * source may carry its certificates appended after the key; a source with an explicit companion never does.
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public final class KeyPairSource {
    private final Path path;
    private final byte[] data;
    private final SshKey key;
    private final SshKeyPair keyPair;

    private Path companionPath;
    private byte[] companionData;
    private SshKey companionKey;
    private List<SshCertificate> companionCertificates;

    private KeyPairSource(Path path, byte[] data, SshKey key, SshKeyPair keyPair) {
        this.path = path;
        this.data = data;
        this.key = key;
        this.keyPair = keyPair;
    }

    public static KeyPairSource of(Path path) {
        return new KeyPairSource(Objects.requireNonNull(path, "No path"), null, null, null);
    }

    public static KeyPairSource of(byte[] data) {
        return new KeyPairSource(null, Objects.requireNonNull(data, "No data").clone(), null, null);
    }

    public static KeyPairSource of(SshKey key) {
        return new KeyPairSource(null, null, Objects.requireNonNull(key, "No key"), null);
    }

    public static KeyPairSource of(SshKeyPair keyPair) {
        return new KeyPairSource(null, null, null, Objects.requireNonNull(keyPair, "No key pair"));
    }

    /**
     * @param  companion A file holding certificates - or the public key if no certificate can be read from it
     * @return           This source
     */
    public KeyPairSource withCompanion(Path companion) {
        clearCompanion();
        this.companionPath = Objects.requireNonNull(companion, "No companion path");
        return this;
    }

    /**
     * @param  companion Encoded certificates - or the public key if no certificate can be decoded from it
     * @return           This source
     */
    public KeyPairSource withCompanion(byte[] companion) {
        clearCompanion();
        this.companionData = Objects.requireNonNull(companion, "No companion data").clone();
        return this;
    }

    public KeyPairSource withPublicKey(SshKey publicKey) {
        clearCompanion();
        this.companionKey = Objects.requireNonNull(publicKey, "No public key");
        return this;
    }

    public KeyPairSource withCertificates(Collection<? extends SshCertificate> certificates) {
        clearCompanion();
        this.companionCertificates = GenericUtils.unmodifiableList(certificates);
        return this;
    }

    public Path getPath() {
        return path;
    }

    public byte[] getData() {
        return (data == null) ? null : data.clone();
    }

    public SshKey getKey() {
        return key;
    }

    public SshKeyPair getKeyPair() {
        return keyPair;
    }

    public Path getCompanionPath() {
        return companionPath;
    }

    public byte[] getCompanionData() {
        return (companionData == null) ? null : companionData.clone();
    }

    public SshKey getCompanionKey() {
        return companionKey;
    }

    public List<SshCertificate> getCompanionCertificates() {
        return companionCertificates;
    }

    public boolean hasCompanion() {
        return (companionPath != null) || (companionData != null) || (companionKey != null)
                || (companionCertificates != null);
    }

    private void clearCompanion() {
        companionPath = null;
        companionData = null;
        companionKey = null;
        companionCertificates = null;
    }

    @Override
    public String toString() {
        if (path != null) {
            return path.toString();
        } else if (key != null) {
            return key.toString();
        } else if (keyPair != null) {
            return keyPair.toString();
        } else {
            return "data[" + data.length + "]";
        }
    }
}
