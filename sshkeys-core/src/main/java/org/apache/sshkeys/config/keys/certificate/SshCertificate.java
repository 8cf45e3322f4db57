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

package org.apache.sshkeys.config.keys.certificate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import org.apache.sshkeys.common.util.GenericUtils;
import org.apache.sshkeys.common.util.NumberUtils;
import org.apache.sshkeys.common.util.ValidateUtils;
import org.apache.sshkeys.common.util.io.IoUtils;
import org.apache.sshkeys.config.keys.KeyExportException;
import org.apache.sshkeys.config.keys.PublicKeyIdentity;
import org.apache.sshkeys.config.keys.SshKey;
import org.apache.sshkeys.config.keys.loader.KeyResourceUtils;
import org.apache.sshkeys.config.keys.loader.ssh2.Ssh2PublicKeyCodec;

/**
 * Base class of the certificates an SSH key can be presented with - OpenSSH certificates, single X.509 certificates
 * and X.509 certificate chains. Two certificates are equal if they are of the same kind and have the same public
 * data.
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public abstract class SshCertificate implements PublicKeyIdentity {
    public static final String FORMAT_OPENSSH = SshKey.FORMAT_OPENSSH;
    public static final String FORMAT_RFC4716 = SshKey.FORMAT_RFC4716;
    public static final String FORMAT_DER = "der";
    public static final String FORMAT_PEM = "pem";

    public static final String PEM_CERTIFICATE = "CERTIFICATE";

    private final String algorithm;
    private final List<String> sigAlgorithms;
    private final List<String> hostKeyAlgorithms;
    private final SshKey key;
    private final byte[] publicData;
    private byte[] comment;

    protected SshCertificate(String algorithm, List<String> sigAlgorithms, List<String> hostKeyAlgorithms,
                             SshKey key, byte[] publicData, byte[] comment) {
        this.algorithm = ValidateUtils.checkNotNullAndNotEmpty(algorithm, "No certificate algorithm");
        this.sigAlgorithms = GenericUtils.unmodifiableList(sigAlgorithms);
        this.hostKeyAlgorithms = GenericUtils.unmodifiableList(hostKeyAlgorithms);
        this.key = Objects.requireNonNull(key, "No certified key");
        this.publicData = Objects.requireNonNull(publicData, "No public data").clone();
        setComment(comment);
    }

    @Override
    public String getAlgorithm() {
        return algorithm;
    }

    /**
     * @return The signature algorithms a key pair presenting this certificate may sign with
     */
    public List<String> getSigAlgorithms() {
        return sigAlgorithms;
    }

    public List<String> getHostKeyAlgorithms() {
        return hostKeyAlgorithms;
    }

    /**
     * @return The certified public key
     */
    public SshKey getKey() {
        return key;
    }

    @Override
    public byte[] getPublicData() {
        return publicData.clone();
    }

    public boolean isX509() {
        return false;
    }

    public boolean isX509Chain() {
        return false;
    }

    public boolean hasComment() {
        return comment != null;
    }

    public byte[] getCommentBytes() {
        return (comment == null) ? null : comment.clone();
    }

    public String getComment() {
        return (comment == null) ? null : new String(comment, StandardCharsets.UTF_8);
    }

    public void setComment(String comment) {
        setComment(GenericUtils.isEmpty(comment) ? null : comment.getBytes(StandardCharsets.UTF_8));
    }

    public void setComment(byte[] comment) {
        this.comment = NumberUtils.isEmpty(comment) ? null : comment.clone();
    }

    public byte[] exportCertificate() throws KeyExportException {
        return exportCertificate(FORMAT_OPENSSH);
    }

    /**
     * @param  format              {@code openssh}, {@code rfc4716}, {@code der} or {@code pem}
     * @return                     The encoded certificate
     * @throws KeyExportException If the format is unknown or does not apply to this kind of certificate
     */
    public byte[] exportCertificate(String format) throws KeyExportException {
        String fmt = (format == null) ? "" : format;
        if (isX509()) {
            if (FORMAT_RFC4716.equals(fmt)) {
                throw new KeyExportException("RFC4716 format is not supported for X.509 certificates");
            }
        } else if (FORMAT_DER.equals(fmt) || FORMAT_PEM.equals(fmt)) {
            throw new KeyExportException("DER and PEM formats are not supported for OpenSSH certificates");
        }

        switch (fmt) {
            case FORMAT_DER:
                return getPublicData();
            case FORMAT_PEM:
                return KeyResourceUtils.encodePem(PEM_CERTIFICATE, null, publicData);
            case FORMAT_OPENSSH:
                return KeyResourceUtils.encodeOpenSshPublic(getAlgorithm(), publicData, comment);
            case FORMAT_RFC4716:
                return Ssh2PublicKeyCodec.INSTANCE.encodePublicKey(publicData, comment);
            default:
                throw new KeyExportException("Unknown export format");
        }
    }

    public void writeCertificate(Path path, String format) throws IOException, KeyExportException {
        IoUtils.write(path, exportCertificate(format), false);
    }

    public void appendCertificate(Path path, String format) throws IOException, KeyExportException {
        IoUtils.write(path, exportCertificate(format), true);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(publicData);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if ((obj == null) || (obj.getClass() != getClass())) {
            return false;
        }
        return Arrays.equals(publicData, ((SshCertificate) obj).publicData);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + getAlgorithm() + "]";
    }
}
