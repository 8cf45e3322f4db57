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

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.sshkeys.common.util.buffer.Buffer;
import org.apache.sshkeys.common.util.buffer.BufferException;
import org.apache.sshkeys.common.util.buffer.ByteArrayBuffer;
import org.apache.sshkeys.common.util.logging.AbstractLoggingBean;
import org.apache.sshkeys.config.keys.KeyImportException;
import org.apache.sshkeys.config.keys.SshKey;
import org.apache.sshkeys.config.keys.SshKeyHandler;
import org.apache.sshkeys.config.keys.SshKeys;
import org.apache.sshkeys.config.keys.impl.AbstractKeyHandler;

/**
 * Encodes and decodes version 01 OpenSSH certificates:
 *
 * <pre>
 * string    algorithm
 * string    nonce
 * ...       certified public key fields
 * uint64    serial
 * uint32    type
 * string    key id
 * string    valid principals
 * uint64    valid after
 * uint64    valid before
 * string    critical options
 * string    extensions
 * string    reserved
 * string    signature key
 * string    signature
 * </pre>
 *
 * The signature covers everything that precedes it.
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public class OpenSshCertificateCodec extends AbstractLoggingBean implements SshCertificateHandler {
    public static final int VERSION = 1;

    /**
     * Nonce size used by {@code ssh-keygen}
     */
    public static final int NONCE_SIZE = 32;

    public static final OpenSshCertificateCodec INSTANCE = new OpenSshCertificateCodec();

    private static final SecureRandom RANDOM = new SecureRandom();

    public OpenSshCertificateCodec() {
        super();
    }

    @Override
    public OpenSshCertificate decode(String algorithm, SshKeyHandler keyHandler, Buffer buffer, byte[] comment)
            throws KeyImportException {
        try {
            return decodeCertificate(algorithm, keyHandler, buffer, comment);
        } catch (BufferException e) {
            throw new KeyImportException("Invalid OpenSSH certificate", e);
        }
    }

    protected OpenSshCertificate decodeCertificate(
            String algorithm, SshKeyHandler keyHandler, Buffer buffer, byte[] comment)
            throws KeyImportException {
        if (keyHandler == null) {
            throw new KeyImportException("Unrecognized certificate algorithm: " + algorithm);
        }

        buffer.getBytes(); // nonce
        SshKey key = keyHandler.decodeSshPublic(getKeyAlgorithm(algorithm), buffer);
        long serial = buffer.getLong();
        long typeCode = buffer.getUInt();
        byte[] keyId = buffer.getBytes();
        byte[] principalData = buffer.getBytes();
        long validAfter = buffer.getLong();
        long validBefore = buffer.getLong();
        byte[] criticalOptions = buffer.getBytes();
        byte[] extensions = buffer.getBytes();
        buffer.getBytes(); // reserved

        SshKey signingKey = SshKeys.decodeSshPublicKey(buffer.getBytes());
        byte[] signed = buffer.getBytesConsumed();
        byte[] signature = buffer.getBytes();
        buffer.checkEnd();

        boolean verified;
        try {
            verified = signingKey.verify(signed, signature);
        } catch (GeneralSecurityException e) {
            throw new KeyImportException("Invalid certificate signature", e);
        }
        if (!verified) {
            throw new KeyImportException("Invalid certificate signature");
        }

        byte[] data = buffer.getBytesConsumed();
        String id = decodeUtf8(keyId, "Invalid characters in key ID");
        List<String> principals = new ArrayList<>();
        Buffer pb = new ByteArrayBuffer(principalData);
        while (pb.available() > 0) {
            principals.add(decodeUtf8(pb.getBytes(), "Invalid characters in principal name"));
        }

        OpenSshCertificate.Type type = OpenSshCertificate.Type.fromCode(typeCode);
        if (type == null) {
            throw new KeyImportException("Unknown certificate type");
        }

        Map<String, Object> options = new LinkedHashMap<>(OpenSshCertificateOptions.decodeOptions(
                criticalOptions, OpenSshCertificateOptions.getCriticalOptions(type), true));
        options.putAll(OpenSshCertificateOptions.decodeOptions(
                extensions, OpenSshCertificateOptions.getExtensions(type), false));

        if (log.isTraceEnabled()) {
            log.trace("decode({}) type={}, id={}, serial={}", algorithm, type, id, Long.toUnsignedString(serial));
        }

        return new OpenSshCertificate(algorithm, VERSION, key, data, principals, options, signingKey,
                serial, type, id, validAfter, validBefore, comment);
    }

    /**
     * Frames and signs a new certificate
     *
     * @param  signingKey               The CA private key
     * @param  algorithm                The certificate algorithm
     * @param  key                      The certified key - converted to public-only before framing
     * @param  nonce                    The nonce - random if {@code null}
     * @param  serial                   The serial number
     * @param  type                     The certificate type
     * @param  keyId                    The key identifier
     * @param  principals               The principals
     * @param  validAfter               The start of the validity period
     * @param  validBefore              The end of the validity period
     * @param  options                  The critical options and extensions by name
     * @param  sigAlgorithm             The algorithm to sign with
     * @param  comment                  The comment of the new certificate
     * @return                          The signed certificate
     * @throws GeneralSecurityException If failed to sign
     */
    @SuppressWarnings("checkstyle:ParameterNumber")
    public OpenSshCertificate encode(
            SshKey signingKey, String algorithm, SshKey key, byte[] nonce, long serial, OpenSshCertificate.Type type,
            String keyId, Collection<String> principals, long validAfter, long validBefore,
            Map<String, ?> options, String sigAlgorithm, byte[] comment)
            throws GeneralSecurityException {
        SshKey certified = key.convertToPublic();

        Buffer principalData = new ByteArrayBuffer();
        for (String p : principals) {
            principalData.putString(p);
        }

        byte[] n = nonce;
        if (n == null) {
            n = new byte[NONCE_SIZE];
            synchronized (RANDOM) {
                RANDOM.nextBytes(n);
            }
        }

        Buffer buffer = new ByteArrayBuffer();
        buffer.putString(algorithm);
        buffer.putBytes(n);
        certified.encodeSshPublic(buffer);
        buffer.putLong(serial);
        buffer.putUInt(type.getCode());
        buffer.putString(keyId);
        buffer.putBytes(principalData.getCompactData());
        buffer.putLong(validAfter);
        buffer.putLong(validBefore);
        buffer.putBytes(OpenSshCertificateOptions.encodeOptions(
                options, OpenSshCertificateOptions.getCriticalOptions(type)));
        buffer.putBytes(OpenSshCertificateOptions.encodeOptions(
                options, OpenSshCertificateOptions.getExtensions(type)));
        buffer.putString("");
        buffer.putBytes(signingKey.getPublicData());

        byte[] signed = buffer.getCompactData();
        buffer.putBytes(signingKey.sign(signed, sigAlgorithm));

        return new OpenSshCertificate(algorithm, VERSION, certified, buffer.getCompactData(),
                new ArrayList<>(principals), options, signingKey.convertToPublic(), serial, type, keyId,
                validAfter, validBefore, comment);
    }

    /**
     * @param  certAlgorithm A certificate algorithm name
     * @return               The algorithm of the certified key as written inside the certificate
     */
    public static String getKeyAlgorithm(String certAlgorithm) {
        return certAlgorithm.endsWith(AbstractKeyHandler.OPENSSH_CERT_SUFFIX)
                ? certAlgorithm.substring(0, certAlgorithm.length() - AbstractKeyHandler.OPENSSH_CERT_SUFFIX.length())
                : certAlgorithm;
    }

    private static String decodeUtf8(byte[] data, String message) throws KeyImportException {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(data))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new KeyImportException(message, e);
        }
    }
}
