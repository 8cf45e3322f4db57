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

import java.util.Collections;
import java.util.Map;

import org.apache.sshkeys.common.util.GenericUtils;
import org.bouncycastle.asn1.ASN1Primitive;

/**
 * A single key or certificate located by the {@link KeyBlockMatcher}
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public final class KeyBlock {
    public enum Format {
        /**
         * Binary DER - {@link KeyBlock#getDerValue()} holds the decoded value
         */
        DER,
        /**
         * {@code -----BEGIN ...-----} armored Base64, optionally with headers
         */
        PEM,
        /**
         * A single {@code algorithm base64 [comment]} line
         */
        OPENSSH,
        /**
         * {@code ---- BEGIN SSH2 PUBLIC KEY ----} armored Base64
         */
        RFC4716
    }

    private final Format format;
    private final String pemName;
    private final Map<String, String> headers;
    private final String algorithm;
    private final byte[] comment;
    private final byte[] data;
    private final ASN1Primitive derValue;
    private final int end;

    private KeyBlock(Format format, String pemName, Map<String, String> headers, String algorithm,
                     byte[] comment, byte[] data, ASN1Primitive derValue, int end) {
        this.format = format;
        this.pemName = pemName;
        this.headers = (GenericUtils.size(headers) > 0) ? headers : Collections.emptyMap();
        this.algorithm = algorithm;
        this.comment = comment;
        this.data = data;
        this.derValue = derValue;
        this.end = end;
    }

    public static KeyBlock der(byte[] data, ASN1Primitive value, int end) {
        return new KeyBlock(Format.DER, null, null, null, null, data, value, end);
    }

    public static KeyBlock pem(String pemName, Map<String, String> headers, byte[] data, int end) {
        return new KeyBlock(Format.PEM, pemName, headers, null, null, data, null, end);
    }

    public static KeyBlock openssh(String algorithm, byte[] comment, byte[] data, int end) {
        return new KeyBlock(Format.OPENSSH, null, null, algorithm, comment, data, null, end);
    }

    public static KeyBlock rfc4716(byte[] comment, byte[] data, int end) {
        return new KeyBlock(Format.RFC4716, null, null, null, comment, data, null, end);
    }

    public Format getFormat() {
        return format;
    }

    /**
     * @return The PEM type prefix - e.g., {@code RSA} for {@code RSA PRIVATE KEY}, empty for PKCS#8
     */
    public String getPemName() {
        return pemName;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public String getHeader(String name) {
        return headers.get(name);
    }

    /**
     * @return The algorithm named on an OpenSSH line
     */
    public String getAlgorithm() {
        return algorithm;
    }

    public byte[] getComment() {
        return comment;
    }

    /**
     * @return The decoded payload - the complete input for {@link Format#DER}
     */
    public byte[] getData() {
        return data;
    }

    public ASN1Primitive getDerValue() {
        return derValue;
    }

    /**
     * @return Offset in the matched input just past this block
     */
    public int getEnd() {
        return end;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + getFormat()
               + ((pemName == null) ? "" : ", pem=" + pemName)
               + ((algorithm == null) ? "" : ", algorithm=" + algorithm)
               + ", end=" + getEnd()
               + "]";
    }
}
