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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import org.apache.sshkeys.common.util.GenericUtils;
import org.apache.sshkeys.common.util.NumberUtils;
import org.apache.sshkeys.common.util.ValidateUtils;
import org.bouncycastle.asn1.ASN1InputStream;
import org.bouncycastle.asn1.ASN1Primitive;

/**
 * Text helpers shared by the key file codecs. Key files are handled as {@code ISO-8859-1} strings so that character
 * offsets are also byte offsets of the original data.
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public final class KeyResourceUtils {
    public static final String PRIVATE_KEY = "PRIVATE KEY";
    public static final String PUBLIC_KEY = "PUBLIC KEY";
    public static final String CERTIFICATE = "CERTIFICATE";

    public static final String PEM_BEGIN = "-----BEGIN ";
    public static final String PEM_END = "-----END ";
    public static final String PEM_TRAILER = "-----";

    public static final int PEM_LINE_WIDTH = 64;
    public static final int OPENSSH_LINE_WIDTH = 70;

    /**
     * Characters removed by {@link #rstrip(String)} and used as separators by {@link #splitWhitespace(String, int)}
     */
    public static final String WHITESPACE = " \t\n\r\u000B\f";

    private KeyResourceUtils() {
        throw new UnsupportedOperationException("No instance");
    }

    public static String toText(byte[] data) {
        return (data == null) ? "" : new String(data, StandardCharsets.ISO_8859_1);
    }

    public static byte[] toBytes(String text) {
        return (text == null) ? GenericUtils.EMPTY_BYTE_ARRAY : text.getBytes(StandardCharsets.ISO_8859_1);
    }

    /**
     * @param  data  The data to encode
     * @param  width Maximum characters per line
     * @return       The Base64 encoding split into lines - each terminated by a {@code '\n'}
     */
    public static String wrapBase64(byte[] data, int width) {
        ValidateUtils.checkTrue(width > 0, "Invalid line width: %d", width);
        String encoded = Base64.getEncoder().encodeToString(data);
        StringBuilder sb = new StringBuilder(encoded.length() + encoded.length() / width + 1);
        for (int pos = 0; pos < encoded.length(); pos += width) {
            sb.append(encoded, pos, Math.min(pos + width, encoded.length())).append('\n');
        }
        return sb.toString();
    }

    public static byte[] encodePem(String type, Map<String, String> headers, byte[] data) {
        return encodePem(type, headers, data, PEM_LINE_WIDTH);
    }

    /**
     * @param  type    The PEM type - e.g., {@code RSA PRIVATE KEY}
     * @param  headers Optional headers - written in iteration order followed by an empty line
     * @param  data    The DER (or other binary) data
     * @param  width   Base64 line width
     * @return         The PEM block bytes
     */
    public static byte[] encodePem(String type, Map<String, String> headers, byte[] data, int width) {
        StringBuilder sb = new StringBuilder();
        sb.append(PEM_BEGIN).append(type).append(PEM_TRAILER).append('\n');
        if (GenericUtils.size(headers) > 0) {
            headers.forEach((name, value) -> sb.append(name).append(": ").append(value).append('\n'));
            sb.append('\n');
        }
        sb.append(wrapBase64(data, width));
        sb.append(PEM_END).append(type).append(PEM_TRAILER).append('\n');
        return sb.toString().getBytes(StandardCharsets.US_ASCII);
    }

    /**
     * @param  algorithm  The key or certificate algorithm
     * @param  publicData The SSH encoded public key or certificate
     * @param  comment    Optional comment
     * @return            A single {@code authorized_keys} style line
     */
    public static byte[] encodeOpenSshPublic(String algorithm, byte[] publicData, byte[] comment) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(publicData.length * 2);
        byte[] prefix = (algorithm + " " + Base64.getEncoder().encodeToString(publicData))
                .getBytes(StandardCharsets.US_ASCII);
        out.write(prefix, 0, prefix.length);
        if (NumberUtils.length(comment) > 0) {
            out.write(' ');
            out.write(comment, 0, comment.length);
        }
        out.write('\n');
        return out.toByteArray();
    }

    /**
     * Decodes Base64 ignoring line breaks and any other character outside the Base64 alphabet
     *
     * @param  text                     The encoded text
     * @return                          The decoded bytes
     * @throws IllegalArgumentException If the data is not valid Base64
     */
    public static byte[] decodeBase64(String text) {
        return Base64.getMimeDecoder().decode(toBytes(text));
    }

    /**
     * @param  s The string
     * @return   The string without trailing {@link #WHITESPACE}
     */
    public static String rstrip(String s) {
        int end = s.length();
        while ((end > 0) && (WHITESPACE.indexOf(s.charAt(end - 1)) >= 0)) {
            end--;
        }
        return s.substring(0, end);
    }

    public static String strip(String s) {
        int start = 0;
        String value = rstrip(s);
        while ((start < value.length()) && (WHITESPACE.indexOf(value.charAt(start)) >= 0)) {
            start++;
        }
        return value.substring(start);
    }

    /**
     * Splits on runs of {@link #WHITESPACE}, ignoring leading and trailing ones
     *
     * @param  s        The string to split
     * @param  maxSplit Maximum number of splits - the last token holds the (left stripped) remainder
     * @return          The tokens
     */
    public static List<String> splitWhitespace(String s, int maxSplit) {
        List<String> tokens = new ArrayList<>();
        int len = s.length();
        int pos = 0;
        while (pos < len) {
            while ((pos < len) && (WHITESPACE.indexOf(s.charAt(pos)) >= 0)) {
                pos++;
            }
            if (pos >= len) {
                break;
            }

            if (tokens.size() >= maxSplit) {
                tokens.add(rstrip(s.substring(pos)));
                break;
            }

            int start = pos;
            while ((pos < len) && (WHITESPACE.indexOf(s.charAt(pos)) < 0)) {
                pos++;
            }
            tokens.add(s.substring(start, pos));
        }
        return tokens;
    }

    /**
     * Decodes exactly one DER value
     *
     * @param  data        The encoded value
     * @return             The decoded value
     * @throws IOException If the data is malformed or has trailing bytes
     */
    public static ASN1Primitive derDecode(byte[] data) throws IOException {
        try {
            return ASN1Primitive.fromByteArray(data);
        } catch (IllegalArgumentException | IllegalStateException | ClassCastException e) {
            throw new IOException("Invalid DER data: " + e.getMessage(), e);
        }
    }

    /**
     * Decodes the first DER value of the data, ignoring whatever follows it
     *
     * @param  data        The data
     * @return             The decoded value and the offset just past it
     * @throws IOException If the data does not start with a valid DER value
     */
    public static DerValue derDecodePartial(byte[] data) throws IOException {
        ByteArrayInputStream bais = new ByteArrayInputStream(data);
        try (ASN1InputStream asn1 = new ASN1InputStream(bais, data.length)) {
            ASN1Primitive value = asn1.readObject();
            if (value == null) {
                throw new IOException("No DER data");
            }
            return new DerValue(value, data.length - bais.available());
        } catch (IllegalArgumentException | IllegalStateException | ClassCastException e) {
            throw new IOException("Invalid DER data: " + e.getMessage(), e);
        }
    }

    /**
     * A decoded DER value along with the offset of the first byte following its encoding
     */
    public static final class DerValue {
        private final ASN1Primitive value;
        private final int end;

        public DerValue(ASN1Primitive value, int end) {
            this.value = value;
            this.end = end;
        }

        public ASN1Primitive getValue() {
            return value;
        }

        public int getEnd() {
            return end;
        }
    }
}
