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


package org.apache.sshkeys.config.keys.loader.ssh2;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import org.apache.sshkeys.common.util.NumberUtils;
import org.apache.sshkeys.config.keys.loader.KeyResourceUtils;

/**
 * Encodes a public key or certificate according to <A HREF="https://tools.ietf.org/html/rfc4716">The Secure Shell
 * (SSH) Public Key File Format</A>. Decoding is done by the
 * {@link org.apache.sshkeys.config.keys.loader.KeyBlockMatcher}.
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public class Ssh2PublicKeyCodec {
    public static final String BEGIN_MARKER = "---- BEGIN SSH2 PUBLIC KEY ----";
    public static final String END_MARKER = "---- END SSH2 PUBLIC KEY ----";

    /**
     * According to <A HREF="https://tools.ietf.org/html/rfc4716#section-3.3">RFC-4716 section 3.3</A>:
     *
     * <P>
     * <code>
     *      A line is continued if the last character in the line is a &quot;\&quot;.  If
     *      the last character of a line is a &quot;\&quot;, then the logical contents of
     *      the line are formed by removing the &quot;\&quot; and the line termination
     *      characters, and appending the contents of the next line.
     * </code>
     * </P>
     */
    public static final char HEADER_CONTINUATION_INDICATOR = '\\';

    /**
     * The only header this codec writes and interprets - the tag itself is case-insensitive
     */
    public static final String COMMENT_HEADER = "Comment";

    public static final Ssh2PublicKeyCodec INSTANCE = new Ssh2PublicKeyCodec();

    public Ssh2PublicKeyCodec() {
        super();
    }

    /**
     * @param  publicData The SSH encoded public key or certificate
     * @param  comment    Optional comment - written as a quoted {@code Comment} header
     * @return            The encoded block
     */
    public byte[] encodePublicKey(byte[] publicData, byte[] comment) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(publicData.length * 2);
        writeAscii(out, BEGIN_MARKER + "\n");
        if (NumberUtils.length(comment) > 0) {
            writeAscii(out, COMMENT_HEADER + ": \"");
            out.write(comment, 0, comment.length);
            writeAscii(out, "\"\n");
        }
        writeAscii(out, KeyResourceUtils.wrapBase64(publicData, KeyResourceUtils.PEM_LINE_WIDTH));
        writeAscii(out, END_MARKER + "\n");
        return out.toByteArray();
    }

    private static void writeAscii(ByteArrayOutputStream out, String text) {
        byte[] bytes = text.getBytes(StandardCharsets.US_ASCII);
        out.write(bytes, 0, bytes.length);
    }
}
