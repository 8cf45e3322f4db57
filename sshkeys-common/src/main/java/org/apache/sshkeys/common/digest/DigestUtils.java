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

package org.apache.sshkeys.common.digest;

import java.security.MessageDigest;
import java.util.Base64;
import java.util.Locale;
import java.util.Objects;

import org.apache.sshkeys.common.util.buffer.BufferUtils;

/**
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public final class DigestUtils {
    private DigestUtils() {
        throw new UnsupportedOperationException("No instance");
    }

    /**
     * @param  d     The {@link BuiltinDigests} to use
     * @param  parts The data parts to digest - in order
     * @return       The digest value
     */
    public static byte[] digest(BuiltinDigests d, byte[]... parts) {
        MessageDigest md = Objects.requireNonNull(d, "No digest").create();
        for (byte[] p : parts) {
            md.update(p);
        }
        return md.digest();
    }

    /**
     * Renders the fingerprint of some data the way OpenSSH does - {@code MD5:} followed by colon separated hex pairs
     * for MD5, otherwise the upper-case digest name followed by the unpadded BASE64 encoding
     *
     * @param  d    The {@link BuiltinDigests} to use
     * @param  data The data to fingerprint
     * @return      The fingerprint
     */
    public static String getFingerPrint(BuiltinDigests d, byte[] data) {
        byte[] raw = digest(d, data);
        String prefix = d.getName().toUpperCase(Locale.ENGLISH) + ":";
        if (d == BuiltinDigests.md5) {
            return prefix + BufferUtils.toHex(':', raw);
        }

        return prefix + Base64.getEncoder().withoutPadding().encodeToString(raw);
    }
}
