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

package org.apache.sshkeys.common.util.buffer;

import java.util.function.IntUnaryOperator;

import org.apache.sshkeys.common.util.NumberUtils;
import org.apache.sshkeys.common.util.ValidateUtils;

/**
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public final class BufferUtils {
    public static final char EMPTY_HEX_SEPARATOR = '\0';
    public static final String HEX_DIGITS = "0123456789abcdef";

    public static final IntUnaryOperator DEFAULT_BUFFER_GROWTH_FACTOR = BufferUtils::getNextPowerOf2;

    /**
     * Maximum value of a {@code uint32} field
     */
    public static final long MAX_UINT32_VALUE = 0x0FFFFFFFFL;

    private BufferUtils() {
        throw new UnsupportedOperationException("No instance");
    }

    public static String toHex(byte... array) {
        return toHex(EMPTY_HEX_SEPARATOR, array);
    }

    public static String toHex(char sep, byte... array) {
        int len = NumberUtils.length(array);
        if (len <= 0) {
            return "";
        }

        StringBuilder sb = new StringBuilder(len * 3);
        for (int index = 0; index < len; index++) {
            if ((index > 0) && (sep != EMPTY_HEX_SEPARATOR)) {
                sb.append(sep);
            }

            byte b = array[index];
            sb.append(HEX_DIGITS.charAt((b >> 4) & 0x0F));
            sb.append(HEX_DIGITS.charAt(b & 0x0F));
        }

        return sb.toString();
    }

    /**
     * @param  csq                   The hex characters - must have an even length, no separators
     * @return                       The decoded bytes
     * @throws NumberFormatException If bad hex characters or odd length
     */
    public static byte[] decodeHex(CharSequence csq) {
        int len = csq.length();
        if ((len & 0x01) != 0) {
            throw new NumberFormatException("Odd number of hex characters: " + len);
        }

        byte[] bytes = new byte[len / 2];
        for (int index = 0, pos = 0; index < len; index += 2, pos++) {
            bytes[pos] = fromHex(csq.charAt(index), csq.charAt(index + 1));
        }

        return bytes;
    }

    public static byte fromHex(char hi, char lo) throws NumberFormatException {
        int hiValue = Character.digit(hi, 16);
        int loValue = Character.digit(lo, 16);
        if ((hiValue < 0) || (loValue < 0)) {
            throw new NumberFormatException("Invalid hex value: " + hi + lo);
        }

        return (byte) ((hiValue << 4) | loValue);
    }

    public static long getUInt(byte[] buf, int off, int len) {
        if (len < Integer.BYTES) {
            throw new IllegalArgumentException(
                    "Not enough data for a UINT: required=" + Integer.BYTES + ", available=" + len);
        }

        long l = (buf[off] << 24) & 0xff000000L;
        l |= (buf[off + 1] << 16) & 0x00ff0000L;
        l |= (buf[off + 2] << 8) & 0x0000ff00L;
        l |= (buf[off + 3]) & 0x000000ffL;
        return l;
    }

    public static int putUInt(long value, byte[] buf, int off, int len) {
        if (len < Integer.BYTES) {
            throw new IllegalArgumentException(
                    "Not enough data for a UINT: required=" + Integer.BYTES + ", available=" + len);
        }

        buf[off] = (byte) ((value >> 24) & 0xFF);
        buf[off + 1] = (byte) ((value >> 16) & 0xFF);
        buf[off + 2] = (byte) ((value >> 8) & 0xFF);
        buf[off + 3] = (byte) (value & 0xFF);

        return Integer.BYTES;
    }

    /**
     * Constant-time comparison of two byte arrays
     *
     * @param  a1 1st array
     * @param  a2 2nd array
     * @return    {@code true} if both arrays have the same length and content
     */
    public static boolean equals(byte[] a1, byte[] a2) {
        int len1 = NumberUtils.length(a1);
        int len2 = NumberUtils.length(a2);
        int result = len1 ^ len2;
        int len = Math.min(len1, len2);
        for (int index = 0; index < len; index++) {
            result |= a1[index] ^ a2[index];
        }

        return result == 0;
    }

    public static int getNextPowerOf2(int value) {
        if (value < Byte.SIZE) {
            return Byte.SIZE;
        }
        if (value > (1 << 30)) {
            return value;
        }

        int j = 1;
        while (j < value) {
            j <<= 1;
        }
        return j;
    }

    public static long validateInt32Value(long value, String format, Object arg) {
        ValidateUtils.checkTrue(isValidInt32Value(value), format, arg);
        return value;
    }

    public static boolean isValidInt32Value(long value) {
        return (value >= Integer.MIN_VALUE) && (value <= Integer.MAX_VALUE);
    }

    public static long validateUint32Value(long value, String format, Object arg) {
        ValidateUtils.checkTrue(isValidUint32Value(value), format, arg);
        return value;
    }

    public static boolean isValidUint32Value(long value) {
        return (value >= 0L) && (value <= MAX_UINT32_VALUE);
    }
}
