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

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.function.IntUnaryOperator;

import org.apache.sshkeys.common.util.GenericUtils;
import org.apache.sshkeys.common.util.NumberUtils;

/**
 * Provides an abstract message buffer for the SSH binary encodings - {@code byte}, {@code uint32}, {@code uint64},
 * {@code string}, {@code mpint} and {@code name-list} as defined in
 * <A HREF="https://tools.ietf.org/html/rfc4251#section-5">RFC 4251 section 5</A>
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public abstract class Buffer {
    protected final byte[] workBuf = new byte[Long.BYTES];

    protected Buffer() {
        super();
    }

    /**
     * @return Current reading position
     */
    public abstract int rpos();

    /**
     * @param rpos Set current reading position
     */
    public abstract void rpos(int rpos);

    /**
     * @return Current writing position
     */
    public abstract int wpos();

    /**
     * @param wpos Set current writing position - <B>Note:</B> if necessary, the underlying data buffer will be
     *             increased so as to allow writing from the new position
     */
    public abstract void wpos(int wpos);

    /**
     * @return Number of bytes that can be read from the current read position
     */
    public abstract int available();

    /**
     * @return The raw underlying data bytes
     */
    public abstract byte[] array();

    /**
     * @return The bytes consumed so far - i.e., everything from the start of the data up to the read position
     */
    public abstract byte[] getBytesConsumed();

    /**
     * @return A copy of the data between the read and write positions
     */
    public byte[] getCompactData() {
        int l = available();
        if (l > 0) {
            byte[] b = new byte[l];
            copyRawBytes(0, b, 0, l);
            return b;
        } else {
            return GenericUtils.EMPTY_BYTE_ARRAY;
        }
    }

    /**
     * Makes sure all data was consumed - used where the format requires exact exhaustion of a (sub-)packet
     *
     * @throws BufferException if unconsumed data remains
     */
    public void checkEnd() throws BufferException {
        int avail = available();
        if (avail > 0) {
            throw new BufferException("Unexpected trailing data: " + avail + " bytes");
        }
    }

    /*
     * ====================== Read methods ======================
     */

    public int getUByte() {
        return getByte() & 0xFF;
    }

    public byte getByte() {
        ensureAvailable(Byte.BYTES);
        getRawBytes(workBuf, 0, Byte.BYTES);
        return workBuf[0];
    }

    public int getInt() {
        return (int) getUInt();
    }

    public long getUInt() {
        ensureAvailable(Integer.BYTES);
        getRawBytes(workBuf, 0, Integer.BYTES);
        return BufferUtils.getUInt(workBuf, 0, Integer.BYTES);
    }

    public long getLong() {
        ensureAvailable(Long.BYTES);
        getRawBytes(workBuf, 0, Long.BYTES);
        long l = 0L;
        for (int index = 0; index < Long.BYTES; index++) {
            l = (l << Byte.SIZE) | (workBuf[index] & 0xFFL);
        }
        return l;
    }

    @SuppressWarnings("PMD.BooleanGetMethodName")
    public boolean getBoolean() {
        return getByte() != 0;
    }

    /**
     * @return Reads a UTF-8 encoded string - malformed sequences are replaced
     */
    public String getString() {
        return getString(StandardCharsets.UTF_8);
    }

    /**
     * Reads a string using a given charset.
     *
     * @param  charset The {@link Charset} to use for the string bytes
     * @return         The read string
     */
    public abstract String getString(Charset charset);

    /**
     * Reads a UTF-8 string, rejecting malformed or unmappable byte sequences instead of replacing them
     *
     * @return                          The decoded string
     * @throws CharacterCodingException If the string bytes are not valid UTF-8
     */
    public String getStrictString() throws CharacterCodingException {
        byte[] bytes = getBytes();
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
    }

    /**
     * According to <A HREF="https://tools.ietf.org/html/rfc4251#page-10">RFC 4251</A>:
     *
     * A name-list is represented as a uint32 containing its length (number of bytes that follow) followed by a
     * comma-separated list of zero or more names.
     *
     * @return The parsed result
     */
    public List<String> getNameList() {
        String list = getString(StandardCharsets.UTF_8);
        String[] values = GenericUtils.split(list, ',');
        return GenericUtils.isEmpty(values) ? Collections.emptyList() : Arrays.asList(values);
    }

    /**
     * @return The remaining data as a list of strings
     */
    public List<String> getAvailableStrings() {
        List<String> list = new ArrayList<>();
        while (available() > 0) {
            list.add(getString());
        }
        return list;
    }

    public BigInteger getMPInt() {
        byte[] bytes = getMPIntAsBytes();
        return (bytes.length == 0) ? BigInteger.ZERO : new BigInteger(bytes);
    }

    public byte[] getMPIntAsBytes() {
        return getBytes();
    }

    public byte[] getBytes() {
        int reqLen = getInt();
        int len = ensureAvailable(reqLen);
        byte[] b = new byte[len];
        getRawBytes(b);
        return b;
    }

    /**
     * Reads a {@code string} and wraps its content for further reading
     *
     * @return A new {@link Buffer} positioned at the start of the string content
     */
    public Buffer getBufferedString() {
        return new ByteArrayBuffer(getBytes());
    }

    /**
     * @return All the remaining bytes - the buffer is exhausted afterwards
     */
    public byte[] getRemainingBytes() {
        byte[] b = getCompactData();
        rpos(rpos() + b.length);
        return b;
    }

    public void getRawBytes(byte[] buf) {
        getRawBytes(buf, 0, buf.length);
    }

    public abstract void getRawBytes(byte[] buf, int off, int len);

    protected abstract void copyRawBytes(int offset, byte[] buf, int pos, int len);

    /**
     * Makes sure the buffer contains enough data to accommodate the requested length
     *
     * @param  reqLen          Requested data in bytes
     * @return                 Same as input if validation successful
     * @throws BufferException If negative length or beyond available requested
     */
    public int ensureAvailable(int reqLen) throws BufferException {
        if (reqLen < 0) {
            throw new BufferException("Bad item length: " + reqLen);
        }

        int availLen = available();
        if (availLen < reqLen) {
            throw new BufferException("Underflow: requested=" + reqLen + ", available=" + availLen);
        }

        return reqLen;
    }

    /*
     * ====================== Write methods ======================
     */

    public void putByte(byte b) {
        ensureCapacity(Byte.BYTES);
        workBuf[0] = b;
        putRawBytes(workBuf, 0, Byte.BYTES);
    }

    public void putBoolean(boolean b) {
        putByte(b ? (byte) 1 : (byte) 0);
    }

    /**
     * Writes 32 bits
     *
     * @param i The 32-bit value
     */
    public void putInt(long i) {
        BufferUtils.validateInt32Value(i, "Invalid 32-bit value: %d", i);
        ensureCapacity(Integer.BYTES);
        BufferUtils.putUInt(i, workBuf, 0, Integer.BYTES);
        putRawBytes(workBuf, 0, Integer.BYTES);
    }

    /**
     * Writes an unsigned 32 bits value
     *
     * @param i The value - must be in the {@code uint32} range
     */
    public void putUInt(long i) {
        BufferUtils.validateUint32Value(i, "Invalid uint32 value: %d", i);
        ensureCapacity(Integer.BYTES);
        BufferUtils.putUInt(i, workBuf, 0, Integer.BYTES);
        putRawBytes(workBuf, 0, Integer.BYTES);
    }

    /**
     * Writes 64 bits
     *
     * @param i The 64-bit value - interpreted as unsigned by the reader where the format says so
     */
    public void putLong(long i) {
        ensureCapacity(Long.BYTES);
        for (int index = Long.BYTES - 1; index >= 0; index--) {
            workBuf[index] = (byte) i;
            i >>>= Byte.SIZE;
        }
        putRawBytes(workBuf, 0, Long.BYTES);
    }

    public void putBytes(byte[] b) {
        putBytes(b, 0, NumberUtils.length(b));
    }

    public void putBytes(byte[] b, int off, int len) {
        putInt(len);
        putRawBytes(b, off, len);
    }

    public void putNameList(Collection<String> names) {
        putString(GenericUtils.join(names, ','));
    }

    public void putString(String string) {
        putString(string, StandardCharsets.UTF_8);
    }

    public void putString(String string, Charset charset) {
        if (GenericUtils.isEmpty(string)) {
            putBytes(GenericUtils.EMPTY_BYTE_ARRAY);
        } else {
            putBytes(string.getBytes(charset));
        }
    }

    /**
     * Writes an {@code mpint} - zero is encoded as an empty string, positive values with a leading zero byte if their
     * high bit is set
     *
     * @param bigint The value to write
     */
    public void putMPInt(BigInteger bigint) {
        if (bigint.signum() == 0) {
            putBytes(GenericUtils.EMPTY_BYTE_ARRAY);
        } else {
            putMPInt(bigint.toByteArray());
        }
    }

    public void putMPInt(byte[] mpInt) {
        if ((mpInt.length > 0) && ((mpInt[0] & 0x80) != 0)) {
            putInt(mpInt.length + 1 /* padding */);
            putByte((byte) 0);
        } else {
            putInt(mpInt.length);
        }
        putRawBytes(mpInt);
    }

    public void putRawBytes(byte[] d) {
        putRawBytes(d, 0, d.length);
    }

    public abstract void putRawBytes(byte[] d, int off, int len);

    /**
     * Appends the available data of another buffer as raw bytes (no length prefix)
     *
     * @param buffer The source {@link Buffer} - its read position is not modified
     */
    public void putBuffer(Buffer buffer) {
        putRawBytes(buffer.getCompactData());
    }

    public Buffer ensureCapacity(int capacity) {
        return ensureCapacity(capacity, BufferUtils.DEFAULT_BUFFER_GROWTH_FACTOR);
    }

    /**
     * @param  capacity     The required capacity
     * @param  growthFactor An {@link IntUnaryOperator} that is invoked if the current capacity is insufficient. The
     *                      argument is the minimum required new data length, the function result should be the
     *                      effective new data length to be allocated - if less than minimum then an exception is thrown
     * @return              This buffer instance
     */
    public abstract Buffer ensureCapacity(int capacity, IntUnaryOperator growthFactor);

    /**
     * @return Current size of underlying backing data bytes array
     */
    protected abstract int size();

    @Override
    public String toString() {
        return getClass().getSimpleName()
               + "[rpos=" + rpos()
               + ", wpos=" + wpos()
               + ", size=" + size()
               + "]";
    }
}
