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


package org.apache.sshkeys.config.keys.loader.openssh.kdf;

import java.security.SecureRandom;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.sshkeys.common.util.ValidateUtils;
import org.apache.sshkeys.common.util.buffer.Buffer;
import org.apache.sshkeys.common.util.buffer.BufferException;
import org.apache.sshkeys.common.util.buffer.BufferUtils;
import org.apache.sshkeys.common.util.buffer.ByteArrayBuffer;
import org.apache.sshkeys.config.keys.KeyEncryptionException;

/**
 * The {@code bcrypt} KDF options of an OpenSSH private key container - {@code string(salt) || uint32(rounds)}
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public class BCryptKdfOptions {
    public static final String NAME = "bcrypt";
    public static final int DEFAULT_SALT_SIZE = 16;

    /**
     * Upper bound on the rounds accepted when decoding, so that a crafted key file cannot stall the loader. The
     * default value (unless overridden by the {@code -a} parameter to the {@code ssh-keygen} command) is usually 16.
     */
    public static final int DEFAULT_MAX_ROUNDS = 0xFF;
    private static final AtomicInteger MAX_ROUNDS_HOLDER = new AtomicInteger(DEFAULT_MAX_ROUNDS);

    private static final SecureRandom RANDOM = new SecureRandom();

    private final byte[] salt;
    private final int numRounds;

    public BCryptKdfOptions(byte[] salt, int numRounds) {
        this.salt = ValidateUtils.checkNotNull(salt, "No salt").clone();
        this.numRounds = numRounds;
    }

    public byte[] getSalt() {
        return salt.clone();
    }

    public int getNumRounds() {
        return numRounds;
    }

    /**
     * @return The encoded options as stored in the container
     */
    public byte[] encode() {
        Buffer buffer = new ByteArrayBuffer(salt.length + 2 * Integer.BYTES);
        buffer.putBytes(salt);
        buffer.putUInt(numRounds);
        return buffer.getCompactData();
    }

    /**
     * @param  password               The password bytes
     * @param  length                 Required amount of key material
     * @return                        The derived bytes
     * @throws KeyEncryptionException If the options cannot be used for the derivation
     */
    public byte[] deriveKey(byte[] password, int length) throws KeyEncryptionException {
        if ((numRounds <= 0) || (numRounds > getMaxAllowedRounds())) {
            throw new KeyEncryptionException(
                    "Bad rounds value (" + numRounds + ") - max. allowed " + getMaxAllowedRounds());
        }
        if (salt.length == 0) {
            throw new KeyEncryptionException("Invalid OpenSSH private key");
        }

        byte[] output = new byte[length];
        BCrypt bcrypt = new BCrypt();
        bcrypt.pbkdf(password, salt, numRounds, output);
        return output;
    }

    @Override
    public int hashCode() {
        return 31 * getNumRounds() + Arrays.hashCode(salt);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == null) {
            return false;
        }
        if (this == obj) {
            return true;
        }
        if (getClass() != obj.getClass()) {
            return false;
        }

        BCryptKdfOptions other = (BCryptKdfOptions) obj;
        return (getNumRounds() == other.getNumRounds())
                && Arrays.equals(salt, other.salt);
    }

    @Override
    public String toString() {
        return NAME + ": rounds=" + getNumRounds() + ", salt=" + BufferUtils.toHex(':', salt);
    }

    /**
     * @param  kdfOptions             The encoded options
     * @return                        The decoded options
     * @throws KeyEncryptionException If the options are malformed
     */
    public static BCryptKdfOptions decode(byte[] kdfOptions) throws KeyEncryptionException {
        try {
            Buffer buffer = new ByteArrayBuffer(kdfOptions);
            byte[] salt = buffer.getBytes();
            long rounds = buffer.getUInt();
            buffer.checkEnd();
            if (rounds > Integer.MAX_VALUE) {
                throw new KeyEncryptionException("Bad rounds value (" + rounds + ")");
            }
            return new BCryptKdfOptions(salt, (int) rounds);
        } catch (BufferException e) {
            throw new KeyEncryptionException("Invalid OpenSSH private key", e);
        }
    }

    /**
     * @param  rounds Number of rounds
     * @return        Options with a random salt of {@link #DEFAULT_SALT_SIZE} bytes
     */
    public static BCryptKdfOptions generate(int rounds) {
        ValidateUtils.checkTrue(rounds > 0, "Invalid rounds value: %d", rounds);
        byte[] salt = new byte[DEFAULT_SALT_SIZE];
        synchronized (RANDOM) {
            RANDOM.nextBytes(salt);
        }
        return new BCryptKdfOptions(salt, rounds);
    }

    public static int getMaxAllowedRounds() {
        return MAX_ROUNDS_HOLDER.get();
    }

    public static void setMaxAllowedRounds(int value) {
        ValidateUtils.checkTrue(value > 0, "Invalid max. rounds value: %d", value);
        MAX_ROUNDS_HOLDER.set(value);
    }
}
