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

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import org.apache.sshkeys.common.util.GenericUtils;
import org.apache.sshkeys.common.util.ValidateUtils;

/**
 * Settings used when encrypting an exported private key. Only the password is needed for the decryption since the
 * remaining parameters are recorded in the encrypted container.
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public class PrivateKeyEncryptionContext implements Cloneable {
    /**
     * Cipher used for PKCS#1 and PKCS#8 encryption unless specified otherwise
     */
    public static final String DEFAULT_CIPHER_NAME = "aes256-cbc";

    /**
     * Cipher used for the OpenSSH private key container unless specified otherwise - same as {@code ssh-keygen}
     */
    public static final String DEFAULT_OPENSSH_CIPHER_NAME = "aes256-ctr";

    public static final String DEFAULT_HASH_NAME = "sha256";
    public static final int DEFAULT_PBE_VERSION = 2;

    /**
     * Default number of bcrypt KDF rounds - 64 cipher re-keys per round
     */
    public static final int DEFAULT_KDF_ROUNDS = 128;

    private static final Map<String, PrivateKeyObfuscator> OBFUSCATORS = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    static {
        registerPrivateKeyObfuscator(AESPrivateKeyObfuscator.AES128);
        registerPrivateKeyObfuscator(AESPrivateKeyObfuscator.AES192);
        registerPrivateKeyObfuscator(AESPrivateKeyObfuscator.AES256);
        registerPrivateKeyObfuscator(DESPrivateKeyObfuscator.DES);
        registerPrivateKeyObfuscator(DESPrivateKeyObfuscator.DES_EDE3);
        registerPrivateKeyObfuscator("3des-cbc", DESPrivateKeyObfuscator.DES_EDE3);
    }

    private String password;
    private String cipherName;
    private String hashName = DEFAULT_HASH_NAME;
    private int pbeVersion = DEFAULT_PBE_VERSION;
    private int kdfRounds = DEFAULT_KDF_ROUNDS;

    public PrivateKeyEncryptionContext() {
        super();
    }

    public PrivateKeyEncryptionContext(String password) {
        this.password = password;
    }

    public PrivateKeyEncryptionContext(String password, String cipherName) {
        this.password = password;
        this.cipherName = cipherName;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String value) {
        password = value;
    }

    public boolean hasPassword() {
        return GenericUtils.isNotEmpty(getPassword());
    }

    public byte[] getPasswordBytes() {
        String value = ValidateUtils.checkNotNullAndNotEmpty(getPassword(), "No password");
        return value.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * @return The configured cipher - {@code null} means the default of the target format
     */
    public String getCipherName() {
        return cipherName;
    }

    public void setCipherName(String value) {
        cipherName = value;
    }

    public String resolveCipherName(String defaultName) {
        String value = getCipherName();
        return GenericUtils.isEmpty(value) ? defaultName : value;
    }

    public String getHashName() {
        return hashName;
    }

    public void setHashName(String value) {
        hashName = ValidateUtils.checkNotNullAndNotEmpty(value, "No hash name");
    }

    public int getPbeVersion() {
        return pbeVersion;
    }

    public void setPbeVersion(int value) {
        pbeVersion = value;
    }

    public int getKdfRounds() {
        return kdfRounds;
    }

    public void setKdfRounds(int value) {
        ValidateUtils.checkTrue(value > 0, "Invalid KDF rounds: %d", value);
        kdfRounds = value;
    }

    public PrivateKeyObfuscator resolvePrivateKeyObfuscator() {
        return getRegisteredPrivateKeyObfuscator(resolveCipherName(DEFAULT_CIPHER_NAME));
    }

    @Override
    public PrivateKeyEncryptionContext clone() {
        try {
            return getClass().cast(super.clone());
        } catch (CloneNotSupportedException e) { // unexpected
            throw new UnsupportedOperationException("Failed to clone: " + toString());
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(getCipherName(), getHashName(), getPbeVersion(), getKdfRounds());
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

        PrivateKeyEncryptionContext other = (PrivateKeyEncryptionContext) obj;
        return Objects.equals(getPassword(), other.getPassword())
                && Objects.equals(getCipherName(), other.getCipherName())
                && Objects.equals(getHashName(), other.getHashName())
                && (getPbeVersion() == other.getPbeVersion())
                && (getKdfRounds() == other.getKdfRounds());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName()
               + "[cipher=" + getCipherName()
               + ", hash=" + getHashName()
               + ", pbe=" + getPbeVersion()
               + ", rounds=" + getKdfRounds()
               + "]";
    }

    /**
     * @param  password The password - may be {@code null}/empty
     * @return          A context holding the password and the default settings - {@code null} if no password
     */
    public static PrivateKeyEncryptionContext forPassword(String password) {
        return GenericUtils.isEmpty(password) ? null : new PrivateKeyEncryptionContext(password);
    }

    public static boolean isEncrypting(PrivateKeyEncryptionContext context) {
        return (context != null) && context.hasPassword();
    }

    public static void registerPrivateKeyObfuscator(PrivateKeyObfuscator o) {
        Objects.requireNonNull(o, "No instance provided");
        registerPrivateKeyObfuscator(o.getCipherName(), o);
        registerPrivateKeyObfuscator(o.getDekName(), o);
    }

    public static PrivateKeyObfuscator registerPrivateKeyObfuscator(String name, PrivateKeyObfuscator o) {
        ValidateUtils.checkNotNullAndNotEmpty(name, "No cipher name");
        Objects.requireNonNull(o, "No instance provided");

        synchronized (OBFUSCATORS) {
            return OBFUSCATORS.put(name, o);
        }
    }

    /**
     * @param  name Either the SSH cipher name ({@code aes128-cbc}) or the {@code DEK-Info} one ({@code AES-128-CBC})
     * @return      The matching {@link PrivateKeyObfuscator} - {@code null} if none
     */
    public static PrivateKeyObfuscator getRegisteredPrivateKeyObfuscator(String name) {
        if (GenericUtils.isEmpty(name)) {
            return null;
        }

        synchronized (OBFUSCATORS) {
            return OBFUSCATORS.get(name);
        }
    }
}
