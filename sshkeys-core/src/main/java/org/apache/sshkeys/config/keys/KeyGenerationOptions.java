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

package org.apache.sshkeys.config.keys;

import java.util.Objects;

import org.apache.sshkeys.config.keys.sk.SecurityKeyAuthenticator;

/**
 * Algorithm specific options for {@link SshKeyHandler#generate(String, KeyGenerationOptions)}. Families ignore the
 * options that do not apply to them.
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public class KeyGenerationOptions implements Cloneable {
    public static final int DEFAULT_RSA_KEY_SIZE = 2048;
    public static final long DEFAULT_RSA_EXPONENT = 65537L;
    public static final String DEFAULT_SK_APPLICATION = "ssh:";
    public static final String DEFAULT_SK_USER = "sshkeys";

    private int keySize;
    private long exponent = DEFAULT_RSA_EXPONENT;
    private String application = DEFAULT_SK_APPLICATION;
    private String user = DEFAULT_SK_USER;
    private String pin;
    private boolean resident;
    private boolean touchRequired = true;
    private SecurityKeyAuthenticator authenticator;

    public KeyGenerationOptions() {
        super();
    }

    /**
     * @return Requested key size in bits - zero for the family default
     */
    public int getKeySize() {
        return keySize;
    }

    public KeyGenerationOptions keySize(int value) {
        this.keySize = value;
        return this;
    }

    public long getExponent() {
        return exponent;
    }

    public KeyGenerationOptions exponent(long value) {
        this.exponent = value;
        return this;
    }

    public String getApplication() {
        return application;
    }

    public KeyGenerationOptions application(String value) {
        this.application = Objects.requireNonNull(value, "No application");
        return this;
    }

    public String getUser() {
        return user;
    }

    public KeyGenerationOptions user(String value) {
        this.user = Objects.requireNonNull(value, "No user");
        return this;
    }

    public String getPin() {
        return pin;
    }

    public KeyGenerationOptions pin(String value) {
        this.pin = value;
        return this;
    }

    public boolean isResident() {
        return resident;
    }

    public KeyGenerationOptions resident(boolean value) {
        this.resident = value;
        return this;
    }

    public boolean isTouchRequired() {
        return touchRequired;
    }

    public KeyGenerationOptions touchRequired(boolean value) {
        this.touchRequired = value;
        return this;
    }

    public SecurityKeyAuthenticator getAuthenticator() {
        return authenticator;
    }

    public KeyGenerationOptions authenticator(SecurityKeyAuthenticator value) {
        this.authenticator = value;
        return this;
    }

    @Override
    public KeyGenerationOptions clone() {
        try {
            return getClass().cast(super.clone());
        } catch (CloneNotSupportedException e) {
            throw new UnsupportedOperationException("Unexpected clone failure", e);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName()
               + "[keySize=" + getKeySize()
               + ", exponent=" + getExponent()
               + ", application=" + getApplication()
               + ", resident=" + isResident()
               + ", touchRequired=" + isTouchRequired()
               + "]";
    }
}
