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

package org.apache.sshkeys.config.keys.sk;

import java.util.Objects;

/**
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public class SecurityKeyEnrollment {
    private final byte[] publicValue;
    private final byte[] keyHandle;

    public SecurityKeyEnrollment(byte[] publicValue, byte[] keyHandle) {
        this.publicValue = Objects.requireNonNull(publicValue, "No public value").clone();
        this.keyHandle = Objects.requireNonNull(keyHandle, "No key handle").clone();
    }

    /**
     * @return The uncompressed EC point or raw Ed25519 public key
     */
    public byte[] getPublicValue() {
        return publicValue.clone();
    }

    public byte[] getKeyHandle() {
        return keyHandle.clone();
    }
}
