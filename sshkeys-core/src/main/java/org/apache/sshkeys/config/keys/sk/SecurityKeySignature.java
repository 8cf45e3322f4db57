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
 * A signature produced by a security token
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public class SecurityKeySignature {
    private final int flags;
    private final long counter;
    private final byte[] signature;

    /**
     * @param flags     The flags reported by the token
     * @param counter   The token signature counter
     * @param signature The raw signature - DER encoded for ECDSA, 64 bytes for Ed25519
     */
    public SecurityKeySignature(int flags, long counter, byte[] signature) {
        this.flags = flags;
        this.counter = counter;
        this.signature = Objects.requireNonNull(signature, "No signature").clone();
    }

    public int getFlags() {
        return flags;
    }

    public long getCounter() {
        return counter;
    }

    public byte[] getSignature() {
        return signature.clone();
    }
}
