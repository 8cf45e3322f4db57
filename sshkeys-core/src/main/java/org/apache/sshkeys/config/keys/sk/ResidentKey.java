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
 * A credential stored on a security token
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public class ResidentKey {
    private final int alg;
    private final String name;
    private final byte[] publicValue;
    private final byte[] keyHandle;

    public ResidentKey(int alg, String name, byte[] publicValue, byte[] keyHandle) {
        this.alg = alg;
        this.name = name;
        this.publicValue = Objects.requireNonNull(publicValue, "No public value").clone();
        this.keyHandle = Objects.requireNonNull(keyHandle, "No key handle").clone();
    }

    /**
     * @return The COSE algorithm number
     */
    public int getAlg() {
        return alg;
    }

    /**
     * @return The user name the credential was enrolled for - may be {@code null}
     */
    public String getName() {
        return name;
    }

    public byte[] getPublicValue() {
        return publicValue.clone();
    }

    public byte[] getKeyHandle() {
        return keyHandle.clone();
    }
}
