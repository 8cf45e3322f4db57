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

package org.apache.sshkeys.common.cipher;

/**
 * The reported algorithm name refers to the cipher base name - e.g., &quot;AES&quot;, &quot;DESede&quot;, etc.
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public interface CipherInformation {
    /**
     * @return The cipher's base algorithm name
     */
    String getAlgorithm();

    /**
     * @return The actual transformation used - e.g., AES/CBC/NoPadding
     */
    String getTransformation();

    /**
     * @return The cipher's key size (in bits)
     */
    int getKeySize();

    /**
     * @return The number of bytes the key derivation function has to produce for the cipher key
     */
    int getKdfSize();

    /**
     * @return Size of the initialization vector (in bytes)
     */
    int getIVSize();

    /**
     * @return Size of the authentication tag (AT) in bytes or 0 if this cipher does not support authentication
     */
    int getAuthenticationTagSize();

    /**
     * @return Size of the cipher block (in bytes) - encrypted data must be padded to a multiple of it
     */
    int getCipherBlockSize();
}
