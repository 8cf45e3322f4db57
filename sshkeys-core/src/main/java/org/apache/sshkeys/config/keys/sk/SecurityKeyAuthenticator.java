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

import java.io.IOException;
import java.util.List;

/**
 * Access to a FIDO2/U2F security token. Implementations talk to the hardware (e.g., through libfido2); every call
 * may block until the user touches the token.
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public interface SecurityKeyAuthenticator {
    /** COSE algorithm number for ECDSA with SHA-256 over P-256 */
    int SSH_SK_ECDSA = -7;
    /** COSE algorithm number for Ed25519 */
    int SSH_SK_ED25519 = -8;

    /** Signature flag - the user touched the token */
    int SSH_SK_USER_PRESENCE_REQD = 0x01;

    /**
     * Creates a new credential on the token
     *
     * @param  alg           {@link #SSH_SK_ECDSA} or {@link #SSH_SK_ED25519}
     * @param  application   The application (relying party) string
     * @param  user          The user name associated with a resident credential
     * @param  pin           The token PIN - may be {@code null}
     * @param  resident      Whether the credential is stored on the token
     * @param  touchRequired Whether signing will require a touch
     * @return               The enrolled public value and key handle
     * @throws IOException   If the token cannot be reached or refuses the enrollment
     */
    SecurityKeyEnrollment enroll(
            int alg, byte[] application, String user, String pin, boolean resident, boolean touchRequired)
            throws IOException;

    /**
     * @param  messageHash SHA-256 of the data to sign
     * @param  application The application string the key was enrolled with
     * @param  keyHandle   The credential key handle
     * @param  flags       The key flags
     * @return             The raw signature along with the token flags and counter
     * @throws IOException If the token cannot be reached or refuses to sign
     */
    SecurityKeySignature sign(byte[] messageHash, byte[] application, byte[] keyHandle, int flags) throws IOException;

    /**
     * @param  application The application to filter on
     * @param  user        The user name to filter on - {@code null} for all
     * @param  pin         The token PIN
     * @return             The credentials resident on the token
     * @throws IOException If the token cannot be reached
     */
    List<ResidentKey> getResidentKeys(byte[] application, String user, String pin) throws IOException;
}
