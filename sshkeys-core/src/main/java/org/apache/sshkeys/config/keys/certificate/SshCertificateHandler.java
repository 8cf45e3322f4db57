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

package org.apache.sshkeys.config.keys.certificate;

import org.apache.sshkeys.common.util.buffer.Buffer;
import org.apache.sshkeys.config.keys.KeyImportException;
import org.apache.sshkeys.config.keys.SshKeyHandler;

/**
 * Decodes the certificates registered under a certificate algorithm name
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
@FunctionalInterface
public interface SshCertificateHandler {
    /**
     * @param  algorithm          The certificate algorithm - already consumed from the buffer
     * @param  keyHandler         The handler of the certified key type - {@code null} if the certificate carries its
     *                            own key encoding (X.509)
     * @param  buffer             A {@link Buffer} over the complete certificate public data, positioned after the
     *                            algorithm name
     * @param  comment            The comment to attach - may be {@code null}
     * @return                    The decoded certificate
     * @throws KeyImportException If the certificate is malformed or its signature is invalid
     */
    SshCertificate decode(String algorithm, SshKeyHandler keyHandler, Buffer buffer, byte[] comment)
            throws KeyImportException;
}
