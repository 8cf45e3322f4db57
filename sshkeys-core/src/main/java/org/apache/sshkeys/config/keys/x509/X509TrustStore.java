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


package org.apache.sshkeys.config.keys.x509;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Set;

import org.apache.sshkeys.common.util.GenericUtils;
import org.apache.sshkeys.common.util.logging.AbstractLoggingBean;
import org.apache.sshkeys.config.keys.SshKeys;
import org.apache.sshkeys.config.keys.certificate.SshCertificate;

/**
 * Expands a set of trusted certificates with the issuers found in OpenSSL style hashed certificate directories -
 * {@code <issuer-hash>.0}, {@code <issuer-hash>.1}, ... The lookup is repeated for every certificate added until no
 * new issuer is found. A missing or unreadable file ends the lookup in that directory for that issuer.
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public class X509TrustStore extends AbstractLoggingBean {
    private final List<Path> directories;

    public X509TrustStore(Collection<Path> directories) {
        this.directories = GenericUtils.unmodifiableList(directories);
    }

    public List<Path> getDirectories() {
        return directories;
    }

    /**
     * @param  cert       The certificate whose issuers are looked up
     * @param  trustStore The store to add the found issuers to - also serves as the set of already visited
     *                    certificates
     * @return            The number of certificates added to the store
     */
    public int expand(SshX509Certificate cert, Set<SshX509Certificate> trustStore) {
        int added = 0;
        Deque<SshX509Certificate> pending = new ArrayDeque<>();
        pending.add(cert);
        while (!pending.isEmpty()) {
            SshX509Certificate child = pending.removeFirst();
            for (Path dir : directories) {
                for (int index = 0;; index++) {
                    Path path = dir.resolve(child.getIssuerHash() + "." + index);
                    SshX509Certificate candidate = readCandidate(path);
                    if (candidate == null) {
                        break;
                    }

                    if (!candidate.getSubject().equals(child.getIssuer())) {
                        continue;
                    }

                    if (trustStore.add(candidate)) {
                        added++;
                        pending.add(candidate);
                        if (log.isDebugEnabled()) {
                            log.debug("expand({}) added {} from {}", cert.getSubject(), candidate.getSubject(), path);
                        }
                    }
                }
            }
        }
        return added;
    }

    protected SshX509Certificate readCandidate(Path path) {
        if (!Files.isRegularFile(path)) {
            if (log.isTraceEnabled()) {
                log.trace("readCandidate({}) not found", path);
            }
            return null;
        }

        try {
            SshCertificate cert = SshKeys.readCertificate(path);
            if (cert instanceof SshX509Certificate) {
                return (SshX509Certificate) cert;
            }
            if (log.isDebugEnabled()) {
                log.debug("readCandidate({}) not an X.509 certificate: {}", path, cert.getAlgorithm());
            }
        } catch (IOException | GeneralSecurityException | IllegalArgumentException e) {
            debug("readCandidate({}) failed ({}) to read certificate", path, e.getClass().getSimpleName(), e);
        }
        return null;
    }
}
