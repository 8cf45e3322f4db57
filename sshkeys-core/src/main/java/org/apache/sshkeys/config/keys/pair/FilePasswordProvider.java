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


package org.apache.sshkeys.config.keys.pair;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
@FunctionalInterface
public interface FilePasswordProvider {
    /**
     * An &quot;empty&quot; provider that returns {@code null} - i.e., unprotected key file
     */
    FilePasswordProvider EMPTY = resourceKey -> null;

    /**
     * @param  resourceKey The resource key representing the <U>private</U> file - {@code null} if the key is loaded
     *                     from in-memory data
     * @return             The password - if {@code null} then no password is available
     * @throws IOException if cannot resolve password
     */
    String getPassword(String resourceKey) throws IOException;

    static FilePasswordProvider of(String password) {
        return resourceKey -> password;
    }

    /**
     * @param  password A password that may not be resolved yet
     * @return          A provider that blocks the loading thread until the password is available
     */
    static FilePasswordProvider of(Future<String> password) {
        Objects.requireNonNull(password, "No password future");
        return resourceKey -> {
            try {
                return password.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw (IOException) new InterruptedIOException("Interrupted while waiting for password").initCause(e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof IOException) {
                    throw (IOException) cause;
                }
                throw new IOException("Failed to resolve password of " + resourceKey, cause);
            }
        };
    }
}
