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

package org.apache.sshkeys.common.util.io;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

import org.apache.sshkeys.common.util.GenericUtils;

/**
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public final class IoUtils {
    /**
     * The {@code ~} character used to denote the user's home folder
     */
    public static final char HOME_TILDE_CHAR = '~';

    public static final OpenOption[] APPEND_OPEN_OPTIONS = {
            StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND };

    private IoUtils() {
        throw new UnsupportedOperationException("No instance allowed");
    }

    /**
     * @return The {@link Path} to the currently running user home
     */
    public static Path getUserHomeFolder() {
        String home = System.getProperty("user.home");
        return GenericUtils.isEmpty(home) ? null : Paths.get(home).toAbsolutePath().normalize();
    }

    /**
     * @param  path The path value - may be {@code null}/empty
     * @return      The path with a leading {@code ~} replaced by the user's home folder
     */
    public static String normalizePath(String path) {
        if (GenericUtils.isBlank(path)) {
            return path;
        }

        if (path.charAt(0) == HOME_TILDE_CHAR) {
            Path homeDir = Objects.requireNonNull(getUserHomeFolder(), "No user home folder available");
            if (path.length() > 1) {
                path = homeDir + path.substring(1);
            } else {
                path = homeDir.toString();
            }
        }

        return path.replace('/', File.separatorChar);
    }

    public static byte[] readAllBytes(Path path) throws IOException {
        return Files.readAllBytes(Objects.requireNonNull(path, "No path"));
    }

    public static void write(Path path, byte[] data, boolean append) throws IOException {
        if (append) {
            Files.write(path, data, APPEND_OPEN_OPTIONS);
        } else {
            Files.write(path, data);
        }
    }
}
