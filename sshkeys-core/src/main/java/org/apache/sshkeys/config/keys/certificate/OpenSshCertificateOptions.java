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

import java.nio.charset.CharacterCodingException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.apache.sshkeys.common.util.GenericUtils;
import org.apache.sshkeys.common.util.buffer.Buffer;
import org.apache.sshkeys.common.util.buffer.BufferException;
import org.apache.sshkeys.common.util.buffer.ByteArrayBuffer;
import org.apache.sshkeys.config.keys.KeyImportException;

/**
 * The critical options and extensions understood in OpenSSH certificates, as ordered tables of name, value encoder
 * and value decoder. Encoding walks a table in order and emits every option with a value set; decoding rejects
 * unknown names only for critical options.
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 * @see    <a href= "https://github.com/openssh/openssh-portable/blob/master/PROTOCOL.certkeys">PROTOCOL.certkeys</a>
 */
public final class OpenSshCertificateOptions {
    public static final String FORCE_COMMAND = "force-command";
    public static final String SOURCE_ADDRESS = "source-address";

    public static final String PERMIT_X11_FORWARDING = "permit-X11-forwarding";
    public static final String PERMIT_AGENT_FORWARDING = "permit-agent-forwarding";
    public static final String PERMIT_PORT_FORWARDING = "permit-port-forwarding";
    public static final String PERMIT_PTY = "permit-pty";
    public static final String PERMIT_USER_RC = "permit-user-rc";
    public static final String NO_TOUCH_REQUIRED = "no-touch-required";

    public static final ValueCodec BOOLEAN = new ValueCodec() {
        @Override
        public void encode(Buffer buffer, Object value) {
            // presence is the value
        }

        @Override
        public Object decode(Buffer buffer) {
            buffer.getRemainingBytes();
            return Boolean.TRUE;
        }
    };

    public static final ValueCodec FORCE_COMMAND_CODEC = new ValueCodec() {
        @Override
        public void encode(Buffer buffer, Object value) {
            buffer.putString(value.toString());
        }

        @Override
        public Object decode(Buffer buffer) throws KeyImportException {
            try {
                return buffer.getStrictString();
            } catch (CharacterCodingException e) {
                throw new KeyImportException("Invalid characters in command", e);
            }
        }
    };

    public static final ValueCodec SOURCE_ADDRESS_CODEC = new ValueCodec() {
        @Override
        public void encode(Buffer buffer, Object value) {
            List<String> names = new ArrayList<>();
            for (Object addr : (Collection<?>) value) {
                SourceAddress network = (addr instanceof SourceAddress)
                        ? (SourceAddress) addr : SourceAddress.valueOf(addr.toString());
                names.add(network.toString());
            }
            buffer.putNameList(names);
        }

        @Override
        public Object decode(Buffer buffer) throws KeyImportException {
            List<String> names = buffer.getNameList();
            List<SourceAddress> result = new ArrayList<>(names.size());
            try {
                for (String n : names) {
                    result.add(SourceAddress.valueOf(n));
                }
            } catch (IllegalArgumentException e) {
                throw new KeyImportException("Invalid source address", e);
            }
            return Collections.unmodifiableList(result);
        }
    };

    public static final List<OptionEntry> USER_OPTIONS = GenericUtils.unmodifiableList(
            new OptionEntry(FORCE_COMMAND, FORCE_COMMAND_CODEC),
            new OptionEntry(SOURCE_ADDRESS, SOURCE_ADDRESS_CODEC));

    public static final List<OptionEntry> USER_EXTENSIONS = GenericUtils.unmodifiableList(
            new OptionEntry(PERMIT_X11_FORWARDING, BOOLEAN),
            new OptionEntry(PERMIT_AGENT_FORWARDING, BOOLEAN),
            new OptionEntry(PERMIT_PORT_FORWARDING, BOOLEAN),
            new OptionEntry(PERMIT_PTY, BOOLEAN),
            new OptionEntry(PERMIT_USER_RC, BOOLEAN),
            new OptionEntry(NO_TOUCH_REQUIRED, BOOLEAN));

    public static final List<OptionEntry> HOST_OPTIONS = Collections.emptyList();

    public static final List<OptionEntry> HOST_EXTENSIONS = Collections.emptyList();

    private OpenSshCertificateOptions() {
        throw new UnsupportedOperationException("No instance");
    }

    /**
     * @param  type The certificate type
     * @return      The critical options table for the type
     */
    public static List<OptionEntry> getCriticalOptions(OpenSshCertificate.Type type) {
        return (type == OpenSshCertificate.Type.USER) ? USER_OPTIONS : HOST_OPTIONS;
    }

    public static List<OptionEntry> getExtensions(OpenSshCertificate.Type type) {
        return (type == OpenSshCertificate.Type.USER) ? USER_EXTENSIONS : HOST_EXTENSIONS;
    }

    /**
     * @param  options The option values by name - options not in the table or without a value are skipped
     * @param  table   The encoding table
     * @return         The encoded {@code name || string(value)} sequence
     */
    public static byte[] encodeOptions(Map<String, ?> options, List<OptionEntry> table) {
        Buffer buffer = new ByteArrayBuffer();
        for (OptionEntry entry : table) {
            Object value = options.get(entry.getName());
            if (!isSet(value)) {
                continue;
            }

            Buffer data = new ByteArrayBuffer();
            entry.getCodec().encode(data, value);
            buffer.putString(entry.getName());
            buffer.putBytes(data.getCompactData());
        }
        return buffer.getCompactData();
    }

    /**
     * @param  encoded            The encoded options
     * @param  table              The decoding table
     * @param  critical           Whether unknown names are an error
     * @return                    The decoded values by name - in encoding order
     * @throws KeyImportException If an option value is invalid or an unknown critical option is found
     */
    public static Map<String, Object> decodeOptions(byte[] encoded, List<OptionEntry> table, boolean critical)
            throws KeyImportException {
        Buffer buffer = new ByteArrayBuffer(encoded);
        Map<String, Object> result = new LinkedHashMap<>();
        while (buffer.available() > 0) {
            String name = buffer.getString();
            OptionEntry entry = findEntry(table, name);
            if (entry == null) {
                if (critical) {
                    throw new KeyImportException("Unrecognized critical option: " + name);
                }
                buffer.getBytes();
                continue;
            }

            Buffer data = buffer.getBufferedString();
            result.put(name, entry.getCodec().decode(data));
            try {
                data.checkEnd();
            } catch (BufferException e) {
                throw new KeyImportException("Invalid value for option " + name, e);
            }
        }
        return result;
    }

    private static OptionEntry findEntry(List<OptionEntry> table, String name) {
        for (OptionEntry entry : table) {
            if (entry.getName().equals(name)) {
                return entry;
            }
        }
        return null;
    }

    private static boolean isSet(Object value) {
        if (value == null) {
            return false;
        } else if (value instanceof Boolean) {
            return (Boolean) value;
        } else if (value instanceof CharSequence) {
            return ((CharSequence) value).length() > 0;
        } else if (value instanceof Collection<?>) {
            return !((Collection<?>) value).isEmpty();
        } else {
            return true;
        }
    }

    /**
     * Encodes and decodes the value of one option
     */
    public interface ValueCodec {
        void encode(Buffer buffer, Object value);

        Object decode(Buffer buffer) throws KeyImportException;
    }

    /**
     * A named row of an option table
     */
    public static final class OptionEntry {
        private final String name;
        private final ValueCodec codec;

        public OptionEntry(String name, ValueCodec codec) {
            this.name = Objects.requireNonNull(name, "No option name");
            this.codec = Objects.requireNonNull(codec, "No option codec");
        }

        public String getName() {
            return name;
        }

        public ValueCodec getCodec() {
            return codec;
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
