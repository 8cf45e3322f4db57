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


package org.apache.sshkeys.config.keys.loader.ssh2;

import java.nio.charset.StandardCharsets;

import org.apache.sshkeys.config.keys.KeyImportException;
import org.apache.sshkeys.config.keys.SshKey;
import org.apache.sshkeys.config.keys.SshKeys;
import org.apache.sshkeys.util.test.JUnitTestSupport;
import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@TestMethodOrder(MethodName.class)
class Ssh2PublicKeyCodecTest extends JUnitTestSupport {
    private static final String ED25519_DATA = "AAAAC3NzaC1lZDI1NTE5AAAAIF8VUrKMHq16wqOC7l2co/wKgXrpzeJyQnf8mmfDqMCB";

    Ssh2PublicKeyCodecTest() {
        super();
    }

    @Test
    void keygenExportedFiles() throws Exception {
        for (String name : new String[] { "ed25519", "rsa" }) {
            SshKey rfc4716 = SshKeys.importPublicKey(getTestResourceBytes(name + "-rfc4716.pub"));
            SshKey openssh = SshKeys.importPublicKey(getTestResourceBytes(name + ".pub"));
            assertEquals(openssh, rfc4716, name);
            assertTrue(rfc4716.getComment().endsWith("converted by root@vm from OpenSSH"),
                    name + ": " + rfc4716.getComment());
        }
    }

    @Test
    void exportKeepsComment() throws Exception {
        SshKey key = SshKeys.importPublicKey(getTestResourceBytes("ed25519-rfc4716.pub"));
        String text = new String(key.exportPublicKey(SshKey.FORMAT_RFC4716), StandardCharsets.UTF_8);
        assertTrue(text.startsWith(Ssh2PublicKeyCodec.BEGIN_MARKER + "\n"
                                   + "Comment: \"256-bit ED25519, converted by root@vm from OpenSSH\"\n"),
                text);
        assertEquals(key, SshKeys.importPublicKey(text.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void continuedAndCaseInsensitiveHeaders() throws Exception {
        String text = Ssh2PublicKeyCodec.BEGIN_MARKER + "\n"
                      + "x-private: something\n"
                      + "COMMENT: \"split \\\n"
                      + "comment\"\n"
                      + ED25519_DATA + "\n"
                      + Ssh2PublicKeyCodec.END_MARKER + "\n";
        SshKey key = SshKeys.importPublicKey(text.getBytes(StandardCharsets.UTF_8));
        assertEquals("split comment", key.getComment());
    }

    @Test
    void noCommentHeader() throws Exception {
        String text = Ssh2PublicKeyCodec.BEGIN_MARKER + "\n"
                      + ED25519_DATA + "\n"
                      + Ssh2PublicKeyCodec.END_MARKER + "\n";
        SshKey key = SshKeys.importPublicKey(text.getBytes(StandardCharsets.UTF_8));
        assertFalse(key.hasComment(), "Unexpected comment");

        String exported = new String(key.exportPublicKey(SshKey.FORMAT_RFC4716), StandardCharsets.UTF_8);
        assertFalse(exported.contains("Comment:"), exported);
        assertArrayEquals(key.getPublicData(), SshKeys.importPublicKey(exported.getBytes(StandardCharsets.UTF_8))
                .getPublicData());
    }

    @Test
    void missingFooter() {
        String text = Ssh2PublicKeyCodec.BEGIN_MARKER + "\n" + ED25519_DATA + "\n";
        KeyImportException e = assertThrows(KeyImportException.class,
                () -> SshKeys.importPublicKey(text.getBytes(StandardCharsets.UTF_8)));
        assertEquals("Missing RFC 4716 footer", e.getMessage());
    }
}
