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


package org.apache.sshkeys.config.keys.loader;

/**
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public class AESPrivateKeyObfuscator extends AbstractPrivateKeyObfuscator {
    public static final String CIPHER_NAME = "AES";
    public static final int IV_SIZE = 16;

    public static final AESPrivateKeyObfuscator AES128 = new AESPrivateKeyObfuscator(128);
    public static final AESPrivateKeyObfuscator AES192 = new AESPrivateKeyObfuscator(192);
    public static final AESPrivateKeyObfuscator AES256 = new AESPrivateKeyObfuscator(256);

    public AESPrivateKeyObfuscator(int keyLength) {
        super("aes" + keyLength + "-cbc", CIPHER_NAME + "-" + keyLength + "-" + DEFAULT_CIPHER_MODE,
              CIPHER_NAME, keyLength / Byte.SIZE, IV_SIZE);
    }
}
