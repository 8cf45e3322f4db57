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
 * Single and triple (EDE3) DES obfuscation
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public class DESPrivateKeyObfuscator extends AbstractPrivateKeyObfuscator {
    public static final int IV_SIZE = 8;

    public static final DESPrivateKeyObfuscator DES = new DESPrivateKeyObfuscator("des-cbc", "DES-CBC", "DES", 8);
    public static final DESPrivateKeyObfuscator DES_EDE3
            = new DESPrivateKeyObfuscator("des3-cbc", "DES-EDE3-CBC", "DESede", 24 /* hardwired size for 3DES */);

    public DESPrivateKeyObfuscator(String cipherName, String dekName, String jceAlgorithm, int keySize) {
        super(cipherName, dekName, jceAlgorithm, keySize, IV_SIZE);
    }
}
