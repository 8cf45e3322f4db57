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

import java.util.Arrays;

import javax.crypto.AEADBadTagException;

import org.apache.sshkeys.common.util.ValidateUtils;
import org.apache.sshkeys.common.util.buffer.BufferUtils;
import org.bouncycastle.crypto.engines.ChaChaEngine;
import org.bouncycastle.crypto.macs.Poly1305;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.crypto.params.ParametersWithIV;

/**
 * AEAD cipher based on the
 * <a href="https://github.com/openbsd/src/blob/master/usr.bin/ssh/PROTOCOL.chacha20poly1305">OpenSSH
 * ChaCha20-Poly1305</a> cipher extension. The first 32 bytes of the key drive the payload stream, the Poly1305 key is
 * the first half of key-stream block zero and the payload is encrypted starting at block one. The initialization
 * vector is the 64-bit big-endian sequence number - an empty one stands for sequence number zero.
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public class ChaCha20Poly1305Cipher implements Cipher {
    public static final int KEY_BYTES = 32;
    public static final int NONCE_BYTES = Long.BYTES;
    public static final int TAG_BYTES = 16;
    public static final int BLOCK_BYTES = 64;

    protected final ChaChaEngine bodyEngine = new ChaChaEngine();
    protected final Poly1305 mac = new Poly1305();
    protected Mode mode;

    public ChaCha20Poly1305Cipher() {
        super();
    }

    @Override
    public String getAlgorithm() {
        return "ChaCha20";
    }

    @Override
    public String getTransformation() {
        return "ChaCha20";
    }

    @Override
    public int getIVSize() {
        return 0;
    }

    @Override
    public int getAuthenticationTagSize() {
        return TAG_BYTES;
    }

    @Override
    public int getCipherBlockSize() {
        return 8;
    }

    @Override
    public int getKdfSize() {
        return 2 * KEY_BYTES;
    }

    @Override
    public int getKeySize() {
        return 512;
    }

    @Override
    public void init(Mode mode, byte[] key, byte[] iv) throws Exception {
        ValidateUtils.checkTrue(key.length >= KEY_BYTES, "Insufficient key data: %d", key.length);
        this.mode = mode;

        byte[] nonce = new byte[NONCE_BYTES];
        if ((iv != null) && (iv.length > 0)) {
            ValidateUtils.checkTrue(iv.length == NONCE_BYTES, "Bad ChaCha20 nonce length: %d", iv.length);
            System.arraycopy(iv, 0, nonce, 0, NONCE_BYTES);
        }

        bodyEngine.init(true, new ParametersWithIV(new KeyParameter(Arrays.copyOfRange(key, 0, KEY_BYTES)), nonce));

        byte[] block = new byte[BLOCK_BYTES];
        bodyEngine.processBytes(block, 0, block.length, block, 0);
        mac.init(new KeyParameter(Arrays.copyOfRange(block, 0, KEY_BYTES)));
    }

    @Override
    public void updateAAD(byte[] data, int offset, int length) throws Exception {
        ValidateUtils.checkState(mode != null, "Cipher not initialized");
        mac.update(data, offset, length);
    }

    @Override
    public void update(byte[] input, int inputOffset, int inputLen) throws Exception {
        ValidateUtils.checkState(mode != null, "Cipher not initialized");

        if (mode == Mode.Decrypt) {
            mac.update(input, inputOffset, inputLen);
            byte[] actual = new byte[TAG_BYTES];
            mac.doFinal(actual, 0);
            byte[] expected = Arrays.copyOfRange(input, inputOffset + inputLen, inputOffset + inputLen + TAG_BYTES);
            if (!BufferUtils.equals(expected, actual)) {
                throw new AEADBadTagException("Tag mismatch");
            }
        }

        bodyEngine.processBytes(input, inputOffset, inputLen, input, inputOffset);

        if (mode == Mode.Encrypt) {
            mac.update(input, inputOffset, inputLen);
            mac.doFinal(input, inputOffset + inputLen);
        }
    }

    @Override
    public String toString() {
        return "chacha20-poly1305";
    }
}
