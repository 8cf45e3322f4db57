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

package org.apache.sshkeys.common.util;

/**
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public final class NumberUtils {
    private NumberUtils() {
        throw new UnsupportedOperationException("No instance allowed");
    }

    /**
     * @param  value The original value
     * @param  blockSize The alignment block size - must be positive
     * @return The smallest multiple of the block size that is greater or equal to the value
     */
    public static int roundUp(int value, int blockSize) {
        ValidateUtils.checkTrue(blockSize > 0, "Non-positive block size: %d", blockSize);
        int remainder = value % blockSize;
        return (remainder == 0) ? value : value + (blockSize - remainder);
    }

    public static boolean isPositiveNumber(CharSequence cs) {
        if (GenericUtils.isEmpty(cs)) {
            return false;
        }

        for (int index = 0; index < cs.length(); index++) {
            char c = cs.charAt(index);
            if ((c < '0') || (c > '9')) {
                return false;
            }
        }

        return true;
    }

    public static int length(byte... a) {
        return (a == null) ? 0 : a.length;
    }

    public static boolean isEmpty(byte[] a) {
        return length(a) <= 0;
    }
}
