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

import java.math.BigInteger;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Objects;

import org.apache.sshkeys.common.util.GenericUtils;
import org.apache.sshkeys.common.util.ValidateUtils;

/**
 * An IPv4 or IPv6 network in CIDR notation as used by the {@code source-address} certificate option. A plain
 * address is a host network ({@code /32} or {@code /128}). Host bits beyond the prefix must be zero.
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public final class SourceAddress {
    private final InetAddress address;
    private final int prefixLength;

    private SourceAddress(InetAddress address, int prefixLength) {
        this.address = address;
        this.prefixLength = prefixLength;
    }

    /**
     * @param  value                    An address or {@code address/prefix} - literal addresses only, no host names
     * @return                          The parsed network
     * @throws IllegalArgumentException If the value is not a valid network
     */
    public static SourceAddress valueOf(String value) {
        ValidateUtils.checkNotNullAndNotEmpty(value, "No network value");
        int pos = value.indexOf('/');
        String host = (pos < 0) ? value : value.substring(0, pos);
        InetAddress addr = parseLiteral(host);
        int maxBits = addr.getAddress().length * Byte.SIZE;

        int prefix = maxBits;
        if (pos >= 0) {
            String bits = value.substring(pos + 1);
            ValidateUtils.checkTrue(isDecimal(bits), "Invalid prefix length in %s", value);
            prefix = Integer.parseInt(bits);
            ValidateUtils.checkTrue(prefix <= maxBits, "Prefix length too large in %s", value);
        }

        BigInteger bits = new BigInteger(1, addr.getAddress());
        BigInteger hostMask = BigInteger.ONE.shiftLeft(maxBits - prefix).subtract(BigInteger.ONE);
        ValidateUtils.checkTrue(bits.and(hostMask).signum() == 0, "%s has host bits set", value);
        return new SourceAddress(addr, prefix);
    }

    public InetAddress getAddress() {
        return address;
    }

    public int getPrefixLength() {
        return prefixLength;
    }

    public boolean isIPv4() {
        return address instanceof Inet4Address;
    }

    private static InetAddress parseLiteral(String host) {
        if (host.indexOf(':') >= 0) {
            // an IPv6 literal is never resolved
            try {
                return InetAddress.getByName(host);
            } catch (UnknownHostException e) {
                throw new IllegalArgumentException("Invalid IPv6 address: " + host, e);
            }
        }

        String[] octets = GenericUtils.split(host, '.');
        ValidateUtils.checkTrue(GenericUtils.length(octets) == 4, "Invalid IPv4 address: %s", host);
        byte[] raw = new byte[4];
        for (int index = 0; index < raw.length; index++) {
            String o = octets[index];
            ValidateUtils.checkTrue(isDecimal(o) && (o.length() <= 3), "Invalid IPv4 address: %s", host);
            int v = Integer.parseInt(o);
            ValidateUtils.checkTrue(v <= 0xFF, "Invalid IPv4 address: %s", host);
            raw[index] = (byte) v;
        }

        try {
            return InetAddress.getByAddress(raw);
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException("Invalid IPv4 address: " + host, e);
        }
    }

    private static boolean isDecimal(String s) {
        if (GenericUtils.isEmpty(s)) {
            return false;
        }
        for (int index = 0; index < s.length(); index++) {
            char c = s.charAt(index);
            if ((c < '0') || (c > '9')) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return Objects.hash(address, prefixLength);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if ((obj == null) || (obj.getClass() != getClass())) {
            return false;
        }
        SourceAddress other = (SourceAddress) obj;
        return (prefixLength == other.prefixLength) && address.equals(other.address);
    }

    @Override
    public String toString() {
        return address.getHostAddress() + "/" + prefixLength;
    }
}
