/*
 * Copyright 2024 The QuantumNet Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.quantumnet.packets;

import java.net.InetAddress;
import java.util.Objects;

import com.google.common.net.InetAddresses;
import org.apache.commons.lang3.StringUtils;

/**
 * An IPv4 or IPv6 subnet in CIDR notation. The prefix length is optional;
 * if omitted, the subnet is the single host address (/32 or /128).
 */
public final class IPSubnet {

    public static final int IPV4_MAX_PREFIX = 32;
    public static final int IPV6_MAX_PREFIX = 128;

    private final String address;
    private final int prefixLength;
    private final boolean ipv6;
    private String string = null;

    private IPSubnet(String address, int prefixLength, boolean ipv6) {
        this.address = address;
        this.prefixLength = prefixLength;
        this.ipv6 = ipv6;
    }

    public String getAddress() {
        return address;
    }

    public int getPrefixLen() {
        return prefixLength;
    }

    public boolean isIpv6() {
        return ipv6;
    }

    /**
     * Whether this subnet covers the whole address space of its family,
     * i.e. 0.0.0.0/0 or ::/0.
     */
    public boolean isAny() {
        if (prefixLength != 0)
            return false;
        InetAddress inet = InetAddresses.forString(address);
        for (byte b : inet.getAddress()) {
            if (b != 0)
                return false;
        }
        return true;
    }

    /**
     * Construct an IPSubnet object from a CIDR notation string - e.g.
     * "192.168.0.1/16" or "fd00::/8". IPv6 is recognised by the presence
     * of a colon.
     *
     * IllegalArgumentException is thrown if the CIDR notation string is
     * invalid.
     */
    public static IPSubnet fromCidr(String cidr) {
        if (StringUtils.isBlank(cidr))
            throw new IllegalArgumentException(cidr + " is not a valid CIDR");

        String trimmed = cidr.trim();
        boolean ipv6 = StringUtils.contains(trimmed, ':');
        String addr = StringUtils.substringBefore(trimmed, "/");
        int maxPrefix = ipv6 ? IPV6_MAX_PREFIX : IPV4_MAX_PREFIX;

        if (!InetAddresses.isInetAddress(addr)
            || (!ipv6 && !StringUtils.contains(addr, '.')))
            throw new IllegalArgumentException(cidr + " is not a valid CIDR");

        int prefixLength = maxPrefix;
        if (StringUtils.contains(trimmed, '/')) {
            String prefix = StringUtils.substringAfter(trimmed, "/");
            if (!StringUtils.isNumeric(prefix) || prefix.length() > 3)
                throw new IllegalArgumentException(
                    cidr + " is not a valid CIDR");
            prefixLength = Integer.parseInt(prefix);
            if (prefixLength > maxPrefix)
                throw new IllegalArgumentException(
                    cidr + " has a prefix length above " + maxPrefix);
        }
        return new IPSubnet(addr, prefixLength, ipv6);
    }

    /**
     * Checks whether CIDR is in the correct format. Returns false if cidr
     * is null.
     */
    public static boolean isValidCidr(String cidr) {
        try {
            fromCidr(cidr);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    @Override
    public String toString() {
        if (string == null)
            string = address + "/" + prefixLength;
        return string;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || this.getClass() != o.getClass())
            return false;

        IPSubnet that = (IPSubnet) o;
        return prefixLength == that.prefixLength &&
               ipv6 == that.ipv6 &&
               Objects.equals(address, that.address);
    }

    @Override
    public int hashCode() {
        return Objects.hash(address, prefixLength, ipv6);
    }
}
