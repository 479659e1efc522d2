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

import java.util.List;
import java.util.Random;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.primitives.Ints;

/**
 * An Ethernet address, held in the low 48 bits of a long and printed as six
 * lower case hex pairs separated by colons.
 */
public final class MAC {

    private static final long MASK = 0xFFFFFFFFFFFFL;
    private static final long MULTICAST_BIT = 0x1L << 40;
    private static final long LOCAL_ADMIN_BIT = 0x2L << 40;

    private static final Splitter COLON = Splitter.on(':');

    private final long bits;

    private MAC(long bits) {
        this.bits = bits & MASK;
    }

    /**
     * A random unicast address with the locally administered bit set, so it
     * never collides with a vendor assigned one.
     */
    public static MAC random(Random rand) {
        return new MAC((rand.nextLong() | LOCAL_ADMIN_BIT) & ~MULTICAST_BIT);
    }

    /**
     * Parses "aa:bb:cc:dd:ee:ff", in either case.
     *
     * @throws IllegalArgumentException if the string is not of that form.
     */
    public static MAC parse(String str) {
        Preconditions.checkArgument(str != null, "MAC address is null");
        List<String> pairs = COLON.splitToList(str.trim());
        Preconditions.checkArgument(pairs.size() == 6,
                                    "invalid MAC address '%s'", str);
        long bits = 0;
        for (String pair : pairs) {
            Integer octet = pair.length() == 2 ? Ints.tryParse(pair, 16) : null;
            Preconditions.checkArgument(octet != null && octet >= 0,
                                        "invalid MAC address '%s'", str);
            bits = (bits << 8) | octet;
        }
        return new MAC(bits);
    }

    public boolean isUnicast() {
        return (bits & MULTICAST_BIT) == 0;
    }

    public boolean isLocallyAdministered() {
        return (bits & LOCAL_ADMIN_BIT) != 0;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(17);
        for (int shift = 40; shift >= 0; shift -= 8) {
            if (shift != 40) sb.append(':');
            sb.append(String.format("%02x", (bits >> shift) & 0xff));
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof MAC && ((MAC) obj).bits == bits;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(bits);
    }
}
