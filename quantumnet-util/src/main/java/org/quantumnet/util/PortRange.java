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

package org.quantumnet.util;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * A closed range of transport ports, both ends within [0, 65535].
 */
public final class PortRange {

    public static final int MAX_PORT = 65535;

    private final int first;
    private final int last;

    private PortRange(int first, int last) {
        this.first = first;
        this.last = last;
    }

    /**
     * @throws IllegalArgumentException if either end is not a port number
     *         or the range is inverted.
     */
    public static PortRange of(int first, int last) {
        checkPort(first);
        checkPort(last);
        Preconditions.checkArgument(first <= last,
                                    "port range %s-%s is inverted",
                                    first, last);
        return new PortRange(first, last);
    }

    public static PortRange single(int port) {
        return of(port, port);
    }

    /**
     * @throws IllegalArgumentException if the value is not a port number.
     */
    public static int checkPort(int port) {
        Preconditions.checkArgument(port >= 0 && port <= MAX_PORT,
                                    "port %s out of range", port);
        return port;
    }

    public int first() {
        return first;
    }

    public int last() {
        return last;
    }

    public boolean isSingle() {
        return first == last;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PortRange)) return false;
        PortRange other = (PortRange) obj;
        return first == other.first && last == other.last;
    }

    @Override
    public int hashCode() {
        return 31 * first + last;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("first", first)
            .add("last", last)
            .toString();
    }
}
