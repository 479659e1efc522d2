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

package org.quantumnet.cluster.data.storage.ovsdb;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.net.HostAndPort;
import org.apache.commons.lang3.StringUtils;

/**
 * An OVSDB server address of the form "tcp:HOST:PORT" or "ssl:HOST:PORT".
 * IPv6 hosts are written in brackets, e.g. "tcp:[::1]:6641".
 */
public final class OvsdbEndpoint {

    public enum Transport { TCP, SSL }

    private final Transport transport;
    private final String host;
    private final int port;

    public OvsdbEndpoint(Transport transport, String host, int port) {
        this.transport = Preconditions.checkNotNull(transport);
        this.host = Preconditions.checkNotNull(host);
        Preconditions.checkArgument(port > 0 && port <= 65535,
                                    "invalid port %s", port);
        this.port = port;
    }

    /**
     * Parses an endpoint string.
     *
     * @throws IllegalArgumentException if the string is empty or malformed.
     */
    public static OvsdbEndpoint parse(String address) {
        if (StringUtils.isBlank(address))
            throw new IllegalArgumentException("empty OVSDB address");

        String trimmed = address.trim();
        String scheme = StringUtils.substringBefore(trimmed, ":");
        String rest = StringUtils.substringAfter(trimmed, ":");

        Transport transport;
        if ("tcp".equalsIgnoreCase(scheme)) {
            transport = Transport.TCP;
        } else if ("ssl".equalsIgnoreCase(scheme)) {
            transport = Transport.SSL;
        } else {
            throw new IllegalArgumentException(
                "unsupported OVSDB address " + address);
        }

        HostAndPort hp;
        try {
            hp = HostAndPort.fromString(rest);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                "malformed OVSDB address " + address, e);
        }
        if (!hp.hasPort() || hp.getHost().isEmpty())
            throw new IllegalArgumentException(
                "OVSDB address " + address + " needs a host and a port");
        return new OvsdbEndpoint(transport, hp.getHost(), hp.getPort());
    }

    public Transport getTransport() {
        return transport;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof OvsdbEndpoint)) return false;
        OvsdbEndpoint other = (OvsdbEndpoint) obj;
        return transport == other.transport
               && host.equals(other.host) && port == other.port;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(transport, host, port);
    }

    @Override
    public String toString() {
        return transport.name().toLowerCase() + ":"
               + HostAndPort.fromParts(host, port);
    }
}
