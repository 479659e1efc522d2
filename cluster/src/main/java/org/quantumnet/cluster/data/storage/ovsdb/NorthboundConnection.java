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

import com.fasterxml.jackson.databind.node.ArrayNode;

import org.quantumnet.cluster.data.storage.NorthboundConnectionException;

/**
 * A session with the OVN Northbound database server.
 */
public interface NorthboundConnection extends AutoCloseable {

    String DATABASE = "OVN_Northbound";

    /**
     * Opens the session, failing if the server cannot be reached within the
     * connect timeout or does not serve the Northbound database.
     */
    void connect() throws NorthboundConnectionException;

    boolean isConnected();

    /**
     * Executes the operations as one OVSDB transaction and returns the
     * result array, one element per operation plus, on commit failure, a
     * trailing error element.
     */
    ArrayNode transact(ArrayNode operations)
        throws NorthboundConnectionException;

    @Override
    void close();
}
