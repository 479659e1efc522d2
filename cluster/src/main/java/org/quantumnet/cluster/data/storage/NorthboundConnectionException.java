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

package org.quantumnet.cluster.data.storage;

/**
 * The Northbound database could not be reached, or the connection to it
 * failed while a request was in flight.
 */
public class NorthboundConnectionException extends NorthboundException {

    private static final long serialVersionUID = 1893021473210418337L;

    public NorthboundConnectionException(String message) {
        super(message);
    }

    public NorthboundConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
