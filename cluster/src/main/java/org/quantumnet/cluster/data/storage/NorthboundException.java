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
 * Base class of the errors raised by Northbound stores.
 */
public class NorthboundException extends Exception {

    private static final long serialVersionUID = 3319286530851197622L;

    public NorthboundException(String message) {
        super(message);
    }

    public NorthboundException(String message, Throwable cause) {
        super(message, cause);
    }
}
