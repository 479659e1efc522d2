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
 * Thrown when a caller looks up or modifies an object that is not in the
 * store.
 */
public class NotFoundException extends NorthboundException {

    private static final long serialVersionUID = -4736018302183574129L;

    private final Class<?> clazz;
    private final Object id;

    public NotFoundException(Class<?> clazz, Object id) {
        this(clazz, id, null);
    }

    public NotFoundException(Class<?> clazz, Object id, Throwable cause) {
        super("There is no " + clazz.getSimpleName() + " with ID " + id + ".",
              cause);
        this.clazz = clazz;
        this.id = id;
    }

    public Class<?> getClazz() {
        return clazz;
    }

    public Object getId() {
        return id;
    }
}
