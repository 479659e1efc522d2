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
 * Thrown when a caller attempts to create an object when an object of the
 * same class with the same key already exists.
 */
public class ObjectExistsException extends NorthboundException {

    private static final long serialVersionUID = 6075751393345072018L;

    private final Class<?> clazz;
    private final Object id;

    public ObjectExistsException(Class<?> clazz, Object id) {
        this(clazz, id, null);
    }

    public ObjectExistsException(Class<?> clazz, Object id, Throwable cause) {
        super("A(n) " + clazz.getSimpleName() + " with ID " + id
              + " already exists.", cause);
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
