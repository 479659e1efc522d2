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

import java.util.List;

import org.quantumnet.cluster.data.ovn.NorthboundObject;

/**
 * Storage of Northbound objects. Objects are addressed by their class and
 * their key: the name for named tables, the UUID otherwise.
 *
 * Implementations are safe for use by concurrent callers. Objects passed in
 * and returned are never shared with the store's own state.
 */
public interface NorthboundStore extends AutoCloseable {

    /**
     * Persists the specified object. Its UUID and key must already be set.
     */
    void create(NorthboundObject obj)
        throws ObjectExistsException, NorthboundException;

    /**
     * Replaces the stored object having the same key as the given one.
     */
    void update(NorthboundObject obj)
        throws NotFoundException, NorthboundException;

    /**
     * Deletes the specified object. Deleting a missing object is a no-op.
     */
    void delete(Class<? extends NorthboundObject> clazz, String key)
        throws NorthboundException;

    /**
     * Gets the specified instance of the specified class.
     */
    <T extends NorthboundObject> T get(Class<T> clazz, String key)
        throws NotFoundException, NorthboundException;

    /**
     * Gets all the instances of the specified class.
     */
    <T extends NorthboundObject> List<T> getAll(Class<T> clazz)
        throws NorthboundException;

    /**
     * Returns true if the specified object exists.
     */
    boolean exists(Class<? extends NorthboundObject> clazz, String key)
        throws NorthboundException;

    /**
     * Applies the operations as one atomic unit: either all of them take
     * effect or none does.
     */
    void multi(List<StorageOp> ops) throws NorthboundException;

    boolean isConnected();

    @Override
    void close();
}
