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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.quantumnet.cluster.data.ovn.NorthboundObject;
import org.quantumnet.cluster.data.ovn.NorthboundTable;

/**
 * Process-local Northbound store, used for development and tests and when
 * the real database cannot be reached. Every object lives in a per-table
 * map keyed by the object's key. The store keeps its own copies of the
 * objects so callers can never change its state behind its back.
 */
public class InMemoryNorthboundStore implements NorthboundStore {

    private static final Logger log =
        LoggerFactory.getLogger(InMemoryNorthboundStore.class);

    private final ObjectMapper mapper = new ObjectMapper();

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private Map<NorthboundTable, Map<String, NorthboundObject>> tables =
        emptyTables();

    private static Map<NorthboundTable, Map<String, NorthboundObject>>
            emptyTables() {
        Map<NorthboundTable, Map<String, NorthboundObject>> tables =
            new HashMap<>();
        for (NorthboundTable table : NorthboundTable.values()) {
            tables.put(table, new HashMap<>());
        }
        return tables;
    }

    @Override
    public void create(NorthboundObject obj) throws NorthboundException {
        multi(List.of(StorageOp.create(obj)));
    }

    @Override
    public void update(NorthboundObject obj) throws NorthboundException {
        multi(List.of(StorageOp.update(obj)));
    }

    @Override
    public void delete(Class<? extends NorthboundObject> clazz, String key)
            throws NorthboundException {
        multi(List.of(StorageOp.delete(clazz, key)));
    }

    @Override
    public <T extends NorthboundObject> T get(Class<T> clazz, String key)
            throws NotFoundException {
        lock.readLock().lock();
        try {
            NorthboundObject obj =
                tables.get(NorthboundTable.forClass(clazz)).get(key);
            if (obj == null)
                throw new NotFoundException(clazz, key);
            return clazz.cast(obj.copy());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public <T extends NorthboundObject> List<T> getAll(Class<T> clazz) {
        lock.readLock().lock();
        try {
            Map<String, NorthboundObject> table =
                tables.get(NorthboundTable.forClass(clazz));
            List<T> all = new ArrayList<>(table.size());
            for (NorthboundObject obj : table.values()) {
                all.add(clazz.cast(obj.copy()));
            }
            return all;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean exists(Class<? extends NorthboundObject> clazz,
                          String key) {
        lock.readLock().lock();
        try {
            return tables.get(NorthboundTable.forClass(clazz))
                         .containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Applies the operations to a copy of the tables, which replaces the
     * current tables only when every operation succeeded.
     */
    @Override
    public void multi(List<StorageOp> ops) throws NorthboundException {
        lock.writeLock().lock();
        try {
            Map<NorthboundTable, Map<String, NorthboundObject>> staged =
                new HashMap<>();
            for (Map.Entry<NorthboundTable, Map<String, NorthboundObject>>
                     e : tables.entrySet()) {
                staged.put(e.getKey(), new HashMap<>(e.getValue()));
            }
            for (StorageOp op : ops) {
                apply(staged, op);
            }
            tables = staged;
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Applied {} operations", ops.size());
    }

    private void apply(Map<NorthboundTable, Map<String, NorthboundObject>>
                           staged, StorageOp op)
            throws NorthboundException {
        Map<String, NorthboundObject> table =
            staged.get(NorthboundTable.forClass(op.clazz()));
        String key = op.key();

        if (op instanceof StorageOp.CreateOp) {
            NorthboundObject obj = ((StorageOp.CreateOp) op).obj;
            Preconditions.checkArgument(key != null,
                                        "%s has no key", obj);
            if (table.containsKey(key))
                throw new ObjectExistsException(op.clazz(), key);
            table.put(key, obj.copy());
        } else if (op instanceof StorageOp.UpdateOp) {
            if (!table.containsKey(key))
                throw new NotFoundException(op.clazz(), key);
            table.put(key, ((StorageOp.UpdateOp) op).obj.copy());
        } else if (op instanceof StorageOp.DeleteOp) {
            table.remove(key);
        } else if (op instanceof StorageOp.MutateOp) {
            NorthboundObject current = table.get(key);
            if (current == null)
                throw new NotFoundException(op.clazz(), key);
            table.put(key, mutate(current, (StorageOp.MutateOp) op));
        } else {
            throw new IllegalArgumentException("Unsupported operation " + op);
        }
    }

    private NorthboundObject mutate(NorthboundObject obj,
                                    StorageOp.MutateOp op) {
        ObjectNode tree = mapper.valueToTree(obj);
        JsonNode column = tree.get(op.column);
        if (column != null && !column.isArray() && !column.isNull())
            throw new IllegalArgumentException(
                op.column + " is not a set column of "
                + op.clazz.getSimpleName());

        ArrayNode values = column instanceof ArrayNode
                           ? (ArrayNode) column : tree.putArray(op.column);
        for (String value : op.values) {
            boolean found = false;
            Iterator<JsonNode> it = values.elements();
            while (it.hasNext()) {
                if (value.equals(it.next().asText())) {
                    found = true;
                    if (!op.insert) it.remove();
                }
            }
            if (op.insert && !found) values.add(value);
        }
        return mapper.convertValue(tree, obj.getClass());
    }

    @Override
    public boolean isConnected() {
        return true;
    }

    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            tables = emptyTables();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
