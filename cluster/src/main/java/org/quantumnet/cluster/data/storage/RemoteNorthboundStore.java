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
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.quantumnet.cluster.data.ovn.NorthboundObject;
import org.quantumnet.cluster.data.ovn.NorthboundTable;
import org.quantumnet.cluster.data.storage.ovsdb.NorthboundConnection;
import org.quantumnet.cluster.data.storage.ovsdb.OvsdbRowCodec;
import org.quantumnet.cluster.data.storage.ovsdb.Transaction;

/**
 * Northbound store backed by an OVSDB server. Every call, and every
 * {@link #multi} batch as a whole, is executed as a single OVSDB
 * transaction, so the database's transactional guarantees are the only
 * source of atomicity.
 *
 * Preconditions are checked inside the transaction with "wait" operations
 * that time out immediately: a create first waits for the key to be
 * absent, updates and mutations wait for it to be present.
 */
public class RemoteNorthboundStore implements NorthboundStore {

    private static final Logger log =
        LoggerFactory.getLogger(RemoteNorthboundStore.class);

    /** Error reported by the server when a wait operation fails. */
    static final String WAIT_FAILED = "timed out";

    private final NorthboundConnection connection;
    private final OvsdbRowCodec codec = new OvsdbRowCodec();

    public RemoteNorthboundStore(NorthboundConnection connection) {
        this.connection = connection;
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
            throws NorthboundException {
        List<T> found = select(clazz, key);
        if (found.isEmpty())
            throw new NotFoundException(clazz, key);
        return found.get(0);
    }

    @Override
    public <T extends NorthboundObject> List<T> getAll(Class<T> clazz)
            throws NorthboundException {
        return select(clazz, null);
    }

    @Override
    public boolean exists(Class<? extends NorthboundObject> clazz,
                          String key) throws NorthboundException {
        return !select(clazz, key).isEmpty();
    }

    private <T extends NorthboundObject> List<T> select(Class<T> clazz,
                                                        String key)
            throws NorthboundException {
        NorthboundTable table = NorthboundTable.forClass(clazz);
        Transaction tx = new Transaction(codec);
        tx.select(table, key);
        ArrayNode results = execute(tx, new HashMap<>());

        List<T> objects = new ArrayList<>();
        for (JsonNode row : results.path(0).path("rows")) {
            objects.add(codec.decode((ObjectNode) row, clazz));
        }
        return objects;
    }

    @Override
    public void multi(List<StorageOp> ops) throws NorthboundException {
        Transaction tx = new Transaction(codec);
        Map<Integer, NorthboundException> waitFailures = new HashMap<>();

        for (StorageOp op : ops) {
            NorthboundTable table = NorthboundTable.forClass(op.clazz());
            String key = op.key();

            if (op instanceof StorageOp.CreateOp) {
                NorthboundObject obj = ((StorageOp.CreateOp) op).obj;
                Preconditions.checkArgument(key != null, "%s has no key", obj);
                if (!table.keyedByUuid()) {
                    waitFailures.put(
                        tx.waitRows(table, key,
                                    Transaction.WAIT_UNTIL_EQUAL),
                        new ObjectExistsException(op.clazz(), key));
                }
                tx.insert(table, obj.uuid, codec.encode(obj));
            } else if (op instanceof StorageOp.UpdateOp) {
                waitFailures.put(
                    tx.waitRows(table, key, Transaction.WAIT_UNTIL_NOT_EQUAL),
                    new NotFoundException(op.clazz(), key));
                tx.update(table, key,
                          codec.encode(((StorageOp.UpdateOp) op).obj));
            } else if (op instanceof StorageOp.DeleteOp) {
                tx.delete(table, key);
            } else if (op instanceof StorageOp.MutateOp) {
                StorageOp.MutateOp mutate = (StorageOp.MutateOp) op;
                waitFailures.put(
                    tx.waitRows(table, key, Transaction.WAIT_UNTIL_NOT_EQUAL),
                    new NotFoundException(op.clazz(), key));
                ArrayNode values = JsonNodeFactory.instance.arrayNode();
                mutate.values.forEach(values::add);
                tx.mutate(table, key, mutate.column,
                          mutate.insert ? Transaction.MUTATE_INSERT
                                        : Transaction.MUTATE_DELETE,
                          codec.encodeValue(values,
                                            table.isReference(mutate.column)));
            } else {
                throw new IllegalArgumentException(
                    "Unsupported operation " + op);
            }
        }

        if (tx.isEmpty()) return;
        execute(tx, waitFailures);
        log.debug("Committed transaction of {} operations", tx.size());
    }

    /**
     * Runs the transaction and maps the first failed operation to an
     * exception. The server aborts the whole transaction when any operation
     * fails.
     */
    private ArrayNode execute(Transaction tx,
                              Map<Integer, NorthboundException> waitFailures)
            throws NorthboundException {
        ArrayNode results = connection.transact(tx.operations());
        for (int i = 0; i < results.size(); i++) {
            JsonNode error = results.get(i).get("error");
            if (error == null || error.isNull()) continue;

            NorthboundException expected = waitFailures.get(i);
            if (expected != null && WAIT_FAILED.equals(error.asText()))
                throw expected;
            String details = results.get(i).path("details").asText("");
            throw new NorthboundException(
                "Northbound transaction failed at operation " + i + ": "
                + error.asText() + (details.isEmpty() ? "" : " (" + details
                                                        + ")"));
        }
        return results;
    }

    @Override
    public boolean isConnected() {
        return connection.isConnected();
    }

    @Override
    public void close() {
        connection.close();
    }
}
