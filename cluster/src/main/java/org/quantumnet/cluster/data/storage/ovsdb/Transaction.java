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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.quantumnet.cluster.data.ovn.NorthboundTable;

/**
 * Builder of the operation array of an OVSDB "transact" request. Every
 * method appends one operation and returns its index in the array, which
 * is also the index of its result.
 */
public class Transaction {

    public static final String WAIT_UNTIL_EQUAL = "==";
    public static final String WAIT_UNTIL_NOT_EQUAL = "!=";
    public static final String MUTATE_INSERT = "insert";
    public static final String MUTATE_DELETE = "delete";

    private final JsonNodeFactory nodes = JsonNodeFactory.instance;
    private final ArrayNode ops = nodes.arrayNode();
    private final OvsdbRowCodec codec;

    public Transaction(OvsdbRowCodec codec) {
        this.codec = codec;
    }

    public ArrayNode operations() {
        return ops;
    }

    public int size() {
        return ops.size();
    }

    public boolean isEmpty() {
        return ops.size() == 0;
    }

    /**
     * Inserts a row with a UUID chosen by the client.
     */
    public int insert(NorthboundTable table, String uuid, ObjectNode row) {
        ObjectNode op = op("insert", table);
        op.set("row", row);
        if (uuid != null) op.put("uuid", uuid);
        return add(op);
    }

    public int update(NorthboundTable table, String key, ObjectNode row) {
        ObjectNode op = op("update", table);
        op.set("where", whereKey(table, key));
        op.set("row", row);
        return add(op);
    }

    public int mutate(NorthboundTable table, String key, String column,
                      String mutator, JsonNode value) {
        ObjectNode op = op("mutate", table);
        op.set("where", whereKey(table, key));
        op.set("mutations", nodes.arrayNode().add(
            nodes.arrayNode().add(column).add(mutator).add(value)));
        return add(op);
    }

    public int delete(NorthboundTable table, String key) {
        ObjectNode op = op("delete", table);
        op.set("where", whereKey(table, key));
        return add(op);
    }

    /**
     * Selects the row with the given key, or every row when the key is
     * null.
     */
    public int select(NorthboundTable table, String key) {
        ObjectNode op = op("select", table);
        op.set("where", key == null ? nodes.arrayNode()
                                    : whereKey(table, key));
        return add(op);
    }

    /**
     * Aborts the transaction unless the set of rows with the given key is
     * empty ({@link #WAIT_UNTIL_EQUAL}) or not empty
     * ({@link #WAIT_UNTIL_NOT_EQUAL}).
     */
    public int waitRows(NorthboundTable table, String key, String until) {
        ObjectNode op = op("wait", table);
        op.put("timeout", 0);
        op.set("where", whereKey(table, key));
        op.set("columns", nodes.arrayNode().add(NorthboundTable.UUID_COLUMN));
        op.put("until", until);
        op.set("rows", nodes.arrayNode());
        return add(op);
    }

    private ArrayNode whereKey(NorthboundTable table, String key) {
        JsonNode value = table.keyedByUuid() ? codec.uuid(key)
                                             : nodes.textNode(key);
        return nodes.arrayNode().add(
            nodes.arrayNode().add(table.keyColumn()).add("==").add(value));
    }

    private ObjectNode op(String name, NorthboundTable table) {
        ObjectNode op = nodes.objectNode();
        op.put("op", name);
        op.put("table", table.tableName());
        return op;
    }

    private int add(ObjectNode op) {
        ops.add(op);
        return ops.size() - 1;
    }
}
