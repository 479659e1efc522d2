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

import java.util.Collection;
import java.util.Iterator;
import java.util.Map;

import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.quantumnet.cluster.data.ovn.NorthboundObject;
import org.quantumnet.cluster.data.ovn.NorthboundTable;

/**
 * Converts Northbound objects to and from rows in the OVSDB JSON notation
 * of RFC 7047: sets as ["set", [...]], maps as ["map", [[k, v], ...]] and
 * row references as ["uuid", id]. Null optional columns are empty sets.
 */
public class OvsdbRowCodec {

    public static final String SET = "set";
    public static final String MAP = "map";
    public static final String UUID = "uuid";
    public static final String NAMED_UUID = "named-uuid";

    private final ObjectMapper mapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);

    private final JsonNodeFactory nodes = JsonNodeFactory.instance;

    public ObjectMapper mapper() {
        return mapper;
    }

    /**
     * The row of the object, without its _uuid column.
     */
    public ObjectNode encode(NorthboundObject obj) {
        NorthboundTable table = NorthboundTable.forClass(obj.getClass());
        ObjectNode tree = mapper.valueToTree(obj);
        ObjectNode row = nodes.objectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = tree.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (NorthboundTable.UUID_COLUMN.equals(field.getKey())) continue;
            row.set(field.getKey(),
                    encodeValue(field.getValue(),
                                table.isReference(field.getKey())));
        }
        return row;
    }

    /**
     * Encodes one column value. Reference columns hold row UUIDs.
     */
    public JsonNode encodeValue(JsonNode value, boolean reference) {
        if (value == null || value.isNull()) {
            return pair(SET, nodes.arrayNode());
        } else if (value.isArray()) {
            ArrayNode elements = nodes.arrayNode();
            for (JsonNode element : value) {
                elements.add(reference ? uuid(element.asText()) : element);
            }
            return pair(SET, elements);
        } else if (value.isObject()) {
            ArrayNode entries = nodes.arrayNode();
            Iterator<Map.Entry<String, JsonNode>> it = value.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                entries.add(nodes.arrayNode().add(e.getKey()).add(e.getValue()));
            }
            return pair(MAP, entries);
        } else if (reference) {
            return uuid(value.asText());
        }
        return value;
    }

    public ArrayNode uuid(String uuid) {
        return pair(UUID, nodes.textNode(uuid));
    }

    /**
     * Builds an object from a row returned by the server.
     */
    public <T extends NorthboundObject> T decode(ObjectNode row,
                                                 Class<T> clazz) {
        JavaType type = mapper.constructType(clazz);
        BeanDescription bean =
            mapper.getDeserializationConfig().introspect(type);

        ObjectNode tree = nodes.objectNode();
        for (BeanPropertyDefinition prop : bean.findProperties()) {
            JsonNode value = row.get(prop.getName());
            if (value == null) continue;
            JsonNode plain = decodeValue(value);
            Class<?> raw = prop.getRawPrimaryType();
            boolean container = Collection.class.isAssignableFrom(raw)
                                || Map.class.isAssignableFrom(raw);
            if (!container && plain.isArray()) {
                // optional scalar column: empty set or a single element
                if (plain.size() == 0) continue;
                plain = plain.get(0);
            }
            tree.set(prop.getName(), plain);
        }
        return mapper.convertValue(tree, clazz);
    }

    /**
     * Strips the OVSDB notation from a value: sets become arrays, maps
     * become objects and references become their UUID string.
     */
    public JsonNode decodeValue(JsonNode value) {
        if (!value.isArray() || value.size() != 2 || !value.get(0).isTextual())
            return value;

        String tag = value.get(0).asText();
        JsonNode body = value.get(1);
        switch (tag) {
            case UUID:
            case NAMED_UUID:
                return body;
            case SET: {
                ArrayNode elements = nodes.arrayNode();
                for (JsonNode element : body) {
                    elements.add(decodeValue(element));
                }
                return elements;
            }
            case MAP: {
                ObjectNode map = nodes.objectNode();
                for (JsonNode entry : body) {
                    map.set(entry.get(0).asText(), decodeValue(entry.get(1)));
                }
                return map;
            }
            default:
                return value;
        }
    }

    private ArrayNode pair(String tag, JsonNode body) {
        return nodes.arrayNode().add(tag).add(body);
    }
}
