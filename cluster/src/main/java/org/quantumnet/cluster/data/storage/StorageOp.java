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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import org.quantumnet.cluster.data.ovn.NorthboundObject;

/**
 * One step of a {@link NorthboundStore#multi} batch.
 */
public abstract class StorageOp {

    private StorageOp() {}

    public static CreateOp create(NorthboundObject obj) {
        return new CreateOp(obj);
    }

    public static UpdateOp update(NorthboundObject obj) {
        return new UpdateOp(obj);
    }

    public static DeleteOp delete(Class<? extends NorthboundObject> clazz,
                                  String key) {
        return new DeleteOp(clazz, key);
    }

    /** Adds the values to the set column of the object. */
    public static MutateOp insert(Class<? extends NorthboundObject> clazz,
                                  String key, String column,
                                  List<String> values) {
        return new MutateOp(clazz, key, column, true, values);
    }

    public static MutateOp insert(Class<? extends NorthboundObject> clazz,
                                  String key, String column, String value) {
        return insert(clazz, key, column, ImmutableList.of(value));
    }

    /** Removes the values from the set column of the object. */
    public static MutateOp remove(Class<? extends NorthboundObject> clazz,
                                  String key, String column,
                                  List<String> values) {
        return new MutateOp(clazz, key, column, false, values);
    }

    public static MutateOp remove(Class<? extends NorthboundObject> clazz,
                                  String key, String column, String value) {
        return remove(clazz, key, column, ImmutableList.of(value));
    }

    public abstract Class<? extends NorthboundObject> clazz();

    public abstract String key();

    public static final class CreateOp extends StorageOp {
        public final NorthboundObject obj;

        CreateOp(NorthboundObject obj) {
            this.obj = obj;
        }

        @Override
        public Class<? extends NorthboundObject> clazz() {
            return obj.getClass();
        }

        @Override
        public String key() {
            return obj.key();
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this).add("obj", obj).toString();
        }
    }

    public static final class UpdateOp extends StorageOp {
        public final NorthboundObject obj;

        UpdateOp(NorthboundObject obj) {
            this.obj = obj;
        }

        @Override
        public Class<? extends NorthboundObject> clazz() {
            return obj.getClass();
        }

        @Override
        public String key() {
            return obj.key();
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this).add("obj", obj).toString();
        }
    }

    /** Deleting a missing object is not an error. */
    public static final class DeleteOp extends StorageOp {
        public final Class<? extends NorthboundObject> clazz;
        public final String key;

        DeleteOp(Class<? extends NorthboundObject> clazz, String key) {
            this.clazz = clazz;
            this.key = key;
        }

        @Override
        public Class<? extends NorthboundObject> clazz() {
            return clazz;
        }

        @Override
        public String key() {
            return key;
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this)
                    .add("clazz", clazz.getSimpleName())
                    .add("key", key).toString();
        }
    }

    /**
     * Inserts or removes elements of a set column without rewriting the rest
     * of the row. The column is named by its Northbound column name.
     */
    public static final class MutateOp extends StorageOp {
        public final Class<? extends NorthboundObject> clazz;
        public final String key;
        public final String column;
        public final boolean insert;
        public final List<String> values;

        MutateOp(Class<? extends NorthboundObject> clazz, String key,
                 String column, boolean insert, List<String> values) {
            this.clazz = clazz;
            this.key = key;
            this.column = column;
            this.insert = insert;
            this.values = ImmutableList.copyOf(values);
        }

        @Override
        public Class<? extends NorthboundObject> clazz() {
            return clazz;
        }

        @Override
        public String key() {
            return key;
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this)
                    .add("clazz", clazz.getSimpleName())
                    .add("key", key)
                    .add("column", column)
                    .add("insert", insert)
                    .add("values", values).toString();
        }
    }
}
