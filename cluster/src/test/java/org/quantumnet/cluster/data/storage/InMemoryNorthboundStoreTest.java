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
import java.util.HashSet;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.Before;
import org.junit.Test;

import org.quantumnet.cluster.data.ovn.Acl;
import org.quantumnet.cluster.data.ovn.AclAction;
import org.quantumnet.cluster.data.ovn.AclDirection;
import org.quantumnet.cluster.data.ovn.AddressSet;
import org.quantumnet.cluster.data.ovn.LogicalSwitch;
import org.quantumnet.cluster.data.ovn.LogicalSwitchPort;
import org.quantumnet.cluster.data.ovn.PortGroup;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class InMemoryNorthboundStoreTest {

    private InMemoryNorthboundStore store;

    @Before
    public void setup() {
        store = new InMemoryNorthboundStore();
    }

    @Test
    public void testCreateAndGet() throws Exception {
        LogicalSwitch ls = new LogicalSwitch("u-1", "ls-a");
        ls.putExternalId("k", "v");
        store.create(ls);

        LogicalSwitch stored = store.get(LogicalSwitch.class, "ls-a");
        assertEquals(ls, stored);
        assertTrue(store.exists(LogicalSwitch.class, "ls-a"));
        assertFalse(store.exists(LogicalSwitchPort.class, "ls-a"));
        assertTrue(store.isConnected());
    }

    @Test
    public void testCreateDuplicate() throws Exception {
        store.create(new LogicalSwitch("u-1", "ls-a"));
        try {
            store.create(new LogicalSwitch("u-2", "ls-a"));
            fail("Expected ObjectExistsException");
        } catch (ObjectExistsException e) {
            assertEquals(LogicalSwitch.class, e.getClazz());
            assertEquals("ls-a", e.getId());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testCreateWithoutKey() throws Exception {
        store.create(new LogicalSwitch("u-1", null));
    }

    @Test
    public void testGetMissing() throws Exception {
        try {
            store.get(PortGroup.class, "pg_nothing");
            fail("Expected NotFoundException");
        } catch (NotFoundException e) {
            assertEquals(PortGroup.class, e.getClazz());
            assertEquals("pg_nothing", e.getId());
        }
    }

    @Test
    public void testUnnamedTablesKeyedByUuid() throws Exception {
        Acl acl = new Acl("acl-1", AclDirection.TO_LPORT, 1000, "ip4",
                          AclAction.ALLOW, "a");
        store.create(acl);
        assertEquals(acl, store.get(Acl.class, "acl-1"));
        assertEquals(1000, store.get(Acl.class, "acl-1").getPriority());
    }

    @Test
    public void testReturnedObjectsAreCopies() throws Exception {
        LogicalSwitch ls = new LogicalSwitch("u-1", "ls-a");
        store.create(ls);
        ls.ports.add("changed-after-create");

        LogicalSwitch stored = store.get(LogicalSwitch.class, "ls-a");
        assertThat(stored.ports, empty());
        stored.ports.add("changed-after-get");

        assertThat(store.get(LogicalSwitch.class, "ls-a").ports, empty());
        assertThat(store.getAll(LogicalSwitch.class).get(0).ports, empty());
    }

    @Test
    public void testUpdate() throws Exception {
        store.create(new LogicalSwitch("u-1", "ls-a"));
        LogicalSwitch ls = store.get(LogicalSwitch.class, "ls-a");
        ls.otherConfig.put("mtu", "1400");
        store.update(ls);
        assertEquals("1400",
                     store.get(LogicalSwitch.class, "ls-a")
                          .otherConfig.get("mtu"));
    }

    @Test(expected = NotFoundException.class)
    public void testUpdateMissing() throws Exception {
        store.update(new LogicalSwitch("u-1", "ls-a"));
    }

    @Test
    public void testDeleteIsIdempotent() throws Exception {
        store.create(new LogicalSwitch("u-1", "ls-a"));
        store.delete(LogicalSwitch.class, "ls-a");
        store.delete(LogicalSwitch.class, "ls-a");
        assertFalse(store.exists(LogicalSwitch.class, "ls-a"));
    }

    @Test
    public void testMutate() throws Exception {
        store.create(new AddressSet("u-1", "as_sg_a", List.of("10.0.0.1")));

        store.multi(List.of(StorageOp.insert(
            AddressSet.class, "as_sg_a", "addresses",
            List.of("10.0.0.1", "10.0.0.2", "10.0.0.3"))));
        assertThat(store.get(AddressSet.class, "as_sg_a").addresses,
                   contains("10.0.0.1", "10.0.0.2", "10.0.0.3"));

        store.multi(List.of(StorageOp.remove(
            AddressSet.class, "as_sg_a", "addresses", "10.0.0.2")));
        assertThat(store.get(AddressSet.class, "as_sg_a").addresses,
                   contains("10.0.0.1", "10.0.0.3"));
    }

    @Test(expected = NotFoundException.class)
    public void testMutateMissing() throws Exception {
        store.multi(List.of(StorageOp.insert(
            PortGroup.class, "pg_none", "ports", "p1")));
    }

    @Test
    public void testMultiIsAtomic() throws Exception {
        store.create(new LogicalSwitch("u-1", "ls-a"));
        LogicalSwitchPort lsp = new LogicalSwitchPort("u-2", "lsp-1");

        try {
            store.multi(List.of(
                StorageOp.create(lsp),
                StorageOp.insert(LogicalSwitch.class, "ls-a", "ports",
                                 "u-2"),
                StorageOp.insert(LogicalSwitch.class, "ls-missing", "ports",
                                 "u-2")));
            fail("Expected NotFoundException");
        } catch (NotFoundException e) {
            assertEquals("ls-missing", e.getId());
        }

        assertFalse(store.exists(LogicalSwitchPort.class, "lsp-1"));
        assertThat(store.get(LogicalSwitch.class, "ls-a").ports, empty());
    }

    @Test
    public void testMulti() throws Exception {
        store.create(new LogicalSwitch("u-1", "ls-a"));
        store.multi(List.of(
            StorageOp.create(new LogicalSwitchPort("u-2", "lsp-1")),
            StorageOp.create(new LogicalSwitchPort("u-3", "lsp-2")),
            StorageOp.insert(LogicalSwitch.class, "ls-a", "ports",
                             List.of("u-2", "u-3"))));

        assertThat(store.getAll(LogicalSwitchPort.class), hasSize(2));
        assertThat(store.get(LogicalSwitch.class, "ls-a").ports,
                   containsInAnyOrder("u-2", "u-3"));
    }

    @Test
    public void testClose() throws Exception {
        store.create(new LogicalSwitch("u-1", "ls-a"));
        store.close();
        assertThat(store.getAll(LogicalSwitch.class), empty());
    }

    private static final String PG = "pg_web";

    private static Acl acl(String uuid) {
        return new Acl(uuid, AclDirection.TO_LPORT, 1000, "ip4",
                       AclAction.ALLOW, uuid);
    }

    /**
     * Replaces the single ACL of the port group on each round, referencing
     * the new ACL before creating it and deleting the old one before
     * dropping its reference. Every other batch fails after adding a
     * reference.
     */
    private void replaceAcls(int rounds) throws NorthboundException {
        String previous = null;
        for (int i = 0; i < rounds; i++) {
            String uuid = "acl-" + i;
            List<StorageOp> ops = new ArrayList<>();
            ops.add(StorageOp.insert(PortGroup.class, PG, "acls", uuid));
            if (previous != null) {
                ops.add(StorageOp.delete(Acl.class, previous));
                ops.add(StorageOp.remove(PortGroup.class, PG, "acls",
                                         previous));
            }
            ops.add(StorageOp.create(acl(uuid)));
            store.multi(ops);
            previous = uuid;

            try {
                store.multi(List.of(
                    StorageOp.insert(PortGroup.class, PG, "acls",
                                     "failed-" + i),
                    StorageOp.create(acl(uuid))));
                fail("Expected ObjectExistsException");
            } catch (ObjectExistsException e) {
                assertEquals(uuid, e.getId());
            }
        }
    }

    /**
     * Any ACL referenced by the group both before and after listing the
     * ACLs was referenced throughout, so it must have been listed.
     */
    private void checkReferences(Queue<String> failures)
            throws NorthboundException {
        PortGroup before = store.get(PortGroup.class, PG);
        Set<String> acls = new HashSet<>();
        for (Acl acl : store.getAll(Acl.class)) {
            acls.add(acl.uuid);
        }
        PortGroup after = store.get(PortGroup.class, PG);
        for (String uuid : before.acls) {
            if (uuid.startsWith("failed-"))
                failures.add("reference from failed batch: " + uuid);
            else if (after.acls.contains(uuid) && !acls.contains(uuid))
                failures.add("dangling reference: " + uuid);
        }
    }

    @Test(timeout = 60000)
    public void testConcurrentReadersSeeWholeBatches() throws Exception {
        store.create(new PortGroup("pg-uuid", PG));
        int readers = 4;
        ExecutorService executor = Executors.newFixedThreadPool(readers + 1);
        AtomicBoolean done = new AtomicBoolean(false);
        CountDownLatch started = new CountDownLatch(readers);
        Queue<String> failures = new ConcurrentLinkedQueue<>();
        try {
            List<Future<Integer>> reads = new ArrayList<>();
            for (int i = 0; i < readers; i++) {
                reads.add(executor.submit(() -> {
                    started.countDown();
                    int checks = 0;
                    while (!done.get()) {
                        checkReferences(failures);
                        checks++;
                    }
                    return checks;
                }));
            }
            started.await();
            Future<Void> writes = executor.submit(() -> {
                replaceAcls(500);
                return null;
            });
            writes.get();
            done.set(true);
            for (Future<Integer> read : reads) {
                assertTrue(read.get() > 0);
            }
        } finally {
            done.set(true);
            executor.shutdownNow();
        }

        assertThat(failures, empty());
        assertThat(store.get(PortGroup.class, PG).acls, contains("acl-499"));
        assertThat(store.getAll(Acl.class), hasSize(1));
    }
}
