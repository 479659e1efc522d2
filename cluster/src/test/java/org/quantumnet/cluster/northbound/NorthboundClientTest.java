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

package org.quantumnet.cluster.northbound;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.ConfigFactory;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import org.quantumnet.cluster.config.NorthboundConfig;
import org.quantumnet.cluster.data.domain.BindingType;
import org.quantumnet.cluster.data.domain.LoadBalancer;
import org.quantumnet.cluster.data.domain.NetworkType;
import org.quantumnet.cluster.data.domain.Port;
import org.quantumnet.cluster.data.domain.RuleAction;
import org.quantumnet.cluster.data.domain.RuleDirection;
import org.quantumnet.cluster.data.domain.SecurityGroup;
import org.quantumnet.cluster.data.domain.SecurityGroupRule;
import org.quantumnet.cluster.data.domain.VirtualNetwork;
import org.quantumnet.cluster.data.ovn.Acl;
import org.quantumnet.cluster.data.ovn.AclAction;
import org.quantumnet.cluster.data.ovn.AclDirection;
import org.quantumnet.cluster.data.ovn.AddressSet;
import org.quantumnet.cluster.data.ovn.DhcpOptions;
import org.quantumnet.cluster.data.ovn.ExternalIds;
import org.quantumnet.cluster.data.ovn.LogicalRouter;
import org.quantumnet.cluster.data.ovn.LogicalRouterPort;
import org.quantumnet.cluster.data.ovn.LogicalSwitch;
import org.quantumnet.cluster.data.ovn.LogicalSwitchPort;
import org.quantumnet.cluster.data.ovn.Nat;
import org.quantumnet.cluster.data.ovn.NatType;
import org.quantumnet.cluster.data.ovn.OvnLoadBalancer;
import org.quantumnet.cluster.data.ovn.PortGroup;
import org.quantumnet.cluster.data.storage.InMemoryNorthboundStore;
import org.quantumnet.cluster.data.storage.NorthboundConnectionException;
import org.quantumnet.cluster.data.storage.NotFoundException;
import org.quantumnet.cluster.naming.SequentialIdGenerator;
import org.quantumnet.cluster.translators.AclPriorities;
import org.quantumnet.cluster.translators.AclTranslator;
import org.quantumnet.cluster.translators.TranslationResult;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class NorthboundClientTest {

    private SequentialIdGenerator ids;
    private InMemoryNorthboundStore store;
    private NorthboundClient client;

    @Before
    public void setup() {
        ids = new SequentialIdGenerator();
        store = new InMemoryNorthboundStore();
        client = new NorthboundClient(store, ids, new AclTranslator(ids));
    }

    @After
    public void teardown() {
        client.close();
    }

    private static VirtualNetwork overlay(String id, boolean dhcp) {
        VirtualNetwork.Spec spec = new VirtualNetwork.Spec();
        spec.mtu = 1450;
        spec.ipConfig = new VirtualNetwork.IpConfig("192.168.10.0/24",
                                                    "192.168.10.1");
        spec.ipConfig.dhcp = new VirtualNetwork.DhcpConfig();
        spec.ipConfig.dhcp.enabled = dhcp;
        spec.ipConfig.dhcp.dnsServers.add("8.8.8.8");
        spec.ipConfig.dhcp.dnsServers.add("1.1.1.1");
        spec.ipConfig.dhcp.domainName = "example.internal";
        return new VirtualNetwork(id, "proj-1", "frontend", spec);
    }

    private static Port port(String id, String networkId, String mac,
                             String... ips) {
        Port.Spec spec = new Port.Spec();
        spec.macAddress = mac;
        for (String ip : ips) {
            spec.fixedIps.add(new Port.FixedIp("subnet-1", ip));
        }
        return new Port(id, networkId, spec);
    }

    private static SecurityGroup webGroup() {
        SecurityGroupRule https = new SecurityGroupRule(
            "rule-443", RuleDirection.INGRESS, "tcp", RuleAction.ALLOW);
        https.portMin = 443;
        https.portMax = 443;
        https.remoteIpPrefix = "0.0.0.0/0";
        List<SecurityGroupRule> rules = new ArrayList<>();
        rules.add(https);
        return new SecurityGroup("sg-1", "web", true, rules);
    }

    /* Logical switches */

    @Test
    public void testCreateOverlaySwitchWithDhcp() throws Exception {
        LogicalSwitch created = client.createLogicalSwitch(overlay("net-1",
                                                                   true));

        LogicalSwitch ls = client.getLogicalSwitch("net-1");
        assertEquals(created, ls);
        assertEquals("ls-net-1", ls.name);
        assertEquals("net-1", ls.externalId(ExternalIds.NETWORK_ID));
        assertEquals("proj-1", ls.externalId(ExternalIds.PROJECT_ID));
        assertEquals("frontend", ls.externalId(ExternalIds.NAME));
        assertEquals("192.168.10.0/24", ls.otherConfig.get("subnet"));
        assertEquals("1450", ls.otherConfig.get("mtu"));

        DhcpOptions dhcp = client.findDhcpOptions("net-1");
        assertNotNull(dhcp);
        assertEquals("192.168.10.0/24", dhcp.cidr);
        assertEquals("192.168.10.1", dhcp.options.get(DhcpOptions.SERVER_ID));
        assertEquals("192.168.10.1", dhcp.options.get(DhcpOptions.ROUTER));
        assertEquals("0a:00:00:00:00:01",
                     dhcp.options.get(DhcpOptions.SERVER_MAC));
        assertEquals("86400", dhcp.options.get(DhcpOptions.LEASE_TIME));
        assertEquals("8.8.8.8,1.1.1.1",
                     dhcp.options.get(DhcpOptions.DNS_SERVER));
        assertEquals("\"example.internal\"",
                     dhcp.options.get(DhcpOptions.DOMAIN_NAME));
        assertEquals("ls-net-1", dhcp.externalId(ExternalIds.SWITCH));
        assertEquals(dhcp, client.getDhcpOptions(dhcp.uuid));
    }

    @Test
    public void testDhcpFailureDoesNotFailSwitch() throws Exception {
        VirtualNetwork net = overlay("net-1", true);
        net.spec.ipConfig.ipv4Subnet = null;

        client.createLogicalSwitch(net);

        assertNotNull(client.getLogicalSwitch("net-1"));
        assertNull(client.findDhcpOptions("net-1"));
        assertFalse(client.getLogicalSwitch("net-1")
                          .otherConfig.containsKey("subnet"));
    }

    @Test
    public void testCreateVlanSwitch() throws Exception {
        VirtualNetwork.Spec spec = new VirtualNetwork.Spec();
        spec.type = NetworkType.VLAN;
        spec.vlan = new VirtualNetwork.VlanConfig(100, "physnet1");
        client.createLogicalSwitch(new VirtualNetwork("net-v", null, null,
                                                      spec));

        LogicalSwitch ls = client.getLogicalSwitch("net-v");
        assertEquals("100", ls.otherConfig.get("vlan"));
        assertFalse(ls.otherConfig.containsKey("mtu"));
        assertEquals("", ls.externalId(ExternalIds.PROJECT_ID));
        assertNull(client.findDhcpOptions("net-v"));
    }

    @Test
    public void testListAndDeleteSwitches() throws Exception {
        client.createLogicalSwitch(overlay("net-1", true));
        client.createLogicalSwitch(overlay("net-2", false));
        client.createLogicalSwitchPort(port("p1", "net-1",
                                            "fa:16:3e:00:00:01", "10.0.0.5"));
        assertThat(client.listLogicalSwitches(), hasSize(2));

        client.deleteLogicalSwitch("net-1");

        assertThat(client.listLogicalSwitches(), hasSize(1));
        assertFalse(store.exists(LogicalSwitchPort.class, "lsp-p1"));
        assertThat(store.getAll(DhcpOptions.class), empty());

        client.deleteLogicalSwitch("net-1");
        client.deleteLogicalSwitch("never-existed");
    }

    @Test(expected = NotFoundException.class)
    public void testGetMissingSwitch() throws Exception {
        client.getLogicalSwitch("nope");
    }

    /* Logical switch ports */

    @Test
    public void testCreatePort() throws Exception {
        client.createLogicalSwitch(overlay("net-1", true));
        Port p = port("p1", "net-1", "fa:16:3e:00:00:01", "192.168.10.5",
                      "192.168.10.6");
        p.spec.securityGroupIds.add("sg-1");
        p.spec.portSecurityEnabled = true;
        p.status.vmId = "vm-1";

        LogicalSwitchPort lsp = client.createLogicalSwitchPort(p);

        assertEquals("lsp-p1", lsp.name);
        assertEquals("lsp-p1", client.getOvnPortName("p1"));
        assertThat(lsp.addresses,
                   contains("fa:16:3e:00:00:01 192.168.10.5 192.168.10.6"));
        assertEquals(lsp.addresses, lsp.portSecurity);
        assertEquals(LogicalSwitchPort.TYPE_NORMAL, lsp.type);
        assertTrue(lsp.enabled);
        assertEquals("p1", lsp.externalId(ExternalIds.PORT_ID));
        assertEquals("vm-1", lsp.externalId(ExternalIds.VM_ID));
        assertEquals(client.findDhcpOptions("net-1").uuid, lsp.dhcpv4Options);

        assertEquals(lsp, client.getLogicalSwitchPort("p1"));
        assertThat(client.getLogicalSwitch("net-1").ports,
                   contains(lsp.uuid));
    }

    @Test
    public void testPortSecurityNeedsSecurityGroups() throws Exception {
        client.createLogicalSwitch(overlay("net-1", false));
        Port p = port("p1", "net-1", "fa:16:3e:00:00:01", "192.168.10.5");
        p.spec.portSecurityEnabled = true;

        LogicalSwitchPort lsp = client.createLogicalSwitchPort(p);

        assertThat(lsp.portSecurity, empty());
        assertNull(lsp.dhcpv4Options);
    }

    @Test
    public void testPortBindings() throws Exception {
        client.createLogicalSwitch(overlay("net-1", false));

        Port direct = port("p1", "net-1", "fa:16:3e:00:00:01");
        direct.spec.binding = new Port.Binding(BindingType.DIRECT);
        direct.status.hostId = "host-7";
        LogicalSwitchPort lsp = client.createLogicalSwitchPort(direct);
        assertEquals(LogicalSwitchPort.TYPE_DIRECT, lsp.type);
        assertEquals("host-7",
                     lsp.options.get(LogicalSwitchPort.OPT_REQUESTED_CHASSIS));

        Port vhost = port("p2", "net-1", "fa:16:3e:00:00:02");
        vhost.spec.binding = new Port.Binding(BindingType.VHOST_USER);
        vhost.spec.binding.vhostSocket = "/run/vhu-p2.sock";
        lsp = client.createLogicalSwitchPort(vhost);
        assertEquals("dpdkvhostuser", lsp.type);
        assertEquals("/run/vhu-p2.sock",
                     lsp.options.get(LogicalSwitchPort.OPT_VHOST_SOCK));
    }

    @Test
    public void testPortWithoutValidMacCreatesNothing() throws Exception {
        client.createLogicalSwitch(overlay("net-1", false));
        for (String mac : new String[] { null, "", "  ", "10.0.0.5",
                                         "fa:16:3e:00:01" }) {
            try {
                client.createLogicalSwitchPort(
                    port("p1", "net-1", mac, "10.0.0.5"));
                fail("Expected IllegalArgumentException for " + mac);
            } catch (IllegalArgumentException e) {
                assertThat(e.getMessage(), containsString("MAC address"));
            }
        }
        assertThat(store.getAll(LogicalSwitchPort.class), empty());
        assertThat(client.getLogicalSwitch("net-1").ports, empty());
    }

    @Test
    public void testPortMacIsNormalized() throws Exception {
        client.createLogicalSwitch(overlay("net-1", false));
        LogicalSwitchPort lsp = client.createLogicalSwitchPort(
            port("p1", "net-1", "FA:16:3E:00:00:0A", "10.0.0.5"));
        assertThat(lsp.addresses, contains("fa:16:3e:00:00:0a 10.0.0.5"));
        assertThat(NorthboundClient.ipsOf(lsp), contains("10.0.0.5"));
    }

    @Test
    public void testPortOnMissingSwitchCreatesNothing() throws Exception {
        try {
            client.createLogicalSwitchPort(port("p1", "net-x",
                                                "fa:16:3e:00:00:01"));
            fail("Expected NotFoundException");
        } catch (NotFoundException e) {
            assertEquals("ls-net-x", e.getId());
        }
        assertThat(store.getAll(LogicalSwitchPort.class), empty());
    }

    @Test
    public void testBindPort() throws Exception {
        client.createLogicalSwitch(overlay("net-1", false));
        client.createLogicalSwitchPort(port("p1", "net-1",
                                            "fa:16:3e:00:00:01"));

        client.bindPort("p1", "vm-9", "host-3");

        LogicalSwitchPort lsp = client.getLogicalSwitchPort("p1");
        assertEquals("vm-9", lsp.externalId(ExternalIds.VM_ID));
        assertEquals("host-3",
                     lsp.options.get(LogicalSwitchPort.OPT_REQUESTED_CHASSIS));
    }

    @Test
    public void testLocalnetPort() throws Exception {
        client.createLogicalSwitch(overlay("net-1", false));

        LogicalSwitchPort lsp =
            client.createLocalnetPort("net-1", 200, "physnet1");

        assertEquals("ls-net-1-localnet", lsp.name);
        assertEquals(LogicalSwitchPort.TYPE_LOCALNET, lsp.type);
        assertThat(lsp.addresses, contains("unknown"));
        assertEquals("physnet1",
                     lsp.options.get(LogicalSwitchPort.OPT_NETWORK_NAME));
        assertEquals(Integer.valueOf(200), lsp.tag);
        assertThat(client.getLogicalSwitch("net-1").ports, contains(lsp.uuid));

        client.createLogicalSwitch(overlay("net-2", false));
        assertNull(client.createLocalnetPort("net-2", 0, "physnet1").tag);
    }

    @Test
    public void testDeletePortCleansSecurityGroups() throws Exception {
        client.createLogicalSwitch(overlay("net-1", false));
        client.createLogicalSwitchPort(port("p1", "net-1",
                                            "fa:16:3e:00:00:01", "10.0.0.5"));
        client.createSecurityGroupAcls(webGroup());
        client.applySecurityGroupToPort("p1", "sg-1");

        client.deleteLogicalSwitchPort("p1");

        assertFalse(store.exists(LogicalSwitchPort.class, "lsp-p1"));
        assertThat(client.getLogicalSwitch("net-1").ports, empty());
        assertThat(client.getPortGroup("pg_sg_sg_1").ports, empty());
        assertThat(client.getAddressSet("as_sg_sg_1").addresses, empty());

        client.deleteLogicalSwitchPort("p1");
    }

    /* Logical routers */

    @Test
    public void testRouter() throws Exception {
        LogicalRouter lr = client.createLogicalRouter("r1", "proj-1", true);

        assertEquals("lr-r1", lr.name);
        assertTrue(lr.enabled);
        assertEquals("", lr.options.get("chassis"));
        assertEquals("r1", lr.externalId(ExternalIds.ROUTER_ID));
        assertEquals(lr, client.getLogicalRouter("r1"));

        LogicalRouter central = client.createLogicalRouter("r2", null, false);
        assertFalse(central.options.containsKey("chassis"));
    }

    @Test
    public void testRouterInterfaces() throws Exception {
        client.createLogicalSwitch(overlay("net-1", false));
        client.createLogicalRouter("r1", "proj-1", false);

        LogicalRouterPort lrp =
            client.addRouterInterface("r1", "net-1", "192.168.10.1/24");

        assertEquals("lr-r1-to-ls-net-1", lrp.name);
        assertThat(lrp.networks, contains("192.168.10.1/24"));
        assertEquals("0a:00:00:00:00:01", lrp.mac);
        assertEquals(lrp, client.getLogicalRouterPort("r1", "net-1"));
        assertThat(client.getLogicalRouter("r1").ports, contains(lrp.uuid));

        LogicalSwitchPort peer =
            store.get(LogicalSwitchPort.class, "ls-net-1-to-lr-r1");
        assertEquals(LogicalSwitchPort.TYPE_ROUTER, peer.type);
        assertThat(peer.addresses, contains("router"));
        assertEquals("lr-r1-to-ls-net-1",
                     peer.options.get(LogicalSwitchPort.OPT_ROUTER_PORT));
        assertThat(client.getLogicalSwitch("net-1").ports,
                   contains(peer.uuid));

        client.removeRouterInterface("r1", "net-1");

        assertThat(client.getLogicalRouter("r1").ports, empty());
        assertThat(client.getLogicalSwitch("net-1").ports, empty());
        assertFalse(store.exists(LogicalRouterPort.class, lrp.name));
        assertFalse(store.exists(LogicalSwitchPort.class, peer.name));
        client.removeRouterInterface("r1", "net-1");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRouterInterfaceNeedsValidGateway() throws Exception {
        client.addRouterInterface("r1", "net-1", "192.168.10.1/99");
    }

    @Test
    public void testRouterInterfaceIsAtomic() throws Exception {
        client.createLogicalRouter("r1", "proj-1", false);
        try {
            client.addRouterInterface("r1", "net-x", "10.0.0.1/24");
            fail("Expected NotFoundException");
        } catch (NotFoundException e) {
            assertEquals("ls-net-x", e.getId());
        }
        assertThat(client.getLogicalRouter("r1").ports, empty());
        assertThat(store.getAll(LogicalRouterPort.class), empty());
    }

    @Test
    public void testDeleteRouterCascades() throws Exception {
        client.createLogicalSwitch(overlay("net-1", false));
        client.createLogicalRouter("r1", "proj-1", false);
        client.addRouterInterface("r1", "net-1", "192.168.10.1/24");
        client.createSnat("r1", "203.0.113.1", "192.168.10.0/24");

        client.deleteLogicalRouter("r1");

        assertFalse(store.exists(LogicalRouter.class, "lr-r1"));
        assertThat(store.getAll(LogicalRouterPort.class), empty());
        assertThat(store.getAll(Nat.class), empty());
        assertThat(client.getLogicalSwitch("net-1").ports, empty());
        assertThat(store.getAll(LogicalSwitchPort.class), empty());

        client.deleteLogicalRouter("r1");
    }

    /* Security groups */

    @Test
    public void testSecurityGroupLifecycle() throws Exception {
        TranslationResult result = client.createSecurityGroupAcls(webGroup());

        assertThat(result.getAcls(), hasSize(6));
        assertThat(store.getAll(Acl.class), hasSize(6));
        PortGroup pg = client.getPortGroup("pg_sg_sg_1");
        assertThat(pg.acls, hasSize(6));
        AddressSet as = client.getAddressSet("as_sg_sg_1");
        assertEquals("sg-1", as.externalId(ExternalIds.SG_ID));

        Acl user = client.getAcl(result.getAcls().get(4).uuid);
        assertEquals("outport == @pg_sg_sg_1 && ip4 && tcp && tcp.dst == 443",
                     user.match);
        assertEquals(AclAction.ALLOW_RELATED, user.action);

        client.deleteSecurityGroupAcls("sg-1");

        assertThat(store.getAll(Acl.class), empty());
        assertFalse(store.exists(AddressSet.class, "as_sg_sg_1"));
        try {
            client.getPortGroup("pg_sg_sg_1");
            fail("Expected NotFoundException");
        } catch (NotFoundException e) {
            assertEquals("pg_sg_sg_1", e.getId());
        }
        client.deleteSecurityGroupAcls("sg-1");
    }

    @Test
    public void testUpdateSecurityGroupKeepsPorts() throws Exception {
        client.createLogicalSwitch(overlay("net-1", false));
        LogicalSwitchPort lsp = client.createLogicalSwitchPort(
            port("p1", "net-1", "fa:16:3e:00:00:01", "10.0.0.5"));
        client.createSecurityGroupAcls(webGroup());
        client.applySecurityGroupToPort("p1", "sg-1");
        PortGroup before = client.getPortGroup("pg_sg_sg_1");

        SecurityGroup sg = webGroup();
        SecurityGroupRule ssh = new SecurityGroupRule(
            "rule-22", RuleDirection.INGRESS, "tcp", RuleAction.ALLOW);
        ssh.portMin = 22;
        sg.rules.add(ssh);
        client.updateSecurityGroupAcls(sg);

        PortGroup after = client.getPortGroup("pg_sg_sg_1");
        assertEquals(before.uuid, after.uuid);
        assertThat(after.ports, contains(lsp.uuid));
        assertThat(after.acls, hasSize(7));
        assertThat(store.getAll(Acl.class), hasSize(7));
        for (String old : before.acls) {
            assertFalse(store.exists(Acl.class, old));
        }
    }

    @Test
    public void testUpdateCreatesMissingSecurityGroup() throws Exception {
        client.updateSecurityGroupAcls(webGroup());
        assertThat(client.getPortGroup("pg_sg_sg_1").acls, hasSize(6));
        assertTrue(store.exists(AddressSet.class, "as_sg_sg_1"));
    }

    @Test
    public void testApplyAndRemoveSecurityGroup() throws Exception {
        client.createLogicalSwitch(overlay("net-1", false));
        LogicalSwitchPort lsp = client.createLogicalSwitchPort(
            port("p1", "net-1", "fa:16:3e:00:00:01", "10.0.0.5", "10.0.0.6"));
        client.createSecurityGroupAcls(webGroup());

        client.applySecurityGroupToPort("p1", "sg-1");
        assertThat(client.getPortGroup("pg_sg_sg_1").ports,
                   contains(lsp.uuid));
        assertThat(client.getAddressSet("as_sg_sg_1").addresses,
                   containsInAnyOrder("10.0.0.5", "10.0.0.6"));

        client.removeSecurityGroupFromPort("p1", "sg-1");
        assertThat(client.getPortGroup("pg_sg_sg_1").ports, empty());
        assertThat(client.getAddressSet("as_sg_sg_1").addresses, empty());
        client.removeSecurityGroupFromPort("p1", "sg-1");
    }

    @Test
    public void testAclPrimitives() throws Exception {
        client.createLogicalSwitch(overlay("net-1", false));
        LogicalSwitchPort lsp = client.createLogicalSwitchPort(
            port("p1", "net-1", "fa:16:3e:00:00:01"));
        PortGroup pg = client.createPortGroup(new PortGroup(null, "pg_admin"));
        assertNotNull(pg.uuid);

        Acl acl = client.createAcl(new Acl(
            null, AclDirection.FROM_LPORT, AclPriorities.ADMIN_RULE_BASE,
            "inport == @pg_admin && tcp.dst == 25", AclAction.DROP,
            "block-smtp"), "pg_admin");
        assertThat(client.getPortGroup("pg_admin").acls, contains(acl.uuid));

        client.addPortToPortGroup("pg_admin", lsp.uuid);
        assertThat(client.getPortGroup("pg_admin").ports, contains(lsp.uuid));
        client.removePortFromPortGroup("pg_admin", lsp.uuid);
        assertThat(client.getPortGroup("pg_admin").ports, empty());

        client.deleteAcl(acl.uuid);
        assertThat(client.getPortGroup("pg_admin").acls, empty());
        assertFalse(store.exists(Acl.class, acl.uuid));

        client.createAcl(new Acl(null, AclDirection.TO_LPORT, 10, "ip4",
                                 AclAction.ALLOW, "a"), "pg_admin");
        client.deletePortGroup("pg_admin");
        assertThat(store.getAll(Acl.class), empty());
        assertFalse(store.exists(PortGroup.class, "pg_admin"));
    }

    @Test
    public void testAddressSets() throws Exception {
        AddressSet as = client.createAddressSet(
            new AddressSet(null, "as_blocked", new ArrayList<>()));
        as.addresses.add("198.51.100.7");
        client.updateAddressSet(as);
        assertThat(client.getAddressSet("as_blocked").addresses,
                   contains("198.51.100.7"));
        client.deleteAddressSet("as_blocked");
        assertFalse(store.exists(AddressSet.class, "as_blocked"));
    }

    /* DHCP */

    @Test
    public void testDhcpOptionsFromSpec() throws Exception {
        DhcpOptionsSpec spec = new DhcpOptionsSpec("10.1.0.0/24", "10.1.0.1");
        spec.dnsServers.add("10.1.0.2");
        spec.dnsServers.add("10.1.0.3");
        spec.mtu = 1400;
        spec.domainName = "lab";

        String uuid = client.createDhcpOptions(spec);

        DhcpOptions dhcp = client.getDhcpOptions(uuid);
        assertEquals("10.1.0.1", dhcp.options.get(DhcpOptions.SERVER_ID));
        assertEquals("86400", dhcp.options.get(DhcpOptions.LEASE_TIME));
        assertEquals("{10.1.0.2, 10.1.0.3}",
                     dhcp.options.get(DhcpOptions.DNS_SERVER));
        assertEquals("1400", dhcp.options.get(DhcpOptions.MTU));
        assertEquals("\"lab\"", dhcp.options.get(DhcpOptions.DOMAIN_NAME));
        assertThat(dhcp.options.get(DhcpOptions.SERVER_MAC), startsWith("0a:"));
    }

    @Test
    public void testUpdateDhcpOptions() throws Exception {
        client.createLogicalSwitch(overlay("net-1", true));
        client.createLogicalSwitchPort(port("p1", "net-1",
                                            "fa:16:3e:00:00:01", "10.0.0.5"));
        DhcpOptions before = client.findDhcpOptions("net-1");
        String serverMac = before.options.get(DhcpOptions.SERVER_MAC);

        DhcpOptionsSpec spec = new DhcpOptionsSpec("10.2.0.0/24", "10.2.0.1");
        spec.leaseTime = 600;
        DhcpOptions after = client.updateDhcpOptions(before.uuid, spec);

        assertEquals(before.uuid, after.uuid);
        assertEquals(after, client.getDhcpOptions(before.uuid));
        assertEquals("10.2.0.0/24", after.cidr);
        assertEquals("10.2.0.1", after.options.get(DhcpOptions.ROUTER));
        assertEquals("600", after.options.get(DhcpOptions.LEASE_TIME));
        assertEquals(serverMac, after.options.get(DhcpOptions.SERVER_MAC));
        assertNull(after.options.get(DhcpOptions.DOMAIN_NAME));
        assertEquals("net-1", after.externalId(ExternalIds.NETWORK_ID));
        assertEquals(after, client.findDhcpOptions("net-1"));
        assertEquals(before.uuid,
                     client.getLogicalSwitchPort("p1").dhcpv4Options);

        spec.serverMac = "0a:00:00:00:aa:bb";
        assertEquals("0a:00:00:00:aa:bb",
                     client.updateDhcpOptions(before.uuid, spec)
                         .options.get(DhcpOptions.SERVER_MAC));
    }

    @Test(expected = NotFoundException.class)
    public void testUpdateMissingDhcpOptions() throws Exception {
        client.updateDhcpOptions(
            "no-such-uuid", new DhcpOptionsSpec("10.2.0.0/24", "10.2.0.1"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDhcpOptionsNeedCidr() throws Exception {
        client.createDhcpOptions(new DhcpOptionsSpec());
    }

    @Test
    public void testDeleteDhcpOptionsUnlinksPorts() throws Exception {
        client.createLogicalSwitch(overlay("net-1", true));
        client.createLogicalSwitchPort(port("p1", "net-1",
                                            "fa:16:3e:00:00:01"));
        DhcpOptions dhcp = client.findDhcpOptions("net-1");

        client.deleteDhcpOptions(dhcp.uuid);

        assertNull(client.findDhcpOptions("net-1"));
        assertNull(client.getLogicalSwitchPort("p1").dhcpv4Options);
    }

    /* NAT */

    @Test
    public void testNat() throws Exception {
        client.createLogicalRouter("r1", "proj-1", false);

        Nat fip = client.createFloatingIpNat("r1", "203.0.113.10",
                                             "10.0.0.5");
        assertEquals(NatType.DNAT_AND_SNAT, fip.type);
        assertEquals("203.0.113.10", fip.externalId(ExternalIds.FLOATING_IP));
        Nat snat = client.createSnat("r1", "203.0.113.1", "10.0.0.0/24");
        assertEquals(NatType.SNAT, snat.type);
        assertEquals("true", snat.externalId(ExternalIds.SNAT));

        assertThat(client.getLogicalRouter("r1").nat,
                   containsInAnyOrder(fip.uuid, snat.uuid));
        assertThat(client.listNats("r1"), hasSize(2));
        assertEquals(fip, client.getNat(fip.uuid));

        client.deleteFloatingIpNat("203.0.113.10");
        assertThat(client.getLogicalRouter("r1").nat, contains(snat.uuid));
        assertFalse(store.exists(Nat.class, fip.uuid));

        client.deleteSnat("r2", "10.0.0.0/24");
        assertTrue(store.exists(Nat.class, snat.uuid));
        client.deleteSnat("r1", "10.0.0.0/24");
        assertThat(client.listNats("r1"), empty());
        client.deleteFloatingIpNat("203.0.113.10");
    }

    /* Load balancers */

    private static LoadBalancer webLb() {
        LoadBalancer.Spec spec = new LoadBalancer.Spec();
        spec.vip = "10.0.0.100";
        spec.protocol = "TCP";
        spec.listeners.add(new LoadBalancer.Listener("http", 80));
        spec.listeners.add(new LoadBalancer.Listener("https", 443));
        spec.listeners.add(new LoadBalancer.Listener("idle", 8080));
        spec.members.add(new LoadBalancer.Member("http", "10.0.0.11", 8080));
        spec.members.add(new LoadBalancer.Member("http", "10.0.0.12", 8080));
        spec.members.add(new LoadBalancer.Member("https", "10.0.0.11", 8443));
        return new LoadBalancer("lb1", "proj-1", "web", spec);
    }

    @Test
    public void testLoadBalancerVips() throws Exception {
        OvnLoadBalancer lb = client.createLoadBalancer(webLb());

        assertEquals("lb-lb1", lb.name);
        assertEquals("tcp", lb.protocol);
        assertEquals("10.0.0.11:8080,10.0.0.12:8080",
                     lb.vips.get("10.0.0.100:80"));
        assertEquals("10.0.0.11:8443", lb.vips.get("10.0.0.100:443"));
        assertFalse(lb.vips.containsKey("10.0.0.100:8080"));
        assertEquals("lb1", lb.externalId(ExternalIds.LB_ID));
        assertEquals(lb, client.getLoadBalancer("lb1"));
    }

    @Test
    public void testMembersWithoutListenerServeAll() {
        LoadBalancer lb = webLb();
        lb.spec.protocol = null;
        lb.spec.members.add(new LoadBalancer.Member(null, "10.0.0.99", 9000));

        OvnLoadBalancer ovn = NorthboundClient.toOvn(lb, "u");

        assertEquals(NorthboundClient.DEFAULT_LB_PROTOCOL, ovn.protocol);
        assertEquals("10.0.0.99:9000", ovn.vips.get("10.0.0.100:8080"));
        assertEquals("10.0.0.11:8443,10.0.0.99:9000",
                     ovn.vips.get("10.0.0.100:443"));
    }

    @Test
    public void testLoadBalancerWithoutMembers() throws Exception {
        LoadBalancer lb = new ObjectMapper().readValue(
            "{\"id\": \"lb2\", \"spec\": {\"vip\": \"10.0.0.200\","
            + " \"listeners\": [{\"id\": \"http\", \"port\": 80}],"
            + " \"members\": null}}", LoadBalancer.class);

        OvnLoadBalancer ovn = client.createLoadBalancer(lb);

        assertEquals("lb-lb2", ovn.name);
        assertTrue(ovn.vips.isEmpty());

        lb.spec.listeners = null;
        assertTrue(client.updateLoadBalancer(lb).vips.isEmpty());
    }

    @Test
    public void testLoadBalancerLifecycle() throws Exception {
        client.createLogicalSwitch(overlay("net-1", false));
        client.createLogicalRouter("r1", "proj-1", false);
        OvnLoadBalancer lb = client.createLoadBalancer(webLb());

        client.assignLoadBalancerToSwitch("lb1", "net-1");
        client.assignLoadBalancerToRouter("lb1", "r1");
        assertThat(client.getLogicalSwitch("net-1").loadBalancer,
                   contains(lb.uuid));
        assertThat(client.getLogicalRouter("r1").loadBalancer,
                   contains(lb.uuid));

        LoadBalancer changed = webLb();
        changed.spec.members.clear();
        changed.spec.members.add(new LoadBalancer.Member("http", "10.0.0.13",
                                                         8080));
        OvnLoadBalancer updated = client.updateLoadBalancer(changed);
        assertEquals(lb.uuid, updated.uuid);
        assertEquals(1, client.getLoadBalancer("lb1").vips.size());
        assertThat(client.getLogicalSwitch("net-1").loadBalancer,
                   contains(lb.uuid));

        client.deleteLoadBalancer("lb1");
        assertFalse(store.exists(OvnLoadBalancer.class, "lb-lb1"));
        assertThat(client.getLogicalSwitch("net-1").loadBalancer, empty());
        assertThat(client.getLogicalRouter("r1").loadBalancer, empty());
        client.deleteLoadBalancer("lb1");
    }

    @Test
    public void testUpdateCreatesMissingLoadBalancer() throws Exception {
        OvnLoadBalancer lb = client.updateLoadBalancer(webLb());
        assertEquals(lb, client.getLoadBalancer("lb1"));
    }

    /* Construction */

    private static NorthboundConfig config(String address, boolean fallback,
                                           boolean cache) {
        return new NorthboundConfig(ConfigFactory.parseString(
            "quantumnet.northbound { address = \"" + address + "\"\n"
            + "fallback_to_mock = " + fallback + "\n"
            + "connect_timeout = 1s\n"
            + "cache.enabled = " + cache + " }"));
    }

    @Test
    public void testInvalidAddressWithoutFallback() throws Exception {
        try {
            NorthboundClient.create(config("", false, true), ids,
                                    new AclTranslator(ids));
            fail("Expected NorthboundConnectionException");
        } catch (NorthboundConnectionException e) {
            assertThat(e.getMessage(), not(""));
        }
    }

    @Test
    public void testInvalidAddressWithFallback() throws Exception {
        try (NorthboundClient mock = NorthboundClient.create(
                config("", true, false), ids, new AclTranslator(ids))) {
            assertTrue(mock.isMockMode());
            assertTrue(mock.isConnected());

            mock.createLogicalSwitch(overlay("net-1", false));
            assertEquals("ls-net-1", mock.getLogicalSwitch("net-1").name);
        }
    }

    @Test
    public void testUnreachableServerWithCachedFallback() throws Exception {
        try (NorthboundClient mock = NorthboundClient.create(
                config("tcp:127.0.0.1:1", true, true), ids,
                new AclTranslator(ids))) {
            assertTrue(mock.isMockMode());
            mock.createLogicalSwitch(overlay("net-1", false));
            assertEquals("ls-net-1", mock.getLogicalSwitch("net-1").name);
        }
    }

    @Test
    public void testInMemoryClientIsMockMode() {
        assertTrue(client.isMockMode());
        assertTrue(client.isConnected());
    }
}
