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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;
import javax.annotation.Nullable;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import org.apache.commons.collections4.ListUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.quantumnet.cluster.config.NorthboundConfig;
import org.quantumnet.cluster.data.domain.BindingType;
import org.quantumnet.cluster.data.domain.LoadBalancer;
import org.quantumnet.cluster.data.domain.NetworkType;
import org.quantumnet.cluster.data.domain.Port;
import org.quantumnet.cluster.data.domain.SecurityGroup;
import org.quantumnet.cluster.data.domain.VirtualNetwork;
import org.quantumnet.cluster.data.ovn.Acl;
import org.quantumnet.cluster.data.ovn.AddressSet;
import org.quantumnet.cluster.data.ovn.DhcpOptions;
import org.quantumnet.cluster.data.ovn.ExternalIds;
import org.quantumnet.cluster.data.ovn.LogicalRouter;
import org.quantumnet.cluster.data.ovn.LogicalRouterPort;
import org.quantumnet.cluster.data.ovn.LogicalSwitch;
import org.quantumnet.cluster.data.ovn.LogicalSwitchPort;
import org.quantumnet.cluster.data.ovn.Nat;
import org.quantumnet.cluster.data.ovn.NatType;
import org.quantumnet.cluster.data.ovn.NorthboundObject;
import org.quantumnet.cluster.data.ovn.OvnLoadBalancer;
import org.quantumnet.cluster.data.ovn.PortGroup;
import org.quantumnet.cluster.data.storage.CachingNorthboundStore;
import org.quantumnet.cluster.data.storage.InMemoryNorthboundStore;
import org.quantumnet.cluster.data.storage.NorthboundConnectionException;
import org.quantumnet.cluster.data.storage.NorthboundException;
import org.quantumnet.cluster.data.storage.NorthboundStore;
import org.quantumnet.cluster.data.storage.NotFoundException;
import org.quantumnet.cluster.data.storage.StorageOp;
import org.quantumnet.cluster.data.storage.RemoteNorthboundStore;
import org.quantumnet.cluster.data.storage.ovsdb.OvsdbConnection;
import org.quantumnet.cluster.data.storage.ovsdb.OvsdbEndpoint;
import org.quantumnet.cluster.naming.IdGenerator;
import org.quantumnet.cluster.naming.OvnNames;
import org.quantumnet.cluster.translators.AclTranslator;
import org.quantumnet.cluster.translators.TranslationResult;
import org.quantumnet.packets.IPSubnet;
import org.quantumnet.packets.MAC;

/**
 * Manages the OVN Northbound objects realising the platform's networks,
 * ports, routers, security groups, NAT rules and load balancers.
 *
 * Every operation that changes more than one object does so in a single
 * {@link NorthboundStore#multi} batch, so that no caller can observe, for
 * instance, a port group referencing an ACL that does not exist. Deletes
 * are idempotent.
 */
public class NorthboundClient implements AutoCloseable {

    private static final Logger log =
        LoggerFactory.getLogger(NorthboundClient.class);

    public static final int DEFAULT_LEASE_TIME = 86400;
    public static final String DEFAULT_LB_PROTOCOL = "tcp";

    private static final String OTHER_CONFIG_VLAN = "vlan";
    private static final String OTHER_CONFIG_SUBNET = "subnet";
    private static final String OTHER_CONFIG_MTU = "mtu";
    private static final String ROUTER_OPT_CHASSIS = "chassis";
    private static final String ADDRESS_ROUTER = "router";
    private static final String ADDRESS_UNKNOWN = "unknown";

    private static final Joiner COMMA = Joiner.on(',');
    private static final Joiner SPACE = Joiner.on(' ');
    private static final Splitter WHITESPACE =
        Splitter.on(' ').omitEmptyStrings().trimResults();

    private final NorthboundStore store;
    private final IdGenerator ids;
    private final AclTranslator translator;
    private final boolean mockMode;

    public NorthboundClient(NorthboundStore store, IdGenerator ids,
                            AclTranslator translator) {
        this.store = store;
        this.ids = ids;
        this.translator = translator;
        NorthboundStore backing = store instanceof CachingNorthboundStore
            ? ((CachingNorthboundStore) store).getDelegate() : store;
        this.mockMode = backing instanceof InMemoryNorthboundStore;
    }

    /**
     * Connects to the Northbound database of the configuration. When the
     * database cannot be reached and fallback to mock is enabled, the
     * client uses an in-memory database for its whole lifetime instead;
     * it never tries to reach the real one again.
     *
     * @throws NorthboundConnectionException if the database cannot be
     *         reached and fallback is disabled.
     */
    public static NorthboundClient create(NorthboundConfig config,
                                          IdGenerator ids,
                                          AclTranslator translator)
            throws NorthboundConnectionException {
        NorthboundStore store;
        try {
            OvsdbEndpoint endpoint;
            try {
                endpoint = OvsdbEndpoint.parse(config.address());
            } catch (IllegalArgumentException e) {
                throw new NorthboundConnectionException(
                    "Invalid Northbound address '" + config.address() + "'",
                    e);
            }
            OvsdbConnection connection =
                new OvsdbConnection(endpoint, config);
            connection.connect();
            store = new RemoteNorthboundStore(connection);
        } catch (NorthboundConnectionException e) {
            if (!config.fallbackToMock())
                throw e;
            log.warn("Northbound database at '{}' is unreachable, using an "
                     + "in-memory database instead: {}", config.address(),
                     e.getMessage());
            store = new InMemoryNorthboundStore();
        }

        if (config.cacheEnabled()) {
            store = new CachingNorthboundStore(store, config.cacheTtl());
        }
        return new NorthboundClient(store, ids, translator);
    }

    public boolean isConnected() {
        return store.isConnected();
    }

    /** Whether the client runs against an in-memory database. */
    public boolean isMockMode() {
        return mockMode;
    }

    @Override
    public void close() {
        log.info("Closing Northbound client");
        store.close();
    }

    /* ------------------------------------------------------------------ */
    /* Logical switches                                                    */
    /* ------------------------------------------------------------------ */

    /**
     * Creates the logical switch of a network. When the network has DHCP
     * enabled, its DHCP options are created too; failing to create them is
     * logged and does not fail the switch creation.
     */
    public LogicalSwitch createLogicalSwitch(VirtualNetwork network)
            throws NorthboundException {
        Preconditions.checkNotNull(network, "network is null");
        String name = OvnNames.logicalSwitch(network.id);
        VirtualNetwork.Spec spec =
            network.spec == null ? new VirtualNetwork.Spec() : network.spec;

        log.info("Creating logical switch {} for network {} of type {}",
                 name, network.id, spec.type);

        LogicalSwitch ls = new LogicalSwitch(ids.newUuid(), name);
        ls.putExternalId(ExternalIds.NETWORK_ID, network.id);
        ls.putExternalId(ExternalIds.PROJECT_ID,
                         StringUtils.defaultString(network.projectId));
        ls.putExternalId(ExternalIds.NAME,
                         StringUtils.defaultString(network.name));

        if (spec.type == NetworkType.VLAN && spec.vlan != null) {
            ls.otherConfig.put(OTHER_CONFIG_VLAN,
                               Integer.toString(spec.vlan.vlanId));
        } else if (spec.type == NetworkType.OVERLAY && spec.ipConfig != null
                   && StringUtils.isNotEmpty(spec.ipConfig.ipv4Subnet)) {
            ls.otherConfig.put(OTHER_CONFIG_SUBNET, spec.ipConfig.ipv4Subnet);
        }
        if (spec.mtu > 0) {
            ls.otherConfig.put(OTHER_CONFIG_MTU, Integer.toString(spec.mtu));
        }

        store.create(ls);

        if (network.dhcpEnabled()) {
            try {
                createNetworkDhcpOptions(name, network);
            } catch (NorthboundException | IllegalArgumentException e) {
                log.warn("Failed to create DHCP options of switch {}: {}",
                         name, e.getMessage());
            }
        }

        log.info("Created logical switch {} ({})", name, ls.uuid);
        return ls;
    }

    public LogicalSwitch getLogicalSwitch(String networkId)
            throws NorthboundException {
        return store.get(LogicalSwitch.class,
                         OvnNames.logicalSwitch(networkId));
    }

    public List<LogicalSwitch> listLogicalSwitches()
            throws NorthboundException {
        return store.getAll(LogicalSwitch.class);
    }

    /**
     * Deletes the switch of a network together with its ports and the DHCP
     * options created for it.
     */
    public void deleteLogicalSwitch(String networkId)
            throws NorthboundException {
        String name = OvnNames.logicalSwitch(networkId);
        log.info("Deleting logical switch {} of network {}", name, networkId);

        List<StorageOp> ops = new ArrayList<>();
        LogicalSwitch ls = find(LogicalSwitch.class, name);
        if (ls != null) {
            for (LogicalSwitchPort lsp : store.getAll(LogicalSwitchPort.class)) {
                if (ls.ports.contains(lsp.uuid))
                    ops.addAll(detachPort(lsp));
            }
        }
        for (DhcpOptions dhcp : dhcpOptionsOfSwitch(name)) {
            ops.add(StorageOp.delete(DhcpOptions.class, dhcp.uuid));
        }
        ops.add(StorageOp.delete(LogicalSwitch.class, name));
        store.multi(ops);
    }

    /* ------------------------------------------------------------------ */
    /* Logical switch ports                                                */
    /* ------------------------------------------------------------------ */

    /**
     * Creates the logical port of a platform port on the switch of its
     * network, which must exist.
     *
     * @throws IllegalArgumentException if the port has no valid MAC address.
     */
    public LogicalSwitchPort createLogicalSwitchPort(Port port)
            throws NorthboundException {
        Preconditions.checkNotNull(port, "port is null");
        Port.Spec spec = port.spec == null ? new Port.Spec() : port.spec;
        Preconditions.checkArgument(StringUtils.isNotBlank(spec.macAddress),
                                    "port %s has no MAC address", port.id);
        String mac = MAC.parse(spec.macAddress).toString();
        Port.Status status =
            port.status == null ? new Port.Status() : port.status;
        String switchName = OvnNames.logicalSwitch(port.networkId);
        String portName = OvnNames.logicalSwitchPort(port.id);

        log.info("Creating logical switch port {} on {}", portName,
                 switchName);

        List<String> parts = new ArrayList<>();
        parts.add(mac);
        parts.addAll(port.ipAddresses());
        String address = SPACE.join(parts);

        LogicalSwitchPort lsp = new LogicalSwitchPort(ids.newUuid(), portName);
        lsp.addresses.add(address);
        lsp.enabled = true;
        lsp.putExternalId(ExternalIds.PORT_ID, port.id);
        lsp.putExternalId(ExternalIds.VM_ID,
                          StringUtils.defaultString(status.vmId));

        if (spec.portSecurityEnabled && spec.securityGroupIds != null
            && !spec.securityGroupIds.isEmpty()) {
            lsp.portSecurity.add(address);
        }

        BindingType binding =
            spec.binding == null ? BindingType.NORMAL : spec.binding.type;
        if (binding == BindingType.DIRECT) {
            lsp.type = LogicalSwitchPort.TYPE_DIRECT;
            if (StringUtils.isNotEmpty(status.hostId))
                lsp.options.put(LogicalSwitchPort.OPT_REQUESTED_CHASSIS,
                                status.hostId);
        } else if (binding == BindingType.VHOST_USER) {
            lsp.type = LogicalSwitchPort.TYPE_VHOST_USER;
            if (StringUtils.isNotEmpty(spec.binding.vhostSocket))
                lsp.options.put(LogicalSwitchPort.OPT_VHOST_SOCK,
                                spec.binding.vhostSocket);
        }

        DhcpOptions dhcp = findDhcpOptions(port.networkId);
        if (dhcp != null) {
            lsp.dhcpv4Options = dhcp.uuid;
        }

        store.multi(List.of(
            StorageOp.create(lsp),
            StorageOp.insert(LogicalSwitch.class, switchName, "ports",
                             lsp.uuid)));

        log.info("Created logical switch port {} ({}) with addresses {}",
                 portName, lsp.uuid, lsp.addresses);
        return lsp;
    }

    public LogicalSwitchPort getLogicalSwitchPort(String portId)
            throws NorthboundException {
        return store.get(LogicalSwitchPort.class,
                         OvnNames.logicalSwitchPort(portId));
    }

    /**
     * Deletes the logical port of a platform port, detaching it from its
     * switch and from every port group, and removing its addresses from
     * the address sets of those groups.
     */
    public void deleteLogicalSwitchPort(String portId)
            throws NorthboundException {
        String portName = OvnNames.logicalSwitchPort(portId);
        log.info("Deleting logical switch port {}", portName);

        LogicalSwitchPort lsp = find(LogicalSwitchPort.class, portName);
        if (lsp == null) return;
        store.multi(detachPort(lsp));
    }

    /**
     * Records the VM a port belongs to and pins the port to a hypervisor.
     */
    public void bindPort(String portId, String vmId, String hostId)
            throws NorthboundException {
        String portName = OvnNames.logicalSwitchPort(portId);
        log.info("Binding port {} to VM {} on host {}", portName, vmId,
                 hostId);

        LogicalSwitchPort lsp =
            store.get(LogicalSwitchPort.class, portName);
        lsp.putExternalId(ExternalIds.VM_ID, vmId);
        lsp.options.put(LogicalSwitchPort.OPT_REQUESTED_CHASSIS, hostId);
        store.update(lsp);
    }

    /**
     * Connects the switch of a network to a physical network, tagging its
     * traffic with the VLAN id when that is positive.
     */
    public LogicalSwitchPort createLocalnetPort(String networkId, int vlanId,
                                                String physicalNetwork)
            throws NorthboundException {
        String switchName = OvnNames.logicalSwitch(networkId);
        String portName = OvnNames.localnetPort(switchName);
        log.info("Creating localnet port {} to {} with VLAN {}", portName,
                 physicalNetwork, vlanId);

        LogicalSwitchPort lsp = new LogicalSwitchPort(ids.newUuid(), portName);
        lsp.type = LogicalSwitchPort.TYPE_LOCALNET;
        lsp.addresses.add(ADDRESS_UNKNOWN);
        lsp.enabled = true;
        lsp.options.put(LogicalSwitchPort.OPT_NETWORK_NAME, physicalNetwork);
        lsp.putExternalId(ExternalIds.NETWORK_ID, networkId);
        if (vlanId > 0) {
            lsp.tag = vlanId;
        }

        store.multi(List.of(
            StorageOp.create(lsp),
            StorageOp.insert(LogicalSwitch.class, switchName, "ports",
                             lsp.uuid)));
        return lsp;
    }

    /** The name of the logical port of a platform port. */
    public String getOvnPortName(String portId) {
        return OvnNames.logicalSwitchPort(portId);
    }

    /* ------------------------------------------------------------------ */
    /* Logical routers                                                     */
    /* ------------------------------------------------------------------ */

    public LogicalRouter createLogicalRouter(String routerId,
                                             String projectId,
                                             boolean distributed)
            throws NorthboundException {
        String name = OvnNames.logicalRouter(routerId);
        log.info("Creating logical router {}, distributed={}", name,
                 distributed);

        LogicalRouter lr = new LogicalRouter(ids.newUuid(), name);
        lr.enabled = true;
        lr.putExternalId(ExternalIds.ROUTER_ID, routerId);
        lr.putExternalId(ExternalIds.PROJECT_ID,
                         StringUtils.defaultString(projectId));
        if (distributed) {
            // no chassis: the router runs on every chassis
            lr.options.put(ROUTER_OPT_CHASSIS, "");
        }

        store.create(lr);
        return lr;
    }

    public LogicalRouter getLogicalRouter(String routerId)
            throws NorthboundException {
        return store.get(LogicalRouter.class,
                         OvnNames.logicalRouter(routerId));
    }

    /**
     * Deletes a router with its ports, the switch ports peered with them
     * and its NAT rules.
     */
    public void deleteLogicalRouter(String routerId)
            throws NorthboundException {
        String name = OvnNames.logicalRouter(routerId);
        log.info("Deleting logical router {}", name);

        LogicalRouter lr = find(LogicalRouter.class, name);
        if (lr == null) return;

        List<StorageOp> ops = new ArrayList<>();
        for (LogicalRouterPort lrp : store.getAll(LogicalRouterPort.class)) {
            if (!lr.ports.contains(lrp.uuid)) continue;
            ops.add(StorageOp.delete(LogicalRouterPort.class, lrp.name));
            for (LogicalSwitchPort peer : peersOf(lrp.name)) {
                ops.addAll(detachPort(peer));
            }
        }
        for (String natUuid : lr.nat) {
            ops.add(StorageOp.delete(Nat.class, natUuid));
        }
        ops.add(StorageOp.delete(LogicalRouter.class, name));
        store.multi(ops);
    }

    /**
     * Links a router to the switch of a network: a router port holding the
     * gateway address and its peer port on the switch are created together.
     *
     * @param gatewayCidr the router address on the network, e.g.
     *        "192.168.1.1/24".
     */
    public LogicalRouterPort addRouterInterface(String routerId,
                                                String networkId,
                                                String gatewayCidr)
            throws NorthboundException {
        Preconditions.checkArgument(IPSubnet.isValidCidr(gatewayCidr),
                                    "invalid gateway %s", gatewayCidr);
        String routerName = OvnNames.logicalRouter(routerId);
        String switchName = OvnNames.logicalSwitch(networkId);
        String lrpName = OvnNames.routerPort(routerName, switchName);
        String peerName = OvnNames.switchRouterPort(switchName, routerName);

        log.info("Adding interface {} of router {} on switch {} with "
                 + "gateway {}", lrpName, routerName, switchName,
                 gatewayCidr);

        List<String> networks = new ArrayList<>();
        networks.add(gatewayCidr.trim());
        LogicalRouterPort lrp = new LogicalRouterPort(
            ids.newUuid(), lrpName, ids.newMac(), networks);
        lrp.enabled = true;
        lrp.putExternalId(ExternalIds.NETWORK_ID, networkId);

        LogicalSwitchPort peer = new LogicalSwitchPort(ids.newUuid(),
                                                       peerName);
        peer.type = LogicalSwitchPort.TYPE_ROUTER;
        peer.addresses.add(ADDRESS_ROUTER);
        peer.options.put(LogicalSwitchPort.OPT_ROUTER_PORT, lrpName);
        peer.putExternalId(ExternalIds.NETWORK_ID, networkId);
        peer.putExternalId(ExternalIds.ROUTER_ID, routerId);

        store.multi(List.of(
            StorageOp.create(lrp),
            StorageOp.insert(LogicalRouter.class, routerName, "ports",
                             lrp.uuid),
            StorageOp.create(peer),
            StorageOp.insert(LogicalSwitch.class, switchName, "ports",
                             peer.uuid)));
        return lrp;
    }

    /**
     * Unlinks a router from the switch of a network.
     */
    public void removeRouterInterface(String routerId, String networkId)
            throws NorthboundException {
        String routerName = OvnNames.logicalRouter(routerId);
        String switchName = OvnNames.logicalSwitch(networkId);
        String lrpName = OvnNames.routerPort(routerName, switchName);
        log.info("Removing interface {} of router {}", lrpName, routerName);

        List<StorageOp> ops = new ArrayList<>();
        LogicalRouterPort lrp = find(LogicalRouterPort.class, lrpName);
        if (lrp != null) {
            if (store.exists(LogicalRouter.class, routerName))
                ops.add(StorageOp.remove(LogicalRouter.class, routerName,
                                         "ports", lrp.uuid));
            ops.add(StorageOp.delete(LogicalRouterPort.class, lrpName));
        }
        LogicalSwitchPort peer = find(
            LogicalSwitchPort.class,
            OvnNames.switchRouterPort(switchName, routerName));
        if (peer != null) {
            ops.addAll(detachPort(peer));
        }
        if (!ops.isEmpty()) store.multi(ops);
    }

    public LogicalRouterPort getLogicalRouterPort(String routerId,
                                                  String networkId)
            throws NorthboundException {
        return store.get(LogicalRouterPort.class, OvnNames.routerPort(
            OvnNames.logicalRouter(routerId),
            OvnNames.logicalSwitch(networkId)));
    }

    /* ------------------------------------------------------------------ */
    /* ACLs, address sets and port groups                                  */
    /* ------------------------------------------------------------------ */

    /**
     * Creates an ACL and attaches it to an existing port group.
     */
    public Acl createAcl(Acl acl, String portGroupName)
            throws NorthboundException {
        if (acl.uuid == null) acl.uuid = ids.newUuid();
        store.multi(List.of(
            StorageOp.create(acl),
            StorageOp.insert(PortGroup.class, portGroupName, "acls",
                             acl.uuid)));
        return acl;
    }

    public Acl getAcl(String uuid) throws NorthboundException {
        return store.get(Acl.class, uuid);
    }

    /**
     * Deletes an ACL, detaching it from the port groups and switches
     * referencing it.
     */
    public void deleteAcl(String uuid) throws NorthboundException {
        List<StorageOp> ops = new ArrayList<>();
        for (PortGroup pg : store.getAll(PortGroup.class)) {
            if (pg.acls.contains(uuid))
                ops.add(StorageOp.remove(PortGroup.class, pg.name, "acls",
                                         uuid));
        }
        for (LogicalSwitch ls : store.getAll(LogicalSwitch.class)) {
            if (ls.acls.contains(uuid))
                ops.add(StorageOp.remove(LogicalSwitch.class, ls.name,
                                         "acls", uuid));
        }
        ops.add(StorageOp.delete(Acl.class, uuid));
        store.multi(ops);
    }

    public AddressSet createAddressSet(AddressSet addressSet)
            throws NorthboundException {
        if (addressSet.uuid == null) addressSet.uuid = ids.newUuid();
        store.create(addressSet);
        return addressSet;
    }

    public AddressSet getAddressSet(String name) throws NorthboundException {
        return store.get(AddressSet.class, name);
    }

    public void updateAddressSet(AddressSet addressSet)
            throws NorthboundException {
        store.update(addressSet);
    }

    public void deleteAddressSet(String name) throws NorthboundException {
        store.delete(AddressSet.class, name);
    }

    public PortGroup createPortGroup(PortGroup portGroup)
            throws NorthboundException {
        if (portGroup.uuid == null) portGroup.uuid = ids.newUuid();
        store.create(portGroup);
        return portGroup;
    }

    public PortGroup getPortGroup(String name) throws NorthboundException {
        return store.get(PortGroup.class, name);
    }

    public void addPortToPortGroup(String portGroupName, String portUuid)
            throws NorthboundException {
        store.multi(List.of(StorageOp.insert(PortGroup.class, portGroupName,
                                             "ports", portUuid)));
    }

    public void removePortFromPortGroup(String portGroupName, String portUuid)
            throws NorthboundException {
        store.multi(List.of(StorageOp.remove(PortGroup.class, portGroupName,
                                             "ports", portUuid)));
    }

    /**
     * Deletes a port group together with the ACLs it owns.
     */
    public void deletePortGroup(String name) throws NorthboundException {
        PortGroup pg = find(PortGroup.class, name);
        if (pg == null) return;
        store.multi(deletePortGroupOps(pg));
    }

    private static List<StorageOp> deletePortGroupOps(PortGroup pg) {
        List<StorageOp> ops = new ArrayList<>();
        for (String aclUuid : pg.acls) {
            ops.add(StorageOp.delete(Acl.class, aclUuid));
        }
        ops.add(StorageOp.delete(PortGroup.class, pg.name));
        return ops;
    }

    /* ------------------------------------------------------------------ */
    /* Security groups                                                     */
    /* ------------------------------------------------------------------ */

    /**
     * Creates the address set, the port group and the ACLs of a security
     * group in one batch.
     *
     * @return the translation, listing the rules that were skipped.
     */
    public TranslationResult createSecurityGroupAcls(SecurityGroup sg)
            throws NorthboundException {
        TranslationResult result = translator.translate(sg);
        log.info("Creating {} ACLs of security group {}",
                 result.getAcls().size(), sg.id);

        List<StorageOp> ops = new ArrayList<>();
        ops.add(StorageOp.create(newAddressSet(sg.id)));
        for (Acl acl : result.getAcls()) {
            ops.add(StorageOp.create(acl));
        }
        ops.add(StorageOp.create(result.getPortGroup()));
        store.multi(ops);
        return result;
    }

    /**
     * Regenerates every ACL of a security group after a change of its rules.
     * The ports of the group are kept.
     */
    public TranslationResult updateSecurityGroupAcls(SecurityGroup sg)
            throws NorthboundException {
        Preconditions.checkNotNull(sg, "security group is null");
        PortGroup current = find(PortGroup.class, OvnNames.portGroup(sg.id));
        if (current == null)
            return createSecurityGroupAcls(sg);

        TranslationResult result = translator.translate(sg);
        log.info("Replacing {} ACLs of security group {} with {}",
                 current.acls.size(), sg.id, result.getAcls().size());

        PortGroup pg = result.getPortGroup();
        pg.uuid = current.uuid;
        pg.ports = current.ports;

        List<StorageOp> ops = new ArrayList<>();
        for (String aclUuid : current.acls) {
            ops.add(StorageOp.delete(Acl.class, aclUuid));
        }
        for (Acl acl : result.getAcls()) {
            ops.add(StorageOp.create(acl));
        }
        ops.add(StorageOp.update(pg));
        if (!store.exists(AddressSet.class, OvnNames.addressSet(sg.id))) {
            ops.add(StorageOp.create(newAddressSet(sg.id)));
        }
        store.multi(ops);
        return result;
    }

    /**
     * Deletes the port group of a security group with its ACLs, then its
     * address set.
     */
    public void deleteSecurityGroupAcls(String sgId)
            throws NorthboundException {
        log.info("Deleting ACLs of security group {}", sgId);
        List<StorageOp> ops = new ArrayList<>();
        PortGroup pg = find(PortGroup.class, OvnNames.portGroup(sgId));
        if (pg != null) {
            ops.addAll(deletePortGroupOps(pg));
        }
        ops.add(StorageOp.delete(AddressSet.class,
                                 OvnNames.addressSet(sgId)));
        store.multi(ops);
    }

    /**
     * Adds a port to the port group of a security group and its addresses
     * to the group's address set.
     */
    public void applySecurityGroupToPort(String portId, String sgId)
            throws NorthboundException {
        LogicalSwitchPort lsp = getLogicalSwitchPort(portId);
        String pgName = OvnNames.portGroup(sgId);
        log.debug("Applying security group {} to port {}", sgId, lsp.name);

        List<StorageOp> ops = new ArrayList<>();
        ops.add(StorageOp.insert(PortGroup.class, pgName, "ports", lsp.uuid));
        String asName = OvnNames.addressSet(sgId);
        List<String> ips = ipsOf(lsp);
        if (!ips.isEmpty() && store.exists(AddressSet.class, asName)) {
            ops.add(StorageOp.insert(AddressSet.class, asName, "addresses",
                                     ips));
        }
        store.multi(ops);
    }

    public void removeSecurityGroupFromPort(String portId, String sgId)
            throws NorthboundException {
        LogicalSwitchPort lsp = find(LogicalSwitchPort.class,
                                     OvnNames.logicalSwitchPort(portId));
        if (lsp == null) return;
        log.debug("Removing security group {} from port {}", sgId, lsp.name);

        List<StorageOp> ops = new ArrayList<>();
        String pgName = OvnNames.portGroup(sgId);
        if (store.exists(PortGroup.class, pgName))
            ops.add(StorageOp.remove(PortGroup.class, pgName, "ports",
                                     lsp.uuid));
        String asName = OvnNames.addressSet(sgId);
        List<String> ips = ipsOf(lsp);
        if (!ips.isEmpty() && store.exists(AddressSet.class, asName))
            ops.add(StorageOp.remove(AddressSet.class, asName, "addresses",
                                     ips));
        if (!ops.isEmpty()) store.multi(ops);
    }

    private AddressSet newAddressSet(String sgId) {
        AddressSet as = new AddressSet(ids.newUuid(),
                                       OvnNames.addressSet(sgId),
                                       new ArrayList<>());
        as.putExternalId(ExternalIds.SG_ID, sgId);
        return as;
    }

    /* ------------------------------------------------------------------ */
    /* DHCP                                                                */
    /* ------------------------------------------------------------------ */

    /**
     * Creates DHCP options from explicit settings.
     *
     * @return the UUID of the new options.
     */
    public String createDhcpOptions(DhcpOptionsSpec spec)
            throws NorthboundException {
        Preconditions.checkArgument(StringUtils.isNotBlank(spec.cidr),
                                    "CIDR is required for DHCP options");
        log.info("Creating DHCP options for {} with router {}", spec.cidr,
                 spec.router);

        DhcpOptions dhcp = new DhcpOptions(ids.newUuid(), spec.cidr);
        putDhcpOptions(dhcp, spec, ids.newMac());
        store.create(dhcp);
        return dhcp.uuid;
    }

    /**
     * Replaces the CIDR and options of existing DHCP options with explicit
     * settings. External ids and the ports using them are kept, and so is
     * the server MAC when the settings leave it empty.
     */
    public DhcpOptions updateDhcpOptions(String uuid, DhcpOptionsSpec spec)
            throws NorthboundException {
        Preconditions.checkArgument(StringUtils.isNotBlank(spec.cidr),
                                    "CIDR is required for DHCP options");
        DhcpOptions dhcp = store.get(DhcpOptions.class, uuid);
        log.info("Updating DHCP options {} for {} with router {}", uuid,
                 spec.cidr, spec.router);

        String serverMac = dhcp.options.get(DhcpOptions.SERVER_MAC);
        dhcp.cidr = spec.cidr;
        dhcp.options.clear();
        putDhcpOptions(dhcp, spec,
                       serverMac == null ? ids.newMac() : serverMac);
        store.update(dhcp);
        return dhcp;
    }

    private static void putDhcpOptions(DhcpOptions dhcp, DhcpOptionsSpec spec,
                                       String defaultServerMac) {
        dhcp.options.put(DhcpOptions.SERVER_ID,
                         StringUtils.defaultString(spec.serverId));
        dhcp.options.put(DhcpOptions.SERVER_MAC,
                         StringUtils.isEmpty(spec.serverMac)
                         ? defaultServerMac : spec.serverMac);
        dhcp.options.put(DhcpOptions.ROUTER,
                         StringUtils.defaultString(spec.router));
        dhcp.options.put(DhcpOptions.LEASE_TIME, Integer.toString(
            spec.leaseTime > 0 ? spec.leaseTime : DEFAULT_LEASE_TIME));
        if (spec.dnsServers != null && !spec.dnsServers.isEmpty()) {
            dhcp.options.put(DhcpOptions.DNS_SERVER,
                             "{" + Joiner.on(", ").join(spec.dnsServers)
                             + "}");
        }
        if (spec.mtu > 0) {
            dhcp.options.put(DhcpOptions.MTU, Integer.toString(spec.mtu));
        }
        if (StringUtils.isNotEmpty(spec.domainName)) {
            dhcp.options.put(DhcpOptions.DOMAIN_NAME,
                             "\"" + spec.domainName + "\"");
        }
    }

    private DhcpOptions createNetworkDhcpOptions(String switchName,
                                                 VirtualNetwork network)
            throws NorthboundException {
        VirtualNetwork.IpConfig ip = network.spec.ipConfig;
        if (StringUtils.isBlank(ip.ipv4Subnet))
            throw new IllegalArgumentException(
                "IPv4 subnet is required for DHCP");
        VirtualNetwork.DhcpConfig conf = ip.dhcp;
        String gateway = StringUtils.defaultString(ip.ipv4Gateway);

        log.info("Creating DHCP options of switch {} for {}", switchName,
                 ip.ipv4Subnet);

        DhcpOptions dhcp = new DhcpOptions(ids.newUuid(), ip.ipv4Subnet);
        dhcp.options.put(DhcpOptions.SERVER_ID, gateway);
        dhcp.options.put(DhcpOptions.SERVER_MAC, ids.newMac());
        dhcp.options.put(DhcpOptions.ROUTER, gateway);
        dhcp.options.put(DhcpOptions.LEASE_TIME, Integer.toString(
            conf.leaseTimeSec > 0 ? conf.leaseTimeSec : DEFAULT_LEASE_TIME));
        if (conf.dnsServers != null && !conf.dnsServers.isEmpty()) {
            dhcp.options.put(DhcpOptions.DNS_SERVER,
                             COMMA.join(conf.dnsServers));
        }
        if (StringUtils.isNotEmpty(conf.domainName)) {
            dhcp.options.put(DhcpOptions.DOMAIN_NAME,
                             "\"" + conf.domainName + "\"");
        }
        if (conf.ntpServers != null && !conf.ntpServers.isEmpty()) {
            dhcp.options.put(DhcpOptions.NTP_SERVER,
                             COMMA.join(conf.ntpServers));
        }
        dhcp.putExternalId(ExternalIds.NETWORK_ID, network.id);
        dhcp.putExternalId(ExternalIds.SWITCH, switchName);

        store.create(dhcp);
        return dhcp;
    }

    public DhcpOptions getDhcpOptions(String uuid)
            throws NorthboundException {
        return store.get(DhcpOptions.class, uuid);
    }

    /**
     * The DHCP options created for the switch of a network, or null.
     */
    @Nullable
    public DhcpOptions findDhcpOptions(String networkId)
            throws NorthboundException {
        List<DhcpOptions> found =
            dhcpOptionsOfSwitch(OvnNames.logicalSwitch(networkId));
        return found.isEmpty() ? null : found.get(0);
    }

    /**
     * Deletes DHCP options, unlinking them from the ports using them.
     */
    public void deleteDhcpOptions(String uuid) throws NorthboundException {
        List<StorageOp> ops = new ArrayList<>();
        for (LogicalSwitchPort lsp : store.getAll(LogicalSwitchPort.class)) {
            if (uuid.equals(lsp.dhcpv4Options)) {
                lsp.dhcpv4Options = null;
                ops.add(StorageOp.update(lsp));
            }
        }
        ops.add(StorageOp.delete(DhcpOptions.class, uuid));
        store.multi(ops);
    }

    private List<DhcpOptions> dhcpOptionsOfSwitch(String switchName)
            throws NorthboundException {
        return filter(DhcpOptions.class,
                      d -> switchName.equals(d.externalId(ExternalIds.SWITCH)));
    }

    /* ------------------------------------------------------------------ */
    /* NAT                                                                 */
    /* ------------------------------------------------------------------ */

    /**
     * Maps a floating IP one to one onto an internal address.
     */
    public Nat createFloatingIpNat(String routerId, String floatingIp,
                                   String internalIp)
            throws NorthboundException {
        String routerName = OvnNames.logicalRouter(routerId);
        log.info("Creating floating IP {} -> {} on router {}", floatingIp,
                 internalIp, routerName);

        Nat nat = new Nat(ids.newUuid(), NatType.DNAT_AND_SNAT, floatingIp,
                          internalIp);
        nat.putExternalId(ExternalIds.FLOATING_IP, floatingIp);
        nat.putExternalId(ExternalIds.ROUTER, routerName);
        addNat(routerName, nat);
        return nat;
    }

    public void deleteFloatingIpNat(String floatingIp)
            throws NorthboundException {
        log.info("Deleting floating IP {}", floatingIp);
        deleteNats(filter(Nat.class,
                          n -> n.type == NatType.DNAT_AND_SNAT
                               && floatingIp.equals(n.externalIp)));
    }

    /**
     * Source NATs the traffic of a subnet leaving through the router.
     *
     * @param logicalSubnet e.g. "10.0.1.0/24".
     */
    public Nat createSnat(String routerId, String externalIp,
                          String logicalSubnet) throws NorthboundException {
        String routerName = OvnNames.logicalRouter(routerId);
        log.info("Creating SNAT of {} to {} on router {}", logicalSubnet,
                 externalIp, routerName);

        Nat nat = new Nat(ids.newUuid(), NatType.SNAT, externalIp,
                          logicalSubnet);
        nat.putExternalId(ExternalIds.SNAT, "true");
        nat.putExternalId(ExternalIds.ROUTER, routerName);
        addNat(routerName, nat);
        return nat;
    }

    public void deleteSnat(String routerId, String logicalSubnet)
            throws NorthboundException {
        String routerName = OvnNames.logicalRouter(routerId);
        log.info("Deleting SNAT of {} on router {}", logicalSubnet,
                 routerName);
        deleteNats(filter(Nat.class,
                          n -> n.type == NatType.SNAT
                               && logicalSubnet.equals(n.logicalIp)
                               && routerName.equals(
                                   n.externalId(ExternalIds.ROUTER))));
    }

    public Nat getNat(String uuid) throws NorthboundException {
        return store.get(Nat.class, uuid);
    }

    public List<Nat> listNats(String routerId) throws NorthboundException {
        LogicalRouter lr = getLogicalRouter(routerId);
        return filter(Nat.class, n -> lr.nat.contains(n.uuid));
    }

    private void addNat(String routerName, Nat nat)
            throws NorthboundException {
        store.multi(List.of(
            StorageOp.create(nat),
            StorageOp.insert(LogicalRouter.class, routerName, "nat",
                             nat.uuid)));
    }

    private void deleteNats(List<Nat> nats) throws NorthboundException {
        if (nats.isEmpty()) return;
        List<StorageOp> ops = new ArrayList<>();
        for (Nat nat : nats) {
            String routerName = nat.externalId(ExternalIds.ROUTER);
            if (routerName != null
                && store.exists(LogicalRouter.class, routerName))
                ops.add(StorageOp.remove(LogicalRouter.class, routerName,
                                         "nat", nat.uuid));
            ops.add(StorageOp.delete(Nat.class, nat.uuid));
        }
        store.multi(ops);
    }

    /* ------------------------------------------------------------------ */
    /* Load balancers                                                      */
    /* ------------------------------------------------------------------ */

    public OvnLoadBalancer createLoadBalancer(LoadBalancer lb)
            throws NorthboundException {
        Preconditions.checkNotNull(lb, "load balancer is null");
        log.info("Creating load balancer {} ({}) on VIP {}", lb.id, lb.name,
                 lb.spec == null ? null : lb.spec.vip);
        OvnLoadBalancer ovnLb = toOvn(lb, ids.newUuid());
        store.create(ovnLb);
        return ovnLb;
    }

    /**
     * Rewrites the VIPs of an existing load balancer in place, keeping its
     * UUID and hence its switch and router attachments.
     */
    public OvnLoadBalancer updateLoadBalancer(LoadBalancer lb)
            throws NorthboundException {
        Preconditions.checkNotNull(lb, "load balancer is null");
        OvnLoadBalancer current =
            find(OvnLoadBalancer.class, OvnNames.loadBalancer(lb.id));
        if (current == null)
            return createLoadBalancer(lb);

        log.info("Updating load balancer {}", lb.id);
        OvnLoadBalancer ovnLb = toOvn(lb, current.uuid);
        store.update(ovnLb);
        return ovnLb;
    }

    public void deleteLoadBalancer(String lbId) throws NorthboundException {
        String name = OvnNames.loadBalancer(lbId);
        log.info("Deleting load balancer {}", name);

        OvnLoadBalancer lb = find(OvnLoadBalancer.class, name);
        if (lb == null) return;

        List<StorageOp> ops = new ArrayList<>();
        for (LogicalSwitch ls : store.getAll(LogicalSwitch.class)) {
            if (ls.loadBalancer.contains(lb.uuid))
                ops.add(StorageOp.remove(LogicalSwitch.class, ls.name,
                                         "load_balancer", lb.uuid));
        }
        for (LogicalRouter lr : store.getAll(LogicalRouter.class)) {
            if (lr.loadBalancer.contains(lb.uuid))
                ops.add(StorageOp.remove(LogicalRouter.class, lr.name,
                                         "load_balancer", lb.uuid));
        }
        ops.add(StorageOp.delete(OvnLoadBalancer.class, name));
        store.multi(ops);
    }

    public OvnLoadBalancer getLoadBalancer(String lbId)
            throws NorthboundException {
        return store.get(OvnLoadBalancer.class, OvnNames.loadBalancer(lbId));
    }

    public void assignLoadBalancerToSwitch(String lbId, String networkId)
            throws NorthboundException {
        OvnLoadBalancer lb = getLoadBalancer(lbId);
        String switchName = OvnNames.logicalSwitch(networkId);
        log.info("Assigning load balancer {} to switch {}", lb.name,
                 switchName);
        store.multi(List.of(StorageOp.insert(
            LogicalSwitch.class, switchName, "load_balancer", lb.uuid)));
    }

    public void assignLoadBalancerToRouter(String lbId, String routerId)
            throws NorthboundException {
        OvnLoadBalancer lb = getLoadBalancer(lbId);
        String routerName = OvnNames.logicalRouter(routerId);
        log.info("Assigning load balancer {} to router {}", lb.name,
                 routerName);
        store.multi(List.of(StorageOp.insert(
            LogicalRouter.class, routerName, "load_balancer", lb.uuid)));
    }

    /**
     * One VIP per listener, "vip:port", mapped to the members serving that
     * listener. A member without listener serves every listener. Listeners
     * without members are left out.
     */
    static OvnLoadBalancer toOvn(LoadBalancer lb, String uuid) {
        LoadBalancer.Spec spec =
            lb.spec == null ? new LoadBalancer.Spec() : lb.spec;
        String protocol = StringUtils.isBlank(spec.protocol)
                          ? DEFAULT_LB_PROTOCOL
                          : spec.protocol.trim().toLowerCase(Locale.ROOT);

        OvnLoadBalancer ovnLb = new OvnLoadBalancer(
            uuid, OvnNames.loadBalancer(lb.id), protocol);
        Map<String, String> vips = new LinkedHashMap<>();
        for (LoadBalancer.Listener listener
                 : ListUtils.emptyIfNull(spec.listeners)) {
            List<String> backends = new ArrayList<>();
            for (LoadBalancer.Member member
                     : ListUtils.emptyIfNull(spec.members)) {
                if (StringUtils.isEmpty(member.listenerId)
                    || member.listenerId.equals(listener.id)) {
                    backends.add(member.address + ":" + member.port);
                }
            }
            if (!backends.isEmpty()) {
                vips.put(spec.vip + ":" + listener.port,
                         COMMA.join(backends));
            }
        }
        ovnLb.vips = vips;
        ovnLb.putExternalId(ExternalIds.LB_ID, lb.id);
        ovnLb.putExternalId(ExternalIds.PROJECT_ID,
                            StringUtils.defaultString(lb.projectId));
        return ovnLb;
    }

    /* ------------------------------------------------------------------ */
    /* Helpers                                                             */
    /* ------------------------------------------------------------------ */

    /** The object with the given key, or null. */
    @Nullable
    private <T extends NorthboundObject> T find(Class<T> clazz, String key)
            throws NorthboundException {
        try {
            return store.get(clazz, key);
        } catch (NotFoundException e) {
            return null;
        }
    }

    private <T extends NorthboundObject> List<T> filter(Class<T> clazz,
                                                        Predicate<T> pred)
            throws NorthboundException {
        List<T> matching = new ArrayList<>();
        for (T obj : store.getAll(clazz)) {
            if (pred.test(obj)) matching.add(obj);
        }
        return matching;
    }

    private List<LogicalSwitchPort> peersOf(String routerPortName)
            throws NorthboundException {
        return filter(LogicalSwitchPort.class,
                      p -> routerPortName.equals(
                          p.options.get(LogicalSwitchPort.OPT_ROUTER_PORT)));
    }

    /**
     * Operations deleting a switch port and every reference to it.
     */
    private List<StorageOp> detachPort(LogicalSwitchPort lsp)
            throws NorthboundException {
        List<StorageOp> ops = new ArrayList<>();
        for (LogicalSwitch ls : store.getAll(LogicalSwitch.class)) {
            if (ls.ports.contains(lsp.uuid))
                ops.add(StorageOp.remove(LogicalSwitch.class, ls.name,
                                         "ports", lsp.uuid));
        }
        List<String> ips = ipsOf(lsp);
        for (PortGroup pg : store.getAll(PortGroup.class)) {
            if (!pg.ports.contains(lsp.uuid)) continue;
            ops.add(StorageOp.remove(PortGroup.class, pg.name, "ports",
                                     lsp.uuid));
            String sgId = pg.externalId(ExternalIds.SG_ID);
            if (sgId != null && !ips.isEmpty()
                && store.exists(AddressSet.class, OvnNames.addressSet(sgId)))
                ops.add(StorageOp.remove(AddressSet.class,
                                         OvnNames.addressSet(sgId),
                                         "addresses", ips));
        }
        ops.add(StorageOp.delete(LogicalSwitchPort.class, lsp.name));
        return ops;
    }

    /**
     * IP addresses of a switch port, taken from its "MAC IP..." addresses.
     */
    static List<String> ipsOf(LogicalSwitchPort lsp) {
        List<String> ips = new ArrayList<>();
        for (String address : lsp.addresses) {
            List<String> parts = WHITESPACE.splitToList(address);
            for (int i = 1; i < parts.size(); i++) {
                ips.add(parts.get(i));
            }
        }
        return ips;
    }
}
