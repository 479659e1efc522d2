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

import java.io.EOFException;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.security.GeneralSecurityException;
import java.security.KeyStore;

import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManagerFactory;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.quantumnet.cluster.config.NorthboundConfig;
import org.quantumnet.cluster.data.storage.NorthboundConnectionException;

/**
 * JSON-RPC 1.0 session with an OVSDB server over TCP or SSL.
 *
 * Requests are serialized over the single socket. The socket read timeout
 * is the request timeout, so no call blocks for longer than that. When the
 * connection drops, the next request reconnects, waiting the reconnect
 * interval between attempts and giving up after the configured number of
 * attempts.
 */
public class OvsdbConnection implements NorthboundConnection {

    private static final Logger log =
        LoggerFactory.getLogger(OvsdbConnection.class);

    private final OvsdbEndpoint endpoint;
    private final NorthboundConfig config;
    private final ObjectMapper mapper = new ObjectMapper();

    private Socket socket;
    private OutputStream output;
    private JsonParser input;
    private long lastRequestId = 0;
    private boolean wasConnected = false;
    private boolean closed = false;

    public OvsdbConnection(OvsdbEndpoint endpoint, NorthboundConfig config) {
        this.endpoint = endpoint;
        this.config = config;
    }

    public OvsdbEndpoint getEndpoint() {
        return endpoint;
    }

    @Override
    public synchronized void connect() throws NorthboundConnectionException {
        if (closed)
            throw new NorthboundConnectionException(
                "Connection to " + endpoint + " is closed");
        if (isConnected()) return;
        open();
    }

    @Override
    public synchronized boolean isConnected() {
        return socket != null && socket.isConnected() && !socket.isClosed();
    }

    @Override
    public ArrayNode transact(ArrayNode operations)
            throws NorthboundConnectionException {
        ArrayNode params = mapper.createArrayNode().add(DATABASE);
        params.addAll(operations);
        JsonNode result = call("transact", params);
        if (result == null || !result.isArray())
            throw new NorthboundConnectionException(
                "Malformed transact reply from " + endpoint + ": " + result);
        return (ArrayNode) result;
    }

    @Override
    public synchronized void close() {
        closed = true;
        disconnect();
    }

    private synchronized JsonNode call(String method, ArrayNode params)
            throws NorthboundConnectionException {
        if (closed)
            throw new NorthboundConnectionException(
                "Connection to " + endpoint + " is closed");
        if (!isConnected()) {
            if (wasConnected) reconnect();
            else open();
        }
        return rpc(method, params);
    }

    private void open() throws NorthboundConnectionException {
        log.debug("Connecting to OVSDB server at {}", endpoint);
        int connectTimeout = (int) config.connectTimeout().toMillis();
        Socket s = new Socket();
        try {
            s.connect(new InetSocketAddress(endpoint.getHost(),
                                            endpoint.getPort()),
                      connectTimeout);
            if (endpoint.getTransport() == OvsdbEndpoint.Transport.SSL) {
                SSLSocket ssl = (SSLSocket) sslSocketFactory(config)
                    .createSocket(s, endpoint.getHost(), endpoint.getPort(),
                                  true);
                ssl.setSoTimeout(connectTimeout);
                ssl.startHandshake();
                s = ssl;
            }
            s.setSoTimeout((int) config.requestTimeout().toMillis());
            s.setTcpNoDelay(true);
            socket = s;
            output = s.getOutputStream();
            input = mapper.getFactory().createParser(s.getInputStream());
        } catch (IOException | GeneralSecurityException e) {
            closeQuietly(s);
            throw new NorthboundConnectionException(
                "Cannot connect to OVSDB server at " + endpoint, e);
        }

        JsonNode dbs = rpc("list_dbs", mapper.createArrayNode());
        if (dbs == null || !dbs.isArray()) {
            disconnect();
            throw new NorthboundConnectionException(
                "Unexpected list_dbs reply from " + endpoint + ": " + dbs);
        }
        boolean served = false;
        for (JsonNode db : dbs) {
            served |= DATABASE.equals(db.asText());
        }
        if (!served) {
            disconnect();
            throw new NorthboundConnectionException(
                "OVSDB server at " + endpoint + " does not serve "
                + DATABASE + ", databases: " + dbs);
        }
        wasConnected = true;
        log.info("Connected to {} at {}", DATABASE, endpoint);
    }

    private void reconnect() throws NorthboundConnectionException {
        int attempts = config.maxReconnectAttempts();
        if (attempts <= 0)
            throw new NorthboundConnectionException(
                "Lost connection to " + endpoint
                + " and reconnection is disabled");

        long interval = config.reconnectInterval().toMillis();
        NorthboundConnectionException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                open();
                return;
            } catch (NorthboundConnectionException e) {
                last = e;
                log.warn("Reconnection {}/{} to {} failed: {}",
                         attempt, attempts, endpoint, e.getMessage());
            }
            if (attempt < attempts) {
                try {
                    Thread.sleep(interval);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new NorthboundConnectionException(
                        "Interrupted while reconnecting to " + endpoint, e);
                }
            }
        }
        throw new NorthboundConnectionException(
            "Giving up on " + endpoint + " after " + attempts
            + " reconnection attempts", last);
    }

    /**
     * Sends one request and reads messages until its reply arrives,
     * answering the server's echo requests meanwhile.
     */
    private JsonNode rpc(String method, ArrayNode params)
            throws NorthboundConnectionException {
        long id = ++lastRequestId;
        ObjectNode request = mapper.createObjectNode();
        request.put("method", method);
        request.set("params", params);
        request.put("id", id);

        try {
            send(request);
            while (true) {
                JsonNode msg = mapper.readTree(input);
                if (msg == null)
                    throw new EOFException("connection closed by server");
                if (msg.hasNonNull("method")) {
                    handleRequest(msg);
                    continue;
                }
                if (msg.path("id").asLong(-1) != id) {
                    log.debug("Ignoring unexpected message {}", msg);
                    continue;
                }
                JsonNode error = msg.get("error");
                if (error != null && !error.isNull())
                    throw new NorthboundConnectionException(
                        method + " on " + endpoint + " failed: " + error);
                return msg.get("result");
            }
        } catch (IOException e) {
            disconnect();
            throw new NorthboundConnectionException(
                method + " on " + endpoint + " failed", e);
        }
    }

    private void handleRequest(JsonNode msg) throws IOException {
        String method = msg.get("method").asText();
        if ("echo".equals(method)) {
            ObjectNode reply = mapper.createObjectNode();
            reply.set("id", msg.get("id"));
            reply.set("result", msg.get("params"));
            reply.putNull("error");
            send(reply);
        } else {
            log.debug("Ignoring {} request from {}", method, endpoint);
        }
    }

    private void send(ObjectNode msg) throws IOException {
        output.write(mapper.writeValueAsBytes(msg));
        output.flush();
    }

    private void disconnect() {
        if (socket != null) {
            log.info("Disconnecting from {}", endpoint);
            closeQuietly(socket);
        }
        socket = null;
        output = null;
        input = null;
    }

    private static void closeQuietly(Socket s) {
        try {
            s.close();
        } catch (IOException e) {
            log.debug("Error closing socket", e);
        }
    }

    static SSLSocketFactory sslSocketFactory(NorthboundConfig config)
            throws IOException, GeneralSecurityException {
        KeyManagerFactory kmf = null;
        if (StringUtils.isNotEmpty(config.sslKeyStore())) {
            char[] password = config.sslKeyStorePassword().toCharArray();
            kmf = KeyManagerFactory.getInstance(
                KeyManagerFactory.getDefaultAlgorithm());
            kmf.init(loadKeyStore(config.sslKeyStore(), password), password);
        }
        TrustManagerFactory tmf = null;
        if (StringUtils.isNotEmpty(config.sslTrustStore())) {
            tmf = TrustManagerFactory.getInstance(
                TrustManagerFactory.getDefaultAlgorithm());
            tmf.init(loadKeyStore(config.sslTrustStore(),
                                  config.sslTrustStorePassword()
                                        .toCharArray()));
        }
        SSLContext context = SSLContext.getInstance("TLS");
        context.init(kmf == null ? null : kmf.getKeyManagers(),
                     tmf == null ? null : tmf.getTrustManagers(), null);
        return context.getSocketFactory();
    }

    private static KeyStore loadKeyStore(String path, char[] password)
            throws IOException, GeneralSecurityException {
        KeyStore store = KeyStore.getInstance(KeyStore.getDefaultType());
        try (InputStream in = new FileInputStream(path)) {
            store.load(in, password);
        }
        return store;
    }
}
