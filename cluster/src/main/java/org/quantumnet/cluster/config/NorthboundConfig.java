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

package org.quantumnet.cluster.config;

import java.time.Duration;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Settings of the Northbound client, read from the quantumnet.northbound
 * section. Missing keys fall back to the defaults of reference.conf.
 */
public class NorthboundConfig {

    public static final String PREFIX = "quantumnet.northbound";

    private final Config conf;

    public NorthboundConfig(Config conf) {
        this.conf = conf.withFallback(ConfigFactory.defaultReference())
                        .getConfig(PREFIX);
    }

    /** Loads the application configuration of the classpath. */
    public static NorthboundConfig load() {
        return new NorthboundConfig(ConfigFactory.load());
    }

    /** "tcp:host:port" or "ssl:host:port". */
    public String address() {
        return conf.getString("address");
    }

    public Duration connectTimeout() {
        return conf.getDuration("connect_timeout");
    }

    public Duration requestTimeout() {
        return conf.getDuration("request_timeout");
    }

    public Duration reconnectInterval() {
        return conf.getDuration("reconnect_interval");
    }

    /** Zero disables reconnection. */
    public int maxReconnectAttempts() {
        return conf.getInt("max_reconnect_attempts");
    }

    public boolean fallbackToMock() {
        return conf.getBoolean("fallback_to_mock");
    }

    public boolean cacheEnabled() {
        return conf.getBoolean("cache.enabled");
    }

    public Duration cacheTtl() {
        return conf.getDuration("cache.ttl");
    }

    /** Path of the JKS or PKCS12 key store, empty for none. */
    public String sslKeyStore() {
        return conf.getString("ssl.key_store");
    }

    public String sslKeyStorePassword() {
        return conf.getString("ssl.key_store_password");
    }

    /** Path of the trust store, empty for the JVM default. */
    public String sslTrustStore() {
        return conf.getString("ssl.trust_store");
    }

    public String sslTrustStorePassword() {
        return conf.getString("ssl.trust_store_password");
    }

    @Override
    public String toString() {
        return "NorthboundConfig{address=" + address()
               + ", cache=" + cacheEnabled()
               + ", fallbackToMock=" + fallbackToMock() + "}";
    }
}
