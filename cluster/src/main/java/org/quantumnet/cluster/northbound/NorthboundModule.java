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

import com.google.inject.Exposed;
import com.google.inject.PrivateModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;

import org.quantumnet.cluster.config.NorthboundConfig;
import org.quantumnet.cluster.data.storage.NorthboundConnectionException;
import org.quantumnet.cluster.naming.IdGenerator;
import org.quantumnet.cluster.naming.RandomIdGenerator;
import org.quantumnet.cluster.translators.AclTranslator;

/**
 * Exposes a singleton {@link NorthboundClient} connected as configured. A
 * connection failure surfaces as a ProvisionException unless fallback to
 * the in-memory database is enabled.
 */
public class NorthboundModule extends PrivateModule {

    private final NorthboundConfig config;

    public NorthboundModule(NorthboundConfig config) {
        this.config = config;
    }

    @Override
    protected void configure() {
        bind(NorthboundConfig.class).toInstance(config);
        expose(NorthboundConfig.class);

        bindIdGenerator();

        bind(AclTranslator.class).in(Singleton.class);
        expose(AclTranslator.class);
    }

    protected void bindIdGenerator() {
        bind(IdGenerator.class).toInstance(new RandomIdGenerator());
    }

    @Provides @Exposed @Singleton
    NorthboundClient provideNorthboundClient(AclTranslator translator,
                                             IdGenerator ids)
            throws NorthboundConnectionException {
        return NorthboundClient.create(config, ids, translator);
    }
}
