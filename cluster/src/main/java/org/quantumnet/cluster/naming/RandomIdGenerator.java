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

package org.quantumnet.cluster.naming;

import java.security.SecureRandom;
import java.util.Random;
import java.util.UUID;

import org.quantumnet.packets.MAC;

public class RandomIdGenerator implements IdGenerator {

    private final Random random;

    public RandomIdGenerator() {
        this(new SecureRandom());
    }

    public RandomIdGenerator(Random random) {
        this.random = random;
    }

    @Override
    public String newUuid() {
        return new UUID(
            (random.nextLong() & ~0xf000L) | 0x4000L,
            (random.nextLong() & 0x3fffffffffffffffL) | 0x8000000000000000L)
            .toString();
    }

    @Override
    public String newMac() {
        return MAC.random(random).toString();
    }
}
