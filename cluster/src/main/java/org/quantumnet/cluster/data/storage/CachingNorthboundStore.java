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

import java.time.Duration;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.google.common.base.Objects;
import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.collect.ImmutableSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.quantumnet.cluster.data.ovn.Acl;
import org.quantumnet.cluster.data.ovn.LogicalRouter;
import org.quantumnet.cluster.data.ovn.LogicalSwitch;
import org.quantumnet.cluster.data.ovn.LogicalSwitchPort;
import org.quantumnet.cluster.data.ovn.NorthboundObject;

/**
 * Read-through cache in front of another store. Lookups of switches,
 * switch ports, routers and ACLs are served from the cache for up to the
 * configured TTL after they were loaded. Entries are invalidated by every
 * write made through this store, but changes made to the database by
 * anyone else are only seen once the entry expires.
 *
 * Reads run concurrently with each other. Writes are exclusive, and the
 * write to the underlying store together with the invalidation of the keys
 * it touches appears atomic to readers.
 */
public class CachingNorthboundStore implements NorthboundStore {

    private static final Logger log =
        LoggerFactory.getLogger(CachingNorthboundStore.class);

    private static final ImmutableSet<Class<?>> CACHED = ImmutableSet.of(
        LogicalSwitch.class, LogicalSwitchPort.class, LogicalRouter.class,
        Acl.class);

    private final NorthboundStore delegate;
    private final Cache<CacheKey, NorthboundObject> cache;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public CachingNorthboundStore(NorthboundStore delegate, Duration ttl) {
        this(delegate, ttl, Ticker.systemTicker());
    }

    public CachingNorthboundStore(NorthboundStore delegate, Duration ttl,
                                  Ticker ticker) {
        this.delegate = delegate;
        this.cache = CacheBuilder.newBuilder()
            .expireAfterWrite(ttl)
            .ticker(ticker)
            .build();
    }

    public NorthboundStore getDelegate() {
        return delegate;
    }

    public static boolean isCached(Class<?> clazz) {
        return CACHED.contains(clazz);
    }

    @Override
    public void create(NorthboundObject obj) throws NorthboundException {
        lock.writeLock().lock();
        try {
            delegate.create(obj);
            invalidate(obj.getClass(), obj.key());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void update(NorthboundObject obj) throws NorthboundException {
        lock.writeLock().lock();
        try {
            delegate.update(obj);
            invalidate(obj.getClass(), obj.key());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void delete(Class<? extends NorthboundObject> clazz, String key)
            throws NorthboundException {
        lock.writeLock().lock();
        try {
            delegate.delete(clazz, key);
            invalidate(clazz, key);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public <T extends NorthboundObject> T get(Class<T> clazz, String key)
            throws NorthboundException {
        if (!isCached(clazz))
            return delegate.get(clazz, key);

        lock.readLock().lock();
        try {
            CacheKey cacheKey = new CacheKey(clazz, key);
            NorthboundObject cached = cache.getIfPresent(cacheKey);
            if (cached != null) {
                log.trace("Cache hit for {} {}", clazz.getSimpleName(), key);
                return clazz.cast(cached.copy());
            }
            T obj = delegate.get(clazz, key);
            cache.put(cacheKey, obj.copy());
            return obj;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public <T extends NorthboundObject> List<T> getAll(Class<T> clazz)
            throws NorthboundException {
        lock.readLock().lock();
        try {
            return delegate.getAll(clazz);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean exists(Class<? extends NorthboundObject> clazz,
                          String key) throws NorthboundException {
        lock.readLock().lock();
        try {
            if (isCached(clazz)
                && cache.getIfPresent(new CacheKey(clazz, key)) != null)
                return true;
            return delegate.exists(clazz, key);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void multi(List<StorageOp> ops) throws NorthboundException {
        lock.writeLock().lock();
        try {
            try {
                delegate.multi(ops);
            } finally {
                // partially applied on failure
                for (StorageOp op : ops) {
                    invalidate(op.clazz(), op.key());
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Drops every cached entry. */
    public void invalidateAll() {
        cache.invalidateAll();
    }

    public long size() {
        cache.cleanUp();
        return cache.size();
    }

    private void invalidate(Class<?> clazz, String key) {
        if (isCached(clazz) && key != null)
            cache.invalidate(new CacheKey(clazz, key));
    }

    @Override
    public boolean isConnected() {
        return delegate.isConnected();
    }

    @Override
    public void close() {
        cache.invalidateAll();
        delegate.close();
    }

    private static final class CacheKey {
        private final Class<?> clazz;
        private final String key;

        CacheKey(Class<?> clazz, String key) {
            this.clazz = clazz;
            this.key = key;
        }

        @Override
        public boolean equals(Object obj) {
            if (obj == this) return true;
            if (!(obj instanceof CacheKey)) return false;
            CacheKey other = (CacheKey) obj;
            return clazz == other.clazz && Objects.equal(key, other.key);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(clazz, key);
        }
    }
}
