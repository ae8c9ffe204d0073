package io.commtrace.analysis.cache;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.commtrace.analysis.config.AnalysisConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// In-memory cache whose entries expire a fixed time after they were stored.
///
/// Expired entries are dropped when looked up, and all of them are swept on every store,
/// so a long-lived instance holds at most the entries stored within one lifetime. Not synchronized.
public final class TtlResultCache implements ResultCache {

    private static final Logger logger = LogManager.getLogger(TtlResultCache.class);

    public static final Duration DEFAULT_TTL = Duration.ofSeconds(3600);

    private final Map<CacheKey, Entry> entries = new HashMap<>();
    private final Duration ttl;
    private final Clock clock;

    private record Entry(Object value, Instant expiresAt) {
    }

    public TtlResultCache() {
        this(DEFAULT_TTL, Clock.systemUTC());
    }

    public TtlResultCache(Duration ttl) {
        this(ttl, Clock.systemUTC());
    }

    /// @param config supplies the lifetime from `analysis.cache.ttl_seconds`
    public TtlResultCache(AnalysisConfig config) {
        this(config.cacheTtl(), Clock.systemUTC());
    }

    /// @param ttl entry lifetime, positive
    /// @param clock time source
    public TtlResultCache(Duration ttl, Clock clock) {
        Objects.requireNonNull(ttl, "ttl cannot be null");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
        this.ttl = ttl;
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    @Override
    public Optional<Object> get(CacheKey key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            entries.remove(key);
            logger.debug("Cache entry expired for {}", key.operation());
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void put(CacheKey key, Object value) {
        Objects.requireNonNull(value, "value cannot be null");
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(entry -> !now.isBefore(entry.expiresAt()));
        if (entries.size() < before) {
            logger.debug("Evicted {} expired cache entries", before - entries.size());
        }
        entries.put(key, new Entry(value, now.plus(ttl)));
    }

    /// @return entries currently held, including expired ones not yet swept
    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }

    public Duration ttl() {
        return ttl;
    }
}
