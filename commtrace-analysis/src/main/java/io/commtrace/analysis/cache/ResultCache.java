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

import java.util.Optional;

/// Memoization capability consulted by analyzers.
///
/// Implementations own their own eviction policy. They are not required to be
/// thread-safe; callers sharing one instance across threads synchronize around it.
public interface ResultCache {

    /// @param key the fingerprint
    /// @return the cached value, or empty on a miss
    Optional<Object> get(CacheKey key);

    /// @param key the fingerprint
    /// @param value the value to remember
    void put(CacheKey key, Object value);

    /// Typed lookup. A cached value of another type counts as a miss.
    ///
    /// @param key the fingerprint
    /// @param type the expected type
    /// @param <T> the expected type
    /// @return the cached value, or empty
    default <T> Optional<T> get(CacheKey key, Class<T> type) {
        return get(key).filter(type::isInstance).map(type::cast);
    }
}
