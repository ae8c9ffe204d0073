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

/** Cache that never remembers anything. The default for analyzers. */
public final class NoOpResultCache implements ResultCache {

    public static final NoOpResultCache INSTANCE = new NoOpResultCache();

    private NoOpResultCache() {
    }

    @Override
    public Optional<Object> get(CacheKey key) {
        return Optional.empty();
    }

    @Override
    public void put(CacheKey key, Object value) {
        // discard
    }
}
