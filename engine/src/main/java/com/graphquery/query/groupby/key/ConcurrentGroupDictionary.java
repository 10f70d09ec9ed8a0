/*
 * Copyright © 2021-present Arcade Data Ltd (info@arcadedata.com)
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
 *
 * SPDX-FileCopyrightText: 2021-present Arcade Data Ltd (info@arcadedata.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.graphquery.query.groupby.key;

import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Group dictionary shared by all the workers. Keys are compared with a non caching {@link RowEqualityComparer}, so lookups from
 * any thread never touch per-worker cache state. Mutation is limited to get-or-add: values are never replaced or removed, updates
 * of the aggregate state happen in the values themselves.
 */
public final class ConcurrentGroupDictionary<V> {
  private final ConcurrentHashMap<SharedKey, V> map;
  private final RowEqualityComparer             comparer;

  public ConcurrentGroupDictionary(final RowKeyEvaluator template, final int initialCapacity) {
    this.comparer = template.isCachingResults() ? template.copy(false).getComparer() : template.getComparer();
    this.map = new ConcurrentHashMap<>(Math.max(16, initialCapacity));
  }

  /**
   * Atomically associates the value to the key if the group is new.
   *
   * @return the value already associated to the group, or {@code value} if this call added it
   */
  public V getOrAdd(final GroupKey key, final V value) {
    final V existing = map.putIfAbsent(new SharedKey(key, comparer), value);
    return existing != null ? existing : value;
  }

  /**
   * Returns the value of the group, creating it with the function the first time. The function runs at most once per group.
   */
  public V computeIfAbsent(final GroupKey key, final Function<GroupKey, ? extends V> mappingFunction) {
    return map.computeIfAbsent(new SharedKey(key, comparer), k -> mappingFunction.apply(k.key));
  }

  public V get(final GroupKey key) {
    return map.get(new SharedKey(key, comparer));
  }

  public int size() {
    return map.size();
  }

  public void forEach(final BiConsumer<GroupKey, ? super V> consumer) {
    map.forEach((k, v) -> consumer.accept(k.key, v));
  }

  private static final class SharedKey {
    private final GroupKey            key;
    private final RowEqualityComparer comparer;

    private SharedKey(final GroupKey key, final RowEqualityComparer comparer) {
      this.key = key;
      this.comparer = comparer;
    }

    @Override
    public int hashCode() {
      return key.getHash();
    }

    @Override
    public boolean equals(final Object obj) {
      if (this == obj)
        return true;
      if (!(obj instanceof SharedKey))
        return false;
      return comparer.equals(key, ((SharedKey) obj).key);
    }
  }
}
