/**
 * colgrouper: Column Grouping.
 *
 * Copyright (C) 2015 Bastian Gloeckle
 *
 * This file is part of colgrouper.
 *
 * colgrouper is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package org.colgrouper.cache;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import com.google.common.collect.Sets;

/**
 * {@link Cache} that keeps each entry for its whole lifetime and never evicts or replaces anything.
 * 
 * <p>
 * Calls to {@link #offer(Object, Object, Object)} will not accept a new object if one with the same keys is registered
 * already; the value that was offered first stays in the cache. If no object with the same keys is registered,
 * {@link #offer(Object, Object, Object)} will always accept the new value.
 * 
 * <p>
 * Reads are safe from multiple threads. Concurrent offers for the same keys are safe in the sense that exactly one of
 * them is accepted, callers whose offer was rejected should {@link #get(Object, Object)} the accepted value.
 * 
 * <p>
 * As nothing is ever evicted, the memory used by this cache grows with the number of distinct key pairs. Do not use
 * it with unbounded key spaces.
 *
 * @author Bastian Gloeckle
 */
public class AppendOnlyCache<K1, K2, V> implements WritableCache<K1, K2, V> {

  private ConcurrentMap<KeyPair<K1, K2>, V> values = new ConcurrentHashMap<>();
  private ConcurrentMap<K1, Set<K2>> secondLevelKeys = new ConcurrentHashMap<>();

  @Override
  public V get(K1 key1, K2 key2) {
    return values.get(new KeyPair<>(key1, key2));
  }

  @Override
  public Collection<V> getAll(K1 key1) {
    Set<K2> key2s = secondLevelKeys.get(key1);
    if (key2s == null)
      return new ArrayList<>();

    List<V> res = new ArrayList<>();
    for (K2 k2 : key2s) {
      V value = values.get(new KeyPair<>(key1, k2));
      if (value != null)
        res.add(value);
    }

    return res;
  }

  @Override
  public int size() {
    return values.size();
  }

  @Override
  public boolean offer(K1 key1, K2 key2, V value) {
    if (key1 == null || key2 == null || value == null)
      throw new IllegalArgumentException("Cannot cache null keys or values.");

    if (values.putIfAbsent(new KeyPair<>(key1, key2), value) != null)
      // value set already (perhaps by a concurrent thread?)
      return false;

    secondLevelKeys.computeIfAbsent(key1, k -> Sets.newConcurrentHashSet()).add(key2);
    return true;
  }

  private static final class KeyPair<K1, K2> {
    private final K1 key1;
    private final K2 key2;

    KeyPair(K1 key1, K2 key2) {
      this.key1 = key1;
      this.key2 = key2;
    }

    @Override
    public int hashCode() {
      return Objects.hash(key1, key2);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof KeyPair))
        return false;
      KeyPair<?, ?> other = (KeyPair<?, ?>) obj;
      return Objects.equals(key1, other.key1) && Objects.equals(key2, other.key2);
    }
  }
}
