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

import java.util.Collection;
import java.util.Collections;

/**
 * A {@link WritableCache} that never holds anything, used when caching is switched off. Every offer is rejected and
 * every read misses.
 *
 * @author Bastian Gloeckle
 */
public class NoopCache<K1, K2, V> implements WritableCache<K1, K2, V> {
  @Override
  public V get(K1 key1, K2 key2) {
    return null;
  }

  @Override
  public Collection<V> getAll(K1 key1) {
    return Collections.emptyList();
  }

  @Override
  public int size() {
    return 0;
  }

  @Override
  public boolean offer(K1 key1, K2 key2, V value) {
    return false;
  }

  @Override
  public V offerOrGet(K1 key1, K2 key2, V value) {
    return value;
  }
}
