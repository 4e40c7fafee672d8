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

/**
 * Read access to values that are keyed by a pair <code>(key1, key2)</code>.
 *
 * <p>
 * <code>key1</code> typically names what kind of value is cached and <code>key2</code> the input it was computed for,
 * which allows to list all cached values of one kind using {@link #getAll(Object)}.
 *
 * @param <K1>
 *          Type of the first key part.
 * @param <K2>
 *          Type of the second key part.
 * @param <V>
 *          Value type.
 * @author Bastian Gloeckle
 */
public interface Cache<K1, K2, V> {
  /**
   * @return The value cached for the key pair or <code>null</code> if there is none.
   */
  public V get(K1 key1, K2 key2);

  /**
   * Typed variant of {@link #get(Object, Object)} for caches that hold values of different types.
   *
   * @return The value cached for the key pair or <code>null</code> if there is none.
   * @throws ClassCastException
   *           if the cached value is not of the given type.
   */
  public default <T extends V> T get(K1 key1, K2 key2, Class<T> type) throws ClassCastException {
    return type.cast(get(key1, key2));
  }

  /**
   * @return All values cached for the given first key part, in no specific order. May be empty.
   */
  public Collection<V> getAll(K1 key1);

  /**
   * @return Number of cached values.
   */
  public int size();
}
