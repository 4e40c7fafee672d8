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

/**
 * A {@link Cache} that values can be offered to.
 *
 * <p>
 * Keys must not be <code>null</code>, need to implement {@link Object#equals(Object)} and {@link Object#hashCode()}
 * correctly and must not change after they have been offered.
 *
 * @author Bastian Gloeckle
 */
public interface WritableCache<K1, K2, V> extends Cache<K1, K2, V> {
  /**
   * Offers a value to the cache, which may or may not accept it.
   *
   * @return true if the value is cached now.
   */
  public boolean offer(K1 key1, K2 key2, V value);

  /**
   * Offers a value and returns the value that callers should use from now on for the key pair.
   *
   * <p>
   * If the offer is rejected because another value is cached for the same keys already, that other value is returned.
   * If the cache did not accept the value for another reason, the given value is returned.
   */
  public default V offerOrGet(K1 key1, K2 key2, V value) {
    if (offer(key1, key2, value))
      return value;

    V cached = get(key1, key2);
    return (cached != null) ? cached : value;
  }
}
