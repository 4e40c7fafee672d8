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
package org.colgrouper.grouping;

import com.google.common.primitives.ImmutableIntArray;

/**
 * The group id of each column together with the distinct group labels, as computed by {@link GroupIndexer}.
 *
 * <p>
 * <code>getGroupIndex().getLabel(getGroupIds().get(i))</code> is the group label of column <code>i</code>.
 *
 * @author Bastian Gloeckle
 */
public final class Factorization {
  private final ImmutableIntArray groupIds;
  private final ColumnSet groupIndex;

  public Factorization(ImmutableIntArray groupIds, ColumnSet groupIndex) {
    this.groupIds = groupIds;
    this.groupIndex = groupIndex;
  }

  /**
   * @return One group id per column, each in <code>[0, getNumberOfGroups())</code>.
   */
  public ImmutableIntArray getGroupIds() {
    return groupIds;
  }

  /**
   * @return The distinct group labels, the label of group id <code>i</code> is at position <code>i</code>.
   */
  public ColumnSet getGroupIndex() {
    return groupIndex;
  }

  public int getNumberOfGroups() {
    return groupIndex.size();
  }

  @Override
  public int hashCode() {
    return 31 * groupIds.hashCode() + groupIndex.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Factorization))
      return false;
    Factorization other = (Factorization) obj;
    return groupIds.equals(other.groupIds) && groupIndex.equals(other.groupIndex);
  }

  @Override
  public String toString() {
    return "Factorization[groupIds=" + groupIds + ", groupIndex=" + groupIndex + "]";
  }
}
