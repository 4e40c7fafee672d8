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

import org.colgrouper.grouping.exception.IncoherentGroupsException;

import com.google.common.primitives.ImmutableIntArray;

/**
 * Calculates the size of each group and the column offsets at which each group starts and ends.
 *
 * <p>
 * Aggregations over groups of columns can use these to slice the column data: group <code>k</code> spans the columns
 * <code>[starts[k], ends[k])</code>.
 *
 * @author Bastian Gloeckle
 */
public final class GroupBoundaryCalculator {
  private GroupBoundaryCalculator() {
  }

  /**
   * Computes the number of columns in each group from the group id of each column.
   *
   * <p>
   * The group ids are checked again for being coherent, as this might be called with group ids that were not computed
   * by {@link GroupIndexer}.
   *
   * @return One entry per group, in the order of the groups.
   * @throws IncoherentGroupsException
   *           if the group ids decrease somewhere.
   * @throws IllegalArgumentException
   *           if there is a negative group id.
   */
  public static ImmutableIntArray runLengths(ImmutableIntArray groupIds)
      throws IncoherentGroupsException, IllegalArgumentException {
    ImmutableIntArray.Builder res = ImmutableIntArray.builder();
    int previousGroup = -1;
    int runCount = 0;
    for (int pos = 0; pos < groupIds.length(); pos++) {
      int group = groupIds.get(pos);
      if (group < 0)
        throw new IllegalArgumentException("Negative group id " + group + " at column " + pos);
      if (group < previousGroup)
        throw new IncoherentGroupsException(pos, "Group id " + group + " at column " + pos
            + " is smaller than previous group id " + previousGroup + ".");

      if (group != previousGroup) {
        if (previousGroup != -1) {
          res.add(runCount);
          runCount = 0;
        }
        previousGroup = group;
      }
      runCount++;
    }
    if (runCount > 0)
      res.add(runCount);

    return res.build();
  }

  /**
   * @return <code>size</code> ones, the counts in case each column is its own group.
   */
  public static ImmutableIntArray singletonCounts(int size) {
    ImmutableIntArray.Builder res = ImmutableIntArray.builder(size);
    for (int i = 0; i < size; i++)
      res.add(1);
    return res.build();
  }

  /**
   * @return Position of the first column of each group (exclusive prefix sum of the counts).
   */
  public static ImmutableIntArray starts(ImmutableIntArray groupCounts) {
    ImmutableIntArray.Builder res = ImmutableIntArray.builder(groupCounts.length());
    int sum = 0;
    for (int i = 0; i < groupCounts.length(); i++) {
      res.add(sum);
      sum += groupCounts.get(i);
    }
    return res.build();
  }

  /**
   * @return Position after the last column of each group (inclusive prefix sum of the counts).
   */
  public static ImmutableIntArray ends(ImmutableIntArray groupCounts) {
    ImmutableIntArray.Builder res = ImmutableIntArray.builder(groupCounts.length());
    int sum = 0;
    for (int i = 0; i < groupCounts.length(); i++) {
      sum += groupCounts.get(i);
      res.add(sum);
    }
    return res.build();
  }
}
