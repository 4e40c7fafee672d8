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
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import com.google.common.primitives.ImmutableIntArray;

/**
 * Tests {@link GroupBoundaryCalculator}.
 *
 * @author Bastian Gloeckle
 */
public class GroupBoundaryCalculatorTest {
  @DataProvider(name = "coherentGroupIds")
  public Object[][] coherentGroupIds() {
    return new Object[][] { //
        new Object[] { ImmutableIntArray.of(0, 0, 1) }, //
        new Object[] { ImmutableIntArray.of(0, 1, 2, 3) }, //
        new Object[] { ImmutableIntArray.of(0, 0, 0, 0) }, //
        new Object[] { ImmutableIntArray.of(0, 1, 1, 1, 2, 3, 3) }, //
        new Object[] { ImmutableIntArray.of(4, 4, 9) }, //
    };
  }

  @Test(dataProvider = "coherentGroupIds")
  public void boundariesAreConsistent(ImmutableIntArray groupIds) {
    // WHEN
    ImmutableIntArray counts = GroupBoundaryCalculator.runLengths(groupIds);
    ImmutableIntArray starts = GroupBoundaryCalculator.starts(counts);
    ImmutableIntArray ends = GroupBoundaryCalculator.ends(counts);

    // THEN
    int sum = counts.stream().sum();
    Assert.assertEquals(sum, groupIds.length(), "Expected counts to sum up to number of columns");
    Assert.assertEquals(starts.get(0), 0, "Expected first group to start at 0");
    Assert.assertEquals(ends.get(ends.length() - 1), groupIds.length(), "Expected last group to end at the end");
    for (int k = 0; k < counts.length(); k++)
      Assert.assertEquals(ends.get(k) - starts.get(k), counts.get(k), "Expected correct boundaries of group " + k);
  }

  @Test
  public void runLengths() {
    Assert.assertEquals(GroupBoundaryCalculator.runLengths(ImmutableIntArray.of(0, 0, 1)), ImmutableIntArray.of(2, 1));
    Assert.assertEquals(GroupBoundaryCalculator.runLengths(ImmutableIntArray.of(0, 1, 1, 1, 2)),
        ImmutableIntArray.of(1, 3, 1));
  }

  @Test
  public void startsAndEnds() {
    ImmutableIntArray counts = ImmutableIntArray.of(2, 1, 3);

    Assert.assertEquals(GroupBoundaryCalculator.starts(counts), ImmutableIntArray.of(0, 2, 3));
    Assert.assertEquals(GroupBoundaryCalculator.ends(counts), ImmutableIntArray.of(2, 3, 6));
  }

  @Test
  public void singletons() {
    ImmutableIntArray counts = GroupBoundaryCalculator.singletonCounts(4);

    Assert.assertEquals(counts, ImmutableIntArray.of(1, 1, 1, 1));
    Assert.assertEquals(GroupBoundaryCalculator.starts(counts), ImmutableIntArray.of(0, 1, 2, 3));
    Assert.assertEquals(GroupBoundaryCalculator.ends(counts), ImmutableIntArray.of(1, 2, 3, 4));
  }

  @Test
  public void empty() {
    ImmutableIntArray counts = GroupBoundaryCalculator.runLengths(ImmutableIntArray.of());

    Assert.assertTrue(counts.isEmpty());
    Assert.assertTrue(GroupBoundaryCalculator.starts(counts).isEmpty());
    Assert.assertTrue(GroupBoundaryCalculator.ends(counts).isEmpty());
  }

  @Test(expectedExceptions = IncoherentGroupsException.class)
  public void decreasingIds() {
    GroupBoundaryCalculator.runLengths(ImmutableIntArray.of(0, 1, 1, 0));
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void negativeIds() {
    GroupBoundaryCalculator.runLengths(ImmutableIntArray.of(-1, 0));
  }
}
