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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.colgrouper.grouping.exception.IncoherentGroupsException;

import com.google.common.primitives.ImmutableIntArray;

/**
 * Factorizes the labels of a {@link NormalizedSpec} into dense group ids.
 *
 * <p>
 * Each distinct label gets the next free id at its first occurrence, scanning the columns from left to right. The
 * resulting grouping needs to be coherent: all columns of a group need to be adjacent, which is the case if and only
 * if the group ids never decrease. An incoherent grouping is never corrected (e.g. by reordering columns), but
 * rejected.
 *
 * @author Bastian Gloeckle
 */
public final class GroupIndexer {
  private GroupIndexer() {
  }

  /**
   * @param columns
   *          The original columns.
   * @param spec
   *          The resolved grouping of the columns. If this is {@link NormalizedSpec#NONE}, each column will be its own
   *          group.
   * @throws IncoherentGroupsException
   *           if any group does not consist of adjacent columns.
   */
  public static Factorization factorize(ColumnSet columns, NormalizedSpec spec) throws IncoherentGroupsException {
    if (!spec.isGrouped())
      return new Factorization(identity(columns.size()), columns);

    ColumnSet labels = spec.getLabels();
    Map<Object, Integer> groupIdByLabel = new HashMap<>();
    List<Object> distinctLabels = new ArrayList<>();
    ImmutableIntArray.Builder groupIds = ImmutableIntArray.builder(labels.size());

    int previousGroupId = -1;
    for (int pos = 0; pos < labels.size(); pos++) {
      Object label = labels.getLabel(pos);
      Integer groupId = groupIdByLabel.get(label);
      if (groupId == null) {
        groupId = distinctLabels.size();
        groupIdByLabel.put(label, groupId);
        distinctLabels.add(label);
      } else if (groupId < previousGroupId)
        throw new IncoherentGroupsException(pos,
            "Group " + label + " re-appears at column " + pos + " after other groups started.");

      groupIds.add(groupId);
      previousGroupId = groupId;
    }

    return new Factorization(groupIds.build(), labels.withLabels(distinctLabels));
  }

  /**
   * Validates that the given group ids describe a coherent grouping, i.e. that they do not decrease anywhere.
   *
   * @throws IncoherentGroupsException
   *           if the ids decrease somewhere.
   */
  public static void validateCoherent(ImmutableIntArray groupIds) throws IncoherentGroupsException {
    for (int pos = 1; pos < groupIds.length(); pos++)
      if (groupIds.get(pos) < groupIds.get(pos - 1))
        throw new IncoherentGroupsException(pos, "Group id " + groupIds.get(pos) + " at column " + pos
            + " is smaller than previous group id " + groupIds.get(pos - 1) + ".");
  }

  /**
   * @return <code>[0, 1, ..., size - 1]</code>.
   */
  public static ImmutableIntArray identity(int size) {
    ImmutableIntArray.Builder res = ImmutableIntArray.builder(size);
    for (int i = 0; i < size; i++)
      res.add(i);
    return res.build();
  }
}
