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
import java.util.List;

import org.colgrouper.grouping.GroupSpec.ExplicitLabels;
import org.colgrouper.grouping.GroupSpec.LevelSelector;
import org.colgrouper.grouping.exception.LengthMismatchException;

/**
 * Resolves a {@link GroupSpec} against a {@link ColumnSet} into a {@link NormalizedSpec} that holds one label per
 * column.
 *
 * <p>
 * {@link GroupSpec#none()}, {@link GroupSpec#baseline()} and {@link GroupSpec#disable()} are not resolved here but
 * result in {@link NormalizedSpec#NONE}: Substituting the baseline is the job of {@link GroupingPolicy}, which does
 * that before calling this resolver.
 *
 * @author Bastian Gloeckle
 */
public final class GroupSpecResolver {
  private GroupSpecResolver() {
  }

  /**
   * @throws LengthMismatchException
   *           if the resolved labels do not have one entry per column.
   * @throws IllegalArgumentException
   *           if a level that should be selected does not exist.
   */
  public static NormalizedSpec resolve(ColumnSet columns, GroupSpec spec)
      throws LengthMismatchException, IllegalArgumentException {
    ColumnSet labels = spec.accept(new GroupSpecVisitor<ColumnSet>() {
      @Override
      public ColumnSet visitNoGrouping() {
        return null;
      }

      @Override
      public ColumnSet visitUseBaseline() {
        return null;
      }

      @Override
      public ColumnSet visitExplicitDisable() {
        return null;
      }

      @Override
      public ColumnSet visitLevelSelector(LevelSelector selector) {
        return selectLevels(columns, selector);
      }

      @Override
      public ColumnSet visitExplicitLabels(ExplicitLabels labels) {
        return labels.getLabels();
      }
    });

    if (labels == null)
      return NormalizedSpec.NONE;

    if (labels.size() != columns.size())
      throw new LengthMismatchException(columns.size(), labels.size());

    return NormalizedSpec.of(labels);
  }

  /**
   * @return Non-negative position of the given level in the given columns.
   * @throws IllegalArgumentException
   *           if there is no such level or if the level is selected by a name that multiple levels have.
   */
  public static int levelPosition(ColumnSet columns, Object level) throws IllegalArgumentException {
    int numberOfLevels = columns.getNumberOfLevels();
    if (level instanceof Integer) {
      int pos = (Integer) level;
      if (pos < 0)
        pos += numberOfLevels;
      if (pos < 0 || pos >= numberOfLevels)
        throw new IllegalArgumentException(
            "Level " + level + " does not exist, columns have " + numberOfLevels + " level(s).");
      return pos;
    }

    int pos = columns.getLevelNames().indexOf(level);
    if (pos == -1)
      throw new IllegalArgumentException(
          "Level '" + level + "' does not exist, available levels: " + columns.getLevelNames());
    if (pos != columns.getLevelNames().lastIndexOf(level))
      throw new IllegalArgumentException(
          "Level name '" + level + "' occurs multiple times, select the level by its position instead.");
    return pos;
  }

  private static ColumnSet selectLevels(ColumnSet columns, LevelSelector selector) {
    List<Integer> positions = new ArrayList<>();
    for (Object level : selector.getLevels())
      positions.add(levelPosition(columns, level));

    if (!selector.isMultiLevel() || positions.size() == 1) {
      int pos = positions.get(0);
      return ColumnSet.named(columns.getLevelNames().get(pos), columns.getLevelValues(pos));
    }

    List<String> levelNames = new ArrayList<>();
    List<List<Object>> levelValues = new ArrayList<>();
    for (int pos : positions) {
      levelNames.add(columns.getLevelNames().get(pos));
      levelValues.add(columns.getLevelValues(pos));
    }

    List<List<Object>> tuples = new ArrayList<>(columns.size());
    for (int col = 0; col < columns.size(); col++) {
      List<Object> tuple = new ArrayList<>(positions.size());
      for (List<Object> values : levelValues)
        tuple.add(values.get(col));
      tuples.add(tuple);
    }

    return ColumnSet.multiLevel(levelNames, tuples);
  }
}
