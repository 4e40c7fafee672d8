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

import java.util.Arrays;
import java.util.List;

import org.colgrouper.grouping.exception.MissingInputException;

import com.google.common.collect.ImmutableList;

/**
 * Specifies how the columns of a {@link ColumnSet} should be grouped.
 *
 * <p>
 * This is a closed set of alternatives, each one a nested subclass. Consumers distinguish them exhaustively using a
 * {@link GroupSpecVisitor}:
 *
 * <ul>
 * <li>{@link NoGrouping}: When used as the baseline of a {@link ColumnGrouper}, the columns are not grouped. When passed
 * to a single call, no override is given, which means the baseline is used.
 * <li>{@link UseBaseline}: Use the baseline grouping of the {@link ColumnGrouper}.
 * <li>{@link ExplicitDisable}: Do not group, even if the {@link ColumnGrouper} has a baseline grouping.
 * <li>{@link LevelSelector}: Group by the values of one or more levels of multi-level column labels.
 * <li>{@link ExplicitLabels}: Group by a label sequence that has one entry per column.
 * </ul>
 *
 * <p>
 * All alternatives correctly implement {@link Object#equals(Object)} and {@link Object#hashCode()}.
 *
 * @author Bastian Gloeckle
 */
public abstract class GroupSpec {
  private GroupSpec() {
  }

  public abstract <T> T accept(GroupSpecVisitor<T> visitor);

  public static GroupSpec none() {
    return NoGrouping.INSTANCE;
  }

  public static GroupSpec baseline() {
    return UseBaseline.INSTANCE;
  }

  public static GroupSpec disable() {
    return ExplicitDisable.INSTANCE;
  }

  /**
   * Group by the values of a single level.
   *
   * @param position
   *          Position of the level, negative values count from the last level (-1 is the last level).
   */
  public static GroupSpec level(int position) {
    return new LevelSelector(ImmutableList.of(position), false);
  }

  /**
   * Group by the values of a single level, identified by its name.
   */
  public static GroupSpec level(String name) {
    if (name == null)
      throw new MissingInputException("name");
    return new LevelSelector(ImmutableList.of(name), false);
  }

  /**
   * Group by the combined values of multiple levels.
   *
   * @param levels
   *          Each entry is either an {@link Integer} (position of the level) or a {@link String} (name of the level).
   */
  public static GroupSpec levels(Object... levels) {
    if (levels == null)
      throw new MissingInputException("levels");
    return levels(Arrays.asList(levels));
  }

  /**
   * Group by the combined values of multiple levels.
   *
   * @param levels
   *          Each entry is either an {@link Integer} (position of the level) or a {@link String} (name of the level).
   */
  public static GroupSpec levels(List<?> levels) {
    if (levels == null)
      throw new MissingInputException("levels");
    if (levels.isEmpty())
      throw new IllegalArgumentException("At least one level needs to be selected.");
    for (Object level : levels)
      if (!(level instanceof Integer) && !(level instanceof String))
        throw new IllegalArgumentException("Levels can only be selected by position or name, but got: " + level);
    return new LevelSelector(ImmutableList.copyOf(levels), true);
  }

  /**
   * Group by explicit, unnamed labels, one per column.
   */
  public static GroupSpec labels(Object... labels) {
    return new ExplicitLabels(ColumnSet.of(labels));
  }

  /**
   * Group by explicit, unnamed labels, one per column.
   */
  public static GroupSpec labels(List<?> labels) {
    return new ExplicitLabels(ColumnSet.of(labels));
  }

  /**
   * Group by explicit labels, one per column. The name will be the name of the resulting group index.
   */
  public static GroupSpec namedLabels(String name, List<?> labels) {
    return new ExplicitLabels(ColumnSet.named(name, labels));
  }

  /**
   * Group by explicit labels, one per column. The labels may have multiple levels, their level names will be the level
   * names of the resulting group index.
   */
  public static GroupSpec labels(ColumnSet labels) {
    if (labels == null)
      throw new MissingInputException("labels");
    return new ExplicitLabels(labels);
  }

  /**
   * No grouping given.
   */
  public static final class NoGrouping extends GroupSpec {
    private static final NoGrouping INSTANCE = new NoGrouping();

    private NoGrouping() {
    }

    @Override
    public <T> T accept(GroupSpecVisitor<T> visitor) {
      return visitor.visitNoGrouping();
    }

    @Override
    public String toString() {
      return "NoGrouping";
    }
  }

  /**
   * Use the baseline grouping.
   */
  public static final class UseBaseline extends GroupSpec {
    private static final UseBaseline INSTANCE = new UseBaseline();

    private UseBaseline() {
    }

    @Override
    public <T> T accept(GroupSpecVisitor<T> visitor) {
      return visitor.visitUseBaseline();
    }

    @Override
    public String toString() {
      return "UseBaseline";
    }
  }

  /**
   * Disable grouping.
   */
  public static final class ExplicitDisable extends GroupSpec {
    private static final ExplicitDisable INSTANCE = new ExplicitDisable();

    private ExplicitDisable() {
    }

    @Override
    public <T> T accept(GroupSpecVisitor<T> visitor) {
      return visitor.visitExplicitDisable();
    }

    @Override
    public String toString() {
      return "ExplicitDisable";
    }
  }

  /**
   * Selects one or more levels of the column labels, each by position or by name.
   */
  public static final class LevelSelector extends GroupSpec {
    private final ImmutableList<Object> levels;
    private final boolean multiLevel;

    private LevelSelector(ImmutableList<Object> levels, boolean multiLevel) {
      this.levels = levels;
      this.multiLevel = multiLevel;
    }

    @Override
    public <T> T accept(GroupSpecVisitor<T> visitor) {
      return visitor.visitLevelSelector(this);
    }

    /**
     * @return The selected levels, each either an {@link Integer} position or a {@link String} name.
     */
    public List<Object> getLevels() {
      return levels;
    }

    /**
     * @return true if the levels were selected as a list, in which case the resulting labels are tuples (if more than
     *         one level is selected).
     */
    public boolean isMultiLevel() {
      return multiLevel;
    }

    @Override
    public int hashCode() {
      return 31 * levels.hashCode() + (multiLevel ? 1 : 0);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof LevelSelector))
        return false;
      LevelSelector other = (LevelSelector) obj;
      return levels.equals(other.levels) && multiLevel == other.multiLevel;
    }

    @Override
    public String toString() {
      return "LevelSelector" + levels;
    }
  }

  /**
   * An explicit label per column.
   */
  public static final class ExplicitLabels extends GroupSpec {
    private final ColumnSet labels;

    private ExplicitLabels(ColumnSet labels) {
      this.labels = labels;
    }

    @Override
    public <T> T accept(GroupSpecVisitor<T> visitor) {
      return visitor.visitExplicitLabels(this);
    }

    public ColumnSet getLabels() {
      return labels;
    }

    @Override
    public int hashCode() {
      return labels.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof ExplicitLabels))
        return false;
      return labels.equals(((ExplicitLabels) obj).labels);
    }

    @Override
    public String toString() {
      return "ExplicitLabels[" + labels + "]";
    }
  }
}
