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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.colgrouper.grouping.exception.MissingInputException;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;

/**
 * An immutable, ordered sequence of column labels.
 *
 * <p>
 * A {@link ColumnSet} has one or more levels, each of which has a name that may be <code>null</code>. If there is only
 * one level, each label is a plain (scalar) object. If there are multiple levels, each label is an immutable
 * {@link List} that holds one value per level (a "tuple"), e.g. <code>["EUR", "open"]</code> for a column set with
 * levels <code>currency</code> and <code>field</code>.
 *
 * <p>
 * Labels must not be <code>null</code>, need to implement {@link Object#equals(Object)} and
 * {@link Object#hashCode()} correctly and must not change after the {@link ColumnSet} has been created. Labels that
 * are {@link List}s are copied into immutable lists.
 *
 * <p>
 * {@link ColumnSet}s are used both for the original columns of a table and for the distinct group labels that result
 * from grouping these columns. Correctly implements {@link Object#equals(Object)} and {@link Object#hashCode()}, taking
 * into account both the labels and the level names.
 *
 * @author Bastian Gloeckle
 */
public final class ColumnSet {
  private final ImmutableList<Object> labels;
  private final List<String> levelNames;

  private ColumnSet(ImmutableList<Object> labels, List<String> levelNames) {
    this.labels = labels;
    this.levelNames = levelNames;
  }

  /**
   * Creates a single-level {@link ColumnSet} without a name.
   */
  public static ColumnSet of(Object... labels) {
    if (labels == null)
      throw new MissingInputException("labels");
    return named(null, Arrays.asList(labels));
  }

  /**
   * Creates a single-level {@link ColumnSet} without a name.
   */
  public static ColumnSet of(List<?> labels) {
    return named(null, labels);
  }

  /**
   * Creates a single-level {@link ColumnSet}.
   *
   * @param name
   *          The name of the only level, may be <code>null</code>.
   */
  public static ColumnSet named(String name, List<?> labels) {
    if (labels == null)
      throw new MissingInputException("labels");

    ImmutableList.Builder<Object> res = ImmutableList.builder();
    int pos = 0;
    for (Object label : labels) {
      res.add(immutableLabel(label, pos));
      pos++;
    }
    return new ColumnSet(res.build(), Collections.singletonList(name));
  }

  /**
   * Creates a {@link ColumnSet} with multiple levels.
   *
   * @param levelNames
   *          One name per level, entries may be <code>null</code>. If this contains only one entry, a single-level
   *          {@link ColumnSet} is created from the first value of each tuple.
   * @param tuples
   *          One tuple per column, each having one value per level.
   */
  public static ColumnSet multiLevel(List<String> levelNames, List<? extends List<?>> tuples) {
    if (levelNames == null)
      throw new MissingInputException("levelNames");
    if (tuples == null)
      throw new MissingInputException("tuples");
    if (levelNames.isEmpty())
      throw new IllegalArgumentException("At least one level is needed.");

    int numberOfLevels = levelNames.size();
    ImmutableList.Builder<Object> res = ImmutableList.builder();
    int pos = 0;
    for (List<?> tuple : tuples) {
      if (tuple == null || tuple.size() != numberOfLevels)
        throw new IllegalArgumentException("Column label at position " + pos + " does not have " + numberOfLevels
            + " levels: " + tuple);
      if (Iterables.any(tuple, Objects::isNull))
        throw new IllegalArgumentException("Column label at position " + pos + " contains null: " + tuple);

      if (numberOfLevels == 1)
        res.add(immutableLabel(tuple.get(0), pos));
      else {
        ImmutableList.Builder<Object> values = ImmutableList.builder();
        for (Object value : tuple)
          values.add(immutableLabel(value, pos));
        res.add(values.build());
      }
      pos++;
    }

    return new ColumnSet(res.build(), Collections.unmodifiableList(new ArrayList<>(levelNames)));
  }

  /**
   * @return The given label, {@link List}s copied into an {@link ImmutableList}.
   * @throws IllegalArgumentException
   *           if the label is or contains <code>null</code>.
   */
  private static Object immutableLabel(Object label, int pos) throws IllegalArgumentException {
    if (label == null)
      throw new IllegalArgumentException("Column label at position " + pos + " is null.");
    if (!(label instanceof List) || label instanceof ImmutableList)
      return label;

    List<?> list = (List<?>) label;
    if (Iterables.any(list, Objects::isNull))
      throw new IllegalArgumentException("Column label at position " + pos + " contains null: " + list);
    return ImmutableList.copyOf(list);
  }

  /**
   * Creates a new {@link ColumnSet} with the same level names as this one, but with the given labels.
   *
   * <p>
   * The labels are expected to be of the same shape as the labels of this set, i.e. they need to be tuples of the
   * correct size if this is a multi-level set.
   */
  /* package */ ColumnSet withLabels(List<Object> newLabels) {
    return new ColumnSet(ImmutableList.copyOf(newLabels), levelNames);
  }

  /**
   * @return Number of columns.
   */
  public int size() {
    return labels.size();
  }

  public boolean isEmpty() {
    return labels.isEmpty();
  }

  /**
   * @return The label at the given position. A {@link List} if this is a multi-level set.
   */
  public Object getLabel(int position) {
    return labels.get(position);
  }

  /**
   * @return All labels, immutable.
   */
  public List<Object> getLabels() {
    return labels;
  }

  public int getNumberOfLevels() {
    return levelNames.size();
  }

  public boolean isMultiLevel() {
    return levelNames.size() > 1;
  }

  /**
   * @return The names of the levels, immutable. Entries may be <code>null</code>.
   */
  public List<String> getLevelNames() {
    return levelNames;
  }

  /**
   * @return The name of a single-level set, <code>null</code> for unnamed and multi-level sets.
   */
  public String getName() {
    if (isMultiLevel())
      return null;
    return levelNames.get(0);
  }

  /**
   * @param level
   *          Non-negative position of the level.
   * @return The values of all columns on the given level, in column order.
   */
  public List<Object> getLevelValues(int level) {
    if (level < 0 || level >= levelNames.size())
      throw new IndexOutOfBoundsException(
          "Level " + level + " out of bounds for " + levelNames.size() + " level(s).");

    if (!isMultiLevel())
      return labels;

    ImmutableList.Builder<Object> res = ImmutableList.builder();
    for (Object tuple : labels)
      res.add(((List<?>) tuple).get(level));
    return res.build();
  }

  /**
   * @return true if both sets have the same labels in the same order, regardless of the level names.
   */
  public boolean labelsEqual(ColumnSet other) {
    return labels.equals(other.labels);
  }

  @Override
  public int hashCode() {
    return Objects.hash(labels, levelNames);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof ColumnSet))
      return false;
    ColumnSet other = (ColumnSet) obj;
    return labels.equals(other.labels) && levelNames.equals(other.levelNames);
  }

  @Override
  public String toString() {
    return "ColumnSet[levels=" + levelNames + ", labels=" + Iterables.limit(labels, 100) + "]";
  }
}
