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

/**
 * The result of resolving a {@link GroupSpec} against a {@link ColumnSet}: Either one label per column or
 * {@link #NONE}, meaning that the columns are not grouped.
 *
 * <p>
 * Correctly implements {@link Object#equals(Object)} and {@link Object#hashCode()}, which makes this the key under
 * which the arrays derived from a grouping are cached.
 *
 * @author Bastian Gloeckle
 */
public final class NormalizedSpec {
  public static final NormalizedSpec NONE = new NormalizedSpec(null);

  private final ColumnSet labels;

  private NormalizedSpec(ColumnSet labels) {
    this.labels = labels;
  }

  public static NormalizedSpec of(ColumnSet labels) {
    if (labels == null)
      throw new IllegalArgumentException("Use NormalizedSpec.NONE for no grouping.");
    return new NormalizedSpec(labels);
  }

  public boolean isGrouped() {
    return labels != null;
  }

  /**
   * @return One label per column or <code>null</code> if not grouped.
   */
  public ColumnSet getLabels() {
    return labels;
  }

  @Override
  public int hashCode() {
    return (labels == null) ? 0 : labels.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof NormalizedSpec))
      return false;
    NormalizedSpec other = (NormalizedSpec) obj;
    if (labels == null)
      return other.labels == null;
    return labels.equals(other.labels);
  }

  @Override
  public String toString() {
    if (labels == null)
      return "NormalizedSpec[NONE]";
    return "NormalizedSpec[" + labels + "]";
  }
}
