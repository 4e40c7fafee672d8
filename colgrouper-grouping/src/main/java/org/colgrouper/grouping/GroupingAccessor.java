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
 * The derived results of a {@link ColumnGrouper} that are cached separately. Used as first part of the cache key, the
 * second part being the {@link NormalizedSpec}.
 *
 * @author Bastian Gloeckle
 */
public enum GroupingAccessor {
  /** {@link Factorization} of the columns. */
  GROUPS_AND_COLUMNS,

  /** Number of columns per group. */
  GROUP_COUNTS,

  /** First column of each group. */
  GROUP_START_IDXS,

  /** Position after the last column of each group. */
  GROUP_END_IDXS
}
