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
 * A change of a requested grouping relative to the baseline grouping of a {@link ColumnGrouper}, each of which can be
 * prohibited using {@link GroupingPermissions}.
 *
 * @author Bastian Gloeckle
 */
public enum GroupingOperation {
  /** The grouper has no baseline grouping, but a grouping is requested. */
  ENABLE("Enabling grouping is not allowed"),

  /** The grouper has a baseline grouping, but no grouping is requested. */
  DISABLE("Disabling grouping is not allowed"),

  /** A grouping is requested that partitions the columns differently than the baseline grouping. */
  MODIFY("Changing groups is not allowed");

  private final String deniedMessage;

  private GroupingOperation(String deniedMessage) {
    this.deniedMessage = deniedMessage;
  }

  public String getDeniedMessage() {
    return deniedMessage;
  }
}
