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
package org.colgrouper.grouping.exception;

/**
 * A grouping puts columns into one group that are not adjacent to each other, or the group ids decrease somewhere.
 * 
 * <p>
 * Groups must be coherent and sorted: each group has to occupy exactly one unbroken run of columns.
 *
 * @author Bastian Gloeckle
 */
public class IncoherentGroupsException extends GroupingException {
  private static final long serialVersionUID = 1L;

  private final int position;

  public IncoherentGroupsException(int position, String msg) {
    super("Groups must be coherent and sorted: " + msg);
    this.position = position;
  }

  /**
   * @return The column position at which the violation was detected.
   */
  public int getPosition() {
    return position;
  }
}
