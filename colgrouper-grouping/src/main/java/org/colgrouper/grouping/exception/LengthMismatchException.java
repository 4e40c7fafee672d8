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
 * The labels of a grouping specification do not have one entry per column.
 *
 * @author Bastian Gloeckle
 */
public class LengthMismatchException extends GroupingException {
  private static final long serialVersionUID = 1L;

  private final int expectedLength;
  private final int actualLength;

  public LengthMismatchException(int expectedLength, int actualLength) {
    super("Grouping labels and columns must have the same length, but there are " + actualLength + " labels for "
        + expectedLength + " columns.");
    this.expectedLength = expectedLength;
    this.actualLength = actualLength;
  }

  /**
   * @return Number of columns.
   */
  public int getExpectedLength() {
    return expectedLength;
  }

  /**
   * @return Number of labels in the grouping specification.
   */
  public int getActualLength() {
    return actualLength;
  }
}
