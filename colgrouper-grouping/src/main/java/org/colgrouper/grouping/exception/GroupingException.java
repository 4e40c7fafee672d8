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
 * Base class of all exceptions raised when a column grouping cannot be resolved or is not allowed.
 * 
 * <p>
 * These are raised synchronously at the point of detection. A call that raises one of these does not return any
 * partial result and does not leave any state behind.
 *
 * @author Bastian Gloeckle
 */
public class GroupingException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public GroupingException(String msg, Throwable cause) {
    super(msg, cause);
  }

  public GroupingException(String msg) {
    super(msg);
  }
}
