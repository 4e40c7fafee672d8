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

import org.colgrouper.grouping.GroupingOperation;

/**
 * A requested grouping would enable, disable or modify the baseline grouping of a grouper although that is not
 * allowed.
 *
 * @author Bastian Gloeckle
 */
public class GroupingPermissionException extends GroupingException {
  private static final long serialVersionUID = 1L;

  private final GroupingOperation operation;

  public GroupingPermissionException(GroupingOperation operation) {
    super(operation.getDeniedMessage());
    this.operation = operation;
  }

  /**
   * @return The operation that was denied.
   */
  public GroupingOperation getOperation() {
    return operation;
  }
}
