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
 * Which {@link GroupingOperation}s are allowed. Immutable.
 *
 * @author Bastian Gloeckle
 */
public final class GroupingPermissions {
  public static final GroupingPermissions ALL = new GroupingPermissions(true, true, true);

  private final boolean allowEnable;
  private final boolean allowDisable;
  private final boolean allowModify;

  private GroupingPermissions(boolean allowEnable, boolean allowDisable, boolean allowModify) {
    this.allowEnable = allowEnable;
    this.allowDisable = allowDisable;
    this.allowModify = allowModify;
  }

  public static GroupingPermissions of(boolean allowEnable, boolean allowDisable, boolean allowModify) {
    return new GroupingPermissions(allowEnable, allowDisable, allowModify);
  }

  public boolean isAllowEnable() {
    return allowEnable;
  }

  public boolean isAllowDisable() {
    return allowDisable;
  }

  public boolean isAllowModify() {
    return allowModify;
  }

  public boolean isAllowed(GroupingOperation operation) {
    switch (operation) {
    case ENABLE:
      return allowEnable;
    case DISABLE:
      return allowDisable;
    case MODIFY:
      return allowModify;
    default:
      throw new IllegalArgumentException("Unknown operation " + operation);
    }
  }

  public GroupingPermissions withAllowEnable(boolean allowEnable) {
    return new GroupingPermissions(allowEnable, allowDisable, allowModify);
  }

  public GroupingPermissions withAllowDisable(boolean allowDisable) {
    return new GroupingPermissions(allowEnable, allowDisable, allowModify);
  }

  public GroupingPermissions withAllowModify(boolean allowModify) {
    return new GroupingPermissions(allowEnable, allowDisable, allowModify);
  }

  @Override
  public int hashCode() {
    return (allowEnable ? 1 : 0) | (allowDisable ? 2 : 0) | (allowModify ? 4 : 0);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof GroupingPermissions))
      return false;
    GroupingPermissions other = (GroupingPermissions) obj;
    return allowEnable == other.allowEnable && allowDisable == other.allowDisable && allowModify == other.allowModify;
  }

  @Override
  public String toString() {
    return "GroupingPermissions[allowEnable=" + allowEnable + ", allowDisable=" + allowDisable + ", allowModify="
        + allowModify + "]";
  }
}
