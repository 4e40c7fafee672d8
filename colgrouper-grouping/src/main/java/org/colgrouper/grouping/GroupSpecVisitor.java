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

import org.colgrouper.grouping.GroupSpec.ExplicitLabels;
import org.colgrouper.grouping.GroupSpec.LevelSelector;

/**
 * Visits exactly one of the alternatives of a {@link GroupSpec}, see {@link GroupSpec#accept(GroupSpecVisitor)}.
 *
 * @param <T>
 *          Result type.
 * @author Bastian Gloeckle
 */
public interface GroupSpecVisitor<T> {
  public T visitNoGrouping();

  public T visitUseBaseline();

  public T visitExplicitDisable();

  public T visitLevelSelector(LevelSelector selector);

  public T visitExplicitLabels(ExplicitLabels labels);
}
