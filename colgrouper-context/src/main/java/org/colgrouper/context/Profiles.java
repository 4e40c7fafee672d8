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
package org.colgrouper.context;

import org.springframework.context.annotation.Profile;

/**
 * Names of the Spring profiles that switch optional beans on, to be used with {@link Profile}.
 *
 * <p>
 * Beans marked with {@link AutoInstatiate} that have no {@link Profile} annotation are always created.
 *
 * @author Bastian Gloeckle
 */
public final class Profiles {
  /**
   * Loads configuration values and wires them into fields annotated with <code>@Config</code>. Beans that read
   * configuration values (e.g. the factory of column groupers) need this profile to be active.
   */
  public static final String CONFIG = "Config";

  /**
   * Profiles to activate when running unit tests that start a Spring context.
   */
  public static final String[] UNIT_TEST = new String[] { CONFIG };

  private Profiles() {
  }
}
