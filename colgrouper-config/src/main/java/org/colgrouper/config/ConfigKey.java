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
package org.colgrouper.config;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Configuration keys which can be used to resolve configuration values.
 * 
 * <p>
 * It's easiest to use these constants with the {@link Config} annotation.
 *
 * @author Bastian Gloeckle
 */
public class ConfigKey {
  /**
   * Whether column groupers created by the factory allow enabling a grouping when they were created without one.
   * 
   * <p>
   * Value is "true" or "false".
   */
  public static final String GROUPING_ALLOW_ENABLE = "groupingAllowEnable";

  /**
   * Whether column groupers created by the factory allow disabling the grouping they were created with.
   * 
   * <p>
   * Value is "true" or "false".
   */
  public static final String GROUPING_ALLOW_DISABLE = "groupingAllowDisable";

  /**
   * Whether column groupers created by the factory allow requesting a grouping that partitions the columns differently
   * than the grouping they were created with. Relabeling groups without changing which columns belong together is
   * always allowed.
   * 
   * <p>
   * Value is "true" or "false".
   */
  public static final String GROUPING_ALLOW_MODIFY = "groupingAllowModify";

  /**
   * Whether column groupers created by the factory cache their group ids, counts and boundaries per distinct resolved
   * grouping.
   * 
   * <p>
   * The cache of a grouper is never evicted while the grouper is alive, so it grows with each distinct grouping that
   * is requested. Set this to "false" if a grouper is queried with a large number of different groupings.
   */
  public static final String GROUPING_CACHE_RESULTS = "groupingCacheResults";

  /**
   * All keys that colgrouper knows.
   */
  public static final Set<String> ALL_KEYS = Collections.unmodifiableSet(new HashSet<>(Arrays
      .asList(GROUPING_ALLOW_ENABLE, GROUPING_ALLOW_DISABLE, GROUPING_ALLOW_MODIFY, GROUPING_CACHE_RESULTS)));
}
