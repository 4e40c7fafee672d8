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

import org.colgrouper.cache.NoopCache;
import org.colgrouper.config.Config;
import org.colgrouper.config.ConfigKey;
import org.colgrouper.context.AutoInstatiate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates {@link ColumnGrouper}s whose permissions and caching behavior follow the configuration.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class ColumnGrouperFactory {
  private static final Logger logger = LoggerFactory.getLogger(ColumnGrouperFactory.class);

  @Config(ConfigKey.GROUPING_ALLOW_ENABLE)
  private boolean allowEnable;

  @Config(ConfigKey.GROUPING_ALLOW_DISABLE)
  private boolean allowDisable;

  @Config(ConfigKey.GROUPING_ALLOW_MODIFY)
  private boolean allowModify;

  @Config(ConfigKey.GROUPING_CACHE_RESULTS)
  private boolean cacheResults;

  /**
   * @return A {@link ColumnGrouper} for the given columns that is grouped by the given baseline.
   */
  public ColumnGrouper createColumnGrouper(ColumnSet columns, GroupSpec groupBy) {
    return createBuilder(columns).groupBy(groupBy).build();
  }

  /**
   * @return A {@link ColumnGrouper.Builder} with the configured defaults, which can be changed before building.
   */
  public ColumnGrouper.Builder createBuilder(ColumnSet columns) {
    GroupingPermissions permissions = getDefaultPermissions();
    logger.trace("Creating column grouper for {} with {}, caching results: {}", columns, permissions, cacheResults);

    ColumnGrouper.Builder res = ColumnGrouper.builder(columns).permissions(permissions);
    if (!cacheResults)
      res.cacheSupplier(NoopCache::new);
    return res;
  }

  public GroupingPermissions getDefaultPermissions() {
    return GroupingPermissions.of(allowEnable, allowDisable, allowModify);
  }

  public boolean isCacheResults() {
    return cacheResults;
  }
}
