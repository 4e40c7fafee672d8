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

import java.util.Objects;
import java.util.function.Supplier;

import org.colgrouper.cache.AppendOnlyCache;
import org.colgrouper.cache.WritableCache;
import org.colgrouper.grouping.exception.GroupingPermissionException;
import org.colgrouper.grouping.exception.IncoherentGroupsException;
import org.colgrouper.grouping.exception.LengthMismatchException;
import org.colgrouper.grouping.exception.MissingInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.primitives.ImmutableIntArray;

/**
 * Groups the columns of a {@link ColumnSet}, e.g. parallel time series in a table, and provides the group of each
 * column and the boundaries of each group.
 *
 * <p>
 * A {@link ColumnGrouper} has a baseline grouping which is used if a call does not request a specific grouping. Each
 * call may request a different grouping using a {@link GroupSpec}, which is checked against the
 * {@link GroupingPermissions} of this grouper (see {@link GroupingPolicy}).
 *
 * <p>
 * Groups must be coherent and sorted: all columns of a group need to be adjacent to each other. Requesting a grouping
 * that does not fulfill this results in an {@link IncoherentGroupsException}.
 *
 * <p>
 * Instances are immutable. Use {@link #toBuilder()} or one of the <code>with*</code> methods to get a changed copy.
 * All results are cached per distinct resolved grouping for the lifetime of the instance; the returned arrays are
 * immutable. Two instances are equal if they have equal columns, baseline and permissions.
 *
 * @author Bastian Gloeckle
 */
public final class ColumnGrouper {
  private static final Logger logger = LoggerFactory.getLogger(ColumnGrouper.class);

  private final ColumnSet columns;
  private final NormalizedSpec baseline;
  private final GroupingPermissions permissions;
  private final GroupingPolicy policy;

  private final Supplier<WritableCache<GroupingAccessor, NormalizedSpec, Object>> cacheSupplier;
  private final WritableCache<GroupingAccessor, NormalizedSpec, Object> cache;

  private ColumnGrouper(Builder builder) throws LengthMismatchException {
    this.columns = builder.columns;
    this.baseline = GroupSpecResolver.resolve(columns, builder.groupBy);
    this.permissions = builder.permissions;
    this.policy = new GroupingPolicy(columns, baseline, permissions);
    this.cacheSupplier = builder.cacheSupplier;
    this.cache = cacheSupplier.get();
  }

  public static Builder builder(ColumnSet columns) {
    return new Builder().columns(columns);
  }

  /**
   * @return A new {@link Builder} initialized with the state of this grouper. Groupers built by it start with an empty
   *         cache.
   */
  public Builder toBuilder() {
    return new Builder().columns(columns).groupBy(getGroupBy()).permissions(permissions).cacheSupplier(cacheSupplier);
  }

  /**
   * @return A copy of this grouper with the given baseline grouping.
   */
  public ColumnGrouper withGroupBy(GroupSpec groupBy) {
    return toBuilder().groupBy(groupBy).build();
  }

  /**
   * @return A copy of this grouper with the given permissions.
   */
  public ColumnGrouper withPermissions(GroupingPermissions permissions) {
    return toBuilder().permissions(permissions).build();
  }

  public ColumnSet getColumns() {
    return columns;
  }

  /**
   * @return The baseline grouping, {@link GroupSpec#none()} if there is none.
   */
  public GroupSpec getGroupBy() {
    return baseline.isGrouped() ? GroupSpec.labels(baseline.getLabels()) : GroupSpec.none();
  }

  public NormalizedSpec getBaseline() {
    return baseline;
  }

  public GroupingPermissions getPermissions() {
    return permissions;
  }

  public boolean isAllowEnable() {
    return permissions.isAllowEnable();
  }

  public boolean isAllowDisable() {
    return permissions.isAllowDisable();
  }

  public boolean isAllowModify() {
    return permissions.isAllowModify();
  }

  /**
   * @see GroupingPolicy#isGrouped(GroupSpec)
   */
  public boolean isGrouped(GroupSpec groupBy) {
    return policy.isGrouped(groupBy);
  }

  /**
   * @return true if the baseline groups the columns.
   */
  public boolean isGrouped() {
    return policy.isGrouped(GroupSpec.none());
  }

  /**
   * @see GroupingPolicy#isGroupingEnabled(GroupSpec)
   */
  public boolean isGroupingEnabled(GroupSpec groupBy) {
    return policy.isGroupingEnabled(groupBy);
  }

  /**
   * @see GroupingPolicy#isGroupingDisabled(GroupSpec)
   */
  public boolean isGroupingDisabled(GroupSpec groupBy) {
    return policy.isGroupingDisabled(groupBy);
  }

  /**
   * @see GroupingPolicy#isGroupingModified(GroupSpec)
   */
  public boolean isGroupingModified(GroupSpec groupBy) {
    return policy.isGroupingModified(groupBy);
  }

  /**
   * @see GroupingPolicy#isGroupingChanged(GroupSpec)
   */
  public boolean isGroupingChanged(GroupSpec groupBy) {
    return policy.isGroupingChanged(groupBy);
  }

  /**
   * @see GroupingPolicy#checkGroupSpec(GroupSpec)
   */
  public void checkGroupSpec(GroupSpec groupBy) throws GroupingPermissionException {
    policy.checkGroupSpec(groupBy);
  }

  /**
   * @see GroupingPolicy#checkGroupSpec(GroupSpec, GroupingPermissions)
   */
  public void checkGroupSpec(GroupSpec groupBy, GroupingPermissions permissionOverride)
      throws GroupingPermissionException {
    policy.checkGroupSpec(groupBy, permissionOverride);
  }

  /**
   * @see GroupingPolicy#resolve(GroupSpec)
   */
  public NormalizedSpec resolveGroupSpec(GroupSpec groupBy) throws GroupingPermissionException {
    return policy.resolve(groupBy);
  }

  /**
   * @see GroupingPolicy#resolve(GroupSpec, GroupingPermissions)
   */
  public NormalizedSpec resolveGroupSpec(GroupSpec groupBy, GroupingPermissions permissionOverride)
      throws GroupingPermissionException {
    return policy.resolve(groupBy, permissionOverride);
  }

  /**
   * @return Group id of each column and the distinct group labels, using the baseline grouping.
   */
  public Factorization getGroupsAndColumns() {
    return getGroupsAndColumns(GroupSpec.none());
  }

  /**
   * @return Group id of each column and the distinct group labels.
   */
  public Factorization getGroupsAndColumns(GroupSpec groupBy) {
    return getGroupsAndColumns(groupBy, permissions);
  }

  /**
   * @return Group id of each column and the distinct group labels, checking against the given permissions.
   */
  public Factorization getGroupsAndColumns(GroupSpec groupBy, GroupingPermissions permissionOverride) {
    return groupsAndColumns(policy.resolve(groupBy, permissionOverride));
  }

  public ImmutableIntArray getGroups() {
    return getGroups(GroupSpec.none());
  }

  /**
   * @return The group id of each column.
   */
  public ImmutableIntArray getGroups(GroupSpec groupBy) {
    return getGroupsAndColumns(groupBy).getGroupIds();
  }

  public ImmutableIntArray getGroups(GroupSpec groupBy, GroupingPermissions permissionOverride) {
    return getGroupsAndColumns(groupBy, permissionOverride).getGroupIds();
  }

  public ColumnSet getGroupedColumns() {
    return getGroupedColumns(GroupSpec.none());
  }

  /**
   * @return The distinct group labels. If the columns are not grouped, these are the columns themselves.
   */
  public ColumnSet getGroupedColumns(GroupSpec groupBy) {
    return getGroupsAndColumns(groupBy).getGroupIndex();
  }

  public ColumnSet getGroupedColumns(GroupSpec groupBy, GroupingPermissions permissionOverride) {
    return getGroupsAndColumns(groupBy, permissionOverride).getGroupIndex();
  }

  public ImmutableIntArray getGroupCounts() {
    return getGroupCounts(GroupSpec.none());
  }

  /**
   * @return The number of columns in each group.
   */
  public ImmutableIntArray getGroupCounts(GroupSpec groupBy) {
    return getGroupCounts(groupBy, permissions);
  }

  public ImmutableIntArray getGroupCounts(GroupSpec groupBy, GroupingPermissions permissionOverride) {
    return groupCounts(policy.resolve(groupBy, permissionOverride));
  }

  public ImmutableIntArray getGroupStartIdxs() {
    return getGroupStartIdxs(GroupSpec.none());
  }

  /**
   * @return The position of the first column of each group.
   */
  public ImmutableIntArray getGroupStartIdxs(GroupSpec groupBy) {
    return getGroupStartIdxs(groupBy, permissions);
  }

  public ImmutableIntArray getGroupStartIdxs(GroupSpec groupBy, GroupingPermissions permissionOverride) {
    NormalizedSpec resolved = policy.resolve(groupBy, permissionOverride);
    return cached(GroupingAccessor.GROUP_START_IDXS, resolved, ImmutableIntArray.class,
        () -> GroupBoundaryCalculator.starts(groupCounts(resolved)));
  }

  public ImmutableIntArray getGroupEndIdxs() {
    return getGroupEndIdxs(GroupSpec.none());
  }

  /**
   * @return The position after the last column of each group.
   */
  public ImmutableIntArray getGroupEndIdxs(GroupSpec groupBy) {
    return getGroupEndIdxs(groupBy, permissions);
  }

  public ImmutableIntArray getGroupEndIdxs(GroupSpec groupBy, GroupingPermissions permissionOverride) {
    NormalizedSpec resolved = policy.resolve(groupBy, permissionOverride);
    return cached(GroupingAccessor.GROUP_END_IDXS, resolved, ImmutableIntArray.class,
        () -> GroupBoundaryCalculator.ends(groupCounts(resolved)));
  }

  private Factorization groupsAndColumns(NormalizedSpec resolved) {
    return cached(GroupingAccessor.GROUPS_AND_COLUMNS, resolved, Factorization.class,
        () -> GroupIndexer.factorize(columns, resolved));
  }

  private ImmutableIntArray groupCounts(NormalizedSpec resolved) {
    return cached(GroupingAccessor.GROUP_COUNTS, resolved, ImmutableIntArray.class, () -> {
      if (!resolved.isGrouped())
        return GroupBoundaryCalculator.singletonCounts(columns.size());
      return GroupBoundaryCalculator.runLengths(groupsAndColumns(resolved).getGroupIds());
    });
  }

  private <T> T cached(GroupingAccessor accessor, NormalizedSpec resolved, Class<T> type, Supplier<T> computation) {
    T res = cache.get(accessor, resolved, type);
    if (res != null) {
      logger.trace("Using cached {} for {}", accessor, resolved);
      return res;
    }

    T computed = computation.get();
    logger.trace("Computed {} for {}: {}", accessor, resolved, computed);
    // a concurrent caller might have been faster, in which case its result is used.
    return type.cast(cache.offerOrGet(accessor, resolved, computed));
  }

  @Override
  public int hashCode() {
    return Objects.hash(columns, baseline, permissions);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof ColumnGrouper))
      return false;
    ColumnGrouper other = (ColumnGrouper) obj;
    return columns.equals(other.columns) && baseline.equals(other.baseline) && permissions.equals(other.permissions);
  }

  @Override
  public String toString() {
    return "ColumnGrouper[columns=" + columns + ", baseline=" + baseline + ", permissions=" + permissions + "]";
  }

  /**
   * Builds {@link ColumnGrouper}s. By default there is no baseline grouping, everything is allowed and results are
   * cached in an {@link AppendOnlyCache}.
   */
  public static final class Builder {
    private ColumnSet columns;
    private GroupSpec groupBy = GroupSpec.none();
    private GroupingPermissions permissions = GroupingPermissions.ALL;
    private Supplier<WritableCache<GroupingAccessor, NormalizedSpec, Object>> cacheSupplier = AppendOnlyCache::new;

    private Builder() {
    }

    public Builder columns(ColumnSet columns) {
      this.columns = columns;
      return this;
    }

    /**
     * @param groupBy
     *          The baseline grouping. {@link GroupSpec#baseline()} and {@link GroupSpec#disable()} are the same as
     *          {@link GroupSpec#none()} here. <code>null</code> means no grouping.
     */
    public Builder groupBy(GroupSpec groupBy) {
      this.groupBy = (groupBy == null) ? GroupSpec.none() : groupBy;
      return this;
    }

    /**
     * @throws MissingInputException
     *           if the permissions are <code>null</code>.
     */
    public Builder permissions(GroupingPermissions permissions) throws MissingInputException {
      if (permissions == null)
        throw new MissingInputException("permissions");
      this.permissions = permissions;
      return this;
    }

    public Builder allowEnable(boolean allowEnable) {
      permissions = permissions.withAllowEnable(allowEnable);
      return this;
    }

    public Builder allowDisable(boolean allowDisable) {
      permissions = permissions.withAllowDisable(allowDisable);
      return this;
    }

    public Builder allowModify(boolean allowModify) {
      permissions = permissions.withAllowModify(allowModify);
      return this;
    }

    /**
     * @param cacheSupplier
     *          Creates the cache of each built grouper. It is called once per grouper, a cache must not be shared
     *          between groupers.
     */
    public Builder cacheSupplier(Supplier<WritableCache<GroupingAccessor, NormalizedSpec, Object>> cacheSupplier) {
      this.cacheSupplier = cacheSupplier;
      return this;
    }

    /**
     * @throws MissingInputException
     *           if no columns or cache supplier have been set.
     * @throws LengthMismatchException
     *           if the baseline grouping does not have one label per column.
     */
    public ColumnGrouper build() throws MissingInputException, LengthMismatchException {
      if (columns == null)
        throw new MissingInputException("columns");
      if (cacheSupplier == null)
        throw new MissingInputException("cacheSupplier");
      return new ColumnGrouper(this);
    }
  }
}
