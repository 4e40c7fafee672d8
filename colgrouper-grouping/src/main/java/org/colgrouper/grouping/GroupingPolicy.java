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
import org.colgrouper.grouping.exception.GroupingPermissionException;
import org.colgrouper.grouping.exception.IncoherentGroupsException;
import org.colgrouper.grouping.exception.LengthMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.primitives.ImmutableIntArray;

/**
 * Decides how a requested {@link GroupSpec} relates to the baseline grouping of a {@link ColumnGrouper} and whether
 * the request is allowed according to the {@link GroupingPermissions}.
 *
 * <p>
 * A requested grouping...
 * <ul>
 * <li>enables grouping if there is no baseline grouping but the request groups the columns.
 * <li>disables grouping if there is a baseline grouping but the request does not group the columns.
 * <li>modifies the grouping if both group the columns, but the request puts the columns into different groups than the
 * baseline does. Only using different labels for the same groups is not a modification.
 * </ul>
 *
 * <p>
 * {@link GroupSpec#none()} and {@link GroupSpec#baseline()} requests are replaced by the baseline grouping before
 * anything is checked.
 *
 * @author Bastian Gloeckle
 */
public class GroupingPolicy {
  private static final Logger logger = LoggerFactory.getLogger(GroupingPolicy.class);

  private final ColumnSet columns;
  private final NormalizedSpec baseline;
  private final GroupingPermissions permissions;

  private final Supplier<ImmutableIntArray> baselineGroupIds;

  /**
   * @param baseline
   *          The resolved baseline grouping, {@link NormalizedSpec#NONE} if there is none.
   */
  public GroupingPolicy(ColumnSet columns, NormalizedSpec baseline, GroupingPermissions permissions) {
    this.columns = columns;
    this.baseline = baseline;
    this.permissions = permissions;
    this.baselineGroupIds = Suppliers.memoize(() -> GroupIndexer.factorize(columns, baseline).getGroupIds());
  }

  /**
   * @return true if the columns are grouped when using the given spec.
   */
  public boolean isGrouped(GroupSpec spec) {
    return spec.accept(new GroupSpecVisitor<Boolean>() {
      @Override
      public Boolean visitNoGrouping() {
        return baseline.isGrouped();
      }

      @Override
      public Boolean visitUseBaseline() {
        return baseline.isGrouped();
      }

      @Override
      public Boolean visitExplicitDisable() {
        return false;
      }

      @Override
      public Boolean visitLevelSelector(LevelSelector selector) {
        return true;
      }

      @Override
      public Boolean visitExplicitLabels(ExplicitLabels labels) {
        return true;
      }
    });
  }

  /**
   * @return true if there is no baseline grouping, but the given spec groups the columns.
   */
  public boolean isGroupingEnabled(GroupSpec spec) {
    return !baseline.isGrouped() && isGrouped(spec);
  }

  /**
   * @return true if there is a baseline grouping, but the given spec does not group the columns.
   */
  public boolean isGroupingDisabled(GroupSpec spec) {
    return baseline.isGrouped() && !isGrouped(spec);
  }

  /**
   * @return true if there is a baseline grouping and the given spec explicitly groups the columns into different groups
   *         than the baseline does.
   * @throws LengthMismatchException
   *           if the spec does not have one label per column.
   * @throws IncoherentGroupsException
   *           if the labels differ from the baseline and the spec does not group the columns coherently.
   */
  public boolean isGroupingModified(GroupSpec spec) throws LengthMismatchException, IncoherentGroupsException {
    if (!baseline.isGrouped())
      return false;

    NormalizedSpec requested = GroupSpecResolver.resolve(columns, spec);
    if (!requested.isGrouped())
      return false;

    if (requested.getLabels().labelsEqual(baseline.getLabels()))
      return false;

    ImmutableIntArray requestedGroupIds = GroupIndexer.factorize(columns, requested).getGroupIds();
    return !requestedGroupIds.equals(baselineGroupIds.get());
  }

  /**
   * @return true if the given spec enables, disables or modifies the grouping.
   */
  public boolean isGroupingChanged(GroupSpec spec) {
    return isGroupingEnabled(spec) || isGroupingDisabled(spec) || isGroupingModified(spec);
  }

  /**
   * Checks the given spec against the permissions of this policy.
   *
   * @throws GroupingPermissionException
   *           if the spec is not allowed.
   */
  public void checkGroupSpec(GroupSpec spec) throws GroupingPermissionException {
    checkGroupSpec(spec, permissions);
  }

  /**
   * Checks the given spec against the given permissions instead of the ones of this policy.
   *
   * @throws GroupingPermissionException
   *           if the spec is not allowed.
   */
  public void checkGroupSpec(GroupSpec spec, GroupingPermissions permissionOverride)
      throws GroupingPermissionException {
    for (GroupingOperation operation : GroupingOperation.values())
      if (!permissionOverride.isAllowed(operation) && isPerformed(operation, spec))
        throw denied(operation, spec);
  }

  /**
   * @return true if requesting the given spec would perform the given operation.
   */
  public boolean isPerformed(GroupingOperation operation, GroupSpec spec) {
    switch (operation) {
    case ENABLE:
      return isGroupingEnabled(spec);
    case DISABLE:
      return isGroupingDisabled(spec);
    case MODIFY:
      return isGroupingModified(spec);
    default:
      throw new IllegalArgumentException("Unknown operation " + operation);
    }
  }

  /**
   * Substitutes the baseline if needed, checks the permissions and resolves the given spec.
   *
   * @throws GroupingPermissionException
   *           if the spec is not allowed.
   * @throws LengthMismatchException
   *           if the spec does not have one label per column.
   */
  public NormalizedSpec resolve(GroupSpec spec) throws GroupingPermissionException, LengthMismatchException {
    return resolve(spec, permissions);
  }

  /**
   * Substitutes the baseline if needed, checks against the given permissions and resolves the given spec.
   *
   * @throws GroupingPermissionException
   *           if the spec is not allowed.
   * @throws LengthMismatchException
   *           if the spec does not have one label per column.
   */
  public NormalizedSpec resolve(GroupSpec spec, GroupingPermissions permissionOverride)
      throws GroupingPermissionException, LengthMismatchException {
    GroupSpec effective = substituteBaseline(spec);
    checkGroupSpec(effective, permissionOverride);
    return GroupSpecResolver.resolve(columns, effective);
  }

  /**
   * @return The spec that actually needs to be used when the given one is requested.
   */
  private GroupSpec substituteBaseline(GroupSpec spec) {
    GroupSpec baselineSpec = baseline.isGrouped() ? GroupSpec.labels(baseline.getLabels()) : GroupSpec.none();

    return spec.accept(new GroupSpecVisitor<GroupSpec>() {
      @Override
      public GroupSpec visitNoGrouping() {
        return baselineSpec;
      }

      @Override
      public GroupSpec visitUseBaseline() {
        return baselineSpec;
      }

      @Override
      public GroupSpec visitExplicitDisable() {
        // disabling nothing is not disabling anything.
        return baseline.isGrouped() ? spec : GroupSpec.none();
      }

      @Override
      public GroupSpec visitLevelSelector(LevelSelector selector) {
        return spec;
      }

      @Override
      public GroupSpec visitExplicitLabels(ExplicitLabels labels) {
        return spec;
      }
    });
  }

  private GroupingPermissionException denied(GroupingOperation operation, GroupSpec spec) {
    logger.debug("Denied {} of grouping for columns {}: requested {}, baseline {}", operation, columns, spec,
        baseline);
    return new GroupingPermissionException(operation);
  }

  public ColumnSet getColumns() {
    return columns;
  }

  public NormalizedSpec getBaseline() {
    return baseline;
  }

  public GroupingPermissions getPermissions() {
    return permissions;
  }
}
