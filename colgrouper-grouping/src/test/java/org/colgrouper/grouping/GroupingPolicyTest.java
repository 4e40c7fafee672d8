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

import org.colgrouper.grouping.exception.GroupingPermissionException;
import org.colgrouper.grouping.exception.IncoherentGroupsException;
import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Tests {@link GroupingPolicy}.
 *
 * @author Bastian Gloeckle
 */
public class GroupingPolicyTest {
  private static final ColumnSet COLUMNS = ColumnSet.of("c0", "c1", "c2");

  private static final GroupSpec BASELINE = GroupSpec.labels("a", "a", "b");

  @Test
  public void isGroupedWithoutBaseline() {
    GroupingPolicy policy = policy(GroupSpec.none(), GroupingPermissions.ALL);

    Assert.assertFalse(policy.isGrouped(GroupSpec.none()));
    Assert.assertFalse(policy.isGrouped(GroupSpec.baseline()));
    Assert.assertFalse(policy.isGrouped(GroupSpec.disable()));
    Assert.assertTrue(policy.isGrouped(BASELINE));
    Assert.assertTrue(policy.isGrouped(GroupSpec.level(0)));
  }

  @Test
  public void isGroupedWithBaseline() {
    GroupingPolicy policy = policy(BASELINE, GroupingPermissions.ALL);

    Assert.assertTrue(policy.isGrouped(GroupSpec.none()));
    Assert.assertTrue(policy.isGrouped(GroupSpec.baseline()));
    Assert.assertFalse(policy.isGrouped(GroupSpec.disable()));
  }

  @Test
  public void enabledAndDisabled() {
    GroupingPolicy ungrouped = policy(GroupSpec.none(), GroupingPermissions.ALL);
    GroupingPolicy grouped = policy(BASELINE, GroupingPermissions.ALL);

    Assert.assertTrue(ungrouped.isGroupingEnabled(BASELINE));
    Assert.assertFalse(ungrouped.isGroupingEnabled(GroupSpec.none()));
    Assert.assertFalse(ungrouped.isGroupingDisabled(GroupSpec.disable()), "Nothing to disable");

    Assert.assertFalse(grouped.isGroupingEnabled(GroupSpec.labels("x", "y", "z")), "Grouping was enabled already");
    Assert.assertTrue(grouped.isGroupingDisabled(GroupSpec.disable()));
    Assert.assertFalse(grouped.isGroupingDisabled(GroupSpec.baseline()));
  }

  @Test
  public void relabelingIsNoModification() {
    // GIVEN
    GroupingPolicy policy = policy(BASELINE, GroupingPermissions.ALL);

    // WHEN
    boolean modified = policy.isGroupingModified(GroupSpec.labels("x", "x", "y"));

    // THEN
    Assert.assertFalse(modified, "Expected same partition with different labels to not be a modification");
    Assert.assertFalse(policy.isGroupingChanged(GroupSpec.labels("x", "x", "y")));
  }

  @Test
  public void differentPartitionIsModification() {
    // GIVEN
    GroupingPolicy policy = policy(BASELINE, GroupingPermissions.ALL);

    // WHEN
    boolean modified = policy.isGroupingModified(GroupSpec.labels("a", "b", "b"));

    // THEN
    Assert.assertTrue(modified, "Expected different partition to be a modification");
    Assert.assertTrue(policy.isGroupingChanged(GroupSpec.labels("a", "b", "b")));
  }

  @Test
  public void sentinelsAreNoModification() {
    GroupingPolicy policy = policy(BASELINE, GroupingPermissions.ALL);

    Assert.assertFalse(policy.isGroupingModified(GroupSpec.none()));
    Assert.assertFalse(policy.isGroupingModified(GroupSpec.baseline()));
    Assert.assertFalse(policy.isGroupingModified(GroupSpec.disable()));
  }

  @Test
  public void bothAbsentIsNoModification() {
    // GIVEN
    GroupingPolicy policy = policy(GroupSpec.none(), GroupingPermissions.ALL);

    // THEN
    Assert.assertFalse(policy.isGroupingModified(GroupSpec.none()), "No grouping vs no grouping is unmodified");
    Assert.assertFalse(policy.isGroupingModified(GroupSpec.disable()), "No grouping vs no grouping is unmodified");
    Assert.assertFalse(policy.isGroupingChanged(GroupSpec.none()));
    Assert.assertFalse(policy.isGroupingModified(GroupSpec.labels("a", "b", "c")),
        "Grouping without baseline is enabling, not modifying");
  }

  @Test(expectedExceptions = IncoherentGroupsException.class)
  public void incoherentModificationCandidate() {
    policy(BASELINE, GroupingPermissions.ALL).isGroupingModified(GroupSpec.labels("a", "b", "a"));
  }

  @Test
  public void enableDenied() {
    GroupingPolicy policy = policy(GroupSpec.none(), GroupingPermissions.ALL.withAllowEnable(false));

    assertDenied(() -> policy.checkGroupSpec(BASELINE), GroupingOperation.ENABLE);
    assertDenied(() -> policy.resolve(GroupSpec.level(0)), GroupingOperation.ENABLE);
    Assert.assertEquals(policy.resolve(GroupSpec.none()), NormalizedSpec.NONE);
    Assert.assertEquals(policy.resolve(GroupSpec.disable()), NormalizedSpec.NONE);
  }

  @Test
  public void disableDenied() {
    GroupingPolicy policy = policy(BASELINE, GroupingPermissions.ALL.withAllowDisable(false));

    assertDenied(() -> policy.resolve(GroupSpec.disable()), GroupingOperation.DISABLE);
    Assert.assertTrue(policy.resolve(GroupSpec.none()).isGrouped());
  }

  @Test
  public void disableWithoutBaselineAlwaysAllowed() {
    GroupingPolicy policy = policy(GroupSpec.none(), GroupingPermissions.of(false, false, false));

    Assert.assertEquals(policy.resolve(GroupSpec.disable()), NormalizedSpec.NONE);
  }

  @Test
  public void modifyDenied() {
    GroupingPolicy policy = policy(BASELINE, GroupingPermissions.ALL.withAllowModify(false));

    assertDenied(() -> policy.resolve(GroupSpec.labels("a", "b", "b")), GroupingOperation.MODIFY);

    NormalizedSpec relabeled = policy.resolve(GroupSpec.labels("x", "x", "y"));
    Assert.assertEquals(relabeled.getLabels().getLabels(), ColumnSet.of("x", "x", "y").getLabels(),
        "Expected relabeling to be allowed and the new labels to be used");
  }

  @Test
  public void permissionOverride() {
    GroupingPolicy policy = policy(BASELINE, GroupingPermissions.ALL);

    assertDenied(() -> policy.resolve(GroupSpec.disable(), GroupingPermissions.ALL.withAllowDisable(false)),
        GroupingOperation.DISABLE);
    Assert.assertEquals(policy.resolve(GroupSpec.disable()), NormalizedSpec.NONE,
        "Expected own permissions to be unaffected by override");
  }

  @Test
  public void baselineIsSubstituted() {
    GroupingPolicy policy = policy(BASELINE, GroupingPermissions.ALL);

    NormalizedSpec resolved = policy.resolve(GroupSpec.baseline());

    Assert.assertEquals(resolved, policy.getBaseline());
    Assert.assertEquals(policy.resolve(GroupSpec.none()), policy.getBaseline());
  }

  private GroupingPolicy policy(GroupSpec baseline, GroupingPermissions permissions) {
    return new GroupingPolicy(COLUMNS, GroupSpecResolver.resolve(COLUMNS, baseline), permissions);
  }

  private void assertDenied(Runnable r, GroupingOperation expectedOperation) {
    try {
      r.run();
      Assert.fail("Expected " + expectedOperation + " to be denied");
    } catch (GroupingPermissionException e) {
      Assert.assertEquals(e.getOperation(), expectedOperation, "Expected correct operation to be denied");
    }
  }

  @Test
  public void performedOperations() {
    GroupingPolicy withBaseline = policy(BASELINE, GroupingPermissions.ALL);
    GroupingPolicy withoutBaseline = policy(GroupSpec.none(), GroupingPermissions.ALL);

    Assert.assertTrue(withoutBaseline.isPerformed(GroupingOperation.ENABLE, BASELINE));
    Assert.assertTrue(withBaseline.isPerformed(GroupingOperation.DISABLE, GroupSpec.disable()));
    Assert.assertTrue(withBaseline.isPerformed(GroupingOperation.MODIFY, GroupSpec.labels("a", "b", "b")));
    Assert.assertFalse(withBaseline.isPerformed(GroupingOperation.ENABLE, GroupSpec.labels("a", "b", "b")));
    Assert.assertFalse(withBaseline.isPerformed(GroupingOperation.MODIFY, GroupSpec.labels("x", "x", "y")));
  }

  @Test
  public void permissionsPerOperation() {
    GroupingPermissions permissions = GroupingPermissions.of(true, false, true);

    Assert.assertTrue(permissions.isAllowed(GroupingOperation.ENABLE));
    Assert.assertFalse(permissions.isAllowed(GroupingOperation.DISABLE));
    Assert.assertTrue(permissions.isAllowed(GroupingOperation.MODIFY));
  }
}
