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

import org.colgrouper.context.Profiles;
import org.colgrouper.grouping.exception.GroupingPermissionException;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import com.google.common.primitives.ImmutableIntArray;

/**
 * Tests {@link ColumnGrouperFactory}.
 *
 * @author Bastian Gloeckle
 */
public class ColumnGrouperFactoryTest {
  private static final ColumnSet COLUMNS = ColumnSet.of("c0", "c1", "c2");

  private AnnotationConfigApplicationContext dataContext;
  private ColumnGrouperFactory factory;

  @BeforeMethod
  public void setUp() {
    dataContext = new AnnotationConfigApplicationContext();
    dataContext.getEnvironment().setActiveProfiles(Profiles.UNIT_TEST);
    dataContext.scan("org.colgrouper");
    dataContext.refresh();

    factory = dataContext.getBean(ColumnGrouperFactory.class);
  }

  @AfterMethod
  public void cleanup() {
    dataContext.close();
  }

  @Test
  public void configuredPermissions() {
    // WHEN
    ColumnGrouper grouper = factory.createColumnGrouper(COLUMNS, GroupSpec.labels("a", "a", "b"));

    // THEN
    Assert.assertEquals(factory.getDefaultPermissions(), GroupingPermissions.of(true, true, false),
        "Expected permissions of colgrouper-test.properties");
    Assert.assertFalse(grouper.isAllowModify());
    Assert.expectThrows(GroupingPermissionException.class,
        () -> grouper.getGroups(GroupSpec.labels("a", "b", "b")));
    Assert.assertEquals(grouper.getGroups(GroupSpec.labels("x", "x", "y")), ImmutableIntArray.of(0, 0, 1));
  }

  @Test
  public void configuredCaching() {
    // GIVEN
    ColumnGrouper grouper = factory.createBuilder(COLUMNS).allowModify(true).build();

    // WHEN
    ImmutableIntArray counts1 = grouper.getGroupCounts(GroupSpec.labels("a", "b", "b"));
    ImmutableIntArray counts2 = grouper.getGroupCounts(GroupSpec.labels("a", "b", "b"));

    // THEN
    Assert.assertFalse(factory.isCacheResults());
    Assert.assertNotSame(counts2, counts1, "Expected results to not be cached");
    Assert.assertEquals(counts2, ImmutableIntArray.of(1, 2));
  }
}
