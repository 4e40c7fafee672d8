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
package org.colgrouper.cache;

import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Tests {@link NoopCache}.
 *
 * @author Bastian Gloeckle
 */
public class NoopCacheTest {
  @Test
  public void nothingCached() {
    // GIVEN
    NoopCache<Integer, String, Long> cache = new NoopCache<>();

    // WHEN
    boolean accepted = cache.offer(1, "a", 3L);

    // THEN
    Assert.assertFalse(accepted, "Expected offer to be rejected");
    Assert.assertNull(cache.get(1, "a"), "Expected to NOT get value.");
    Assert.assertTrue(cache.getAll(1).isEmpty(), "Expected to NOT get values.");
    Assert.assertEquals(cache.size(), 0, "Expected correct size");
  }

  @Test
  public void offerOrGetReturnsOfferedValue() {
    NoopCache<Integer, String, Long> cache = new NoopCache<>();

    Assert.assertEquals((long) cache.offerOrGet(1, "a", 3L), 3L, "Expected offered value");
    Assert.assertEquals((long) cache.offerOrGet(1, "a", 4L), 4L, "Expected offered value");
  }
}
