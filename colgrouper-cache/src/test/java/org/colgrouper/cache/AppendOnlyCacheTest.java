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

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Tests {@link AppendOnlyCache}.
 *
 * @author Bastian Gloeckle
 */
public class AppendOnlyCacheTest {
  @Test
  public void simpleAdd() {
    // GIVEN
    AppendOnlyCache<Integer, String, Long> cache = new AppendOnlyCache<>();

    // WHEN
    boolean accepted1 = cache.offer(1, "a", 3L);
    boolean accepted2 = cache.offer(1, "b", 4L);
    boolean accepted3 = cache.offer(2, "a", 5L);

    // THEN
    Assert.assertTrue(accepted1 && accepted2 && accepted3, "Expected all distinct keys to be accepted");
    Assert.assertEquals((long) cache.get(1, "a"), 3L, "Expected to get value.");
    Assert.assertEquals((long) cache.get(2, "a"), 5L, "Expected to get value.");
    Assert.assertEquals(new HashSet<>(cache.getAll(1)), new HashSet<>(Arrays.asList(3L, 4L)),
        "Expected to get values.");
    Assert.assertEquals(cache.size(), 3, "Expected correct size");
  }

  @Test
  public void firstOfferWins() {
    // GIVEN
    AppendOnlyCache<Integer, String, Long> cache = new AppendOnlyCache<>();
    cache.offer(1, "a", 3L);

    // WHEN
    boolean accepted = cache.offer(1, "a", 10L);

    // THEN
    Assert.assertFalse(accepted, "Expected second offer for same keys to be rejected");
    Assert.assertEquals((long) cache.get(1, "a"), 3L, "Expected first value to stay in the cache");
    Assert.assertEquals(cache.size(), 1, "Expected correct size");
  }

  @Test
  public void offerOrGetReturnsFirstValue() {
    // GIVEN
    AppendOnlyCache<Integer, String, Long> cache = new AppendOnlyCache<>();

    // WHEN
    long first = cache.offerOrGet(1, "a", 3L);
    long second = cache.offerOrGet(1, "a", 10L);

    // THEN
    Assert.assertEquals(first, 3L, "Expected offered value to be returned");
    Assert.assertEquals(second, 3L, "Expected value that was cached first to be returned");
  }

  @Test
  public void typedGet() {
    AppendOnlyCache<Integer, String, Object> cache = new AppendOnlyCache<>();
    cache.offer(1, "a", "value");

    Assert.assertEquals(cache.get(1, "a", String.class), "value", "Expected to get typed value");
    Assert.assertNull(cache.get(1, "b", String.class), "Expected no value for unknown key2");
  }

  @Test(expectedExceptions = ClassCastException.class)
  public void typedGetWrongType() {
    AppendOnlyCache<Integer, String, Object> cache = new AppendOnlyCache<>();
    cache.offer(1, "a", "value");

    cache.get(1, "a", Long.class);
  }

  @Test
  public void missingKeys() {
    AppendOnlyCache<Integer, String, Long> cache = new AppendOnlyCache<>();
    cache.offer(1, "a", 3L);

    Assert.assertNull(cache.get(1, "b"), "Expected no value for unknown key2");
    Assert.assertNull(cache.get(2, "a"), "Expected no value for unknown key1");
    Assert.assertTrue(cache.getAll(2).isEmpty(), "Expected no values for unknown key1");
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void nullValueRejected() {
    new AppendOnlyCache<Integer, String, Long>().offer(1, "a", null);
  }

  @Test
  public void concurrentOffersAcceptExactlyOne() throws Exception {
    // GIVEN
    AppendOnlyCache<Integer, String, Integer> cache = new AppendOnlyCache<>();
    ExecutorService executor = Executors.newFixedThreadPool(8);
    try {
      List<Callable<Boolean>> offers = IntStream.range(0, 64).mapToObj(i -> (Callable<Boolean>) () -> {
        return cache.offer(0, "key", i);
      }).collect(Collectors.toList());

      // WHEN
      List<Future<Boolean>> results = executor.invokeAll(offers);

      // THEN
      int accepted = 0;
      for (Future<Boolean> f : results)
        if (f.get())
          accepted++;

      Assert.assertEquals(accepted, 1, "Expected exactly one offer to be accepted");
      Assert.assertEquals(cache.size(), 1, "Expected correct size");
      Assert.assertEquals(cache.getAll(0).size(), 1, "Expected one value for key1");
    } finally {
      executor.shutdownNow();
    }
  }
}
