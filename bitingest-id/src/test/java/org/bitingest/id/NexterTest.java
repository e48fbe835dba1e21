/**
 * bitingest: Bitmap Index Ingestion.
 *
 * Copyright (C) 2015 Bastian Gloeckle
 *
 * This file is part of bitingest.
 *
 * bitingest is free software: you can redistribute it and/or modify
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
package org.bitingest.id;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Tests {@link Nexter}.
 *
 * @author Bastian Gloeckle
 */
public class NexterTest {
  @Test
  public void startsAtGivenValue() {
    // GIVEN
    Nexter nexter = new Nexter(10);

    // WHEN
    long first = nexter.next();
    long second = nexter.next();

    // THEN
    Assert.assertEquals(first, 10L, "Expected first value to be the start value");
    Assert.assertEquals(second, 11L, "Expected second value to follow");
    Assert.assertEquals(nexter.last(), 11L, "Expected last to return last handed out value");
  }

  @Test
  public void concurrentCallersGetDistinctValues() throws Exception {
    // GIVEN
    Nexter nexter = new Nexter();
    ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      List<Future<List<Long>>> futures = new ArrayList<>();

      // WHEN
      for (int i = 0; i < 4; i++)
        futures.add(executor.submit(() -> {
          List<Long> res = new ArrayList<>();
          for (int j = 0; j < 1000; j++)
            res.add(nexter.next());
          return res;
        }));

      List<Long> all = new ArrayList<>();
      for (Future<List<Long>> f : futures)
        all.addAll(f.get());
      Collections.sort(all);

      // THEN
      for (int i = 0; i < 4000; i++)
        Assert.assertEquals((long) all.get(i), (long) i, "Expected each value exactly once");
    } finally {
      executor.shutdownNow();
    }
  }
}
