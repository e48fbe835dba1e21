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

import java.util.HashSet;
import java.util.Set;

import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Tests {@link DefaultRangeNexter}.
 *
 * @author Bastian Gloeckle
 */
public class DefaultRangeNexterTest {
  private static final long WIDTH = 1L << 16;

  @Test
  public void strictlyIncreasingAcrossRanges() throws IdAllocationException {
    // GIVEN
    DefaultRangeNexter nexter = new DefaultRangeNexter(new LocalRangeAllocator(WIDTH));

    // WHEN
    long last = -1;
    for (int i = 0; i < WIDTH * 2 + 10; i++) {
      long next = nexter.next();

      // THEN
      Assert.assertTrue(next > last, "Expected identifiers to increase strictly, but got " + next + " after " + last);
      last = next;
    }
    Assert.assertEquals(last, WIDTH * 2 + 9, "Expected identifiers to be dense");
  }

  @Test
  public void returnedRemainderUsedByOtherNexter() throws IdAllocationException {
    // GIVEN
    LocalRangeAllocator allocator = new LocalRangeAllocator(WIDTH);
    DefaultRangeNexter first = new DefaultRangeNexter(allocator);
    DefaultRangeNexter second = new DefaultRangeNexter(allocator);
    for (int i = 0; i < 10; i++)
      first.next();

    // WHEN
    first.returnRange();
    long next = second.next();

    // THEN
    Assert.assertEquals(next, 10L, "Expected second nexter to continue where the first stopped");
  }

  @Test
  public void concurrentNextersDisjoint() throws IdAllocationException {
    // GIVEN
    LocalRangeAllocator allocator = new LocalRangeAllocator(WIDTH);
    DefaultRangeNexter first = new DefaultRangeNexter(allocator);
    DefaultRangeNexter second = new DefaultRangeNexter(allocator);
    Set<Long> seen = new HashSet<>();

    // WHEN
    for (int i = 0; i < 1000; i++) {
      // THEN
      Assert.assertTrue(seen.add(first.next()), "Expected no duplicate identifier");
      Assert.assertTrue(seen.add(second.next()), "Expected no duplicate identifier");
    }
  }
}
