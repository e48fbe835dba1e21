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

import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Tests {@link LocalRangeAllocator}.
 *
 * @author Bastian Gloeckle
 */
public class LocalRangeAllocatorTest {
  private static final long WIDTH = 1L << 16;

  @Test
  public void newRangesDisjointAndAligned() throws IdAllocationException {
    // GIVEN
    LocalRangeAllocator allocator = new LocalRangeAllocator(WIDTH);

    // WHEN
    IdRange first = allocator.get();
    IdRange second = allocator.get();

    // THEN
    Assert.assertEquals(first.getStart(), 0L, "Expected first range to start at 0");
    Assert.assertEquals(first.getEnd(), WIDTH, "Expected first range to end at shard width");
    Assert.assertEquals(second.getStart(), WIDTH, "Expected second range to start after first");
    Assert.assertEquals(second.getEnd(), 2 * WIDTH, "Expected second range to span one shard");
  }

  @Test
  public void returnedRangeReissuedFirst() throws IdAllocationException {
    // GIVEN
    LocalRangeAllocator allocator = new LocalRangeAllocator(WIDTH);
    IdRange first = allocator.get();
    allocator.get();
    first.setStart(100);

    // WHEN
    allocator.returnRange(first);
    IdRange next = allocator.get();

    // THEN
    Assert.assertEquals(next.getStart(), 100L, "Expected returned range to be reissued");
    Assert.assertEquals(next.getEnd(), WIDTH, "Expected returned range to be reissued");
    Assert.assertEquals(allocator.get().getStart(), 2 * WIDTH, "Expected new range after free list is empty");
  }

  @Test
  public void returnedRangesReissuedLastInFirstOut() throws IdAllocationException {
    // GIVEN
    LocalRangeAllocator allocator = new LocalRangeAllocator(WIDTH);
    IdRange first = allocator.get();
    IdRange second = allocator.get();

    // WHEN
    allocator.returnRange(first);
    allocator.returnRange(second);

    // THEN
    Assert.assertEquals(allocator.get().getStart(), WIDTH, "Expected range returned last to be reissued first");
    Assert.assertEquals(allocator.get().getStart(), 0L, "Expected range returned first to be reissued second");
  }

  @Test
  public void fullyConsumedRangeIgnored() throws IdAllocationException {
    // GIVEN
    LocalRangeAllocator allocator = new LocalRangeAllocator(WIDTH);
    IdRange first = allocator.get();
    first.setStart(first.getEnd());

    // WHEN
    allocator.returnRange(first);

    // THEN
    Assert.assertEquals(allocator.get().getStart(), WIDTH, "Expected empty range not to be reissued");
  }

  @Test(expectedExceptions = IdAllocationException.class)
  public void malformedRangeRejected() throws IdAllocationException {
    new LocalRangeAllocator(WIDTH).returnRange(new IdRange(10, 5));
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void shardWidthNotPowerOfTwoRejected() {
    new LocalRangeAllocator(WIDTH + 1);
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void shardWidthTooSmallRejected() {
    new LocalRangeAllocator(1L << 15);
  }
}
