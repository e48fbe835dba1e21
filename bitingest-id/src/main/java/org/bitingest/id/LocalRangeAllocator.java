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

import java.util.ArrayDeque;
import java.util.Deque;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link RangeAllocator} that is valid inside a single process.
 * 
 * <p>
 * New ranges are aligned to the shard width. Returned ranges are kept on a stack and handed out again before new ranges
 * are created.
 *
 * @author Bastian Gloeckle
 */
public class LocalRangeAllocator implements RangeAllocator {
  private static final Logger logger = LoggerFactory.getLogger(LocalRangeAllocator.class);

  public static final long MIN_SHARD_WIDTH = 1L << 16;

  private final long shardWidth;

  private final Object sync = new Object();

  private long next = 0L;

  private final Deque<IdRange> returned = new ArrayDeque<>();

  /**
   * @param shardWidth
   *          Number of identifiers in each range. Must be a power of two and at least {@link #MIN_SHARD_WIDTH}.
   * @throws IllegalArgumentException
   *           if the shard width is invalid.
   */
  public LocalRangeAllocator(long shardWidth) throws IllegalArgumentException {
    if (shardWidth < MIN_SHARD_WIDTH || Long.bitCount(shardWidth) != 1)
      throw new IllegalArgumentException(
          "Shard width must be a power of two and at least " + MIN_SHARD_WIDTH + ", but was " + shardWidth);
    this.shardWidth = shardWidth;
  }

  @Override
  public IdRange get() throws IdAllocationException {
    synchronized (sync) {
      if (!returned.isEmpty()) {
        IdRange res = returned.pop();
        logger.trace("Handing out returned range {}", res);
        return res;
      }

      if (next > Long.MAX_VALUE - shardWidth)
        throw new IdAllocationException("Identifier space exhausted.");

      IdRange res = new IdRange(next, next + shardWidth);
      next += shardWidth;
      logger.trace("Handing out new range {}", res);
      return res;
    }
  }

  @Override
  public void returnRange(IdRange range) throws IdAllocationException {
    if (range.getStart() > range.getEnd())
      throw new IdAllocationException("Cannot return malformed range " + range + ": start is after end.");

    if (range.getStart() == range.getEnd())
      return;

    synchronized (sync) {
      returned.push(new IdRange(range.getStart(), range.getEnd()));
    }
  }

  public long getShardWidth() {
    return shardWidth;
  }
}
