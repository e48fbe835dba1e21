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

/**
 * Default {@link RangeNexter} which fetches a new range from the {@link RangeAllocator} as soon as the current range is
 * used up.
 *
 * @author Bastian Gloeckle
 */
public class DefaultRangeNexter implements RangeNexter {
  private final RangeAllocator allocator;

  private IdRange range;

  public DefaultRangeNexter(RangeAllocator allocator) {
    this.allocator = allocator;
  }

  @Override
  public long next() throws IdAllocationException {
    if (range == null || range.isEmpty())
      range = allocator.get();

    if (range.getStart() > range.getEnd())
      throw new IllegalStateException("Range " + range + " is corrupted.");

    long res = range.getStart();
    range.setStart(res + 1);
    return res;
  }

  @Override
  public void returnRange() throws IdAllocationException {
    if (range == null)
      return;
    IdRange toReturn = range;
    range = null;
    allocator.returnRange(toReturn);
  }
}
