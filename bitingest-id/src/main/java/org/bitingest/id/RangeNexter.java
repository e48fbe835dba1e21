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
 * Hands out single column identifiers which are taken from ranges of a {@link RangeAllocator}.
 * 
 * <p>
 * Instances are not thread safe, each worker should use its own instance.
 *
 * @author Bastian Gloeckle
 */
public interface RangeNexter {
  /**
   * @return The next identifier.
   */
  public long next() throws IdAllocationException;

  /**
   * Give back the unused identifiers of the current range to the allocator. A subsequent call to {@link #next()} will
   * fetch a new range.
   */
  public void returnRange() throws IdAllocationException;
}
