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
 * Hands out disjoint ranges of column identifiers to workers which then can create identifiers without any further
 * coordination.
 * 
 * <p>
 * Implementations are thread safe.
 *
 * @author Bastian Gloeckle
 */
public interface RangeAllocator {
  /**
   * @return A range of identifiers that is not in use by any other caller. Ranges that were returned using
   *         {@link #returnRange(IdRange)} are handed out again before new ranges are created.
   */
  public IdRange get() throws IdAllocationException;

  /**
   * Give back the unused part of a range that was received by {@link #get()}. The caller must not use any identifiers
   * of that range after calling this method.
   * 
   * @throws IdAllocationException
   *           if the range is malformed, i.e. its start is after its end.
   */
  public void returnRange(IdRange range) throws IdAllocationException;
}
