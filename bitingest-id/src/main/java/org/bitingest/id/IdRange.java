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
 * A half-open range <code>[start, end)</code> of column identifiers.
 * 
 * <p>
 * Not thread safe, a range is owned by one worker at a time.
 *
 * @author Bastian Gloeckle
 */
public class IdRange {
  private long start;
  private long end;

  public IdRange(long start, long end) {
    this.start = start;
    this.end = end;
  }

  public long getStart() {
    return start;
  }

  public void setStart(long start) {
    this.start = start;
  }

  public long getEnd() {
    return end;
  }

  public void setEnd(long end) {
    this.end = end;
  }

  /**
   * @return <code>true</code> if there are no identifiers left in this range.
   */
  public boolean isEmpty() {
    return start >= end;
  }

  @Override
  public String toString() {
    return "[" + start + "," + end + ")";
  }
}
