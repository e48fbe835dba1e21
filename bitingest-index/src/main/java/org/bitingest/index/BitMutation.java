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
package org.bitingest.index;

import java.time.Instant;
import java.util.Objects;

/**
 * Sets the bit of a column in a row.
 *
 * @author Bastian Gloeckle
 */
public class BitMutation {
  private final long row;
  private final long column;
  private final Instant timestamp;

  public BitMutation(long row, long column, Instant timestamp) {
    this.row = row;
    this.column = column;
    this.timestamp = timestamp;
  }

  public long getRow() {
    return row;
  }

  public long getColumn() {
    return column;
  }

  /**
   * @return Timestamp or <code>null</code>.
   */
  public Instant getTimestamp() {
    return timestamp;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof BitMutation))
      return false;
    BitMutation other = (BitMutation) obj;
    return row == other.row && column == other.column && Objects.equals(timestamp, other.timestamp);
  }

  @Override
  public int hashCode() {
    return Objects.hash(row, column, timestamp);
  }

  @Override
  public String toString() {
    return "BitMutation[row=" + row + ",column=" + column + ((timestamp != null) ? ",timestamp=" + timestamp : "")
        + "]";
  }
}
