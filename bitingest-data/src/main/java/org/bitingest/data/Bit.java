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
package org.bitingest.data;

import java.time.Instant;
import java.util.Objects;

/**
 * A set bit in a row of a frame: The column the bit is set for is held by the surrounding {@link IndexRecord}.
 *
 * @author Bastian Gloeckle
 */
public class Bit {
  private final String frame;
  private final long row;
  private final Instant timestamp;

  public Bit(String frame, long row) {
    this(frame, row, null);
  }

  public Bit(String frame, long row, Instant timestamp) {
    this.frame = frame;
    this.row = row;
    this.timestamp = timestamp;
  }

  public String getFrame() {
    return frame;
  }

  public long getRow() {
    return row;
  }

  /**
   * @return Timestamp of the bit or <code>null</code>.
   */
  public Instant getTimestamp() {
    return timestamp;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Bit))
      return false;
    Bit other = (Bit) obj;
    return frame.equals(other.frame) && row == other.row && Objects.equals(timestamp, other.timestamp);
  }

  @Override
  public int hashCode() {
    return Objects.hash(frame, row, timestamp);
  }

  @Override
  public String toString() {
    return "Bit[frame=" + frame + ",row=" + row + ((timestamp != null) ? ",timestamp=" + timestamp : "") + "]";
  }
}
