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

import java.util.Objects;

/**
 * A numeric value of a range encoded field in a frame.
 *
 * @author Bastian Gloeckle
 */
public class Val {
  private final String frame;
  private final String field;
  private final long value;

  public Val(String frame, String field, long value) {
    this.frame = frame;
    this.field = field;
    this.value = value;
  }

  public String getFrame() {
    return frame;
  }

  public String getField() {
    return field;
  }

  public long getValue() {
    return value;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Val))
      return false;
    Val other = (Val) obj;
    return frame.equals(other.frame) && field.equals(other.field) && value == other.value;
  }

  @Override
  public int hashCode() {
    return Objects.hash(frame, field, value);
  }

  @Override
  public String toString() {
    return "Val[frame=" + frame + ",field=" + field + ",value=" + value + "]";
  }
}
