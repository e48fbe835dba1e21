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

import java.util.Objects;

/**
 * Sets the value of a column in a range encoded field.
 *
 * @author Bastian Gloeckle
 */
public class ValueMutation {
  private final long column;
  private final long value;

  public ValueMutation(long column, long value) {
    this.column = column;
    this.value = value;
  }

  public long getColumn() {
    return column;
  }

  public long getValue() {
    return value;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ValueMutation))
      return false;
    ValueMutation other = (ValueMutation) obj;
    return column == other.column && value == other.value;
  }

  @Override
  public int hashCode() {
    return Objects.hash(column, value);
  }

  @Override
  public String toString() {
    return "ValueMutation[column=" + column + ",value=" + value + "]";
  }
}
