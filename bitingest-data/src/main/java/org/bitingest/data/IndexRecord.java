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
import java.util.ArrayList;
import java.util.List;

/**
 * All index mutations derived from a single record: The column identifier of the record and the {@link Bit}s and
 * {@link Val}s to set for that column.
 *
 * @author Bastian Gloeckle
 */
public class IndexRecord {
  private final long column;
  private final List<Bit> bits = new ArrayList<>();
  private final List<Val> vals = new ArrayList<>();

  public IndexRecord(long column) {
    this.column = column;
  }

  public long getColumn() {
    return column;
  }

  public void addBit(String frame, long row) {
    bits.add(new Bit(frame, row));
  }

  public void addBit(String frame, long row, Instant timestamp) {
    bits.add(new Bit(frame, row, timestamp));
  }

  public void addVal(String frame, String field, long value) {
    vals.add(new Val(frame, field, value));
  }

  public List<Bit> getBits() {
    return bits;
  }

  public List<Val> getVals() {
    return vals;
  }

  @Override
  public String toString() {
    return "IndexRecord[column=" + column + ",bits=" + bits + ",vals=" + vals + "]";
  }
}
