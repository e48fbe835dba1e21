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
package org.bitingest.ingest;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters of an {@link Ingester} run.
 *
 * @author Bastian Gloeckle
 */
public class IngestStats {
  private final AtomicLong records = new AtomicLong();
  private final AtomicLong parseErrors = new AtomicLong();
  private final AtomicLong transformErrors = new AtomicLong();
  private final AtomicLong mapErrors = new AtomicLong();
  private final AtomicLong bits = new AtomicLong();
  private final AtomicLong values = new AtomicLong();

  /* package */ void record() {
    records.incrementAndGet();
  }

  /* package */ void parseError() {
    parseErrors.incrementAndGet();
  }

  /* package */ void transformError() {
    transformErrors.incrementAndGet();
  }

  /* package */ void mapError() {
    mapErrors.incrementAndGet();
  }

  /* package */ void bits(int count) {
    bits.addAndGet(count);
  }

  /* package */ void values(int count) {
    values.addAndGet(count);
  }

  /**
   * @return Number of records read from the source.
   */
  public long getRecords() {
    return records.get();
  }

  public long getParseErrors() {
    return parseErrors.get();
  }

  public long getTransformErrors() {
    return transformErrors.get();
  }

  public long getMapErrors() {
    return mapErrors.get();
  }

  public long getBits() {
    return bits.get();
  }

  public long getValues() {
    return values.get();
  }

  @Override
  public String toString() {
    return "records=" + getRecords() + ", parseErrors=" + getParseErrors() + ", transformErrors="
        + getTransformErrors() + ", mapErrors=" + getMapErrors() + ", bits=" + getBits() + ", values=" + getValues();
  }
}
