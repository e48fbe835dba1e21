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

import java.io.Closeable;
import java.io.IOException;
import java.time.Instant;

/**
 * Accepts index mutations and writes them to the index eventually.
 * 
 * <p>
 * All add methods are safe to be called concurrently and may block if the mutations cannot be written fast enough.
 *
 * @author Bastian Gloeckle
 */
public interface Indexer extends Closeable {
  public void addBit(String frame, long column, long row);

  public void addBitTimestamp(String frame, long column, long row, Instant timestamp);

  public void addValue(String frame, String field, long column, long value);

  /**
   * Writes all mutations that were added and waits until that is done. No mutations may be added afterwards.
   */
  @Override
  public void close() throws IOException;
}
