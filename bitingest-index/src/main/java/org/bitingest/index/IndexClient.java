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
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Client of the bitmap index server that data is imported into.
 *
 * @author Bastian Gloeckle
 */
public interface IndexClient extends Closeable {
  /**
   * Creates the index if it does not exist.
   */
  public void ensureIndex() throws IndexClientException;

  /**
   * Creates the frame if it does not exist.
   */
  public void ensureFrame(String frame) throws IndexClientException;

  /**
   * Creates the range encoded field in the given frame if it does not exist, creating the frame, too, if needed.
   */
  public void ensureField(String frame, String field, long min, long max) throws IndexClientException;

  /**
   * Sets all given bits in the frame.
   */
  public void importBits(String frame, List<BitMutation> bits) throws IndexClientException;

  /**
   * Sets the values of the given field in the frame.
   */
  public void importValues(String frame, String field, List<ValueMutation> values) throws IndexClientException;

  /**
   * Executes a query and returns the parsed response.
   */
  public JsonNode query(String query) throws IndexClientException;
}
