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
package org.bitingest.ingest.source;

import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;

import org.bitingest.ingest.Source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * {@link Source} reading a stream of JSON values, each being one record. The values may be separated by whitespace or
 * newlines. Records are provided as {@link JsonNode}.
 *
 * @author Bastian Gloeckle
 */
public class JsonSource implements Source, Closeable {
  private final Reader reader;
  private final MappingIterator<JsonNode> iterator;

  public JsonSource(Reader reader) throws IOException {
    this.reader = reader;
    this.iterator = new ObjectMapper().readerFor(JsonNode.class).readValues(reader);
  }

  @Override
  public synchronized Object record() throws IOException {
    if (!iterator.hasNextValue())
      return null;
    return iterator.nextValue();
  }

  @Override
  public void close() throws IOException {
    try {
      iterator.close();
    } finally {
      reader.close();
    }
  }
}
