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
import java.util.LinkedHashMap;
import java.util.Map;

import org.bitingest.ingest.Source;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;

/**
 * {@link Source} reading CSV data whose first row contains the column names. Each following row is provided as a
 * {@link Map} from column name to value, empty cells are left out.
 *
 * @author Bastian Gloeckle
 */
public class CsvSource implements Source, Closeable {
  private final CSVReader csvReader;
  private String[] header;

  public CsvSource(Reader reader) {
    this.csvReader = new CSVReaderBuilder(reader).build();
  }

  @Override
  public synchronized Object record() throws IOException {
    try {
      if (header == null) {
        header = csvReader.readNext();
        if (header == null)
          return null;
      }

      String[] row = csvReader.readNext();
      if (row == null)
        return null;

      Map<String, String> res = new LinkedHashMap<>();
      for (int i = 0; i < Math.min(header.length, row.length); i++)
        if (!row[i].isEmpty())
          res.put(header[i].trim(), row[i]);
      return res;
    } catch (CsvValidationException e) {
      throw new IOException("Invalid CSV in line " + csvReader.getLinesRead() + ": " + e.getMessage(), e);
    }
  }

  @Override
  public void close() throws IOException {
    csvReader.close();
  }
}
