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

import java.io.IOException;
import java.io.StringReader;
import java.util.LinkedHashMap;
import java.util.Map;

import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Tests {@link CsvSource}.
 *
 * @author Bastian Gloeckle
 */
public class CsvSourceTest {
  @Test
  public void rowsBecomeMaps() throws IOException {
    try (CsvSource source = new CsvSource(new StringReader("name,color,size\nalice,red,3\nbob,,\"4,5\"\n"))) {
      Map<String, String> expected = new LinkedHashMap<>();
      expected.put("name", "alice");
      expected.put("color", "red");
      expected.put("size", "3");
      Assert.assertEquals(source.record(), expected);

      expected.clear();
      expected.put("name", "bob");
      expected.put("size", "4,5");
      Assert.assertEquals(source.record(), expected, "Expected empty cells to be left out");

      Assert.assertNull(source.record(), "Expected end of records");
    }
  }

  @Test
  public void headerOnly() throws IOException {
    try (CsvSource source = new CsvSource(new StringReader("a,b\n"))) {
      Assert.assertNull(source.record());
    }
  }
}
