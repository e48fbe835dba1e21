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
package org.bitingest.tool;

import java.util.Map;

import org.bitingest.tool.ingest.Ingest;
import org.bitingest.tool.proxy.Proxy;
import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Tests {@link Tool}.
 *
 * @author Bastian Gloeckle
 */
public class ToolTest {
  @Test
  public void functionsFound() throws Exception {
    // WHEN
    Map<String, ToolFunction> functions = Tool.findToolFunctions();

    // THEN
    Assert.assertTrue(functions.get(Ingest.FUNCTION_NAME) instanceof Ingest, "Expected ingest function");
    Assert.assertTrue(functions.get(Proxy.FUNCTION_NAME) instanceof Proxy, "Expected proxy function");
  }
}
