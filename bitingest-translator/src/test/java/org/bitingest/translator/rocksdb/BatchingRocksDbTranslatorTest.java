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
package org.bitingest.translator.rocksdb;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;

import org.bitingest.translator.BulkAddingTranslator;
import org.bitingest.translator.TranslatorException;
import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Tests {@link BatchingRocksDbTranslator}.
 *
 * @author Bastian Gloeckle
 */
public class BatchingRocksDbTranslatorTest extends AbstractPersistentTranslatorTestSupport {
  @Override
  protected BulkAddingTranslator openTranslator(File dir, String... frames) throws TranslatorException {
    return new BatchingRocksDbTranslator(dir, 100, 400, 10, frames);
  }

  @Test
  public void predefinedFramesCreated() throws Exception {
    // GIVEN
    translator.close();

    // WHEN
    translator = openTranslator(dir, "a", "b");

    // THEN
    Assert.assertTrue(translator.getFrames().contains("a"), "Expected predefined frame");
    Assert.assertTrue(translator.getFrames().contains("b"), "Expected predefined frame");
  }

  @Test(expectedExceptions = TranslatorException.class)
  public void bulkAddAfterCloseFails() throws Exception {
    // GIVEN
    BulkAddingTranslator closed = openTranslator(new File(dir, "other"), "a");
    closed.close();

    // WHEN
    closed.bulkAdd("a", Arrays.asList("x"));

    // THEN: exception
  }

  @Test
  public void closeIdempotent() throws IOException {
    // WHEN
    translator.close();
    translator.close();

    // THEN
    translator = null;
  }
}
