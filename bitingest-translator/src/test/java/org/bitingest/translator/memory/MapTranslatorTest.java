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
package org.bitingest.translator.memory;

import org.bitingest.translator.AbstractTranslatorTestSupport;
import org.bitingest.translator.Translator;
import org.bitingest.translator.TranslatorException;
import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Tests {@link MapTranslator}.
 *
 * @author Bastian Gloeckle
 */
public class MapTranslatorTest extends AbstractTranslatorTestSupport {
  @Override
  protected Translator createTranslator() {
    return new MapTranslator("predefined");
  }

  @Test
  public void returnsFirstTranslatedInstance() throws TranslatorException {
    // GIVEN
    byte[] value = new byte[] { 5 };
    long id = translator.getId("bytes", value);

    // WHEN
    Object res = translator.get("bytes", id);

    // THEN
    Assert.assertSame(res, value, "Expected the instance that was translated first");
  }

  @Test(expectedExceptions = TranslatorException.class)
  public void predefinedFrameKnown() throws TranslatorException {
    // WHEN
    translator.get("predefined", 0L);

    // THEN: no UnknownFrameException, but identifier is not assigned.
  }
}
