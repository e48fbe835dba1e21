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
package org.bitingest.translator;

import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Tests {@link NexterFrameTranslator}.
 *
 * @author Bastian Gloeckle
 */
public class NexterFrameTranslatorTest {
  @Test
  public void newIdOnEachCall() {
    // GIVEN
    NexterFrameTranslator frameTranslator = new NexterFrameTranslator();

    // WHEN
    long first = frameTranslator.getId("a");
    long second = frameTranslator.getId("a");

    // THEN
    Assert.assertEquals(first, 0L, "Expected first identifier to be 0");
    Assert.assertEquals(second, 1L, "Expected a new identifier even for the same value");
  }

  @Test(expectedExceptions = TranslatorException.class)
  public void cannotTranslateBack() throws TranslatorException {
    new NexterFrameTranslator().get(0L);
  }
}
