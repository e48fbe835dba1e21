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

import org.bitingest.id.Nexter;

/**
 * A {@link FrameTranslator} that hands out a new identifier on each call to {@link #getId(Object)} without remembering
 * the value.
 * 
 * <p>
 * This is useful to create column identifiers for records which do not have a natural key. Identifiers cannot be
 * translated back.
 *
 * @author Bastian Gloeckle
 */
public class NexterFrameTranslator implements FrameTranslator {
  private final Nexter nexter;

  public NexterFrameTranslator() {
    this(new Nexter());
  }

  public NexterFrameTranslator(Nexter nexter) {
    this.nexter = nexter;
  }

  /**
   * @throws TranslatorException
   *           always, as values are not stored.
   */
  @Override
  public Object get(long id) throws TranslatorException {
    throw new TranslatorException("Cannot translate identifier " + id + " back to a value, values are not stored.");
  }

  @Override
  public long getId(Object value) {
    return nexter.next();
  }
}
