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

import java.util.List;

/**
 * A {@link Translator} that can assign identifiers to many values at once.
 *
 * @author Bastian Gloeckle
 */
public interface BulkAddingTranslator extends Translator {
  /**
   * Assigns identifiers to all given values, in the order of the list: If the next free identifier of the frame is
   * <code>base</code>, the value at index <code>i</code> receives the identifier <code>base + i</code>. For a new frame
   * this means that value <code>i</code> receives identifier <code>i</code>.
   * 
   * <p>
   * Values are written in sub-batches to bound the size of each write.
   * 
   * @throws TranslatorException
   *           if any value already has an identifier in the frame, a value is contained twice in the list, or the
   *           values cannot be stored.
   */
  public void bulkAdd(String frame, List<?> values) throws TranslatorException;
}
