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

/**
 * A {@link FrameTranslator} that delegates to a single frame of a {@link Translator}.
 *
 * @author Bastian Gloeckle
 */
public class SingleFrameTranslator implements FrameTranslator {
  private final Translator delegate;
  private final String frame;

  public SingleFrameTranslator(Translator delegate, String frame) {
    this.delegate = delegate;
    this.frame = frame;
  }

  @Override
  public Object get(long id) throws TranslatorException {
    return delegate.get(frame, id);
  }

  @Override
  public long getId(Object value) throws TranslatorException {
    return delegate.getId(frame, value);
  }

  public String getFrame() {
    return frame;
  }
}
