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

import java.io.Closeable;
import java.io.IOException;
import java.util.Set;

/**
 * Translates values to dense identifiers and back, independently for each frame.
 * 
 * <p>
 * Within a frame, the n-th distinct value that is translated receives the identifier n-1. Once a value has an
 * identifier, that mapping never changes. All methods are safe to be called concurrently. Frames are created
 * implicitly on the first call to {@link #getId(String, Object)}.
 * 
 * <p>
 * Supported values are those supported by {@link org.bitingest.data.ValueCodec}. Two values are equal if their
 * encodings are equal.
 *
 * @author Bastian Gloeckle
 */
public interface Translator extends Closeable {
  /**
   * Returns the value that was assigned the given identifier in the given frame.
   * 
   * @throws UnknownFrameException
   *           if the frame does not exist.
   * @throws TranslatorException
   *           if the identifier was never assigned or the value cannot be read.
   */
  public Object get(String frame, long id) throws TranslatorException, UnknownFrameException;

  /**
   * Returns the identifier of the given value in the given frame, assigning the next free identifier if the value has
   * none yet. Creates the frame if it does not exist.
   * 
   * @throws TranslatorException
   *           if the mapping cannot be read or stored.
   */
  public long getId(String frame, Object value) throws TranslatorException;

  /**
   * @return The names of all frames known to this translator.
   */
  public Set<String> getFrames();

  /**
   * @return A {@link FrameTranslator} working on a single frame of this translator.
   */
  default FrameTranslator forFrame(String frame) {
    return new SingleFrameTranslator(this, frame);
  }

  /**
   * Releases all resources. The translator must not be used afterwards.
   */
  @Override
  public void close() throws IOException;
}
