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

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.bitingest.translator.Translator;
import org.bitingest.translator.TranslatorException;
import org.bitingest.translator.UnknownFrameException;

/**
 * In-memory {@link Translator}, all translations are lost when the process ends.
 *
 * @author Bastian Gloeckle
 */
public class MapTranslator implements Translator {
  private final Map<String, MapFrameTranslator> frames = new ConcurrentHashMap<>();

  /**
   * @param frames
   *          Frames to create right away.
   */
  public MapTranslator(String... frames) {
    for (String frame : frames)
      getFrameTranslator(frame);
  }

  @Override
  public Object get(String frame, long id) throws TranslatorException, UnknownFrameException {
    MapFrameTranslator frameTranslator = frames.get(frame);
    if (frameTranslator == null)
      throw new UnknownFrameException(frame);
    return frameTranslator.get(id);
  }

  @Override
  public long getId(String frame, Object value) {
    return getFrameTranslator(frame).getId(value);
  }

  /**
   * @return The translator of the given frame, which is created if it does not exist.
   */
  public MapFrameTranslator getFrameTranslator(String frame) {
    return frames.computeIfAbsent(frame, f -> new MapFrameTranslator());
  }

  @Override
  public Set<String> getFrames() {
    return Collections.unmodifiableSet(frames.keySet());
  }

  @Override
  public void close() {
    frames.clear();
  }
}
