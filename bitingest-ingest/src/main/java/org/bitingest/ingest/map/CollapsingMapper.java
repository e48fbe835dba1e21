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
package org.bitingest.ingest.map;

import java.util.ArrayList;
import java.util.List;

import org.bitingest.data.Entity;
import org.bitingest.data.IndexRecord;
import org.bitingest.data.Literal;
import org.bitingest.id.DefaultRangeNexter;
import org.bitingest.id.IdAllocationException;
import org.bitingest.id.Nexter;
import org.bitingest.id.RangeAllocator;
import org.bitingest.id.RangeNexter;
import org.bitingest.translator.FrameTranslator;
import org.bitingest.translator.Translator;
import org.bitingest.translator.TranslatorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link RecordMapper} that collapses the nested structure of an entity into frames using a {@link Framer}.
 * 
 * <p>
 * Each path from the entity to a value is mapped like this:
 * 
 * <ul>
 * <li>Strings, timestamps and byte arrays set a bit in the frame of the path, in the row the value is translated to.
 * <li>Numbers set the value of the field of the path. Fields without frame go into frame {@link #DEFAULT_FRAME}.
 * <li><code>true</code> sets a bit in the frame of the path without its last element, in the row the last element is
 * translated to. <code>false</code> is not indexed.
 * <li>Each element of a list is mapped as if it was the only value at the path.
 * </ul>
 * 
 * <p>
 * The column of an entity is the translated subject if a column translator is available. Otherwise a new column is
 * created for each entity, either from ranges of a {@link RangeAllocator} or from a single counter.
 *
 * @author Bastian Gloeckle
 */
public class CollapsingMapper implements RecordMapper {
  private static final Logger logger = LoggerFactory.getLogger(CollapsingMapper.class);

  public static final String DEFAULT_FRAME = "default";

  private final Translator translator;
  private final Framer framer;

  private FrameTranslator columnTranslator;
  private RangeAllocator columnAllocator;
  private ThreadLocal<RangeNexter> rangeNexters;
  private Nexter nexter;

  /**
   * Columns are created using a single counter starting at 0.
   */
  public CollapsingMapper(Translator translator, Framer framer) {
    this.translator = translator;
    this.framer = framer;
    this.nexter = new Nexter();
  }

  /**
   * Columns are the subjects of the entities translated by the given translator.
   */
  public CollapsingMapper(Translator translator, Framer framer, FrameTranslator columnTranslator) {
    this.translator = translator;
    this.framer = framer;
    this.columnTranslator = columnTranslator;
  }

  /**
   * Columns are created from ranges of the given allocator, each worker thread using its own ranges.
   */
  public CollapsingMapper(Translator translator, Framer framer, RangeAllocator columnAllocator) {
    this.translator = translator;
    this.framer = framer;
    this.columnAllocator = columnAllocator;
    this.rangeNexters = ThreadLocal.withInitial(() -> new DefaultRangeNexter(columnAllocator));
  }

  @Override
  public IndexRecord map(Entity entity) throws MapException {
    IndexRecord res = new IndexRecord(column(entity));
    mapEntity(res, new ArrayList<>(), entity);
    return res;
  }

  private long column(Entity entity) throws MapException {
    if (columnTranslator != null) {
      if (entity.getSubject() == null)
        throw new MapException("Entity has no subject: " + entity);
      try {
        return columnTranslator.getId(entity.getSubject());
      } catch (TranslatorException e) {
        throw new MapException("Could not translate subject " + entity.getSubject() + ": " + e.getMessage(), e);
      }
    }
    if (columnAllocator != null) {
      try {
        return rangeNexters.get().next();
      } catch (IdAllocationException e) {
        throw new MapException("Could not allocate column: " + e.getMessage(), e);
      }
    }
    return nexter.next();
  }

  private void mapEntity(IndexRecord record, List<String> path, Entity entity) throws MapException {
    for (String property : entity.getProperties().keySet()) {
      path.add(property);
      mapValue(record, path, entity.get(property));
      path.remove(path.size() - 1);
    }
  }

  private void mapValue(IndexRecord record, List<String> path, Object value) throws MapException {
    if (value instanceof Entity)
      mapEntity(record, path, (Entity) value);
    else if (value instanceof List) {
      for (Object element : (List<?>) value)
        mapValue(record, path, element);
    } else
      mapLiteral(record, path, (Literal) value);
  }

  private void mapLiteral(IndexRecord record, List<String> path, Literal literal) throws MapException {
    switch (literal.getType()) {
    case STRING:
    case BYTES:
      setBit(record, framer.frame(path), literal.getValue());
      break;
    case TIME:
      setBit(record, framer.frame(path), literal.getValue().toString());
      break;
    case LONG:
    case DOUBLE:
      FrameAndField frameAndField = framer.field(path);
      if (frameAndField == null)
        return;
      String frame = frameAndField.getFrame().isEmpty() ? DEFAULT_FRAME : frameAndField.getFrame();
      record.addVal(frame, frameAndField.getField(), literal.longValue());
      break;
    case BOOLEAN:
      if (!(Boolean) literal.getValue())
        return;
      String boolFrame = (path.size() == 1) ? DEFAULT_FRAME : framer.frame(path.subList(0, path.size() - 1));
      setBit(record, boolFrame, path.get(path.size() - 1));
      break;
    }
  }

  private void setBit(IndexRecord record, String frame, Object value) throws MapException {
    if (frame == null || frame.isEmpty())
      return;
    try {
      record.addBit(frame, translator.getId(frame, value));
    } catch (TranslatorException e) {
      throw new MapException("Could not translate value of frame " + frame + ": " + e.getMessage(), e);
    } catch (IllegalArgumentException e) {
      throw new MapException("Invalid frame " + frame + ": " + e.getMessage(), e);
    }
  }

  @Override
  public void workerFinished() {
    if (rangeNexters == null)
      return;
    try {
      rangeNexters.get().returnRange();
    } catch (IdAllocationException e) {
      logger.warn("Could not return unused columns to allocator", e);
    } finally {
      rangeNexters.remove();
    }
  }
}
