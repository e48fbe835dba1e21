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
package org.bitingest.ingest.parse;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import org.bitingest.data.Entity;
import org.bitingest.data.Literal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * {@link RecordParser} for generic nested data: {@link Map Maps}, {@link List Lists}, Jackson {@link JsonNode} trees and
 * JSON text.
 * 
 * <p>
 * Maps and JSON objects become {@link Entity entities}, lists and JSON arrays become lists and everything else becomes
 * a {@link Literal}. <code>null</code> values are skipped, or fail the record if the parser is strict.
 * 
 * <p>
 * If a subject path is set, the value at that path is removed from the entity and used as its subject.
 *
 * @author Bastian Gloeckle
 */
public class GenericParser implements RecordParser {
  private static final Logger logger = LoggerFactory.getLogger(GenericParser.class);

  private final ObjectMapper mapper = new ObjectMapper();

  private List<String> subjectPath = Collections.emptyList();
  private boolean strict = false;

  @Override
  public Entity parse(Object record) throws ParseException {
    if (record instanceof String)
      record = parseJson((String) record);
    else if (record instanceof byte[])
      record = parseJson(new String((byte[]) record, StandardCharsets.UTF_8));

    Object parsed = parseValue(record, "");
    if (!(parsed instanceof Entity))
      throw new ParseException("Record is not an object: " + record);
    Entity res = (Entity) parsed;

    if (!subjectPath.isEmpty())
      res.setSubject(extractSubject(res));
    return res;
  }

  private JsonNode parseJson(String json) throws ParseException {
    try {
      return mapper.readTree(json);
    } catch (IOException e) {
      throw new ParseException("Invalid JSON: " + e.getMessage(), e);
    }
  }

  private Object parseValue(Object value, String location) throws ParseException {
    if (value == null || (value instanceof JsonNode && ((JsonNode) value).isNull()))
      return null;

    if (value instanceof Map) {
      Entity res = new Entity();
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet())
        putProperty(res, String.valueOf(entry.getKey()), entry.getValue(), location);
      return res;
    }
    if (value instanceof Iterable && !(value instanceof JsonNode))
      return parseList(((Iterable<?>) value).iterator(), location);

    if (value instanceof JsonNode) {
      JsonNode node = (JsonNode) value;
      if (node.isObject()) {
        Entity res = new Entity();
        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext();) {
          Map.Entry<String, JsonNode> field = it.next();
          putProperty(res, field.getKey(), field.getValue(), location);
        }
        return res;
      }
      if (node.isArray())
        return parseList(node.elements(), location);
      if (node.isTextual())
        return Literal.of(node.textValue());
      if (node.isIntegralNumber() && node.canConvertToLong())
        return Literal.of(node.longValue());
      if (node.isNumber())
        return Literal.of(node.doubleValue());
      if (node.isBoolean())
        return Literal.of(node.booleanValue());
      if (node.isBinary()) {
        try {
          return Literal.of(node.binaryValue());
        } catch (IOException e) {
          throw new ParseException("Could not read binary value at '" + location + "'", e);
        }
      }
      throw new ParseException("Unsupported JSON value at '" + location + "': " + node);
    }

    try {
      return Literal.ofObject(value);
    } catch (IllegalArgumentException e) {
      throw new ParseException("Unsupported value at '" + location + "': " + e.getMessage(), e);
    }
  }

  private List<Object> parseList(Iterator<?> elements, String location) throws ParseException {
    List<Object> res = new ArrayList<>();
    while (elements.hasNext()) {
      Object element = parseValue(elements.next(), location);
      if (element == null) {
        nullValue(location);
        continue;
      }
      res.add(element);
    }
    return res;
  }

  private void putProperty(Entity entity, String name, Object rawValue, String location) throws ParseException {
    String propertyLocation = location.isEmpty() ? name : location + "." + name;
    Object value = parseValue(rawValue, propertyLocation);
    if (value == null) {
      nullValue(propertyLocation);
      return;
    }
    entity.put(name, value);
  }

  private void nullValue(String location) throws ParseException {
    if (strict)
      throw new ParseException("Null value at '" + location + "'");
    logger.trace("Skipping null value at '{}'", location);
  }

  private String extractSubject(Entity entity) throws ParseException {
    Entity parent = entity;
    for (String element : subjectPath.subList(0, subjectPath.size() - 1)) {
      Object child = parent.get(element);
      if (!(child instanceof Entity))
        throw new ParseException("Subject path " + subjectPath + " not found in record.");
      parent = (Entity) child;
    }
    Object subject = parent.remove(subjectPath.get(subjectPath.size() - 1));
    if (!(subject instanceof Literal))
      throw new ParseException("Subject path " + subjectPath + " does not denote a single value in record.");
    Literal literal = (Literal) subject;
    if (literal.getType() == Literal.Type.BYTES)
      return new String((byte[]) literal.getValue(), StandardCharsets.UTF_8);
    return String.valueOf(literal.getValue());
  }

  /**
   * Use the value at the given path of property names as subject of the parsed entities.
   */
  public void setSubjectPath(String... subjectPath) {
    this.subjectPath = Arrays.asList(subjectPath);
  }

  public void setStrict(boolean strict) {
    this.strict = strict;
  }
}
