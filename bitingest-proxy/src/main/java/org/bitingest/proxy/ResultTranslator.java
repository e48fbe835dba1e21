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
package org.bitingest.proxy;

import java.nio.charset.StandardCharsets;
import java.util.List;

import org.bitingest.translator.FrameTranslator;
import org.bitingest.translator.Translator;
import org.bitingest.translator.TranslatorException;
import org.bitingest.translator.UnknownFrameException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Replaces the row and column identifiers in query responses of the index server with the values they were translated
 * from.
 * 
 * <p>
 * The response is expected to be a JSON object with a "results" array holding one result per top-level call of the
 * query. Results of calls without frame are left untouched, as are counts and other scalar results.
 *
 * @author Bastian Gloeckle
 */
public class ResultTranslator {
  private static final String RESULTS = "results";
  private static final String KEY = "key";
  private static final String ID = "id";
  private static final String COUNT = "count";
  private static final String COLUMNS = "columns";

  private final Translator translator;
  private final FrameTranslator columnTranslator;

  /**
   * @param columnTranslator
   *          Translator of column identifiers, may be <code>null</code>.
   */
  public ResultTranslator(Translator translator, FrameTranslator columnTranslator) {
    this.translator = translator;
    this.columnTranslator = columnTranslator;
  }

  /**
   * Translates the response in place.
   * 
   * @param frames
   *          The frame of each top-level call of the query, empty for calls without frame.
   * @return The translated response.
   * @throws TranslatorException
   *           if an identifier cannot be translated.
   * @throws UnknownFrameException
   *           if a frame is not known to the translator.
   */
  public JsonNode translate(JsonNode response, List<String> frames) throws TranslatorException, UnknownFrameException {
    JsonNode results = response.get(RESULTS);
    if (results == null || !results.isArray())
      return response;

    ArrayNode resultArray = (ArrayNode) results;
    for (int i = 0; i < resultArray.size() && i < frames.size(); i++) {
      String frame = frames.get(i);
      if (frame.isEmpty())
        continue;
      resultArray.set(i, translateResult(resultArray.get(i), frame));
    }
    return response;
  }

  private JsonNode translateResult(JsonNode result, String frame) throws TranslatorException {
    if (result.isArray()) {
      for (JsonNode element : result)
        if (element.isObject() && element.has(COUNT))
          translateIdField((ObjectNode) element, frame);
      return result;
    }

    if (result.isObject()) {
      ObjectNode object = (ObjectNode) result;
      JsonNode columns = object.get(COLUMNS);
      if (columns != null) {
        if (columnTranslator != null && columns.isArray()) {
          ArrayNode translated = object.putArray(COLUMNS);
          for (JsonNode column : columns)
            translated.add(column.canConvertToLong() ? toJson(columnTranslator.get(column.asLong())) : column);
        }
      } else
        translateIdField(object, frame);
    }
    return result;
  }

  private void translateIdField(ObjectNode object, String frame) throws TranslatorException {
    for (String field : new String[] { KEY, ID }) {
      JsonNode id = object.get(field);
      if (id != null && id.isIntegralNumber()) {
        object.set(field, toJson(translator.get(frame, id.asLong())));
        return;
      }
    }
  }

  /* package */ static JsonNode toJson(Object value) {
    JsonNodeFactory factory = JsonNodeFactory.instance;
    if (value instanceof byte[])
      return factory.textNode(new String((byte[]) value, StandardCharsets.UTF_8));
    if (value instanceof Long || value instanceof Integer)
      return factory.numberNode(((Number) value).longValue());
    if (value instanceof Double)
      return factory.numberNode((Double) value);
    if (value instanceof Boolean)
      return factory.booleanNode((Boolean) value);
    return factory.textNode(String.valueOf(value));
  }
}
