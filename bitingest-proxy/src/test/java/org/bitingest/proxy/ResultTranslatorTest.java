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

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;

import org.bitingest.translator.FrameTranslator;
import org.bitingest.translator.Translator;
import org.bitingest.translator.TranslatorException;
import org.bitingest.translator.UnknownFrameException;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Tests {@link ResultTranslator}.
 *
 * @author Bastian Gloeckle
 */
public class ResultTranslatorTest {
  private ObjectMapper mapper = new ObjectMapper();
  private Translator translator;
  private FrameTranslator columnTranslator;

  @BeforeMethod
  public void before() throws TranslatorException {
    translator = mock(Translator.class);
    when(translator.get("color", 3)).thenReturn("red");
    when(translator.get("color", 7)).thenReturn("blue".getBytes(StandardCharsets.UTF_8));
    when(translator.get("color", 99)).thenThrow(new TranslatorException("No value for id 99"));
    when(translator.get("nope", 1)).thenThrow(new UnknownFrameException("nope"));
    columnTranslator = mock(FrameTranslator.class);
    when(columnTranslator.get(5)).thenReturn("alice");
    when(columnTranslator.get(6)).thenReturn("bob");
  }

  private JsonNode json(String json) throws Exception {
    return mapper.readTree(json);
  }

  @Test
  public void topNKeysTranslated() throws Exception {
    // GIVEN
    JsonNode response = json("{\"results\":[[{\"key\":3,\"count\":10},{\"key\":7,\"count\":4}]]}");

    // WHEN
    JsonNode res = new ResultTranslator(translator, null).translate(response, Collections.singletonList("color"));

    // THEN
    Assert.assertEquals(res, json("{\"results\":[[{\"key\":\"red\",\"count\":10},{\"key\":\"blue\",\"count\":4}]]}"));
  }

  @Test
  public void topNIdsTranslated() throws Exception {
    // GIVEN
    JsonNode response = json("{\"results\":[[{\"id\":3,\"count\":10}]]}");

    // WHEN
    JsonNode res = new ResultTranslator(translator, null).translate(response, Collections.singletonList("color"));

    // THEN
    Assert.assertEquals(res, json("{\"results\":[[{\"id\":\"red\",\"count\":10}]]}"));
  }

  @Test
  public void resultsWithoutFrameUntouched() throws Exception {
    // GIVEN
    JsonNode response = json("{\"results\":[12, [{\"key\":3,\"count\":1}], true]}");

    // WHEN
    JsonNode res =
        new ResultTranslator(translator, null).translate(response.deepCopy(), Arrays.asList("color", "", "color"));

    // THEN
    Assert.assertEquals(res, response, "Expected count, frameless and boolean results to be left untouched");
  }

  @Test
  public void columnsTranslated() throws Exception {
    // GIVEN
    JsonNode response = json("{\"results\":[{\"attrs\":{},\"columns\":[5,6]}]}");

    // WHEN
    JsonNode res =
        new ResultTranslator(translator, columnTranslator).translate(response, Collections.singletonList("color"));

    // THEN
    Assert.assertEquals(res, json("{\"results\":[{\"attrs\":{},\"columns\":[\"alice\",\"bob\"]}]}"));
  }

  @Test
  public void columnsUntouchedWithoutColumnTranslator() throws Exception {
    // GIVEN
    JsonNode response = json("{\"results\":[{\"attrs\":{},\"columns\":[5,6]}]}");

    // WHEN
    JsonNode res = new ResultTranslator(translator, null).translate(response.deepCopy(),
        Collections.singletonList("color"));

    // THEN
    Assert.assertEquals(res, response);
  }

  @Test(expectedExceptions = TranslatorException.class)
  public void unknownIdFails() throws Exception {
    new ResultTranslator(translator, null).translate(json("{\"results\":[[{\"key\":99,\"count\":1}]]}"),
        Collections.singletonList("color"));
  }

  @Test(expectedExceptions = UnknownFrameException.class)
  public void unknownFrameFails() throws Exception {
    new ResultTranslator(translator, null).translate(json("{\"results\":[{\"id\":1}]}"),
        Collections.singletonList("nope"));
  }
}
