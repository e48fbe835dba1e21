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

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import org.bitingest.data.Bit;
import org.bitingest.data.Entity;
import org.bitingest.data.IndexRecord;
import org.bitingest.data.Literal;
import org.bitingest.data.Val;
import org.bitingest.id.LocalRangeAllocator;
import org.bitingest.translator.Translator;
import org.bitingest.translator.memory.MapTranslator;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

/**
 * Tests {@link CollapsingMapper}.
 *
 * @author Bastian Gloeckle
 */
public class CollapsingMapperTest {
  private Translator translator;

  @BeforeMethod
  public void before() {
    translator = new MapTranslator();
  }

  @Test
  public void stringsBecomeBits() throws Exception {
    // GIVEN
    CollapsingMapper mapper = new CollapsingMapper(translator, new DashFramer());
    Entity geo = new Entity();
    geo.put("city", Literal.of("Berlin"));
    Entity entity = new Entity();
    entity.put("geo", geo);
    entity.put("color", Literal.of("red"));

    // WHEN
    IndexRecord record = mapper.map(entity);

    // THEN
    long cityRow = translator.getId("geo-city", "Berlin");
    long colorRow = translator.getId("color", "red");
    Assert.assertEquals(record.getBits(), Arrays.asList(new Bit("geo-city", cityRow), new Bit("color", colorRow)));
    Assert.assertEquals(record.getColumn(), 0L, "Expected first column");
  }

  @Test
  public void numbersBecomeValues() throws Exception {
    // GIVEN
    CollapsingMapper mapper = new CollapsingMapper(translator, new DashFramer());
    Entity stats = new Entity();
    stats.put("age", Literal.of(42L));
    Entity entity = new Entity();
    entity.put("user", stats);
    entity.put("score", Literal.of(7.9));

    // WHEN
    IndexRecord record = mapper.map(entity);

    // THEN
    Assert.assertEquals(record.getVals(),
        Arrays.asList(new Val("user", "age", 42), new Val(CollapsingMapper.DEFAULT_FRAME, "score", 7)));
    Assert.assertTrue(record.getBits().isEmpty(), "Expected no bits");
  }

  @Test
  public void trueBecomesBitOfParent() throws Exception {
    // GIVEN
    CollapsingMapper mapper = new CollapsingMapper(translator, new DashFramer());
    Entity flags = new Entity();
    flags.put("admin", Literal.of(true));
    flags.put("banned", Literal.of(false));
    Entity entity = new Entity();
    entity.put("flags", flags);
    entity.put("active", Literal.of(true));

    // WHEN
    IndexRecord record = mapper.map(entity);

    // THEN
    Assert.assertEquals(record.getBits(),
        Arrays.asList(new Bit("flags", translator.getId("flags", "admin")),
            new Bit(CollapsingMapper.DEFAULT_FRAME, translator.getId(CollapsingMapper.DEFAULT_FRAME, "active"))));
  }

  @Test
  public void listElementsMappedWithSamePath() throws Exception {
    // GIVEN
    CollapsingMapper mapper = new CollapsingMapper(translator, new DashFramer());
    Entity entity = new Entity();
    entity.put("tags", Arrays.asList(Literal.of("a"), Literal.of("b"), Literal.of("a")));

    // WHEN
    IndexRecord record = mapper.map(entity);

    // THEN
    Set<Long> rows = new HashSet<>();
    for (Bit bit : record.getBits()) {
      Assert.assertEquals(bit.getFrame(), "tags");
      rows.add(bit.getRow());
    }
    Assert.assertEquals(rows, new HashSet<>(Arrays.asList(translator.getId("tags", "a"), translator.getId("tags", "b"))));
  }

  @Test
  public void timestampMappedAsIsoString() throws Exception {
    // GIVEN
    CollapsingMapper mapper = new CollapsingMapper(translator, new DashFramer());
    Entity entity = new Entity();
    entity.put("at", Literal.of(Instant.parse("2017-01-02T03:04:05Z")));

    // WHEN
    IndexRecord record = mapper.map(entity);

    // THEN
    Assert.assertEquals(record.getBits().get(0).getRow(), translator.getId("at", "2017-01-02T03:04:05Z"));
  }

  @Test
  public void ignoredPathsNotMapped() throws Exception {
    // GIVEN
    CollapsingMapper mapper = new CollapsingMapper(translator,
        new DashFramer(Collections.singletonList("password"), Collections.emptyList()));
    Entity entity = new Entity();
    entity.put("password", Literal.of("secret"));
    entity.put("size", Literal.of(3L));

    // WHEN
    IndexRecord record = mapper.map(entity);

    // THEN
    Assert.assertTrue(record.getBits().isEmpty(), "Expected ignored value to be left out");
    Assert.assertEquals(record.getVals().size(), 1);
  }

  @Test
  public void columnFromSubject() throws Exception {
    // GIVEN
    CollapsingMapper mapper = new CollapsingMapper(translator, new DashFramer(), translator.forFrame("columns"));
    Entity first = new Entity("alice");
    Entity second = new Entity("bob");

    // WHEN
    long firstColumn = mapper.map(first).getColumn();
    long secondColumn = mapper.map(second).getColumn();
    long firstAgain = mapper.map(new Entity("alice")).getColumn();

    // THEN
    Assert.assertNotEquals(firstColumn, secondColumn, "Expected different columns for different subjects");
    Assert.assertEquals(firstAgain, firstColumn, "Expected same column for same subject");
  }

  @Test(expectedExceptions = MapException.class)
  public void missingSubjectFails() throws Exception {
    CollapsingMapper mapper = new CollapsingMapper(translator, new DashFramer(), translator.forFrame("columns"));
    mapper.map(new Entity());
  }

  @Test
  public void columnsFromRanges() throws Exception {
    // GIVEN
    LocalRangeAllocator allocator = new LocalRangeAllocator(LocalRangeAllocator.MIN_SHARD_WIDTH);
    CollapsingMapper mapper = new CollapsingMapper(translator, new DashFramer(), allocator);

    // WHEN
    long first = mapper.map(new Entity()).getColumn();
    long second = mapper.map(new Entity()).getColumn();
    mapper.workerFinished();

    // THEN
    Assert.assertEquals(first, 0L);
    Assert.assertEquals(second, 1L);
    Assert.assertEquals(allocator.get().getStart(), 2L, "Expected unused columns to be returned to the allocator");
  }
}
