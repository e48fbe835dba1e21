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
package org.bitingest.data;

import java.util.Arrays;

import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Tests {@link Entity}.
 *
 * @author Bastian Gloeckle
 */
public class EntityTest {
  @Test
  public void nestedValuesAccepted() {
    // GIVEN
    Entity inner = new Entity();
    inner.put("name", Literal.of("x"));
    Entity e = new Entity("subj");

    // WHEN
    e.put("inner", inner);
    e.put("tags", Arrays.asList(Literal.of("a"), Literal.of("b")));

    // THEN
    Assert.assertEquals(e.getProperties().size(), 2, "Expected both properties to be set");
    Assert.assertEquals(e.get("inner"), inner, "Expected nested entity");
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void rawValueRejected() {
    new Entity().put("name", "not a literal");
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void rawValueInListRejected() {
    new Entity().put("tags", Arrays.asList(Literal.of("a"), 5));
  }
}
