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
package org.bitingest.index;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.mockito.ArgumentCaptor;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

/**
 * Tests {@link BatchingImportClient}.
 *
 * @author Bastian Gloeckle
 */
public class BatchingImportClientTest {
  private static final int RETRIES = 2;

  private IndexClient indexClient;

  @BeforeMethod
  public void before() {
    indexClient = mock(IndexClient.class);
  }

  @SuppressWarnings({ "unchecked", "rawtypes" })
  private ArgumentCaptor<List<BitMutation>> bitCaptor() {
    return ArgumentCaptor.forClass((Class) List.class);
  }

  @Test
  public void allBitsWrittenInBatches() throws Exception {
    // GIVEN
    BatchingImportClient importClient = new BatchingImportClient(indexClient, 1000, 10, RETRIES, 1);

    // WHEN
    for (long col = 0; col < 95; col++)
      importClient.addBit("f", col, col % 3);
    importClient.close();

    // THEN
    verify(indexClient, times(1)).ensureFrame("f");
    ArgumentCaptor<List<BitMutation>> captor = bitCaptor();
    verify(indexClient, atLeast(10)).importBits(eq("f"), captor.capture());
    List<BitMutation> written = new ArrayList<>();
    for (List<BitMutation> batch : captor.getAllValues()) {
      Assert.assertTrue(batch.size() <= 10, "Expected batches to respect batch size, but got " + batch.size());
      written.addAll(batch);
    }
    Assert.assertEquals(written.size(), 95, "Expected all bits to be written");
    for (int i = 0; i < 95; i++)
      Assert.assertEquals(written.get(i), new BitMutation(i % 3, i, null), "Expected bits to be written in order");
    Assert.assertEquals(importClient.getFlushed(), 95L, "Expected correct flushed count");
    Assert.assertEquals(importClient.getDropped(), 0L, "Expected nothing to be dropped");
  }

  @Test
  public void smallBufferWritesEverything() throws Exception {
    // GIVEN
    BatchingImportClient importClient = new BatchingImportClient(indexClient, 1, 1, RETRIES, 1);

    // WHEN
    for (long col = 0; col < 50; col++)
      importClient.addBit("f", col, 1);
    importClient.close();

    // THEN
    verify(indexClient, times(50)).importBits(eq("f"), anyList());
    Assert.assertEquals(importClient.getFlushed(), 50L, "Expected all bits to be written");
  }

  @Test
  public void timestampIsPassedOn() throws Exception {
    // GIVEN
    BatchingImportClient importClient = new BatchingImportClient(indexClient, 10, 10, RETRIES, 1);
    Instant ts = Instant.parse("2017-03-04T10:15:00Z");

    // WHEN
    importClient.addBitTimestamp("f", 7, 3, ts);
    importClient.close();

    // THEN
    verify(indexClient).importBits("f", Collections.singletonList(new BitMutation(3, 7, ts)));
  }

  @Test
  public void failedWriteIsRetried() throws Exception {
    // GIVEN
    doThrow(new IndexClientException("down")).doNothing().when(indexClient).importBits(eq("f"), anyList());
    BatchingImportClient importClient = new BatchingImportClient(indexClient, 10, 10, RETRIES, 1);

    // WHEN
    importClient.addBit("f", 1, 1);
    importClient.close();

    // THEN
    verify(indexClient, times(2)).importBits(eq("f"), anyList());
    Assert.assertEquals(importClient.getFlushed(), 1L, "Expected bit to be written after retry");
    Assert.assertEquals(importClient.getDropped(), 0L, "Expected nothing to be dropped");
  }

  @Test
  public void batchDroppedAfterRetries() throws Exception {
    // GIVEN
    doThrow(new IndexClientException("down")).when(indexClient).importBits(eq("f"), anyList());
    BatchingImportClient importClient = new BatchingImportClient(indexClient, 10, 10, RETRIES, 1);

    // WHEN
    importClient.addBit("f", 1, 1);
    importClient.close();

    // THEN
    verify(indexClient, times(RETRIES + 1)).importBits(eq("f"), anyList());
    Assert.assertEquals(importClient.getFlushed(), 0L, "Expected nothing to be written");
    Assert.assertEquals(importClient.getDropped(), 1L, "Expected bit to be dropped");
  }

  @Test
  public void writerContinuesAfterDroppedBatch() throws Exception {
    // GIVEN
    doThrow(new IndexClientException("down")).doThrow(new IndexClientException("down"))
        .doThrow(new IndexClientException("down")).doNothing().when(indexClient).importBits(eq("f"), anyList());
    BatchingImportClient importClient = new BatchingImportClient(indexClient, 10, 1, RETRIES, 1);

    // WHEN
    importClient.addBit("f", 1, 1);
    importClient.addBit("f", 2, 1);
    importClient.close();

    // THEN
    Assert.assertEquals(importClient.getDropped(), 1L, "Expected first bit to be dropped");
    Assert.assertEquals(importClient.getFlushed(), 1L, "Expected second bit to be written");
  }

  @Test
  public void failedPreparationDropsMutations() throws Exception {
    // GIVEN
    doThrow(new IndexClientException("down")).when(indexClient).ensureFrame("f");
    BatchingImportClient importClient = new BatchingImportClient(indexClient, 10, 10, RETRIES, 1);

    // WHEN
    importClient.addBit("f", 1, 1);
    importClient.addBit("f", 2, 1);
    importClient.close();

    // THEN
    verify(indexClient, never()).importBits(any(), anyList());
    Assert.assertEquals(importClient.getDropped(), 2L, "Expected bits to be dropped");
  }

  @Test
  public void valuesWrittenToField() throws Exception {
    // GIVEN
    BatchingImportClient importClient = new BatchingImportClient(indexClient, 10, 10, RETRIES, 1);

    // WHEN
    importClient.addValue("f", "age", 5, 42);
    importClient.close();

    // THEN
    verify(indexClient).ensureField("f", "age", BatchingImportClient.FIELD_MIN, BatchingImportClient.FIELD_MAX);
    verify(indexClient).importValues("f", "age", Collections.singletonList(new ValueMutation(5, 42)));
    verify(indexClient, never()).ensureFrame("f");
  }

  @Test
  public void declaredFramesArePreparedWithoutMutations() throws Exception {
    // GIVEN
    BatchingImportClient importClient = new BatchingImportClient(indexClient, 10, 10, RETRIES, 1);

    // WHEN
    importClient.declareFrames(Collections.singletonList("f"));
    importClient.close();

    // THEN
    verify(indexClient).ensureFrame("f");
    verify(indexClient, never()).importBits(any(), anyList());
  }

  @Test(expectedExceptions = IllegalStateException.class)
  public void addAfterCloseFails() throws Exception {
    // GIVEN
    BatchingImportClient importClient = new BatchingImportClient(indexClient, 10, 10, RETRIES, 1);
    importClient.close();

    // WHEN
    importClient.addBit("f", 1, 1);

    // THEN: exception
  }

  @Test
  public void closeIsIdempotent() throws IOException, IndexClientException {
    // GIVEN
    List<Integer> writtenSizes = Collections.synchronizedList(new ArrayList<>());
    doAnswer(invocation -> {
      writtenSizes.add(((List<?>) invocation.getArgument(1)).size());
      return null;
    }).when(indexClient).importBits(eq("f"), anyList());
    BatchingImportClient importClient = new BatchingImportClient(indexClient, 10, 10, RETRIES, 1);
    importClient.addBit("f", 1, 1);

    // WHEN
    importClient.close();
    importClient.close();

    // THEN
    Assert.assertEquals(writtenSizes, Collections.singletonList(1), "Expected bit to be written exactly once");
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void invalidBatchSize() {
    new BatchingImportClient(indexClient, 10, 0, RETRIES, 1);
  }

  @Test(timeOut = 10000)
  public void uncheckedPreparationFailureDoesNotBlockProducer() throws Exception {
    // GIVEN
    doThrow(new IllegalArgumentException("bad frame")).when(indexClient).ensureFrame("first name");
    BatchingImportClient importClient = new BatchingImportClient(indexClient, 2, 1, RETRIES, 1);

    // WHEN
    for (long col = 0; col < 10; col++)
      importClient.addBit("first name", col, 1);
    importClient.close();

    // THEN
    verify(indexClient, times(RETRIES + 1)).ensureFrame("first name");
    Assert.assertEquals(importClient.getDropped(), 10L, "Expected all bits to be dropped");
  }

  @Test(timeOut = 10000)
  public void writerContinuesAfterUncheckedWriteFailure() throws Exception {
    // GIVEN
    doThrow(new IllegalStateException("broken")).doThrow(new IllegalStateException("broken"))
        .doThrow(new IllegalStateException("broken")).doNothing().when(indexClient).importBits(eq("f"), anyList());
    BatchingImportClient importClient = new BatchingImportClient(indexClient, 10, 1, RETRIES, 1);

    // WHEN
    importClient.addBit("f", 1, 1);
    importClient.addBit("f", 2, 1);
    importClient.close();

    // THEN
    Assert.assertEquals(importClient.getDropped(), 1L, "Expected first bit to be dropped");
    Assert.assertEquals(importClient.getFlushed(), 1L, "Expected second bit to be written");
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void invalidFieldNameRejected() throws Exception {
    BatchingImportClient importClient = new BatchingImportClient(indexClient, 10, 10, RETRIES, 1);
    try {
      importClient.addValue("f", "first name", 1, 1);
    } finally {
      importClient.close();
    }
  }
}
