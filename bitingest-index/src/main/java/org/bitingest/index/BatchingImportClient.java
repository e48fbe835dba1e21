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

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Indexer} that buffers mutations in bounded queues and writes them in batches to an {@link IndexClient}.
 * 
 * <p>
 * There is one queue and one {@link ImportWriterThread} for each frame that bits are set in and one for each field that
 * values are set in. Those are created when the first mutation for the destination arrives. Mutations of a single
 * destination are written in the order they were added.
 * 
 * <p>
 * The given {@link IndexClient} is not closed by this class.
 *
 * @author Bastian Gloeckle
 */
public class BatchingImportClient implements Indexer {
  private static final Logger logger = LoggerFactory.getLogger(BatchingImportClient.class);

  /** Range of fields created by this client. */
  public static final long FIELD_MIN = Long.MIN_VALUE;
  public static final long FIELD_MAX = Long.MAX_VALUE;

  /** Field names are used as bare identifiers in queries. */
  public static final Pattern FIELD_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private final IndexClient client;
  private final int bufferSize;
  private final int batchSize;
  private final int retries;
  private final long retryBackoffMs;

  private final Map<String, ImportWriterThread<BitMutation>> bitWriters = new ConcurrentHashMap<>();
  private final Map<FrameField, ImportWriterThread<ValueMutation>> valueWriters = new ConcurrentHashMap<>();

  private final ReadWriteLock closeLock = new ReentrantReadWriteLock();
  private boolean closed = false;

  public BatchingImportClient(IndexClient client, int bufferSize, int batchSize, int retries, long retryBackoffMs) {
    if (bufferSize < 1 || batchSize < 1)
      throw new IllegalArgumentException("Buffer size and batch size must be positive.");
    this.client = client;
    this.bufferSize = bufferSize;
    this.batchSize = batchSize;
    this.retries = retries;
    this.retryBackoffMs = retryBackoffMs;
  }

  /**
   * Creates the writers of the given frames right away instead of on the first mutation.
   */
  public void declareFrames(Collection<String> frames) {
    closeLock.readLock().lock();
    try {
      if (closed)
        throw new IllegalStateException("Import client closed.");
      for (String frame : frames)
        bitWriter(frame);
    } finally {
      closeLock.readLock().unlock();
    }
  }

  @Override
  public void addBit(String frame, long column, long row) {
    addBitTimestamp(frame, column, row, null);
  }

  @Override
  public void addBitTimestamp(String frame, long column, long row, Instant timestamp) {
    closeLock.readLock().lock();
    try {
      if (closed)
        throw new IllegalStateException("Import client closed, cannot add bit to frame " + frame);
      bitWriter(frame).put(new BitMutation(row, column, timestamp));
    } finally {
      closeLock.readLock().unlock();
    }
  }

  @Override
  public void addValue(String frame, String field, long column, long value) {
    closeLock.readLock().lock();
    try {
      if (closed)
        throw new IllegalStateException("Import client closed, cannot add value to field " + field);
      if (!FIELD_NAME.matcher(field).matches())
        throw new IllegalArgumentException("Invalid field name '" + field + "'");
      valueWriters.computeIfAbsent(new FrameField(frame, field), frameField -> {
        ImportWriterThread<ValueMutation> res =
            new ImportWriterThread<>(frame + "." + field, new ImportWriterThread.Destination<ValueMutation>() {
              @Override
              public void prepare() throws IndexClientException {
                client.ensureField(frame, field, FIELD_MIN, FIELD_MAX);
              }

              @Override
              public void write(List<ValueMutation> batch) throws IndexClientException {
                client.importValues(frame, field, batch);
              }
            }, bufferSize, batchSize, retries, retryBackoffMs);
        res.start();
        return res;
      }).put(new ValueMutation(column, value));
    } finally {
      closeLock.readLock().unlock();
    }
  }

  private ImportWriterThread<BitMutation> bitWriter(String frame) {
    return bitWriters.computeIfAbsent(frame, f -> {
      ImportWriterThread<BitMutation> res =
          new ImportWriterThread<>(frame, new ImportWriterThread.Destination<BitMutation>() {
            @Override
            public void prepare() throws IndexClientException {
              client.ensureFrame(frame);
            }

            @Override
            public void write(List<BitMutation> batch) throws IndexClientException {
              client.importBits(frame, batch);
            }
          }, bufferSize, batchSize, retries, retryBackoffMs);
      res.start();
      return res;
    });
  }

  @Override
  public void close() throws IOException {
    List<ImportWriterThread<?>> writers = new ArrayList<>();
    closeLock.writeLock().lock();
    try {
      if (closed)
        return;
      closed = true;
      writers.addAll(bitWriters.values());
      writers.addAll(valueWriters.values());
    } finally {
      closeLock.writeLock().unlock();
    }

    for (ImportWriterThread<?> writer : writers)
      writer.requestClose();

    for (ImportWriterThread<?> writer : writers) {
      try {
        writer.join();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IOException("Interrupted while waiting for " + writer.getName() + " to finish.", e);
      }
    }
    logger.info("Import client closed: {} mutations written, {} dropped.", getFlushed(), getDropped());
  }

  /**
   * @return Number of mutations that were successfully written.
   */
  public long getFlushed() {
    return bitWriters.values().stream().mapToLong(ImportWriterThread::getFlushed).sum()
        + valueWriters.values().stream().mapToLong(ImportWriterThread::getFlushed).sum();
  }

  /**
   * @return Number of mutations that could not be written and were discarded.
   */
  public long getDropped() {
    return bitWriters.values().stream().mapToLong(ImportWriterThread::getDropped).sum()
        + valueWriters.values().stream().mapToLong(ImportWriterThread::getDropped).sum();
  }

  private static class FrameField {
    private final String frame;
    private final String field;

    FrameField(String frame, String field) {
      this.frame = frame;
      this.field = field;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof FrameField))
        return false;
      FrameField other = (FrameField) obj;
      return frame.equals(other.frame) && field.equals(other.field);
    }

    @Override
    public int hashCode() {
      return frame.hashCode() * 31 + field.hashCode();
    }
  }
}
