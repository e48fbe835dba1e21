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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread draining the queue of mutations of a single destination (a frame or a field of a frame) and writing them in
 * batches to an {@link IndexClient}.
 * 
 * <p>
 * A batch is written as soon as it reaches the batch size or when the queue runs empty. Writing a batch is retried
 * with exponential backoff; when all retries failed, the batch is dropped and the thread continues with the next one.
 *
 * @author Bastian Gloeckle
 */
public class ImportWriterThread<T> extends Thread {
  private static final Logger logger = LoggerFactory.getLogger(ImportWriterThread.class);

  private static final long POLL_TIMEOUT_MS = 100;

  /**
   * Target of the mutations.
   */
  public static interface Destination<T> {
    /**
     * Creates the destination in the index if needed, called once before the first batch is written.
     */
    public void prepare() throws IndexClientException;

    public void write(List<T> batch) throws IndexClientException;
  }

  private final String destinationName;
  private final Destination<T> destination;
  private final BlockingQueue<T> queue;
  private final int batchSize;
  private final int retries;
  private final long retryBackoffMs;

  private volatile boolean closing = false;

  private final AtomicLong flushed = new AtomicLong(0);
  private final AtomicLong dropped = new AtomicLong(0);

  public ImportWriterThread(String destinationName, Destination<T> destination, int bufferSize, int batchSize,
      int retries, long retryBackoffMs) {
    super("import-writer-" + destinationName);
    this.destinationName = destinationName;
    this.destination = destination;
    this.queue = new ArrayBlockingQueue<>(bufferSize);
    this.batchSize = batchSize;
    this.retries = retries;
    this.retryBackoffMs = retryBackoffMs;
    setUncaughtExceptionHandler((thread, throwable) -> logger.error(
        "Uncaught exception in writer of {}, queued mutations will not be written.", destinationName, throwable));
  }

  /**
   * Enqueues a mutation, blocks while the queue is full.
   */
  public void put(T mutation) {
    try {
      queue.put(mutation);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while enqueuing mutation for " + destinationName, e);
    }
  }

  /**
   * Instructs the thread to write everything that is queued and terminate then.
   */
  public void requestClose() {
    closing = true;
  }

  @Override
  public void run() {
    boolean prepared = retry("prepare", () -> destination.prepare());
    if (!prepared)
      logger.error("Could not prepare {} in index, all mutations for it will be dropped.", destinationName);

    List<T> batch = new ArrayList<>(batchSize);
    while (true) {
      T next;
      try {
        next = queue.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        logger.warn("Interrupted while waiting for mutations of {}, dropping {} queued mutations.", destinationName,
            batch.size() + queue.size());
        dropped.addAndGet(batch.size() + queue.size());
        return;
      }

      if (next == null) {
        if (!batch.isEmpty())
          flush(batch, prepared);
        if (closing && queue.isEmpty())
          break;
        continue;
      }

      batch.add(next);
      queue.drainTo(batch, batchSize - batch.size());
      if (batch.size() >= batchSize || queue.isEmpty())
        flush(batch, prepared);
    }
    logger.debug("Writer of {} done: {} mutations written, {} dropped.", destinationName, flushed.get(), dropped.get());
  }

  private void flush(List<T> batch, boolean prepared) {
    List<T> toWrite = new ArrayList<>(batch);
    batch.clear();

    if (prepared && retry("write " + toWrite.size() + " mutations to", () -> destination.write(toWrite)))
      flushed.addAndGet(toWrite.size());
    else {
      logger.warn("Dropping batch of {} mutations for {}.", toWrite.size(), destinationName);
      dropped.addAndGet(toWrite.size());
    }
  }

  private boolean retry(String description, IndexAction action) {
    long backoff = retryBackoffMs;
    for (int attempt = 0;; attempt++) {
      try {
        action.run();
        return true;
      } catch (IndexClientException | RuntimeException e) {
        if (attempt >= retries) {
          logger.error("Could not {} {} after {} attempts", description, destinationName, attempt + 1, e);
          return false;
        }
        logger.info("Could not {} {} (attempt {}), retrying in {} ms: {}", description, destinationName, attempt + 1,
            backoff, e.getMessage());
      }
      try {
        Thread.sleep(backoff);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return false;
      }
      backoff *= 2;
    }
  }

  public long getFlushed() {
    return flushed.get();
  }

  public long getDropped() {
    return dropped.get();
  }

  private static interface IndexAction {
    public void run() throws IndexClientException;
  }
}
