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
package org.bitingest.ingest;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.bitingest.data.Bit;
import org.bitingest.data.Entity;
import org.bitingest.data.IndexRecord;
import org.bitingest.data.Val;
import org.bitingest.index.Indexer;
import org.bitingest.ingest.map.MapException;
import org.bitingest.ingest.map.RecordMapper;
import org.bitingest.ingest.parse.ParseException;
import org.bitingest.ingest.parse.RecordParser;
import org.bitingest.threads.ExecutorManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads records from a {@link Source}, parses, transforms and maps them and hands the resulting bits and values to an
 * {@link Indexer}.
 * 
 * <p>
 * Records that fail to be parsed or mapped, or fail unexpectedly, are logged and skipped. A failing
 * {@link Transformer} is logged, too, but the record is processed further. When the source is exhausted (or fails), the {@link Indexer} is closed.
 *
 * @author Bastian Gloeckle
 */
public class Ingester {
  private static final Logger logger = LoggerFactory.getLogger(Ingester.class);

  private final Source source;
  private final RecordParser parser;
  private final RecordMapper mapper;
  private final Indexer indexer;
  private final ExecutorManager executorManager;

  private final List<Transformer> transformers = new CopyOnWriteArrayList<>();
  private final IngestStats stats = new IngestStats();

  private int parseConcurrency = 1;
  private volatile boolean stopped = false;

  public Ingester(Source source, RecordParser parser, RecordMapper mapper, Indexer indexer,
      ExecutorManager executorManager) {
    this.source = source;
    this.parser = parser;
    this.mapper = mapper;
    this.indexer = indexer;
    this.executorManager = executorManager;
  }

  /**
   * Number of worker threads processing records in parallel.
   */
  public void setParseConcurrency(int parseConcurrency) {
    if (parseConcurrency < 1)
      throw new IllegalArgumentException("Parse concurrency must be at least 1.");
    this.parseConcurrency = parseConcurrency;
  }

  public void addTransformer(Transformer transformer) {
    transformers.add(transformer);
  }

  /**
   * Ingests all records of the source and blocks until done, including closing the {@link Indexer}.
   * 
   * @throws IOException
   *           if the indexer fails to write all data.
   */
  public void run() throws IOException {
    logger.info("Starting ingestion with {} workers.", parseConcurrency);
    ExecutorService executor = executorManager.newFixedThreadPool("ingest-worker-%d",
        (thread, throwable) -> logger.error("Uncaught exception in ingestion worker {}", thread.getName(), throwable),
        parseConcurrency);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < parseConcurrency; i++)
        futures.add(executor.submit(this::work));

      for (Future<?> future : futures) {
        try {
          future.get();
        } catch (ExecutionException e) {
          logger.error("Ingestion worker failed", e.getCause());
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          stop();
          logger.warn("Interrupted while waiting for ingestion workers.");
          break;
        }
      }
    } finally {
      executor.shutdown();
      indexer.close();
    }
    logger.info("Ingestion done: {}", stats);
  }

  /**
   * Instructs the workers to stop after the record they are currently processing. {@link #run()} returns as soon as
   * they stopped and the indexer has been closed.
   */
  public void stop() {
    stopped = true;
  }

  private void work() {
    try {
      while (!stopped) {
        Object record;
        try {
          record = source.record();
        } catch (IOException e) {
          logger.error("Could not read from source, stopping worker.", e);
          return;
        }
        if (record == null)
          return;
        stats.record();
        try {
          process(record);
        } catch (RuntimeException e) {
          stats.mapError();
          logger.warn("Unexpected error while processing record, skipping it.", e);
        }
      }
    } finally {
      mapper.workerFinished();
    }
  }

  private void process(Object record) {
    Entity entity;
    try {
      entity = parser.parse(record);
    } catch (ParseException e) {
      stats.parseError();
      logger.warn("Could not parse record, skipping it: {}", e.getMessage());
      logger.trace("Record that could not be parsed: {}", record);
      return;
    }

    for (Transformer transformer : transformers) {
      try {
        transformer.transform(entity);
      } catch (TransformException e) {
        stats.transformError();
        logger.warn("Transformer {} failed on entity {}: {}", transformer.getClass().getSimpleName(),
            entity.getSubject(), e.getMessage());
      }
    }

    IndexRecord indexRecord;
    try {
      indexRecord = mapper.map(entity);
    } catch (MapException e) {
      stats.mapError();
      logger.warn("Could not map entity {}, skipping it: {}", entity.getSubject(), e.getMessage());
      return;
    }

    for (Bit bit : indexRecord.getBits()) {
      if (bit.getTimestamp() != null)
        indexer.addBitTimestamp(bit.getFrame(), indexRecord.getColumn(), bit.getRow(), bit.getTimestamp());
      else
        indexer.addBit(bit.getFrame(), indexRecord.getColumn(), bit.getRow());
    }
    for (Val val : indexRecord.getVals())
      indexer.addValue(val.getFrame(), val.getField(), indexRecord.getColumn(), val.getValue());
    stats.bits(indexRecord.getBits().size());
    stats.values(indexRecord.getVals().size());
  }

  public IngestStats getStats() {
    return stats;
  }
}
