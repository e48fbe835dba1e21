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
package org.bitingest.config;

/**
 * Configuration keys which can be used to resolve configuration values.
 * 
 * <p>
 * It's easiest to use these constants with the {@link Config} annotation.
 *
 * @author Bastian Gloeckle
 */
public class ConfigKey {
  /**
   * The translator implementation to use. One of "memory", "rocksdb" or "rocksdb-batched".
   * 
   * <p>
   * "memory" keeps all translations in memory only, they are lost when the process ends. "rocksdb" stores the
   * translations of each frame in two RocksDB databases and guards new assignments with striped locks. "rocksdb-batched"
   * stores all frames in a single RocksDB database and commits new assignments in groups.
   */
  public static final String TRANSLATOR_TYPE = "translator.type";

  /**
   * The directory the persistent translators store their data in.
   * 
   * <p>
   * This can be a relative path which is then interpreted as being relative to the current working directory.
   */
  public static final String TRANSLATOR_DIR = "translator.dir";

  /**
   * Number of locks the "rocksdb" translator stripes the values across.
   */
  public static final String TRANSLATOR_LOCK_BUCKETS = "translator.lockBuckets";

  /**
   * Maximum number of new assignments the "rocksdb-batched" translator commits at once.
   */
  public static final String TRANSLATOR_BATCH_MAX_SIZE = "translator.batchMaxSize";

  /**
   * Maximum number of microseconds the "rocksdb-batched" translator waits for more assignments before committing a
   * batch.
   */
  public static final String TRANSLATOR_BATCH_MAX_DELAY_MICROS = "translator.batchMaxDelayMicros";

  /**
   * Number of values that are written in one write batch on bulk adds.
   */
  public static final String TRANSLATOR_BULK_ADD_BATCH_SIZE = "translator.bulkAddBatchSize";

  /**
   * The index servers to talk to.
   * 
   * Format is: <code>
   * host:port,host:port,host:port, ...
   * </code>
   */
  public static final String INDEX_HOSTS = "index.hosts";

  /**
   * Name of the index the data is imported into.
   */
  public static final String INDEX_NAME = "index.name";

  /**
   * Number of mutations that can be buffered for each frame (and for each field) before adding more mutations blocks.
   */
  public static final String IMPORT_BUFFER_SIZE = "import.bufferSize";

  /**
   * Maximum number of mutations sent to the index server in one request.
   */
  public static final String IMPORT_BATCH_SIZE = "import.batchSize";

  /**
   * Number of times a failed import request is retried before the mutations are dropped.
   */
  public static final String IMPORT_RETRIES = "import.retries";

  /**
   * Milliseconds to wait before the first retry of a failed import request. The wait time doubles on each retry.
   */
  public static final String IMPORT_RETRY_BACKOFF_MS = "import.retryBackoffMs";

  /**
   * Number of threads that parse and map records concurrently.
   */
  public static final String INGEST_PARSE_CONCURRENCY = "ingest.parseConcurrency";

  /**
   * Number of column identifiers in one range handed out to an ingestion worker. Needs to be a power of two and at least
   * 65536.
   */
  public static final String IDALLOC_SHARD_WIDTH = "idalloc.shardWidth";

  /**
   * The address the mapping proxy listens on, in the form host:port.
   */
  public static final String PROXY_BIND = "proxy.bind";

  /**
   * The index server the mapping proxy forwards requests to, in the form host:port.
   */
  public static final String PROXY_UPSTREAM = "proxy.upstream";
}
