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
package org.bitingest.tool.ingest;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import org.bitingest.config.Config;
import org.bitingest.config.ConfigKey;
import org.bitingest.context.AutoInstatiate;
import org.bitingest.context.Profiles;
import org.bitingest.id.LocalRangeAllocator;
import org.bitingest.id.RangeAllocator;
import org.bitingest.index.BatchingImportClient;
import org.bitingest.index.IndexClient;
import org.bitingest.index.http.HttpIndexClient;
import org.springframework.context.annotation.Profile;

/**
 * Creates the configured index clients and column allocators for an ingestion run.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
@Profile(Profiles.TOOL)
public class IngestFactory {
  @Config(ConfigKey.INDEX_HOSTS)
  private String indexHosts;

  @Config(ConfigKey.INDEX_NAME)
  private String indexName;

  @Config(ConfigKey.IMPORT_BUFFER_SIZE)
  private int bufferSize;

  @Config(ConfigKey.IMPORT_BATCH_SIZE)
  private int batchSize;

  @Config(ConfigKey.IMPORT_RETRIES)
  private int retries;

  @Config(ConfigKey.IMPORT_RETRY_BACKOFF_MS)
  private long retryBackoffMs;

  @Config(ConfigKey.IDALLOC_SHARD_WIDTH)
  private long shardWidth;

  @Config(ConfigKey.INGEST_PARSE_CONCURRENCY)
  private int parseConcurrency;

  /**
   * @param hosts
   *          Comma separated "host:port" pairs or <code>null</code> to use the configured ones.
   * @param index
   *          Name of the index or <code>null</code> to use the configured one.
   */
  public IndexClient createIndexClient(String hosts, String index) {
    String effectiveHosts = (hosts != null) ? hosts : indexHosts;
    List<String> hostList = Arrays.stream(effectiveHosts.split(",")).map(String::trim).filter(s -> !s.isEmpty())
        .collect(Collectors.toList());
    return new HttpIndexClient(hostList, (index != null) ? index : indexName);
  }

  public BatchingImportClient createImportClient(IndexClient indexClient) {
    return new BatchingImportClient(indexClient, bufferSize, batchSize, retries, retryBackoffMs);
  }

  public RangeAllocator createColumnAllocator() {
    return new LocalRangeAllocator(shardWidth);
  }

  public int getParseConcurrency() {
    return parseConcurrency;
  }
}
