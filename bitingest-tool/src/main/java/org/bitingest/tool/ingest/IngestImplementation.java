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

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

import org.bitingest.context.Profiles;
import org.bitingest.index.BatchingImportClient;
import org.bitingest.index.IndexClient;
import org.bitingest.index.IndexClientException;
import org.bitingest.ingest.IngestStats;
import org.bitingest.ingest.Ingester;
import org.bitingest.ingest.Source;
import org.bitingest.ingest.map.CollapsingMapper;
import org.bitingest.ingest.map.DashFramer;
import org.bitingest.ingest.parse.GenericParser;
import org.bitingest.ingest.source.CsvSource;
import org.bitingest.ingest.source.JsonSource;
import org.bitingest.threads.ExecutorManager;
import org.bitingest.translator.Translator;
import org.bitingest.translator.TranslatorException;
import org.bitingest.translator.TranslatorFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

/**
 * Ingests a JSON or CSV file into the index.
 *
 * @author Bastian Gloeckle
 */
public class IngestImplementation {
  private static final Logger logger = LoggerFactory.getLogger(IngestImplementation.class);

  /** Frame of the translator holding the subjects of the ingested records. */
  public static final String COLUMN_FRAME = "_column";

  public static final String FORMAT_JSON = "json";
  public static final String FORMAT_CSV = "csv";

  private File inputFile;
  private String format;
  private String subject;
  private Integer concurrency;
  private String hosts;
  private String index;

  /**
   * @param inputFile
   *          <code>null</code> to read from stdin.
   * @param subject
   *          Dot separated path of the property identifying a record or <code>null</code> if records should be
   *          numbered.
   * @param concurrency
   *          <code>null</code> for the configured value.
   * @param hosts
   *          <code>null</code> for the configured value.
   * @param index
   *          <code>null</code> for the configured value.
   */
  public IngestImplementation(File inputFile, String format, String subject, Integer concurrency, String hosts,
      String index) {
    this.inputFile = inputFile;
    this.format = format;
    this.subject = subject;
    this.concurrency = concurrency;
    this.hosts = hosts;
    this.index = index;
  }

  /**
   * @return Statistics of the ingestion or <code>null</code> if it failed.
   */
  public IngestStats ingest() {
    logger.info("Starting bitingest context...");

    try (AnnotationConfigApplicationContext ctx = new AnnotationConfigApplicationContext()) {
      ctx.getEnvironment().setActiveProfiles(Profiles.CONFIG, Profiles.TOOL);
      ctx.scan("org.bitingest");
      ctx.refresh();

      TranslatorFactory translatorFactory = ctx.getBean(TranslatorFactory.class);
      IngestFactory ingestFactory = ctx.getBean(IngestFactory.class);
      ExecutorManager executorManager = ctx.getBean(ExecutorManager.class);

      try (Translator translator = translatorFactory.createTranslator();
          IndexClient indexClient = ingestFactory.createIndexClient(hosts, index);
          Reader reader = openInput()) {
        Source source = createSource(reader);
        indexClient.ensureIndex();

        GenericParser parser = new GenericParser();
        CollapsingMapper mapper;
        if (subject != null) {
          parser.setSubjectPath(subject.split("\\."));
          mapper = new CollapsingMapper(translator, new DashFramer(), translator.forFrame(COLUMN_FRAME));
        } else
          mapper = new CollapsingMapper(translator, new DashFramer(), ingestFactory.createColumnAllocator());

        BatchingImportClient importClient = ingestFactory.createImportClient(indexClient);
        Ingester ingester = new Ingester(source, parser, mapper, importClient, executorManager);
        ingester.setParseConcurrency((concurrency != null) ? concurrency : ingestFactory.getParseConcurrency());

        ingester.run();

        logger.info("Ingested {} records, {} mutations written to index, {} dropped.",
            ingester.getStats().getRecords(), importClient.getFlushed(), importClient.getDropped());
        return ingester.getStats();
      } catch (IOException | TranslatorException | IndexClientException e) {
        logger.error("Could not proceed.", e);
        return null;
      }
    }
  }

  private Reader openInput() throws IOException {
    InputStream is = (inputFile != null) ? new FileInputStream(inputFile) : System.in;
    return new InputStreamReader(is, StandardCharsets.UTF_8);
  }

  private Source createSource(Reader reader) throws IOException {
    switch (format) {
    case FORMAT_JSON:
      return new JsonSource(reader);
    case FORMAT_CSV:
      return new CsvSource(reader);
    default:
      throw new IOException("Unknown input format '" + format + "'.");
    }
  }
}
