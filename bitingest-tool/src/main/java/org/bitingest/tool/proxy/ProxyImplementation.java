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
package org.bitingest.tool.proxy;

import java.io.Closeable;
import java.io.IOException;

import org.bitingest.config.ConfigKey;
import org.bitingest.config.ConfigurationManager;
import org.bitingest.context.Profiles;
import org.bitingest.proxy.MappingProxyServer;
import org.bitingest.tool.ingest.IngestImplementation;
import org.bitingest.translator.FrameTranslator;
import org.bitingest.translator.Translator;
import org.bitingest.translator.TranslatorFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

/**
 * Runs the mapping proxy on top of the configured translator.
 *
 * @author Bastian Gloeckle
 */
public class ProxyImplementation implements Closeable {
  private static final Logger logger = LoggerFactory.getLogger(ProxyImplementation.class);

  private String bind;
  private String upstream;

  private AnnotationConfigApplicationContext ctx;
  private Translator translator;
  private MappingProxyServer server;

  /**
   * @param bind
   *          <code>null</code> for the configured value.
   * @param upstream
   *          <code>null</code> for the configured value.
   */
  public ProxyImplementation(String bind, String upstream) {
    this.bind = bind;
    this.upstream = upstream;
  }

  /**
   * Starts the proxy and returns.
   */
  public MappingProxyServer start() throws Exception {
    logger.info("Starting bitingest context...");
    ctx = new AnnotationConfigApplicationContext();
    ctx.getEnvironment().setActiveProfiles(Profiles.CONFIG, Profiles.TOOL);
    ctx.scan("org.bitingest");
    ctx.refresh();

    ConfigurationManager config = ctx.getBean(ConfigurationManager.class);
    String effectiveBind = (bind != null) ? bind : config.getValue(ConfigKey.PROXY_BIND);
    String effectiveUpstream = (upstream != null) ? upstream : config.getValue(ConfigKey.PROXY_UPSTREAM);

    try {
      translator = ctx.getBean(TranslatorFactory.class).createTranslator();

      FrameTranslator columnTranslator = null;
      if (translator.getFrames().contains(IngestImplementation.COLUMN_FRAME))
        columnTranslator = translator.forFrame(IngestImplementation.COLUMN_FRAME);
      else
        logger.info("Translator has no column frame, columns in query results will not be translated.");

      server = new MappingProxyServer(effectiveBind, effectiveUpstream, translator, columnTranslator);
      server.start();
      return server;
    } catch (Exception e) {
      close();
      throw e;
    }
  }

  /**
   * Starts the proxy and blocks until the JVM is shut down.
   */
  public void run() {
    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      try {
        close();
      } catch (IOException e) {
        logger.warn("Could not shut down cleanly", e);
      }
    }, "proxy-shutdown"));

    try {
      start().join();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.info("Interrupted, shutting down.");
    } catch (Exception e) {
      logger.error("Could not run proxy.", e);
    }
  }

  @Override
  public synchronized void close() throws IOException {
    IOException firstException = null;
    if (server != null) {
      try {
        server.close();
      } catch (IOException e) {
        firstException = e;
      }
      server = null;
    }
    if (translator != null) {
      try {
        translator.close();
      } catch (IOException e) {
        if (firstException == null)
          firstException = e;
        else
          firstException.addSuppressed(e);
      }
      translator = null;
    }
    if (ctx != null) {
      ctx.close();
      ctx = null;
    }
    if (firstException != null)
      throw firstException;
  }
}
