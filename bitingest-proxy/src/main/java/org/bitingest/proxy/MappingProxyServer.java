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
package org.bitingest.proxy;

import java.io.Closeable;
import java.io.IOException;

import org.bitingest.translator.FrameTranslator;
import org.bitingest.translator.Translator;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Embedded HTTP server in front of the index server which translates identifiers in query results back to the values
 * they were created from, see {@link MappingProxyServlet}.
 *
 * @author Bastian Gloeckle
 */
public class MappingProxyServer implements Closeable {
  private static final Logger logger = LoggerFactory.getLogger(MappingProxyServer.class);

  private final String bindHost;
  private final int bindPort;
  private final UpstreamForwarder forwarder;
  private final ResultTranslator resultTranslator;

  private Server server;

  /**
   * @param bind
   *          "host:port" to listen on. Port 0 selects a free port.
   * @param upstream
   *          "host:port" of the index server.
   * @param columnTranslator
   *          Translator of column identifiers, may be <code>null</code>.
   */
  public MappingProxyServer(String bind, String upstream, Translator translator, FrameTranslator columnTranslator) {
    int colonIdx = bind.lastIndexOf(':');
    if (colonIdx < 0)
      throw new IllegalArgumentException("Bind address must be of the form host:port: " + bind);
    this.bindHost = bind.substring(0, colonIdx);
    try {
      this.bindPort = Integer.parseInt(bind.substring(colonIdx + 1));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid port in bind address: " + bind, e);
    }
    this.forwarder = new UpstreamForwarder(upstream);
    this.resultTranslator = new ResultTranslator(translator, columnTranslator);
  }

  public void start() throws Exception {
    server = new Server();
    ServerConnector connector = new ServerConnector(server);
    if (!bindHost.isEmpty())
      connector.setHost(bindHost);
    connector.setPort(bindPort);
    server.addConnector(connector);

    ServletContextHandler context = new ServletContextHandler();
    context.setContextPath("/");
    context.addServlet(new ServletHolder(new MappingProxyServlet(forwarder, resultTranslator)), "/*");
    server.setHandler(context);

    server.start();
    logger.info("Mapping proxy listening on {}:{}, forwarding to {}", bindHost, getPort(), forwarder.getBaseUri());
  }

  /**
   * @return The port the server listens on, valid after {@link #start()}.
   */
  public int getPort() {
    return ((ServerConnector) server.getConnectors()[0]).getLocalPort();
  }

  /**
   * Blocks until the server is stopped.
   */
  public void join() throws InterruptedException {
    server.join();
  }

  @Override
  public void close() throws IOException {
    try {
      if (server != null)
        server.stop();
    } catch (Exception e) {
      throw new IOException("Could not stop mapping proxy", e);
    } finally {
      forwarder.close();
    }
  }
}
