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
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import javax.servlet.http.HttpServlet;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

import org.bitingest.ingest.IngestStats;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import com.google.common.io.CharStreams;

/**
 * Tests {@link IngestImplementation} against a stub index server.
 *
 * @author Bastian Gloeckle
 */
public class IngestImplementationTest {
  private Server server;
  private int port;
  private List<String> requests;
  private File inputFile;

  @BeforeMethod
  public void before() throws Exception {
    requests = new CopyOnWriteArrayList<>();
    server = new Server();
    ServerConnector connector = new ServerConnector(server);
    connector.setHost("localhost");
    connector.setPort(0);
    server.addConnector(connector);
    ServletContextHandler context = new ServletContextHandler();
    context.setContextPath("/");
    context.addServlet(new ServletHolder(new HttpServlet() {
      private static final long serialVersionUID = 1L;

      @Override
      protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        requests.add(req.getRequestURI() + " " + CharStreams.toString(req.getReader()));
        resp.setStatus(200);
        resp.setContentType("application/json");
        resp.getOutputStream().write("{}".getBytes(StandardCharsets.UTF_8));
      }
    }), "/*");
    server.setHandler(context);
    server.start();
    port = connector.getLocalPort();

    inputFile = File.createTempFile("bitingest-ingest-test", ".json");
  }

  @AfterMethod
  public void after() throws Exception {
    server.stop();
    inputFile.delete();
  }

  @Test
  public void jsonIngested() throws Exception {
    // GIVEN
    Files.write(inputFile.toPath(),
        ("{\"id\":\"a\",\"color\":\"red\",\"age\":31}\n{\"id\":\"b\",\"color\":\"blue\"}\n"
            + "{\"id\":\"c\",\"color\":\"red\"}\n").getBytes(StandardCharsets.UTF_8));

    // WHEN
    IngestStats stats = new IngestImplementation(inputFile, IngestImplementation.FORMAT_JSON, "id", 2,
        "localhost:" + port, "test").ingest();

    // THEN
    Assert.assertNotNull(stats, "Expected ingestion to succeed");
    Assert.assertEquals(stats.getRecords(), 3L, "Expected all records to be read");
    Assert.assertEquals(stats.getBits(), 3L, "Expected a bit per color");
    Assert.assertEquals(stats.getValues(), 1L, "Expected one value");
    Assert.assertTrue(requests.contains("/index/test "), "Expected index to be created: " + requests);
    long setBits = requests.stream().filter(r -> r.startsWith("/index/test/query "))
        .mapToLong(r -> r.split("SetBit\\(frame=\"color\"", -1).length - 1).sum();
    Assert.assertEquals(setBits, 3L, "Expected all bits to be imported: " + requests);
    Assert.assertTrue(requests.stream().anyMatch(r -> r.contains("SetFieldValue(frame=\"default\"")),
        "Expected value to be imported: " + requests);
  }

  @Test
  public void csvIngested() throws Exception {
    // GIVEN
    Files.write(inputFile.toPath(), "name,color\nx,red\ny,green\n".getBytes(StandardCharsets.UTF_8));

    // WHEN
    IngestStats stats = new IngestImplementation(inputFile, IngestImplementation.FORMAT_CSV, null, null,
        "localhost:" + port, "test").ingest();

    // THEN
    Assert.assertNotNull(stats, "Expected ingestion to succeed");
    Assert.assertEquals(stats.getRecords(), 2L);
    Assert.assertEquals(stats.getBits(), 4L, "Expected a bit per cell");
  }

  @Test
  public void unreachableIndexFails() throws Exception {
    // GIVEN
    Files.write(inputFile.toPath(), "{\"color\":\"red\"}".getBytes(StandardCharsets.UTF_8));
    server.stop();

    // WHEN
    IngestStats stats = new IngestImplementation(inputFile, IngestImplementation.FORMAT_JSON, null, null,
        "localhost:" + port, "test").ingest();

    // THEN
    Assert.assertNull(stats, "Expected ingestion to fail");
  }
}
