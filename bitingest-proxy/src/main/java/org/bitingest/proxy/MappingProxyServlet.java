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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import javax.servlet.http.HttpServlet;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

import org.bitingest.proxy.UpstreamForwarder.UpstreamResponse;
import org.bitingest.translator.TranslatorException;
import org.bitingest.translator.UnknownFrameException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.io.ByteStreams;

/**
 * Servlet forwarding all requests to the upstream index server. Responses to queries are translated using a
 * {@link ResultTranslator}, all other responses are passed on unchanged.
 *
 * @author Bastian Gloeckle
 */
public class MappingProxyServlet extends HttpServlet {
  private static final long serialVersionUID = 1L;

  private static final Logger logger = LoggerFactory.getLogger(MappingProxyServlet.class);

  private static final String QUERY_PATH_SUFFIX = "/query";
  private static final String JSON_CONTENT_TYPE = "application/json";

  private final transient UpstreamForwarder forwarder;
  private final transient ResultTranslator resultTranslator;
  private final transient ObjectMapper mapper = new ObjectMapper();

  public MappingProxyServlet(UpstreamForwarder forwarder, ResultTranslator resultTranslator) {
    this.forwarder = forwarder;
    this.resultTranslator = resultTranslator;
  }

  @Override
  protected void service(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    resp.setHeader("Access-Control-Allow-Origin", "*");

    byte[] body = ByteStreams.toByteArray(req.getInputStream());
    String path = req.getRequestURI();
    String pathAndQuery = (req.getQueryString() != null) ? path + "?" + req.getQueryString() : path;

    if (!path.endsWith(QUERY_PATH_SUFFIX)) {
      UpstreamResponse upstreamResponse = forward(req, resp, pathAndQuery, body);
      if (upstreamResponse != null)
        relay(upstreamResponse, resp);
      return;
    }

    List<String> frames;
    try {
      frames = PqlParseUtil.topLevelFrames(new String(body, StandardCharsets.UTF_8));
    } catch (PqlParseException e) {
      logger.debug("Could not parse query: {}", e.getMessage());
      error(resp, HttpServletResponse.SC_BAD_REQUEST, "Could not parse query: " + e.getMessage());
      return;
    }

    UpstreamResponse upstreamResponse = forward(req, resp, pathAndQuery, body);
    if (upstreamResponse == null)
      return;
    if (!upstreamResponse.isSuccess()) {
      relay(upstreamResponse, resp);
      return;
    }

    JsonNode result;
    try {
      result = mapper.readTree(upstreamResponse.getBody());
    } catch (JsonProcessingException e) {
      logger.warn("Upstream returned a query response that is no valid JSON, passing it on unchanged.");
      relay(upstreamResponse, resp);
      return;
    }

    try {
      result = resultTranslator.translate(result, frames);
    } catch (TranslatorException | UnknownFrameException e) {
      logger.warn("Could not translate query result: {}", e.getMessage());
      error(resp, HttpServletResponse.SC_INTERNAL_SERVER_ERROR, "Could not translate result: " + e.getMessage());
      return;
    }

    resp.setStatus(HttpServletResponse.SC_OK);
    resp.setContentType(JSON_CONTENT_TYPE);
    resp.getOutputStream().write(mapper.writeValueAsBytes(result));
  }

  /**
   * @return The upstream response or <code>null</code> if the upstream server could not be reached, in which case an
   *         error has been sent already.
   */
  private UpstreamResponse forward(HttpServletRequest req, HttpServletResponse resp, String pathAndQuery, byte[] body)
      throws IOException {
    try {
      return forwarder.forward(req.getMethod(), pathAndQuery, body, req.getContentType());
    } catch (IOException e) {
      logger.warn("Could not forward request to {}: {}", forwarder.getBaseUri(), e.getMessage());
      error(resp, HttpServletResponse.SC_BAD_GATEWAY, "Upstream not reachable: " + e.getMessage());
      return null;
    }
  }

  private void relay(UpstreamResponse upstreamResponse, HttpServletResponse resp) throws IOException {
    resp.setStatus(upstreamResponse.getStatus());
    if (upstreamResponse.getContentType() != null)
      resp.setContentType(upstreamResponse.getContentType());
    resp.getOutputStream().write(upstreamResponse.getBody());
  }

  private void error(HttpServletResponse resp, int status, String message) throws IOException {
    ObjectNode error = mapper.createObjectNode();
    error.put("error", message);
    resp.setStatus(status);
    resp.setContentType(JSON_CONTENT_TYPE);
    resp.getOutputStream().write(mapper.writeValueAsBytes(error));
  }
}
