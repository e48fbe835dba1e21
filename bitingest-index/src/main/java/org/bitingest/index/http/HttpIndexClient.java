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
package org.bitingest.index.http;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpStatus;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.net.URIBuilder;
import org.apache.hc.core5.util.Timeout;
import org.bitingest.index.BitMutation;
import org.bitingest.index.IndexClient;
import org.bitingest.index.IndexClientException;
import org.bitingest.index.ValueMutation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * {@link IndexClient} talking to the HTTP interface of the index server.
 * 
 * <p>
 * Mutations are sent as query strings consisting of one SetBit/SetFieldValue call per mutation. Requests are
 * distributed round robin over the configured hosts.
 *
 * @author Bastian Gloeckle
 */
public class HttpIndexClient implements IndexClient {
  private static final Logger logger = LoggerFactory.getLogger(HttpIndexClient.class);

  /** Format of timestamps of time quantum frames. */
  public static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm").withZone(ZoneOffset.UTC);

  private static final int CONFLICT = 409;

  private static final Timeout CONNECT_TIMEOUT = Timeout.ofSeconds(10);
  private static final Timeout RESPONSE_TIMEOUT = Timeout.ofMinutes(5);

  private final ObjectMapper mapper = new ObjectMapper();
  private final List<String> baseUris;
  private final String index;
  private final CloseableHttpClient httpClient;
  private final AtomicInteger nextHost = new AtomicInteger(0);

  /**
   * @param hosts
   *          "host:port" pairs, optionally prefixed with a scheme.
   */
  public HttpIndexClient(List<String> hosts, String index) {
    if (hosts.isEmpty())
      throw new IllegalArgumentException("At least one index host needed.");
    this.baseUris = hosts.stream().map(HttpIndexClient::toBaseUri).collect(Collectors.toList());
    this.index = index;

    RequestConfig requestConfig = RequestConfig.custom() //
        .setConnectionRequestTimeout(CONNECT_TIMEOUT) //
        .setResponseTimeout(RESPONSE_TIMEOUT) //
        .build();

    httpClient = HttpClients.custom() //
        .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create() //
            .setMaxConnTotal(100) //
            .setMaxConnPerRoute(100) //
            .build()) //
        .setDefaultRequestConfig(requestConfig) //
        .evictIdleConnections(Timeout.of(1, TimeUnit.MINUTES)) //
        .build();
  }

  /* package */ static String toBaseUri(String host) {
    String res = host.trim();
    if (!res.startsWith("http://") && !res.startsWith("https://"))
      res = "http://" + res;
    while (res.endsWith("/"))
      res = res.substring(0, res.length() - 1);
    return res;
  }

  @Override
  public void ensureIndex() throws IndexClientException {
    post("", true, "index", index);
  }

  @Override
  public void ensureFrame(String frame) throws IndexClientException {
    post(frameOptions(false), true, "index", index, "frame", frame);
  }

  @Override
  public void ensureField(String frame, String field, long min, long max) throws IndexClientException {
    post(frameOptions(true), true, "index", index, "frame", frame);

    ObjectNode fieldDef = mapper.createObjectNode();
    fieldDef.put("type", "int");
    fieldDef.put("min", min);
    fieldDef.put("max", max);
    post(fieldDef.toString(), true, "index", index, "frame", frame, "field", field);
  }

  private String frameOptions(boolean rangeEnabled) {
    ObjectNode res = mapper.createObjectNode();
    ObjectNode options = res.putObject("options");
    if (rangeEnabled)
      options.put("rangeEnabled", true);
    return res.toString();
  }

  @Override
  public void importBits(String frame, List<BitMutation> bits) throws IndexClientException {
    if (bits.isEmpty())
      return;
    post(setBitQuery(frame, bits), false, "index", index, "query");
  }

  @Override
  public void importValues(String frame, String field, List<ValueMutation> values) throws IndexClientException {
    if (values.isEmpty())
      return;
    post(setFieldValueQuery(frame, field, values), false, "index", index, "query");
  }

  @Override
  public JsonNode query(String query) throws IndexClientException {
    String body = post(query, false, "index", index, "query");
    try {
      return mapper.readTree(body);
    } catch (IOException e) {
      throw new IndexClientException("Could not parse query response: " + e.getMessage(), e);
    }
  }

  /* package */ static String setBitQuery(String frame, List<BitMutation> bits) {
    StringBuilder sb = new StringBuilder();
    for (BitMutation bit : bits) {
      sb.append("SetBit(frame=").append(quote(frame)).append(", rowID=").append(bit.getRow()).append(", columnID=")
          .append(bit.getColumn());
      if (bit.getTimestamp() != null)
        sb.append(", timestamp=\"").append(TIMESTAMP_FORMAT.format(bit.getTimestamp())).append("\"");
      sb.append(")");
    }
    return sb.toString();
  }

  /* package */ static String setFieldValueQuery(String frame, String field, List<ValueMutation> values) {
    StringBuilder sb = new StringBuilder();
    for (ValueMutation value : values)
      sb.append("SetFieldValue(frame=").append(quote(frame)).append(", columnID=").append(value.getColumn())
          .append(", ").append(field).append("=").append(value.getValue()).append(")");
    return sb.toString();
  }

  /* package */ static String quote(String value) {
    return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
  }

  private String post(String body, boolean acceptConflict, String... pathSegments) throws IndexClientException {
    URI uri = uri(pathSegments);
    HttpPost request = new HttpPost(uri);
    request.setEntity(new StringEntity(body, ContentType.APPLICATION_JSON.withCharset(StandardCharsets.UTF_8)));

    try {
      return httpClient.execute(request, response -> {
        String responseBody = (response.getEntity() != null) ? EntityUtils.toString(response.getEntity()) : "";
        int code = response.getCode();
        if (code >= HttpStatus.SC_SUCCESS && code < HttpStatus.SC_REDIRECTION)
          return responseBody;
        if (acceptConflict && code == CONFLICT) {
          logger.trace("Resource at {} exists already.", uri);
          return responseBody;
        }
        throw new IndexServerResponseException(
            "Index server responded with " + code + " to request to " + uri + ": " + responseBody);
      });
    } catch (IndexServerResponseException e) {
      throw new IndexClientException(e.getMessage(), e);
    } catch (IOException e) {
      throw new IndexClientException("Could not send request to " + uri + ": " + e.getMessage(), e);
    }
  }

  /**
   * URI of the next host with the given path segments, each one percent-encoded.
   */
  private URI uri(String... pathSegments) throws IndexClientException {
    String baseUri = baseUris.get(Math.floorMod(nextHost.getAndIncrement(), baseUris.size()));
    try {
      return new URIBuilder(baseUri).appendPathSegments(pathSegments).build();
    } catch (URISyntaxException e) {
      throw new IndexClientException("Could not build URI for " + baseUri + " and " + Arrays.toString(pathSegments),
          e);
    }
  }

  @Override
  public void close() throws IOException {
    httpClient.close();
  }

  /** Error response, transported through the response handler. */
  private static class IndexServerResponseException extends IOException {
    private static final long serialVersionUID = 1L;

    public IndexServerResponseException(String msg) {
      super(msg);
    }
  }
}
