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
import java.net.URI;
import java.util.concurrent.TimeUnit;

import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.io.entity.ByteArrayEntity;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;

/**
 * Forwards HTTP requests to the upstream index server.
 *
 * @author Bastian Gloeckle
 */
public class UpstreamForwarder implements Closeable {
  private final String baseUri;
  private final CloseableHttpClient httpClient;

  /**
   * @param upstream
   *          "host:port" of the upstream server, optionally prefixed with a scheme.
   */
  public UpstreamForwarder(String upstream) {
    String uri = upstream.trim();
    if (!uri.startsWith("http://") && !uri.startsWith("https://"))
      uri = "http://" + uri;
    while (uri.endsWith("/"))
      uri = uri.substring(0, uri.length() - 1);
    this.baseUri = uri;

    httpClient = HttpClients.custom() //
        .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create() //
            .setMaxConnTotal(50) //
            .setMaxConnPerRoute(50) //
            .build()) //
        .setDefaultRequestConfig(RequestConfig.custom() //
            .setConnectionRequestTimeout(Timeout.ofSeconds(10)) //
            .setResponseTimeout(Timeout.ofMinutes(5)) //
            .build()) //
        .evictIdleConnections(Timeout.of(1, TimeUnit.MINUTES)) //
        .disableRedirectHandling() //
        .build();
  }

  /**
   * @param pathAndQuery
   *          Path of the request, including the query string if any.
   * @param contentType
   *          Content-Type header of the request or <code>null</code>.
   * @throws IOException
   *           if the upstream server cannot be reached.
   */
  public UpstreamResponse forward(String method, String pathAndQuery, byte[] body, String contentType)
      throws IOException {
    HttpUriRequestBase request = new HttpUriRequestBase(method, URI.create(baseUri + pathAndQuery));
    if (body.length > 0)
      request.setEntity(new ByteArrayEntity(body, (contentType != null) ? ContentType.parse(contentType) : null));

    return httpClient.execute(request, response -> {
      byte[] responseBody = (response.getEntity() != null) ? EntityUtils.toByteArray(response.getEntity()) : new byte[0];
      Header responseContentType = response.getFirstHeader(HttpHeaders.CONTENT_TYPE);
      return new UpstreamResponse(response.getCode(),
          (responseContentType != null) ? responseContentType.getValue() : null, responseBody);
    });
  }

  public String getBaseUri() {
    return baseUri;
  }

  @Override
  public void close() throws IOException {
    httpClient.close();
  }

  /**
   * Response of the upstream server.
   */
  public static class UpstreamResponse {
    private final int status;
    private final String contentType;
    private final byte[] body;

    public UpstreamResponse(int status, String contentType, byte[] body) {
      this.status = status;
      this.contentType = contentType;
      this.body = body;
    }

    public int getStatus() {
      return status;
    }

    /**
     * @return Content-Type header or <code>null</code>.
     */
    public String getContentType() {
      return contentType;
    }

    public byte[] getBody() {
      return body;
    }

    public boolean isSuccess() {
      return status >= 200 && status < 300;
    }
  }
}
