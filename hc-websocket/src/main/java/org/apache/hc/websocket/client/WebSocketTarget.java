/*
 * ====================================================================
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 * ====================================================================
 *
 * This software consists of voluntary contributions made by many
 * individuals on behalf of the Apache Software Foundation.  For more
 * information on the Apache Software Foundation, please see
 * <http://www.apache.org/>.
 *
 */
package org.apache.hc.websocket.client;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

import org.apache.hc.core5.annotation.Contract;
import org.apache.hc.core5.annotation.ThreadingBehavior;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.http.URIScheme;
import org.apache.hc.core5.util.TextUtils;

/**
 * Endpoint of a WebSocket connection with defaults applied: scheme {@code ws},
 * port 80 for {@code ws} and 443 for {@code wss}, path {@code /}.
 *
 * @since 1.0
 */
@Contract(threading = ThreadingBehavior.IMMUTABLE)
public final class WebSocketTarget {

    public static final String WS = "ws";
    public static final String WSS = "wss";

    private final String scheme;
    private final String host;
    private final int port;
    private final String path;

    private WebSocketTarget(final String scheme, final String host, final int port, final String path) {
        this.scheme = scheme;
        this.host = host;
        this.port = port;
        this.path = path;
    }

    /**
     * @param scheme {@code ws}, {@code wss} or {@code null} for {@code ws}
     * @param host   host name or address
     * @param port   port, or a value {@code <= 0} for the scheme default
     * @param path   request target including any query, or {@code null} for {@code /}
     * @throws InvalidUrlException if the scheme is unknown or the host is missing
     */
    public static WebSocketTarget of(final String scheme, final String host, final int port, final String path) {
        final String s = scheme != null ? scheme.toLowerCase(Locale.ROOT) : WS;
        if (!WS.equals(s) && !WSS.equals(s)) {
            throw new InvalidUrlException("Unsupported scheme: " + scheme);
        }
        if (TextUtils.isBlank(host)) {
            throw new InvalidUrlException("Host is missing");
        }
        if (port > 0xFFFF) {
            throw new InvalidUrlException("Port out of range: " + port);
        }
        final int p = port > 0 ? port : defaultPort(s);
        final String target;
        if (TextUtils.isEmpty(path)) {
            target = "/";
        } else if (path.charAt(0) != '/') {
            target = "/" + path;
        } else {
            target = path;
        }
        return new WebSocketTarget(s, host, p, target);
    }

    public static WebSocketTarget of(final URI uri) {
        if (uri.getHost() == null) {
            throw new InvalidUrlException("Host is missing: " + uri);
        }
        final String rawPath = uri.getRawPath();
        final String query = uri.getRawQuery();
        final StringBuilder buf = new StringBuilder();
        buf.append(TextUtils.isEmpty(rawPath) ? "/" : rawPath);
        if (query != null) {
            buf.append('?').append(query);
        }
        return of(uri.getScheme(), uri.getHost(), uri.getPort(), buf.toString());
    }

    /**
     * Parses a {@code ws://} or {@code wss://} URL.
     *
     * @throws InvalidUrlException if the URL is malformed or incomplete
     */
    public static WebSocketTarget parse(final String url) {
        if (url == null) {
            throw new InvalidUrlException("URL is null");
        }
        final URI uri;
        try {
            uri = new URI(url);
        } catch (final URISyntaxException ex) {
            throw new InvalidUrlException("Invalid URL: " + url, ex);
        }
        return of(uri);
    }

    static int defaultPort(final String scheme) {
        return WSS.equals(scheme) ? 443 : 80;
    }

    public String getScheme() {
        return scheme;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getPath() {
        return path;
    }

    public boolean isSecure() {
        return WSS.equals(scheme);
    }

    /**
     * @return value of the {@code Host} header: the port is omitted when it is the scheme default
     */
    public String getHostHeader() {
        return port == defaultPort(scheme) ? host : host + ":" + port;
    }

    /**
     * @return the endpoint as an HTTP host, {@code https} for secure targets
     */
    public HttpHost toHttpHost() {
        return new HttpHost(isSecure() ? URIScheme.HTTPS.id : URIScheme.HTTP.id, host, port);
    }

    @Override
    public String toString() {
        return scheme + "://" + getHostHeader() + path;
    }
}
