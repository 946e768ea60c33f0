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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Locale;

import org.apache.hc.core5.http.EntityDetails;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpException;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.HttpRequest;
import org.apache.hc.core5.http.HttpRequestInterceptor;
import org.apache.hc.core5.http.HttpResponse;
import org.apache.hc.core5.http.ProtocolException;
import org.apache.hc.core5.http.protocol.HttpContext;
import org.apache.hc.core5.util.Args;

/**
 * Offer of an upgrade to the WebSocket protocol (RFC 6455 section 4.1).
 * <p>
 * As a request interceptor it adds the upgrade headers to the handshake request;
 * {@link #validate(HttpResponse)} then checks the server's answer against the key
 * offered.
 * </p>
 *
 * @since 1.0
 */
public final class WebSocketUpgradeOffer implements HttpRequestInterceptor {

    public static final String SEC_WEBSOCKET_KEY = "Sec-WebSocket-Key";
    public static final String SEC_WEBSOCKET_VERSION = "Sec-WebSocket-Version";
    public static final String SEC_WEBSOCKET_ACCEPT = "Sec-WebSocket-Accept";
    public static final String VERSION = "13";

    private static final String GUID = "258EAFA5-E914-47DA-95CA-C5AB0DC85B11";
    private static final SecureRandom RANDOM = new SecureRandom();

    private final String key;

    public WebSocketUpgradeOffer() {
        this(randomKey());
    }

    WebSocketUpgradeOffer(final String key) {
        this.key = Args.notBlank(key, "Key");
    }

    public String getKey() {
        return key;
    }

    @Override
    public void process(
            final HttpRequest request,
            final EntityDetails entity,
            final HttpContext context) throws HttpException, IOException {
        request.setHeader(HttpHeaders.UPGRADE, "websocket");
        request.setHeader(HttpHeaders.CONNECTION, "Upgrade");
        request.setHeader(SEC_WEBSOCKET_KEY, key);
        request.setHeader(SEC_WEBSOCKET_VERSION, VERSION);
    }

    /**
     * Checks the headers of a {@code 101} response.
     *
     * @throws ProtocolException if the server did not accept this offer
     */
    public void validate(final HttpResponse response) throws ProtocolException {
        final Header upgrade = response.getFirstHeader(HttpHeaders.UPGRADE);
        if (upgrade == null || !"websocket".equalsIgnoreCase(upgrade.getValue().trim())) {
            throw new ProtocolException("Missing or invalid Upgrade header");
        }
        final Header connection = response.getFirstHeader(HttpHeaders.CONNECTION);
        if (connection == null || !connection.getValue().toLowerCase(Locale.ROOT).contains("upgrade")) {
            throw new ProtocolException("Missing or invalid Connection header");
        }
        final Header accept = response.getFirstHeader(SEC_WEBSOCKET_ACCEPT);
        if (accept == null || !computeAccept(key).equals(accept.getValue().trim())) {
            throw new ProtocolException("Invalid Sec-WebSocket-Accept header");
        }
    }

    static String computeAccept(final String key) {
        try {
            final MessageDigest sha1 = MessageDigest.getInstance("SHA-1");
            final byte[] digest = sha1.digest((key + GUID).getBytes(StandardCharsets.ISO_8859_1));
            return Base64.getEncoder().encodeToString(digest);
        } catch (final NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-1 not available", ex);
        }
    }

    private static String randomKey() {
        final byte[] rnd = new byte[16];
        RANDOM.nextBytes(rnd);
        return Base64.getEncoder().encodeToString(rnd);
    }
}
