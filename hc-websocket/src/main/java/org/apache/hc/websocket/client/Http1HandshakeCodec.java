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

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpRequest;
import org.apache.hc.core5.http.HttpResponse;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.message.BasicHttpResponse;
import org.apache.hc.core5.http.message.BasicLineParser;
import org.apache.hc.core5.http.message.StatusLine;
import org.apache.hc.core5.util.CharArrayBuffer;

/**
 * Minimal HTTP/1.1 codec for the upgrade exchange.
 */
final class Http1HandshakeCodec {

    private static final byte[] CRLFCRLF = "\r\n\r\n".getBytes(StandardCharsets.ISO_8859_1);

    private Http1HandshakeCodec() {
    }

    static ByteBuffer encodeRequest(final HttpRequest request) {
        final StringBuilder sb = new StringBuilder();
        sb.append(request.getMethod()).append(' ').append(request.getRequestUri()).append(" HTTP/1.1\r\n");
        for (final Header h : request.getHeaders()) {
            sb.append(h.getName()).append(": ").append(h.getValue()).append("\r\n");
        }
        sb.append("\r\n");
        return ByteBuffer.wrap(sb.toString().getBytes(StandardCharsets.ISO_8859_1));
    }

    /**
     * Tries to parse a complete response head from the bytes written so far into {@code in}
     * (positions {@code 0} to {@code in.position()}). The buffer is left untouched.
     *
     * @return the response, or {@code null} if the head is not complete yet
     * @throws ParseException if the head is malformed
     */
    static Response tryParse(final ByteBuffer in) throws ParseException {
        final int pos = in.position();
        if (pos <= 0) {
            return null;
        }
        final byte[] a = new byte[pos];
        final ByteBuffer dup = in.duplicate();
        dup.flip();
        dup.get(a);

        final int hdrEnd = indexOf(a, CRLFCRLF);
        if (hdrEnd < 0) {
            return null;
        }
        final String[] lines = new String(a, 0, hdrEnd, StandardCharsets.ISO_8859_1).split("\r\n");
        final StatusLine statusLine = BasicLineParser.INSTANCE.parseStatusLine(toBuffer(lines[0]));
        final BasicHttpResponse response = new BasicHttpResponse(statusLine.getStatusCode(), statusLine.getReasonPhrase());
        response.setVersion(statusLine.getProtocolVersion());
        for (int i = 1; i < lines.length; i++) {
            if (!lines[i].isEmpty()) {
                response.addHeader(BasicLineParser.INSTANCE.parseHeader(toBuffer(lines[i])));
            }
        }
        return new Response(response, Arrays.copyOfRange(a, hdrEnd + CRLFCRLF.length, a.length));
    }

    private static CharArrayBuffer toBuffer(final String line) {
        final CharArrayBuffer buf = new CharArrayBuffer(line.length());
        buf.append(line);
        return buf;
    }

    private static int indexOf(final byte[] hay, final byte[] needle) {
        outer:
        for (int i = 0; i <= hay.length - needle.length; i++) {
            for (int j = 0; j < needle.length; j++) {
                if (hay[i + j] != needle[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

    static final class Response {

        final HttpResponse head;
        final byte[] leftover;

        Response(final HttpResponse head, final byte[] leftover) {
            this.head = head;
            this.leftover = leftover != null ? leftover : new byte[0];
        }
    }
}
