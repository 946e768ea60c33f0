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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

import org.apache.hc.core5.http.Method;
import org.apache.hc.core5.http.ProtocolException;
import org.apache.hc.core5.http.message.BasicHttpRequest;
import org.junit.jupiter.api.Test;

class Http1HandshakeCodecTest {

    private static ByteBuffer received(final String s) {
        final ByteBuffer buf = ByteBuffer.allocate(512);
        buf.put(s.getBytes(StandardCharsets.ISO_8859_1));
        return buf;
    }

    @Test
    void encodeRequest_writesRequestLineAndHeaders() {
        final BasicHttpRequest request = new BasicHttpRequest(Method.GET, "/chat?x=1");
        request.addHeader("Host", "example.com");
        request.addHeader("Content-Length", "0");

        final ByteBuffer out = Http1HandshakeCodec.encodeRequest(request);
        assertEquals("GET /chat?x=1 HTTP/1.1\r\nHost: example.com\r\nContent-Length: 0\r\n\r\n",
                StandardCharsets.ISO_8859_1.decode(out).toString());
    }

    @Test
    void tryParse_incompleteHead_returnsNull() throws Exception {
        final ByteBuffer in = received("HTTP/1.1 101 Switching Protocols\r\nUpgrade: websocket\r\n");
        assertNull(Http1HandshakeCodec.tryParse(in));
        assertNull(Http1HandshakeCodec.tryParse(ByteBuffer.allocate(16)));
        assertEquals(54, in.position());
    }

    @Test
    void tryParse_completeHead_withLeftover() throws Exception {
        final ByteBuffer in = received("HTTP/1.1 101 Switching Protocols\r\n"
                + "Upgrade: websocket\r\nConnection: Upgrade\r\n\r\n\u0081\u0002hi");

        final Http1HandshakeCodec.Response response = Http1HandshakeCodec.tryParse(in);
        assertNotNull(response);
        assertEquals(101, response.head.getCode());
        assertEquals("Switching Protocols", response.head.getReasonPhrase());
        assertEquals("websocket", response.head.getFirstHeader("upgrade").getValue());
        assertArrayEquals(new byte[] {(byte) 0x81, 2, 'h', 'i'}, response.leftover);
    }

    @Test
    void tryParse_malformedStatusLine_fails() {
        final ByteBuffer in = received("NOT-HTTP\r\n\r\n");
        assertThrows(ProtocolException.class, () -> Http1HandshakeCodec.tryParse(in));
    }
}
