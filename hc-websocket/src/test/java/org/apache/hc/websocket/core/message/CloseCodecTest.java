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
package org.apache.hc.websocket.core.message;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

class CloseCodecTest {

    @Test
    void encode_then_read() {
        final ByteBuffer payload = CloseCodec.encode(1000, "bye");
        assertEquals(5, payload.remaining());
        assertEquals(1000, CloseCodec.readCloseCode(payload));
        assertEquals("bye", CloseCodec.readCloseReason(payload));
        assertEquals(5, payload.remaining());
    }

    @Test
    void shortPayload_hasNoCode() {
        assertEquals(-1, CloseCodec.readCloseCode(ByteBuffer.allocate(0)));
        assertEquals(-1, CloseCodec.readCloseCode(ByteBuffer.wrap(new byte[] {3})));
        assertEquals(-1, CloseCodec.readCloseCode(null));
        assertEquals("", CloseCodec.readCloseReason(ByteBuffer.wrap(new byte[] {3, (byte) 0xE8})));
    }

    @Test
    void validity_rules() {
        assertTrue(CloseCodec.isValidToSend(1000));
        assertTrue(CloseCodec.isValidToSend(1011));
        assertTrue(CloseCodec.isValidToSend(3000));
        assertTrue(CloseCodec.isValidToSend(4999));
        assertFalse(CloseCodec.isValidToSend(1005));
        assertFalse(CloseCodec.isValidToSend(1006));
        assertFalse(CloseCodec.isValidToSend(1015));
        assertFalse(CloseCodec.isValidToSend(1004));
        assertFalse(CloseCodec.isValidToSend(999));
        assertFalse(CloseCodec.isValidToSend(5000));
        assertFalse(CloseCodec.isValidToReceive(1005));
        assertTrue(CloseCodec.isValidToReceive(1001));
    }

    @Test
    void reason_isTruncated_onCodePointBoundary() {
        final StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 80; i++) {
            sb.append('é');
        }
        final String truncated = CloseCodec.truncateReasonUtf8(sb.toString());
        assertEquals(61, truncated.length());
        assertTrue(truncated.getBytes(StandardCharsets.UTF_8).length <= 123);
        assertEquals(2 + 122, CloseCodec.encode(1000, sb.toString()).remaining());
    }
}
