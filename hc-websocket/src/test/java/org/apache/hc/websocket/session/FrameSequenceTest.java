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
package org.apache.hc.websocket.session;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;

import org.apache.hc.websocket.core.frame.Opcode;
import org.apache.hc.websocket.core.frame.WebSocketFrame;
import org.junit.jupiter.api.Test;

class FrameSequenceTest {

    private static WebSocketFrame frame(final int opcode, final boolean fin, final byte[] key, final byte... data) {
        return WebSocketFrame.create(fin, opcode, key, ByteBuffer.wrap(data));
    }

    @Test
    void binary_concatenatesInOrder_and_unmasks() throws Exception {
        final FrameSequence seq = new FrameSequence(Opcode.BINARY);
        seq.append(frame(Opcode.BINARY, false, new byte[] {1, 2, 3, 4}, (byte) 1, (byte) 2));
        seq.append(frame(Opcode.CONT, true, null, (byte) 3));

        final ByteBuffer out = seq.finishBinary();
        final byte[] bytes = new byte[out.remaining()];
        out.get(bytes);
        assertArrayEquals(new byte[] {1, 2, 3}, bytes);
        assertEquals(Opcode.BINARY, seq.getType());
    }

    @Test
    void text_multiByteSplitAcrossFragments() throws Exception {
        final byte[] utf8 = "café €".getBytes(StandardCharsets.UTF_8);
        final FrameSequence seq = new FrameSequence(Opcode.TEXT);
        // split inside both the 2 byte and the 3 byte sequence
        seq.append(WebSocketFrame.create(false, Opcode.TEXT, null, ByteBuffer.wrap(utf8, 0, 4)));
        seq.append(WebSocketFrame.create(false, Opcode.CONT, null, ByteBuffer.wrap(utf8, 4, 3)));
        seq.append(WebSocketFrame.create(true, Opcode.CONT, null, ByteBuffer.wrap(utf8, 7, utf8.length - 7)));

        assertEquals("café €", seq.finishText());
    }

    @Test
    void text_malformedByte_isRejected() {
        final FrameSequence seq = new FrameSequence(Opcode.TEXT);
        assertThrows(CharacterCodingException.class,
                () -> seq.append(frame(Opcode.TEXT, true, null, (byte) 'a', (byte) 0xFF)));
    }

    @Test
    void text_truncatedSequenceAtEnd_isRejected() throws Exception {
        final FrameSequence seq = new FrameSequence(Opcode.TEXT);
        seq.append(frame(Opcode.TEXT, true, null, (byte) 'a', (byte) 0xC3));
        assertThrows(CharacterCodingException.class, seq::finishText);
    }
}
