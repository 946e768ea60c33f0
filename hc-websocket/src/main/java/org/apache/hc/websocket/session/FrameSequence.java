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

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

import org.apache.hc.core5.util.ByteArrayBuffer;
import org.apache.hc.websocket.core.frame.Opcode;
import org.apache.hc.websocket.core.frame.WebSocketFrame;

/**
 * Accumulates the fragments of one data message. Text is decoded as it arrives;
 * a multi-byte sequence split between fragments is carried over to the next append.
 */
final class FrameSequence {

    private final int type;
    private final ByteArrayBuffer binary;
    private final StringBuilder text;
    private final CharsetDecoder decoder;
    private ByteBuffer pending;

    FrameSequence(final int type) {
        this.type = type;
        if (type == Opcode.TEXT) {
            this.binary = null;
            this.text = new StringBuilder();
            this.decoder = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT);
        } else {
            this.binary = new ByteArrayBuffer(256);
            this.text = null;
            this.decoder = null;
        }
    }

    int getType() {
        return type;
    }

    /**
     * Appends the unmasked payload of {@code frame}.
     *
     * @throws CharacterCodingException if a text payload is not valid UTF-8
     */
    void append(final WebSocketFrame frame) throws CharacterCodingException {
        final ByteBuffer data = frame.unmaskedPayload();
        if (type == Opcode.TEXT) {
            decode(data, false);
        } else {
            binary.append(data.array(), data.arrayOffset() + data.position(), data.remaining());
        }
    }

    /**
     * Completes the text message.
     *
     * @throws CharacterCodingException if the message ends inside a multi-byte sequence
     */
    String finishText() throws CharacterCodingException {
        decode(ByteBuffer.allocate(0), true);
        final CharBuffer out = CharBuffer.allocate(4);
        final CoderResult result = decoder.flush(out);
        if (result.isError()) {
            result.throwException();
        }
        out.flip();
        text.append(out);
        return text.toString();
    }

    ByteBuffer finishBinary() {
        return ByteBuffer.wrap(binary.toByteArray());
    }

    private void decode(final ByteBuffer data, final boolean endOfInput) throws CharacterCodingException {
        final ByteBuffer in;
        if (pending != null) {
            in = ByteBuffer.allocate(pending.remaining() + data.remaining());
            in.put(pending);
            in.put(data);
            in.flip();
            pending = null;
        } else {
            in = data;
        }
        // UTF-8 never yields more chars than bytes
        final CharBuffer out = CharBuffer.allocate(in.remaining() + 1);
        final CoderResult result = decoder.decode(in, out, endOfInput);
        if (result.isError()) {
            result.throwException();
        }
        out.flip();
        text.append(out);
        if (in.hasRemaining()) {
            pending = ByteBuffer.allocate(in.remaining());
            pending.put(in);
            pending.flip();
        }
    }
}
