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
package org.apache.hc.websocket.core.frame;

import static org.apache.hc.websocket.core.frame.FrameHeaderBits.FIN;
import static org.apache.hc.websocket.core.frame.FrameHeaderBits.LENGTH_MASK;
import static org.apache.hc.websocket.core.frame.FrameHeaderBits.MASK_BIT;
import static org.apache.hc.websocket.core.frame.FrameHeaderBits.OPCODE_MASK;
import static org.apache.hc.websocket.core.frame.FrameHeaderBits.PAYLOAD_BYTE_MAX;
import static org.apache.hc.websocket.core.frame.FrameHeaderBits.PAYLOAD_LONG;
import static org.apache.hc.websocket.core.frame.FrameHeaderBits.PAYLOAD_SHORT;
import static org.apache.hc.websocket.core.frame.FrameHeaderBits.RSV1;
import static org.apache.hc.websocket.core.frame.FrameHeaderBits.RSV2;
import static org.apache.hc.websocket.core.frame.FrameHeaderBits.RSV3;

import java.nio.ByteBuffer;

import org.apache.hc.websocket.api.CloseCode;
import org.apache.hc.websocket.core.close.WebSocketProtocolException;

/**
 * Incremental RFC 6455 frame decoder.
 * <p>
 * Frames of either role are accepted; the masking key, if any, is kept on the
 * decoded frame. Fragmentation of control frames is left to the session to judge.
 * </p>
 *
 * @since 1.0
 */
public final class WebSocketFrameDecoder {

    private final int maxFrameSize;

    /**
     * @param maxFrameSize maximum payload length of a single frame; {@code 0} disables the limit
     */
    public WebSocketFrameDecoder(final int maxFrameSize) {
        this.maxFrameSize = maxFrameSize;
    }

    public int getMaxFrameSize() {
        return maxFrameSize;
    }

    /**
     * Decodes one frame from {@code in}.
     *
     * @return the frame, or {@code null} if {@code in} does not hold a complete frame yet,
     * in which case its position is left unchanged
     * @throws WebSocketProtocolException if the frame violates the protocol or the size limit
     */
    public WebSocketFrame decode(final ByteBuffer in) {
        in.mark();
        if (in.remaining() < 2) {
            in.reset();
            return null;
        }
        final int b0 = in.get() & 0xFF;
        final int b1 = in.get() & 0xFF;

        final boolean fin = (b0 & FIN) != 0;
        final int rsv = b0 & (RSV1 | RSV2 | RSV3);
        final int opcode = b0 & OPCODE_MASK;
        if (rsv != 0) {
            throw new WebSocketProtocolException(CloseCode.PROTOCOL_ERROR, "RSV bits set without extension");
        }

        final boolean masked = (b1 & MASK_BIT) != 0;
        long len = b1 & LENGTH_MASK;
        if (len == PAYLOAD_SHORT) {
            if (in.remaining() < 2) {
                in.reset();
                return null;
            }
            len = in.getShort() & 0xFFFF;
        } else if (len == PAYLOAD_LONG) {
            if (in.remaining() < 8) {
                in.reset();
                return null;
            }
            len = in.getLong();
            if (len < 0) {
                throw new WebSocketProtocolException(CloseCode.PROTOCOL_ERROR, "Negative payload length");
            }
        }

        if (Opcode.isControl(opcode) && len > PAYLOAD_BYTE_MAX) {
            throw new WebSocketProtocolException(CloseCode.PROTOCOL_ERROR, "Control frame too large: " + len);
        }
        if (len > Integer.MAX_VALUE || maxFrameSize > 0 && len > maxFrameSize) {
            throw new WebSocketProtocolException(CloseCode.MESSAGE_TOO_BIG, "Frame too large: " + len);
        }

        byte[] maskingKey = null;
        if (masked) {
            if (in.remaining() < 4) {
                in.reset();
                return null;
            }
            maskingKey = new byte[4];
            in.get(maskingKey);
        }
        if (in.remaining() < len) {
            in.reset();
            return null;
        }

        final ByteBuffer payload = ByteBuffer.allocate((int) len);
        final int oldLimit = in.limit();
        in.limit(in.position() + (int) len);
        payload.put(in);
        in.limit(oldLimit);
        payload.flip();
        return new WebSocketFrame(fin, rsv, opcode, maskingKey, payload.asReadOnlyBuffer());
    }
}
