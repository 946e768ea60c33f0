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
import static org.apache.hc.websocket.core.frame.FrameHeaderBits.MASK_BIT;
import static org.apache.hc.websocket.core.frame.FrameHeaderBits.PAYLOAD_BYTE_MAX;
import static org.apache.hc.websocket.core.frame.FrameHeaderBits.PAYLOAD_LONG;
import static org.apache.hc.websocket.core.frame.FrameHeaderBits.PAYLOAD_SHORT;
import static org.apache.hc.websocket.core.frame.FrameHeaderBits.RSV1;
import static org.apache.hc.websocket.core.frame.FrameHeaderBits.RSV2;
import static org.apache.hc.websocket.core.frame.FrameHeaderBits.RSV3;

import java.nio.ByteBuffer;

import org.apache.hc.core5.util.Args;

/**
 * Serializes {@link WebSocketFrame}s to their RFC 6455 wire form.
 *
 * @since 1.0
 */
public final class WebSocketFrameEncoder {

    public static final WebSocketFrameEncoder INSTANCE = new WebSocketFrameEncoder();

    public ByteBuffer encode(final WebSocketFrame frame) {
        Args.notNull(frame, "Frame");
        final int len = frame.getPayloadLength();
        final int hdrExtra = len <= PAYLOAD_BYTE_MAX ? 0 : len <= 0xFFFF ? 2 : 8;
        final int maskLen = frame.isMasked() ? 4 : 0;
        final ByteBuffer out = ByteBuffer.allocate(2 + hdrExtra + maskLen + len);
        encodeInto(frame, out);
        out.flip();
        return out;
    }

    /**
     * Writes the frame into {@code out}, which must have enough space remaining.
     */
    public ByteBuffer encodeInto(final WebSocketFrame frame, final ByteBuffer out) {
        final int len = frame.getPayloadLength();
        final int finBit = frame.isFin() ? FIN : 0;
        out.put((byte) (finBit | (frame.getRsv() & (RSV1 | RSV2 | RSV3)) | (frame.getOpcode() & 0x0F)));

        final int maskBit = frame.isMasked() ? MASK_BIT : 0;
        if (len <= PAYLOAD_BYTE_MAX) {
            out.put((byte) (maskBit | len));
        } else if (len <= 0xFFFF) {
            out.put((byte) (maskBit | PAYLOAD_SHORT));
            out.putShort((short) len);
        } else {
            out.put((byte) (maskBit | PAYLOAD_LONG));
            out.putLong(len);
        }
        if (frame.isMasked()) {
            out.put(frame.getMaskingKey());
        }
        out.put(frame.getPayload());
        return out;
    }
}
