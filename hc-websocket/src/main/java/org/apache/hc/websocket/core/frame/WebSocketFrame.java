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

import java.nio.ByteBuffer;

import org.apache.hc.core5.annotation.Contract;
import org.apache.hc.core5.annotation.ThreadingBehavior;
import org.apache.hc.core5.util.Args;

/**
 * A single RFC 6455 frame.
 * <p>
 * The payload is kept as carried on the wire: when a masking key is present the
 * payload bytes are masked. Use {@link #unmaskedPayload()} to obtain application data.
 * </p>
 *
 * @since 1.0
 */
@Contract(threading = ThreadingBehavior.IMMUTABLE)
public final class WebSocketFrame {

    private final boolean fin;
    private final int rsv;
    private final int opcode;
    private final byte[] maskingKey;
    private final ByteBuffer payload;

    WebSocketFrame(final boolean fin, final int rsv, final int opcode, final byte[] maskingKey, final ByteBuffer payload) {
        this.fin = fin;
        this.rsv = rsv;
        this.opcode = opcode;
        this.maskingKey = maskingKey;
        this.payload = payload;
    }

    /**
     * Creates a frame carrying the given application data, masked with
     * {@code maskingKey} when one is given.
     *
     * @param fin        final fragment flag
     * @param opcode     frame opcode (0x0-0xF)
     * @param maskingKey 4-byte masking key or {@code null} for an unmasked frame
     * @param data       application data; may be {@code null} for an empty payload
     */
    public static WebSocketFrame create(final boolean fin, final int opcode, final byte[] maskingKey, final ByteBuffer data) {
        Args.check(opcode >= 0 && opcode <= 0x0F, "Opcode out of range: %s", opcode);
        if (maskingKey != null) {
            Args.check(maskingKey.length == 4, "Masking key must be 4 bytes");
        }
        final ByteBuffer src = data != null ? data.asReadOnlyBuffer() : ByteBuffer.allocate(0);
        final ByteBuffer wire = ByteBuffer.allocate(src.remaining());
        wire.put(src);
        wire.flip();
        if (maskingKey != null) {
            toggleMask(wire, maskingKey);
        }
        return new WebSocketFrame(fin, 0, opcode, maskingKey != null ? maskingKey.clone() : null, wire.asReadOnlyBuffer());
    }

    static void toggleMask(final ByteBuffer buf, final byte[] key) {
        final int pos = buf.position();
        final int lim = buf.limit();
        for (int i = pos; i < lim; i++) {
            buf.put(i, (byte) (buf.get(i) ^ key[(i - pos) & 3]));
        }
    }

    public boolean isFin() {
        return fin;
    }

    public int getRsv() {
        return rsv;
    }

    public int getOpcode() {
        return opcode;
    }

    public boolean isMasked() {
        return maskingKey != null;
    }

    /**
     * @return a copy of the masking key or {@code null} when the frame is not masked
     */
    public byte[] getMaskingKey() {
        return maskingKey != null ? maskingKey.clone() : null;
    }

    public int getPayloadLength() {
        return payload.remaining();
    }

    /**
     * @return read-only view of the payload as carried on the wire
     */
    public ByteBuffer getPayload() {
        return payload.asReadOnlyBuffer();
    }

    /**
     * @return a fresh buffer with the payload with masking removed
     */
    public ByteBuffer unmaskedPayload() {
        final ByteBuffer src = payload.asReadOnlyBuffer();
        final ByteBuffer out = ByteBuffer.allocate(src.remaining());
        out.put(src);
        out.flip();
        if (maskingKey != null) {
            toggleMask(out, maskingKey);
        }
        return out;
    }

    @Override
    public String toString() {
        return "[" + Opcode.name(opcode) + (fin ? " fin" : "") + (maskingKey != null ? " masked" : "")
                + " len=" + payload.remaining() + "]";
    }
}
