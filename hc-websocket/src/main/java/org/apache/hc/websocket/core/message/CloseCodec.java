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

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

import org.apache.hc.core5.annotation.Internal;

/**
 * Helpers for RFC 6455 CLOSE payloads.
 */
@Internal
public final class CloseCodec {

    /** Reason bytes that fit in a control frame after the 2 byte code. */
    public static final int MAX_REASON_BYTES = 123;

    private CloseCodec() {
    }

    /**
     * Builds a CLOSE payload: big-endian code followed by the UTF-8 reason, truncated if needed.
     */
    public static ByteBuffer encode(final int code, final String reason) {
        final byte[] r = truncateReasonUtf8(reason).getBytes(StandardCharsets.UTF_8);
        final ByteBuffer buf = ByteBuffer.allocate(2 + r.length);
        buf.put((byte) (code >> 8 & 0xFF));
        buf.put((byte) (code & 0xFF));
        buf.put(r);
        buf.flip();
        return buf;
    }

    /**
     * @return the close code, or {@code -1} if the payload holds fewer than 2 bytes
     */
    public static int readCloseCode(final ByteBuffer payload) {
        if (payload == null || payload.remaining() < 2) {
            return -1;
        }
        final int p = payload.position();
        return (payload.get(p) & 0xFF) << 8 | payload.get(p + 1) & 0xFF;
    }

    public static String readCloseReason(final ByteBuffer payload) {
        if (payload == null || payload.remaining() <= 2) {
            return "";
        }
        final ByteBuffer dup = payload.duplicate();
        dup.position(dup.position() + 2);
        return StandardCharsets.UTF_8.decode(dup).toString();
    }

    // 1005, 1006 and 1015 are reserved for local use
    private static boolean isForbiddenOnWire(final int code) {
        return code == 1005 || code == 1006 || code == 1015;
    }

    private static boolean isRfcDefined(final int code) {
        switch (code) {
            case 1000:
            case 1001:
            case 1002:
            case 1003:
            case 1007:
            case 1008:
            case 1009:
            case 1010:
            case 1011:
                return true;
            default:
                return false;
        }
    }

    private static boolean isAppRange(final int code) {
        return code >= 3000 && code <= 4999;
    }

    /**
     * Validates a code about to be put on the wire.
     */
    public static boolean isValidToSend(final int code) {
        return code >= 0 && !isForbiddenOnWire(code) && (isRfcDefined(code) || isAppRange(code));
    }

    /**
     * Validates a code parsed from the wire.
     */
    public static boolean isValidToReceive(final int code) {
        return !isForbiddenOnWire(code) && (isRfcDefined(code) || isAppRange(code));
    }

    /**
     * Truncates to at most 123 UTF-8 bytes without splitting a code point.
     */
    public static String truncateReasonUtf8(final String reason) {
        if (reason == null || reason.isEmpty()) {
            return "";
        }
        if (reason.getBytes(StandardCharsets.UTF_8).length <= MAX_REASON_BYTES) {
            return reason;
        }
        int i = 0;
        int byteCount = 0;
        while (i < reason.length()) {
            final int cp = reason.codePointAt(i);
            final int n = cp < 0x80 ? 1 : cp < 0x800 ? 2 : cp < 0x10000 ? 3 : 4;
            if (byteCount + n > MAX_REASON_BYTES) {
                break;
            }
            byteCount += n;
            i += Character.charCount(cp);
        }
        return reason.substring(0, i);
    }
}
