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
package org.apache.hc.websocket.api;

import java.nio.ByteBuffer;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiConsumer;

import org.apache.hc.websocket.session.PeerRole;

/**
 * An established WebSocket connection as seen by application code.
 *
 * <h3>Threading</h3>
 * <p>Each connection is bound to one I/O dispatch thread. Inbound messages,
 * registered handlers and completion of the returned futures run on that thread.
 * Handlers must not block.</p>
 *
 * <h3>Masking</h3>
 * <p>Frames sent by a {@link PeerRole#CLIENT} endpoint carry a fresh random masking
 * key; frames sent by a {@link PeerRole#SERVER} endpoint are not masked.</p>
 *
 * <h3>Close handshake</h3>
 * <p>{@link #close(int, String)} sends a CLOSE frame once. Later calls complete
 * immediately without sending anything. {@link #onClose()} completes when the
 * underlying connection has been torn down.</p>
 *
 * @since 1.0
 */
public interface WebSocket {

    /**
     * Sends a complete text message encoded as UTF-8.
     *
     * @return a future completed once the frame has been written
     */
    CompletableFuture<Void> sendText(CharSequence text);

    /**
     * Sends a complete binary message.
     *
     * @return a future completed once the frame has been written
     */
    CompletableFuture<Void> sendBinary(ByteBuffer data);

    /**
     * Sends a single raw frame.
     *
     * @param data   payload, may be {@code null}
     * @param opcode frame opcode, see {@link org.apache.hc.websocket.core.frame.Opcode}
     * @param fin    final fragment flag
     * @return a future completed once the frame has been written
     */
    CompletableFuture<Void> send(ByteBuffer data, int opcode, boolean fin);

    /**
     * Starts the close handshake with {@link CloseCode#GOING_AWAY}.
     */
    CompletableFuture<Void> close();

    CompletableFuture<Void> close(int code);

    /**
     * Starts the close handshake.
     *
     * @param code   close code valid on the wire
     * @param reason optional reason, truncated to 123 UTF-8 bytes
     * @return a future completed once the CLOSE frame has been written, or immediately
     * if the session is already closed
     * @throws IllegalArgumentException if {@code code} may not be sent on the wire
     */
    CompletableFuture<Void> close(int code, String reason);

    /**
     * Registers the text message handler, replacing any previous one.
     */
    void onText(BiConsumer<WebSocket, String> handler);

    /**
     * Registers the binary message handler, replacing any previous one.
     */
    void onBinary(BiConsumer<WebSocket, ByteBuffer> handler);

    /**
     * @return future completed when the underlying connection is gone
     */
    CompletableFuture<Void> onClose();

    /**
     * @return {@code true} once a close has been sent or the connection is gone
     */
    boolean isClosed();

    PeerRole getRole();
}
