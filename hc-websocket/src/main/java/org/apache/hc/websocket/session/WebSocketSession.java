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
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;

import org.apache.hc.core5.util.Args;
import org.apache.hc.websocket.api.CloseCode;
import org.apache.hc.websocket.api.WebSocket;
import org.apache.hc.websocket.core.close.WebSocketProtocolException;
import org.apache.hc.websocket.core.frame.Opcode;
import org.apache.hc.websocket.core.frame.WebSocketFrame;
import org.apache.hc.websocket.core.message.CloseCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * WebSocket endpoint bound to a single {@link WebSocketTransport}.
 * <p>
 * {@link #handleIncoming(WebSocketFrame)} must be called from the connection's I/O
 * thread, one frame at a time and in arrival order. Fragmented messages are
 * reassembled before being handed to the registered handler. PINGs are answered,
 * the close handshake is completed on the peer's behalf, and framing violations
 * close the session with the matching status code.
 * </p>
 *
 * @since 1.0
 */
public final class WebSocketSession implements WebSocket {

    private static final Logger LOG = LoggerFactory.getLogger(WebSocketSession.class);

    private static final BiConsumer<WebSocket, String> NO_TEXT = (ws, text) -> { };
    private static final BiConsumer<WebSocket, ByteBuffer> NO_BINARY = (ws, data) -> { };

    private final WebSocketTransport transport;
    private final PeerRole role;
    private final AtomicBoolean closed;
    private final CompletableFuture<Void> closeFuture;

    private volatile BiConsumer<WebSocket, String> textHandler;
    private volatile BiConsumer<WebSocket, ByteBuffer> binaryHandler;

    // I/O thread only
    private FrameSequence sequence;

    public WebSocketSession(final WebSocketTransport transport, final PeerRole role) {
        this.transport = Args.notNull(transport, "Transport");
        this.role = Args.notNull(role, "Peer role");
        this.closed = new AtomicBoolean(false);
        this.closeFuture = new CompletableFuture<>();
        this.textHandler = NO_TEXT;
        this.binaryHandler = NO_BINARY;
        transport.closeFuture().whenComplete((v, ex) -> transportClosed());
    }

    @Override
    public PeerRole getRole() {
        return role;
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public CompletableFuture<Void> sendText(final CharSequence text) {
        Args.notNull(text, "Text");
        return send(StandardCharsets.UTF_8.encode(CharBuffer.wrap(text)), Opcode.TEXT, true);
    }

    @Override
    public CompletableFuture<Void> sendBinary(final ByteBuffer data) {
        Args.notNull(data, "Data");
        return send(data, Opcode.BINARY, true);
    }

    @Override
    public CompletableFuture<Void> send(final ByteBuffer data, final int opcode, final boolean fin) {
        return transport.write(WebSocketFrame.create(fin, opcode, role.newMaskingKey(), data));
    }

    @Override
    public CompletableFuture<Void> close() {
        return close(CloseCode.GOING_AWAY, null);
    }

    @Override
    public CompletableFuture<Void> close(final int code) {
        return close(code, null);
    }

    @Override
    public CompletableFuture<Void> close(final int code, final String reason) {
        if (!CloseCodec.isValidToSend(code)) {
            throw new IllegalArgumentException("Invalid close code: " + code);
        }
        if (!closed.compareAndSet(false, true)) {
            return CompletableFuture.completedFuture(null);
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("{} sending close {}", transport, code);
        }
        return transport.write(WebSocketFrame.create(true, Opcode.CLOSE, role.newMaskingKey(),
                CloseCodec.encode(code, reason)));
    }

    @Override
    public void onText(final BiConsumer<WebSocket, String> handler) {
        this.textHandler = handler != null ? handler : NO_TEXT;
    }

    @Override
    public void onBinary(final BiConsumer<WebSocket, ByteBuffer> handler) {
        this.binaryHandler = handler != null ? handler : NO_BINARY;
    }

    @Override
    public CompletableFuture<Void> onClose() {
        return closeFuture;
    }

    /**
     * Processes one inbound frame.
     */
    public void handleIncoming(final WebSocketFrame frame) {
        final int opcode = frame.getOpcode();
        switch (opcode) {
            case Opcode.CLOSE:
                handleClose(frame);
                break;
            case Opcode.PING:
                if (frame.isFin()) {
                    send(frame.unmaskedPayload(), Opcode.PONG, true);
                } else {
                    protocolError(CloseCode.PROTOCOL_ERROR, "fragmented ping");
                }
                break;
            case Opcode.TEXT:
            case Opcode.BINARY:
                if (sequence != null) {
                    sequence = null;
                    protocolError(CloseCode.PROTOCOL_ERROR, "data frame inside a fragmented message");
                    return;
                }
                sequence = new FrameSequence(opcode);
                appendAndMaybeDispatch(frame);
                break;
            case Opcode.CONT:
                if (sequence == null) {
                    protocolError(CloseCode.PROTOCOL_ERROR, "continuation without a message in progress");
                    return;
                }
                appendAndMaybeDispatch(frame);
                break;
            default:
                if (LOG.isDebugEnabled()) {
                    LOG.debug("{} ignoring {} frame", transport, Opcode.name(opcode));
                }
        }
    }

    /**
     * Closes the session after the inbound stream failed to decode.
     */
    public void handleProtocolException(final WebSocketProtocolException ex) {
        sequence = null;
        protocolError(ex.getCloseCode(), ex.getMessage());
    }

    private void appendAndMaybeDispatch(final WebSocketFrame frame) {
        final FrameSequence current = sequence;
        try {
            current.append(frame);
            if (!frame.isFin()) {
                return;
            }
            sequence = null;
            if (current.getType() == Opcode.TEXT) {
                final String text = current.finishText();
                deliver(textHandler, text);
            } else {
                deliver(binaryHandler, current.finishBinary());
            }
        } catch (final CharacterCodingException ex) {
            sequence = null;
            protocolError(CloseCode.INVALID_PAYLOAD_DATA, "malformed UTF-8 in text message");
        }
    }

    private <T> void deliver(final BiConsumer<WebSocket, T> handler, final T message) {
        try {
            handler.accept(this, message);
        } catch (final RuntimeException ex) {
            LOG.warn("{} message handler failed", transport, ex);
        }
    }

    private void handleClose(final WebSocketFrame frame) {
        if (closed.get()) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("{} close confirmed by peer", transport);
            }
            transport.close();
            return;
        }
        final int code = CloseCodec.readCloseCode(frame.unmaskedPayload());
        final int echo;
        if (code == -1) {
            echo = CloseCode.GOING_AWAY;
        } else if (CloseCodec.isValidToReceive(code)) {
            echo = code;
        } else {
            echo = CloseCode.PROTOCOL_ERROR;
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("{} peer sent close {}, echoing {}", transport, code, echo);
        }
        close(echo).whenComplete((v, ex) -> transport.close());
    }

    private void protocolError(final int code, final String message) {
        if (LOG.isDebugEnabled()) {
            LOG.debug("{} protocol violation: {}", transport, message);
        }
        if (closed.get()) {
            transport.close();
        } else {
            close(code);
        }
    }

    private void transportClosed() {
        if (closed.compareAndSet(false, true)) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("{} connection lost without close handshake", transport);
            }
        }
        sequence = null;
        closeFuture.complete(null);
    }

    @Override
    public String toString() {
        return "WebSocketSession[" + role + ", " + transport + ", closed=" + closed.get() + "]";
    }
}
