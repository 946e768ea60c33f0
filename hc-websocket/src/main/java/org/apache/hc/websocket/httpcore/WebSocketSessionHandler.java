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
package org.apache.hc.websocket.httpcore;

import java.io.IOException;
import java.nio.ByteBuffer;

import org.apache.hc.core5.io.CloseMode;
import org.apache.hc.core5.reactor.EventMask;
import org.apache.hc.core5.reactor.IOEventHandler;
import org.apache.hc.core5.reactor.IOSession;
import org.apache.hc.core5.util.Args;
import org.apache.hc.core5.util.Timeout;
import org.apache.hc.websocket.core.close.WebSocketProtocolException;
import org.apache.hc.websocket.core.frame.WebSocketFrame;
import org.apache.hc.websocket.core.frame.WebSocketFrameDecoder;
import org.apache.hc.websocket.session.WebSocketSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * I/O event handler of an upgraded connection. Decodes inbound frames and feeds
 * them to the {@link WebSocketSession}; drives the {@link IOSessionTransport} write queue.
 *
 * @since 1.0
 */
public final class WebSocketSessionHandler implements IOEventHandler {

    private static final Logger LOG = LoggerFactory.getLogger(WebSocketSessionHandler.class);

    private final IOSessionTransport transport;
    private final WebSocketSession session;
    private final WebSocketFrameDecoder decoder;
    private final ByteBuffer readBuf;

    private ByteBuffer inbuf;
    private boolean discardInput;

    public WebSocketSessionHandler(
            final IOSessionTransport transport,
            final WebSocketSession session,
            final WebSocketFrameDecoder decoder) {
        this.transport = Args.notNull(transport, "Transport");
        this.session = Args.notNull(session, "Session");
        this.decoder = Args.notNull(decoder, "Decoder");
        this.readBuf = ByteBuffer.allocate(8192);
        this.inbuf = ByteBuffer.allocate(4096);
    }

    public WebSocketSession getSession() {
        return session;
    }

    @Override
    public void connected(final IOSession ioSession) {
        ioSession.setEvent(EventMask.READ);
    }

    @Override
    public void inputReady(final IOSession ioSession, final ByteBuffer src) throws IOException {
        if (src != null && src.hasRemaining()) {
            append(src);
        }
        int n;
        do {
            readBuf.clear();
            n = ioSession.read(readBuf);
            if (n > 0) {
                readBuf.flip();
                append(readBuf);
            }
        } while (n > 0);

        processFrames();

        if (n < 0) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("{} end of stream", ioSession.getId());
            }
            transport.shutdown(CloseMode.GRACEFUL);
        }
    }

    private void processFrames() {
        if (discardInput) {
            inbuf.clear();
            return;
        }
        inbuf.flip();
        try {
            for (;;) {
                final WebSocketFrame frame = decoder.decode(inbuf);
                if (frame == null) {
                    break;
                }
                session.handleIncoming(frame);
            }
            inbuf.compact();
        } catch (final WebSocketProtocolException ex) {
            // the stream is out of sync; the peer's CLOSE cannot be read anymore
            discardInput = true;
            inbuf.clear();
            session.handleProtocolException(ex);
            transport.close();
        }
    }

    private void append(final ByteBuffer src) {
        if (inbuf.remaining() < src.remaining()) {
            final int need = inbuf.position() + src.remaining();
            final ByteBuffer bigger = ByteBuffer.allocate(Math.max(need, inbuf.capacity() * 2));
            inbuf.flip();
            bigger.put(inbuf);
            inbuf = bigger;
        }
        inbuf.put(src);
    }

    @Override
    public void outputReady(final IOSession ioSession) throws IOException {
        transport.flush();
    }

    @Override
    public void timeout(final IOSession ioSession, final Timeout timeout) {
        if (LOG.isDebugEnabled()) {
            LOG.debug("{} timeout {}", ioSession.getId(), timeout);
        }
        transport.shutdown(CloseMode.GRACEFUL);
    }

    @Override
    public void exception(final IOSession ioSession, final Exception cause) {
        if (LOG.isDebugEnabled()) {
            LOG.debug("{} I/O exception", ioSession.getId(), cause);
        }
        transport.shutdown(CloseMode.GRACEFUL);
    }

    @Override
    public void disconnected(final IOSession ioSession) {
        transport.disconnected();
    }
}
