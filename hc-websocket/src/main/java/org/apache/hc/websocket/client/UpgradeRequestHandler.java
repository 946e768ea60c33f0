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
package org.apache.hc.websocket.client;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.ByteBuffer;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import org.apache.hc.core5.concurrent.FutureCallback;
import org.apache.hc.core5.http.ConnectionClosedException;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpException;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.HttpResponse;
import org.apache.hc.core5.http.HttpStatus;
import org.apache.hc.core5.http.Method;
import org.apache.hc.core5.http.ProtocolException;
import org.apache.hc.core5.http.message.BasicHttpRequest;
import org.apache.hc.core5.http.nio.ssl.TlsStrategy;
import org.apache.hc.core5.http.protocol.HttpCoreContext;
import org.apache.hc.core5.io.CloseMode;
import org.apache.hc.core5.reactor.EventMask;
import org.apache.hc.core5.reactor.IOEventHandler;
import org.apache.hc.core5.reactor.IOSession;
import org.apache.hc.core5.reactor.ssl.TransportSecurityLayer;
import org.apache.hc.core5.util.Args;
import org.apache.hc.core5.util.Timeout;
import org.apache.hc.websocket.api.WebSocket;
import org.apache.hc.websocket.api.WebSocketClientConfig;
import org.apache.hc.websocket.httpcore.WebSocketSessions;
import org.apache.hc.websocket.session.WebSocketSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Event handler of a connection between connect and protocol switch.
 * <p>
 * Once activated it optionally starts TLS, then sends a single {@code GET}
 * upgrade request and waits for the response head. A {@code 101} response
 * replaces this handler with a client {@link WebSocketSession}; anything else,
 * as well as any I/O failure, fails the result and closes the connection.
 * </p>
 */
final class UpgradeRequestHandler implements IOEventHandler {

    private static final Logger LOG = LoggerFactory.getLogger(UpgradeRequestHandler.class);

    static final int MAX_HEAD_SIZE = 8 * 1024;

    private final WebSocketTarget target;
    private final List<Header> headers;
    private final WebSocketUpgradeOffer offer;
    private final WebSocketClientConfig config;
    private final TlsStrategy tlsStrategy;
    private final Consumer<WebSocket> onUpgrade;
    private final CompletableFuture<Void> result;
    private final AtomicBoolean activated;
    private final ByteBuffer readBuf;

    private volatile IOSession channel;
    private ByteBuffer inbuf;
    private volatile ByteBuffer requestBuf;
    private boolean switched;

    UpgradeRequestHandler(
            final WebSocketTarget target,
            final List<Header> headers,
            final WebSocketUpgradeOffer offer,
            final WebSocketClientConfig config,
            final TlsStrategy tlsStrategy,
            final Consumer<WebSocket> onUpgrade,
            final CompletableFuture<Void> result) {
        this.target = Args.notNull(target, "Target");
        this.headers = headers != null ? headers : Collections.<Header>emptyList();
        this.offer = Args.notNull(offer, "Upgrade offer");
        this.config = Args.notNull(config, "Config");
        this.tlsStrategy = tlsStrategy;
        this.onUpgrade = Args.notNull(onUpgrade, "Upgrade callback");
        this.result = Args.notNull(result, "Result");
        this.activated = new AtomicBoolean(false);
        this.readBuf = ByteBuffer.allocate(2048);
        this.inbuf = ByteBuffer.allocate(1024);
    }

    /**
     * Installs this handler on a freshly connected session, unless the reactor
     * already did so, and activates it.
     * <p>
     * The given session must be the one the reactor handed to the connect callback.
     * I/O events carry the transport session it wraps; closing that one directly
     * bypasses the reactor and no {@code disconnected} event would ever follow.
     * </p>
     */
    void attach(final IOSession ioSession) {
        channel = ioSession;
        if (ioSession.getHandler() != this) {
            ioSession.upgrade(this);
        }
        activate(ioSession);
    }

    void activate(final IOSession eventSession) {
        if (!activated.compareAndSet(false, true)) {
            return;
        }
        if (channel == null) {
            channel = eventSession;
        }
        final IOSession ioSession = channel;
        ioSession.setSocketTimeout(config.getHandshakeTimeout());
        if (target.isSecure()) {
            if (!(ioSession instanceof TransportSecurityLayer) || tlsStrategy == null) {
                fail(ioSession, new IllegalStateException("TLS is not supported by " + ioSession));
                return;
            }
            if (LOG.isDebugEnabled()) {
                LOG.debug("{} starting TLS with {}", ioSession.getId(), target.getHost());
            }
            tlsStrategy.upgrade(
                    (TransportSecurityLayer) ioSession,
                    target.toHttpHost(),
                    null,
                    config.getTlsHandshakeTimeout(),
                    new FutureCallback<TransportSecurityLayer>() {

                        @Override
                        public void completed(final TransportSecurityLayer tlsSession) {
                            sendRequest(ioSession);
                        }

                        @Override
                        public void failed(final Exception ex) {
                            fail(ioSession, ex);
                        }

                        @Override
                        public void cancelled() {
                            fail(ioSession, new CancellationException("TLS handshake cancelled"));
                        }

                    });
        } else {
            sendRequest(ioSession);
        }
    }

    private void sendRequest(final IOSession ioSession) {
        final BasicHttpRequest request = new BasicHttpRequest(Method.GET, target.getPath());
        request.addHeader(HttpHeaders.CONTENT_TYPE, "text/plain; charset=utf-8");
        request.addHeader(HttpHeaders.CONTENT_LENGTH, "0");
        request.addHeader(HttpHeaders.HOST, target.getHostHeader());
        for (final Header header : headers) {
            request.addHeader(header);
        }
        try {
            offer.process(request, null, HttpCoreContext.create());
        } catch (final HttpException | IOException ex) {
            fail(ioSession, ex);
            return;
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("{} sending upgrade request {} {}", ioSession.getId(), request.getMethod(), request.getRequestUri());
        }
        requestBuf = Http1HandshakeCodec.encodeRequest(request);
        ioSession.setEvent(EventMask.WRITE);
    }

    @Override
    public void connected(final IOSession ioSession) {
        activate(ioSession);
    }

    @Override
    public void outputReady(final IOSession ioSession) throws IOException {
        final ByteBuffer out = requestBuf;
        if (out != null && out.hasRemaining()) {
            ioSession.write(out);
        }
        if (out == null || !out.hasRemaining()) {
            ioSession.clearEvent(EventMask.WRITE);
            ioSession.setEvent(EventMask.READ);
        }
    }

    @Override
    public void inputReady(final IOSession eventSession, final ByteBuffer src) throws IOException {
        if (switched) {
            return;
        }
        final IOSession ioSession = channel != null ? channel : eventSession;
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

        final Http1HandshakeCodec.Response response;
        try {
            response = Http1HandshakeCodec.tryParse(inbuf);
        } catch (final ProtocolException ex) {
            fail(ioSession, ex);
            return;
        }
        if (response == null) {
            if (inbuf.position() > MAX_HEAD_SIZE) {
                fail(ioSession, new ProtocolException("Upgrade response head exceeds " + MAX_HEAD_SIZE + " bytes"));
            } else if (n < 0) {
                fail(ioSession, new ConnectionClosedException("Connection closed before upgrade response"));
            }
            return;
        }
        final HttpResponse head = response.head;
        if (head.getCode() != HttpStatus.SC_SWITCHING_PROTOCOLS) {
            fail(ioSession, new UpgradeRefusedException(head));
            return;
        }
        try {
            offer.validate(head);
        } catch (final ProtocolException ex) {
            fail(ioSession, ex);
            return;
        }
        switched = true;
        if (LOG.isDebugEnabled()) {
            LOG.debug("{} switching protocols to websocket", ioSession.getId());
        }
        final WebSocketSession session = WebSocketSessions.client(ioSession, config);
        ioSession.setSocketTimeout(Timeout.DISABLED);
        try {
            onUpgrade.accept(session);
        } catch (final RuntimeException ex) {
            result.completeExceptionally(ex);
            ioSession.close(CloseMode.IMMEDIATE);
            return;
        }
        result.complete(null);
        if (response.leftover.length > 0) {
            ioSession.getHandler().inputReady(ioSession, ByteBuffer.wrap(response.leftover));
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
    public void timeout(final IOSession eventSession, final Timeout timeout) {
        fail(channel != null ? channel : eventSession, new SocketTimeoutException("WebSocket handshake timed out after " + timeout));
    }

    @Override
    public void exception(final IOSession eventSession, final Exception cause) {
        fail(channel != null ? channel : eventSession, cause);
    }

    @Override
    public void disconnected(final IOSession ioSession) {
        if (result.completeExceptionally(new ConnectionClosedException("Connection closed during WebSocket handshake"))) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("{} disconnected during handshake", ioSession.getId());
            }
        }
    }

    private void fail(final IOSession ioSession, final Exception cause) {
        if (result.completeExceptionally(cause)) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("{} upgrade failed: {}", ioSession.getId(), cause.toString());
            }
        } else if (LOG.isDebugEnabled()) {
            LOG.debug("{} ignoring late failure: {}", ioSession.getId(), cause.toString());
        }
        ioSession.close(CloseMode.IMMEDIATE);
    }
}
