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

import java.io.Closeable;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.UnknownHostException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import org.apache.hc.core5.concurrent.DefaultThreadFactory;
import org.apache.hc.core5.concurrent.FutureCallback;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.nio.ssl.BasicClientTlsStrategy;
import org.apache.hc.core5.http.nio.ssl.TlsStrategy;
import org.apache.hc.core5.io.CloseMode;
import org.apache.hc.core5.reactor.ConnectionInitiator;
import org.apache.hc.core5.reactor.DefaultConnectingIOReactor;
import org.apache.hc.core5.reactor.IOReactorConfig;
import org.apache.hc.core5.reactor.IOSession;
import org.apache.hc.core5.util.Args;
import org.apache.hc.websocket.api.WebSocket;
import org.apache.hc.websocket.api.WebSocketClientConfig;
import org.apache.hc.websocket.httpcore.WebSocketIOEventHandlerFactory;
import org.apache.hc.websocket.support.LoggingExceptionCallback;
import org.apache.hc.websocket.support.LoggingIOSessionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Establishes WebSocket connections: TCP connect, TLS for {@code wss}, HTTP
 * upgrade, then hand-off of a client {@link WebSocket} to the caller.
 * <p>
 * A client either owns its I/O reactor, created and started by
 * {@link #WebSocketClient(WebSocketClientConfig)}, or shares one passed to
 * {@link #WebSocketClient(ConnectionInitiator, WebSocketClientConfig)}. A shared
 * reactor must use {@link WebSocketIOEventHandlerFactory} and is never shut down
 * by the client. An owned reactor must be shut down exactly once, with
 * {@link #shutdown()} or {@link #close()}.
 * </p>
 *
 * @since 1.0
 */
public class WebSocketClient implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(WebSocketClient.class);

    private final ConnectionInitiator connectionInitiator;
    private final DefaultConnectingIOReactor ioReactor;
    private final boolean ownsReactor;
    private final WebSocketClientConfig config;
    private final TlsStrategy tlsStrategy;
    private final AtomicBoolean shutdown;

    /**
     * Creates a client with its own I/O reactor of {@code config.getIoThreadCount()} threads.
     */
    public WebSocketClient(final WebSocketClientConfig config) {
        this.config = config != null ? config : WebSocketClientConfig.DEFAULT;
        final IOReactorConfig ioReactorConfig = IOReactorConfig.custom()
                .setIoThreadCount(this.config.getIoThreadCount())
                .setTcpNoDelay(true)
                .build();
        this.ioReactor = new DefaultConnectingIOReactor(
                WebSocketIOEventHandlerFactory.INSTANCE,
                ioReactorConfig,
                new DefaultThreadFactory("websocket-dispatch", true),
                null,
                LoggingExceptionCallback.INSTANCE,
                LoggingIOSessionListener.INSTANCE,
                null);
        this.connectionInitiator = ioReactor;
        this.ownsReactor = true;
        this.tlsStrategy = resolveTlsStrategy(this.config);
        this.shutdown = new AtomicBoolean(false);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Starting I/O reactor {}", this.config);
        }
        ioReactor.start();
    }

    /**
     * Creates a client on a shared reactor. The reactor's lifecycle stays with the caller.
     */
    public WebSocketClient(final ConnectionInitiator connectionInitiator, final WebSocketClientConfig config) {
        this.connectionInitiator = Args.notNull(connectionInitiator, "Connection initiator");
        this.ioReactor = null;
        this.ownsReactor = false;
        this.config = config != null ? config : WebSocketClientConfig.DEFAULT;
        this.tlsStrategy = resolveTlsStrategy(this.config);
        this.shutdown = new AtomicBoolean(false);
    }

    private static TlsStrategy resolveTlsStrategy(final WebSocketClientConfig config) {
        return config.getTlsStrategy() != null ? config.getTlsStrategy() : new BasicClientTlsStrategy();
    }

    public boolean ownsReactor() {
        return ownsReactor;
    }

    public WebSocketClientConfig getConfig() {
        return config;
    }

    /**
     * Connects to a {@code ws://} or {@code wss://} URL.
     *
     * @param url       target URL
     * @param headers   extra request headers, may be {@code null}
     * @param onUpgrade receives the session once the protocol switch has happened,
     *                  before the returned future completes
     * @return future completed on successful upgrade, or failed exactly once with the
     * first error: {@link InvalidUrlException}, {@link UpgradeRefusedException},
     * {@link AlreadyShutdownException} or the underlying transport failure
     */
    public CompletableFuture<Void> connect(
            final String url,
            final List<Header> headers,
            final Consumer<WebSocket> onUpgrade) {
        final WebSocketTarget target;
        try {
            target = WebSocketTarget.parse(url);
        } catch (final InvalidUrlException ex) {
            return failed(ex);
        }
        return connect(target, headers, onUpgrade);
    }

    public CompletableFuture<Void> connect(
            final URI uri,
            final List<Header> headers,
            final Consumer<WebSocket> onUpgrade) {
        Args.notNull(uri, "URI");
        final WebSocketTarget target;
        try {
            target = WebSocketTarget.of(uri);
        } catch (final InvalidUrlException ex) {
            return failed(ex);
        }
        return connect(target, headers, onUpgrade);
    }

    /**
     * Connects to an explicit endpoint.
     *
     * @param scheme {@code ws}, {@code wss} or {@code null} for {@code ws}
     * @param port   port or a value {@code <= 0} for the scheme default
     * @param path   request target or {@code null} for {@code /}
     */
    public CompletableFuture<Void> connect(
            final String scheme,
            final String host,
            final int port,
            final String path,
            final List<Header> headers,
            final Consumer<WebSocket> onUpgrade) {
        final WebSocketTarget target;
        try {
            target = WebSocketTarget.of(scheme, host, port, path);
        } catch (final InvalidUrlException ex) {
            return failed(ex);
        }
        return connect(target, headers, onUpgrade);
    }

    public CompletableFuture<Void> connect(
            final WebSocketTarget target,
            final List<Header> headers,
            final Consumer<WebSocket> onUpgrade) {
        Args.notNull(target, "Target");
        Args.notNull(onUpgrade, "Upgrade callback");
        if (shutdown.get()) {
            return failed(new AlreadyShutdownException());
        }
        final InetSocketAddress address = new InetSocketAddress(target.getHost(), target.getPort());
        if (address.isUnresolved()) {
            return failed(new UnknownHostException(target.getHost()));
        }
        final CompletableFuture<Void> result = new CompletableFuture<>();
        final UpgradeRequestHandler handler = new UpgradeRequestHandler(
                target, headers, new WebSocketUpgradeOffer(), config, tlsStrategy, onUpgrade, result);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Connecting to {}", target);
        }
        try {
            connectionInitiator.connect(
                    target.toHttpHost(),
                    address,
                    null,
                    config.getConnectTimeout(),
                    handler,
                    new FutureCallback<IOSession>() {

                        @Override
                        public void completed(final IOSession ioSession) {
                            handler.attach(ioSession);
                        }

                        @Override
                        public void failed(final Exception ex) {
                            if (LOG.isDebugEnabled()) {
                                LOG.debug("Connect to {} failed: {}", target, ex.toString());
                            }
                            result.completeExceptionally(ex);
                        }

                        @Override
                        public void cancelled() {
                            result.cancel(false);
                        }

                    });
        } catch (final RuntimeException ex) {
            // the reactor refuses new connections once it is shutting down
            result.completeExceptionally(ex);
        }
        return result;
    }

    /**
     * Shuts down an owned reactor. Does nothing when the reactor is shared.
     *
     * @throws AlreadyShutdownException if the owned reactor has already been shut down
     */
    public void shutdown() {
        if (!ownsReactor) {
            return;
        }
        if (!shutdown.compareAndSet(false, true)) {
            throw new AlreadyShutdownException();
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("Shutting down I/O reactor");
        }
        ioReactor.close(CloseMode.GRACEFUL);
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    /**
     * Shuts down an owned reactor unless that has already happened.
     */
    @Override
    public void close() {
        if (ownsReactor && shutdown.compareAndSet(false, true)) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("Closing I/O reactor");
            }
            ioReactor.close(CloseMode.GRACEFUL);
        }
    }

    private static CompletableFuture<Void> failed(final Exception ex) {
        final CompletableFuture<Void> future = new CompletableFuture<>();
        future.completeExceptionally(ex);
        return future;
    }

}
