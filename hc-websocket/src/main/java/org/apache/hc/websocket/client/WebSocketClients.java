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

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.reactor.ConnectionInitiator;
import org.apache.hc.websocket.api.WebSocket;
import org.apache.hc.websocket.api.WebSocketClientConfig;

/**
 * Factory methods for {@link WebSocketClient} instances.
 *
 * @since 1.0
 */
public final class WebSocketClients {

    private WebSocketClients() {
    }

    /**
     * Creates a client with its own single threaded I/O reactor.
     */
    public static WebSocketClient createDefault() {
        return new WebSocketClient(WebSocketClientConfig.DEFAULT);
    }

    public static WebSocketClient create(final WebSocketClientConfig config) {
        return new WebSocketClient(config);
    }

    /**
     * Connects through a shared reactor; the reactor is not shut down by this call.
     */
    public static CompletableFuture<Void> connect(
            final String url,
            final List<Header> headers,
            final WebSocketClientConfig config,
            final ConnectionInitiator connectionInitiator,
            final Consumer<WebSocket> onUpgrade) {
        return new WebSocketClient(connectionInitiator, config).connect(url, headers, onUpgrade);
    }

}
