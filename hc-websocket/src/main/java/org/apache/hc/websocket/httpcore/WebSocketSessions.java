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

import org.apache.hc.core5.reactor.IOSession;
import org.apache.hc.core5.util.Args;
import org.apache.hc.websocket.api.WebSocketClientConfig;
import org.apache.hc.websocket.core.frame.WebSocketFrameDecoder;
import org.apache.hc.websocket.session.PeerRole;
import org.apache.hc.websocket.session.WebSocketSession;

/**
 * Mounts a {@link WebSocketSession} on an {@link IOSession} whose HTTP upgrade
 * has already taken place. The session replaces the current event handler.
 * <p>
 * Pass the reactor's own session, as handed to the connect callback, not the
 * session carried by I/O events: teardown closes the given session and only the
 * former reports {@code disconnected} back to the handler.
 * </p>
 *
 * @since 1.0
 */
public final class WebSocketSessions {

    private WebSocketSessions() {
    }

    public static WebSocketSession client(final IOSession ioSession, final WebSocketClientConfig config) {
        return install(ioSession, PeerRole.CLIENT, config);
    }

    public static WebSocketSession server(final IOSession ioSession, final WebSocketClientConfig config) {
        return install(ioSession, PeerRole.SERVER, config);
    }

    private static WebSocketSession install(
            final IOSession ioSession,
            final PeerRole role,
            final WebSocketClientConfig config) {
        Args.notNull(ioSession, "I/O session");
        final WebSocketClientConfig cfg = config != null ? config : WebSocketClientConfig.DEFAULT;
        final IOSessionTransport transport = new IOSessionTransport(ioSession, cfg.getCloseWaitTimeout());
        final WebSocketSession session = new WebSocketSession(transport, role);
        final WebSocketSessionHandler handler = new WebSocketSessionHandler(
                transport, session, new WebSocketFrameDecoder(cfg.getMaxFrameSize()));
        ioSession.upgrade(handler);
        handler.connected(ioSession);
        return session;
    }
}
