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
package org.apache.hc.websocket.support;

import org.apache.hc.core5.reactor.IOSession;
import org.apache.hc.core5.reactor.IOSessionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Debug trace of connection lifecycle events.
 */
public final class LoggingIOSessionListener implements IOSessionListener {

    public static final LoggingIOSessionListener INSTANCE = new LoggingIOSessionListener();

    private static final Logger LOG = LoggerFactory.getLogger("org.apache.hc.websocket.connection");

    private LoggingIOSessionListener() {
    }

    @Override
    public void connected(final IOSession session) {
        if (LOG.isDebugEnabled()) {
            LOG.debug("{} connected remote={}", session.getId(), session.getRemoteAddress());
        }
    }

    @Override
    public void startTls(final IOSession session) {
        if (LOG.isDebugEnabled()) {
            LOG.debug("{} TLS started", session.getId());
        }
    }

    @Override
    public void inputReady(final IOSession session) {
    }

    @Override
    public void outputReady(final IOSession session) {
    }

    @Override
    public void timeout(final IOSession session) {
        if (LOG.isDebugEnabled()) {
            LOG.debug("{} timeout", session.getId());
        }
    }

    @Override
    public void exception(final IOSession session, final Exception ex) {
        if (LOG.isDebugEnabled()) {
            LOG.debug("{} exception", session.getId(), ex);
        }
    }

    @Override
    public void disconnected(final IOSession session) {
        if (LOG.isDebugEnabled()) {
            LOG.debug("{} disconnected", session.getId());
        }
    }

}
