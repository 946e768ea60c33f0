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

import org.apache.hc.core5.annotation.Contract;
import org.apache.hc.core5.annotation.ThreadingBehavior;
import org.apache.hc.core5.http.nio.ssl.TlsStrategy;
import org.apache.hc.core5.util.Timeout;

/**
 * Immutable WebSocket client settings.
 *
 * @since 1.0
 */
@Contract(threading = ThreadingBehavior.IMMUTABLE)
public final class WebSocketClientConfig {

    public static final WebSocketClientConfig DEFAULT = custom().build();

    private final TlsStrategy tlsStrategy;
    private final int maxFrameSize;
    private final Timeout connectTimeout;
    private final Timeout tlsHandshakeTimeout;
    private final Timeout handshakeTimeout;
    private final Timeout closeWaitTimeout;
    private final int ioThreadCount;

    private WebSocketClientConfig(
            final TlsStrategy tlsStrategy,
            final int maxFrameSize,
            final Timeout connectTimeout,
            final Timeout tlsHandshakeTimeout,
            final Timeout handshakeTimeout,
            final Timeout closeWaitTimeout,
            final int ioThreadCount) {
        this.tlsStrategy = tlsStrategy;
        this.maxFrameSize = maxFrameSize;
        this.connectTimeout = connectTimeout;
        this.tlsHandshakeTimeout = tlsHandshakeTimeout;
        this.handshakeTimeout = handshakeTimeout;
        this.closeWaitTimeout = closeWaitTimeout;
        this.ioThreadCount = ioThreadCount;
    }

    /**
     * @return TLS strategy for {@code wss} targets or {@code null} to use the default one
     */
    public TlsStrategy getTlsStrategy() {
        return tlsStrategy;
    }

    public int getMaxFrameSize() {
        return maxFrameSize;
    }

    public Timeout getConnectTimeout() {
        return connectTimeout;
    }

    public Timeout getTlsHandshakeTimeout() {
        return tlsHandshakeTimeout;
    }

    public Timeout getHandshakeTimeout() {
        return handshakeTimeout;
    }

    public Timeout getCloseWaitTimeout() {
        return closeWaitTimeout;
    }

    public int getIoThreadCount() {
        return ioThreadCount;
    }

    @Override
    public String toString() {
        return "[maxFrameSize=" + maxFrameSize +
                ", connectTimeout=" + connectTimeout +
                ", tlsHandshakeTimeout=" + tlsHandshakeTimeout +
                ", handshakeTimeout=" + handshakeTimeout +
                ", closeWaitTimeout=" + closeWaitTimeout +
                ", ioThreadCount=" + ioThreadCount +
                "]";
    }

    public static Builder custom() {
        return new Builder();
    }

    public static final class Builder {

        private TlsStrategy tlsStrategy;
        private int maxFrameSize = 1 << 14;
        private Timeout connectTimeout = Timeout.ofSeconds(10);
        private Timeout tlsHandshakeTimeout = Timeout.ofSeconds(10);
        private Timeout handshakeTimeout = Timeout.ofSeconds(10);
        private Timeout closeWaitTimeout = Timeout.ofSeconds(5);
        private int ioThreadCount = 1;

        public Builder setTlsStrategy(final TlsStrategy v) {
            this.tlsStrategy = v;
            return this;
        }

        public Builder setMaxFrameSize(final int v) {
            this.maxFrameSize = v;
            return this;
        }

        public Builder setConnectTimeout(final Timeout v) {
            this.connectTimeout = v;
            return this;
        }

        public Builder setTlsHandshakeTimeout(final Timeout v) {
            this.tlsHandshakeTimeout = v;
            return this;
        }

        public Builder setHandshakeTimeout(final Timeout v) {
            this.handshakeTimeout = v;
            return this;
        }

        public Builder setCloseWaitTimeout(final Timeout v) {
            this.closeWaitTimeout = v;
            return this;
        }

        public Builder setIoThreadCount(final int v) {
            this.ioThreadCount = v;
            return this;
        }

        public WebSocketClientConfig build() {
            if (maxFrameSize <= 0) {
                throw new IllegalArgumentException("maxFrameSize > 0");
            }
            if (ioThreadCount <= 0) {
                throw new IllegalArgumentException("ioThreadCount > 0");
            }
            if (connectTimeout == null || tlsHandshakeTimeout == null
                    || handshakeTimeout == null || closeWaitTimeout == null) {
                throw new IllegalArgumentException("timeouts != null");
            }
            return new WebSocketClientConfig(
                    tlsStrategy, maxFrameSize,
                    connectTimeout, tlsHandshakeTimeout, handshakeTimeout, closeWaitTimeout,
                    ioThreadCount);
        }
    }
}
