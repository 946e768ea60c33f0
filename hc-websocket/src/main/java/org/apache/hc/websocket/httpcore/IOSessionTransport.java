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
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;

import org.apache.hc.core5.http.ConnectionClosedException;
import org.apache.hc.core5.io.CloseMode;
import org.apache.hc.core5.reactor.EventMask;
import org.apache.hc.core5.reactor.IOSession;
import org.apache.hc.core5.util.Args;
import org.apache.hc.core5.util.Timeout;
import org.apache.hc.websocket.core.frame.Opcode;
import org.apache.hc.websocket.core.frame.WebSocketFrame;
import org.apache.hc.websocket.core.frame.WebSocketFrameEncoder;
import org.apache.hc.websocket.session.WebSocketTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link WebSocketTransport} over a reactor {@link IOSession}.
 * <p>
 * Frames may be queued from any thread; they are written by the I/O dispatch
 * thread on {@code outputReady}.
 * </p>
 *
 * @since 1.0
 */
public final class IOSessionTransport implements WebSocketTransport {

    private static final Logger LOG = LoggerFactory.getLogger(IOSessionTransport.class);

    private static final class PendingWrite {

        final ByteBuffer buf;
        final CompletableFuture<Void> future;

        PendingWrite(final ByteBuffer buf) {
            this.buf = buf;
            this.future = new CompletableFuture<>();
        }
    }

    private final IOSession ioSession;
    private final Timeout closeWaitTimeout;
    private final Queue<PendingWrite> outbound;
    private final CompletableFuture<Void> closeFuture;

    private volatile boolean closeRequested;
    private PendingWrite activeWrite;

    public IOSessionTransport(final IOSession ioSession, final Timeout closeWaitTimeout) {
        this.ioSession = Args.notNull(ioSession, "I/O session");
        this.closeWaitTimeout = closeWaitTimeout;
        this.outbound = new ConcurrentLinkedQueue<>();
        this.closeFuture = new CompletableFuture<>();
    }

    @Override
    public CompletableFuture<Void> write(final WebSocketFrame frame) {
        Args.notNull(frame, "Frame");
        if (closeFuture.isDone()) {
            final CompletableFuture<Void> failed = new CompletableFuture<>();
            failed.completeExceptionally(new ConnectionClosedException());
            return failed;
        }
        final PendingWrite pending = new PendingWrite(WebSocketFrameEncoder.INSTANCE.encode(frame));
        outbound.add(pending);
        if (frame.getOpcode() == Opcode.CLOSE && closeWaitTimeout != null) {
            ioSession.setSocketTimeout(closeWaitTimeout);
        }
        ioSession.setEvent(EventMask.WRITE);
        return pending.future;
    }

    @Override
    public void close() {
        closeRequested = true;
        if (!closeFuture.isDone()) {
            ioSession.setEvent(EventMask.WRITE);
        }
    }

    @Override
    public CompletableFuture<Void> closeFuture() {
        return closeFuture;
    }

    @Override
    public boolean isOpen() {
        return !closeFuture.isDone() && ioSession.isOpen();
    }

    /**
     * Closes the underlying session right away, without draining the write queue.
     */
    void shutdown(final CloseMode closeMode) {
        if (LOG.isDebugEnabled()) {
            LOG.debug("{} shutting down transport ({})", ioSession.getId(), closeMode);
        }
        ioSession.close(closeMode);
    }

    /**
     * Writes queued frames until the queue is empty or the socket stops accepting data.
     */
    void flush() throws IOException {
        for (;;) {
            if (activeWrite == null) {
                activeWrite = outbound.poll();
                if (activeWrite == null) {
                    ioSession.clearEvent(EventMask.WRITE);
                    if (!outbound.isEmpty()) {
                        continue;
                    }
                    if (closeRequested) {
                        if (LOG.isDebugEnabled()) {
                            LOG.debug("{} closing transport", ioSession.getId());
                        }
                        ioSession.close(CloseMode.GRACEFUL);
                    }
                    return;
                }
            }
            ioSession.write(activeWrite.buf);
            if (activeWrite.buf.hasRemaining()) {
                ioSession.setEvent(EventMask.WRITE);
                return;
            }
            final PendingWrite done = activeWrite;
            activeWrite = null;
            done.future.complete(null);
        }
    }

    /**
     * Fails whatever is still queued and completes {@link #closeFuture()}.
     */
    void disconnected() {
        final ConnectionClosedException cause = new ConnectionClosedException();
        if (activeWrite != null) {
            activeWrite.future.completeExceptionally(cause);
            activeWrite = null;
        }
        PendingWrite pending;
        while ((pending = outbound.poll()) != null) {
            pending.future.completeExceptionally(cause);
        }
        closeFuture.complete(null);
    }

    @Override
    public String toString() {
        return String.valueOf(ioSession.getId());
    }
}
