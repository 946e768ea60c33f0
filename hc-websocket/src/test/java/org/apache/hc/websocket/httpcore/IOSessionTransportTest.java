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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.ByteBuffer;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import org.apache.hc.core5.http.ConnectionClosedException;
import org.apache.hc.core5.io.CloseMode;
import org.apache.hc.core5.reactor.EventMask;
import org.apache.hc.core5.reactor.IOSession;
import org.apache.hc.core5.util.Timeout;
import org.apache.hc.websocket.core.frame.Opcode;
import org.apache.hc.websocket.core.frame.WebSocketFrame;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class IOSessionTransportTest {

    private IOSession ioSession;
    private IOSessionTransport transport;
    private ByteBuffer wire;

    @BeforeEach
    void setUp() throws Exception {
        ioSession = mock(IOSession.class);
        wire = ByteBuffer.allocate(1024);
        when(ioSession.isOpen()).thenReturn(true);
        when(ioSession.write(any(ByteBuffer.class))).thenAnswer(inv -> {
            final ByteBuffer src = inv.getArgument(0);
            final int n = src.remaining();
            wire.put(src);
            return n;
        });
        transport = new IOSessionTransport(ioSession, Timeout.ofSeconds(5));
    }

    private static WebSocketFrame frame(final int opcode, final byte... data) {
        return WebSocketFrame.create(true, opcode, null, ByteBuffer.wrap(data));
    }

    @Test
    void writes_areFlushedInOrder_and_completed() throws Exception {
        final CompletableFuture<Void> f1 = transport.write(frame(Opcode.TEXT, (byte) 'a'));
        final CompletableFuture<Void> f2 = transport.write(frame(Opcode.BINARY, (byte) 1, (byte) 2));
        verify(ioSession, atLeastOnce()).setEvent(EventMask.WRITE);
        assertFalse(f1.isDone());

        transport.flush();

        assertTrue(f1.isDone());
        assertTrue(f2.isDone());
        wire.flip();
        assertEquals(3 + 4, wire.remaining());
        assertEquals((byte) 0x81, wire.get(0));
        assertEquals((byte) 0x82, wire.get(3));
        verify(ioSession).clearEvent(EventMask.WRITE);
    }

    @Test
    void partialWrite_keepsFuturePending() throws Exception {
        when(ioSession.write(any(ByteBuffer.class))).thenAnswer(inv -> {
            final ByteBuffer src = inv.getArgument(0);
            src.get();
            return 1;
        }).thenReturn(0);

        final CompletableFuture<Void> f = transport.write(frame(Opcode.TEXT, (byte) 'a', (byte) 'b'));
        transport.flush();

        assertFalse(f.isDone());
        verify(ioSession, never()).clearEvent(EventMask.WRITE);
    }

    @Test
    void closeFrame_armsCloseWaitTimeout() {
        transport.write(frame(Opcode.CLOSE, (byte) 0x03, (byte) 0xE8));
        verify(ioSession).setSocketTimeout(Timeout.ofSeconds(5));
    }

    @Test
    void close_waitsForQueueToDrain() throws Exception {
        transport.write(frame(Opcode.TEXT, (byte) 'a'));
        transport.close();
        verify(ioSession, never()).close(any(CloseMode.class));

        transport.flush();
        verify(ioSession).close(CloseMode.GRACEFUL);
    }

    @Test
    void disconnect_failsPendingWrites() {
        final CompletableFuture<Void> pending = transport.write(frame(Opcode.TEXT, (byte) 'a'));
        transport.disconnected();

        assertTrue(transport.closeFuture().isDone());
        assertFalse(transport.isOpen());
        final ExecutionException ex = assertThrows(ExecutionException.class, pending::get);
        assertInstanceOf(ConnectionClosedException.class, ex.getCause());

        final CompletableFuture<Void> late = transport.write(frame(Opcode.TEXT, (byte) 'b'));
        assertTrue(late.isCompletedExceptionally());
    }
}
