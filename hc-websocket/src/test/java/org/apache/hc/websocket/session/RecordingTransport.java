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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.apache.hc.websocket.core.frame.WebSocketFrame;

/**
 * Transport that keeps written frames in memory. Writes complete immediately
 * unless {@link #holdWrites} is set.
 */
final class RecordingTransport implements WebSocketTransport {

    final List<WebSocketFrame> written = new ArrayList<>();
    final List<CompletableFuture<Void>> writeFutures = new ArrayList<>();
    final CompletableFuture<Void> closeFuture = new CompletableFuture<>();
    boolean holdWrites;
    int closeCalls;

    @Override
    public CompletableFuture<Void> write(final WebSocketFrame frame) {
        written.add(frame);
        final CompletableFuture<Void> future = new CompletableFuture<>();
        writeFutures.add(future);
        if (!holdWrites) {
            future.complete(null);
        }
        return future;
    }

    @Override
    public void close() {
        closeCalls++;
    }

    @Override
    public CompletableFuture<Void> closeFuture() {
        return closeFuture;
    }

    @Override
    public boolean isOpen() {
        return !closeFuture.isDone();
    }

    WebSocketFrame last() {
        return written.get(written.size() - 1);
    }

    @Override
    public String toString() {
        return "recording";
    }
}
