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

import java.util.concurrent.CompletableFuture;

import org.apache.hc.websocket.core.frame.WebSocketFrame;

/**
 * Connection handle owned by a {@link WebSocketSession}.
 *
 * @since 1.0
 */
public interface WebSocketTransport {

    /**
     * Queues a frame for writing. Frames are written in submission order.
     *
     * @return future completed once the frame has been written, or failed if
     * the connection goes away first
     */
    CompletableFuture<Void> write(WebSocketFrame frame);

    /**
     * Closes the connection after pending writes have been flushed.
     */
    void close();

    /**
     * @return future completed once the connection has been torn down
     */
    CompletableFuture<Void> closeFuture();

    boolean isOpen();
}
