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

import org.apache.hc.core5.http.HttpResponse;
import org.apache.hc.core5.http.ProtocolException;

/**
 * Signals that the server answered the upgrade request with something other
 * than {@code 101 Switching Protocols}.
 *
 * @since 1.0
 */
public class UpgradeRefusedException extends ProtocolException {

    private static final long serialVersionUID = 1L;

    private final transient HttpResponse response;

    public UpgradeRefusedException(final HttpResponse response) {
        super("Invalid response status: " + response.getCode() + " " + response.getReasonPhrase());
        this.response = response;
    }

    /**
     * @return the response head sent by the server
     */
    public HttpResponse getResponse() {
        return response;
    }

    public int getStatusCode() {
        return response.getCode();
    }
}
