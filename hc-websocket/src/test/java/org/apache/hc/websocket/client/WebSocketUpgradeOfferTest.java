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

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Base64;

import org.apache.hc.core5.http.HttpStatus;
import org.apache.hc.core5.http.Method;
import org.apache.hc.core5.http.ProtocolException;
import org.apache.hc.core5.http.message.BasicHttpRequest;
import org.apache.hc.core5.http.message.BasicHttpResponse;
import org.apache.hc.core5.http.protocol.HttpCoreContext;
import org.junit.jupiter.api.Test;

class WebSocketUpgradeOfferTest {

    private static final String RFC_KEY = "dGhlIHNhbXBsZSBub25jZQ==";
    private static final String RFC_ACCEPT = "s3pPLMBiTxaQ9kYGzzhZRbK+xOo=";

    private static BasicHttpResponse switching(final String accept) {
        final BasicHttpResponse response = new BasicHttpResponse(HttpStatus.SC_SWITCHING_PROTOCOLS, "Switching Protocols");
        response.addHeader("Upgrade", "websocket");
        response.addHeader("Connection", "Upgrade");
        if (accept != null) {
            response.addHeader("Sec-WebSocket-Accept", accept);
        }
        return response;
    }

    @Test
    void accept_matchesRfcExample() {
        assertEquals(RFC_ACCEPT, WebSocketUpgradeOffer.computeAccept(RFC_KEY));
    }

    @Test
    void process_addsUpgradeHeaders() throws Exception {
        final WebSocketUpgradeOffer offer = new WebSocketUpgradeOffer(RFC_KEY);
        final BasicHttpRequest request = new BasicHttpRequest(Method.GET, "/chat");
        offer.process(request, null, HttpCoreContext.create());

        assertEquals("websocket", request.getFirstHeader("Upgrade").getValue());
        assertEquals("Upgrade", request.getFirstHeader("Connection").getValue());
        assertEquals(RFC_KEY, request.getFirstHeader("Sec-WebSocket-Key").getValue());
        assertEquals("13", request.getFirstHeader("Sec-WebSocket-Version").getValue());
    }

    @Test
    void randomKey_is16BytesBase64() {
        final WebSocketUpgradeOffer a = new WebSocketUpgradeOffer();
        final WebSocketUpgradeOffer b = new WebSocketUpgradeOffer();
        assertEquals(16, Base64.getDecoder().decode(a.getKey()).length);
        assertNotEquals(a.getKey(), b.getKey());
    }

    @Test
    void validate_acceptsMatchingResponse() {
        final WebSocketUpgradeOffer offer = new WebSocketUpgradeOffer(RFC_KEY);
        assertDoesNotThrow(() -> offer.validate(switching(RFC_ACCEPT)));
    }

    @Test
    void validate_rejectsBadResponses() {
        final WebSocketUpgradeOffer offer = new WebSocketUpgradeOffer(RFC_KEY);
        assertThrows(ProtocolException.class, () -> offer.validate(switching("bogus")));
        assertThrows(ProtocolException.class, () -> offer.validate(switching(null)));

        final BasicHttpResponse noUpgrade = new BasicHttpResponse(HttpStatus.SC_SWITCHING_PROTOCOLS);
        noUpgrade.addHeader("Connection", "Upgrade");
        noUpgrade.addHeader("Sec-WebSocket-Accept", RFC_ACCEPT);
        assertThrows(ProtocolException.class, () -> offer.validate(noUpgrade));
    }
}
