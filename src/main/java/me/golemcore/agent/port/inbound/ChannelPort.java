package me.golemcore.agent.port.inbound;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.agent.domain.model.InboundMessage;
import me.golemcore.agent.domain.model.Session;
import reactor.core.publisher.Flux;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Bidirectional port for communication channels (terminal, chat protocol,
 * email). Implementations handle transport specifics: authentication, message
 * format conversion and delivery.
 *
 * <p>
 * {@link #isStreaming()} selects how the agent loop delivers replies: a
 * streaming channel receives every text fragment as it arrives from the model,
 * a non-streaming channel receives the complete reply once at the end of the
 * turn.
 */
public interface ChannelPort {

    /**
     * Returns the channel type identifier (e.g., "cli", "matrix", "email").
     */
    String getChannelType();

    boolean isStreaming();

    /**
     * Starts the underlying transport.
     */
    default void start() {
        // Default no-op implementation
    }

    /**
     * Stops the transport and completes the {@link #receive()} stream.
     */
    default void stop() {
        // Default no-op implementation
    }

    /**
     * Inbound messages as they arrive.
     */
    Flux<InboundMessage> receive();

    /**
     * Sends text to a session. {@code metadata} carries the routing hints of the
     * inbound message being answered.
     */
    CompletableFuture<Void> send(Session session, String text, Map<String, Object> metadata);

    /**
     * Switches the typing indicator on or off. Default implementation does
     * nothing; channels can override to show activity.
     */
    default void sendTyping(Session session, boolean active) {
        // Default no-op implementation
    }
}
