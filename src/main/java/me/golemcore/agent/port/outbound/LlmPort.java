package me.golemcore.agent.port.outbound;

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

import me.golemcore.agent.domain.model.LlmChunk;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ToolDefinition;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Port for integrating with language model providers (any OpenAI-compatible
 * endpoint). Responses are produced as a stream of {@link LlmChunk} events:
 * text fragments, and at most one terminal tool-call batch.
 */
public interface LlmPort {

    /**
     * Returns the provider identifier (e.g., "openai", "none").
     */
    String getProviderId();

    /**
     * Sends the full conversation (system prompt included) to the model.
     * Implementations must accept an empty tool list. Errors are signalled through
     * the returned {@link Flux}; cancelling the subscription aborts the request.
     *
     * @param messages
     *            ordered conversation context
     * @param tools
     *            tool definitions the model may call
     * @param stream
     *            whether text should be delivered incrementally
     */
    Flux<LlmChunk> chat(List<Message> messages, List<ToolDefinition> tools, boolean stream);

    /**
     * Checks if the provider is configured and operational.
     */
    default boolean isAvailable() {
        return true;
    }
}
