package me.golemcore.agent.domain.component;

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

import me.golemcore.agent.domain.model.Session;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Capability handler that the model can invoke through function calling.
 * Tools expose their JSON Schema definition and implement the execution.
 *
 * <p>
 * Tools must not throw: every failure, including invalid arguments, is
 * reported as an error-flagged {@link ToolResult}. The tool call id is stamped
 * on the result by the registry, so tools leave it unset.
 */
public interface ToolComponent extends Component {

    @Override
    default String getComponentType() {
        return "tool";
    }

    ToolDefinition getDefinition();

    /**
     * Executes the tool on behalf of a session.
     *
     * @param session
     *            session that issued the call
     * @param arguments
     *            parsed call arguments
     * @return a future containing the tool execution result
     */
    CompletableFuture<ToolResult> execute(Session session, Map<String, Object> arguments);

    default String getToolName() {
        return getDefinition().getName();
    }
}
