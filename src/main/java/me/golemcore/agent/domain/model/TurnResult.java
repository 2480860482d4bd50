package me.golemcore.agent.domain.model;

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

/**
 * Summary of one processed inbound message.
 *
 * @param finalText
 *            reply text delivered to the channel (error line for failed model
 *            calls)
 * @param toolRounds
 *            number of completed tool-call rounds
 * @param outcome
 *            how the turn ended
 */
public record TurnResult(String finalText, int toolRounds, Outcome outcome) {

    public enum Outcome {
        COMPLETED, ROUNDS_EXHAUSTED, MODEL_FAILED
    }
}
