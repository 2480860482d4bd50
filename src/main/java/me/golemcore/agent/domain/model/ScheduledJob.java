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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A scheduled job: a message delivered to a target session on a cron or
 * interval schedule. Persisted as part of the whole job list in
 * {@code cron/jobs.json}.
 *
 * <p>
 * {@code schedule} is either a cron expression ({@code "0 9 * * *"}) or an
 * interval ({@code "every 3600"}, seconds). {@code channel} holds the target
 * session id, e.g. {@code "cli:local"}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ScheduledJob {

    public static final String DEFAULT_CHANNEL = "cli:local";
    public static final String DEFAULT_TIMEZONE = "UTC";

    private String id;
    private String name;
    private String message;
    private String schedule;

    @Builder.Default
    private String channel = DEFAULT_CHANNEL;

    @Builder.Default
    private boolean enabled = true;

    @Builder.Default
    private String timezone = DEFAULT_TIMEZONE;

    private Instant lastRun;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();
}
