package me.golemcore.agent.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.ScheduledJob;
import me.golemcore.agent.port.outbound.ConversationStorePort;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Service;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Domain service for managing scheduled jobs. The job list is persisted as a
 * whole through {@link ConversationStorePort#saveJobs(List)}; every mutation
 * is a load, modify, save cycle.
 *
 * <p>
 * Firing jobs is the job of an external scheduler; this service only keeps
 * the list valid.
 */
@Service
@Slf4j
public class ScheduledJobService {

    private static final String INTERVAL_PREFIX = "every ";
    private static final int CRON_FIVE_FIELDS = 5;
    private static final int CRON_SIX_FIELDS = 6;
    private static final int ID_LENGTH = 8;

    private final ConversationStorePort store;

    public ScheduledJobService(ConversationStorePort store) {
        this.store = store;
    }

    /**
     * Validates and appends a new job.
     *
     * @throws IllegalArgumentException
     *             if a required field is missing, the schedule is neither a 5/6
     *             field cron expression nor {@code every N}, or the timezone is
     *             unknown
     */
    public synchronized ScheduledJob addJob(String name, String message, String schedule, String timezone,
            String channel, boolean enabled) {
        requireText(name, "name");
        requireText(message, "message");
        requireText(schedule, "schedule");
        if (!isValidSchedule(schedule)) {
            throw new IllegalArgumentException(
                    "Invalid schedule '" + schedule + "'. Use cron syntax or 'every N'.");
        }
        String zone = timezone == null || timezone.isBlank() ? ScheduledJob.DEFAULT_TIMEZONE : timezone.trim();
        try {
            ZoneId.of(zone);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Unknown timezone: " + zone, e);
        }

        ScheduledJob job = ScheduledJob.builder()
                .id(generateId())
                .name(name)
                .message(message)
                .schedule(schedule.trim())
                .channel(channel == null || channel.isBlank() ? ScheduledJob.DEFAULT_CHANNEL : channel)
                .enabled(enabled)
                .timezone(zone)
                .metadata(new LinkedHashMap<>())
                .build();

        List<ScheduledJob> jobs = new ArrayList<>(store.loadJobs().join());
        jobs.add(job);
        store.saveJobs(jobs).join();
        log.info("[Jobs] Created job {} ({}) for {}: {}", job.getId(), name, job.getChannel(), job.getSchedule());
        return job;
    }

    public List<ScheduledJob> listJobs() {
        return store.loadJobs().join();
    }

    /**
     * @return {@code false} if no job has the given id
     */
    public synchronized boolean removeJob(String id) {
        List<ScheduledJob> jobs = store.loadJobs().join();
        List<ScheduledJob> updated = jobs.stream()
                .filter(job -> !job.getId().equals(id))
                .toList();
        if (updated.size() == jobs.size()) {
            return false;
        }
        store.saveJobs(updated).join();
        log.info("[Jobs] Removed job {}", id);
        return true;
    }

    /**
     * @return {@code false} if no job has the given id
     */
    public synchronized boolean setEnabled(String id, boolean enabled) {
        List<ScheduledJob> jobs = store.loadJobs().join();
        List<ScheduledJob> updated = new ArrayList<>(jobs.size());
        boolean found = false;
        for (ScheduledJob job : jobs) {
            if (job.getId().equals(id)) {
                found = true;
                updated.add(job.toBuilder().enabled(enabled).build());
            } else {
                updated.add(job);
            }
        }
        if (!found) {
            return false;
        }
        store.saveJobs(updated).join();
        log.info("[Jobs] {} job {}", enabled ? "Enabled" : "Disabled", id);
        return true;
    }

    public static String formatJobs(List<ScheduledJob> jobs) {
        if (jobs.isEmpty()) {
            return "No cron jobs configured.";
        }
        StringBuilder sb = new StringBuilder();
        for (ScheduledJob job : jobs) {
            if (!sb.isEmpty()) {
                sb.append('\n');
            }
            sb.append("  [").append(job.isEnabled() ? "on" : "off").append("] ")
                    .append(job.getId()).append("  ").append(job.getName()).append('\n');
            sb.append("       schedule: ").append(job.getSchedule())
                    .append("  timezone: ").append(job.getTimezone())
                    .append("  channel: ").append(job.getChannel()).append('\n');
            sb.append("       message:  ").append(job.getMessage());
        }
        return sb.toString();
    }

    /**
     * Accepts {@code every N} with a positive number of seconds, or a cron
     * expression with 5 fields (minute precision) or 6 fields (leading seconds).
     */
    public static boolean isValidSchedule(String schedule) {
        if (schedule == null || schedule.isBlank()) {
            return false;
        }
        String trimmed = schedule.trim();
        if (trimmed.toLowerCase(Locale.ROOT).startsWith(INTERVAL_PREFIX)) {
            String[] parts = trimmed.split("\\s+");
            if (parts.length != 2) {
                return false;
            }
            try {
                return Long.parseLong(parts[1]) > 0;
            } catch (NumberFormatException e) {
                return false;
            }
        }
        String[] fields = trimmed.split("\\s+");
        String cron;
        if (fields.length == CRON_FIVE_FIELDS) {
            cron = "0 " + trimmed;
        } else if (fields.length == CRON_SIX_FIELDS) {
            cron = trimmed;
        } else {
            return false;
        }
        try {
            CronExpression.parse(cron);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static String generateId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, ID_LENGTH);
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }
}
