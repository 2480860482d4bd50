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

import java.util.Objects;

/**
 * Conversation session identified by {@code channel:senderId}.
 *
 * <p>
 * Sessions have no lifecycle of their own: they exist as soon as any history,
 * summary or cursor is written under their key. {@link #storageKey()} derives
 * the filesystem-safe token used for per-session files.
 */
public record Session(String channel, String senderId) {

    private static final String SEPARATOR = ":";
    private static final char ESCAPE = '%';
    private static final String ESCAPED_CHARS = "%:/\\";
    private static final int HEX_RADIX = 16;

    public Session {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(senderId, "senderId");
    }

    /**
     * Parses a {@code channel:senderId} key. Everything after the first separator
     * belongs to the sender id, so {@code matrix:@alice:example.org} yields sender
     * {@code @alice:example.org}.
     */
    public static Session parse(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Session id must not be blank");
        }
        int idx = id.indexOf(SEPARATOR);
        if (idx <= 0 || idx == id.length() - 1) {
            throw new IllegalArgumentException("Session id must look like channel:sender, got: " + id);
        }
        return new Session(id.substring(0, idx), id.substring(idx + 1));
    }

    public String id() {
        return channel + SEPARATOR + senderId;
    }

    public String storageKey() {
        return toStorageKey(id());
    }

    /**
     * Percent-escapes {@code %}, {@code :}, {@code /} and backslash, so distinct
     * ids always map to distinct file names: {@code cli:local} becomes
     * {@code cli%3Alocal}.
     */
    public static String toStorageKey(String sessionId) {
        StringBuilder sb = new StringBuilder(sessionId.length() + 4);
        for (int i = 0; i < sessionId.length(); i++) {
            char c = sessionId.charAt(i);
            if (ESCAPED_CHARS.indexOf(c) >= 0) {
                sb.append(ESCAPE).append(String.format("%02X", (int) c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Reverses {@link #toStorageKey(String)}. A {@code %} not followed by two hex
     * digits is kept as is.
     */
    public static String fromStorageKey(String storageKey) {
        StringBuilder sb = new StringBuilder(storageKey.length());
        int i = 0;
        while (i < storageKey.length()) {
            char c = storageKey.charAt(i);
            if (c == ESCAPE && i + 2 < storageKey.length() && isHexPair(storageKey, i + 1)) {
                sb.append((char) Integer.parseInt(storageKey.substring(i + 1, i + 3), HEX_RADIX));
                i += 3;
            } else {
                sb.append(c);
                i++;
            }
        }
        return sb.toString();
    }

    private static boolean isHexPair(String value, int start) {
        return Character.digit(value.charAt(start), HEX_RADIX) >= 0
                && Character.digit(value.charAt(start + 1), HEX_RADIX) >= 0;
    }

    @Override
    public String toString() {
        return id();
    }
}
