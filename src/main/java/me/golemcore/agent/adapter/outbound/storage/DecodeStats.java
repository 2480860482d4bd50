package me.golemcore.agent.adapter.outbound.storage;

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
 * Malformed-line bookkeeping for one history read: how many lines were skipped
 * and a short preview of the first one.
 */
final class DecodeStats {

    private static final int PREVIEW_LENGTH = 80;

    private int malformed;
    private String firstPreview;

    void recordMalformed(String line) {
        if (malformed == 0) {
            firstPreview = line.length() <= PREVIEW_LENGTH ? line : line.substring(0, PREVIEW_LENGTH) + "...";
        }
        malformed++;
    }

    int malformed() {
        return malformed;
    }

    String firstPreview() {
        return firstPreview;
    }

    boolean hasMalformed() {
        return malformed > 0;
    }
}
