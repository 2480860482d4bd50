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

import me.golemcore.agent.domain.model.Skill;

import java.util.List;

/**
 * Renders the {@code <available_skills>} index appended to the system prompt.
 * Always-on skills are left out; their full body is injected instead.
 */
final class SkillsXml {

    private SkillsXml() {
    }

    static String render(List<Skill> skills) {
        StringBuilder sb = new StringBuilder("<available_skills>\n");
        for (Skill skill : skills) {
            if (skill.isAlways()) {
                continue;
            }
            sb.append("  <skill available=\"").append(skill.isAvailable()).append("\">\n");
            element(sb, "name", skill.getName());
            element(sb, "description", skill.getDescription());
            if (skill.getLocation() != null) {
                element(sb, "location", skill.getLocation().toString());
            }
            sb.append("  </skill>\n");
        }
        return sb.append("</available_skills>").toString();
    }

    private static void element(StringBuilder sb, String tag, String value) {
        sb.append("    <").append(tag).append('>')
                .append(escape(value != null ? value : ""))
                .append("</").append(tag).append(">\n");
    }

    static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
            case '<' -> sb.append("&lt;");
            case '>' -> sb.append("&gt;");
            case '&' -> sb.append("&amp;");
            case '"' -> sb.append("&quot;");
            default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
