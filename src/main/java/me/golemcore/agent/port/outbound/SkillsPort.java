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

import me.golemcore.agent.domain.model.Skill;

import java.util.List;

/**
 * Port for skill discovery. Supplies capability descriptions for the system
 * prompt index and full bodies for always-on skills.
 */
public interface SkillsPort {

    List<Skill> listSkills();

    /**
     * Returns the full {@code SKILL.md} text of a named skill, or an empty string
     * if it is unknown.
     */
    String loadSkillBody(String name);
}
