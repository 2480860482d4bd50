package me.golemcore.agent.adapter.outbound.skills;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.Skill;
import me.golemcore.agent.infrastructure.config.BotProperties;
import me.golemcore.agent.port.outbound.SkillsPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Discovers skills stored as {@code <directory>/<name>/SKILL.md}.
 *
 * <p>
 * Each file may start with YAML frontmatter:
 *
 * <pre>
 * ---
 * name: weather
 * description: Look up forecasts
 * always: false
 * requires:
 *   bins: [curl]
 *   env: [WEATHER_API_KEY]
 * ---
 * </pre>
 *
 * A skill whose required binaries are not on {@code PATH} or whose required
 * environment variables are unset is listed as unavailable. Parsed metadata is
 * cached per file and reloaded when the file's modification time changes.
 */
@Component
@Slf4j
public class FileSystemSkillsAdapter implements SkillsPort {

    private static final String SKILL_FILE = "SKILL.md";
    private static final Pattern FRONTMATTER_PATTERN = Pattern.compile(
            "^---\\s*\\n(.*?)\\n---\\s*\\n?(.*)$", Pattern.DOTALL);

    private final Path directory;
    private final UnaryOperator<String> environment;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final Map<Path, CachedSkill> cache = new ConcurrentHashMap<>();

    @Autowired
    public FileSystemSkillsAdapter(BotProperties properties) {
        this(Paths.get(BotProperties.expandUserHome(properties.getSkills().getDirectory())), System::getenv);
    }

    FileSystemSkillsAdapter(Path directory, UnaryOperator<String> environment) {
        this.directory = directory.toAbsolutePath().normalize();
        this.environment = environment;
    }

    @Override
    public List<Skill> listSkills() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<Skill> skills = new ArrayList<>();
        try (Stream<Path> entries = Files.list(directory)) {
            List<Path> skillDirs = entries.filter(Files::isDirectory).sorted().toList();
            for (Path skillDir : skillDirs) {
                Path skillFile = skillDir.resolve(SKILL_FILE);
                if (Files.isRegularFile(skillFile)) {
                    Skill skill = loadCached(skillFile, skillDir.getFileName().toString());
                    if (skill != null) {
                        skills.add(skill);
                    }
                }
            }
        } catch (IOException e) {
            log.warn("[Skills] Failed to list skills in {}: {}", directory, e.getMessage());
        }
        return skills;
    }

    @Override
    public String loadSkillBody(String name) {
        Path skillFile = directory.resolve(name).resolve(SKILL_FILE).normalize();
        if (!skillFile.startsWith(directory) || !Files.isRegularFile(skillFile)) {
            return "";
        }
        try {
            return Files.readString(skillFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("[Skills] Failed to read skill {}: {}", name, e.getMessage());
            return "";
        }
    }

    private Skill loadCached(Path skillFile, String dirName) {
        FileTime modified;
        try {
            modified = Files.getLastModifiedTime(skillFile);
        } catch (IOException e) {
            log.debug("[Skills] Cannot stat {}: {}", skillFile, e.getMessage());
            return null;
        }
        CachedSkill cached = cache.get(skillFile);
        if (cached != null && cached.modified().equals(modified)) {
            return cached.skill();
        }
        try {
            Skill skill = parseSkill(Files.readString(skillFile, StandardCharsets.UTF_8), skillFile, dirName);
            cache.put(skillFile, new CachedSkill(modified, skill));
            log.debug("[Skills] Loaded skill: {}", skill.getName());
            return skill;
        } catch (IOException e) {
            log.warn("[Skills] Failed to load skill: {}", skillFile, e);
            return null;
        }
    }

    @SuppressWarnings("unchecked")
    private Skill parseSkill(String content, Path skillFile, String dirName) {
        String name = dirName;
        String description = "";
        boolean always = false;
        boolean available = true;

        Matcher matcher = FRONTMATTER_PATTERN.matcher(content);
        if (matcher.matches()) {
            try {
                Map<String, Object> yaml = yamlMapper.readValue(matcher.group(1), Map.class);
                if (yaml != null) {
                    name = String.valueOf(yaml.getOrDefault("name", dirName));
                    description = String.valueOf(yaml.getOrDefault("description", ""));
                    always = Boolean.TRUE.equals(yaml.get("always"));
                    available = checkRequirements(name, yaml.get("requires"));
                }
            } catch (IOException | RuntimeException e) {
                log.warn("[Skills] Failed to parse skill frontmatter: {}", skillFile, e);
            }
        }

        return Skill.builder()
                .name(name)
                .description(description)
                .location(skillFile)
                .always(always)
                .available(available)
                .build();
    }

    @SuppressWarnings("unchecked")
    private boolean checkRequirements(String skillName, Object requires) {
        if (!(requires instanceof Map)) {
            return true;
        }
        Map<String, Object> requirements = (Map<String, Object>) requires;
        List<String> missing = new ArrayList<>();
        for (String bin : asStrings(requirements.get("bins"))) {
            if (!isOnPath(bin)) {
                missing.add("CLI: " + bin);
            }
        }
        for (String env : asStrings(requirements.get("env"))) {
            String value = environment.apply(env);
            if (value == null || value.isBlank()) {
                missing.add("env: " + env);
            }
        }
        if (!missing.isEmpty()) {
            log.info("[Skills] Skill {} unavailable, missing {}", skillName, missing);
        }
        return missing.isEmpty();
    }

    private boolean isOnPath(String binary) {
        String path = environment.apply("PATH");
        if (path == null || path.isBlank()) {
            return false;
        }
        for (String dir : path.split(File.pathSeparator)) {
            if (!dir.isBlank() && Files.isExecutable(Paths.get(dir, binary))) {
                return true;
            }
        }
        return false;
    }

    private static List<String> asStrings(Object value) {
        if (value instanceof List<?> list) {
            return list.stream().filter(Objects::nonNull).map(String::valueOf).toList();
        }
        if (value instanceof String s && !s.isBlank()) {
            return List.of(s);
        }
        return List.of();
    }

    private record CachedSkill(FileTime modified, Skill skill) {
    }
}
