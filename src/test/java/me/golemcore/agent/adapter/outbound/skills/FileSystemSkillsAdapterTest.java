package me.golemcore.agent.adapter.outbound.skills;

import me.golemcore.agent.domain.model.Skill;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileSystemSkillsAdapterTest {

    @TempDir
    Path skillsDir;

    private Path writeSkill(String dir, String content) throws IOException {
        Path skillDir = Files.createDirectories(skillsDir.resolve(dir));
        Path file = skillDir.resolve("SKILL.md");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private FileSystemSkillsAdapter adapter(Map<String, String> env) {
        return new FileSystemSkillsAdapter(skillsDir, env::get);
    }

    @Test
    void shouldParseFrontmatter() throws IOException {
        Path file = writeSkill("weather", """
                ---
                name: weather
                description: Look up forecasts
                always: false
                ---
                # Weather
                Use the forecast API.
                """);

        List<Skill> skills = adapter(Map.of()).listSkills();

        assertEquals(1, skills.size());
        Skill skill = skills.get(0);
        assertEquals("weather", skill.getName());
        assertEquals("Look up forecasts", skill.getDescription());
        assertFalse(skill.isAlways());
        assertTrue(skill.isAvailable());
        assertEquals(file, skill.getLocation());
    }

    @Test
    void shouldFallBackToDirectoryNameWithoutFrontmatter() throws IOException {
        writeSkill("notes", "# Notes\nJust a body.");

        Skill skill = adapter(Map.of()).listSkills().get(0);

        assertEquals("notes", skill.getName());
        assertEquals("", skill.getDescription());
    }

    @Test
    void shouldMarkSkillUnavailableWhenRequirementsMissing() throws IOException {
        writeSkill("github", """
                ---
                name: github
                description: Manage issues
                requires:
                  bins: [definitely-not-installed-binary]
                  env: [GITHUB_TOKEN]
                ---
                body
                """);

        assertFalse(adapter(Map.of("PATH", "")).listSkills().get(0).isAvailable());
    }

    @Test
    void shouldMarkSkillAvailableWhenRequirementsMet() throws IOException {
        Path bin = Files.createDirectories(skillsDir.resolve(".bin"));
        Path tool = Files.writeString(bin.resolve("mytool"), "#!/bin/sh\n");
        assertTrue(tool.toFile().setExecutable(true));
        writeSkill("tooling", """
                ---
                name: tooling
                requires:
                  bins: [mytool]
                  env: [API_TOKEN]
                ---
                body
                """);

        Skill skill = adapter(Map.of("PATH", bin.toString(), "API_TOKEN", "secret")).listSkills().stream()
                .filter(s -> s.getName().equals("tooling"))
                .findFirst()
                .orElseThrow();

        assertTrue(skill.isAvailable());
    }

    @Test
    void shouldListSkillsSortedByDirectory() throws IOException {
        writeSkill("zeta", "---\nname: zeta\n---\nz");
        writeSkill("alpha", "---\nname: alpha\nalways: true\n---\na");
        Files.createDirectories(skillsDir.resolve("empty"));

        List<Skill> skills = adapter(Map.of()).listSkills();

        assertEquals(List.of("alpha", "zeta"), skills.stream().map(Skill::getName).toList());
        assertTrue(skills.get(0).isAlways());
    }

    @Test
    void shouldReloadSkillWhenFileChanges() throws IOException {
        Path file = writeSkill("daily", "---\nname: daily\ndescription: v1\n---\nbody");
        FileSystemSkillsAdapter adapter = adapter(Map.of());
        assertEquals("v1", adapter.listSkills().get(0).getDescription());

        Files.writeString(file, "---\nname: daily\ndescription: v2\n---\nbody", StandardCharsets.UTF_8);
        Files.setLastModifiedTime(file, FileTime.from(Instant.now().plusSeconds(60)));

        assertEquals("v2", adapter.listSkills().get(0).getDescription());
    }

    @Test
    void shouldLoadSkillBody() throws IOException {
        String content = "---\nname: core\n---\nAlways be brief.";
        writeSkill("core", content);

        FileSystemSkillsAdapter adapter = adapter(Map.of());

        assertEquals(content, adapter.loadSkillBody("core"));
        assertEquals("", adapter.loadSkillBody("missing"));
        assertEquals("", adapter.loadSkillBody("../outside"));
    }

    @Test
    void shouldReturnEmptyListForMissingDirectory() {
        FileSystemSkillsAdapter adapter = new FileSystemSkillsAdapter(skillsDir.resolve("nope"), name -> null);

        assertTrue(adapter.listSkills().isEmpty());
    }
}
