package com.autonomous.shellagent.service;

import com.autonomous.shellagent.config.AgentProperties;
import com.autonomous.shellagent.model.SessionProfile;
import com.autonomous.shellagent.model.TaskPriority;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads per-session profiles from YAML files ({@code session_id}, {@code shell_command}, ...).
 * <p>
 * Files are read in name order. A profile that fails validation is skipped as a whole, and when two files
 * claim the same session the first one wins. Sessions without a profile run with the defaults.
 */
@Slf4j
@Service
public class SessionProfileLoader {

    private String profilePath;

    private final Map<String, SessionProfile> profiles = new ConcurrentHashMap<>();
    private final ObjectMapper yamlMapper;

    public SessionProfileLoader(AgentProperties properties) {
        this.profilePath = properties.getSessionProfilePath();
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        this.yamlMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public void setProfilePath(String path) {
        this.profilePath = path;
    }

    @PostConstruct
    public void loadProfiles() {
        profiles.clear();
        Path dir = Paths.get(profilePath);
        if (!Files.isDirectory(dir)) {
            log.info("Session profile directory not found: {}", profilePath);
            return;
        }

        for (Path file : profileFiles(dir)) {
            SessionProfile profile;
            try {
                profile = yamlMapper.readValue(file.toFile(), SessionProfile.class);
            } catch (IOException e) {
                log.error("Failed to load profile from {}: {}", file.getFileName(), e.getMessage());
                continue;
            }
            if (profile == null) {
                log.warn("Skipping {}: empty file", file.getFileName());
                continue;
            }

            List<String> problems = validate(profile);
            if (!problems.isEmpty()) {
                log.warn("Skipping {}: {}", file.getFileName(), String.join("; ", problems));
                continue;
            }
            if (profile.getDefaultPriority() == null) {
                profile.setDefaultPriority(TaskPriority.MEDIUM);
            }

            SessionProfile existing = profiles.putIfAbsent(profile.getSessionId(), profile);
            if (existing != null) {
                log.warn("Skipping {}: session {} already has a profile", file.getFileName(), profile.getSessionId());
            } else {
                log.info("Loaded profile for session: {}", profile.getSessionId());
            }
        }
    }

    /**
     * Problems that make a profile unusable; empty when the profile can be used.
     */
    public List<String> validate(SessionProfile profile) {
        List<String> problems = new ArrayList<>();
        if (profile.getSessionId() == null || profile.getSessionId().isBlank()) {
            problems.add("no session_id");
        }

        List<String> shellCommand = profile.getShellCommand();
        if (shellCommand != null) {
            if (shellCommand.isEmpty()) {
                problems.add("shell_command is empty");
            } else if (shellCommand.stream().anyMatch(part -> part == null || part.isBlank())) {
                problems.add("shell_command has a blank entry");
            }
        }

        String workingDirectory = profile.getWorkingDirectory();
        if (workingDirectory != null && !Files.isDirectory(Paths.get(workingDirectory))) {
            problems.add("working_directory " + workingDirectory + " is not a directory");
        }

        Map<String, String> environment = profile.getEnvironment();
        if (environment != null && environment.keySet().stream().anyMatch(key -> key == null || key.isBlank())) {
            problems.add("environment has a blank variable name");
        }
        return problems;
    }

    public Optional<SessionProfile> getProfile(String sessionId) {
        return Optional.ofNullable(profiles.get(sessionId));
    }

    /**
     * The stored profile, or a bare one carrying only the session id.
     */
    public SessionProfile resolve(String sessionId) {
        return getProfile(sessionId).orElseGet(() -> {
            SessionProfile profile = new SessionProfile();
            profile.setSessionId(sessionId);
            return profile;
        });
    }

    public Map<String, SessionProfile> getAllProfiles() {
        return Map.copyOf(profiles);
    }

    private static List<Path> profileFiles(Path dir) {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*.{yaml,yml}")) {
            stream.forEach(files::add);
        } catch (IOException e) {
            log.error("Failed to list profiles in {}: {}", dir, e.getMessage());
        }
        files.sort(null);
        return files;
    }
}
