package com.powerlevel.tracker.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.powerlevel.tracker.exception.InvalidTrackerConfigException;
import com.powerlevel.tracker.model.TrackerConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

@Slf4j
@Service
public class ConfigLoaderService {

    static final List<String> CONFIG_LOCATIONS = List.of(".github-tracker.yaml", ".opencode/tracker.yaml");
    private static final Pattern REPO_SLUG_PATTERN = Pattern.compile("^[\\w.-]+/[\\w.-]+$");

    private final ObjectMapper yamlMapper;

    public ConfigLoaderService() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        this.yamlMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Reads the tracker config of a repository checkout, or defaults when it has none.
     *
     * @throws InvalidTrackerConfigException if the file exists but cannot be parsed or fails validation
     */
    public TrackerConfig loadConfig(Path repoDir) {
        Optional<Path> configFile = CONFIG_LOCATIONS.stream()
            .map(repoDir::resolve)
            .filter(Files::isRegularFile)
            .findFirst();

        if (configFile.isEmpty()) {
            log.debug("No tracker config in {}, using defaults", repoDir);
            return new TrackerConfig();
        }

        TrackerConfig config;
        try {
            config = yamlMapper.readValue(configFile.get().toFile(), TrackerConfig.class);
        } catch (IOException e) {
            throw new InvalidTrackerConfigException("Invalid YAML in " + configFile.get() + ": " + e.getMessage(), e);
        }
        if (config == null) {
            config = new TrackerConfig();
        }
        validate(config);
        log.info("Loaded tracker config from {}", configFile.get());
        return config;
    }

    public void validate(TrackerConfig config) {
        Integer boardNumber = config.getProjectBoard().getNumber();
        if (boardNumber != null && boardNumber < 1) {
            throw new InvalidTrackerConfigException("project_board.number must be null or a positive integer");
        }
        for (TrackerConfig.ExternalTracker tracker : config.getExternal().getTrackers()) {
            if (tracker.getEpicNumber() < 1) {
                throw new InvalidTrackerConfigException("external.trackers[].epic_number must be a positive integer");
            }
            if (tracker.getRepo() == null || !REPO_SLUG_PATTERN.matcher(tracker.getRepo()).matches()) {
                throw new InvalidTrackerConfigException(
                    "external.trackers[].repo must be owner/name, got: " + tracker.getRepo());
            }
        }
    }
}
