package org.carball.sascan.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    static final String ENV_MAX_MACRO_PARAMETERS = "SASCAN_MAX_MACRO_PARAMETERS";
    static final String ENV_HIGH_COMPLEXITY_THRESHOLD = "SASCAN_HIGH_COMPLEXITY_THRESHOLD";
    static final String ENV_SOURCE_EXTENSION = "SASCAN_SOURCE_EXTENSION";

    private final Map<String, String> environment;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > defaults
     */
    public ThresholdConfig loadConfiguration(String[] args) {
        return loadConfiguration(null, null, args);
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > threshold file > profile > defaults.
     * Either the profile name or the threshold file may be null.
     */
    public ThresholdConfig loadConfiguration(String profileName, Path thresholdFile, String[] args) {
        log.debug("Loading configuration");

        ThresholdConfig base = profileName != null ? loadProfile(profileName) : ThresholdConfig.defaults();
        if (thresholdFile != null) {
            base = loadThresholdFile(thresholdFile, base);
        }

        ThresholdConfig.ThresholdConfigBuilder builder = base.toBuilder();
        applyEnvironmentVariables(builder);
        applyCLIArguments(builder, args);

        ThresholdConfig thresholds = builder.build();
        thresholds.validate();

        log.info("Configuration loaded: {}", thresholds.getDescription());
        return thresholds;
    }

    public ThresholdConfig loadProfile(String profileName) {
        try {
            AnalysisProfile profile = AnalysisProfile.fromName(profileName);
            ThresholdConfig thresholds = profile.buildThresholds();
            log.info("Loaded profile '{}': {}", profileName, thresholds.getDescription());
            return thresholds;
        } catch (IllegalArgumentException e) {
            log.error("Unknown profile: {}. {}", profileName, e.getMessage());
            throw e;
        }
    }

    /**
     * Overlays the values present in a YAML file onto {@code base}. A missing or unreadable file
     * leaves {@code base} unchanged.
     */
    public ThresholdConfig loadThresholdFile(Path thresholdFile, ThresholdConfig base) {
        if (!Files.exists(thresholdFile)) {
            log.warn("Threshold config file not found: {}, using {} thresholds", thresholdFile, base.getProfileName());
            return base;
        }

        try {
            ThresholdConfig target = base.toBuilder().build();
            ThresholdConfig loaded = yamlMapper.readerForUpdating(target).readValue(thresholdFile.toFile());
            log.info("Loaded threshold configuration from: {}", thresholdFile);
            return loaded;
        } catch (IOException e) {
            log.error("Failed to load threshold config from {}: {}, using {} thresholds",
                    thresholdFile, e.getMessage(), base.getProfileName());
            return base;
        }
    }

    private void applyEnvironmentVariables(ThresholdConfig.ThresholdConfigBuilder builder) {
        String maxParams = environment.get(ENV_MAX_MACRO_PARAMETERS);
        if (maxParams != null) {
            try {
                builder.maxMacroParameters(Integer.parseInt(maxParams.trim()));
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", ENV_MAX_MACRO_PARAMETERS, maxParams);
            }
        }

        String complexity = environment.get(ENV_HIGH_COMPLEXITY_THRESHOLD);
        if (complexity != null) {
            try {
                builder.highComplexityThreshold(Integer.parseInt(complexity.trim()));
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", ENV_HIGH_COMPLEXITY_THRESHOLD, complexity);
            }
        }

        String extension = environment.get(ENV_SOURCE_EXTENSION);
        if (extension != null && !extension.isBlank()) {
            builder.sourceExtension(normalizeExtension(extension));
        }
    }

    private void applyCLIArguments(ThresholdConfig.ThresholdConfigBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--thresholds.max-macro-parameters":
                        builder.maxMacroParameters(Integer.parseInt(value));
                        break;
                    case "--thresholds.high-complexity":
                        builder.highComplexityThreshold(Integer.parseInt(value));
                        break;
                    case "--extension":
                        builder.sourceExtension(normalizeExtension(value));
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }
    }

    static String normalizeExtension(String extension) {
        String trimmed = extension.trim();
        return trimmed.startsWith(".") ? trimmed : "." + trimmed;
    }

    /**
     * Returns help text for threshold configuration options.
     */
    public static String getThresholdHelp() {
        return """
            Threshold Configuration Options:

            CLI Arguments:
              --thresholds.max-macro-parameters <num>  Flag macros declaring more parameters
              --thresholds.high-complexity <num>       Flag units whose complexity exceeds this
              --extension <ext>                        Source file extension to analyze

            Environment Variables:
              SASCAN_MAX_MACRO_PARAMETERS              Same as --thresholds.max-macro-parameters
              SASCAN_HIGH_COMPLEXITY_THRESHOLD         Same as --thresholds.high-complexity
              SASCAN_SOURCE_EXTENSION                  Same as --extension

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Threshold file (--thresholds)
              4. Profile (--profile) or built-in defaults
            """;
    }
}
