package org.carball.sascan.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@Slf4j
public class ThresholdConfig {

    public static final int DEFAULT_MAX_MACRO_PARAMETERS = 3;
    public static final int DEFAULT_HIGH_COMPLEXITY_THRESHOLD = 10;
    public static final String DEFAULT_SOURCE_EXTENSION = ".sas";

    // Macros declaring more parameters than this are flagged
    @JsonProperty("max_macro_parameters")
    @Builder.Default
    private int maxMacroParameters = DEFAULT_MAX_MACRO_PARAMETERS;

    // Units scoring strictly above this are flagged
    @JsonProperty("high_complexity_threshold")
    @Builder.Default
    private int highComplexityThreshold = DEFAULT_HIGH_COMPLEXITY_THRESHOLD;

    @JsonProperty("source_extension")
    @Builder.Default
    private String sourceExtension = DEFAULT_SOURCE_EXTENSION;

    @JsonProperty("profile_name")
    @Builder.Default
    private String profileName = "default";

    public static ThresholdConfig defaults() {
        return ThresholdConfig.builder().build();
    }

    /**
     * Logs a warning for every value that would make the analysis meaningless. Nothing is rejected.
     */
    public void validate() {
        if (maxMacroParameters < 0) {
            log.warn("Max macro parameters ({}) should not be negative", maxMacroParameters);
        }

        if (highComplexityThreshold < 1) {
            log.warn("High complexity threshold ({}) should be at least 1; every unit will be flagged",
                    highComplexityThreshold);
        }

        if (sourceExtension == null || sourceExtension.isBlank()) {
            log.warn("Source extension is empty; every regular file will be analyzed");
        }

        log.debug("Using thresholds - Macro params: {}, Complexity: {}, Extension: {}, Profile: {}",
                maxMacroParameters, highComplexityThreshold, sourceExtension, profileName);
    }

    public String getDescription() {
        return String.format("Profile: %s | Max macro params: %d | High complexity: %d | Extension: %s",
                profileName, maxMacroParameters, highComplexityThreshold, sourceExtension);
    }
}
