package org.carball.sascan.config;

import lombok.Getter;

import java.util.Arrays;
import java.util.stream.Collectors;

@Getter
public enum AnalysisProfile {

    STRICT("strict", "Flag anything that will need attention during migration", 2, 7),

    BALANCED("balanced", "McCabe's conventional limits - default settings", 3, 10),

    LENIENT("lenient", "Only flag the worst offenders in large legacy code bases", 5, 15);

    private final String name;
    private final String description;
    private final int maxMacroParameters;
    private final int highComplexityThreshold;

    AnalysisProfile(String name, String description, int maxMacroParameters, int highComplexityThreshold) {
        this.name = name;
        this.description = description;
        this.maxMacroParameters = maxMacroParameters;
        this.highComplexityThreshold = highComplexityThreshold;
    }

    public ThresholdConfig buildThresholds() {
        return ThresholdConfig.builder()
                .profileName(name)
                .maxMacroParameters(maxMacroParameters)
                .highComplexityThreshold(highComplexityThreshold)
                .build();
    }

    /**
     * Finds profile by name (case-insensitive).
     */
    public static AnalysisProfile fromName(String name) {
        for (AnalysisProfile profile : values()) {
            if (profile.getName().equalsIgnoreCase(name)) {
                return profile;
            }
        }
        throw new IllegalArgumentException("Unknown analysis profile: " + name +
                ". Available profiles: " + getAvailableProfiles());
    }

    public static String getAvailableProfiles() {
        return Arrays.stream(values())
                .map(AnalysisProfile::getName)
                .collect(Collectors.joining(", "));
    }

    public static String getProfileHelp() {
        StringBuilder help = new StringBuilder("Available Analysis Profiles:\n\n");
        for (AnalysisProfile profile : values()) {
            help.append(String.format("  %-10s %s (macro params > %d, complexity > %d)%n",
                    profile.getName(), profile.getDescription(),
                    profile.getMaxMacroParameters(), profile.getHighComplexityThreshold()));
        }
        return help.toString();
    }
}
