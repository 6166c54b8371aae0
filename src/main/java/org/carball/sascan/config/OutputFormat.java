package org.carball.sascan.config;

public enum OutputFormat {
    JSON,
    MARKDOWN,
    BOTH
}
