package org.carball.gantry.config;

public enum OutputFormat {
    JSON,
    MARKDOWN,
    BOTH
}
