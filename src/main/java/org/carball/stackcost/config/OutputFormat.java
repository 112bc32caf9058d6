package org.carball.stackcost.config;

public enum OutputFormat {
    JSON,
    MARKDOWN,
    BOTH
}
