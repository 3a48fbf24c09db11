package org.carball.plandoctor.config;

public enum OutputFormat {
    JSON,
    MARKDOWN,
    BOTH
}
