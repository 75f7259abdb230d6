package com.scholary.sorter.paths;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Fallback roots used until a confirm has been persisted.
 *
 * <p>These map to the "paths.*" keys in application.yml; both may be left empty.
 */
@ConfigurationProperties(prefix = "paths")
public record PathsProperties(String sourceDir, String targetDir) {}
