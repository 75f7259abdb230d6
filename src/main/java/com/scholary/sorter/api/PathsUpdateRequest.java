package com.scholary.sorter.api;

/**
 * Body of {@code POST /api/paths}: either roots to stage or an {@code action} of {@code confirm} or
 * {@code cancel}.
 */
public record PathsUpdateRequest(String sourceDir, String targetDir, String action) {}
