package com.scholary.sorter.paths;

/** Published after staged roots have been promoted to current. */
public record PathsConfirmedEvent(PathsConfig.Roots previous, PathsConfig.Roots current) {}
