package com.scholary.sorter.config;

import com.scholary.sorter.job.JobStoreProperties;
import com.scholary.sorter.paths.PathsProperties;
import com.scholary.sorter.status.EventsProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the job store and the components reading from it.
 *
 * <p>Enables the store, paths and events properties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties({
  JobStoreProperties.class,
  PathsProperties.class,
  EventsProperties.class
})
public class StoreConfig {}
