package com.scholary.sorter.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.sorter.analyzer.AnalyzerProperties;
import com.scholary.sorter.analyzer.FolderAnalyzer;
import com.scholary.sorter.analyzer.HeuristicFolderAnalyzer;
import com.scholary.sorter.analyzer.HttpFolderAnalyzer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the folder analyzer.
 *
 * <p>Enables the AnalyzerProperties to be loaded from application.yml and picks the implementation
 * named by {@code analyzer.provider}.
 */
@Configuration
@EnableConfigurationProperties(AnalyzerProperties.class)
public class AnalyzerConfig {

  @Bean
  public FolderAnalyzer folderAnalyzer(AnalyzerProperties properties, ObjectMapper objectMapper) {
    return switch (properties.provider()) {
      case HTTP -> new HttpFolderAnalyzer(properties, objectMapper);
      case HEURISTIC -> new HeuristicFolderAnalyzer();
    };
  }
}
