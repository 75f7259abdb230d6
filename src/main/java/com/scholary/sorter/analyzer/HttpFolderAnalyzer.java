package com.scholary.sorter.analyzer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.sorter.job.Proposal;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the remote proposal service.
 *
 * <p>Sends the folder snapshot as JSON to {@code POST {baseUrl}/api/v1/propose} and reads back a
 * {@link Proposal}. Transport failures and non-2xx answers are retried with exponential backoff;
 * a response that parses but carries no usable fields is not retried.
 */
public class HttpFolderAnalyzer implements FolderAnalyzer {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpFolderAnalyzer.class);

  static final String PROPOSE_PATH = "/api/v1/propose";

  private final HttpClient httpClient;
  private final AnalyzerProperties properties;
  private final ObjectMapper objectMapper;

  public HttpFolderAnalyzer(AnalyzerProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info("Initialized analyzer client: baseUrl={}", properties.baseUrl());
  }

  @Override
  public Proposal analyze(AnalysisRequest request) {
    LOGGER.info(
        "Requesting proposal: folder={}, files={}, feedback={}",
        request.folderPath(),
        request.metadata() == null ? 0 : request.metadata().totalFiles(),
        request.feedback() != null);

    int attempt = 0;
    Exception lastException = null;

    while (attempt < properties.maxRetries()) {
      try {
        return attemptAnalyze(request);
      } catch (IOException e) {
        lastException = e;
        attempt++;
        if (attempt < properties.maxRetries()) {
          long backoffMs =
              (long) (Math.pow(2, attempt - 1) * properties.retryBackoffMillis()
                  + Math.random() * properties.retryBackoffMillis());
          LOGGER.warn(
              "Analyzer attempt {} failed, retrying in {}ms: {}", attempt, backoffMs, e.getMessage());
          sleep(backoffMs);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new AnalyzerException("Analyzer call interrupted", e);
      }
    }

    throw new AnalyzerException(
        String.format(
            "Analyzer failed after %d attempts: %s",
            properties.maxRetries(), lastException == null ? "no attempt" : lastException.getMessage()),
        lastException);
  }

  private Proposal attemptAnalyze(AnalysisRequest analysisRequest)
      throws IOException, InterruptedException {
    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + PROPOSE_PATH))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .POST(BodyPublishers.ofString(objectMapper.writeValueAsString(analysisRequest)))
            .build();

    LOGGER.debug("Sending proposal request to {}", request.uri());

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    if (response.statusCode() / 100 != 2) {
      throw new IOException(
          String.format(
              "Analyzer returned status %d: %s", response.statusCode(), response.body()));
    }

    Proposal proposal = parse(response.body());
    LOGGER.info(
        "Proposal received: artist={}, album={}, year={}, confidence={}",
        proposal.artist(),
        proposal.album(),
        proposal.year(),
        proposal.confidence());
    return proposal;
  }

  private Proposal parse(String body) {
    Proposal proposal;
    try {
      proposal = objectMapper.readValue(body, Proposal.class);
    } catch (JsonProcessingException e) {
      throw new AnalyzerException("Malformed analyzer response: " + e.getOriginalMessage(), e);
    }
    if (proposal == null || proposal.isBlank()) {
      throw new AnalyzerException("Analyzer returned an empty proposal");
    }
    return proposal;
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new AnalyzerException("Analyzer call interrupted", ie);
    }
  }
}
