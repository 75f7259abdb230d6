package com.scholary.sorter.analyzer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.scholary.sorter.analyzer.AnalyzerProperties.Provider;
import com.scholary.sorter.job.FolderMetadata;
import com.scholary.sorter.job.Proposal;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests for the HTTP analyzer against an in-process HTTP server. */
class HttpFolderAnalyzerTest {

  private final ObjectMapper objectMapper =
      new ObjectMapper().setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
  private final Queue<String> requestBodies = new ConcurrentLinkedQueue<>();
  private final AtomicInteger calls = new AtomicInteger();
  private final Queue<Reply> replies = new ConcurrentLinkedQueue<>();

  private HttpServer server;
  private HttpFolderAnalyzer analyzer;

  private record Reply(int status, String body) {}

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext(
        HttpFolderAnalyzer.PROPOSE_PATH,
        exchange -> {
          calls.incrementAndGet();
          requestBodies.add(
              new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
          Reply reply = replies.isEmpty() ? new Reply(500, "no reply queued") : replies.poll();
          byte[] body = reply.body().getBytes(StandardCharsets.UTF_8);
          exchange.getResponseHeaders().add("Content-Type", "application/json");
          exchange.sendResponseHeaders(reply.status(), body.length);
          try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
          }
        });
    server.start();

    String baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    analyzer =
        new HttpFolderAnalyzer(
            new AnalyzerProperties(Provider.HTTP, baseUrl, 5, 5, 3, 1), objectMapper);
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
  }

  @Test
  void analyze_shouldPostTheSnapshotAndReadTheProposal() throws Exception {
    replies.add(
        new Reply(
            200, "{\"artist\":\"X\",\"album\":\"Y\",\"year\":2001,\"release_type\":\"album\"}"));

    Proposal proposal = analyzer.analyze(request("wrong genre"));

    assertThat(proposal).isEqualTo(new Proposal("X", "Y", "2001", "album", null, null));
    JsonNode sent = objectMapper.readTree(requestBodies.poll());
    assertThat(sent.get("folder_path").asText()).isEqualTo("/music/A");
    assertThat(sent.get("feedback").asText()).isEqualTo("wrong genre");
    assertThat(sent.get("metadata").get("total_files").asInt()).isEqualTo(2);
    assertThat(sent.get("metadata").get("files")).hasSize(2);
  }

  @Test
  void analyze_shouldRetryServerErrorsThenSucceed() {
    replies.add(new Reply(503, "busy"));
    replies.add(new Reply(200, "{\"artist\":\"X\",\"album\":\"Y\"}"));

    Proposal proposal = analyzer.analyze(request(null));

    assertThat(proposal.artist()).isEqualTo("X");
    assertThat(calls.get()).isEqualTo(2);
  }

  @Test
  void analyze_shouldGiveUpAfterMaxRetries() {
    assertThatThrownBy(() -> analyzer.analyze(request(null)))
        .isInstanceOf(AnalyzerException.class)
        .hasMessageContaining("after 3 attempts");
    assertThat(calls.get()).isEqualTo(3);
  }

  @Test
  void analyze_shouldFailWithoutRetryOnAMalformedResponse() {
    replies.add(new Reply(200, "this is not json"));

    assertThatThrownBy(() -> analyzer.analyze(request(null)))
        .isInstanceOf(AnalyzerException.class)
        .hasMessageContaining("Malformed");
    assertThat(calls.get()).isEqualTo(1);
  }

  @Test
  void analyze_shouldRejectAnEmptyProposal() {
    replies.add(new Reply(200, "{\"reasoning\":\"no idea\"}"));

    assertThatThrownBy(() -> analyzer.analyze(request(null)))
        .isInstanceOf(AnalyzerException.class)
        .hasMessageContaining("empty proposal");
  }

  private static AnalysisRequest request(String feedback) {
    return new AnalysisRequest(
        "/music/A", new FolderMetadata("A", 2, List.of("01.mp3", "02.mp3")), feedback, null);
  }
}
