package de.ovgu.commitminer.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import de.ovgu.commitminer.util.Json;
import org.apache.commons.io.IOUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests the class {@link PmdDaemonAnalyzer} against a local HTTP server.
 */
class PmdDaemonAnalyzerTest {
    @TempDir
    File root;

    private HttpServer server;
    private String url;
    private final List<String> receivedBodies = new CopyOnWriteArrayList<>();
    private volatile int responseCode = 200;
    private volatile String responseBody = "{\"files\": []}";
    private volatile long responseDelayMillis = 0;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.createContext("/analyze", this::handleAnalyze);
        server.setExecutor(null);
        server.start();
        url = "http://localhost:" + server.getAddress().getPort() + "/analyze";
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    private void handleAnalyze(HttpExchange exchange) throws IOException {
        receivedBodies.add(IOUtils.toString(exchange.getRequestBody(), StandardCharsets.UTF_8));
        if (responseDelayMillis > 0) {
            try {
                Thread.sleep(responseDelayMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        byte[] body = responseBody.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(responseCode, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    private AnalysisRequest request(String... files) {
        return new AnalysisRequest(root, new File(root, "ruleset.xml"), "lib/a.jar", Arrays.asList(files));
    }

    @Test
    void shouldPostRequestAndParseReport() throws IOException {
        responseBody = "{\"files\": [{\"filename\": \"" + new File(root, "A.java").getAbsolutePath().replace("\\", "\\\\")
                + "\", \"violations\": [{\"rule\": \"UnusedPrivateField\", \"beginline\": 4}]}]}";

        AnalysisReport report = new PmdDaemonAnalyzer(url, 5000).analyze(request("A.java", "pkg/B.java"));

        assertThat(report.countsByRule("A.java")).containsEntry("UnusedPrivateField", 1);
        assertThat(receivedBodies).hasSize(1);
        JsonNode sent = Json.mapper().readTree(receivedBodies.get(0));
        assertThat(sent.path("path").asText()).isEqualTo(root.getAbsolutePath());
        assertThat(sent.path("ruleset").asText()).endsWith("ruleset.xml");
        assertThat(sent.path("auxClasspath").asText()).isEqualTo("lib/a.jar");
        List<String> files = new ArrayList<>();
        for (JsonNode f : sent.path("files")) {
            files.add(f.asText());
        }
        assertThat(files).containsExactly("A.java", "pkg/B.java");
    }

    @Test
    void shouldNotCallDaemonWithoutFiles() {
        AnalysisReport report = new PmdDaemonAnalyzer(url, 5000).analyze(
                new AnalysisRequest(root, new File("ruleset.xml"), "", Collections.<String>emptyList()));

        assertThat(report.getViolationCount()).isZero();
        assertThat(receivedBodies).isEmpty();
    }

    @Test
    void shouldReportServerError() {
        responseCode = 500;
        responseBody = "java.lang.OutOfMemoryError";

        AnalysisException e = catchThrowableOfType(
                () -> new PmdDaemonAnalyzer(url, 5000).analyze(request("A.java")), AnalysisException.class);

        assertThat(e).hasMessageContaining("500").hasMessageContaining("OutOfMemoryError");
        assertThat(e.getFailureCause()).isEqualTo(AnalysisException.Cause.SERVER);
        assertThat(e.isRetryable()).isFalse();
    }

    @Test
    void shouldReportTimeout() {
        responseDelayMillis = 2000;

        AnalysisException e = catchThrowableOfType(
                () -> new PmdDaemonAnalyzer(url, 200).analyze(request("A.java")), AnalysisException.class);

        assertThat(e.getFailureCause()).isEqualTo(AnalysisException.Cause.TIMEOUT);
    }

    @Test
    void shouldReportUnreachableDaemonAsRetryable() {
        server.stop(0);
        server = null;

        AnalysisException e = catchThrowableOfType(
                () -> new PmdDaemonAnalyzer(url, 5000).analyze(request("A.java")), AnalysisException.class);

        assertThat(e.getFailureCause()).isEqualTo(AnalysisException.Cause.TRANSPORT);
        assertThat(e.isRetryable()).isTrue();
    }

    @Test
    void shouldReportMalformedResponse() {
        responseBody = "<html>not json</html>";

        AnalysisException e = catchThrowableOfType(
                () -> new PmdDaemonAnalyzer(url, 5000).analyze(request("A.java")), AnalysisException.class);

        assertThat(e.getFailureCause()).isEqualTo(AnalysisException.Cause.REPORT);
    }
}
