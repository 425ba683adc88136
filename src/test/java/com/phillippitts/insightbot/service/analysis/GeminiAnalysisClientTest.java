package com.phillippitts.insightbot.service.analysis;

import com.phillippitts.insightbot.config.properties.AnalysisClientProperties;
import com.phillippitts.insightbot.domain.AnalysisMode;
import com.phillippitts.insightbot.exception.AnalysisServiceException;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GeminiAnalysisClientTest {

    private static final String BASE = "https://gemini.test";

    @TempDir
    Path tempDir;

    private MockRestServiceServer server;
    private GeminiAnalysisClient client;

    @BeforeEach
    void setUp() {
        client = newClient("secret", true);
    }

    @Test
    void uploadReturnsActiveFileImmediately() throws IOException {
        // Arrange
        server.expect(requestTo(startsWith(BASE + "/upload/v1beta/files?key=secret")))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess(fileJson("files/abc", "ACTIVE").toString(), MediaType.APPLICATION_JSON));

        // Act
        UploadedAudio uploaded = client.upload(upload(5L, "Alice"));

        // Assert
        assertThat(uploaded.remoteName()).isEqualTo("files/abc");
        assertThat(uploaded.uri()).isEqualTo("https://files.test/files/abc");
        assertThat(uploaded.label()).isEqualTo("Alice");
        server.verify();
    }

    @Test
    void uploadPollsUntilFileIsActive() throws IOException {
        server.expect(requestTo(startsWith(BASE + "/upload/v1beta/files")))
                .andRespond(withSuccess(fileJson("files/abc", "PROCESSING").toString(), MediaType.APPLICATION_JSON));
        server.expect(requestTo(startsWith(BASE + "/v1beta/files/abc")))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(fileJson("files/abc", "PROCESSING").getJSONObject("file").toString(),
                        MediaType.APPLICATION_JSON));
        server.expect(requestTo(startsWith(BASE + "/v1beta/files/abc")))
                .andRespond(withSuccess(fileJson("files/abc", "ACTIVE").getJSONObject("file").toString(),
                        MediaType.APPLICATION_JSON));

        UploadedAudio uploaded = client.upload(upload(5L, "Alice"));

        assertThat(uploaded.remoteName()).isEqualTo("files/abc");
        server.verify();
    }

    @Test
    void failedProcessingIsFatalAndDeletesRemoteFile() throws IOException {
        server.expect(requestTo(startsWith(BASE + "/upload/v1beta/files")))
                .andRespond(withSuccess(fileJson("files/abc", "PROCESSING").toString(), MediaType.APPLICATION_JSON));
        server.expect(requestTo(startsWith(BASE + "/v1beta/files/abc")))
                .andRespond(withSuccess(new JSONObject().put("state", "FAILED").toString(), MediaType.APPLICATION_JSON));
        server.expect(requestTo(startsWith(BASE + "/v1beta/files/abc")))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withSuccess());

        assertThatThrownBy(() -> client.upload(upload(5L, "Alice")))
                .isInstanceOf(AnalysisServiceException.class)
                .satisfies(e -> assertThat(((AnalysisServiceException) e).getKind())
                        .isEqualTo(AnalysisServiceException.Kind.FATAL));
        server.verify();
    }

    @Test
    void uploadQuotaResponseIsRateLimited() throws IOException {
        server.expect(requestTo(startsWith(BASE + "/upload/v1beta/files")))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS).body("slow down"));

        assertThatThrownBy(() -> client.upload(upload(5L, "Alice")))
                .isInstanceOf(AnalysisServiceException.class)
                .satisfies(e -> assertThat(((AnalysisServiceException) e).isRateLimited()).isTrue());
    }

    @Test
    void generateReportReturnsCandidateText() {
        server.expect(requestTo(startsWith(BASE + "/v1beta/models/gemini-2.0-flash:generateContent")))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess(candidateJson("the report"), MediaType.APPLICATION_JSON));

        String report = client.generateReport(List.of(uploaded()), AnalysisMode.DEBATE, "");

        assertThat(report).isEqualTo("the report");
        server.verify();
    }

    @Test
    void generateReportFallsBackWhenNoCandidate() {
        server.expect(requestTo(startsWith(BASE + "/v1beta/models/")))
                .andRespond(withSuccess("{\"candidates\":[]}", MediaType.APPLICATION_JSON));

        String report = client.generateReport(List.of(uploaded()), AnalysisMode.DEBATE, "");

        assertThat(report).isEqualTo(ReportMessages.FALLBACK_REPORT);
    }

    @Test
    void errorObjectInBodyIsTransient() {
        server.expect(requestTo(startsWith(BASE + "/v1beta/models/")))
                .andRespond(withSuccess("{\"error\":{\"code\":500,\"message\":\"internal\"}}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.generateReport(List.of(uploaded()), AnalysisMode.DEBATE, ""))
                .isInstanceOf(AnalysisServiceException.class)
                .satisfies(e -> assertThat(((AnalysisServiceException) e).getKind())
                        .isEqualTo(AnalysisServiceException.Kind.TRANSIENT));
    }

    @Test
    void serverErrorIsTransient() {
        server.expect(requestTo(startsWith(BASE + "/v1beta/models/")))
                .andRespond(withServerError());

        assertThatThrownBy(() -> client.generateReport(List.of(uploaded()), AnalysisMode.DEBATE, ""))
                .isInstanceOf(AnalysisServiceException.class)
                .satisfies(e -> assertThat(((AnalysisServiceException) e).getStatusCode()).isEqualTo(500));
    }

    @Test
    void missingApiKeyIsFatal() throws IOException {
        client = newClient("", true);

        assertThat(client.isConfigured()).isFalse();
        assertThatThrownBy(() -> client.upload(upload(5L, "Alice")))
                .isInstanceOf(AnalysisServiceException.class)
                .satisfies(e -> assertThat(((AnalysisServiceException) e).getKind())
                        .isEqualTo(AnalysisServiceException.Kind.FATAL));
    }

    @Test
    void requestCarriesPromptContextLabelsAndFiles() {
        JSONObject request = client.buildRequest(List.of(uploaded()), AnalysisMode.SUMMARY, "earlier");

        JSONArray parts = request.getJSONArray("contents").getJSONObject(0).getJSONArray("parts");
        assertThat(parts.length()).isEqualTo(4);
        assertThat(parts.getJSONObject(0).getString("text")).isEqualTo(AnalysisPrompts.forMode(AnalysisMode.SUMMARY));
        assertThat(parts.getJSONObject(1).getString("text")).contains("earlier");
        assertThat(parts.getJSONObject(2).getString("text")).isEqualTo(AnalysisPrompts.speakerLabel("Alice"));
        assertThat(parts.getJSONObject(3).getJSONObject("file_data").getString("file_uri"))
                .isEqualTo("https://files.test/files/abc");
        assertThat(request.has("tools")).isTrue();
    }

    @Test
    void requestOmitsEmptyContextAndDisabledGrounding() {
        client = newClient("secret", false);

        JSONObject request = client.buildRequest(List.of(uploaded()), AnalysisMode.DEBATE, " ");

        JSONArray parts = request.getJSONArray("contents").getJSONObject(0).getJSONArray("parts");
        assertThat(parts.length()).isEqualTo(3);
        assertThat(request.has("tools")).isFalse();
    }

    @Test
    void classifiesFailures() {
        assertThat(GeminiAnalysisClient.classify("op", 429, "", 1).getKind())
                .isEqualTo(AnalysisServiceException.Kind.RATE_LIMITED);
        assertThat(GeminiAnalysisClient.classify("op", 400, "Quota exceeded for metric", 1).getKind())
                .isEqualTo(AnalysisServiceException.Kind.RATE_LIMITED);
        assertThat(GeminiAnalysisClient.classify("op", 503, "", 1).getKind())
                .isEqualTo(AnalysisServiceException.Kind.TRANSIENT);
        assertThat(GeminiAnalysisClient.classify("op", 403, "forbidden", 1).getKind())
                .isEqualTo(AnalysisServiceException.Kind.FATAL);
    }

    private GeminiAnalysisClient newClient(String apiKey, boolean grounding) {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        AnalysisClientProperties properties = new AnalysisClientProperties(BASE, null, apiKey, null,
                null, null, 5, Duration.ofMillis(1), grounding);
        return new GeminiAnalysisClient(builder.build(), properties);
    }

    private AudioUpload upload(long speakerId, String label) throws IOException {
        Path file = tempDir.resolve(speakerId + ".opus");
        Files.write(file, new byte[] {1, 0, 42});
        return new AudioUpload(speakerId, label, file, "audio/ogg");
    }

    private static UploadedAudio uploaded() {
        return new UploadedAudio(5L, "Alice", "files/abc", "https://files.test/files/abc", "audio/ogg");
    }

    private static JSONObject fileJson(String name, String state) {
        return new JSONObject().put("file", new JSONObject()
                .put("name", name)
                .put("uri", "https://files.test/" + name)
                .put("mimeType", "audio/ogg")
                .put("state", state));
    }

    private static String candidateJson(String text) {
        return new JSONObject().put("candidates", new JSONArray().put(new JSONObject()
                .put("content", new JSONObject().put("parts", new JSONArray()
                        .put(new JSONObject().put("text", text)))))).toString();
    }
}
