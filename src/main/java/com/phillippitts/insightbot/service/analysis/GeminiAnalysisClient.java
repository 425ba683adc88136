package com.phillippitts.insightbot.service.analysis;

import com.phillippitts.insightbot.config.properties.AnalysisClientProperties;
import com.phillippitts.insightbot.domain.AnalysisMode;
import com.phillippitts.insightbot.exception.AnalysisServiceException;
import com.phillippitts.insightbot.exception.AnalysisServiceExceptionBuilder;
import com.phillippitts.insightbot.util.LogSanitizer;
import com.phillippitts.insightbot.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Objects;

/**
 * {@link AnalysisClient} for the Gemini REST API.
 *
 * <p>Flow per report:
 * <ol>
 *   <li>Each speaker file is uploaded through the multipart files endpoint and polled until the
 *       service reports it {@code ACTIVE}.</li>
 *   <li>One {@code generateContent} call carries the mode prompt, the optional previous context,
 *       and a label part plus a file part per speaker. Search grounding is requested when
 *       enabled.</li>
 *   <li>The caller deletes the uploaded files afterwards.</li>
 * </ol>
 *
 * <p>Failure classification:
 * <ul>
 *   <li>HTTP 429, or an error body mentioning {@value #QUOTA_EXCEEDED}: RATE_LIMITED</li>
 *   <li>HTTP 5xx, I/O failures, an {@code error} object in a 2xx body: TRANSIENT</li>
 *   <li>Other HTTP 4xx: FATAL</li>
 * </ul>
 *
 * <p>The API key travels as a query parameter and is never logged.
 */
@Component
public class GeminiAnalysisClient implements AnalysisClient {

    private static final Logger LOG = LogManager.getLogger(GeminiAnalysisClient.class);

    static final String QUOTA_EXCEEDED = "Quota exceeded";
    static final String STATE_ACTIVE = "ACTIVE";
    static final String STATE_FAILED = "FAILED";
    private static final String API_VERSION = "/v1beta";

    private final RestClient restClient;
    private final AnalysisClientProperties properties;

    public GeminiAnalysisClient(@Qualifier("analysisRestClient") RestClient restClient,
                                AnalysisClientProperties properties) {
        this.restClient = restClient;
        this.properties = properties;
    }

    @Override
    public boolean isConfigured() {
        return properties.isConfigured();
    }

    @Override
    public UploadedAudio upload(AudioUpload upload) {
        Objects.requireNonNull(upload, "upload must not be null");
        requireConfigured();

        byte[] bytes;
        try {
            bytes = Files.readAllBytes(upload.file());
        } catch (IOException e) {
            throw AnalysisServiceExceptionBuilder.create("Failed to read audio file")
                    .cause(e)
                    .metadata("file", upload.file().getFileName())
                    .build();
        }

        String fileName = upload.file().getFileName().toString();
        MultipartBodyBuilder body = new MultipartBodyBuilder();
        body.part("file", new NamedByteArrayResource(bytes, fileName), MediaType.parseMediaType(upload.mimeType()));

        URI uri = uri(properties.getUploadBaseUrl(), API_VERSION + "/files");
        JSONObject response = execute("upload", restClient.post()
                .uri(uri)
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(body.build()));

        JSONObject file = response.optJSONObject("file");
        if (file == null || file.optString("name").isEmpty()) {
            throw AnalysisServiceExceptionBuilder.create("Upload response carried no file")
                    .metadata("file", fileName)
                    .build();
        }
        UploadedAudio uploaded = toUploaded(upload, file);
        LOG.info("Uploaded {} ({} bytes) as {}", fileName, bytes.length, uploaded.remoteName());

        if (!STATE_ACTIVE.equals(file.optString("state", STATE_ACTIVE))) {
            try {
                awaitActive(uploaded);
            } catch (AnalysisServiceException e) {
                delete(uploaded);
                throw e;
            }
        }
        return uploaded;
    }

    @Override
    public String generateReport(List<UploadedAudio> files, AnalysisMode mode, String context) {
        if (files == null || files.isEmpty()) {
            throw new IllegalArgumentException("At least one uploaded file is required");
        }
        Objects.requireNonNull(mode, "mode must not be null");
        requireConfigured();

        JSONObject request = buildRequest(files, mode, context);
        URI uri = uri(properties.getBaseUrl(),
                API_VERSION + "/models/" + properties.getModel() + ":generateContent");

        long start = System.nanoTime();
        JSONObject response = execute("generateContent", restClient.post()
                .uri(uri)
                .contentType(MediaType.APPLICATION_JSON)
                .body(request.toString()));

        JSONObject error = response.optJSONObject("error");
        if (error != null) {
            throw AnalysisServiceExceptionBuilder.create(error.optString("message", "Analysis service error"))
                    .kind(AnalysisServiceException.Kind.TRANSIENT)
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .metadata("code", error.opt("code"))
                    .build();
        }

        String report = extractText(response);
        LOG.info("Report generated in {} ms for {} speakers: {}",
                TimeUtils.elapsedMillis(start), files.size(), LogSanitizer.preview(report));
        return report;
    }

    @Override
    public void delete(UploadedAudio file) {
        if (file == null || file.remoteName() == null || !properties.isConfigured()) {
            return;
        }
        try {
            restClient.delete()
                    .uri(uri(properties.getBaseUrl(), API_VERSION + "/" + file.remoteName()))
                    .retrieve()
                    .toBodilessEntity();
            LOG.debug("Deleted remote file {}", file.remoteName());
        } catch (RestClientException e) {
            LOG.warn("Failed to delete remote file {}: {}", file.remoteName(), e.getMessage());
        }
    }

    JSONObject buildRequest(List<UploadedAudio> files, AnalysisMode mode, String context) {
        JSONArray parts = new JSONArray();
        parts.put(new JSONObject().put("text", AnalysisPrompts.forMode(mode)));
        if (context != null && !context.isBlank()) {
            parts.put(new JSONObject().put("text", AnalysisPrompts.contextPreamble(context)));
        }
        for (UploadedAudio file : files) {
            parts.put(new JSONObject().put("text", AnalysisPrompts.speakerLabel(file.label())));
            parts.put(new JSONObject().put("file_data", new JSONObject()
                    .put("file_uri", file.uri())
                    .put("mime_type", file.mimeType())));
        }

        JSONObject request = new JSONObject()
                .put("contents", new JSONArray().put(new JSONObject()
                        .put("role", "user")
                        .put("parts", parts)));
        if (properties.isGroundingEnabled()) {
            request.put("tools", new JSONArray().put(new JSONObject().put("google_search", new JSONObject())));
        }
        return request;
    }

    static String extractText(JSONObject response) {
        JSONArray candidates = response.optJSONArray("candidates");
        if (candidates == null || candidates.isEmpty()) {
            return ReportMessages.FALLBACK_REPORT;
        }
        JSONObject content = candidates.optJSONObject(0) == null ? null
                : candidates.getJSONObject(0).optJSONObject("content");
        JSONArray parts = content == null ? null : content.optJSONArray("parts");
        if (parts == null || parts.isEmpty() || parts.optJSONObject(0) == null) {
            return ReportMessages.FALLBACK_REPORT;
        }
        String text = parts.getJSONObject(0).optString("text", "");
        return text.isBlank() ? ReportMessages.FALLBACK_REPORT : text;
    }

    private void awaitActive(UploadedAudio uploaded) {
        URI uri = uri(properties.getBaseUrl(), API_VERSION + "/" + uploaded.remoteName());
        for (int attempt = 1; attempt <= properties.getFilePollAttempts(); attempt++) {
            JSONObject file = execute("getFile", restClient.get().uri(uri));
            String state = file.optString("state", "");
            if (STATE_ACTIVE.equals(state)) {
                LOG.debug("File {} active after {} polls", uploaded.remoteName(), attempt);
                return;
            }
            if (STATE_FAILED.equals(state)) {
                throw AnalysisServiceExceptionBuilder.create("File processing failed")
                        .kind(AnalysisServiceException.Kind.FATAL)
                        .metadata("file", uploaded.remoteName())
                        .build();
            }
            sleepBeforePoll();
        }
        throw AnalysisServiceExceptionBuilder.create("File processing timeout")
                .metadata("file", uploaded.remoteName())
                .metadata("attempts", properties.getFilePollAttempts())
                .build();
    }

    private void sleepBeforePoll() {
        try {
            Thread.sleep(properties.getFilePollInterval().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnalysisServiceException("Interrupted while waiting for file processing",
                    AnalysisServiceException.Kind.TRANSIENT, e);
        }
    }

    private JSONObject execute(String operation, RestClient.RequestHeadersSpec<?> spec) {
        long start = System.nanoTime();
        try {
            return spec.exchange((request, response) -> {
                int status = response.getStatusCode().value();
                String body = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
                if (!response.getStatusCode().is2xxSuccessful()) {
                    throw classify(operation, status, body, TimeUtils.elapsedMillis(start));
                }
                return body.isBlank() ? new JSONObject() : new JSONObject(body);
            });
        } catch (AnalysisServiceException e) {
            throw e;
        } catch (RestClientException | JSONException e) {
            throw AnalysisServiceExceptionBuilder.create(operation + " failed: " + e.getMessage())
                    .kind(AnalysisServiceException.Kind.TRANSIENT)
                    .cause(e)
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .build();
        }
    }

    static AnalysisServiceException classify(String operation, int status, String body, long durationMs) {
        AnalysisServiceException.Kind kind;
        if (status == 429 || (body != null && body.contains(QUOTA_EXCEEDED))) {
            kind = AnalysisServiceException.Kind.RATE_LIMITED;
        } else if (status >= 500) {
            kind = AnalysisServiceException.Kind.TRANSIENT;
        } else {
            kind = AnalysisServiceException.Kind.FATAL;
        }
        return AnalysisServiceExceptionBuilder.create(operation + " failed")
                .kind(kind)
                .status(status)
                .durationMs(durationMs)
                .metadata("body", LogSanitizer.truncate(body, 200))
                .build();
    }

    private void requireConfigured() {
        if (!properties.isConfigured()) {
            throw new AnalysisServiceException("Analysis API key is not configured",
                    AnalysisServiceException.Kind.FATAL);
        }
    }

    private URI uri(String base, String path) {
        return UriComponentsBuilder.fromUriString(base)
                .path(path)
                .queryParam("key", properties.getApiKey())
                .encode()
                .build()
                .toUri();
    }

    private static UploadedAudio toUploaded(AudioUpload upload, JSONObject file) {
        return new UploadedAudio(upload.speakerId(), upload.label(), file.getString("name"),
                file.optString("uri", ""), file.optString("mimeType", upload.mimeType()));
    }

    /** Byte resource that reports a file name, so the multipart part carries one. */
    private static final class NamedByteArrayResource extends ByteArrayResource {

        private final String filename;

        NamedByteArrayResource(byte[] bytes, String filename) {
            super(bytes);
            this.filename = filename;
        }

        @Override
        public String getFilename() {
            return filename;
        }

        @Override
        public boolean equals(Object other) {
            return super.equals(other) && other instanceof NamedByteArrayResource named
                    && filename.equals(named.filename);
        }

        @Override
        public int hashCode() {
            return 31 * super.hashCode() + filename.hashCode();
        }
    }
}
