package com.phillippitts.insightbot.service.publication;

import com.phillippitts.insightbot.config.properties.PublicationProperties;
import com.phillippitts.insightbot.exception.PublicationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * {@link ReportPublisher} using the Discord REST API.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /channels/{channel}/messages} for messages, also inside threads</li>
 *   <li>{@code POST /channels/{channel}/messages/{message}/threads} to open a thread</li>
 * </ul>
 */
@Component
public class DiscordReportPublisher implements ReportPublisher {

    private static final Logger LOG = LogManager.getLogger(DiscordReportPublisher.class);

    /** Discord rejects thread names longer than this. */
    static final int MAX_THREAD_NAME = 100;

    private final RestClient restClient;
    private final PublicationProperties properties;

    public DiscordReportPublisher(@Qualifier("publicationRestClient") RestClient restClient,
                                  PublicationProperties properties) {
        this.restClient = restClient;
        this.properties = properties;
    }

    @Override
    public MessageHandle postMessage(long channelId, String text) {
        JSONObject response = post("/channels/{channelId}/messages", messageBody(text), channelId, channelId);
        return new MessageHandle(channelId, parseId(response, channelId));
    }

    @Override
    public ThreadHandle createThread(MessageHandle message, String title) {
        String name = title.length() > MAX_THREAD_NAME ? title.substring(0, MAX_THREAD_NAME) : title;
        JSONObject body = new JSONObject()
            .put("name", name)
            .put("auto_archive_duration", properties.getThreadAutoArchiveMinutes());
        JSONObject response = post("/channels/{channelId}/messages/{messageId}/threads",
            body, message.channelId(), message.channelId(), message.messageId());
        long threadId = parseId(response, message.channelId());
        LOG.debug("Opened thread {} on message {} in channel {}", threadId, message.messageId(), message.channelId());
        return new ThreadHandle(threadId, name);
    }

    @Override
    public void sendToThread(ThreadHandle thread, String text) {
        post("/channels/{channelId}/messages", messageBody(text), thread.threadId(), thread.threadId());
    }

    @Override
    public int messageLimit() {
        return properties.getMessageLimit();
    }

    private JSONObject messageBody(String text) {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("Message text must not be empty");
        }
        if (text.length() > properties.getMessageLimit()) {
            throw new IllegalArgumentException("Message of " + text.length() + " chars exceeds limit "
                + properties.getMessageLimit());
        }
        return new JSONObject().put("content", text);
    }

    private JSONObject post(String path, JSONObject body, long channelId, Object... uriVariables) {
        try {
            String response = restClient.post()
                .uri(path, uriVariables)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body.toString())
                .retrieve()
                .body(String.class);
            return response == null || response.isBlank() ? new JSONObject() : new JSONObject(response);
        } catch (RestClientException | JSONException e) {
            throw new PublicationException("Discord request " + path + " failed: " + e.getMessage(), channelId, e);
        }
    }

    private static long parseId(JSONObject response, long channelId) {
        String id = response.optString("id", "");
        try {
            return Long.parseLong(id);
        } catch (NumberFormatException e) {
            throw new PublicationException("Discord response carried no id", channelId, e);
        }
    }
}
