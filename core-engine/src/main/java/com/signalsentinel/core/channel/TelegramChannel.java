package com.signalsentinel.core.channel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Objects;

/**
 * Telegram Bot API channel.
 *
 * <p>
 * Posts plain text to {@code /bot<token>/sendMessage} for one chat or
 * channel. No parse mode is set and link previews are disabled. Messages are
 * sent with notification sound on.
 * </p>
 *
 * <h3>Failures</h3>
 * <p>
 * An {@code ok=false} response maps to its {@code description}; timeouts,
 * I/O errors and unreadable responses map to a failed {@link ChannelResult}.
 * Nothing is retried here: the dispatcher leaves its state untouched on
 * failure, so the alert remains eligible on a later cycle.
 * </p>
 *
 * @see <a href="https://core.telegram.org/bots/api#sendmessage">Telegram sendMessage</a>
 * @since 1.0.0
 */
public class TelegramChannel implements AlertChannel {

    private static final Logger LOG = LoggerFactory.getLogger(TelegramChannel.class);

    static final String DEFAULT_API_BASE_URL = "https://api.telegram.org";
    private static final String CONTENT_TYPE = "application/json";

    private final String apiBaseUrl;
    private final String botToken;
    private final String chatId;
    private final Duration requestTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    /**
     * @param botToken       bot token; must not be blank
     * @param chatId         target chat / channel id; must not be blank
     * @param requestTimeout per-request timeout
     * @throws IllegalArgumentException if a credential is blank
     */
    public TelegramChannel(String botToken, String chatId, Duration requestTimeout) {
        this(DEFAULT_API_BASE_URL, botToken, chatId, requestTimeout,
                HttpClient.newBuilder().connectTimeout(requestTimeout).build(),
                new ObjectMapper());
    }

    TelegramChannel(String apiBaseUrl, String botToken, String chatId, Duration requestTimeout,
            HttpClient httpClient, ObjectMapper objectMapper) {
        this.apiBaseUrl = Objects.requireNonNull(apiBaseUrl, "apiBaseUrl must not be null");
        this.botToken = requireNonBlank(botToken, "Telegram bot token");
        this.chatId = requireNonBlank(chatId, "Telegram channel id");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout must not be null");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public ChannelResult send(String text) {
        Objects.requireNonNull(text, "text must not be null");

        HttpResponse<String> response;
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(apiBaseUrl + "/bot" + botToken + "/sendMessage"))
                    .header("Content-Type", CONTENT_TYPE)
                    .timeout(requestTimeout)
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody(text)))
                    .build();
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            LOG.warn("[Telegram] Request timed out after {}", requestTimeout);
            return ChannelResult.failed("Request timed out after " + requestTimeout.toMillis() + " ms");
        } catch (IOException e) {
            LOG.warn("[Telegram] Request failed: {}", e.getMessage());
            return ChannelResult.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ChannelResult.failed("Interrupted while sending");
        }

        return parseResponse(response);
    }

    @Override
    public String name() {
        return "telegram";
    }

    // ---------------------------------------------------------------
    // Wire format
    // ---------------------------------------------------------------

    private String requestBody(String text) throws IOException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("chat_id", chatId);
        body.put("text", text);
        body.put("disable_web_page_preview", true);
        return objectMapper.writeValueAsString(body);
    }

    private ChannelResult parseResponse(HttpResponse<String> response) {
        JsonNode json;
        try {
            json = objectMapper.readTree(response.body());
        } catch (IOException e) {
            LOG.warn("[Telegram] Unreadable response: HTTP {}", response.statusCode());
            return ChannelResult.failed("Unreadable Telegram response (HTTP " + response.statusCode() + ")");
        }

        if (json != null && json.path("ok").asBoolean(false)) {
            JsonNode messageId = json.path("result").path("message_id");
            LOG.info("[Telegram] Message delivered: id={}", messageId.asText(null));
            return ChannelResult.delivered(messageId.isMissingNode() ? null : messageId.asText());
        }

        String description = json != null ? json.path("description").asText("") : "";
        LOG.warn("[Telegram] Send rejected: HTTP {} - {}", response.statusCode(), description);
        return ChannelResult.failed(description.isBlank()
                ? "Unknown Telegram API error (HTTP " + response.statusCode() + ")"
                : description);
    }

    private static String requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        return value;
    }

    @Override
    public String toString() {
        return "TelegramChannel{chatId='" + chatId + "', apiBaseUrl='" + apiBaseUrl + "'}";
    }
}
