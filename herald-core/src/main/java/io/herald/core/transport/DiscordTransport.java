package io.herald.core.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Posts messages to Discord channels through the REST API using a bot token.
 */
public final class DiscordTransport implements MessageTransport {
    private static final Logger LOG = LoggerFactory.getLogger(DiscordTransport.class);
    private static final MediaType JSON = MediaType.get("application/json");
    private static final int MAX_ERROR_BODY = 300;

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final String apiBase;
    private final String botToken;

    public DiscordTransport(OkHttpClient client, ObjectMapper mapper, String apiBase, String botToken) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        if (apiBase == null || apiBase.isBlank()) {
            throw new IllegalArgumentException("apiBase must not be blank");
        }
        if (botToken == null || botToken.isBlank()) {
            throw new IllegalArgumentException("botToken must not be blank");
        }
        this.apiBase = apiBase.endsWith("/") ? apiBase.substring(0, apiBase.length() - 1) : apiBase;
        this.botToken = botToken;
    }

    @Override
    public String name() {
        return "discord";
    }

    @Override
    public void send(String channel, String message) throws DeliveryException {
        if (channel == null || channel.isBlank()) {
            throw new DeliveryException("channel is required");
        }
        HttpUrl base = HttpUrl.parse(apiBase);
        if (base == null) {
            throw new DeliveryException("Invalid Discord API base: " + apiBase);
        }
        HttpUrl url = base.newBuilder()
            .addPathSegment("channels")
            .addPathSegment(channel.trim())
            .addPathSegment("messages")
            .build();

        Request request;
        try {
            String body = mapper.writeValueAsString(Map.of("content", message == null ? "" : message));
            request = new Request.Builder()
                .url(url)
                .addHeader("Authorization", "Bot " + botToken)
                .post(RequestBody.create(body, JSON))
                .build();
        } catch (IOException e) {
            throw new DeliveryException("Failed to encode message for channel " + channel, e);
        }

        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                String raw = response.body() == null ? "" : response.body().string();
                throw new DeliveryException(
                    "Discord rejected message for channel " + channel + " (HTTP " + response.code() + "): "
                        + truncate(raw),
                    response.code(),
                    null
                );
            }
            LOG.debug("Sent message to channel {} (HTTP {})", channel, response.code());
        } catch (IOException e) {
            throw new DeliveryException("Failed to reach Discord for channel " + channel + ": " + e.getMessage(), e);
        }
    }

    private String truncate(String raw) {
        if (raw.length() <= MAX_ERROR_BODY) {
            return raw;
        }
        return raw.substring(0, MAX_ERROR_BODY) + "...";
    }
}
