package io.herald.core.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DiscordTransportTest {
    private final ObjectMapper mapper = new ObjectMapper();
    private MockWebServer server;
    private DiscordTransport transport;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        String apiBase = server.url("/api/v10/").toString();
        transport = new DiscordTransport(new OkHttpClient(), mapper, apiBase, "secret-token");
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void shouldPostMessageToChannel() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"id\":\"1\"}"));

        transport.send("123456", "Stand-up in 5 \"minutes\"");

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/api/v10/channels/123456/messages");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bot secret-token");
        JsonNode body = mapper.readTree(request.getBody().readUtf8());
        assertThat(body.path("content").asText()).isEqualTo("Stand-up in 5 \"minutes\"");
    }

    @Test
    void shouldRaiseDeliveryExceptionWithStatusOnRejection() {
        server.enqueue(new MockResponse().setResponseCode(403).setBody("{\"message\":\"Missing Access\"}"));

        assertThatThrownBy(() -> transport.send("123456", "hi"))
            .isInstanceOfSatisfying(DeliveryException.class, e -> {
                assertThat(e.httpStatus()).isEqualTo(403);
                assertThat(e.getMessage()).contains("Missing Access");
            });
    }

    @Test
    void shouldWrapConnectionFailures() throws Exception {
        server.shutdown();

        assertThatThrownBy(() -> transport.send("123456", "hi"))
            .isInstanceOfSatisfying(DeliveryException.class, e -> assertThat(e.httpStatus()).isEqualTo(-1));
    }

    @Test
    void shouldRejectBlankChannelWithoutCallingTheApi() {
        assertThatThrownBy(() -> transport.send(" ", "hi")).isInstanceOf(DeliveryException.class);
        assertThat(server.getRequestCount()).isZero();
    }
}
