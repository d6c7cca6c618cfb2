package com.xksgroup.streamarchiver.service.notification;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.streamarchiver.config.ArchiverProperties;
import com.xksgroup.streamarchiver.config.ArchiverProperties.NotificationConfig;
import com.xksgroup.streamarchiver.config.ConfigService;
import okhttp3.Call;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("WebhookNotifier Tests")
class WebhookNotifierTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ArchiverProperties properties;
    private OkHttpClient httpClient;
    private List<Request> sent;
    private WebhookNotifier notifier;

    @BeforeEach
    void setUp() {
        properties = new ArchiverProperties();
        properties.setNotifications(List.of(
                target("https://hooks.example.com/found", "monitor-feed:found"),
                target("https://hooks.example.com/status", "status:finished", "status:error")));
        ConfigService configService = mock(ConfigService.class);
        when(configService.getConfig()).thenReturn(properties);

        sent = new ArrayList<>();
        httpClient = mock(OkHttpClient.class);
        when(httpClient.newCall(any(Request.class))).thenAnswer(invocation -> {
            Request request = invocation.getArgument(0);
            sent.add(request);
            Call call = mock(Call.class);
            when(call.execute()).thenReturn(new Response.Builder()
                    .request(request)
                    .protocol(Protocol.HTTP_1_1)
                    .code(204)
                    .message("No Content")
                    .body(ResponseBody.create("", null))
                    .build());
            return call;
        });
        notifier = new WebhookNotifier(configService, httpClient, objectMapper);
    }

    private static NotificationConfig target(String url, String... tags) {
        NotificationConfig target = new NotificationConfig();
        target.setUrl(url);
        target.setTags(List.of(tags));
        return target;
    }

    @Test
    @DisplayName("Should post to the targets subscribed to the tag only")
    void testRoutesByTag() throws IOException {
        notifier.notify("Archive status: Finished", "Karaoke from Someone", "status:finished");

        assertEquals(1, sent.size());
        Request request = sent.get(0);
        assertEquals("https://hooks.example.com/status", request.url().toString());
        assertEquals("POST", request.method());

        Buffer buffer = new Buffer();
        request.body().writeTo(buffer);
        JsonNode payload = objectMapper.readTree(buffer.readUtf8());
        assertEquals("Archive status: Finished", payload.get("title").asText());
        assertEquals("Karaoke from Someone", payload.get("body").asText());
        assertEquals("status:finished", payload.get("tag").asText());
    }

    @Test
    @DisplayName("Should send a null title as JSON null")
    void testNullTitle() throws IOException {
        notifier.notify(null, "Someone is doing a stream", "monitor-feed:found");

        assertEquals(1, sent.size());
        Buffer buffer = new Buffer();
        sent.get(0).body().writeTo(buffer);
        assertTrue(objectMapper.readTree(buffer.readUtf8()).get("title").isNull());
    }

    @Test
    @DisplayName("Should not send anything for tags nobody listens to")
    void testNoSubscribers() {
        notifier.notify("Archive status: Downloading", "body", "status:downloading");

        assertTrue(sent.isEmpty());
    }

    @Test
    @DisplayName("Should swallow delivery failures")
    void testDeliveryFailure() {
        when(httpClient.newCall(any(Request.class))).thenAnswer(invocation -> {
            Call call = mock(Call.class);
            when(call.execute()).thenThrow(new IOException("connection refused"));
            return call;
        });

        assertDoesNotThrow(() -> notifier.notify("t", "b", "status:error"));
    }
}
