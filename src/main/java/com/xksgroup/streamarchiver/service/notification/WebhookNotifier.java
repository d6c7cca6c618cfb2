package com.xksgroup.streamarchiver.service.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.streamarchiver.config.ArchiverProperties.NotificationConfig;
import com.xksgroup.streamarchiver.config.ConfigService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Posts {@code {title, body, tag}} as JSON to every configured target listing the tag.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookNotifier implements Notifier {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final ConfigService configService;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Override
    @Async("notificationExecutor")
    public void notify(String title, String body, String tag) {
        String payload;
        try {
            Map<String, Object> message = new LinkedHashMap<>();
            message.put("title", title);
            message.put("body", body);
            message.put("tag", tag);
            payload = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.error("Could not serialize notification for tag {}", tag, e);
            return;
        }

        for (NotificationConfig target : configService.getConfig().getNotifications()) {
            if (target.getUrl() == null || !target.getTags().contains(tag)) {
                continue;
            }
            Request request = new Request.Builder()
                    .url(target.getUrl())
                    .post(RequestBody.create(payload, JSON))
                    .build();
            try (Response response = httpClient.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    log.warn("Notification target {} answered {} for tag {}", target.getUrl(), response.code(), tag);
                } else {
                    log.debug("Sent notification with tag {} to {}", tag, target.getUrl());
                }
            } catch (IOException | IllegalArgumentException e) {
                log.warn("Failed to deliver notification with tag {} to {}: {}", tag, target.getUrl(), e.getMessage());
            }
        }
    }
}
