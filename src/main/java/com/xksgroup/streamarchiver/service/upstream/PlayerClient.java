package com.xksgroup.streamarchiver.service.upstream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.streamarchiver.config.ArchiverProperties.PlayerConfig;
import com.xksgroup.streamarchiver.config.ConfigService;
import com.xksgroup.streamarchiver.model.player.ClientConfig;
import com.xksgroup.streamarchiver.model.player.PlayerResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fetches video metadata from the upstream player endpoint.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlayerClient {

    private static final MediaType JSON = MediaType.get("application/json");
    private static final String WEB_CLIENT_VERSION = "2.20241121.01.00";

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ClientConfigProvider clientConfigProvider;
    private final ConfigService configService;

    /**
     * Requests player metadata for a video, retrying on empty or mismatched answers.
     *
     * @param validate when {@code true}, only a response describing {@code videoId} is accepted;
     *                 when {@code false} the first decodable response is returned as-is
     * @return the response, or {@code null} if none was acceptable after all attempts
     */
    public PlayerResponse fetchPlayerResponse(String videoId, boolean validate) throws InterruptedException {
        PlayerConfig player = configService.getConfig().getPlayer();
        ClientConfig clientConfig = clientConfigProvider.get();
        Request request = buildRequest(player, clientConfig, videoId);

        for (int attempt = 1; attempt <= player.getMaxAttempts(); attempt++) {
            PlayerResponse response = execute(request, videoId);
            if (response != null && !validate) {
                return response;
            }
            if (response != null && response.getVideoDetails() != null
                    && videoId.equals(response.getVideoDetails().getVideoId())) {
                return response;
            }
            log.debug("No usable player response for {} (attempt {}/{})", videoId, attempt, player.getMaxAttempts());
            if (attempt < player.getMaxAttempts()) {
                Thread.sleep(player.getRetryDelay().toMillis());
            }
        }
        log.warn("Giving up on player response for {} after {} attempts", videoId, player.getMaxAttempts());
        return null;
    }

    private PlayerResponse execute(Request request, String videoId) {
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (body == null) {
                return null;
            }
            return objectMapper.readValue(body.string(), PlayerResponse.class);
        } catch (IOException e) {
            log.debug("Player request for {} failed: {}", videoId, e.getMessage());
            return null;
        }
    }

    private Request buildRequest(PlayerConfig player, ClientConfig clientConfig, String videoId) {
        String key = clientConfig.getApiKey() != null ? clientConfig.getApiKey() : ClientConfigProvider.fallbackKey();
        HttpUrl url = HttpUrl.get(player.getBaseUrl() + "/youtubei/v1/player").newBuilder()
                .addQueryParameter("key", key)
                .build();

        Map<String, Object> client = new LinkedHashMap<>();
        client.put("clientName", "WEB");
        client.put("clientVersion", WEB_CLIENT_VERSION);
        client.put("hl", "en");
        client.putAll(clientConfig.toPostContext());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("context", Map.of("client", client));
        payload.put("videoId", videoId);
        payload.put("playbackContext", Map.of("contentPlaybackContext", Map.of("html5Preference", "HTML5_PREF_WANTS")));

        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize player request", e);
        }

        Request.Builder builder = new Request.Builder()
                .url(url)
                .post(RequestBody.create(json, JSON))
                .header("X-YouTube-Client-Name", "1")
                .header("X-YouTube-Client-Version", WEB_CLIENT_VERSION)
                .header("Origin", player.getBaseUrl());
        clientConfig.toHeaders().forEach(builder::header);
        return builder.build();
    }
}
