package com.xksgroup.streamarchiver.service.upstream;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.streamarchiver.config.ConfigService;
import com.xksgroup.streamarchiver.model.player.ClientConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;

/**
 * Supplies the current web client configuration, scraping the home page at most once per
 * {@code archiver.player.client-config-max-age}. Falls back to a built-in API key when scraping fails.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClientConfigProvider {

    // urlsafe base64 of a publicly known key
    private static final String FALLBACK_KEY_ENCODED = "QUl6YVN5QU9fRkoyU2xxVThRNFNURUhMR0NpbHdfWTlfMTFxY1c4";
    static final String CONFIG_MARKER = "ytcfg.set({\"CLIENT";
    private static final int MAX_FETCH_ATTEMPTS = 5;

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ConfigService configService;
    private final Clock clock;

    private ClientConfig cached;
    private Instant cachedAt;

    public synchronized ClientConfig get() throws InterruptedException {
        Duration maxAge = configService.getConfig().getPlayer().getClientConfigMaxAge();
        Instant now = clock.instant();
        if (cached != null && cachedAt != null && Duration.between(cachedAt, now).compareTo(maxAge) < 0) {
            return cached;
        }
        ClientConfig scraped = scrape();
        if (scraped == null) {
            log.warn("Could not extract client configuration; using built-in key");
            return fallback();
        }
        cached = scraped;
        cachedAt = now;
        return cached;
    }

    public static String fallbackKey() {
        return new String(Base64.getUrlDecoder().decode(FALLBACK_KEY_ENCODED), StandardCharsets.US_ASCII);
    }

    private ClientConfig fallback() {
        return ClientConfig.builder().apiKey(fallbackKey()).build();
    }

    private ClientConfig scrape() throws InterruptedException {
        String homeUrl = configService.getConfig().getPlayer().getBaseUrl() + "/";
        for (int attempt = 1; attempt <= MAX_FETCH_ATTEMPTS; attempt++) {
            Request request = new Request.Builder().url(homeUrl).get().build();
            try (Response response = httpClient.newCall(request).execute()) {
                ResponseBody body = response.body();
                if (response.isSuccessful() && body != null) {
                    return extract(body.string());
                }
                log.debug("Home page answered {} (attempt {}/{})", response.code(), attempt, MAX_FETCH_ATTEMPTS);
            } catch (IOException e) {
                log.debug("Home page fetch failed (attempt {}/{}): {}", attempt, MAX_FETCH_ATTEMPTS, e.getMessage());
            }
            if (attempt < MAX_FETCH_ATTEMPTS) {
                Thread.sleep(6000);
            }
        }
        return null;
    }

    /**
     * Reads the first JSON object following the {@code ytcfg.set} marker, ignoring whatever follows it.
     */
    ClientConfig extract(String html) {
        int marker = html.indexOf(CONFIG_MARKER);
        if (marker < 0) {
            return null;
        }
        int start = html.indexOf('{', marker);
        try (JsonParser parser = objectMapper.getFactory().createParser(html.substring(start))) {
            return objectMapper.readValue(parser, ClientConfig.class);
        } catch (IOException e) {
            log.debug("Malformed client configuration: {}", e.getMessage());
            return null;
        }
    }
}
