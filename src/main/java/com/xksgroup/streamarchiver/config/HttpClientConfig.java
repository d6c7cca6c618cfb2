package com.xksgroup.streamarchiver.config;

import com.xksgroup.streamarchiver.service.helper.IntervalRateLimiter;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class HttpClientConfig {

    @Bean
    public OkHttpClient okHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(15))
                .readTimeout(Duration.ofSeconds(30))
                .callTimeout(Duration.ofSeconds(60))
                .followRedirects(true)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Shared by every caller that resolves video metadata while scheduling jobs.
     */
    @Bean
    public IntervalRateLimiter playerRateLimiter(ArchiverProperties properties) {
        return new IntervalRateLimiter("player", properties.getPlayer().getRequestInterval());
    }
}
