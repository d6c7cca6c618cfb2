package com.xksgroup.streamarchiver.service.feed;

import com.xksgroup.streamarchiver.config.ArchiverProperties.ChannelMonitorConfig;
import com.xksgroup.streamarchiver.config.ConfigService;
import com.xksgroup.streamarchiver.exception.FeedFetchException;
import com.xksgroup.streamarchiver.model.FeedEntry;
import com.xksgroup.streamarchiver.model.FeedItemMatch;
import com.xksgroup.streamarchiver.service.helper.FeedParser;
import com.xksgroup.streamarchiver.service.helper.PatternMatcher;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Semaphore;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Fetches a channel's upload feed and finds the entries whose title or description matches
 * one of the channel's rules.
 */
@Slf4j
@Service
public class FeedPoller {

    private final OkHttpClient httpClient;
    private final ConfigService configService;
    private final Semaphore fetchPermits;

    public FeedPoller(OkHttpClient httpClient, ConfigService configService) {
        this.httpClient = httpClient;
        this.configService = configService;
        this.fetchPermits = new Semaphore(Math.max(1, configService.getConfig().getFeed().getMaxConcurrentFetches()));
    }

    /**
     * @throws FeedFetchException if the feed cannot be retrieved or parsed
     */
    public List<FeedItemMatch> getChannelMatches(ChannelMonitorConfig channel) throws InterruptedException {
        String xml = fetchFeed(channel.getId());
        List<FeedEntry> entries = FeedParser.parse(xml);
        List<FeedItemMatch> matches = matchEntries(channel, configService.getRules(channel.getId()), entries);
        log.debug("Channel {}: {} feed entries, {} match(es)", channel.getId(), entries.size(), matches.size());
        return matches;
    }

    private String fetchFeed(String channelId) throws InterruptedException {
        HttpUrl url = HttpUrl.get(configService.getConfig().getFeed().getBaseUrl()).newBuilder()
                .addQueryParameter("channel_id", channelId)
                .build();
        Request request = new Request.Builder().url(url).get().build();

        fetchPermits.acquire();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new FeedFetchException("Feed for channel " + channelId + " answered " + response.code());
            }
            return body.string();
        } catch (IOException e) {
            throw new FeedFetchException("Failed to fetch feed for channel " + channelId + ": " + e.getMessage(), e);
        } finally {
            fetchPermits.release();
        }
    }

    /**
     * Matches feed entries (newest first) against the rules. Each entry's description loses the
     * lines that also appear in any of the next {@code numDescLookbehind} older entries, so text
     * shared by a channel's description template cannot trigger a match on its own.
     * <p>
     * Only entries with a full window of older entries are matched; the oldest
     * {@code numDescLookbehind} entries serve as comparison context only.
     */
    static List<FeedItemMatch> matchEntries(ChannelMonitorConfig channel, Map<String, Pattern> rules,
                                            List<FeedEntry> entries) {
        List<FeedItemMatch> matches = new ArrayList<>();
        int lookbehind = Math.max(0, channel.getNumDescLookbehind());
        for (int i = 0; i + lookbehind < entries.size(); i++) {
            FeedEntry entry = entries.get(i);

            Set<String> olderLines = new HashSet<>();
            for (FeedEntry older : entries.subList(i + 1, i + 1 + lookbehind)) {
                older.summary().lines().map(String::stripTrailing).forEach(olderLines::add);
            }
            String uniqueSummary = entry.summary().lines()
                    .map(String::stripTrailing)
                    .filter(line -> !olderLines.contains(line))
                    .collect(Collectors.joining("\n"));

            Set<String> matchingTerms = new TreeSet<>(PatternMatcher.getPatternMatches(rules, entry.title()));
            matchingTerms.addAll(PatternMatcher.getPatternMatches(rules, uniqueSummary));
            if (!matchingTerms.isEmpty()) {
                matches.add(new FeedItemMatch(channel, entry.link(), entry.videoId(), entry.author(), matchingTerms));
            }
        }
        return matches;
    }
}
