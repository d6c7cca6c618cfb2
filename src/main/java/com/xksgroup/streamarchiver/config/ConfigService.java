package com.xksgroup.streamarchiver.config;

import com.xksgroup.streamarchiver.config.ArchiverProperties.ChannelMonitorConfig;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Holds the live configuration. Components read the current snapshot on every use and may
 * register a {@link ConfigChangeSignal} to be woken up whenever it is replaced.
 */
@Slf4j
@Service
public class ConfigService {

    private final Validator validator;
    private final Set<ConfigChangeSignal> signals = new CopyOnWriteArraySet<>();

    private volatile ArchiverProperties config;
    private volatile Map<String, Map<String, Pattern>> compiledRules;

    public ConfigService(ArchiverProperties initial, Validator validator) {
        this.validator = validator;
        this.compiledRules = validate(initial);
        this.config = initial;
        log.info("Loaded configuration with {} monitored channel(s)", initial.getChannels().size());
    }

    public ArchiverProperties getConfig() {
        return config;
    }

    public List<ChannelMonitorConfig> getChannels() {
        return config.getChannels();
    }

    /**
     * Compiled rules for a channel, keyed by rule name in declaration order.
     */
    public Map<String, Pattern> getRules(String channelId) {
        return compiledRules.getOrDefault(channelId, Collections.emptyMap());
    }

    /**
     * Replaces the configuration after validating it, then sets every registered signal.
     *
     * @throws IllegalArgumentException if the replacement is invalid; the current one is kept
     */
    public void update(ArchiverProperties replacement) {
        Map<String, Map<String, Pattern>> rules = validate(replacement);
        synchronized (this) {
            this.config = replacement;
            this.compiledRules = rules;
        }
        log.info("Updated configuration; {} monitored channel(s)", replacement.getChannels().size());
        signals.forEach(ConfigChangeSignal::set);
    }

    /**
     * Returns a signal that is set now and again after every configuration change.
     */
    public ConfigChangeSignal newChangeSignal() {
        ConfigChangeSignal signal = new ConfigChangeSignal();
        signals.add(signal);
        return signal;
    }

    public void releaseChangeSignal(ConfigChangeSignal signal) {
        signals.remove(signal);
    }

    private Map<String, Map<String, Pattern>> validate(ArchiverProperties candidate) {
        Set<ConstraintViolation<ArchiverProperties>> violations = validator.validate(candidate);
        if (!violations.isEmpty()) {
            String msg = violations.stream()
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid configuration: " + msg);
        }

        int resolution = candidate.getDownloader().getMaxVideoResolution();
        if (!ArchiverProperties.VALID_RESOLUTIONS.contains(resolution)) {
            throw new IllegalArgumentException("Invalid resolution preset " + resolution + " (expected one of "
                    + ArchiverProperties.VALID_RESOLUTIONS.stream().sorted().map(String::valueOf)
                    .collect(Collectors.joining(", ")) + ")");
        }

        Set<String> seen = new HashSet<>();
        Set<String> duplicates = candidate.getChannels().stream()
                .map(ChannelMonitorConfig::getId)
                .filter(id -> !seen.add(id))
                .collect(Collectors.toCollection(TreeSet::new));
        if (!duplicates.isEmpty()) {
            throw new IllegalArgumentException("Duplicate channels in config: " + duplicates);
        }

        Map<String, Map<String, Pattern>> rules = new LinkedHashMap<>();
        for (ChannelMonitorConfig channel : candidate.getChannels()) {
            Map<String, Pattern> channelRules = new LinkedHashMap<>();
            channel.getTerms().forEach((name, regex) -> {
                try {
                    channelRules.put(name, Pattern.compile(regex));
                } catch (PatternSyntaxException e) {
                    throw new IllegalArgumentException("Invalid pattern for term '" + name
                            + "' in channel " + channel.getId() + ": " + e.getDescription(), e);
                }
            });
            if (channelRules.isEmpty()) {
                log.warn("Channel {} has no terms configured; nothing will be scheduled from it", channel.getId());
            }
            rules.put(channel.getId(), Collections.unmodifiableMap(channelRules));
        }
        return rules;
    }
}
