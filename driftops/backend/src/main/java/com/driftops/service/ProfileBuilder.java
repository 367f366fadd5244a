package com.driftops.service;

import com.driftops.model.DataProfile;
import com.driftops.model.FeatureConfig;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds {@link DataProfile}s under one fixed {@link FeatureConfig}.
 */
public class ProfileBuilder {

    private final FeatureConfig config;
    private final Pattern tokenPattern;
    private final String fingerprint;
    private final Clock clock;

    public ProfileBuilder(FeatureConfig config, Clock clock) {
        this.config = config;
        this.tokenPattern = Pattern.compile(config.tokenPattern());
        this.fingerprint = config.fingerprint();
        this.clock = clock;
    }

    public FeatureConfig config() {
        return config;
    }

    public DataProfile build(Collection<String> messages) {
        Map<String, Long> counts = new HashMap<>();
        int messageCount = 0;

        for (String message : messages) {
            if (message == null) {
                continue;
            }
            messageCount++;
            Matcher matcher = tokenPattern.matcher(config.lowercase() ? message.toLowerCase(Locale.ROOT) : message);
            while (matcher.find()) {
                String token = matcher.group();
                if (token.length() < config.minTokenLength() || config.stopwords().contains(token)) {
                    continue;
                }
                counts.merge(token, 1L, Long::sum);
            }
        }

        // top-K by count, ties alphabetical so the same corpus always yields the same profile
        Map<String, Long> retained = new LinkedHashMap<>();
        counts.entrySet().stream()
            .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()))
            .limit(config.maxVocabularySize())
            .forEach(e -> retained.put(e.getKey(), e.getValue()));

        return new DataProfile(messageCount, retained, fingerprint, Instant.now(clock));
    }
}
