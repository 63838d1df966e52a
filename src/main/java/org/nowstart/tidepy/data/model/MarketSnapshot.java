package org.nowstart.tidepy.data.model;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

public record MarketSnapshot(Instant timestamp, Map<String, MarketQuote> quotes) {

    public MarketSnapshot {
        if (timestamp == null) {
            throw new IllegalArgumentException("snapshot timestamp is required");
        }
        quotes = quotes == null
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(quotes));
    }

    public Optional<MarketQuote> quote(String asset) {
        return Optional.ofNullable(quotes.get(asset));
    }
}
