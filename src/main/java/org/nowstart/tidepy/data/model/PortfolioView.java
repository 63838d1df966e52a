package org.nowstart.tidepy.data.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable copy of the book handed to the sizer and the dashboard.
 */
public record PortfolioView(
        BigDecimal equity,
        BigDecimal entryNotionalCap,
        BigDecimal maxNotionalCap,
        BigDecimal aggregateNotional,
        BigDecimal portfolioCeiling,
        Map<String, PositionState> positions,
        Set<String> inflightAssets
) {

    public PortfolioView {
        positions = Collections.unmodifiableMap(new TreeMap<>(positions));
        inflightAssets = Set.copyOf(inflightAssets);
    }

    public BigDecimal currentNotional(String asset) {
        PositionState state = positions.get(asset);
        return state == null ? BigDecimal.ZERO : state.currentNotional();
    }
}
