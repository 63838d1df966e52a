package org.nowstart.tidepy.data.property;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.nowstart.tidepy.data.type.TrackTag;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Static per-asset metadata the exchange does not publish: sector track, token unlock progress and
 * circulating supply. The entries also define the tradable universe.
 */
@Validated
@ConfigurationProperties(prefix = "tidepy.assets")
public record AssetCatalogProperties(
        @Valid @NotNull @DefaultValue List<AssetProfile> entries
) {

    public Optional<AssetProfile> find(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        String normalized = symbol.trim().toUpperCase(Locale.ROOT);
        return entries.stream()
                .filter(entry -> entry.symbol().equalsIgnoreCase(normalized))
                .findFirst();
    }

    public List<String> symbols() {
        return entries.stream()
                .map(entry -> entry.symbol().trim().toUpperCase(Locale.ROOT))
                .distinct()
                .sorted()
                .toList();
    }

    public record AssetProfile(
            @NotBlank String symbol,
            @DefaultValue("OTHER") TrackTag track,
            // 0..1, share of total supply already unlocked
            BigDecimal unlockProgress,
            BigDecimal circulatingSupply
    ) {
    }
}
