package org.nowstart.tidepy.service.risk;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.nowstart.tidepy.data.model.MarketQuote;
import org.nowstart.tidepy.data.model.MarketSnapshot;

class MarkPriceBookTest {

    @Test
    void update_keepsLastPositivePrice() {
        MarkPriceBook book = new MarkPriceBook();
        book.update("DOGEUSDT", new BigDecimal("0.2"));

        book.update(new MarketSnapshot(Instant.parse("2026-01-05T00:00:00Z"), Map.of(
                "DOGEUSDT", new MarketQuote("DOGEUSDT", BigDecimal.ZERO, null, null, null, List.of()),
                "WIFUSDT", new MarketQuote("WIFUSDT", new BigDecimal("1.8"), null, null, null, List.of())
        )));
        book.update("ARBUSDT", null);

        assertThat(book.price("DOGEUSDT")).contains(new BigDecimal("0.2"));
        assertThat(book.price("WIFUSDT")).contains(new BigDecimal("1.8"));
        assertThat(book.price("ARBUSDT")).isEmpty();
    }
}
