package org.nowstart.tidepy.service.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tidepy.data.entity.CycleSummaryEntry;
import org.nowstart.tidepy.data.entity.FactorRecordEntry;
import org.nowstart.tidepy.data.entity.MarketSnapshotEntry;
import org.nowstart.tidepy.data.entity.OrderEventEntry;
import org.nowstart.tidepy.data.entity.SignalEntry;
import org.nowstart.tidepy.data.model.CycleSummary;
import org.nowstart.tidepy.data.model.FactorRecord;
import org.nowstart.tidepy.data.model.MarketSnapshot;
import org.nowstart.tidepy.data.model.Order;
import org.nowstart.tidepy.data.model.Signal;
import org.nowstart.tidepy.data.property.TradingProperties;
import org.nowstart.tidepy.repository.CycleSummaryEntryRepository;
import org.nowstart.tidepy.repository.FactorRecordEntryRepository;
import org.nowstart.tidepy.repository.MarketSnapshotEntryRepository;
import org.nowstart.tidepy.repository.OrderEventEntryRepository;
import org.nowstart.tidepy.repository.SignalEntryRepository;
import org.springframework.stereotype.Service;

/**
 * Append-only sink for everything a cycle produces. A failed write is logged and dropped; storage is never
 * allowed to abort a cycle or block an order from settling.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StrategyStorageService {

    private final MarketSnapshotEntryRepository marketSnapshotEntryRepository;
    private final FactorRecordEntryRepository factorRecordEntryRepository;
    private final SignalEntryRepository signalEntryRepository;
    private final OrderEventEntryRepository orderEventEntryRepository;
    private final CycleSummaryEntryRepository cycleSummaryEntryRepository;
    private final TradingProperties tradingProperties;
    private final ObjectMapper objectMapper;

    public void appendSnapshot(MarketSnapshot snapshot) {
        List<MarketSnapshotEntry> entries = snapshot.quotes().values().stream()
                .map(quote -> MarketSnapshotEntry.builder()
                        .id(UUID.randomUUID())
                        .cycleTimestamp(snapshot.timestamp())
                        .asset(quote.symbol())
                        .price(quote.price())
                        .fundingRate(quote.fundingRate())
                        .volume24h(quote.volume24h())
                        .marketCap(quote.marketCap())
                        .build())
                .toList();
        saveQuietly("market_snapshot", snapshot.timestamp(), () -> marketSnapshotEntryRepository.saveAll(entries));
    }

    public void appendFactors(Instant cycleTimestamp, List<FactorRecord> records) {
        if (!tradingProperties.factor().persistFactors() || records.isEmpty()) {
            return;
        }
        List<FactorRecordEntry> entries = records.stream()
                .map(record -> FactorRecordEntry.builder()
                        .id(UUID.randomUUID())
                        .cycleTimestamp(record.cycleTimestamp())
                        .asset(record.asset())
                        .fundingRate(record.fundingRate())
                        .liquidityTier(record.liquidityTier())
                        .pumpScore(record.pumpScore())
                        .trackTag(record.trackTag())
                        .unlockProgressRatio(record.unlockProgressRatio())
                        .build())
                .toList();
        saveQuietly("factor_record", cycleTimestamp, () -> factorRecordEntryRepository.saveAll(entries));
    }

    public void appendSignals(Instant cycleTimestamp, List<Signal> signals) {
        if (signals.isEmpty()) {
            return;
        }
        List<SignalEntry> entries = new ArrayList<>();
        for (int i = 0; i < signals.size(); i++) {
            Signal signal = signals.get(i);
            entries.add(SignalEntry.builder()
                    .id(UUID.randomUUID())
                    .cycleTimestamp(signal.cycleTimestamp())
                    .asset(signal.asset())
                    .direction(signal.direction())
                    .strengthScore(signal.strengthScore())
                    .rankPosition(i + 1)
                    .build());
        }
        saveQuietly("signal", cycleTimestamp, () -> signalEntryRepository.saveAll(entries));
    }

    public void appendOrderEvent(Order order) {
        OrderEventEntry entry = OrderEventEntry.builder()
                .orderId(order.getId())
                .asset(order.getAsset())
                .exchangeOrderId(order.getExchangeOrderId())
                .side(order.getSide())
                .reason(order.getReason())
                .mode(tradingProperties.executionMode())
                .status(order.getStatus())
                .requestedNotional(order.getRequestedNotional())
                .filledNotional(order.getFilledNotional())
                .filledQuantity(order.getFilledQuantity())
                .avgFillPrice(order.getAvgFillPrice())
                .attempts(order.getAttempts())
                .failureCategory(order.getFailureCategory())
                .failure(truncate(order.getFailure(), 1024))
                .createdAt(order.getCreatedAt())
                .settledAt(order.getUpdatedAt())
                .build();
        saveQuietly("order_event", order.getUpdatedAt(), () -> orderEventEntryRepository.save(entry));
    }

    public void appendCycleSummary(CycleSummary summary) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(summary);
        } catch (JsonProcessingException e) {
            log.warn("event=storage_append_failed kind=cycle_summary cycle_ts={}", summary.cycleTimestamp(), e);
            return;
        }

        CycleSummaryEntry entry = CycleSummaryEntry.builder()
                .id(UUID.randomUUID())
                .cycleTimestamp(summary.cycleTimestamp())
                .status(summary.status())
                .payload(payload)
                .build();
        saveQuietly("cycle_summary", summary.cycleTimestamp(), () -> cycleSummaryEntryRepository.save(entry));
    }

    public List<SignalEntry> findSignals(Instant cycleTimestamp) {
        return signalEntryRepository.findByCycleTimestampOrderByRankPositionAsc(cycleTimestamp);
    }

    public List<FactorRecordEntry> findFactors(Instant cycleTimestamp) {
        return factorRecordEntryRepository.findByCycleTimestampOrderByAssetAsc(cycleTimestamp);
    }

    public List<MarketSnapshotEntry> findSnapshot(Instant cycleTimestamp) {
        return marketSnapshotEntryRepository.findByCycleTimestampOrderByAssetAsc(cycleTimestamp);
    }

    public Optional<CycleSummary> findCycleSummary(Instant cycleTimestamp) {
        return cycleSummaryEntryRepository.findFirstByCycleTimestamp(cycleTimestamp)
                .flatMap(this::readSummary);
    }

    public List<OrderEventEntry> findRecentOrderEvents() {
        return orderEventEntryRepository.findTop50ByOrderBySettledAtDesc();
    }

    private Optional<CycleSummary> readSummary(CycleSummaryEntry entry) {
        try {
            return Optional.of(objectMapper.readValue(entry.getPayload(), CycleSummary.class));
        } catch (JsonProcessingException e) {
            log.warn("event=storage_read_failed kind=cycle_summary cycle_ts={}", entry.getCycleTimestamp(), e);
            return Optional.empty();
        }
    }

    private void saveQuietly(String kind, Instant cycleTimestamp, Runnable write) {
        try {
            write.run();
        } catch (RuntimeException e) {
            log.warn("event=storage_append_failed kind={} cycle_ts={}", kind, cycleTimestamp, e);
        }
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
