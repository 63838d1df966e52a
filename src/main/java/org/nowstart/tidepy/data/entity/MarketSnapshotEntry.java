package org.nowstart.tidepy.data.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Entity
@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "market_snapshot_entry", indexes = @Index(name = "idx_snapshot_cycle", columnList = "cycleTimestamp"))
public class MarketSnapshotEntry extends AuditableEntity {

    @Id
    private UUID id;

    private Instant cycleTimestamp;

    private String asset;

    @Column(precision = 38, scale = 12)
    private BigDecimal price;

    @Column(precision = 38, scale = 12)
    private BigDecimal fundingRate;

    @Column(precision = 38, scale = 12)
    private BigDecimal volume24h;

    @Column(precision = 38, scale = 12)
    private BigDecimal marketCap;
}
