package org.nowstart.tidepy.data.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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
import org.nowstart.tidepy.data.type.TrackTag;

@Entity
@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "factor_record_entry", indexes = @Index(name = "idx_factor_cycle", columnList = "cycleTimestamp"))
public class FactorRecordEntry extends AuditableEntity {

    @Id
    private UUID id;

    private Instant cycleTimestamp;

    private String asset;

    @Column(precision = 38, scale = 12)
    private BigDecimal fundingRate;

    private int liquidityTier;

    private double pumpScore;

    @Enumerated(EnumType.STRING)
    private TrackTag trackTag;

    @Column(precision = 38, scale = 12)
    private BigDecimal unlockProgressRatio;
}
