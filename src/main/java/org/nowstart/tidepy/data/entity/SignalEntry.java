package org.nowstart.tidepy.data.entity;

import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.nowstart.tidepy.data.type.SignalDirection;

@Entity
@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "signal_entry", indexes = @Index(name = "idx_signal_cycle", columnList = "cycleTimestamp"))
public class SignalEntry extends AuditableEntity {

    @Id
    private UUID id;

    private Instant cycleTimestamp;

    private String asset;

    @Enumerated(EnumType.STRING)
    private SignalDirection direction;

    private double strengthScore;

    // 1-based position in the cycle's ranking
    private int rankPosition;
}
