package org.nowstart.tidepy.data.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.nowstart.tidepy.data.type.CycleStatus;

@Entity
@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "cycle_summary_entry")
public class CycleSummaryEntry extends AuditableEntity {

    @Id
    private UUID id;

    private Instant cycleTimestamp;

    @Enumerated(EnumType.STRING)
    private CycleStatus status;

    // CycleSummary serialized as JSON
    @Column(length = 65535)
    private String payload;
}
